package com.example.issuance.service;

import com.example.issuance.model.IssuancePolicy;
import com.example.issuance.model.IssuerRecord;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Computes how much of the current supply one issuer may mint in a single call, as parts
 * of {@link IssuancePolicy#FACTOR_SCALE}.
 * <p>
 * Integer arithmetic only; every division truncates toward zero, so issuers get the floor
 * of their entitlement. The result is always within {@code 0..baseFactor}.
 */
@Component
public class MintFactorCalculator {

    private static final BigInteger SCALE = BigInteger.valueOf(IssuancePolicy.FACTOR_SCALE);

    private final BigInteger baseFactor;
    private final BigInteger burnBonus;
    private final BigInteger lowMintThreshold;

    public MintFactorCalculator(IssuancePolicy policy) {
        this.baseFactor = BigInteger.valueOf(policy.baseFactor());
        this.burnBonus = BigInteger.valueOf(policy.burnBonus());
        this.lowMintThreshold = BigInteger.valueOf(policy.lowMintThreshold());
    }

    public long mintFactor(IssuerRecord record, BigInteger currentSupply) {
        if (currentSupply.signum() == 0) {
            return baseFactor.longValueExact();
        }

        BigInteger avgMint = average(record.getTotalMinted(), record.getMintCount());
        BigInteger avgBurn = average(record.getTotalBurned(), record.getBurnCount());
        BigInteger avgPercentMint = avgMint.multiply(SCALE).divide(currentSupply);

        BigInteger adjustedBase = avgPercentMint.compareTo(baseFactor) >= 0
                ? BigInteger.ZERO
                : baseFactor.subtract(avgPercentMint);

        BigInteger burnOffset = BigInteger.ZERO;
        if (record.getTotalBurned().compareTo(record.getTotalMinted()) >= 0) {
            burnOffset = burnOffset.add(burnBonus);
        }
        if (avgBurn.compareTo(avgMint) >= 0) {
            burnOffset = burnOffset.add(burnBonus);
        }
        if (avgPercentMint.compareTo(lowMintThreshold) < 0) {
            burnOffset = burnOffset.add(burnBonus);
        }

        return adjustedBase.add(burnOffset).min(baseFactor).longValueExact();
    }

    /**
     * Largest single mint allowed for the given factor: {@code supply * factor / scale}.
     */
    public BigInteger maxMintable(long mintFactor, BigInteger currentSupply) {
        return currentSupply.multiply(BigInteger.valueOf(mintFactor)).divide(SCALE);
    }

    /**
     * True when {@code amount * scale <= supply * factor}.
     */
    public boolean withinFactor(BigInteger amount, long mintFactor, BigInteger currentSupply) {
        return amount.multiply(SCALE).compareTo(currentSupply.multiply(BigInteger.valueOf(mintFactor))) <= 0;
    }

    private static BigInteger average(BigInteger total, long count) {
        return count == 0 ? BigInteger.ZERO : total.divide(BigInteger.valueOf(count));
    }
}
