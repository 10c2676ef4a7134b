package com.example.issuance.service;

import com.example.issuance.model.IssuerRecord;
import com.example.issuance.support.IssuanceFixture;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class MintFactorCalculatorTest {

    private final MintFactorCalculator calculator = new MintFactorCalculator(IssuanceFixture.policy(3));

    @Test
    void zeroSupplyReturnsBaseFactor() {
        IssuerRecord heavyMinter = history(1_000_000, 1, 0, 0);

        assertThat(calculator.mintFactor(heavyMinter, BigInteger.ZERO)).isEqualTo(1000);
    }

    @Test
    void freshIssuerIsCappedAtBaseFactor() {
        assertThat(calculator.mintFactor(history(0, 0, 0, 0), BigInteger.valueOf(1_000_000))).isEqualTo(1000);
    }

    @Test
    void averageMintShareReducesFactor() {
        long factor = calculator.mintFactor(history(100_000, 1, 0, 0), BigInteger.valueOf(1_100_000));

        assertThat(factor).isEqualTo(91);
        assertThat(calculator.maxMintable(factor, BigInteger.valueOf(1_100_000))).isEqualTo(BigInteger.valueOf(10_010));
    }

    @Test
    void mintingAtOrAboveBaseRateLeavesNoHeadroom() {
        assertThat(calculator.mintFactor(history(200_000, 1, 0, 0), BigInteger.valueOf(1_000_000))).isZero();
    }

    @Test
    void burnHeavyIssuerRegainsHeadroom() {
        IssuerRecord burner = history(200_000, 1, 300_000, 1);

        assertThat(calculator.mintFactor(burner, BigInteger.valueOf(1_000_000))).isEqualTo(200);
    }

    @Test
    void lowMinterGetsThresholdBonus() {
        assertThat(calculator.mintFactor(history(15_000, 1, 0, 0), BigInteger.valueOf(1_000_000))).isEqualTo(950);
    }

    @Test
    void averagesTruncateTowardZero() {
        // avgMint = 3 / 2 = 1, so the share is 1 * 10000 / 30 = 333
        assertThat(calculator.mintFactor(history(3, 2, 0, 0), BigInteger.valueOf(30))).isEqualTo(667);
    }

    @Test
    void withinFactorComparesScaledAmounts() {
        BigInteger supply = BigInteger.valueOf(1_000_000);

        assertThat(calculator.withinFactor(BigInteger.valueOf(100_000), 1000, supply)).isTrue();
        assertThat(calculator.withinFactor(BigInteger.valueOf(100_001), 1000, supply)).isFalse();
        assertThat(calculator.withinFactor(BigInteger.ONE, 0, supply)).isFalse();
    }

    @Test
    void factorStaysWithinZeroAndBaseForArbitraryHistories() {
        Random random = new Random(7);
        for (int i = 0; i < 10_000; i++) {
            long mintCount = random.nextInt(50);
            long burnCount = random.nextInt(50);
            BigInteger minted = mintCount == 0 ? BigInteger.ZERO : new BigInteger(80, random);
            BigInteger burned = burnCount == 0 ? BigInteger.ZERO : new BigInteger(80, random);
            BigInteger supply = new BigInteger(1 + random.nextInt(90), random);

            long factor = calculator.mintFactor(new IssuerRecord(0, 0, 100, minted, mintCount, burned, burnCount), supply);

            assertThat(factor).isBetween(0L, 1000L);
        }
    }

    private static IssuerRecord history(long minted, long mintCount, long burned, long burnCount) {
        return new IssuerRecord(0, 0, 100,
                BigInteger.valueOf(minted), mintCount, BigInteger.valueOf(burned), burnCount);
    }
}
