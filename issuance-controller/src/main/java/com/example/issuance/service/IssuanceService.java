package com.example.issuance.service;

import com.example.issuance.clock.BlockClock;
import com.example.issuance.error.IssuanceError;
import com.example.issuance.error.IssuanceException;
import com.example.issuance.event.IssuerEvent;
import com.example.issuance.event.IssuerEventLog;
import com.example.issuance.ledger.TokenLedger;
import com.example.issuance.model.Address;
import com.example.issuance.model.IssuancePolicy;
import com.example.issuance.model.IssuerRecord;
import com.example.issuance.model.MintReceipt;
import com.example.issuance.registry.IssuerGuards;
import com.example.issuance.registry.IssuerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for every issuer and issuance operation.
 * <p>
 * Calls are serialized by a single lock and each one runs inside one ledger transaction.
 * Guards run first and the ledger call precedes any registry mutation, so a failure at any
 * step leaves neither the registry nor the ledger changed.
 */
@Service
public class IssuanceService {

    private static final Logger logger = LoggerFactory.getLogger(IssuanceService.class);

    private final ReentrantLock lock = new ReentrantLock(true);

    private final IssuerRegistry registry;
    private final IssuerGuards guards;
    private final MintFactorCalculator mintFactorCalculator;
    private final TokenLedger ledger;
    private final BlockClock clock;
    private final IssuerEventLog eventLog;
    private final IssuancePolicy policy;
    private final TransactionOperations transactions;

    public IssuanceService(IssuerRegistry registry, IssuerGuards guards, MintFactorCalculator mintFactorCalculator,
                           TokenLedger ledger, BlockClock clock, IssuerEventLog eventLog,
                           IssuancePolicy policy, TransactionOperations transactions) {
        this.registry = registry;
        this.guards = guards;
        this.mintFactorCalculator = mintFactorCalculator;
        this.ledger = ledger;
        this.clock = clock;
        this.eventLog = eventLog;
        this.policy = policy;
        this.transactions = transactions;
    }

    public IssuerRecord authorizeIssuer(Address identity) {
        return serialized(() -> registry.authorize(identity));
    }

    public void deauthorizeIssuer(Address identity, Address caller) {
        serialized(() -> {
            registry.deauthorize(identity, caller);
            return null;
        });
    }

    public List<Address> deauthorizeAllExpiredIssuers(Address caller) {
        return serialized(() -> registry.deauthorizeAllExpired(caller));
    }

    /**
     * Moves the caller's authorization to {@code newIdentity}.
     *
     * @return the list position now held by {@code newIdentity}
     */
    public int transferIssuerAuthorization(Address newIdentity, Address caller) {
        return serialized(() -> registry.transferAuthorization(caller, newIdentity));
    }

    /**
     * Mints to {@code to}. With zero supply the requested amount is ignored and exactly the
     * supply floor is minted; otherwise the request must fit the caller's mint factor and any
     * shortfall to the supply floor is added on top.
     */
    public MintReceipt mint(Address to, BigInteger requestedAmount, Address caller) {
        return serialized(() -> {
            long now = clock.currentBlock();
            IssuerRecord record = guards.requireActiveIssuer(caller, now);
            guards.requireExternalIdentity(to, IssuanceError.INVALID_RECEIVER);

            BigInteger supply = ledger.totalSupply();
            BigInteger amount;
            BigInteger topUp;
            if (supply.signum() == 0) {
                amount = policy.supplyFloor();
                topUp = policy.supplyFloor();
                logger.info("Bootstrap mint of {} by {} (requested {} ignored)", amount, caller, requestedAmount);
            } else {
                if (requestedAmount == null || requestedAmount.signum() <= 0) {
                    throw new IssuanceException(IssuanceError.INVALID_AMOUNT,
                            "Mint amount must be positive: " + requestedAmount);
                }
                long factor = mintFactorCalculator.mintFactor(record, supply);
                if (!mintFactorCalculator.withinFactor(requestedAmount, factor, supply)) {
                    throw new IssuanceException(IssuanceError.EXCEEDS_MINT_FACTOR,
                            "Requested " + requestedAmount + " exceeds max mintable "
                                    + mintFactorCalculator.maxMintable(factor, supply) + " for " + caller);
                }
                topUp = policy.supplyFloor().subtract(supply.add(requestedAmount)).max(BigInteger.ZERO);
                amount = requestedAmount.add(topUp);
            }

            ledger.mint(to, amount);
            record.recordMint(amount);

            logger.info("Issuer {} minted {} to {} (top-up {}), mint count {}",
                    caller, amount, to, topUp, record.getMintCount());
            eventLog.append(new IssuerEvent.IssuerActivity(now, caller, amount, BigInteger.ZERO,
                    record.getTotalMinted(), record.getTotalBurned()));
            return new MintReceipt(to, amount, topUp, supply.add(amount));
        });
    }

    public void burn(BigInteger amount, Address caller) {
        serialized(() -> {
            long now = clock.currentBlock();
            IssuerRecord record = guards.requireActiveIssuer(caller, now);
            requireNonNegative(amount);

            ledger.burn(caller, amount);
            recordBurn(caller, record, amount, now);
            return null;
        });
    }

    public void burnFrom(Address account, BigInteger amount, Address caller) {
        serialized(() -> {
            long now = clock.currentBlock();
            IssuerRecord record = guards.requireActiveIssuer(caller, now);
            requireNonNegative(amount);

            ledger.spendAllowance(account, caller, amount);
            ledger.burn(account, amount);
            recordBurn(caller, record, amount, now);
            return null;
        });
    }

    /**
     * Sets the allowance {@code spender} may burn from {@code owner}'s balance.
     */
    public BigInteger approve(Address owner, Address spender, BigInteger amount) {
        return serialized(() -> {
            if (amount == null || amount.signum() < 0) {
                throw new IssuanceException(IssuanceError.INVALID_AMOUNT,
                        "Allowance must not be negative: " + amount);
            }
            ledger.approve(owner, spender, amount);
            return ledger.allowance(owner, spender);
        });
    }

    public BigInteger getAllowance(Address owner, Address spender) {
        return serialized(() -> ledger.allowance(owner, spender));
    }

    public List<Address> getIssuers() {
        return serialized(registry::getIssuers);
    }

    public List<Address> getExpiredIssuers() {
        return serialized(registry::getExpiredIssuers);
    }

    public IssuerRecord getIssuerRecord(Address identity) {
        return serialized(() -> registry.getIssuerRecord(identity));
    }

    public long getIssuerMintFactor(Address identity) {
        return serialized(() -> {
            IssuerRecord record = guards.requireMember(identity);
            long factor = mintFactorCalculator.mintFactor(record, ledger.totalSupply());
            logger.debug("Mint factor of {} is {}", identity, factor);
            return factor;
        });
    }

    /**
     * Largest amount {@code identity} may request right now; the supply floor while supply is zero.
     */
    public BigInteger getIssuerMaxMintable(Address identity) {
        return serialized(() -> {
            IssuerRecord record = guards.requireMember(identity);
            BigInteger supply = ledger.totalSupply();
            if (supply.signum() == 0) {
                return policy.supplyFloor();
            }
            return mintFactorCalculator.maxMintable(mintFactorCalculator.mintFactor(record, supply), supply);
        });
    }

    public long getIssuerCooldown(Address identity) {
        return serialized(() -> registry.cooldownUntil(identity));
    }

    private void recordBurn(Address caller, IssuerRecord record, BigInteger amount, long now) {
        record.recordBurn(amount);
        logger.info("Issuer {} burned {}, burn count {}", caller, amount, record.getBurnCount());
        eventLog.append(new IssuerEvent.IssuerActivity(now, caller, BigInteger.ZERO, amount,
                record.getTotalMinted(), record.getTotalBurned()));
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IssuanceException(IssuanceError.INVALID_AMOUNT, "Burn amount must not be negative: " + amount);
        }
    }

    private <T> T serialized(Supplier<T> operation) {
        lock.lock();
        try {
            return transactions.execute(status -> operation.get());
        } finally {
            lock.unlock();
        }
    }
}
