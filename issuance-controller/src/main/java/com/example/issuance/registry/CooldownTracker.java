package com.example.issuance.registry;

import com.example.issuance.model.Address;
import com.example.issuance.model.IssuancePolicy;
import com.example.issuance.model.IssuerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks the reactivation delay of identities that left their term early.
 */
@Component
public class CooldownTracker {

    private static final Logger logger = LoggerFactory.getLogger(CooldownTracker.class);

    private final RegistryState state;
    private final IssuancePolicy policy;

    public CooldownTracker(RegistryState state, IssuancePolicy policy) {
        this.state = state;
        this.policy = policy;
    }

    /**
     * @return the block before which the identity may not be authorized, or 0 if none
     */
    public long cooldownUntil(Address identity) {
        return state.cooldowns().getOrDefault(identity, 0L);
    }

    public boolean isCoolingDown(Address identity, long now) {
        return cooldownUntil(identity) > now;
    }

    /**
     * True while less than the threshold share of the record's term has been served.
     */
    public boolean isEarlyExit(IssuerRecord record, long now) {
        long served = now - record.getStartBlock();
        long term = record.getExpirationBlock() - record.getStartBlock();
        if (served >= term) {
            return false;
        }
        // served < term <= MAX_TERM_LENGTH_BLOCKS, so neither product overflows
        return served * 100L < term * policy.earlyExitThresholdPercent();
    }

    /**
     * Starts a cooldown lasting until the record's natural expiration when a voluntary exit
     * happens early. Exits forced by a third party never start one.
     */
    public void applyExitRule(Address identity, IssuerRecord record, boolean voluntary, long now) {
        if (voluntary && isEarlyExit(record, now)) {
            state.cooldowns().put(identity, record.getExpirationBlock());
            logger.info("Cooldown started for {} until block {}", identity, record.getExpirationBlock());
        }
    }

    public void clear(Address identity) {
        state.cooldowns().remove(identity);
    }
}
