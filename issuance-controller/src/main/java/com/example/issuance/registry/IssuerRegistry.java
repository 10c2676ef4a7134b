package com.example.issuance.registry;

import com.example.issuance.clock.BlockClock;
import com.example.issuance.error.IssuanceError;
import com.example.issuance.error.IssuanceException;
import com.example.issuance.event.IssuerEvent;
import com.example.issuance.event.IssuerEventLog;
import com.example.issuance.model.Address;
import com.example.issuance.model.IssuancePolicy;
import com.example.issuance.model.IssuerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns the set of authorized issuers: authorization, deauthorization, expiry sweeps and
 * transfer of an authorization to a new identity.
 * <p>
 * Operations run all guards before touching {@link RegistryState}, so a rejected call
 * leaves the registry unchanged. Callers are expected to serialize access.
 */
@Component
public class IssuerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(IssuerRegistry.class);

    private final RegistryState state;
    private final CooldownTracker cooldownTracker;
    private final IssuerGuards guards;
    private final BlockClock clock;
    private final IssuancePolicy policy;
    private final IssuerEventLog eventLog;

    public IssuerRegistry(RegistryState state, CooldownTracker cooldownTracker, IssuerGuards guards,
                          BlockClock clock, IssuancePolicy policy, IssuerEventLog eventLog) {
        this.state = state;
        this.cooldownTracker = cooldownTracker;
        this.guards = guards;
        this.clock = clock;
        this.policy = policy;
        this.eventLog = eventLog;
    }

    public IssuerRecord authorize(Address identity) {
        long now = clock.currentBlock();

        guards.requireExternalIdentity(identity, IssuanceError.INVALID_TARGET);
        guards.requireNotMember(identity);
        guards.requireCapacity();
        guards.requireNoCooldown(identity, now);

        if (now > Long.MAX_VALUE - policy.termLengthBlocks()) {
            throw new ArithmeticException("Expiration of a term starting at block " + now + " overflows");
        }
        long expirationBlock = now + policy.termLengthBlocks();
        IssuerRecord record = state.append(identity, now, expirationBlock);
        cooldownTracker.clear(identity);

        logger.info("Authorized issuer {} at position {}, expires at block {}",
                identity, record.getPosition(), expirationBlock);
        eventLog.append(new IssuerEvent.IssuerAuthorized(now, identity, expirationBlock));
        return record.copy();
    }

    /**
     * Removes an issuer. Anyone may remove an expired issuer; only the issuer itself may
     * leave before expiration.
     */
    public void deauthorize(Address identity, Address caller) {
        long now = clock.currentBlock();

        IssuerRecord record = guards.requireMember(identity);
        boolean voluntary = identity.equals(caller);
        if (!voluntary && !record.isExpiredAt(now)) {
            throw new IssuanceException(IssuanceError.TERM_NOT_EXPIRED,
                    "Issuer " + identity + " term runs until block " + record.getExpirationBlock());
        }

        removeIssuer(identity, record, caller, voluntary, now);
    }

    /**
     * Removes every expired issuer.
     *
     * @return the removed identities, in removal order
     */
    public List<Address> deauthorizeAllExpired(Address caller) {
        long now = clock.currentBlock();
        List<Address> removed = new ArrayList<>();

        // Back to front: a swap-removal only moves an already visited element into the freed slot.
        for (int i = state.size() - 1; i >= 0; i--) {
            Address identity = state.issuerAt(i);
            IssuerRecord record = state.record(identity);
            if (record.isExpiredAt(now)) {
                removeIssuer(identity, record, caller, identity.equals(caller), now);
                removed.add(identity);
            }
        }

        if (!removed.isEmpty()) {
            logger.info("Expiry sweep at block {} removed {} issuer(s), {} remaining",
                    now, removed.size(), state.totalIssuers());
        }
        return removed;
    }

    /**
     * Hands {@code from}'s authorization, record and list slot to {@code to}.
     *
     * @return the list position the authorization occupies
     */
    public int transferAuthorization(Address from, Address to) {
        long now = clock.currentBlock();

        IssuerRecord record = guards.requireActiveIssuer(from, now);
        guards.requireNotMember(to);
        guards.requireExternalIdentity(to, IssuanceError.INVALID_TARGET);
        guards.requireNoCooldown(to, now);

        cooldownTracker.applyExitRule(from, record, true, now);
        IssuerRecord migrated = state.replace(from, to);

        logger.info("Transferred issuer authorization {} -> {} at position {}", from, to, migrated.getPosition());
        eventLog.append(new IssuerEvent.IssuerAuthorizationTransferred(now, from, to, migrated.getPosition()));
        return migrated.getPosition();
    }

    public List<Address> getIssuers() {
        return state.issuers();
    }

    /**
     * Snapshot of issuers whose term has ended, sized by a counting pass before filling.
     */
    public List<Address> getExpiredIssuers() {
        long now = clock.currentBlock();
        int size = state.size();

        int count = 0;
        for (int i = 0; i < size; i++) {
            if (state.record(state.issuerAt(i)).isExpiredAt(now)) {
                count++;
            }
        }

        Address[] expired = new Address[count];
        int filled = 0;
        for (int i = 0; i < size && filled < count; i++) {
            Address identity = state.issuerAt(i);
            if (state.record(identity).isExpiredAt(now)) {
                expired[filled++] = identity;
            }
        }
        return List.of(expired);
    }

    public boolean isIssuer(Address identity) {
        return state.isMember(identity);
    }

    public IssuerRecord getIssuerRecord(Address identity) {
        return guards.requireMember(identity).copy();
    }

    public long cooldownUntil(Address identity) {
        return cooldownTracker.cooldownUntil(identity);
    }

    public int totalIssuers() {
        return state.totalIssuers();
    }

    private void removeIssuer(Address identity, IssuerRecord record, Address caller, boolean voluntary, long now) {
        cooldownTracker.applyExitRule(identity, record, voluntary, now);
        state.remove(identity);

        logger.info("Deauthorized issuer {} (caller {}) at block {}", identity, caller, now);
        eventLog.append(new IssuerEvent.IssuerDeauthorized(now, identity, caller));
    }
}
