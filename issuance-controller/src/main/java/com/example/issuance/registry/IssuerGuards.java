package com.example.issuance.registry;

import com.example.issuance.error.IssuanceError;
import com.example.issuance.error.IssuanceException;
import com.example.issuance.model.Address;
import com.example.issuance.model.IssuancePolicy;
import com.example.issuance.model.IssuerRecord;
import org.springframework.stereotype.Component;

/**
 * Eligibility checks shared by registry and issuance operations. Each check either passes
 * silently or throws an {@link IssuanceException}.
 */
@Component
public class IssuerGuards {

    private final RegistryState state;
    private final CooldownTracker cooldownTracker;
    private final IssuancePolicy policy;

    public IssuerGuards(RegistryState state, CooldownTracker cooldownTracker, IssuancePolicy policy) {
        this.state = state;
        this.cooldownTracker = cooldownTracker;
        this.policy = policy;
    }

    public IssuerRecord requireMember(Address identity) {
        IssuerRecord record = state.record(identity);
        if (record == null) {
            throw new IssuanceException(IssuanceError.NOT_AUTHORIZED, "Not an authorized issuer: " + identity);
        }
        return record;
    }

    /**
     * Member check followed by expiration check, in that order.
     */
    public IssuerRecord requireActiveIssuer(Address identity, long now) {
        IssuerRecord record = requireMember(identity);
        if (record.isExpiredAt(now)) {
            throw new IssuanceException(IssuanceError.TERM_EXPIRED,
                    "Issuer term expired at block " + record.getExpirationBlock() + ": " + identity);
        }
        return record;
    }

    public void requireNotMember(Address identity) {
        if (state.isMember(identity)) {
            throw new IssuanceException(IssuanceError.ALREADY_AUTHORIZED, "Already an authorized issuer: " + identity);
        }
    }

    public void requireCapacity() {
        if (state.totalIssuers() >= policy.maxIssuers()) {
            throw new IssuanceException(IssuanceError.CAP_REACHED,
                    "Issuer cap of " + policy.maxIssuers() + " reached");
        }
    }

    public void requireNoCooldown(Address identity, long now) {
        if (cooldownTracker.isCoolingDown(identity, now)) {
            throw new IssuanceException(IssuanceError.COOLDOWN_ACTIVE,
                    "Cooldown active for " + identity + " until block " + cooldownTracker.cooldownUntil(identity));
        }
    }

    /**
     * Rejects the null identity and the controller's own identity with the given error.
     */
    public void requireExternalIdentity(Address identity, IssuanceError error) {
        if (identity == null || identity.isZero()) {
            throw new IssuanceException(error, "Null identity is not a valid target");
        }
        if (identity.equals(policy.controllerAddress())) {
            throw new IssuanceException(error, "Controller identity is not a valid target");
        }
    }
}
