package com.example.issuance.registry;

import com.example.issuance.model.IssuancePolicy;
import com.example.issuance.model.IssuerRecord;
import com.example.issuance.support.IssuanceFixture;
import org.junit.jupiter.api.Test;

import static com.example.issuance.support.IssuanceFixture.address;
import static org.assertj.core.api.Assertions.assertThat;

class CooldownTrackerTest {

    private final RegistryState state = new RegistryState();
    private final CooldownTracker tracker = new CooldownTracker(state, IssuanceFixture.policy(3));

    @Test
    void earlyExitBoundaryIsNinetyFivePercentOfTerm() {
        IssuerRecord record = new IssuerRecord(0, 1000, 1100);

        assertThat(tracker.isEarlyExit(record, 1000)).isTrue();
        assertThat(tracker.isEarlyExit(record, 1094)).isTrue();
        assertThat(tracker.isEarlyExit(record, 1095)).isFalse();
        assertThat(tracker.isEarlyExit(record, 1200)).isFalse();
    }

    @Test
    void earlyExitRuleHoldsForLongTermsLateInTheBlockRange() {
        long term = IssuancePolicy.MAX_TERM_LENGTH_BLOCKS;
        long start = Long.MAX_VALUE - term;
        CooldownTracker longTermTracker = new CooldownTracker(state,
                new IssuancePolicy(IssuanceFixture.CONTROLLER, 3, term, 95, 1000, 100, 200, IssuanceFixture.SUPPLY_FLOOR));
        IssuerRecord record = new IssuerRecord(0, start, Long.MAX_VALUE);

        assertThat(longTermTracker.isEarlyExit(record, start + term / 2)).isTrue();
        assertThat(longTermTracker.isEarlyExit(record, Long.MAX_VALUE - 1)).isFalse();
        assertThat(longTermTracker.isEarlyExit(record, Long.MAX_VALUE)).isFalse();
    }

    @Test
    void forcedExitNeverStartsCooldown() {
        IssuerRecord record = new IssuerRecord(0, 0, 100);

        tracker.applyExitRule(address(1), record, false, 10);

        assertThat(tracker.cooldownUntil(address(1))).isZero();
        assertThat(tracker.isCoolingDown(address(1), 10)).isFalse();
    }

    @Test
    void cooldownLapsesAtExpirationBlock() {
        IssuerRecord record = new IssuerRecord(0, 0, 100);

        tracker.applyExitRule(address(1), record, true, 10);

        assertThat(tracker.cooldownUntil(address(1))).isEqualTo(100);
        assertThat(tracker.isCoolingDown(address(1), 99)).isTrue();
        assertThat(tracker.isCoolingDown(address(1), 100)).isFalse();

        tracker.clear(address(1));
        assertThat(tracker.cooldownUntil(address(1))).isZero();
    }
}
