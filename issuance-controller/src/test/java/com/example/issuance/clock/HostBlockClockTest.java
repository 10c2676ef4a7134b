package com.example.issuance.clock;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HostBlockClockTest {

    private final HostBlockClock clock = new HostBlockClock();

    @Test
    void advanceRejectsOverflowAndKeepsBlock() {
        clock.advance(Long.MAX_VALUE - 10);

        assertThatThrownBy(() -> clock.advance(11))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overflows");
        assertThat(clock.currentBlock()).isEqualTo(Long.MAX_VALUE - 10);

        assertThat(clock.advance(10)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void advanceRejectsNegativeCount() {
        assertThatThrownBy(() -> clock.advance(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(clock.currentBlock()).isZero();
    }

    @Test
    void advanceToNeverMovesBackwards() {
        clock.advanceTo(50);
        clock.advanceTo(50);

        assertThatThrownBy(() -> clock.advanceTo(49))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("behind current block 50");
        assertThat(clock.currentBlock()).isEqualTo(50);
    }
}
