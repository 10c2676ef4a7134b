package com.example.issuance.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.example.issuance.support.IssuanceFixture.CONTROLLER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssuancePolicyTest {

    @Test
    void termLengthIsBounded() {
        assertThatThrownBy(() -> policyWithTerm(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policyWithTerm(IssuancePolicy.MAX_TERM_LENGTH_BLOCKS + 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("termLengthBlocks");
        assertThatThrownBy(() -> policyWithTerm(Long.MAX_VALUE)).isInstanceOf(IllegalArgumentException.class);

        assertThat(policyWithTerm(IssuancePolicy.MAX_TERM_LENGTH_BLOCKS).termLengthBlocks())
                .isEqualTo(IssuancePolicy.MAX_TERM_LENGTH_BLOCKS);
    }

    private static IssuancePolicy policyWithTerm(long term) {
        return new IssuancePolicy(CONTROLLER, 3, term, 95, 1000, 100, 200, BigInteger.valueOf(1_000_000));
    }
}
