package com.example.issuance.model;

import java.math.BigInteger;

/**
 * Deployment-time constants of the issuance controller. Frozen at startup.
 *
 * @param controllerAddress         the controller's own identity, never a valid mint or transfer target
 * @param maxIssuers                cap on concurrently authorized issuers
 * @param termLengthBlocks          blocks an authorization stays valid
 * @param earlyExitThresholdPercent share of the term an issuer must serve before leaving without a cooldown
 * @param baseFactor                ceiling of every issuer's mint factor, in {@link #FACTOR_SCALE} units
 * @param burnBonus                 headroom restored per conservative-issuer condition, in {@link #FACTOR_SCALE} units
 * @param lowMintThreshold          average mint share below which an issuer counts as conservative
 * @param supplyFloor               minimum total supply topped up on mint calls
 */
public record IssuancePolicy(
        Address controllerAddress,
        int maxIssuers,
        long termLengthBlocks,
        int earlyExitThresholdPercent,
        long baseFactor,
        long burnBonus,
        long lowMintThreshold,
        BigInteger supplyFloor
) {
    /** Mint factors are parts-per-ten-thousand of current supply. */
    public static final long FACTOR_SCALE = 10_000L;

    /** Longest term for which percentage-of-term arithmetic stays within {@code long}. */
    public static final long MAX_TERM_LENGTH_BLOCKS = Long.MAX_VALUE / 100;

    public IssuancePolicy {
        if (controllerAddress == null || controllerAddress.isZero()) {
            throw new IllegalArgumentException("Controller address must be a non-zero address");
        }
        if (maxIssuers <= 0) {
            throw new IllegalArgumentException("maxIssuers must be positive: " + maxIssuers);
        }
        if (termLengthBlocks <= 0 || termLengthBlocks > MAX_TERM_LENGTH_BLOCKS) {
            throw new IllegalArgumentException("termLengthBlocks must be within 1.." + MAX_TERM_LENGTH_BLOCKS
                    + ": " + termLengthBlocks);
        }
        if (earlyExitThresholdPercent < 0 || earlyExitThresholdPercent > 100) {
            throw new IllegalArgumentException("earlyExitThresholdPercent must be within 0..100: " + earlyExitThresholdPercent);
        }
        if (baseFactor <= 0 || baseFactor > FACTOR_SCALE) {
            throw new IllegalArgumentException("baseFactor must be within 1.." + FACTOR_SCALE + ": " + baseFactor);
        }
        if (burnBonus < 0 || lowMintThreshold < 0) {
            throw new IllegalArgumentException("burnBonus and lowMintThreshold must not be negative");
        }
        if (supplyFloor == null || supplyFloor.signum() <= 0) {
            throw new IllegalArgumentException("supplyFloor must be positive: " + supplyFloor);
        }
    }
}
