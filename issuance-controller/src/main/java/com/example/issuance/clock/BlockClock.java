package com.example.issuance.clock;

/**
 * Source of the host's monotonic block counter. Read once per operation.
 */
public interface BlockClock {

    long currentBlock();
}
