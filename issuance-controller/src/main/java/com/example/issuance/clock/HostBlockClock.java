package com.example.issuance.clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Block counter advanced by the host. Never moves backwards.
 */
@Component
public class HostBlockClock implements BlockClock {

    private static final Logger logger = LoggerFactory.getLogger(HostBlockClock.class);

    private final AtomicLong block = new AtomicLong();

    @Override
    public long currentBlock() {
        return block.get();
    }

    /**
     * @throws IllegalArgumentException if {@code blocks} is negative or the counter would overflow
     */
    public long advance(long blocks) {
        if (blocks < 0) {
            throw new IllegalArgumentException("Cannot advance by a negative block count: " + blocks);
        }
        long current = block.updateAndGet(value -> {
            if (value > Long.MAX_VALUE - blocks) {
                throw new IllegalArgumentException("Advancing block " + value + " by " + blocks + " overflows the counter");
            }
            return value + blocks;
        });
        logger.debug("Advanced clock by {} to block {}", blocks, current);
        return current;
    }

    /**
     * @throws IllegalArgumentException if {@code target} is behind the current block
     */
    public void advanceTo(long target) {
        block.updateAndGet(value -> {
            if (target < value) {
                throw new IllegalArgumentException("Block " + target + " is behind current block " + value);
            }
            return target;
        });
    }
}
