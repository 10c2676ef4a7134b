package com.example.issuance.model;

import java.math.BigInteger;

/**
 * Per-issuer state: slot in the dense issuer list, validity window and lifetime counters.
 */
public class IssuerRecord {

    private int position;
    private final long startBlock;
    private final long expirationBlock;
    private BigInteger totalMinted;
    private long mintCount;
    private BigInteger totalBurned;
    private long burnCount;

    public IssuerRecord(int position, long startBlock, long expirationBlock) {
        this(position, startBlock, expirationBlock, BigInteger.ZERO, 0L, BigInteger.ZERO, 0L);
    }

    public IssuerRecord(int position, long startBlock, long expirationBlock,
                        BigInteger totalMinted, long mintCount, BigInteger totalBurned, long burnCount) {
        this.position = position;
        this.startBlock = startBlock;
        this.expirationBlock = expirationBlock;
        this.totalMinted = totalMinted;
        this.mintCount = mintCount;
        this.totalBurned = totalBurned;
        this.burnCount = burnCount;
    }

    public IssuerRecord copy() {
        return new IssuerRecord(position, startBlock, expirationBlock, totalMinted, mintCount, totalBurned, burnCount);
    }

    public void recordMint(BigInteger amount) {
        totalMinted = totalMinted.add(amount);
        mintCount++;
    }

    public void recordBurn(BigInteger amount) {
        totalBurned = totalBurned.add(amount);
        burnCount++;
    }

    public boolean isExpiredAt(long block) {
        return block >= expirationBlock;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public long getStartBlock() {
        return startBlock;
    }

    public long getExpirationBlock() {
        return expirationBlock;
    }

    public BigInteger getTotalMinted() {
        return totalMinted;
    }

    public long getMintCount() {
        return mintCount;
    }

    public BigInteger getTotalBurned() {
        return totalBurned;
    }

    public long getBurnCount() {
        return burnCount;
    }
}
