package com.example.issuance.model;

import java.math.BigInteger;

/**
 * Burn request body. {@code account} is only read by burn-from.
 */
public record BurnRequest(String account, BigInteger amount) {
}
