package com.example.issuance.model;

import java.math.BigInteger;

/**
 * Outcome of a mint call.
 *
 * @param to          receiver of the new units
 * @param minted      total units created, top-up included
 * @param topUp       units added to reach the supply floor
 * @param totalSupply supply after the mint
 */
public record MintReceipt(Address to, BigInteger minted, BigInteger topUp, BigInteger totalSupply) {
}
