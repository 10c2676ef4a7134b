package com.example.issuance.model;

import java.math.BigInteger;

public record MintRequest(String to, BigInteger amount) {
}
