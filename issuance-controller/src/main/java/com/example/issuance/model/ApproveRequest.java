package com.example.issuance.model;

import java.math.BigInteger;

public record ApproveRequest(String spender, BigInteger amount) {
}
