package com.example.issuance.ledger;

import com.example.issuance.model.Address;

import java.math.BigInteger;

public class LedgerException extends RuntimeException {

    private final String code;

    public LedgerException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static LedgerException insufficientBalance(Address account, BigInteger balance, BigInteger needed) {
        return new LedgerException("insufficient_balance",
                "Balance of " + account + " is " + balance + ", needed " + needed);
    }

    public static LedgerException insufficientAllowance(Address owner, Address spender,
                                                         BigInteger allowance, BigInteger needed) {
        return new LedgerException("insufficient_allowance",
                "Allowance of " + spender + " over " + owner + " is " + allowance + ", needed " + needed);
    }

    public String getCode() {
        return code;
    }
}
