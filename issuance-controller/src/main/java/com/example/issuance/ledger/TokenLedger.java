package com.example.issuance.ledger;

import com.example.issuance.model.Address;

import java.math.BigInteger;

/**
 * Fungible-value ledger the controller issues against. Implementations reject invalid
 * debits with a {@link LedgerException} and leave balances untouched.
 */
public interface TokenLedger {

    BigInteger totalSupply();

    BigInteger balanceOf(Address account);

    BigInteger allowance(Address owner, Address spender);

    void mint(Address account, BigInteger amount);

    void burn(Address account, BigInteger amount);

    void approve(Address owner, Address spender, BigInteger amount);

    void spendAllowance(Address owner, Address spender, BigInteger amount);
}
