package com.example.issuance.support;

import com.example.issuance.ledger.LedgerException;
import com.example.issuance.ledger.TokenLedger;
import com.example.issuance.model.Address;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemoryTokenLedger implements TokenLedger {

    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<String, BigInteger> allowances = new HashMap<>();

    @Override
    public BigInteger totalSupply() {
        return balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    @Override
    public BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public BigInteger allowance(Address owner, Address spender) {
        return allowances.getOrDefault(key(owner, spender), BigInteger.ZERO);
    }

    @Override
    public void mint(Address account, BigInteger amount) {
        balances.merge(account, amount, BigInteger::add);
    }

    @Override
    public void burn(Address account, BigInteger amount) {
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw LedgerException.insufficientBalance(account, balance, amount);
        }
        balances.put(account, balance.subtract(amount));
    }

    @Override
    public void approve(Address owner, Address spender, BigInteger amount) {
        allowances.put(key(owner, spender), amount);
    }

    @Override
    public void spendAllowance(Address owner, Address spender, BigInteger amount) {
        BigInteger current = allowance(owner, spender);
        if (current.compareTo(amount) < 0) {
            throw LedgerException.insufficientAllowance(owner, spender, current, amount);
        }
        allowances.put(key(owner, spender), current.subtract(amount));
    }

    private static String key(Address owner, Address spender) {
        return owner.value() + ":" + spender.value();
    }
}
