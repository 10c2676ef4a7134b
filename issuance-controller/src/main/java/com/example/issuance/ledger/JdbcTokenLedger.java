package com.example.issuance.ledger;

import com.example.issuance.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * {@link TokenLedger} backed by the {@code token_balances} and {@code token_allowances} tables.
 * Total supply is the sum of all balances.
 */
@Repository
@Transactional
public class JdbcTokenLedger implements TokenLedger {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTokenLedger.class);

    private final JdbcClient jdbcClient;

    public JdbcTokenLedger(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger totalSupply() {
        return jdbcClient.sql("SELECT COALESCE(SUM(balance), 0) FROM token_balances")
            .query(BigDecimal.class)
            .single()
            .toBigInteger();
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(Address account) {
        return jdbcClient.sql("SELECT balance FROM token_balances WHERE account = :account")
            .param("account", account.value())
            .query(BigDecimal.class)
            .optional()
            .map(BigDecimal::toBigInteger)
            .orElse(BigInteger.ZERO);
    }

    @Override
    @Transactional(readOnly = true)
    public BigInteger allowance(Address owner, Address spender) {
        return jdbcClient.sql("""
            SELECT amount FROM token_allowances
            WHERE owner_account = :owner AND spender_account = :spender
            """)
            .param("owner", owner.value())
            .param("spender", spender.value())
            .query(BigDecimal.class)
            .optional()
            .map(BigDecimal::toBigInteger)
            .orElse(BigInteger.ZERO);
    }

    @Override
    public void mint(Address account, BigInteger amount) {
        requireNonNegative(amount);
        setBalance(account, balanceOf(account).add(amount));
        logger.debug("Credited {} to {}", amount, account);
    }

    @Override
    public void burn(Address account, BigInteger amount) {
        requireNonNegative(amount);
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw LedgerException.insufficientBalance(account, balance, amount);
        }
        setBalance(account, balance.subtract(amount));
        logger.debug("Debited {} from {}", amount, account);
    }

    @Override
    public void approve(Address owner, Address spender, BigInteger amount) {
        requireNonNegative(amount);
        int updated = jdbcClient.sql("""
            UPDATE token_allowances SET amount = :amount
            WHERE owner_account = :owner AND spender_account = :spender
            """)
            .param("amount", new BigDecimal(amount))
            .param("owner", owner.value())
            .param("spender", spender.value())
            .update();

        if (updated == 0) {
            jdbcClient.sql("""
                INSERT INTO token_allowances (owner_account, spender_account, amount)
                VALUES (:owner, :spender, :amount)
                """)
                .param("owner", owner.value())
                .param("spender", spender.value())
                .param("amount", new BigDecimal(amount))
                .update();
        }
        logger.info("Approved {} to spend {} on behalf of {}", spender, amount, owner);
    }

    @Override
    public void spendAllowance(Address owner, Address spender, BigInteger amount) {
        requireNonNegative(amount);
        BigInteger current = allowance(owner, spender);
        if (current.compareTo(amount) < 0) {
            throw LedgerException.insufficientAllowance(owner, spender, current, amount);
        }
        approve(owner, spender, current.subtract(amount));
    }

    private void setBalance(Address account, BigInteger balance) {
        int updated = jdbcClient.sql("UPDATE token_balances SET balance = :balance WHERE account = :account")
            .param("balance", new BigDecimal(balance))
            .param("account", account.value())
            .update();

        if (updated == 0) {
            jdbcClient.sql("INSERT INTO token_balances (account, balance) VALUES (:account, :balance)")
                .param("account", account.value())
                .param("balance", new BigDecimal(balance))
                .update();
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be a non-negative integer: " + amount);
        }
    }
}
