package com.example.issuance.event;

import com.example.issuance.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * {@link IssuerEventLog} backed by the {@code issuer_events} table. Rows are never updated or deleted.
 */
@Repository
public class JdbcIssuerEventLog implements IssuerEventLog {

    private static final Logger logger = LoggerFactory.getLogger(JdbcIssuerEventLog.class);

    private final JdbcClient jdbcClient;

    public JdbcIssuerEventLog(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    @Override
    public void append(IssuerEvent event) {
        Address subject = null;
        Address counterparty = null;
        Integer position = null;
        Long expirationBlock = null;
        BigInteger minted = null;
        BigInteger burned = null;
        BigInteger totalMinted = null;
        BigInteger totalBurned = null;

        if (event instanceof IssuerEvent.IssuerAuthorized e) {
            subject = e.issuer();
            expirationBlock = e.expirationBlock();
        } else if (event instanceof IssuerEvent.IssuerDeauthorized e) {
            subject = e.issuer();
            counterparty = e.caller();
        } else if (event instanceof IssuerEvent.IssuerAuthorizationTransferred e) {
            subject = e.from();
            counterparty = e.to();
            position = e.position();
        } else if (event instanceof IssuerEvent.IssuerActivity e) {
            subject = e.issuer();
            minted = e.minted();
            burned = e.burned();
            totalMinted = e.totalMinted();
            totalBurned = e.totalBurned();
        } else {
            throw new IllegalArgumentException("Unsupported event: " + event);
        }

        jdbcClient.sql("""
            INSERT INTO issuer_events (event_type, block_number, subject, counterparty, list_position,
                                       expiration_block, minted, burned, total_minted, total_burned, created_at)
            VALUES (:eventType, :block, :subject, :counterparty, :position,
                    :expirationBlock, :minted, :burned, :totalMinted, :totalBurned, :createdAt)
            """)
            .param("eventType", event.type())
            .param("block", event.block())
            .param("subject", subject.value())
            .param("counterparty", counterparty == null ? null : counterparty.value())
            .param("position", position)
            .param("expirationBlock", expirationBlock)
            .param("minted", decimal(minted))
            .param("burned", decimal(burned))
            .param("totalMinted", decimal(totalMinted))
            .param("totalBurned", decimal(totalBurned))
            .param("createdAt", Instant.now())
            .update();

        logger.info("Event {} at block {}: {}", event.type(), event.block(), event);
    }

    @Override
    public List<IssuerEvent> entries() {
        return jdbcClient.sql("""
            SELECT event_type, block_number, subject, counterparty, list_position,
                   expiration_block, minted, burned, total_minted, total_burned
            FROM issuer_events ORDER BY id
            """)
            .query((rs, rowNum) -> toEvent(rs))
            .list();
    }

    private static IssuerEvent toEvent(ResultSet rs) throws SQLException {
        String type = rs.getString("event_type");
        long block = rs.getLong("block_number");
        Address subject = Address.of(rs.getString("subject"));
        return switch (type) {
            case "issuer_authorized" -> new IssuerEvent.IssuerAuthorized(block, subject,
                    rs.getLong("expiration_block"));
            case "issuer_deauthorized" -> new IssuerEvent.IssuerDeauthorized(block, subject,
                    Address.of(rs.getString("counterparty")));
            case "issuer_authorization_transferred" -> new IssuerEvent.IssuerAuthorizationTransferred(block, subject,
                    Address.of(rs.getString("counterparty")), rs.getInt("list_position"));
            case "issuer_activity" -> new IssuerEvent.IssuerActivity(block, subject,
                    integer(rs, "minted"), integer(rs, "burned"),
                    integer(rs, "total_minted"), integer(rs, "total_burned"));
            default -> throw new IllegalStateException("Unknown event type in issuer_events: " + type);
        };
    }

    private static BigDecimal decimal(BigInteger value) {
        return value == null ? null : new BigDecimal(value);
    }

    private static BigInteger integer(ResultSet rs, String column) throws SQLException {
        return rs.getBigDecimal(column).toBigInteger();
    }
}
