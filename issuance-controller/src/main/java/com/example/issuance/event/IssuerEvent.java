package com.example.issuance.event;

import com.example.issuance.model.Address;

import java.math.BigInteger;

/**
 * Append-only notifications emitted by registry and issuance operations.
 */
public interface IssuerEvent {

    /** Block at which the event was emitted. */
    long block();

    String type();

    record IssuerAuthorized(long block, Address issuer, long expirationBlock) implements IssuerEvent {
        @Override
        public String type() {
            return "issuer_authorized";
        }
    }

    record IssuerDeauthorized(long block, Address issuer, Address caller) implements IssuerEvent {
        @Override
        public String type() {
            return "issuer_deauthorized";
        }
    }

    record IssuerAuthorizationTransferred(long block, Address from, Address to, int position) implements IssuerEvent {
        @Override
        public String type() {
            return "issuer_authorization_transferred";
        }
    }

    record IssuerActivity(long block, Address issuer, BigInteger minted, BigInteger burned,
                          BigInteger totalMinted, BigInteger totalBurned) implements IssuerEvent {
        @Override
        public String type() {
            return "issuer_activity";
        }
    }
}
