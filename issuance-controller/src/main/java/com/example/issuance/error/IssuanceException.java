package com.example.issuance.error;

public class IssuanceException extends RuntimeException {

    private final IssuanceError error;

    public IssuanceException(IssuanceError error, String message) {
        super(message);
        this.error = error;
    }

    public IssuanceError getError() {
        return error;
    }
}
