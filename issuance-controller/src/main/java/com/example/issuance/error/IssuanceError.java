package com.example.issuance.error;

import java.util.Locale;

/**
 * Named rejection reasons. Every one of them aborts the operation with no state change.
 */
public enum IssuanceError {

    NOT_AUTHORIZED(Category.ELIGIBILITY),
    TERM_EXPIRED(Category.ELIGIBILITY),
    ALREADY_AUTHORIZED(Category.ELIGIBILITY),
    CAP_REACHED(Category.ELIGIBILITY),
    COOLDOWN_ACTIVE(Category.ELIGIBILITY),
    INVALID_TARGET(Category.TARGET),
    INVALID_RECEIVER(Category.TARGET),
    EXCEEDS_MINT_FACTOR(Category.ECONOMIC),
    INVALID_AMOUNT(Category.ECONOMIC),
    TERM_NOT_EXPIRED(Category.TIMING);

    public enum Category {
        ELIGIBILITY, TARGET, ECONOMIC, TIMING
    }

    private final Category category;

    IssuanceError(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    /**
     * Wire form used in error responses, e.g. {@code cooldown_active}.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
