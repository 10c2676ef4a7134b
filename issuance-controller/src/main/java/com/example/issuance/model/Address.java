package com.example.issuance.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A ledger identity: 20 bytes rendered as {@code 0x}-prefixed lower-case hex.
 *
 * @param value normalized hex form, always 42 characters long
 */
public record Address(String value) {

    private static final Pattern HEX_FORM = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        if (value == null || !HEX_FORM.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Address of(String value) {
        return new Address(value);
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
