package com.threadmail.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Email address value object.
 * Equality is case-insensitive on the address and ignores the display name.
 */
public record EmailAddress(String address, String displayName) {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public EmailAddress {
        if (address == null || !EMAIL_PATTERN.matcher(address).matches()) {
            throw new InvalidValueException("Invalid email address: " + address);
        }
        if (displayName != null && displayName.isBlank()) {
            displayName = null;
        }
    }

    public EmailAddress(String address) {
        this(address, null);
    }

    /**
     * Lower-cased address, the form used for participant sets
     */
    public String normalized() {
        return address.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmailAddress other)) return false;
        return address.equalsIgnoreCase(other.address);
    }

    @Override
    public int hashCode() {
        return normalized().hashCode();
    }

    @Override
    public String toString() {
        return displayName != null ? displayName + " <" + address + ">" : address;
    }
}
