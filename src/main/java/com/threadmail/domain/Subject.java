package com.threadmail.domain;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Subject line value object
 * - Reply / forward detection
 * - Normalized form with every leading Re:/Fwd:/Fw: token stripped
 */
public record Subject(String raw) {

    private static final Pattern PREFIX_PATTERN = Pattern.compile("^(re|fwd|fw)\\s*:\\s*", Pattern.CASE_INSENSITIVE);

    public Subject {
        if (raw == null || raw.trim().isEmpty()) {
            throw new InvalidValueException("Email subject cannot be empty");
        }
    }

    public boolean isReply() {
        return raw.toLowerCase(Locale.ROOT).startsWith("re:");
    }

    public boolean isForward() {
        String lower = raw.toLowerCase(Locale.ROOT);
        return lower.startsWith("fwd:") || lower.startsWith("fw:");
    }

    /**
     * "Re: Fwd: RE: Budget" -> "Budget". Case is preserved.
     */
    public String normalized() {
        String value = raw.trim();
        String stripped = PREFIX_PATTERN.matcher(value).replaceFirst("");
        while (!stripped.equals(value)) {
            value = stripped.trim();
            stripped = PREFIX_PATTERN.matcher(value).replaceFirst("");
        }
        return value;
    }

    /**
     * Case-insensitive comparison of the normalized forms
     */
    public boolean sameConversationAs(Subject other) {
        return other != null && normalized().equalsIgnoreCase(other.normalized());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subject other)) return false;
        return raw.trim().equals(other.raw.trim());
    }

    @Override
    public int hashCode() {
        return raw.trim().hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }
}
