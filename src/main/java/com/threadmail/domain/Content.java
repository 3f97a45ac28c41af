package com.threadmail.domain;

/**
 * Message body value object. Plain text is mandatory, HTML is optional.
 */
public record Content(String plainText, String html) {

    public static final int DEFAULT_PREVIEW_LENGTH = 150;

    public Content {
        if (plainText == null || plainText.trim().isEmpty()) {
            throw new InvalidValueException("Email content cannot be empty");
        }
    }

    public Content(String plainText) {
        this(plainText, null);
    }

    public String preview() {
        return preview(DEFAULT_PREVIEW_LENGTH);
    }

    /**
     * Whitespace collapsed to single spaces, cut at maxLength with "..." appended
     */
    public String preview(int maxLength) {
        if (maxLength < 0) {
            throw new InvalidValueException("Preview length cannot be negative: " + maxLength);
        }
        String text = plainText.replaceAll("\\s+", " ").trim();
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }

    public int wordCount() {
        String trimmed = plainText.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    public boolean hasHtml() {
        return html != null && !html.isBlank();
    }
}
