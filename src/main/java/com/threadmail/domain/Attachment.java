package com.threadmail.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Attachment owned by a message. Identity is the attachment id.
 */
public record Attachment(String id,
                         String filename,
                         String mimeType,
                         long sizeBytes,
                         String contentId,
                         boolean inline) {

    private static final Set<String> DOCUMENT_TYPES = Set.of(
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document"
    );

    public Attachment {
        if (id == null || id.isBlank()) {
            throw new InvalidValueException("Attachment id is required");
        }
        if (filename == null || filename.trim().isEmpty()) {
            throw new InvalidValueException("Attachment filename cannot be empty");
        }
        if (sizeBytes < 0) {
            throw new InvalidValueException("Attachment size cannot be negative: " + sizeBytes);
        }
        if (mimeType == null || mimeType.isBlank()) {
            mimeType = "application/octet-stream";
        }
    }

    public boolean isImage() {
        return mimeType.startsWith("image/");
    }

    public boolean isDocument() {
        return DOCUMENT_TYPES.contains(mimeType);
    }

    /**
     * Size in MB rounded to two decimals
     */
    public double sizeInMegabytes() {
        return Math.round((sizeBytes / (1024.0 * 1024.0)) * 100) / 100.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Attachment other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }
}
