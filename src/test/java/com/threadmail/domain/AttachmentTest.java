package com.threadmail.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttachmentTest {

    @Test
    @DisplayName("Type helpers and size in MB")
    void testTypeHelpers() {
        Attachment image = new Attachment("a1", "photo.png", "image/png", 1_572_864, null, false);
        Attachment pdf = new Attachment("a2", "report.pdf", "application/pdf", 10, null, false);

        assertThat(image.isImage()).isTrue();
        assertThat(image.isDocument()).isFalse();
        assertThat(image.sizeInMegabytes()).isEqualTo(1.5);
        assertThat(pdf.isDocument()).isTrue();
    }

    @Test
    @DisplayName("Missing MIME type defaults to application/octet-stream")
    void testDefaultMimeType() {
        assertThat(new Attachment("a1", "blob", null, 0, null, false).mimeType())
                .isEqualTo("application/octet-stream");
    }

    @Test
    @DisplayName("Identity is the attachment id")
    void testEquality() {
        assertThat(new Attachment("a1", "x.txt", "text/plain", 1, null, false))
                .isEqualTo(new Attachment("a1", "y.txt", "text/html", 2, "cid", true));
    }

    @Test
    @DisplayName("Blank filename and negative size are rejected")
    void testValidation() {
        assertThatThrownBy(() -> new Attachment("a1", " ", "text/plain", 1, null, false))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new Attachment("a1", "x.txt", "text/plain", -1, null, false))
                .isInstanceOf(InvalidValueException.class);
    }
}
