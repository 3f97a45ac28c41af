package com.threadmail.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentTest {

    @Test
    @DisplayName("Preview collapses whitespace and cuts long bodies")
    void testPreview() {
        Content content = new Content("Hello\n\n  world,\tthis is a longer body");

        assertThat(content.preview(11)).isEqualTo("Hello world...");
        assertThat(content.preview(100)).isEqualTo("Hello world, this is a longer body");
    }

    @Test
    @DisplayName("Default preview is 150 characters")
    void testDefaultPreviewLength() {
        Content content = new Content("x".repeat(200));

        assertThat(content.preview()).hasSize(Content.DEFAULT_PREVIEW_LENGTH + 3).endsWith("...");
    }

    @Test
    @DisplayName("Word count and HTML presence")
    void testWordCountAndHtml() {
        assertThat(new Content("  one two\nthree ").wordCount()).isEqualTo(3);
        assertThat(new Content("text", "<p>text</p>").hasHtml()).isTrue();
        assertThat(new Content("text", " ").hasHtml()).isFalse();
    }

    @Test
    @DisplayName("Empty plain text is rejected")
    void testEmptyRejected() {
        assertThatThrownBy(() -> new Content(" \n ")).isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new Content("text").preview(-1)).isInstanceOf(InvalidValueException.class);
    }
}
