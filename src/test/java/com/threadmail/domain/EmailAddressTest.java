package com.threadmail.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmailAddressTest {

    @Test
    @DisplayName("Addresses compare case-insensitively and ignore the display name")
    void testEqualityIgnoresCase() {
        EmailAddress upper = new EmailAddress("Alice@Example.COM", "Alice");
        EmailAddress lower = new EmailAddress("alice@example.com");

        assertThat(upper).isEqualTo(lower);
        assertThat(upper.hashCode()).isEqualTo(lower.hashCode());
        assertThat(upper.normalized()).isEqualTo("alice@example.com");
    }

    @Test
    @DisplayName("Malformed addresses are rejected")
    void testInvalidAddress() {
        assertThatThrownBy(() -> new EmailAddress("not-an-address"))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new EmailAddress("a b@example.com"))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new EmailAddress("user@localhost"))
                .isInstanceOf(InvalidValueException.class);
        assertThatThrownBy(() -> new EmailAddress(null))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    @DisplayName("toString renders 'Name <address>' when a display name is present")
    void testToString() {
        assertThat(new EmailAddress("alice@example.com", "Alice")).hasToString("Alice <alice@example.com>");
        assertThat(new EmailAddress("alice@example.com", "  ")).hasToString("alice@example.com");
        assertThat(new EmailAddress("alice@example.com", "  ").displayName()).isNull();
    }
}
