package com.ryuqq.addressbook.core.key;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContactKeysTest {

    @Test
    void phoneKey_StripsSeparators() {
        assertThat(ContactKeys.phoneKey("(555) 123-4567")).isEqualTo("5551234567");
        assertThat(ContactKeys.phoneKey("555.123.4567")).isEqualTo("5551234567");
    }

    @Test
    void phoneKey_KeepsLeadingPlus() {
        assertThat(ContactKeys.phoneKey("+1 555 123 4567")).isEqualTo("+15551234567");
    }

    @Test
    void phoneKey_NoDigits_ReturnsEmpty() {
        assertThat(ContactKeys.phoneKey("bob")).isEmpty();
    }

    @Test
    void isPhoneText_AcceptsDigitsAndSeparatorsOnly() {
        assertThat(ContactKeys.isPhoneText("+1 (555) 123-4567")).isTrue();
        assertThat(ContactKeys.isPhoneText("555.123.4567")).isTrue();
        assertThat(ContactKeys.isPhoneText("1-800-FLOWERS")).isFalse();
        assertThat(ContactKeys.isPhoneText("555-1234 ext 9")).isFalse();
        assertThat(ContactKeys.isPhoneText("\u0665\u0665\u0665")).isFalse();
    }

    @Test
    void emailKey_TrimsAndLowercases() {
        assertThat(ContactKeys.emailKey("  Alice.Smith@Example.COM ")).isEqualTo("alice.smith@example.com");
    }

    @Test
    void nullArguments_ThrowIllegalArgument() {
        assertThatThrownBy(() -> ContactKeys.phoneKey(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("phone cannot be null");
        assertThatThrownBy(() -> ContactKeys.isPhoneText(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("text cannot be null");
        assertThatThrownBy(() -> ContactKeys.emailKey(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("email cannot be null");
    }
}
