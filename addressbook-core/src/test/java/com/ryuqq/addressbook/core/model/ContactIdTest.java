package com.ryuqq.addressbook.core.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ContactId Value Object 테스트.
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
class ContactIdTest {

    @Test
    void of_ValidValue_CreatesContactId() {
        // Given
        String value = "contact-12345";

        // When
        ContactId contactId = ContactId.of(value);

        // Then
        assertNotNull(contactId);
        assertEquals(value, contactId.getValue());
    }

    @Test
    void of_UuidValue_CreatesContactId() {
        // Given
        String value = UUID.randomUUID().toString();

        // When
        ContactId contactId = ContactId.of(value);

        // Then
        assertEquals(value, contactId.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ContactId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ContactId.of("   ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_ValueExceeds255Characters_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ContactId.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }

    @Test
    void of_ValueWithInvalidCharacters_ThrowsException() {
        // Given: 공백 포함
        String valueWithSpace = "contact 123";

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ContactId.of(valueWithSpace)
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        ContactId first = ContactId.of("contact-1");
        ContactId second = ContactId.of("contact-1");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void compareTo_SortsByValue() {
        // Given
        List<ContactId> ids = new ArrayList<>(List.of(
            ContactId.of("c"), ContactId.of("a"), ContactId.of("b")
        ));

        // When
        Collections.sort(ids);

        // Then
        assertEquals(List.of(ContactId.of("a"), ContactId.of("b"), ContactId.of("c")), ids);
    }

    @Test
    void toString_ContainsValue() {
        // Given
        ContactId contactId = ContactId.of("contact-42");

        // Then
        assertEquals("ContactId{contact-42}", contactId.toString());
    }
}
