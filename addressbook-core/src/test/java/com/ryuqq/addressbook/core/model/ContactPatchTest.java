package com.ryuqq.addressbook.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ContactPatch 테스트.
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
class ContactPatchTest {

    private final Contact current = new Contact(
        ContactId.of("contact-1"), "Alice Smith", "555-123-4567", "alice@example.com");

    @Test
    void 빈_패치는_현재_Contact를_그대로_반환() {
        // given
        ContactPatch patch = ContactPatch.empty();

        // when
        Contact result = patch.applyTo(current);

        // then
        assertThat(patch.isEmpty()).isTrue();
        assertThat(result).isSameAs(current);
    }

    @Test
    void 전화번호만_변경하면_나머지_필드_유지() {
        // given
        ContactPatch patch = ContactPatch.empty().withPhone("555-000-1111");

        // when
        Contact result = patch.applyTo(current);

        // then
        assertThat(result.id()).isEqualTo(current.id());
        assertThat(result.name()).isEqualTo("Alice Smith");
        assertThat(result.phone()).isEqualTo("555-000-1111");
        assertThat(result.email()).isEqualTo("alice@example.com");
    }

    @Test
    void 존재하는_필드만_Optional로_노출() {
        // given
        ContactPatch patch = ContactPatch.empty().withName("Alice Jones").withEmail("aj@example.com");

        // then
        assertThat(patch.isEmpty()).isFalse();
        assertThat(patch.nameIfPresent()).contains("Alice Jones");
        assertThat(patch.phoneIfPresent()).isEmpty();
        assertThat(patch.emailIfPresent()).contains("aj@example.com");
    }
}
