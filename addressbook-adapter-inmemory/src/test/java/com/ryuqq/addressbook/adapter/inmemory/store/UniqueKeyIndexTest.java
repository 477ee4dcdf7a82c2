package com.ryuqq.addressbook.adapter.inmemory.store;

import com.ryuqq.addressbook.core.model.ContactId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UniqueKeyIndexTest {

    private final UniqueKeyIndex index = new UniqueKeyIndex("phone", 16);
    private final ContactId alice = ContactId.of("alice");
    private final ContactId bob = ContactId.of("bob");

    @Test
    void put_ThenOwnerOf_ReturnsOwner() {
        index.put("5551234567", alice);

        assertThat(index.ownerOf("5551234567")).isEqualTo(alice);
        assertThat(index.ownerOf("5559999999")).isNull();
    }

    @Test
    void put_SameOwnerTwice_IsAllowed() {
        index.put("5551234567", alice);
        index.put("5551234567", alice);

        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void put_KeyOwnedByOther_FailsFast() {
        index.put("5551234567", alice);

        assertThatThrownBy(() -> index.put("5551234567", bob))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("phone key '5551234567' is owned by");
        assertThat(index.ownerOf("5551234567")).isEqualTo(alice);
    }

    @Test
    void remove_OnlyWhenOwnedByGivenId() {
        index.put("5551234567", alice);

        index.remove("5551234567", bob);
        assertThat(index.ownerOf("5551234567")).isEqualTo(alice);

        index.remove("5551234567", alice);
        assertThat(index.ownerOf("5551234567")).isNull();
    }
}
