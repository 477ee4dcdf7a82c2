package com.ryuqq.addressbook.adapter.inmemory.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryContactStoreConfigTest {

    @Test
    void defaults() {
        InMemoryContactStoreConfig config = new InMemoryContactStoreConfig();

        assertThat(config.searchMode()).isEqualTo(SearchMode.INDEXED);
        assertThat(config.initialCapacity()).isEqualTo(256);
    }

    @Test
    void withers_ReturnModifiedCopies() {
        InMemoryContactStoreConfig config = new InMemoryContactStoreConfig()
            .withSearchMode(SearchMode.SUBSTRING)
            .withInitialCapacity(1024);

        assertThat(config).isEqualTo(new InMemoryContactStoreConfig(SearchMode.SUBSTRING, 1024));
    }

    @Test
    void invalidValues_AreRejected() {
        assertThatThrownBy(() -> new InMemoryContactStoreConfig(null, 16))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("searchMode cannot be null");
        assertThatThrownBy(() -> new InMemoryContactStoreConfig(SearchMode.INDEXED, -1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("initialCapacity cannot be negative");
    }
}
