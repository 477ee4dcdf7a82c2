package com.ryuqq.addressbook.adapter.inmemory.store;

/**
 * InMemoryContactStore configuration (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>searchMode: phone/email matching policy (default {@link SearchMode#INDEXED})</li>
 *   <li>initialCapacity: initial size of the primary table and indexes (default 256)</li>
 * </ul>
 *
 * @author AddressBook Team
 * @since 1.0.0
 * @param searchMode search policy (not null)
 * @param initialCapacity initial map capacity (0 or more)
 */
public record InMemoryContactStoreConfig(SearchMode searchMode, int initialCapacity) {

    /**
     * Default settings: searchMode=INDEXED, initialCapacity=256.
     */
    public InMemoryContactStoreConfig() {
        this(SearchMode.INDEXED, 256);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if searchMode is null or initialCapacity is negative
     */
    public InMemoryContactStoreConfig {
        if (searchMode == null) {
            throw new IllegalArgumentException("searchMode cannot be null");
        }
        if (initialCapacity < 0) {
            throw new IllegalArgumentException(
                "initialCapacity cannot be negative (current: " + initialCapacity + ")"
            );
        }
    }

    /**
     * Creates a copy with a different search mode.
     *
     * @param searchMode new search mode
     * @return new InMemoryContactStoreConfig instance
     */
    public InMemoryContactStoreConfig withSearchMode(SearchMode searchMode) {
        return new InMemoryContactStoreConfig(searchMode, this.initialCapacity);
    }

    /**
     * Creates a copy with a different initial capacity.
     *
     * @param initialCapacity new initial capacity
     * @return new InMemoryContactStoreConfig instance
     */
    public InMemoryContactStoreConfig withInitialCapacity(int initialCapacity) {
        return new InMemoryContactStoreConfig(this.searchMode, initialCapacity);
    }
}
