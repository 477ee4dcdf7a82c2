package com.ryuqq.addressbook.adapter.inmemory.store;

import com.ryuqq.addressbook.core.model.ContactId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Index from a normalized key (phone or email) to its single owning contact.
 *
 * <p>Not thread-safe. {@link InMemoryContactStore} guards it with its read/write lock and
 * checks {@link #ownerOf(String)} before calling {@link #put}, so a put that would steal
 * another contact's key indicates a broken store and fails fast.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
final class UniqueKeyIndex {

    private final String field;
    private final Map<String, ContactId> owners;

    UniqueKeyIndex(String field, int initialCapacity) {
        this.field = field;
        this.owners = new HashMap<>(initialCapacity);
    }

    String field() {
        return field;
    }

    /**
     * Returns the contact owning a key.
     *
     * @param key normalized key
     * @return the owner, or null if the key is free
     */
    ContactId ownerOf(String key) {
        return owners.get(key);
    }

    void put(String key, ContactId id) {
        ContactId previous = owners.putIfAbsent(key, id);
        if (previous != null && !previous.equals(id)) {
            throw new IllegalStateException(
                String.format("%s key '%s' is owned by %s, cannot assign to %s", field, key, previous, id));
        }
    }

    /**
     * Removes a key only if the given contact owns it.
     *
     * @param key normalized key
     * @param id expected owner
     */
    void remove(String key, ContactId id) {
        owners.remove(key, id);
    }

    Map<String, ContactId> asMap() {
        return Collections.unmodifiableMap(owners);
    }

    int size() {
        return owners.size();
    }

    void clear() {
        owners.clear();
    }
}
