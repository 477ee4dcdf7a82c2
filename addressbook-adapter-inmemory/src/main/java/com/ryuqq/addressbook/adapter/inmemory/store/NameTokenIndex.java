package com.ryuqq.addressbook.adapter.inmemory.store;

import com.ryuqq.addressbook.core.model.ContactId;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Inverted index from lowercase name token to the contacts whose name contains it.
 *
 * <p>Not thread-safe. {@link InMemoryContactStore} guards it with its read/write lock.
 * A bucket is deleted as soon as its last identifier leaves, so every bucket present
 * in the index is non-empty.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>add / remove:</strong> O(t) for t tokens</li>
 *   <li><strong>lookup:</strong> O(1) probe, result view of size k</li>
 * </ul>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
final class NameTokenIndex {

    private final Map<String, Set<ContactId>> buckets;

    NameTokenIndex(int initialCapacity) {
        this.buckets = new HashMap<>(initialCapacity);
    }

    void add(ContactId id, Collection<String> tokens) {
        for (String token : tokens) {
            buckets.computeIfAbsent(token, t -> new HashSet<>()).add(id);
        }
    }

    void remove(ContactId id, Collection<String> tokens) {
        for (String token : tokens) {
            Set<ContactId> bucket = buckets.get(token);
            if (bucket != null && bucket.remove(id) && bucket.isEmpty()) {
                buckets.remove(token);
            }
        }
    }

    /**
     * Returns the identifiers indexed under a token.
     *
     * @param token lowercase token
     * @return unmodifiable view, empty when the token is unknown
     */
    Set<ContactId> lookup(String token) {
        Set<ContactId> bucket = buckets.get(token);
        return bucket == null ? Collections.emptySet() : Collections.unmodifiableSet(bucket);
    }

    Map<String, Set<ContactId>> asMap() {
        return Collections.unmodifiableMap(buckets);
    }

    int tokenCount() {
        return buckets.size();
    }

    void clear() {
        buckets.clear();
    }
}
