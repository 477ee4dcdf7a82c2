package com.ryuqq.addressbook.core.spi;

import com.ryuqq.addressbook.core.model.ContactId;

/**
 * Identifier generation strategy for new contacts.
 *
 * <p>Implementations must be thread-safe and must never return an identifier twice
 * over the lifetime of a store, including identifiers of deleted contacts.
 * Random 128-bit UUIDs or a monotonic counter plus node tag both qualify.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContactIdGenerator {

    /**
     * Generates the next identifier.
     *
     * @return a never-before-returned identifier
     */
    ContactId nextId();
}
