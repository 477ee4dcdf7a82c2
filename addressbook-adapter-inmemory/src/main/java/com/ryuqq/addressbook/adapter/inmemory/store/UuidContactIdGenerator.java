package com.ryuqq.addressbook.adapter.inmemory.store;

import com.ryuqq.addressbook.core.model.ContactId;
import com.ryuqq.addressbook.core.spi.ContactIdGenerator;

import java.util.UUID;

/**
 * {@link ContactIdGenerator} backed by {@link UUID#randomUUID()} (random 128-bit values).
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public final class UuidContactIdGenerator implements ContactIdGenerator {

    @Override
    public ContactId nextId() {
        return ContactId.of(UUID.randomUUID().toString());
    }
}
