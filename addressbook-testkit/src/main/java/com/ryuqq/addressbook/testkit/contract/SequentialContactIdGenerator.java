package com.ryuqq.addressbook.testkit.contract;

import com.ryuqq.addressbook.core.model.ContactId;
import com.ryuqq.addressbook.core.spi.ContactIdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Predictable {@link ContactIdGenerator} for tests.
 *
 * <p>Produces {@code prefix-000001}, {@code prefix-000002}, ... so that identifier order
 * equals creation order and assertions on ordered results stay readable.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public class SequentialContactIdGenerator implements ContactIdGenerator {

    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    public SequentialContactIdGenerator(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        this.prefix = prefix;
    }

    @Override
    public ContactId nextId() {
        return ContactId.of(String.format("%s-%06d", prefix, sequence.incrementAndGet()));
    }
}
