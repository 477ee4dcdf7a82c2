/**
 * In-memory ContactStore adapter implementation package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.addressbook.adapter.inmemory.store.InMemoryContactStore}:
 *       Thread-safe multi-index implementation of {@link com.ryuqq.addressbook.core.spi.ContactStore}</li>
 *   <li>{@link com.ryuqq.addressbook.adapter.inmemory.store.InMemoryContactStoreConfig}:
 *       Search mode and capacity settings</li>
 *   <li>{@link com.ryuqq.addressbook.adapter.inmemory.store.UuidContactIdGenerator}:
 *       Random UUID identifiers</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> A single {@link java.util.concurrent.locks.ReentrantReadWriteLock}
 *       covers the primary table and every index, so cross-index state is observed atomically</li>
 *   <li><strong>All-or-nothing:</strong> Uniqueness and input checks finish before any write</li>
 *   <li><strong>Deterministic output:</strong> Searches and listings are ordered by contact id</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Writers are serialized; write throughput does not scale with cores</li>
 * </ul>
 *
 * @see com.ryuqq.addressbook.core.spi.ContactStore
 * @author AddressBook Team
 * @since 1.0.0
 */
package com.ryuqq.addressbook.adapter.inmemory.store;
