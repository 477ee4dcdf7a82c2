/**
 * Error taxonomy of the contact store.
 *
 * <p>All store failures are unchecked {@link com.ryuqq.addressbook.core.exception.ContactStoreException}
 * subclasses tagged with an {@link com.ryuqq.addressbook.core.exception.ErrorCode}. Programming errors
 * (null arguments, use after close) are reported with {@link java.lang.IllegalArgumentException} and
 * {@link java.lang.IllegalStateException} instead.</p>
 *
 * @since 1.0.0
 * @author AddressBook Team
 */
package com.ryuqq.addressbook.core.exception;
