package com.ryuqq.addressbook.core.spi;

import com.ryuqq.addressbook.core.exception.ConflictException;
import com.ryuqq.addressbook.core.exception.InvalidInputException;
import com.ryuqq.addressbook.core.exception.NotFoundException;
import com.ryuqq.addressbook.core.model.Contact;
import com.ryuqq.addressbook.core.model.ContactDraft;
import com.ryuqq.addressbook.core.model.ContactId;
import com.ryuqq.addressbook.core.model.ContactPatch;

import java.util.Collection;
import java.util.List;

/**
 * Contact Store SPI.
 *
 * <p>This interface is the narrow operation contract through which request-handling layers
 * consume contact records. It exposes single-record primitives only; batching policy
 * (partial success vs all-or-nothing) belongs to the calling layer.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Identifier generation on create</li>
 *   <li>Phone and email uniqueness over normalized keys</li>
 *   <li>Lookup by identifier and token search over names, phones and emails</li>
 *   <li>Idempotent bulk delete</li>
 * </ul>
 *
 * <p><strong>Consistency Guarantee:</strong></p>
 * <ul>
 *   <li>Every mutation takes effect atomically across the primary table and all indexes</li>
 *   <li>Operations are linearizable; readers never observe a partially applied mutation</li>
 *   <li>A failed mutation leaves the store unchanged</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Bounded: No operation may block on I/O or external resources</li>
 *   <li>Owned: A store is constructed and closed explicitly by its owner; after
 *       {@link #close()} every method throws {@link IllegalStateException}</li>
 * </ul>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public interface ContactStore extends AutoCloseable {

    /**
     * Creates a contact and assigns it a fresh identifier.
     *
     * @param draft the contact fields
     * @return the stored contact
     * @throws IllegalArgumentException if draft is null
     * @throws InvalidInputException if a field is missing or blank, or the phone holds no digits
     * @throws ConflictException if the phone or email key is owned by another contact
     */
    Contact create(ContactDraft draft);

    /**
     * Retrieves a contact.
     *
     * <p>Performance: O(1)</p>
     *
     * @param id the contact identifier
     * @return the contact
     * @throws IllegalArgumentException if id is null
     * @throws NotFoundException if no live contact has this identifier
     */
    Contact get(ContactId id);

    /**
     * Replaces the fields present in the patch, preserving the others.
     *
     * <p>All constraints are checked before any index is touched. Re-assigning a contact's
     * own phone or email (in any spelling with the same key) is not a conflict.
     * An empty patch returns the current contact unchanged.</p>
     *
     * @param id the contact identifier
     * @param patch the fields to change
     * @return the updated contact
     * @throws IllegalArgumentException if id or patch is null
     * @throws NotFoundException if no live contact has this identifier
     * @throws InvalidInputException if a supplied field is blank, or the phone holds no digits
     * @throws ConflictException if the new phone or email key is owned by another contact
     */
    Contact update(ContactId id, ContactPatch patch);

    /**
     * Deletes contacts.
     *
     * <p>Duplicate identifiers are ignored and missing identifiers are skipped,
     * so retrying a delete is safe.</p>
     *
     * @param ids identifiers to delete
     * @return the number of contacts actually removed
     * @throws IllegalArgumentException if ids is null or contains null
     */
    int delete(Collection<ContactId> ids);

    /**
     * Searches contacts by free text.
     *
     * <p>The query is tokenized the same way names are indexed; matching is case-insensitive
     * and a blank query matches nothing. Implementations document whether phone and email
     * are matched exactly or by substring, since that decides the cost class.</p>
     *
     * @param query free text (null is treated as blank)
     * @return matching contacts ordered by identifier (may be empty)
     */
    List<Contact> search(String query);

    /**
     * Lists every live contact.
     *
     * @return all contacts ordered by identifier (may be empty)
     */
    List<Contact> findAll();

    /**
     * Returns the number of live contacts.
     *
     * @return contact count
     */
    int size();

    /**
     * Tears the store down and releases its records.
     *
     * <p>Closing twice is allowed.</p>
     */
    @Override
    void close();
}
