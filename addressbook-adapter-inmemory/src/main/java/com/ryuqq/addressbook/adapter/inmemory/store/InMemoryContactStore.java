package com.ryuqq.addressbook.adapter.inmemory.store;

import com.ryuqq.addressbook.core.exception.ConflictException;
import com.ryuqq.addressbook.core.exception.InvalidInputException;
import com.ryuqq.addressbook.core.exception.NotFoundException;
import com.ryuqq.addressbook.core.key.ContactKeys;
import com.ryuqq.addressbook.core.key.NameTokenizer;
import com.ryuqq.addressbook.core.model.Contact;
import com.ryuqq.addressbook.core.model.ContactDraft;
import com.ryuqq.addressbook.core.model.ContactId;
import com.ryuqq.addressbook.core.model.ContactPatch;
import com.ryuqq.addressbook.core.spi.ContactIdGenerator;
import com.ryuqq.addressbook.core.spi.ContactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ContactStore} SPI.
 *
 * <p>This implementation keeps a primary table and three secondary indexes that are
 * updated together as one unit of shared state.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>contacts:</strong> HashMap&lt;ContactId, Contact&gt; - Primary table (O(1) access)</li>
 *   <li><strong>nameIndex:</strong> {@link NameTokenIndex} - Lowercase name token → contact ids</li>
 *   <li><strong>phoneIndex:</strong> {@link UniqueKeyIndex} - Phone key → owning contact id</li>
 *   <li><strong>emailIndex:</strong> {@link UniqueKeyIndex} - Email key → owning contact id</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong></p>
 * <ul>
 *   <li>One {@link ReentrantReadWriteLock} guards all four structures</li>
 *   <li>get / search / findAll / size run under the read lock and may overlap each other</li>
 *   <li>create / update / delete / close run under the write lock, exclusive of everything</li>
 *   <li>Constraints are checked before the first structure is touched, so a failed
 *       mutation changes nothing</li>
 *   <li>Id generation and logging happen outside the lock</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>create / get:</strong> O(t) / O(1), t = name tokens</li>
 *   <li><strong>update:</strong> O(t) for the token delta</li>
 *   <li><strong>delete:</strong> O(m · t) for m identifiers</li>
 *   <li><strong>search:</strong> O(q + k) in {@link SearchMode#INDEXED}, O(n) in {@link SearchMode#SUBSTRING}</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (ContactStore store = new InMemoryContactStore()) {
 *     Contact alice = store.create(ContactDraft.of("Alice Smith", "555-123-4567", "alice@example.com"));
 *     store.update(alice.id(), ContactPatch.empty().withPhone("555-000-1111"));
 *     List&lt;Contact&gt; smiths = store.search("smith");
 *     store.delete(List.of(alice.id()));
 * }
 * </pre>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public class InMemoryContactStore implements ContactStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryContactStore.class);

    private static final Comparator<Contact> BY_ID = Comparator.comparing(Contact::id);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ContactIdGenerator idGenerator;
    private final InMemoryContactStoreConfig config;

    private final Map<ContactId, Contact> contacts;
    private final NameTokenIndex nameIndex;
    private final UniqueKeyIndex phoneIndex;
    private final UniqueKeyIndex emailIndex;

    /** Guarded by {@link #lock}. */
    private boolean closed;

    /**
     * Creates a store with UUID identifiers and default settings.
     */
    public InMemoryContactStore() {
        this(new UuidContactIdGenerator(), new InMemoryContactStoreConfig());
    }

    /**
     * Creates a store with UUID identifiers.
     *
     * @param config store settings
     */
    public InMemoryContactStore(InMemoryContactStoreConfig config) {
        this(new UuidContactIdGenerator(), config);
    }

    /**
     * Creates a store.
     *
     * @param idGenerator identifier strategy
     * @param config store settings
     * @throws IllegalArgumentException if a dependency is null
     */
    public InMemoryContactStore(ContactIdGenerator idGenerator, InMemoryContactStoreConfig config) {
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.idGenerator = idGenerator;
        this.config = config;
        this.contacts = new HashMap<>(config.initialCapacity());
        this.nameIndex = new NameTokenIndex(config.initialCapacity());
        this.phoneIndex = new UniqueKeyIndex("phone", config.initialCapacity());
        this.emailIndex = new UniqueKeyIndex("email", config.initialCapacity());
    }

    @Override
    public Contact create(ContactDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
        requireText("name", draft.name());
        String phoneKey = requirePhoneKey(draft.phone());
        String emailKey = ContactKeys.emailKey(requireText("email", draft.email()));

        ContactId id = idGenerator.nextId();
        Contact created;

        lock.writeLock().lock();
        try {
            ensureOpen();
            checkAvailable(phoneIndex, phoneKey, null);
            checkAvailable(emailIndex, emailKey, null);
            if (id == null || contacts.containsKey(id)) {
                throw new IllegalStateException("Id generator returned an unusable id: " + id);
            }

            created = new Contact(id, draft.name(), draft.phone(), draft.email());
            contacts.put(id, created);
            nameIndex.add(id, NameTokenizer.tokenize(created.name()));
            phoneIndex.put(phoneKey, id);
            emailIndex.put(emailKey, id);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Created contact {}", id);
        return created;
    }

    @Override
    public Contact get(ContactId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        lock.readLock().lock();
        try {
            ensureOpen();
            Contact contact = contacts.get(id);
            if (contact == null) {
                throw new NotFoundException(id);
            }
            return contact;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Only the token difference between old and new name is applied to the name index</li>
     *   <li>Phone and email entries move only when their key changes</li>
     *   <li>Both uniqueness checks run before the first index write</li>
     * </ul>
     */
    @Override
    public Contact update(ContactId id, ContactPatch patch) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        patch.nameIfPresent().ifPresent(name -> requireText("name", name));
        patch.phoneIfPresent().ifPresent(InMemoryContactStore::requirePhoneKey);
        patch.emailIfPresent().ifPresent(email -> requireText("email", email));

        Contact updated;

        lock.writeLock().lock();
        try {
            ensureOpen();
            Contact current = contacts.get(id);
            if (current == null) {
                throw new NotFoundException(id);
            }
            if (patch.isEmpty()) {
                return current;
            }
            updated = patch.applyTo(current);

            String oldPhoneKey = ContactKeys.phoneKey(current.phone());
            String newPhoneKey = ContactKeys.phoneKey(updated.phone());
            String oldEmailKey = ContactKeys.emailKey(current.email());
            String newEmailKey = ContactKeys.emailKey(updated.email());
            checkAvailable(phoneIndex, newPhoneKey, id);
            checkAvailable(emailIndex, newEmailKey, id);

            Set<String> oldTokens = NameTokenizer.tokenize(current.name());
            Set<String> newTokens = NameTokenizer.tokenize(updated.name());
            if (!oldTokens.equals(newTokens)) {
                nameIndex.remove(id, difference(oldTokens, newTokens));
                nameIndex.add(id, difference(newTokens, oldTokens));
            }
            if (!oldPhoneKey.equals(newPhoneKey)) {
                phoneIndex.remove(oldPhoneKey, id);
                phoneIndex.put(newPhoneKey, id);
            }
            if (!oldEmailKey.equals(newEmailKey)) {
                emailIndex.remove(oldEmailKey, id);
                emailIndex.put(newEmailKey, id);
            }
            contacts.put(id, updated);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Updated contact {}", id);
        return updated;
    }

    @Override
    public int delete(Collection<ContactId> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        Set<ContactId> unique = new LinkedHashSet<>();
        for (ContactId id : ids) {
            if (id == null) {
                throw new IllegalArgumentException("ids cannot contain null");
            }
            unique.add(id);
        }

        int removed = 0;

        lock.writeLock().lock();
        try {
            ensureOpen();
            for (ContactId id : unique) {
                Contact contact = contacts.remove(id);
                if (contact != null) {
                    nameIndex.remove(id, NameTokenizer.tokenize(contact.name()));
                    phoneIndex.remove(ContactKeys.phoneKey(contact.phone()), id);
                    emailIndex.remove(ContactKeys.emailKey(contact.email()), id);
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Deleted {} of {} requested contacts", removed, unique.size());
        return removed;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Each query token is probed in the name index and the hits are unioned</li>
     *   <li>A phone-like query ({@link ContactKeys#isPhoneText(String)}) is probed in the phone index</li>
     *   <li>The email key of the query is probed in the email index</li>
     *   <li>{@link SearchMode#SUBSTRING} additionally scans every live contact: O(n)</li>
     * </ul>
     */
    @Override
    public List<Contact> search(String query) {
        boolean blank = query == null || query.isBlank();
        Set<String> tokens = NameTokenizer.tokenize(query);
        String phoneKey = blank || !ContactKeys.isPhoneText(query) ? "" : ContactKeys.phoneKey(query);
        String emailKey = blank ? "" : ContactKeys.emailKey(query);

        lock.readLock().lock();
        try {
            ensureOpen();
            if (blank) {
                return List.of();
            }

            Set<ContactId> matches = new HashSet<>();
            for (String token : tokens) {
                matches.addAll(nameIndex.lookup(token));
            }
            addOwner(matches, phoneKey.isEmpty() ? null : phoneIndex.ownerOf(phoneKey));
            addOwner(matches, emailIndex.ownerOf(emailKey));

            if (config.searchMode() == SearchMode.SUBSTRING) {
                for (Contact contact : contacts.values()) {
                    if (containsQuery(contact, emailKey, phoneKey)) {
                        matches.add(contact.id());
                    }
                }
            }

            return matches.stream()
                    .map(contacts::get)
                    .sorted(BY_ID)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Contact> findAll() {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<Contact> all = new ArrayList<>(contacts.values());
            all.sort(BY_ID);
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return contacts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        int dropped;

        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            dropped = contacts.size();
            contacts.clear();
            nameIndex.clear();
            phoneIndex.clear();
            emailIndex.clear();
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Contact store closed, {} contacts dropped", dropped);
    }

    /**
     * Cross-checks every index against the primary table.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return descriptions of every violated invariant (empty when consistent)
     */
    public List<String> verifyIndexConsistency() {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<String> violations = new ArrayList<>();

            for (Contact contact : contacts.values()) {
                ContactId id = contact.id();
                for (String token : NameTokenizer.tokenize(contact.name())) {
                    if (!nameIndex.lookup(token).contains(id)) {
                        violations.add(id + " missing from name bucket '" + token + "'");
                    }
                }
                expectOwner(violations, phoneIndex, ContactKeys.phoneKey(contact.phone()), id);
                expectOwner(violations, emailIndex, ContactKeys.emailKey(contact.email()), id);
            }

            for (Map.Entry<String, Set<ContactId>> bucket : nameIndex.asMap().entrySet()) {
                if (bucket.getValue().isEmpty()) {
                    violations.add("empty name bucket '" + bucket.getKey() + "'");
                }
                for (ContactId id : bucket.getValue()) {
                    Contact contact = contacts.get(id);
                    if (contact == null) {
                        violations.add("name bucket '" + bucket.getKey() + "' references missing " + id);
                    } else if (!NameTokenizer.tokenize(contact.name()).contains(bucket.getKey())) {
                        violations.add("name bucket '" + bucket.getKey() + "' holds stale " + id);
                    }
                }
            }

            checkNoStaleKeys(violations, phoneIndex, contact -> ContactKeys.phoneKey(contact.phone()));
            checkNoStaleKeys(violations, emailIndex, contact -> ContactKeys.emailKey(contact.email()));
            return violations;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the number of distinct name tokens currently indexed.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return token bucket count
     */
    public int nameTokenCount() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return nameIndex.tokenCount();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Contact store is closed");
        }
    }

    private static void checkAvailable(UniqueKeyIndex index, String key, ContactId self) {
        ContactId owner = index.ownerOf(key);
        if (owner != null && !owner.equals(self)) {
            throw new ConflictException(index.field(), key, owner);
        }
    }

    private static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw InvalidInputException.forField(field, "Field '" + field + "' must be a non-empty string");
        }
        return value;
    }

    private static String requirePhoneKey(String phone) {
        requireText("phone", phone);
        if (!ContactKeys.isPhoneText(phone)) {
            throw InvalidInputException.forField("phone",
                    "Field 'phone' may only contain digits, '+', '-', '(', ')', '.' and spaces: " + phone);
        }
        String key = ContactKeys.phoneKey(phone);
        if (key.isEmpty()) {
            throw InvalidInputException.forField("phone", "Field 'phone' must contain digits: " + phone);
        }
        return key;
    }

    private static boolean containsQuery(Contact contact, String needle, String phoneKey) {
        return contact.name().toLowerCase(Locale.ROOT).contains(needle)
                || ContactKeys.emailKey(contact.email()).contains(needle)
                || (!phoneKey.isEmpty() && ContactKeys.phoneKey(contact.phone()).contains(phoneKey));
    }

    private static void addOwner(Set<ContactId> matches, ContactId owner) {
        if (owner != null) {
            matches.add(owner);
        }
    }

    private static Set<String> difference(Set<String> left, Set<String> right) {
        Set<String> result = new HashSet<>(left);
        result.removeAll(right);
        return result;
    }

    private static void expectOwner(List<String> violations, UniqueKeyIndex index, String key, ContactId id) {
        ContactId owner = index.ownerOf(key);
        if (!id.equals(owner)) {
            violations.add(id + " does not own " + index.field() + " key '" + key + "' (owner: " + owner + ")");
        }
    }

    private void checkNoStaleKeys(List<String> violations, UniqueKeyIndex index,
                                  Function<Contact, String> keyOf) {
        for (Map.Entry<String, ContactId> entry : index.asMap().entrySet()) {
            Contact contact = contacts.get(entry.getValue());
            if (contact == null) {
                violations.add(index.field() + " key '" + entry.getKey() + "' references missing " + entry.getValue());
            } else if (!keyOf.apply(contact).equals(entry.getKey())) {
                violations.add(index.field() + " key '" + entry.getKey() + "' is stale for " + entry.getValue());
            }
        }
    }
}
