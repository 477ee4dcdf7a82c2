package com.ryuqq.addressbook.testkit.contract;

import com.ryuqq.addressbook.core.model.Contact;
import com.ryuqq.addressbook.core.model.ContactPatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for search.
 *
 * <p>Every query here gives the same answer whether phones and emails are matched exactly
 * or by substring, so any {@code ContactStore} search policy must pass.</p>
 *
 * <p><strong>Fixture:</strong> Alice Smith, Bob Jones, Charlie Smith (created in that order).</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public abstract class AbstractSearchContractTest extends AbstractContactStoreContractTest {

    protected Contact alice;
    protected Contact bob;
    protected Contact charlie;

    @BeforeEach
    void setUpContacts() {
        alice = createContact("Alice Smith", "555-123-4567", "alice@example.com");
        bob = createContact("Bob Jones", "555-987-6543", "bob@example.com");
        charlie = createContact("Charlie Smith", "555-555-0000", "charlie@example.com");
    }

    @Test
    void testSearch_SharedSurname_ReturnsBothOrderedById() {
        assertEquals(List.of(alice.id(), charlie.id()), idsOf(store.search("Smith")));
    }

    @Test
    void testSearch_IsCaseInsensitive() {
        assertEquals(List.of(bob.id()), idsOf(store.search("bob")));
        assertEquals(List.of(bob.id()), idsOf(store.search("BOB")));
        assertEquals(List.of(alice.id(), charlie.id()), idsOf(store.search("sMiTh")));
    }

    @Test
    void testSearch_EmptyOrBlankQuery_MatchesNothing() {
        assertTrue(store.search("").isEmpty());
        assertTrue(store.search("   ").isEmpty());
        assertTrue(store.search(null).isEmpty());
    }

    @Test
    void testSearch_UnknownWord_MatchesNothing() {
        assertTrue(store.search("nonexistent").isEmpty());
    }

    @Test
    void testSearch_MultipleTokens_ReturnsUnion() {
        assertEquals(List.of(alice.id(), bob.id()), idsOf(store.search("alice jones")));
    }

    @Test
    void testSearch_ExactPhone_FindsOwner() {
        assertEquals(List.of(bob.id()), idsOf(store.search("555-987-6543")));
        assertEquals(List.of(bob.id()), idsOf(store.search("(555) 987-6543")));
    }

    @Test
    void testSearch_ExactEmail_FindsOwnerIgnoringCase() {
        assertEquals(List.of(charlie.id()), idsOf(store.search("Charlie@Example.com")));
    }

    @Test
    void testSearch_ReturnsCurrentFieldValues() {
        List<Contact> results = store.search("alice");

        assertEquals(List.of(alice), results);
    }

    @Test
    void testSearch_SingleCharacterToken_MatchesByIndexLookup() {
        // Given
        Contact tolkien = createContact("Q X Tolkien", "555-111-2222", "tolkien@example.org");

        // When & Then
        assertEquals(List.of(tolkien.id()), idsOf(store.search("q")));
    }

    @Test
    void testSearch_NameSplitByUnicodeSpace_MatchesEachWord() {
        // Given
        Contact dana = createContact("Dana\u3000Smith", "555-222-3333", "dana@example.net");
        Contact eve = createContact("Eve\u00A0Park", "555-444-5555", "eve@example.net");

        // When & Then
        assertEquals(List.of(alice.id(), charlie.id(), dana.id()), idsOf(store.search("smith")));
        assertEquals(List.of(dana.id()), idsOf(store.search("dana")));
        assertEquals(List.of(eve.id()), idsOf(store.search("park")));
        assertSearchableConsistently();
    }

    @Test
    void testSearch_AfterRename_FollowsNewName() {
        // When
        store.update(charlie.id(), ContactPatch.empty().withName("Charlie Brown"));

        // Then
        assertEquals(List.of(alice.id()), idsOf(store.search("smith")));
        assertEquals(List.of(charlie.id()), idsOf(store.search("brown")));
        assertEquals(List.of(charlie.id()), idsOf(store.search("charlie")));
    }

    @Test
    void testSearch_AfterDelete_ExcludesDeleted() {
        // When
        store.delete(List.of(alice.id()));

        // Then
        assertEquals(List.of(charlie.id()), idsOf(store.search("smith")));
        assertTrue(store.search("alice").isEmpty());
        assertTrue(store.search("555-123-4567").isEmpty());
    }

    @Test
    void testSearch_EveryContactReachableByItsKeys() {
        assertSearchableConsistently();
    }
}
