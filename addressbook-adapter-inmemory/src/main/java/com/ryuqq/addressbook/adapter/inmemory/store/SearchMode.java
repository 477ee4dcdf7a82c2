package com.ryuqq.addressbook.adapter.inmemory.store;

/**
 * How {@link InMemoryContactStore#search(String)} matches phones and emails.
 *
 * <p>Name tokens are always matched through the token index. The mode only decides what
 * happens beyond that, and with it the cost class of a search.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public enum SearchMode {

    /**
     * Token lookups plus exact O(1) probes of the phone and email indexes.
     * Cost: O(t + k) for t query tokens and k matched contacts.
     */
    INDEXED,

    /**
     * Everything {@link #INDEXED} does, plus a scan of every live contact matching
     * the query as a substring of the lowercase name, the email key, or the phone key.
     * Cost: O(n) in the number of live contacts.
     */
    SUBSTRING
}
