package com.ryuqq.addressbook.core.key;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits names and search queries into lowercase word tokens.
 *
 * <p>The same rule feeds the name token index and query tokenization, so a query word
 * matches a name exactly when both produce the same token. There is no minimum token
 * length and no stop-word list. Any Unicode white space separates tokens, including
 * {@code U+00A0} and {@code U+3000}.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public final class NameTokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private NameTokenizer() {
    }

    /**
     * Tokenizes text.
     *
     * @param text name or query (null is treated as empty)
     * @return distinct tokens in order of first appearance (never null, unmodifiable)
     */
    public static Set<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptySet();
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String piece : WHITESPACE.split(text.trim().toLowerCase(Locale.ROOT))) {
            if (!piece.isEmpty()) {
                tokens.add(piece);
            }
        }
        return Collections.unmodifiableSet(tokens);
    }
}
