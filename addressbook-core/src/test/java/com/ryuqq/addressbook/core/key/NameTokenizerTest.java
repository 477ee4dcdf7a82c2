package com.ryuqq.addressbook.core.key;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NameTokenizerTest {

    @Test
    void tokenize_SplitsOnWhitespaceAndLowercases() {
        assertThat(NameTokenizer.tokenize("Alice  Smith\tJr"))
            .containsExactly("alice", "smith", "jr");
    }

    @Test
    void tokenize_SplitsOnUnicodeWhitespace() {
        assertThat(NameTokenizer.tokenize("Alice\u3000Smith")).containsExactly("alice", "smith");
        assertThat(NameTokenizer.tokenize("Alice\u00A0Smith")).containsExactly("alice", "smith");
        assertThat(NameTokenizer.tokenize("\u3000Bob\u2003Jones\u00A0")).containsExactly("bob", "jones");
    }

    @Test
    void tokenize_CollapsesDuplicates() {
        assertThat(NameTokenizer.tokenize("Smith smith SMITH")).containsExactly("smith");
    }

    @Test
    void tokenize_BlankOrNull_ReturnsEmpty() {
        assertThat(NameTokenizer.tokenize("")).isEmpty();
        assertThat(NameTokenizer.tokenize("   ")).isEmpty();
        assertThat(NameTokenizer.tokenize(null)).isEmpty();
    }

    @Test
    void tokenize_SingleCharacterTokenIsKept() {
        assertThat(NameTokenizer.tokenize("J R Tolkien")).containsExactly("j", "r", "tolkien");
    }

    @Test
    void tokenize_ResultIsUnmodifiable() {
        assertThatThrownBy(() -> NameTokenizer.tokenize("Alice").add("bob"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
