package org.pragmatica.tokenmatch.grammar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LookaheadTest {

    @Test
    void of_upperCasesCandidates() {
        assertThat(Lookahead.of("select", "With").values()).containsExactly("SELECT", "WITH");
        assertThat(Lookahead.of().values()).isEmpty();
    }

    @Test
    void union_keepsFirstSeenOrderWithoutDuplicates() {
        var union = Lookahead.of("a", "b").union(Lookahead.of("b", "c"));

        assertThat(union.values()).containsExactly("A", "B", "C");
    }

    @Test
    void union_withEmpty_isIdentity() {
        var candidates = Lookahead.of("a");

        assertEquals(candidates, Lookahead.of().union(candidates));
    }

    @Test
    void isTrivia_detectsBlankCandidates() {
        assertTrue(Lookahead.isTrivia(" "));
        assertTrue(Lookahead.isTrivia("\n"));
        assertFalse(Lookahead.isTrivia("A"));
        assertFalse(Lookahead.unsupported().isSupported());
    }
}
