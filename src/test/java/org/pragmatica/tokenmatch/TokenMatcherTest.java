package org.pragmatica.tokenmatch;

import org.junit.jupiter.api.Test;
import org.pragmatica.tokenmatch.error.GrammarError;
import org.pragmatica.tokenmatch.error.InvalidGrammarException;
import org.pragmatica.tokenmatch.error.RecursionLimitException;
import org.pragmatica.tokenmatch.grammar.Grammar;
import org.pragmatica.tokenmatch.tree.Token;
import org.pragmatica.tokenmatch.tree.Tokens;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.tokenmatch.grammar.Grammars.anyNumberOf;
import static org.pragmatica.tokenmatch.grammar.Grammars.grammar;
import static org.pragmatica.tokenmatch.grammar.Grammars.keyword;
import static org.pragmatica.tokenmatch.grammar.Grammars.oneOf;
import static org.pragmatica.tokenmatch.grammar.Grammars.ref;
import static org.pragmatica.tokenmatch.grammar.Grammars.repeat;
import static org.pragmatica.tokenmatch.grammar.Grammars.rule;
import static org.pragmatica.tokenmatch.grammar.Grammars.sequence;

class TokenMatcherTest {

    private static final Grammar STATEMENTS = grammar(
        rule("statements", repeat(ref("statement"), keyword(";")).minTimes(1).build()),
        rule("statement", oneOf(ref("select"), ref("insert"))),
        rule("select", sequence(keyword("select"), ref("columns"), ref("from").asOptional())),
        rule("columns", repeat(keyword("a"), keyword("b"), keyword(",")).minTimes(1)
                                                                     .exclude(keyword("from"))
                                                                     .build()),
        rule("from", sequence(keyword("from"), keyword("t"))),
        rule("insert", sequence(keyword("insert"), keyword("into"), keyword("t"))));

    @Test
    void match_startRule_consumesWholeScript() {
        var matcher = TokenMatcher.create(STATEMENTS);
        var input = Tokens.of("select", " ", "a", ",", " ", "b", " ", "from", " ", "t", ";", "\n",
                              "insert", " ", "into", " ", "t", ";");

        var result = matcher.match(input);

        assertTrue(result.isComplete());
        assertEquals(input, result.matched());
    }

    @Test
    void match_namedRule_leavesRemainder() {
        var matcher = TokenMatcher.create(STATEMENTS);
        var input = Tokens.of("insert", " ", "into", " ", "t", ";");

        var result = matcher.match(input, "statement");

        assertThat(result.matched()).hasSize(5);
        assertThat(result.unmatched()).extracting(Token::raw)
                                      .containsExactly(";");
    }

    @Test
    void match_unmatchableInput_returnsInputUnmatched() {
        var matcher = TokenMatcher.create(STATEMENTS);
        var input = Tokens.of("delete", " ", "t");

        var result = matcher.match(input);

        assertFalse(result.hasMatch());
        assertEquals(input, result.unmatched());
    }

    @Test
    void match_sameInputTwice_isDeterministic() {
        var matcher = TokenMatcher.create(STATEMENTS);
        var input = Tokens.of("select", " ", "b", " ", "a", ";", "select", " ", "a");

        assertEquals(matcher.match(input), matcher.match(input));
    }

    @Test
    void match_withAndWithoutPruning_agree() {
        var pruning = TokenMatcher.create(STATEMENTS);
        var exhaustive = TokenMatcher.builder(STATEMENTS)
                                     .pruning(false)
                                     .build();
        var input = Tokens.of("select", " ", "a", " ", "from", " ", "t", ";", "insert", " ", "x");

        assertEquals(pruning.match(input), exhaustive.match(input));
    }

    @Test
    void match_adHocMatchable_resolvesAgainstGrammar() {
        var matcher = TokenMatcher.create(STATEMENTS);
        var input = Tokens.of("from", " ", "t", " ", "insert");

        var result = matcher.match(input, anyNumberOf(ref("from"), keyword("insert")));

        assertTrue(result.isComplete());
    }

    @Test
    void match_compositeTokens_areKeptIntact() {
        var matcher = TokenMatcher.create(grammar(rule("any", anyNumberOf(keyword("a"), keyword("b")))));
        var composite = Token.composite("already_parsed", Token.code("b"));
        var input = List.<Token>of(Token.code("a"), composite);

        var result = matcher.match(input);

        assertThat(result.matched()).containsExactly(input.get(0));
        assertThat(result.unmatched()).containsExactly(composite);
    }

    // === Errors ===

    @Test
    void create_invalidGrammar_throws() {
        var invalid = grammar(rule("a", ref("b")));

        var error = assertThrows(InvalidGrammarException.class, () -> TokenMatcher.create(invalid));

        assertThat(error.errors()).containsExactly(new GrammarError.UndefinedReference("b", "a"));
    }

    @Test
    void match_unknownRule_throws() {
        var matcher = TokenMatcher.create(STATEMENTS);

        var error = assertThrows(InvalidGrammarException.class, () -> matcher.match(Tokens.of("a"), "update"));

        assertThat(error.errors()).containsExactly(new GrammarError.UnknownRule("update"));
    }

    @Test
    void match_emptyGrammar_hasNoStartRule() {
        var matcher = TokenMatcher.create(Grammar.empty());

        var error = assertThrows(InvalidGrammarException.class, () -> matcher.match(Tokens.of("a")));

        assertThat(error.errors()).containsExactly(new GrammarError.NoStartRule());
    }

    @Test
    void builder_maxDepth_limitsRecursion() {
        var matcher = TokenMatcher.builder(grammar(rule("expr", sequence(ref("expr"), keyword("a")))))
                                  .maxDepth(16)
                                  .build();

        assertThrows(RecursionLimitException.class, () -> matcher.match(Tokens.of("a")));
        assertEquals(16, matcher.config().maxDepth());
    }
}
