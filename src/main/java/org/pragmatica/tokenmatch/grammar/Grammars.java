package org.pragmatica.tokenmatch.grammar;

import java.util.Arrays;

/**
 * Shorthand for building grammars in code.
 *
 * <p>Example usage:
 * <pre>{@code
 * var grammar = grammar(
 *     rule("statement", oneOf(ref("select"), ref("insert"))),
 *     rule("select", sequence(keyword("select"), anyNumberOf(keyword("a"), keyword("b")))),
 *     rule("insert", sequence(keyword("insert"), keyword("into"))));
 * }</pre>
 */
public final class Grammars {
    private Grammars() {}

    public static Keyword keyword(String text) {
        return Keyword.of(text);
    }

    public static Sequence sequence(Matchable... elements) {
        return Sequence.of(elements);
    }

    public static Ref ref(String ruleName) {
        return Ref.to(ruleName);
    }

    public static OneOf oneOf(Matchable... options) {
        return OneOf.of(options);
    }

    /**
     * Zero or more repetitions of any of the options, gaps allowed.
     */
    public static AnyNumberOf anyNumberOf(Matchable... options) {
        return AnyNumberOf.builder(options)
                          .build();
    }

    public static AnyNumberOf.Builder repeat(Matchable... options) {
        return AnyNumberOf.builder(options);
    }

    public static Rule rule(String name, Matchable matchable) {
        return new Rule(name, matchable);
    }

    public static Grammar grammar(Rule... rules) {
        return Grammar.of(Arrays.asList(rules));
    }
}
