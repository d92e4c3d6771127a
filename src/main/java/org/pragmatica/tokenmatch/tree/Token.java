package org.pragmatica.tokenmatch.tree;

import com.google.common.base.Preconditions;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;

/**
 * Unit of input consumed by matchers. Either a leaf produced by the lexer or a
 * composite already recognized by an earlier pass.
 */
public sealed interface Token {

    /**
     * Source text covered by this token.
     */
    String raw();

    /**
     * Upper-cased raw text, used for case-insensitive comparison.
     */
    default String rawUpper() {
        return raw().toUpperCase(Locale.ROOT);
    }

    /**
     * Whether this token carries grammatical meaning (i.e. is not trivia).
     */
    boolean isCode();

    default boolean isTrivia() {
        return !isCode();
    }

    /**
     * Leaf tokens in document order. The traversal is lazy and may be restarted.
     */
    Iterable<Raw> leaves();

    // === Factories ===

    static Raw code(String raw) {
        return new Raw(TokenKind.CODE, raw);
    }

    static Raw whitespace(String raw) {
        return new Raw(TokenKind.WHITESPACE, raw);
    }

    static Raw newline() {
        return new Raw(TokenKind.NEWLINE, "\n");
    }

    static Raw comment(String raw) {
        return new Raw(TokenKind.COMMENT, raw);
    }

    static Composite composite(String type, Token... children) {
        return new Composite(type, ImmutableList.copyOf(children));
    }

    static Composite composite(String type, List<? extends Token> children) {
        return new Composite(type, ImmutableList.copyOf(children));
    }

    /**
     * Leaf token as produced by the lexer.
     */
    record Raw(TokenKind kind, String raw) implements Token {
        public Raw {
            Preconditions.checkNotNull(kind, "kind");
            Preconditions.checkNotNull(raw, "raw");
        }

        @Override
        public boolean isCode() {
            return kind.isCode();
        }

        @Override
        public Iterable<Raw> leaves() {
            return ImmutableList.of(this);
        }

        @Override
        public String toString() {
            return kind + "('" + raw + "')";
        }
    }

    /**
     * Token with nested children, e.g. a sub-structure recognized by a prior pass.
     */
    record Composite(String type, ImmutableList<Token> children) implements Token {
        public Composite {
            Preconditions.checkNotNull(type, "type");
            Preconditions.checkNotNull(children, "children");
        }

        @Override
        public String raw() {
            var builder = new StringBuilder();
            for (var leaf : leaves()) {
                builder.append(leaf.raw());
            }
            return builder.toString();
        }

        @Override
        public boolean isCode() {
            return children.stream()
                           .anyMatch(Token::isCode);
        }

        @Override
        public Iterable<Raw> leaves() {
            return FluentIterable.from(children)
                                 .transformAndConcat(Token::leaves);
        }

        @Override
        public String toString() {
            return type + children;
        }
    }
}
