package org.pragmatica.tokenmatch.tree;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import java.util.List;

/**
 * Helpers over token sequences.
 */
public final class Tokens {
    private Tokens() {}

    /**
     * Build a sequence of leaf tokens from raw strings. Blank strings become
     * whitespace (or a newline for "\n"), everything else becomes code.
     */
    public static ImmutableList<Token> of(String... raws) {
        var builder = ImmutableList.<Token>builder();
        for (var raw : raws) {
            builder.add(classify(raw));
        }
        return builder.build();
    }

    private static Token.Raw classify(String raw) {
        if (raw.equals("\n")) {
            return Token.newline();
        }
        return raw.isBlank()
               ? Token.whitespace(raw)
               : Token.code(raw);
    }

    /**
     * Upper-cased raw text of every leaf, composites expanded, in document order.
     */
    public static ImmutableList<String> rawUpperLeaves(List<? extends Token> tokens) {
        var builder = ImmutableList.<String>builder();
        for (var token : tokens) {
            for (var leaf : token.leaves()) {
                builder.add(leaf.rawUpper());
            }
        }
        return builder.build();
    }

    /**
     * Number of leaf tokens in the sequence.
     */
    public static int leafCount(List<? extends Token> tokens) {
        int count = 0;
        for (var token : tokens) {
            count += Iterables.size(token.leaves());
        }
        return count;
    }

    /**
     * Length of the leading run of trivia tokens.
     */
    public static int leadingTrivia(List<? extends Token> tokens) {
        int index = 0;
        while (index < tokens.size() && tokens.get(index).isTrivia()) {
            index++;
        }
        return index;
    }

    /**
     * Concatenate two sequences preserving order.
     */
    public static ImmutableList<Token> concat(List<? extends Token> first, List<? extends Token> second) {
        return ImmutableList.<Token>builderWithExpectedSize(first.size() + second.size())
                            .addAll(first)
                            .addAll(second)
                            .build();
    }
}
