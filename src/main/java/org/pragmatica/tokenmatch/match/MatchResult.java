package org.pragmatica.tokenmatch.match;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.tokenmatch.tree.Token;
import org.pragmatica.tokenmatch.tree.Tokens;

import java.util.List;

/**
 * Result of a match attempt: the consumed prefix and the untouched remainder.
 *
 * <p>{@code matched ++ unmatched} always reproduces the input given to the attempt.
 * A failed attempt is {@link #fromUnmatched(List)}: nothing matched, whole input left.
 */
public record MatchResult(ImmutableList<Token> matched, ImmutableList<Token> unmatched) {

    public MatchResult {
        Preconditions.checkNotNull(matched, "matched");
        Preconditions.checkNotNull(unmatched, "unmatched");
    }

    private static final MatchResult EMPTY = new MatchResult(ImmutableList.of(), ImmutableList.of());

    public static MatchResult of(List<? extends Token> matched, List<? extends Token> unmatched) {
        return new MatchResult(ImmutableList.copyOf(matched), ImmutableList.copyOf(unmatched));
    }

    /**
     * Failure over the given input.
     */
    public static MatchResult fromUnmatched(List<? extends Token> tokens) {
        return new MatchResult(ImmutableList.of(), ImmutableList.copyOf(tokens));
    }

    /**
     * Complete match of the given tokens.
     */
    public static MatchResult fromMatched(List<? extends Token> tokens) {
        return new MatchResult(ImmutableList.copyOf(tokens), ImmutableList.of());
    }

    public static MatchResult fromEmpty() {
        return EMPTY;
    }

    /**
     * True when nothing is left unconsumed.
     */
    public boolean isComplete() {
        return unmatched.isEmpty();
    }

    /**
     * True when at least one token was consumed.
     */
    public boolean hasMatch() {
        return !matched.isEmpty();
    }

    /**
     * Length of the match in leaf tokens; the measure used to pick the longest match.
     */
    public int matchedLength() {
        return Tokens.leafCount(matched);
    }

    /**
     * The input this result was produced from.
     */
    public ImmutableList<Token> input() {
        return Tokens.concat(matched, unmatched);
    }

    // === Combination ===

    /**
     * Left-to-right combination: matched tokens of both, remainder of {@code next}.
     */
    public MatchResult then(MatchResult next) {
        return new MatchResult(Tokens.concat(matched, next.matched), next.unmatched);
    }

    /**
     * Same result with tokens consumed ahead of it, e.g. a skipped gap.
     */
    public MatchResult withPrefix(List<? extends Token> prefix) {
        if (prefix.isEmpty()) {
            return this;
        }
        return new MatchResult(Tokens.concat(prefix, matched), unmatched);
    }

    @Override
    public String toString() {
        return "MatchResult[matched=" + matched + ", unmatched=" + unmatched + "]";
    }
}
