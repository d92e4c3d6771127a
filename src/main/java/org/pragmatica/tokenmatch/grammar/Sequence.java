package org.pragmatica.tokenmatch.grammar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.tokenmatch.match.MatchContext;
import org.pragmatica.tokenmatch.match.MatchResult;
import org.pragmatica.tokenmatch.tree.Token;
import org.pragmatica.tokenmatch.tree.Tokens;

import java.util.Arrays;
import java.util.List;

/**
 * Matches its elements one after another. Optional elements that do not match are
 * skipped; a required element that does not match fails the whole sequence.
 */
public final class Sequence implements Matchable {
    private final ImmutableList<Matchable> elements;
    private final boolean allowGaps;
    private final boolean optional;

    private Sequence(List<? extends Matchable> elements, boolean allowGaps, boolean optional) {
        Preconditions.checkArgument(!elements.isEmpty(), "at least one element is required");
        this.elements = ImmutableList.copyOf(elements);
        this.allowGaps = allowGaps;
        this.optional = optional;
    }

    public static Sequence of(Matchable... elements) {
        return new Sequence(Arrays.asList(elements), true, false);
    }

    public static Sequence of(List<? extends Matchable> elements) {
        return new Sequence(elements, true, false);
    }

    /**
     * Same elements, with trivia between them left unconsumed.
     */
    public Sequence withoutGaps() {
        return new Sequence(elements, false, optional);
    }

    public Sequence asOptional() {
        return new Sequence(elements, allowGaps, true);
    }

    @Override
    public MatchResult match(List<Token> tokens, MatchContext ctx) {
        var accumulated = MatchResult.fromUnmatched(tokens);
        boolean matchedAny = false;

        for (var element : elements) {
            var unmatched = accumulated.unmatched();
            List<Token> gap = List.of();
            List<Token> rest = unmatched;
            if (matchedAny && allowGaps) {
                int gapLength = Tokens.leadingTrivia(unmatched);
                gap = unmatched.subList(0, gapLength);
                rest = unmatched.subList(gapLength, unmatched.size());
            }

            MatchResult result;
            try (var child = ctx.deeper()) {
                result = element.match(rest, child);
            }

            if (result.hasMatch()) {
                accumulated = accumulated.then(result.withPrefix(gap));
                matchedAny = true;
            } else if (!element.isOptional()) {
                return MatchResult.fromUnmatched(tokens);
            }
        }
        return accumulated;
    }

    /**
     * Candidates of the leading optional elements plus the first required one.
     */
    @Override
    public Lookahead lookahead(MatchContext ctx) {
        var candidates = Lookahead.of();
        for (var element : elements) {
            if (!(element.lookahead(ctx) instanceof Lookahead.Candidates elementCandidates)) {
                return Lookahead.unsupported();
            }
            candidates = candidates.union(elementCandidates);
            if (!element.isOptional()) {
                return candidates;
            }
        }
        // All elements optional: may match nothing, so no first token can be promised
        return Lookahead.unsupported();
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    @Override
    public List<Matchable> elements() {
        return elements;
    }

    @Override
    public String toString() {
        return "Sequence" + elements;
    }
}
