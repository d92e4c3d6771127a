package org.pragmatica.tokenmatch.grammar;

import com.google.common.collect.ImmutableList;
import org.pragmatica.tokenmatch.error.LookaheadInvariantException;
import org.pragmatica.tokenmatch.match.MatchContext;
import org.pragmatica.tokenmatch.tree.Token;
import org.pragmatica.tokenmatch.tree.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops alternatives whose lookahead proves they cannot match at the current position.
 *
 * <p>Alternatives without a lookahead set are always kept. An alternative with one is
 * kept when any of its candidates occurs in the flattened input and, unless the
 * candidate is trivia, is the first code string of that input.
 */
final class LookaheadPruner {
    private static final Logger log = LoggerFactory.getLogger(LookaheadPruner.class);

    private LookaheadPruner() {}

    /**
     * Alternatives that still need a full match attempt, in declaration order.
     */
    static ImmutableList<Matchable> prune(List<Token> tokens, List<? extends Matchable> options, MatchContext ctx) {
        var leaves = Tokens.rawUpperLeaves(tokens);
        var available = ImmutableList.<Matchable>builder();
        var pruned = new ArrayList<Matchable>();
        int nonSimple = 0;
        int matchedSimple = 0;

        for (var option : options) {
            var lookahead = option.lookahead(ctx);
            if (!(lookahead instanceof Lookahead.Candidates candidates)) {
                available.add(option);
                nonSimple++;
                continue;
            }
            if (anyAnchored(candidates, leaves)) {
                available.add(option);
                matchedSimple++;
            } else {
                pruned.add(option);
            }
        }

        var result = available.build();
        log.trace("Pruned options at depth {}: non-simple={}, pruned={}, matched={}, dropped={}",
                  ctx.depth(), nonSimple, pruned.size(), matchedSimple, pruned);
        return result;
    }

    private static boolean anyAnchored(Lookahead.Candidates candidates, List<String> leaves) {
        for (var candidate : candidates.values()) {
            if (anchored(candidate, leaves)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anchored(String candidate, List<String> leaves) {
        if (!leaves.contains(candidate)) {
            return false;
        }
        if (Lookahead.isTrivia(candidate)) {
            return true;
        }
        return candidate.equals(firstCode(leaves, candidate));
    }

    static String firstCode(List<String> leaves, String candidate) {
        for (var leaf : leaves) {
            if (!Lookahead.isTrivia(leaf)) {
                return leaf;
            }
        }
        throw new LookaheadInvariantException(candidate);
    }
}
