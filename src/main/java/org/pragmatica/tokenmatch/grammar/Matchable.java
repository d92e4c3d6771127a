package org.pragmatica.tokenmatch.grammar;

import org.pragmatica.tokenmatch.match.MatchContext;
import org.pragmatica.tokenmatch.match.MatchResult;
import org.pragmatica.tokenmatch.tree.Token;

import java.util.List;

/**
 * Anything a token sequence can be matched against: terminals, rule references
 * and combinators. Implementations are immutable.
 */
public interface Matchable {

    /**
     * Match the start of {@code tokens}. A failed match is
     * {@link MatchResult#fromUnmatched(List)}, never an exception.
     */
    MatchResult match(List<Token> tokens, MatchContext ctx);

    /**
     * Upper-cased strings any successful match could start with, or
     * {@link Lookahead#unsupported()} when no such cheap check exists.
     */
    default Lookahead lookahead(MatchContext ctx) {
        return Lookahead.unsupported();
    }

    /**
     * Whether absence of a match is acceptable to an enclosing grammar.
     */
    boolean isOptional();

    /**
     * Direct sub-grammars, in declaration order.
     */
    default List<Matchable> elements() {
        return List.of();
    }
}
