package org.pragmatica.tokenmatch.grammar;

import com.google.common.base.Preconditions;
import org.pragmatica.tokenmatch.error.GrammarError;
import org.pragmatica.tokenmatch.error.InvalidGrammarException;
import org.pragmatica.tokenmatch.match.MatchContext;
import org.pragmatica.tokenmatch.match.MatchResult;
import org.pragmatica.tokenmatch.tree.Token;

import java.util.List;

/**
 * Reference to a named rule, resolved against the context's grammar when matched.
 */
public final class Ref implements Matchable {
    private final String ruleName;
    private final boolean optional;

    private Ref(String ruleName, boolean optional) {
        this.ruleName = ruleName;
        this.optional = optional;
    }

    public static Ref to(String ruleName) {
        Preconditions.checkNotNull(ruleName, "ruleName");
        return new Ref(ruleName, false);
    }

    public Ref asOptional() {
        return new Ref(ruleName, true);
    }

    @Override
    public MatchResult match(List<Token> tokens, MatchContext ctx) {
        var target = resolve(ctx);
        try (var child = ctx.deeper(ruleName)) {
            return target.match(tokens, child);
        }
    }

    /**
     * Lookahead of the referenced rule. A rule that is already being resolved
     * reports unsupported instead of recursing.
     */
    @Override
    public Lookahead lookahead(MatchContext ctx) {
        if (ctx.onTrail(ruleName)) {
            return Lookahead.unsupported();
        }
        var target = resolve(ctx);
        try (var child = ctx.deeper(ruleName)) {
            return target.lookahead(child);
        }
    }

    private Matchable resolve(MatchContext ctx) {
        return ctx.resolve(ruleName)
                  .orElseThrow(() -> new InvalidGrammarException(new GrammarError.UnknownRule(ruleName)));
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    public String ruleName() {
        return ruleName;
    }

    @Override
    public String toString() {
        return "Ref(" + ruleName + ")";
    }
}
