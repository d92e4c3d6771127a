package org.pragmatica.tokenmatch.grammar;

import com.google.common.base.Preconditions;
import org.pragmatica.tokenmatch.match.MatchContext;
import org.pragmatica.tokenmatch.match.MatchResult;
import org.pragmatica.tokenmatch.tree.Token;

import java.util.List;
import java.util.Locale;

/**
 * Terminal matching a single leaf token by its text, ignoring case.
 * Composite tokens are never matched by a keyword.
 */
public final class Keyword implements Matchable {
    private final String template;
    private final boolean optional;

    private Keyword(String template, boolean optional) {
        this.template = template;
        this.optional = optional;
    }

    public static Keyword of(String text) {
        Preconditions.checkNotNull(text, "text");
        Preconditions.checkArgument(!text.isEmpty(), "keyword text must not be empty");
        return new Keyword(text.toUpperCase(Locale.ROOT), false);
    }

    public Keyword asOptional() {
        return new Keyword(template, true);
    }

    @Override
    public MatchResult match(List<Token> tokens, MatchContext ctx) {
        if (tokens.isEmpty()) {
            return MatchResult.fromUnmatched(tokens);
        }
        var first = tokens.get(0);
        if (first instanceof Token.Raw && first.rawUpper().equals(template)) {
            return MatchResult.of(tokens.subList(0, 1), tokens.subList(1, tokens.size()));
        }
        return MatchResult.fromUnmatched(tokens);
    }

    @Override
    public Lookahead lookahead(MatchContext ctx) {
        return Lookahead.of(template);
    }

    @Override
    public boolean isOptional() {
        return optional;
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return "Keyword('" + template + "')";
    }
}
