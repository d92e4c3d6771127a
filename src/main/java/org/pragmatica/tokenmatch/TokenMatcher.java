package org.pragmatica.tokenmatch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.tokenmatch.error.GrammarError;
import org.pragmatica.tokenmatch.error.InvalidGrammarException;
import org.pragmatica.tokenmatch.grammar.Grammar;
import org.pragmatica.tokenmatch.grammar.Matchable;
import org.pragmatica.tokenmatch.match.MatchContext;
import org.pragmatica.tokenmatch.match.MatchResult;
import org.pragmatica.tokenmatch.match.MatcherConfig;
import org.pragmatica.tokenmatch.tree.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point for matching token sequences against a grammar.
 *
 * <p>Example usage:
 * <pre>{@code
 * var matcher = TokenMatcher.create(grammar(
 *     rule("verb", oneOf(keyword("select"), keyword("insert")))));
 *
 * var result = matcher.match(Tokens.of("select", " ", "insert"));
 * }</pre>
 *
 * <p>Instances are immutable; every call runs in its own root context.
 */
public final class TokenMatcher {
    private static final Logger log = LoggerFactory.getLogger(TokenMatcher.class);

    private final Grammar grammar;
    private final MatcherConfig config;

    private TokenMatcher(Grammar grammar, MatcherConfig config) {
        this.grammar = grammar;
        this.config = config;
    }

    /**
     * Create a matcher for a grammar with default configuration.
     *
     * @throws InvalidGrammarException if the grammar does not validate
     */
    public static TokenMatcher create(Grammar grammar) {
        return create(grammar, MatcherConfig.DEFAULT);
    }

    /**
     * Create a matcher for a grammar with custom configuration.
     *
     * @throws InvalidGrammarException if the grammar does not validate
     */
    public static TokenMatcher create(Grammar grammar, MatcherConfig config) {
        Preconditions.checkNotNull(grammar, "grammar");
        Preconditions.checkNotNull(config, "config");
        return new TokenMatcher(grammar.validated(), config);
    }

    /**
     * Match against the effective start rule.
     */
    public MatchResult match(List<? extends Token> tokens) {
        var startRule = grammar.effectiveStartRule()
                               .orElseThrow(() -> new InvalidGrammarException(new GrammarError.NoStartRule()));
        return match(tokens, startRule.name());
    }

    /**
     * Match against a named rule.
     */
    public MatchResult match(List<? extends Token> tokens, String ruleName) {
        var rule = grammar.rule(ruleName)
                          .orElseThrow(() -> new InvalidGrammarException(new GrammarError.UnknownRule(ruleName)));
        log.debug("Matching {} token(s) against rule '{}'", tokens.size(), ruleName);

        MatchResult result;
        try (var ctx = MatchContext.root(grammar, config);
             var child = ctx.deeper(ruleName)) {
            result = rule.matchable()
                         .match(ImmutableList.copyOf(tokens), child);
        }
        log.debug("Rule '{}' matched {} of {} token(s)", ruleName, result.matched().size(), tokens.size());
        return result;
    }

    /**
     * Match against an ad-hoc grammar element whose references resolve in this grammar.
     */
    public MatchResult match(List<? extends Token> tokens, Matchable matchable) {
        try (var ctx = MatchContext.root(grammar, config)) {
            return matchable.match(ImmutableList.copyOf(tokens), ctx);
        }
    }

    public MatcherConfig config() {
        return config;
    }

    /**
     * Create a builder for more complex matcher configuration.
     */
    public static Builder builder(Grammar grammar) {
        return new Builder(grammar);
    }

    public static final class Builder {
        private final Grammar grammar;
        private boolean pruningEnabled = true;
        private int maxDepth = MatcherConfig.DEFAULT_MAX_DEPTH;

        private Builder(Grammar grammar) {
            this.grammar = grammar;
        }

        public Builder pruning(boolean enabled) {
            this.pruningEnabled = enabled;
            return this;
        }

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public TokenMatcher build() {
            var config = new MatcherConfig(pruningEnabled, maxDepth);
            return create(grammar, config);
        }
    }
}
