package org.pragmatica.tokenmatch.match;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.tokenmatch.error.RecursionLimitException;
import org.pragmatica.tokenmatch.grammar.Grammar;
import org.pragmatica.tokenmatch.grammar.Matchable;
import org.pragmatica.tokenmatch.grammar.Rule;

import java.util.Optional;

/**
 * Scoped context of one match attempt.
 *
 * <p>Nested attempts run in a child obtained from {@link #deeper()} and released
 * with try-with-resources:
 * <pre>{@code
 * try (var child = ctx.deeper()) {
 *     result = alternative.match(tokens, child);
 * }
 * }</pre>
 * The context only tracks depth and the trail of rules being resolved; nothing
 * written by a nested attempt is visible to its caller.
 */
public final class MatchContext implements AutoCloseable {

    private final Grammar grammar;
    private final MatcherConfig config;
    private final int depth;
    private final ImmutableList<String> crumbs;

    private boolean released;

    private MatchContext(Grammar grammar, MatcherConfig config, int depth, ImmutableList<String> crumbs) {
        this.grammar = grammar;
        this.config = config;
        this.depth = depth;
        this.crumbs = crumbs;
    }

    public static MatchContext root(Grammar grammar, MatcherConfig config) {
        Preconditions.checkNotNull(grammar, "grammar");
        Preconditions.checkNotNull(config, "config");
        return new MatchContext(grammar, config, 0, ImmutableList.of());
    }

    /**
     * Root context without named rules, for matching standalone combinators.
     */
    public static MatchContext root() {
        return root(Grammar.empty(), MatcherConfig.DEFAULT);
    }

    // === Scoping ===

    /**
     * Child context for one nested match attempt.
     *
     * @throws RecursionLimitException if the configured depth would be exceeded
     */
    public MatchContext deeper() {
        return descend(crumbs);
    }

    /**
     * Child context for resolving the named rule; the name is added to the trail.
     */
    public MatchContext deeper(String crumb) {
        return descend(ImmutableList.<String>builder()
                                    .addAll(crumbs)
                                    .add(crumb)
                                    .build());
    }

    private MatchContext descend(ImmutableList<String> trail) {
        Preconditions.checkState(!released, "Context at depth %s is already released", depth);
        if (depth >= config.maxDepth()) {
            throw new RecursionLimitException(config.maxDepth(), trail);
        }
        return new MatchContext(grammar, config, depth + 1, trail);
    }

    @Override
    public void close() {
        released = true;
    }

    public boolean isReleased() {
        return released;
    }

    // === Rule Resolution ===

    /**
     * Look up a named rule in the grammar this context matches against.
     */
    public Optional<Matchable> resolve(String ruleName) {
        return grammar.rule(ruleName)
                      .map(Rule::matchable);
    }

    /**
     * Whether the named rule is already being resolved further up the call tree.
     */
    public boolean onTrail(String ruleName) {
        return crumbs.contains(ruleName);
    }

    // === Accessors ===

    public MatcherConfig config() {
        return config;
    }

    public int depth() {
        return depth;
    }

    public ImmutableList<String> crumbs() {
        return crumbs;
    }
}
