package org.pragmatica.tokenmatch.match;

import com.google.common.base.Preconditions;

/**
 * Matcher configuration options.
 *
 * @param pruningEnabled whether alternatives are filtered by their lookahead sets
 *                       before a full match attempt
 * @param maxDepth       deepest allowed nesting of match attempts
 */
public record MatcherConfig(
    boolean pruningEnabled,
    int maxDepth
) {
    public static final int DEFAULT_MAX_DEPTH = 255;

    public static final MatcherConfig DEFAULT = new MatcherConfig(
        true,
        DEFAULT_MAX_DEPTH
    );

    public MatcherConfig {
        Preconditions.checkArgument(maxDepth > 0, "maxDepth must be positive, got %s", maxDepth);
    }

    public MatcherConfig withPruning(boolean enabled) {
        return new MatcherConfig(enabled, maxDepth);
    }

    public MatcherConfig withMaxDepth(int depth) {
        return new MatcherConfig(pruningEnabled, depth);
    }
}
