package org.pragmatica.tokenmatch.error;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Nesting of match attempts went past the configured depth, usually because of a
 * left-recursive or otherwise cyclic grammar.
 */
public class RecursionLimitException extends IllegalStateException {
    private final int maxDepth;
    private final ImmutableList<String> trail;

    public RecursionLimitException(int maxDepth, List<String> trail) {
        super("Match recursion exceeded depth " + maxDepth + ", rule trail: " + trail);
        this.maxDepth = maxDepth;
        this.trail = ImmutableList.copyOf(trail);
    }

    public int maxDepth() {
        return maxDepth;
    }

    public ImmutableList<String> trail() {
        return trail;
    }
}
