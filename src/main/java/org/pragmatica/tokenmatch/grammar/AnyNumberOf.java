package org.pragmatica.tokenmatch.grammar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.tokenmatch.match.MatchContext;
import org.pragmatica.tokenmatch.match.MatchResult;
import org.pragmatica.tokenmatch.tree.Token;
import org.pragmatica.tokenmatch.tree.Tokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Matches any of the options, repeated between {@code minTimes} and {@code maxTimes} times.
 *
 * <p>Each repetition takes the first option that consumes the whole remaining input;
 * failing that, the longest partial match, with ties going to the option declared
 * first. Repetitions never backtrack into an earlier choice.
 */
public class AnyNumberOf implements Matchable {
    private static final Logger log = LoggerFactory.getLogger(AnyNumberOf.class);

    private final ImmutableList<Matchable> options;
    private final int minTimes;
    private final Optional<Integer> maxTimes;
    private final boolean allowGaps;
    private final Optional<Matchable> exclude;
    private final boolean optional;

    protected AnyNumberOf(List<? extends Matchable> options,
                          int minTimes,
                          Optional<Integer> maxTimes,
                          boolean allowGaps,
                          Optional<Matchable> exclude,
                          boolean optional) {
        Preconditions.checkArgument(!options.isEmpty(), "at least one option is required");
        Preconditions.checkArgument(minTimes >= 0, "minTimes must not be negative, got %s", minTimes);
        Preconditions.checkNotNull(maxTimes, "maxTimes");
        Preconditions.checkNotNull(exclude, "exclude");
        maxTimes.ifPresent(max -> Preconditions.checkArgument(max >= 1 && max >= minTimes,
                                                              "maxTimes must be positive and >= minTimes (%s), got %s",
                                                              minTimes, max));
        this.options = ImmutableList.copyOf(options);
        this.minTimes = minTimes;
        this.maxTimes = maxTimes;
        this.allowGaps = allowGaps;
        this.exclude = exclude;
        this.optional = optional;
    }

    public static Builder builder(Matchable... options) {
        return new Builder(Arrays.asList(options));
    }

    public static Builder builder(List<? extends Matchable> options) {
        return new Builder(options);
    }

    // === Repetition ===

    @Override
    public MatchResult match(List<Token> tokens, MatchContext ctx) {
        if (exclude.isPresent() && excluded(tokens, ctx)) {
            log.trace("{} vetoed by exclude at depth {}", this, ctx.depth());
            return MatchResult.fromUnmatched(tokens);
        }

        var accumulated = MatchResult.fromUnmatched(tokens);
        int matches = 0;

        while (true) {
            if (maxTimes.isPresent() && matches >= maxTimes.get()) {
                return accumulated;
            }

            var unmatched = accumulated.unmatched();
            if (unmatched.isEmpty()) {
                return matches >= minTimes
                       ? accumulated
                       : MatchResult.fromUnmatched(tokens);
            }

            List<Token> gap = List.of();
            List<Token> rest = unmatched;
            if (matches > 0 && allowGaps) {
                int gapLength = Tokens.leadingTrivia(unmatched);
                gap = unmatched.subList(0, gapLength);
                rest = unmatched.subList(gapLength, unmatched.size());
            }

            var result = matchOnce(rest, ctx);
            if (!result.hasMatch()) {
                log.trace("{} stopped after {} repetition(s)", this, matches);
                // Skipped gap is still part of the accumulated remainder
                return matches >= minTimes
                       ? accumulated
                       : MatchResult.fromUnmatched(tokens);
            }

            accumulated = accumulated.then(result.withPrefix(gap));
            matches++;
        }
    }

    private boolean excluded(List<Token> tokens, MatchContext ctx) {
        try (var child = ctx.deeper()) {
            return exclude.get()
                          .match(tokens, child)
                          .hasMatch();
        }
    }

    // === Single Pass ===

    /**
     * Match one repetition. Returns the first complete match, otherwise the longest
     * partial one (earliest declared on ties), otherwise a failure.
     */
    MatchResult matchOnce(List<Token> tokens, MatchContext ctx) {
        var available = ctx.config().pruningEnabled()
                        ? LookaheadPruner.prune(tokens, options, ctx)
                        : options;
        if (available.isEmpty()) {
            return MatchResult.fromUnmatched(tokens);
        }

        MatchResult best = null;
        for (var option : available) {
            MatchResult result;
            try (var child = ctx.deeper()) {
                result = option.match(tokens, child);
            }
            if (result.isComplete()) {
                return result;
            }
            if (result.hasMatch() && (best == null || result.matchedLength() > best.matchedLength())) {
                best = result;
                if (log.isTraceEnabled()) {
                    log.trace("{} saved partial match of length {} from {}", this, best.matchedLength(), option);
                }
            }
        }

        return best != null
               ? best
               : MatchResult.fromUnmatched(tokens);
    }

    // === Self Description ===

    /**
     * Union of the options' lookahead sets; unsupported as soon as one option has none.
     */
    @Override
    public Lookahead lookahead(MatchContext ctx) {
        var candidates = Lookahead.of();
        for (var option : options) {
            if (!(option.lookahead(ctx) instanceof Lookahead.Candidates optionCandidates)) {
                return Lookahead.unsupported();
            }
            candidates = candidates.union(optionCandidates);
        }
        return candidates;
    }

    @Override
    public boolean isOptional() {
        return optional || minTimes == 0;
    }

    @Override
    public List<Matchable> elements() {
        var builder = ImmutableList.<Matchable>builder()
                                   .addAll(options);
        exclude.ifPresent(builder::add);
        return builder.build();
    }

    // === Accessors ===

    public ImmutableList<Matchable> options() {
        return options;
    }

    public int minTimes() {
        return minTimes;
    }

    public Optional<Integer> maxTimes() {
        return maxTimes;
    }

    public boolean allowGaps() {
        return allowGaps;
    }

    public Optional<Matchable> exclude() {
        return exclude;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + minTimes + ".." + maxTimes.map(String::valueOf).orElse("*")
               + ", options=" + options + "]";
    }

    public static final class Builder {
        private final List<? extends Matchable> options;
        private int minTimes = 0;
        private Optional<Integer> maxTimes = Optional.empty();
        private boolean allowGaps = true;
        private Optional<Matchable> exclude = Optional.empty();
        private boolean optional = false;

        private Builder(List<? extends Matchable> options) {
            this.options = options;
        }

        public Builder minTimes(int times) {
            this.minTimes = times;
            return this;
        }

        public Builder maxTimes(int times) {
            this.maxTimes = Optional.of(times);
            return this;
        }

        public Builder allowGaps(boolean allow) {
            this.allowGaps = allow;
            return this;
        }

        public Builder exclude(Matchable matchable) {
            this.exclude = Optional.of(matchable);
            return this;
        }

        public Builder optional() {
            this.optional = true;
            return this;
        }

        public AnyNumberOf build() {
            return new AnyNumberOf(options, minTimes, maxTimes, allowGaps, exclude, optional);
        }
    }
}
