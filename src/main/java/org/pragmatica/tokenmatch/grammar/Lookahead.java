package org.pragmatica.tokenmatch.grammar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * First-token strings a grammar element can start with, in the spirit of a
 * FIRST set. Used to rule out alternatives without a full match attempt.
 */
public sealed interface Lookahead {

    boolean isSupported();

    static Lookahead unsupported() {
        return Unsupported.INSTANCE;
    }

    static Candidates of(String... candidates) {
        return of(List.of(candidates));
    }

    static Candidates of(Collection<String> candidates) {
        var builder = ImmutableSet.<String>builder();
        for (var candidate : candidates) {
            Preconditions.checkNotNull(candidate, "candidate");
            builder.add(candidate.toUpperCase(Locale.ROOT));
        }
        return new Candidates(builder.build());
    }

    /**
     * A candidate with no visible content. It is not anchored to the first code token.
     */
    static boolean isTrivia(String candidate) {
        return candidate.strip()
                        .isEmpty();
    }

    /**
     * No cheap check available; the element always needs a full match attempt.
     */
    record Unsupported() implements Lookahead {
        private static final Unsupported INSTANCE = new Unsupported();

        @Override
        public boolean isSupported() {
            return false;
        }
    }

    /**
     * Upper-cased candidate strings, in insertion order.
     */
    record Candidates(ImmutableSet<String> values) implements Lookahead {
        @Override
        public boolean isSupported() {
            return true;
        }

        public Candidates union(Candidates other) {
            return new Candidates(ImmutableSet.<String>builder()
                                              .addAll(values)
                                              .addAll(other.values)
                                              .build());
        }
    }
}
