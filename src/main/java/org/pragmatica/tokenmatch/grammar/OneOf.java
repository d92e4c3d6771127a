package org.pragmatica.tokenmatch.grammar;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Matches exactly one of the options: {@link AnyNumberOf} fixed to a single repetition.
 */
public final class OneOf extends AnyNumberOf {

    OneOf(List<? extends Matchable> options, boolean allowGaps, Optional<Matchable> exclude, boolean optional) {
        super(options, 1, Optional.of(1), allowGaps, exclude, optional);
    }

    public static OneOf of(Matchable... options) {
        return of(Arrays.asList(options));
    }

    public static OneOf of(List<? extends Matchable> options) {
        return new OneOf(options, true, Optional.empty(), false);
    }

    /**
     * Same options, vetoed whenever {@code matchable} matches the input.
     */
    public OneOf excluding(Matchable matchable) {
        return new OneOf(options(), allowGaps(), Optional.of(matchable), isOptional());
    }

    /**
     * Same options, acceptable to enclosing grammars when absent.
     */
    public OneOf asOptional() {
        return new OneOf(options(), allowGaps(), exclude(), true);
    }
}
