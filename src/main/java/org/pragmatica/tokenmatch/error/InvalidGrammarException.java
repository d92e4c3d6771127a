package org.pragmatica.tokenmatch.error;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a grammar cannot be used as defined.
 */
public class InvalidGrammarException extends RuntimeException {
    private final ImmutableList<GrammarError> errors;

    public InvalidGrammarException(List<? extends GrammarError> errors) {
        super(describe(errors));
        this.errors = ImmutableList.copyOf(errors);
    }

    public InvalidGrammarException(GrammarError error) {
        this(ImmutableList.of(error));
    }

    public ImmutableList<GrammarError> errors() {
        return errors;
    }

    private static String describe(List<? extends GrammarError> errors) {
        return errors.stream()
                     .map(GrammarError::message)
                     .collect(Collectors.joining("; "));
    }
}
