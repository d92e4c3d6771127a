package org.pragmatica.tokenmatch.error;

/**
 * A non-trivia lookahead candidate was checked against input holding only trivia.
 * Cannot happen for well-formed input; signals a bug rather than a failed match.
 */
public class LookaheadInvariantException extends IllegalStateException {
    private final String candidate;

    public LookaheadInvariantException(String candidate) {
        super("Lookahead candidate '" + candidate + "' checked against input with no code tokens");
        this.candidate = candidate;
    }

    public String candidate() {
        return candidate;
    }
}
