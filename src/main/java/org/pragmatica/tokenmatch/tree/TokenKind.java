package org.pragmatica.tokenmatch.tree;

/**
 * Kind of a leaf token. Everything except {@link #CODE} is trivia:
 * whitespace, line breaks and comments carry no grammatical meaning.
 */
public enum TokenKind {
    CODE,
    WHITESPACE,
    NEWLINE,
    COMMENT;

    public boolean isCode() {
        return this == CODE;
    }
}
