package org.pragmatica.tokenmatch.grammar;

import com.google.common.base.Preconditions;

/**
 * A named grammar rule: Name := matchable.
 */
public record Rule(String name, Matchable matchable) {
    public Rule {
        Preconditions.checkNotNull(name, "name");
        Preconditions.checkNotNull(matchable, "matchable");
    }
}
