package org.pragmatica.tokenmatch.error;

/**
 * Problem found in a grammar definition.
 */
public sealed interface GrammarError {
    String message();

    /**
     * Reference to a rule the grammar does not define.
     */
    record UndefinedReference(
    String ruleName,
    String referencedFrom) implements GrammarError {
        @Override
        public String message() {
            return "Undefined rule reference '" + ruleName + "' in rule '" + referencedFrom + "'";
        }
    }

    /**
     * Two rules registered under the same name.
     */
    record DuplicateRule(String ruleName) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + ruleName + "' is defined more than once";
        }
    }

    /**
     * Match requested for a rule the grammar does not define.
     */
    record UnknownRule(String ruleName) implements GrammarError {
        @Override
        public String message() {
            return "Unknown rule: " + ruleName;
        }
    }

    /**
     * Match requested without a rule name on a grammar with no rules.
     */
    record NoStartRule() implements GrammarError {
        @Override
        public String message() {
            return "No start rule defined in grammar";
        }
    }
}
