package org.pragmatica.tokenmatch.grammar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.pragmatica.tokenmatch.error.GrammarError;
import org.pragmatica.tokenmatch.error.InvalidGrammarException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A complete grammar - named rules, optionally with an explicit start rule.
 */
public record Grammar(
 ImmutableList<Rule> rules,
 Optional<String> startRule) {

    public Grammar {
        Preconditions.checkNotNull(rules, "rules");
        Preconditions.checkNotNull(startRule, "startRule");
    }

    private static final Grammar EMPTY = new Grammar(ImmutableList.of(), Optional.empty());

    public static Grammar empty() {
        return EMPTY;
    }

    public static Grammar of(List<Rule> rules) {
        return new Grammar(ImmutableList.copyOf(rules), Optional.empty());
    }

    public Grammar withStartRule(String name) {
        return new Grammar(rules, Optional.of(name));
    }

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .equals(name))
                    .findFirst();
    }

    /**
     * Get the effective start rule (first rule if not explicitly specified).
     */
    public Optional<Rule> effectiveStartRule() {
        if (startRule.isPresent()) {
            return startRule.flatMap(this::rule);
        }
        return rules.isEmpty()
               ? Optional.empty()
               : Optional.of(rules.get(0));
    }

    // === Validation ===

    /**
     * All problems of this grammar: duplicate names, references to undefined rules
     * and an explicit start rule that is not defined.
     */
    public List<GrammarError> validate() {
        var errors = new ArrayList<GrammarError>();
        var ruleNames = new HashSet<String>();

        for (var rule : rules) {
            if (!ruleNames.add(rule.name())) {
                errors.add(new GrammarError.DuplicateRule(rule.name()));
            }
        }
        for (var rule : rules) {
            collectUndefinedReferences(rule.matchable(), rule.name(), ruleNames, errors);
        }
        startRule.filter(name -> !ruleNames.contains(name))
                 .ifPresent(name -> errors.add(new GrammarError.UnknownRule(name)));
        return errors;
    }

    /**
     * This grammar if it is valid.
     *
     * @throws InvalidGrammarException listing every problem found by {@link #validate()}
     */
    public Grammar validated() {
        var errors = validate();
        if (!errors.isEmpty()) {
            throw new InvalidGrammarException(errors);
        }
        return this;
    }

    private static void collectUndefinedReferences(Matchable matchable,
                                                   String ruleName,
                                                   Set<String> ruleNames,
                                                   List<GrammarError> errors) {
        if (matchable instanceof Ref ref && !ruleNames.contains(ref.ruleName())) {
            errors.add(new GrammarError.UndefinedReference(ref.ruleName(), ruleName));
        }
        for (var element : matchable.elements()) {
            collectUndefinedReferences(element, ruleName, ruleNames, errors);
        }
    }
}
