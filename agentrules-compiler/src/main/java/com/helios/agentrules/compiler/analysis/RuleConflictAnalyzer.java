/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.compiler.analysis;

import com.helios.agentrules.api.model.ConflictReport;
import com.helios.agentrules.api.model.ConflictType;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleConflict;
import com.helios.agentrules.api.model.RuleScope;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Analyzes a loaded rule set for conflicts, independently of any single request.
 *
 * <h2>Conflict Detection</h2>
 * <ul>
 *   <li><b>Same name</b>: a name defined in more than one scope. One conflict is reported per
 *       shadowed rule, naming the scope that wins under the default scope precedence
 *       (session &gt; project &gt; user &gt; global). The {@code override} flag is not
 *       consulted; this is the default outcome.</li>
 *   <li><b>Contradiction</b>: a pair of rules where one contains a positive marker and the
 *       other a negative marker of the same {@link OpposingMarkers} set. This is a keyword
 *       heuristic with false positives and negatives; it yields warnings only.</li>
 * </ul>
 *
 * <h2>Performance Note</h2>
 * <p>Contradiction detection compares every pair of rules, O(N²). Each rule's content is
 * tokenized once up front.
 *
 * <h2>Usage</h2>
 * <pre>
 * RuleConflictAnalyzer analyzer = new RuleConflictAnalyzer();
 * ConflictReport report = analyzer.analyze(store.listRules());
 *
 * for (RuleConflict conflict : report.sameNameConflicts()) {
 *     System.out.println(conflict.describe());
 * }
 * report.warnings().forEach(System.out::println);
 * </pre>
 */
public class RuleConflictAnalyzer {
    private static final Logger logger = Logger.getLogger(RuleConflictAnalyzer.class.getName());

    private static final Pattern NON_WORD = Pattern.compile("\\W+");

    private static final Comparator<Rule> BY_SCOPE_PRECEDENCE =
        Comparator.comparingInt((Rule r) -> r.scope().priority()).reversed();

    private final List<OpposingMarkers> markers;

    /**
     * Creates an analyzer with the {@link OpposingMarkers#DEFAULTS default} marker sets.
     */
    public RuleConflictAnalyzer() {
        this(OpposingMarkers.DEFAULTS);
    }

    public RuleConflictAnalyzer(List<OpposingMarkers> markers) {
        this.markers = List.copyOf(markers);
    }

    public ConflictReport analyze(Collection<Rule> rules) {
        List<Rule> ordered = List.copyOf(rules);
        List<RuleConflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        detectSameName(ordered, conflicts);
        detectContradictions(ordered, conflicts, warnings);

        logger.fine(() -> "Conflict analysis over " + ordered.size() + " rules found "
            + conflicts.size() + " conflicts");
        return new ConflictReport(conflicts, warnings);
    }

    /**
     * Returns the rule that wins among same-named rules: highest scope precedence,
     * then highest rule priority.
     */
    public Optional<Rule> winningRule(Collection<Rule> rules) {
        return rules.stream().max(
            Comparator.comparingInt((Rule r) -> r.scope().priority())
                .thenComparingInt(Rule::priority));
    }

    private void detectSameName(List<Rule> rules, List<RuleConflict> conflicts) {
        Map<String, List<Rule>> byName = new LinkedHashMap<>();
        for (Rule rule : rules) {
            byName.computeIfAbsent(rule.name(), k -> new ArrayList<>()).add(rule);
        }

        for (Map.Entry<String, List<Rule>> entry : byName.entrySet()) {
            List<Rule> sorted = entry.getValue().stream().sorted(BY_SCOPE_PRECEDENCE).toList();
            List<RuleScope> scopes = sorted.stream().map(Rule::scope).distinct().toList();
            if (scopes.size() < 2) {
                continue;
            }

            Rule winner = sorted.get(0);
            for (Rule loser : sorted.subList(1, sorted.size())) {
                conflicts.add(new RuleConflict(
                    winner.name(), winner.scope(),
                    loser.name(), loser.scope(),
                    ConflictType.SAME_NAME,
                    scopes,
                    winner.scope().value() + " scope takes precedence",
                    String.format("Rule '%s' exists at both %s and %s scopes",
                        entry.getKey(), winner.scope().value(), loser.scope().value())));
            }
        }
    }

    private void detectContradictions(List<Rule> rules, List<RuleConflict> conflicts, List<String> warnings) {
        if (markers.isEmpty() || rules.size() < 2) {
            return;
        }

        List<Set<String>> words = rules.stream().map(r -> words(r.content())).toList();

        for (int i = 0; i < rules.size(); i++) {
            for (int j = i + 1; j < rules.size(); j++) {
                if (contradicts(words.get(i), words.get(j))) {
                    Rule first = rules.get(i);
                    Rule second = rules.get(j);
                    String warning = String.format(
                        "Potential contradiction between '%s' (%s) and '%s' (%s): rules may have conflicting instructions",
                        first.name(), first.scope().value(), second.name(), second.scope().value());
                    warnings.add(warning);
                    conflicts.add(new RuleConflict(
                        first.name(), first.scope(),
                        second.name(), second.scope(),
                        ConflictType.CONTRADICTORY,
                        List.of(first.scope(), second.scope()).stream().distinct().toList(),
                        "both rules apply; review their instructions",
                        warning));
                }
            }
        }
    }

    private boolean contradicts(Set<String> a, Set<String> b) {
        for (OpposingMarkers set : markers) {
            if ((set.hasPositive(a) && set.hasNegative(b)) || (set.hasNegative(a) && set.hasPositive(b))) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> words(String content) {
        return Arrays.stream(NON_WORD.split(content.toLowerCase(Locale.ROOT)))
            .filter(w -> !w.isEmpty())
            .collect(Collectors.toSet());
    }
}
