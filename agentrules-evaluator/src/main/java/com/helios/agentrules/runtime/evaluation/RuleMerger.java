/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.runtime.evaluation;

import com.helios.agentrules.api.model.MergeConflict;
import com.helios.agentrules.api.model.MergeResult;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleMatch;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Merges matched rules into the ordered, deduplicated, size-bounded list that gets rendered.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li><b>Order</b> by scope precedence (session, project, user, global), then rule
 *       priority descending, then name ascending.</li>
 *   <li><b>Deduplicate</b>: the first rule with a given name is kept. A later rule with the
 *       same name replaces it only if it has {@code override} set, and then moves to the end
 *       of the accepted list, which is its own precedence rank; otherwise it is dropped. Both outcomes are recorded as {@link MergeConflict}s; a rule dropped in favour
 *       of an accepted {@code override} rule is reported as overridden.</li>
 *   <li><b>Truncate</b>: rules are accepted in order while the combined UTF-8 size of their
 *       content stays within {@code maxContentSize}. The first rule that does not fit ends the
 *       list, so the result is always a prefix of the ordered list.</li>
 * </ol>
 *
 * <p>Merging is deterministic and side-effect free.
 */
public final class RuleMerger {
    private static final Logger logger = Logger.getLogger(RuleMerger.class.getName());

    public static final long DEFAULT_MAX_CONTENT_SIZE = 100_000;

    /**
     * Precedence order: highest scope first, then highest priority, then name.
     */
    public static final Comparator<Rule> PRECEDENCE =
        Comparator.comparingInt((Rule r) -> r.scope().priority()).reversed()
            .thenComparing(Comparator.comparingInt(Rule::priority).reversed())
            .thenComparing(Rule::name);

    private final long maxContentSize;

    public RuleMerger() {
        this(DEFAULT_MAX_CONTENT_SIZE);
    }

    public RuleMerger(long maxContentSize) {
        if (maxContentSize < 0) {
            throw new IllegalArgumentException("maxContentSize must be >= 0, got: " + maxContentSize);
        }
        this.maxContentSize = maxContentSize;
    }

    public long maxContentSize() {
        return maxContentSize;
    }

    public MergeResult merge(List<RuleMatch> matches) {
        return mergeRules(matches.stream().map(RuleMatch::rule).toList());
    }

    public MergeResult mergeRules(List<Rule> rules) {
        List<Rule> sorted = rules.stream().sorted(PRECEDENCE).toList();

        Map<String, Rule> acceptedByName = new LinkedHashMap<>();
        List<MergeConflict> conflicts = new ArrayList<>();

        for (Rule rule : sorted) {
            Rule existing = acceptedByName.get(rule.name());
            if (existing == null) {
                acceptedByName.put(rule.name(), rule);
                continue;
            }

            if (rule.override()) {
                acceptedByName.remove(rule.name());
                acceptedByName.put(rule.name(), rule);
                conflicts.add(new MergeConflict(rule.name(), existing.name(),
                    "overridden by " + rule.scope().value() + " scope"));
                logger.fine(() -> "Rule '" + rule.name() + "' from " + rule.scope().value()
                    + " overrides " + existing.scope().value());
            } else if (existing.override()) {
                // An accepted override rule reports what it shadows as overridden, so a
                // user-scope override reads the same whichever side sorts first.
                conflicts.add(new MergeConflict(rule.name(), existing.name(),
                    "overridden by " + existing.scope().value() + " scope"));
                logger.fine(() -> "Rule '" + rule.name() + "' from " + rule.scope().value()
                    + " overridden by " + existing.scope().value());
            } else {
                conflicts.add(new MergeConflict(rule.name(), existing.name(),
                    "duplicate name, keeping " + existing.scope().value() + " scope"));
                logger.fine(() -> "Rule '" + rule.name() + "' conflict: keeping " + existing.scope().value()
                    + ", skipping " + rule.scope().value());
            }
        }
        List<Rule> accepted = new ArrayList<>(acceptedByName.values());

        List<Rule> finalRules = new ArrayList<>();
        long totalSize = 0;
        for (Rule rule : accepted) {
            long size = contentSize(rule);
            if (totalSize + size > maxContentSize) {
                logger.warning("Rule '" + rule.name() + "' and " + (accepted.size() - finalRules.size() - 1)
                    + " lower-precedence rules dropped due to size limit ("
                    + (totalSize + size) + " > " + maxContentSize + ")");
                break;
            }
            finalRules.add(rule);
            totalSize += size;
        }

        return new MergeResult(finalRules, conflicts, totalSize);
    }

    /**
     * Size of a rule's content in UTF-8 bytes.
     */
    public static long contentSize(Rule rule) {
        return rule.content().getBytes(StandardCharsets.UTF_8).length;
    }
}
