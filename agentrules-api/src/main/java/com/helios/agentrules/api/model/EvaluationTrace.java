/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Audit record of one rule evaluation: what was considered, what applied and why,
 * what was skipped and why, which collisions were resolved and what survived.
 *
 * <p>Produced once per request by the rules engine and kept as the engine's
 * "last trace". Serialised with snake_case keys so it can be shipped as-is to a
 * debugging UI.
 *
 * <h2>Usage</h2>
 * <pre>
 * RulesEvaluation evaluation = engine.evaluate(context);
 * EvaluationTrace trace = evaluation.trace();
 *
 * for (SkippedRule skipped : trace.skippedRules()) {
 *     System.out.println(skipped.name() + ": " + skipped.reason());
 * }
 * </pre>
 *
 * @param requestId        short identifier of the request (8 characters)
 * @param timestamp        when evaluation started
 * @param evaluatedRules   names of every rule considered, in input order
 * @param matchedRules     rules that applied, with reasons
 * @param skippedRules     rules that did not apply, with reasons
 * @param conflicts        same-name collisions resolved during merging
 * @param finalRules       names of the rules in the rendered output, in order
 * @param totalContentSize combined content size of the final rules in bytes
 */
public record EvaluationTrace(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("evaluated_rules") List<String> evaluatedRules,
    @JsonProperty("matched_rules") List<RuleMatch> matchedRules,
    @JsonProperty("skipped_rules") List<SkippedRule> skippedRules,
    @JsonProperty("conflicts") List<MergeConflict> conflicts,
    @JsonProperty("final_rules") List<String> finalRules,
    @JsonProperty("total_content_size") long totalContentSize
) implements Serializable {

    public EvaluationTrace {
        evaluatedRules = evaluatedRules == null ? List.of() : List.copyOf(evaluatedRules);
        matchedRules = matchedRules == null ? List.of() : List.copyOf(matchedRules);
        skippedRules = skippedRules == null ? List.of() : List.copyOf(skippedRules);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        finalRules = finalRules == null ? List.of() : List.copyOf(finalRules);
        if (timestamp == null) timestamp = Instant.now();
    }

    /**
     * Names of the matched rules, in match order.
     */
    public List<String> matchedRuleNames() {
        return matchedRules.stream().map(m -> m.rule().name()).toList();
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
