/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.agentrules.api.model.EvaluationTrace;
import com.helios.agentrules.api.model.MergeConflict;
import com.helios.agentrules.api.model.RuleMatch;
import com.helios.agentrules.api.model.RuleScope;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Emitted after every evaluation, whether or not any rule applied.
 *
 * @param requestId       request identifier, matching the trace
 * @param timestamp       when the evaluation ran
 * @param triggeredRules  rules that applied, in match order
 * @param skippedCount    number of rules that did not apply
 * @param conflicts       collisions resolved while merging
 * @param totalSize       combined size of the rendered rules in bytes
 */
public record RulesAppliedEvent(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("triggered_rules") List<TriggeredRule> triggeredRules,
    @JsonProperty("skipped_count") int skippedCount,
    @JsonProperty("conflicts") List<MergeConflict> conflicts,
    @JsonProperty("total_size") long totalSize
) implements Serializable {

    public static final String EVENT_TYPE = "rules_applied";

    @JsonProperty("event_type")
    public String eventType() {
        return EVENT_TYPE;
    }

    public RulesAppliedEvent {
        triggeredRules = List.copyOf(triggeredRules);
        conflicts = List.copyOf(conflicts);
    }

    public static RulesAppliedEvent fromTrace(EvaluationTrace trace) {
        List<TriggeredRule> triggered = trace.matchedRules().stream()
            .map(TriggeredRule::of)
            .toList();
        return new RulesAppliedEvent(
            trace.requestId(),
            trace.timestamp(),
            triggered,
            trace.skippedRules().size(),
            trace.conflicts(),
            trace.totalContentSize());
    }

    /**
     * Summary of one applied rule.
     */
    public record TriggeredRule(
        @JsonProperty("name") String name,
        @JsonProperty("scope") RuleScope scope,
        @JsonProperty("match_reason") String matchReason,
        @JsonProperty("matched_files") List<String> matchedFiles
    ) implements Serializable {

        static TriggeredRule of(RuleMatch match) {
            return new TriggeredRule(
                match.rule().name(), match.rule().scope(), match.matchReason(), match.matchedFiles());
        }
    }
}
