/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.runtime.render;

import com.helios.agentrules.api.model.EvaluationTrace;
import com.helios.agentrules.api.model.MergeConflict;
import com.helios.agentrules.api.model.RuleMatch;
import com.helios.agentrules.api.model.SkippedRule;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats an {@link EvaluationTrace} as the debug section appended to the prompt in debug mode.
 */
public final class TraceFormatter {

    public static final int DEFAULT_MAX_SKIPPED = 10;

    private final int maxSkipped;

    public TraceFormatter() {
        this(DEFAULT_MAX_SKIPPED);
    }

    public TraceFormatter(int maxSkipped) {
        this.maxSkipped = maxSkipped;
    }

    public String format(EvaluationTrace trace) {
        List<String> lines = new ArrayList<>();
        lines.add("\n---");
        lines.add("## [DEBUG] Rule Evaluation Trace");
        lines.add("Request ID: " + trace.requestId());
        lines.add("Timestamp: " + trace.timestamp());
        lines.add("Evaluated: " + trace.evaluatedRules().size() + " rules");
        lines.add("Matched: " + trace.matchedRules().size() + " rules");
        lines.add("Final: " + trace.finalRules().size() + " rules");
        lines.add("Total Size: " + trace.totalContentSize() + " bytes");
        lines.add("");
        lines.add("### Triggered Rules:");

        for (RuleMatch match : trace.matchedRules()) {
            lines.add("- " + match.rule().name() + " (" + match.rule().scope().value() + "): " + match.matchReason());
            if (!match.matchedFiles().isEmpty()) {
                lines.add("  Files: " + String.join(", ", match.matchedFiles()));
            }
        }

        List<SkippedRule> skipped = trace.skippedRules();
        if (!skipped.isEmpty()) {
            lines.add("\n### Skipped Rules:");
            for (SkippedRule rule : skipped.subList(0, Math.min(maxSkipped, skipped.size()))) {
                lines.add("- " + rule.name() + ": " + rule.reason());
            }
            if (skipped.size() > maxSkipped) {
                lines.add("  ... and " + (skipped.size() - maxSkipped) + " more");
            }
        }

        if (!trace.conflicts().isEmpty()) {
            lines.add("\n### Conflicts:");
            for (MergeConflict conflict : trace.conflicts()) {
                lines.add("- " + conflict.ruleName() + " vs " + conflict.otherRuleName() + ": " + conflict.reason());
            }
        }

        lines.add("---\n");
        return String.join("\n", lines);
    }
}
