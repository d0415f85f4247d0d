package com.helios.agentrules.runtime.render;

import com.helios.agentrules.api.model.EvaluationTrace;
import com.helios.agentrules.api.model.MergeConflict;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleMatch;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.api.model.SkippedRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class TraceFormatterTest {

    @Test
    @DisplayName("Should list triggered rules with files, at most ten skipped rules and conflicts")
    void shouldFormatTrace() {
        Rule react = Rule.builder("react", "React").fileMatch("*.tsx").scope(RuleScope.USER).build();
        List<SkippedRule> skipped = IntStream.range(0, 12)
            .mapToObj(i -> new SkippedRule("manual-" + i, "not manually referenced"))
            .toList();
        EvaluationTrace trace = new EvaluationTrace(
            "1a2b3c4d",
            Instant.parse("2025-06-01T10:15:30Z"),
            List.of("react"),
            List.of(new RuleMatch(react, "file pattern matched: *.tsx", List.of("src/App.tsx"), Map.of())),
            skipped,
            List.of(new MergeConflict("react", "react", "duplicate name, keeping user scope")),
            List.of("react"),
            17);

        String text = new TraceFormatter().format(trace);

        assertThat(text)
            .startsWith("\n---\n## [DEBUG] Rule Evaluation Trace\n")
            .contains("Request ID: 1a2b3c4d")
            .contains("Timestamp: 2025-06-01T10:15:30Z")
            .contains("Total Size: 17 bytes")
            .contains("- react (user): file pattern matched: *.tsx\n  Files: src/App.tsx")
            .contains("- manual-9: not manually referenced")
            .doesNotContain("manual-10")
            .contains("  ... and 2 more")
            .contains("- react vs react: duplicate name, keeping user scope")
            .endsWith("---\n");
    }

    @Test
    @DisplayName("Should omit empty sections")
    void shouldOmitEmptySections() {
        EvaluationTrace trace = new EvaluationTrace("abcdefgh", Instant.EPOCH,
            List.of(), List.of(), List.of(), List.of(), List.of(), 0);

        String text = new TraceFormatter().format(trace);

        assertThat(text).doesNotContain("Skipped Rules").doesNotContain("Conflicts").doesNotContain("more");
    }
}
