package com.helios.agentrules.infra.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.helios.agentrules.api.events.RulesAppliedEvent;
import com.helios.agentrules.api.model.ConflictReport;
import com.helios.agentrules.api.model.ConflictType;
import com.helios.agentrules.api.model.EvaluationTrace;
import com.helios.agentrules.api.model.MergeConflict;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleConflict;
import com.helios.agentrules.api.model.RuleMatch;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.api.model.SkippedRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RulesJson")
class RulesJsonTest {

    private static final Instant CREATED = Instant.parse("2025-03-01T08:00:00Z");

    private final Rule reactRule = Rule.builder("react", "React conventions")
            .content("Use hooks.")
            .fileMatch("*.tsx")
            .priority(70)
            .sourcePath("/work/.helios/rules/react.md")
            .createdAt(CREATED)
            .updatedAt(CREATED)
            .metadata(Map.of("owner", "web-team"))
            .build();

    @Test
    @DisplayName("rules use snake_case keys, wire enum values and ISO-8601 timestamps")
    void ruleShape() throws Exception {
        JsonNode json = RulesJson.mapper().readTree(RulesJson.toJson(reactRule));

        assertThat(json.get("file_match_pattern").asText()).isEqualTo("*.tsx");
        assertThat(json.get("inclusion").asText()).isEqualTo("fileMatch");
        assertThat(json.get("scope").asText()).isEqualTo("project");
        assertThat(json.get("source_path").asText()).isEqualTo("/work/.helios/rules/react.md");
        assertThat(json.get("created_at").asText()).isEqualTo("2025-03-01T08:00:00Z");
        assertThat(json.get("metadata").get("owner").asText()).isEqualTo("web-team");
        assertThat(json.has("cacheKey")).isFalse();
        assertThat(json.has("fileMatchPattern")).isFalse();
    }

    @Test
    @DisplayName("a rule read back from JSON equals the original")
    void ruleReadBack() {
        Rule copy = RulesJson.fromJson(RulesJson.toJson(reactRule), Rule.class);

        assertThat(copy).isEqualTo(reactRule);
    }

    @Test
    @DisplayName("traces export matches, skips and conflicts")
    void traceShape() throws Exception {
        EvaluationTrace trace = new EvaluationTrace(
                "a1b2c3d4",
                CREATED,
                List.of("react", "style"),
                List.of(new RuleMatch(reactRule, "file pattern matched: *.tsx", List.of("src/App.tsx"), Map.of())),
                List.of(new SkippedRule("style", "disabled")),
                List.of(new MergeConflict("react", "react", "duplicate name, keeping project scope")),
                List.of("react"),
                10);

        JsonNode json = RulesJson.mapper().readTree(RulesJson.toJson(trace));

        assertThat(json.get("request_id").asText()).isEqualTo("a1b2c3d4");
        assertThat(json.get("timestamp").asText()).isEqualTo("2025-03-01T08:00:00Z");
        assertThat(json.get("matched_rules").get(0).get("matched_files").get(0).asText()).isEqualTo("src/App.tsx");
        assertThat(json.get("skipped_rules").get(0).get("reason").asText()).isEqualTo("disabled");
        assertThat(json.get("conflicts").get(0).get("rule1").asText()).isEqualTo("react");
        assertThat(json.get("final_rules").get(0).asText()).isEqualTo("react");
        assertThat(json.get("total_content_size").asLong()).isEqualTo(10);
    }

    @Test
    @DisplayName("conflict reports carry derived totals and survive a read back")
    void conflictReport() throws Exception {
        ConflictReport report = new ConflictReport(List.of(new RuleConflict(
                "style", RuleScope.GLOBAL, "style", RuleScope.PROJECT,
                ConflictType.SAME_NAME, List.of(RuleScope.GLOBAL, RuleScope.PROJECT),
                "project scope takes precedence", "Rule 'style' exists at both global and project scopes")),
                List.of());

        String text = RulesJson.toJson(report);
        JsonNode json = RulesJson.mapper().readTree(text);

        assertThat(json.get("total_conflicts").asInt()).isEqualTo(1);
        assertThat(json.get("conflicts").get(0).get("conflict_type").asText()).isEqualTo("same_name");
        assertThat(json.get("conflicts").get(0).get("severity").asText()).isEqualTo("ERROR");
        assertThat(RulesJson.fromJson(text, ConflictReport.class)).isEqualTo(report);
    }

    @Test
    @DisplayName("events include their event type")
    void eventType() throws Exception {
        EvaluationTrace trace = new EvaluationTrace("r1", CREATED, List.of(), List.of(), List.of(),
                List.of(), List.of(), 0);

        JsonNode json = RulesJson.mapper().readTree(RulesJson.toJson(RulesAppliedEvent.fromTrace(trace)));

        assertThat(json.get("event_type").asText()).isEqualTo("rules_applied");
        assertThat(json.get("request_id").asText()).isEqualTo("r1");
        assertThat(json.get("skipped_count").asInt()).isZero();
    }

    @Test
    @DisplayName("pretty output is indented")
    void prettyOutput() {
        assertThat(RulesJson.toPrettyJson(Map.of("a", 1))).contains("\n");
    }
}
