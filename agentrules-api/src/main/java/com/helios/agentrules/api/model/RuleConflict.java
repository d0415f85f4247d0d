/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * A conflict between two loaded rules.
 *
 * <p>For {@link ConflictType#SAME_NAME} conflicts {@code rule1} is the winner and
 * {@code rule2} the rule it shadows; {@code scopes} lists every scope defining the name.
 *
 * @param rule1Name  first rule (the winner for same-name conflicts)
 * @param rule1Scope scope of the first rule
 * @param rule2Name  second rule
 * @param rule2Scope scope of the second rule
 * @param type       conflict kind
 * @param scopes     all scopes involved, highest precedence first
 * @param resolution how the conflict is resolved at evaluation time
 * @param details    human-readable explanation
 */
public record RuleConflict(
    @JsonProperty("rule1_name") String rule1Name,
    @JsonProperty("rule1_scope") RuleScope rule1Scope,
    @JsonProperty("rule2_name") String rule2Name,
    @JsonProperty("rule2_scope") RuleScope rule2Scope,
    @JsonProperty("conflict_type") ConflictType type,
    @JsonProperty("scopes") List<RuleScope> scopes,
    @JsonProperty("resolution") String resolution,
    @JsonProperty("details") String details
) implements Serializable {

    public RuleConflict {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        if (details == null) details = "";
    }

    @JsonProperty("severity")
    public ConflictType.Severity severity() {
        return type.severity();
    }

    public String describe() {
        return String.format("[%s] '%s' (%s) vs '%s' (%s): %s",
            type.value(), rule1Name, rule1Scope.value(), rule2Name, rule2Scope.value(), resolution);
    }
}
