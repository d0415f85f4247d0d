/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A rule that applies to the current request, with the reason it applied.
 *
 * @param rule         the matched rule
 * @param matchReason  human-readable explanation (e.g. "file pattern matched: *.py")
 * @param matchedFiles files that triggered a fileMatch rule, in context order
 * @param contextVars  snapshot of the context variables the match was evaluated with
 */
public record RuleMatch(
    @JsonProperty("rule") Rule rule,
    @JsonProperty("match_reason") String matchReason,
    @JsonProperty("matched_files") List<String> matchedFiles,
    @JsonProperty("context_vars") Map<String, Object> contextVars
) implements Serializable {

    public RuleMatch {
        matchedFiles = matchedFiles == null ? List.of() : List.copyOf(matchedFiles);
        contextVars = contextVars == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(contextVars));
    }

    public RuleMatch(Rule rule, String matchReason) {
        this(rule, matchReason, List.of(), Map.of());
    }
}
