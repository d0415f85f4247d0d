/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import java.util.List;

/**
 * Result of matching a rule list against a {@link MatchContext}.
 */
public record MatchOutcome(List<RuleMatch> matched, List<SkippedRule> skipped) {

    public MatchOutcome {
        matched = List.copyOf(matched);
        skipped = List.copyOf(skipped);
    }

    public List<String> matchedNames() {
        return matched.stream().map(m -> m.rule().name()).toList();
    }
}
