/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import java.util.List;

/**
 * Result of merging matched rules.
 *
 * @param finalRules       deduplicated rules in precedence order, truncated to the size budget
 * @param conflicts        same-name collisions and how they were resolved
 * @param totalContentSize combined UTF-8 byte length of the final rules' content
 */
public record MergeResult(List<Rule> finalRules, List<MergeConflict> conflicts, long totalContentSize) {

    public MergeResult {
        finalRules = List.copyOf(finalRules);
        conflicts = List.copyOf(conflicts);
    }

    public List<String> finalRuleNames() {
        return finalRules.stream().map(Rule::name).toList();
    }
}
