/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Result of static conflict analysis over a rule set.
 *
 * @param conflicts detected conflicts, same-name conflicts first
 * @param warnings  human-readable warnings, one per suspected contradiction
 */
public record ConflictReport(
    @JsonProperty("conflicts") List<RuleConflict> conflicts,
    @JsonProperty("warnings") List<String> warnings
) implements Serializable {

    public ConflictReport {
        conflicts = List.copyOf(conflicts);
        warnings = List.copyOf(warnings);
    }

    public static ConflictReport empty() {
        return new ConflictReport(List.of(), List.of());
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    @JsonProperty("total_conflicts")
    public int conflictCount() {
        return conflicts.size();
    }

    public List<RuleConflict> sameNameConflicts() {
        return ofType(ConflictType.SAME_NAME);
    }

    public List<RuleConflict> contradictions() {
        return ofType(ConflictType.CONTRADICTORY);
    }

    private List<RuleConflict> ofType(ConflictType type) {
        return conflicts.stream().filter(c -> c.type() == type).toList();
    }
}
