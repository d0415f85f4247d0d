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
 * Summary of one store reload.
 *
 * @param loadedCount number of rules in the new snapshot
 * @param failures    files skipped because they could not be parsed
 * @param completedAt when the new snapshot was published
 */
public record ReloadReport(
    @JsonProperty("loaded_count") int loadedCount,
    @JsonProperty("failures") List<ParseFailure> failures,
    @JsonProperty("completed_at") Instant completedAt
) implements Serializable {

    public ReloadReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
        if (completedAt == null) completedAt = Instant.now();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
