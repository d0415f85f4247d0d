/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import java.util.List;

/**
 * Outcome of loading every rule document in one directory.
 * Bad files end up in {@code failures}; they never abort the scan.
 */
public record DirectoryScanResult(List<Rule> rules, List<ParseFailure> failures) {

    public DirectoryScanResult {
        rules = List.copyOf(rules);
        failures = List.copyOf(failures);
    }

    public static DirectoryScanResult empty() {
        return new DirectoryScanResult(List.of(), List.of());
    }
}
