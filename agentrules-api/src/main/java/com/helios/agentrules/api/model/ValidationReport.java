/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Result of validating a rule document without loading it.
 */
public record ValidationReport(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("warnings") List<String> warnings
) implements Serializable {

    public ValidationReport {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
