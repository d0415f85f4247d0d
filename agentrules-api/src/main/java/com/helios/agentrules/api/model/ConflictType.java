/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of problem reported by static conflict analysis.
 */
public enum ConflictType {
    /** The same rule name is defined in more than one scope. */
    SAME_NAME("same_name", Severity.ERROR),

    /** Two rules appear to give opposing instructions. Heuristic. */
    CONTRADICTORY("contradictory", Severity.WARNING);

    public enum Severity { ERROR, WARNING }

    private final String value;
    private final Severity severity;

    ConflictType(String value, Severity severity) {
        this.value = value;
        this.severity = severity;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public Severity severity() {
        return severity;
    }
}
