/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.helios.agentrules.api.exceptions.RuleValidationException;

/**
 * When a rule is considered applicable to a request.
 *
 * <p>This is a closed set: consumers dispatch on it with exhaustive
 * {@code switch} expressions, so adding a mode fails compilation wherever
 * it is not handled.
 */
public enum RuleInclusion {
    /** Always included. */
    ALWAYS("always"),

    /** Included when at least one file in context matches the rule's glob. */
    FILE_MATCH("fileMatch"),

    /** Included only when the user references the rule by name. */
    MANUAL("manual");

    private final String value;

    RuleInclusion(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RuleInclusion fromValue(String value) {
        for (RuleInclusion inclusion : values()) {
            if (inclusion.value.equals(value)) {
                return inclusion;
            }
        }
        throw new RuleValidationException(
                "Invalid inclusion mode: '" + value + "' (expected always, fileMatch or manual)");
    }
}
