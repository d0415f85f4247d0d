/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.helios.agentrules.api.exceptions.RuleValidationException;

import java.util.List;

/**
 * Hierarchy level a rule belongs to.
 *
 * <p>The scope determines the default precedence of a rule during merging
 * (higher {@link #priority()} wins) and, for every scope except
 * {@link #SESSION}, the directory the rule is loaded from:
 * <ul>
 *   <li>{@link #GLOBAL}: system-wide rules</li>
 *   <li>{@link #USER}: rules of one user</li>
 *   <li>{@link #PROJECT}: rules checked into a project</li>
 *   <li>{@link #SESSION}: runtime-only rules supplied by the caller</li>
 * </ul>
 */
public enum RuleScope {
    GLOBAL("global", 1),
    USER("user", 2),
    PROJECT("project", 3),
    SESSION("session", 4);

    /**
     * Scopes searched by a name-only lookup, most specific first.
     * Session rules are never part of this search.
     */
    public static final List<RuleScope> LOOKUP_ORDER = List.of(PROJECT, USER, GLOBAL);

    private final String value;
    private final int priority;

    RuleScope(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Precedence of this scope when rules with the same name collide.
     */
    public int priority() {
        return priority;
    }

    /**
     * Whether this scope is backed by a rules directory.
     */
    public boolean isPersistent() {
        return this != SESSION;
    }

    @JsonCreator
    public static RuleScope fromValue(String value) {
        for (RuleScope scope : values()) {
            if (scope.value.equalsIgnoreCase(value)) {
                return scope;
            }
        }
        throw new RuleValidationException("Invalid scope: " + value);
    }
}
