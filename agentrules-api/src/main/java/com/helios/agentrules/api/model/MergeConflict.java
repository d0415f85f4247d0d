/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A same-name collision resolved while merging the rules of one request.
 *
 * @param ruleName      name of the rule being processed
 * @param otherRuleName name of the rule it collided with
 * @param reason        how the collision was resolved
 */
public record MergeConflict(
    @JsonProperty("rule1") String ruleName,
    @JsonProperty("rule2") String otherRuleName,
    @JsonProperty("reason") String reason
) implements Serializable {
}
