/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A rule that did not apply to a request, with the reason.
 */
public record SkippedRule(
    @JsonProperty("name") String name,
    @JsonProperty("reason") String reason
) implements Serializable {
}
