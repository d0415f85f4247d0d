/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.events;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.agentrules.api.model.EvaluationTrace;

import java.io.Serializable;

/**
 * Emitted in debug mode with the complete trace of an evaluation.
 */
public record RuleDebugEvent(
    @JsonProperty("trace") EvaluationTrace trace
) implements Serializable {

    public static final String EVENT_TYPE = "rule_debug";

    @JsonProperty("event_type")
    public String eventType() {
        return EVENT_TYPE;
    }

    public String requestId() {
        return trace.requestId();
    }
}
