/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A rule file that was skipped during a directory scan.
 *
 * @param path   path of the offending file
 * @param reason why it was skipped
 */
public record ParseFailure(
    @JsonProperty("path") String path,
    @JsonProperty("reason") String reason
) implements Serializable {

    public String describe() {
        return path + ": " + reason;
    }
}
