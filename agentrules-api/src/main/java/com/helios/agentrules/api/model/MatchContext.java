/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request facts used to decide which conditional rules apply.
 *
 * <p>The caller assembles this from the live request: files referenced by the
 * conversation, the user's text, session/assistant identifiers and the rule
 * names the user mentioned explicitly (for example {@code @security-review}).
 *
 * @param currentFiles ordered list of file paths in context
 * @param userQuery    the user's message text
 * @param sessionId    current session identifier
 * @param assistantId  current assistant identifier
 * @param manualRules  rule names explicitly referenced by the user
 * @param extraVars    additional caller-defined variables
 */
public record MatchContext(
    @JsonProperty("current_files") List<String> currentFiles,
    @JsonProperty("user_query") String userQuery,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("assistant_id") String assistantId,
    @JsonProperty("manual_rules") List<String> manualRules,
    @JsonProperty("extra_vars") Map<String, Object> extraVars
) implements Serializable {

    public MatchContext {
        currentFiles = currentFiles == null ? List.of() : List.copyOf(currentFiles);
        manualRules = manualRules == null ? List.of() : List.copyOf(manualRules);
        if (userQuery == null) userQuery = "";
        if (sessionId == null) sessionId = "";
        if (assistantId == null) assistantId = "";
        extraVars = extraVars == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraVars));
    }

    public static MatchContext empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> currentFiles = new ArrayList<>();
        private final List<String> manualRules = new ArrayList<>();
        private final Map<String, Object> extraVars = new LinkedHashMap<>();
        private String userQuery = "";
        private String sessionId = "";
        private String assistantId = "";

        private Builder() {
        }

        public Builder currentFiles(List<String> files) {
            currentFiles.addAll(files);
            return this;
        }

        public Builder currentFile(String file) {
            currentFiles.add(file);
            return this;
        }

        public Builder userQuery(String userQuery) {
            this.userQuery = userQuery;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder assistantId(String assistantId) {
            this.assistantId = assistantId;
            return this;
        }

        public Builder manualRules(List<String> names) {
            manualRules.addAll(names);
            return this;
        }

        public Builder manualRule(String name) {
            manualRules.add(name);
            return this;
        }

        public Builder extraVar(String key, Object value) {
            extraVars.put(key, value);
            return this;
        }

        public MatchContext build() {
            return new MatchContext(currentFiles, userQuery, sessionId, assistantId, manualRules, extraVars);
        }
    }
}
