/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.helios.agentrules.api.exceptions.RuleValidationException;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single agent rule: a text body plus the metadata that decides when it applies
 * and how it ranks against other rules.
 *
 * <p>Rules are immutable. Changing a rule means building a new instance
 * ({@link #toBuilder()}, {@link #withSourcePath(String)}) and saving it through a store.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@code name} and {@code description} are non-blank</li>
 *   <li>{@code priority} is within [{@value #MIN_PRIORITY}, {@value #MAX_PRIORITY}]</li>
 *   <li>{@link RuleInclusion#FILE_MATCH} requires a non-blank {@code fileMatchPattern}</li>
 * </ul>
 * Violations raise {@link RuleValidationException}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Rule rule = Rule.builder("react-rules", "React conventions")
 *     .content("Use function components.")
 *     .scope(RuleScope.PROJECT)
 *     .fileMatch("*.tsx")
 *     .priority(70)
 *     .build();
 * }</pre>
 */
public record Rule(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("content") String content,
    @JsonProperty("scope") RuleScope scope,
    @JsonProperty("inclusion") RuleInclusion inclusion,
    @JsonProperty("file_match_pattern") String fileMatchPattern,
    @JsonProperty("priority") int priority,
    @JsonProperty("override") boolean override,
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("source_path") String sourcePath,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("metadata") Map<String, String> metadata
) implements Serializable {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 100;
    public static final int DEFAULT_PRIORITY = 50;

    public Rule {
        if (name == null || name.isBlank()) {
            throw new RuleValidationException("Rule name cannot be empty");
        }
        if (description == null || description.isBlank()) {
            throw new RuleValidationException("Rule description cannot be empty");
        }
        if (scope == null) {
            throw new RuleValidationException("Rule scope is required for rule '" + name + "'");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new RuleValidationException(
                "Priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ", got " + priority);
        }
        if (inclusion == null) inclusion = RuleInclusion.ALWAYS;
        if (fileMatchPattern != null && fileMatchPattern.isBlank()) fileMatchPattern = null;
        if (inclusion == RuleInclusion.FILE_MATCH && fileMatchPattern == null) {
            throw new RuleValidationException(
                "Rule '" + name + "' uses fileMatch inclusion but has no fileMatchPattern");
        }
        if (content == null) content = "";
        if (createdAt == null) createdAt = Instant.now();
        if (updatedAt == null) updatedAt = createdAt;
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Key identifying this rule inside a store: {@code <scope>:<name>}.
     */
    @JsonIgnore
    public String cacheKey() {
        return cacheKey(scope, name);
    }

    public static String cacheKey(RuleScope scope, String name) {
        return scope.value() + ":" + name;
    }

    public Rule withSourcePath(String newSourcePath) {
        return toBuilder().sourcePath(newSourcePath).build();
    }

    public Rule withScope(RuleScope newScope) {
        return toBuilder().scope(newScope).build();
    }

    public Rule withEnabled(boolean newEnabled) {
        return toBuilder().enabled(newEnabled).updatedAt(Instant.now()).build();
    }

    public static Builder builder(String name, String description) {
        return new Builder(name, description);
    }

    public Builder toBuilder() {
        return new Builder(name, description)
            .content(content)
            .scope(scope)
            .inclusion(inclusion)
            .fileMatchPattern(fileMatchPattern)
            .priority(priority)
            .override(override)
            .enabled(enabled)
            .sourcePath(sourcePath)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .metadata(metadata);
    }

    public static final class Builder {
        private String name;
        private String description;
        private String content = "";
        private RuleScope scope = RuleScope.PROJECT;
        private RuleInclusion inclusion = RuleInclusion.ALWAYS;
        private String fileMatchPattern;
        private int priority = DEFAULT_PRIORITY;
        private boolean override;
        private boolean enabled = true;
        private String sourcePath;
        private Instant createdAt;
        private Instant updatedAt;
        private Map<String, String> metadata = Map.of();

        private Builder(String name, String description) {
            this.name = name;
            this.description = description;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder scope(RuleScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder inclusion(RuleInclusion inclusion) {
            this.inclusion = inclusion;
            return this;
        }

        public Builder fileMatchPattern(String fileMatchPattern) {
            this.fileMatchPattern = fileMatchPattern;
            return this;
        }

        /**
         * Shorthand for {@code inclusion(FILE_MATCH).fileMatchPattern(pattern)}.
         */
        public Builder fileMatch(String pattern) {
            this.inclusion = RuleInclusion.FILE_MATCH;
            this.fileMatchPattern = pattern;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder override(boolean override) {
            this.override = override;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder sourcePath(String sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Rule build() {
            return new Rule(name, description, content, scope, inclusion, fileMatchPattern,
                priority, override, enabled, sourcePath, createdAt, updatedAt, metadata);
        }
    }
}
