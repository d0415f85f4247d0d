/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.infra.config;

import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.compiler.FileReferenceResolver;
import com.helios.agentrules.runtime.evaluation.RuleMerger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Settings of the rules engine: where rules live, how large the merged output may
 * grow, how far file references are followed, and runtime switches.
 *
 * <p>Values are resolved in three layers, later layers winning:
 * <ol>
 *   <li>builder defaults</li>
 *   <li>{@code agent-rules.properties} (classpath root, then file system)</li>
 *   <li>environment variables {@code RULES_<PROPERTY>} (for example
 *       {@code rules.max.content.size} is overridden by {@code RULES_MAX_CONTENT_SIZE})</li>
 * </ol>
 *
 * <p>Default directories, relative to the user's home unless configured:
 * <ul>
 *   <li>global: {@code ~/.helios/rules}</li>
 *   <li>user: {@code ~/.helios/users/<userId>/rules}, only when a user id is set</li>
 *   <li>project: {@code <projectRoot>/.helios/rules}, only when a project root is set</li>
 * </ul>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * RulesConfig config = RulesConfig.builder()
 *     .projectRoot(Path.of("/work/shop"))
 *     .userId("alice")
 *     .maxContentSize(50_000)
 *     .build();
 * }</pre>
 */
public final class RulesConfig {

    private static final Logger logger = Logger.getLogger(RulesConfig.class.getName());

    public static final String DEFAULT_PROPERTIES_FILE = "agent-rules.properties";
    public static final long DEFAULT_MONITOR_INTERVAL_SECONDS = 10;

    static final String KEY_GLOBAL_DIR = "rules.global.dir";
    static final String KEY_USER_DIR = "rules.user.dir";
    static final String KEY_USER_ID = "rules.user.id";
    static final String KEY_PROJECT_ROOT = "rules.project.root";
    static final String KEY_PROJECT_DIR = "rules.project.dir";
    static final String KEY_MAX_CONTENT_SIZE = "rules.max.content.size";
    static final String KEY_MAX_FILE_REFERENCES = "rules.max.file.references";
    static final String KEY_ALLOWED_REFERENCE_DIRS = "rules.allowed.reference.dirs";
    static final String KEY_DEBUG_MODE = "rules.debug.mode";
    static final String KEY_RELOAD_BEFORE_EVALUATE = "rules.reload.before.evaluate";
    static final String KEY_MONITOR_INTERVAL_SECONDS = "rules.monitor.interval.seconds";

    private static final List<String> KEYS = List.of(
            KEY_GLOBAL_DIR, KEY_USER_DIR, KEY_USER_ID, KEY_PROJECT_ROOT, KEY_PROJECT_DIR,
            KEY_MAX_CONTENT_SIZE, KEY_MAX_FILE_REFERENCES, KEY_ALLOWED_REFERENCE_DIRS,
            KEY_DEBUG_MODE, KEY_RELOAD_BEFORE_EVALUATE, KEY_MONITOR_INTERVAL_SECONDS);

    private static final String HELIOS_DIR = ".helios";
    private static final String RULES_DIR = "rules";

    private final Map<RuleScope, Path> scopeDirectories;
    private final String userId;
    private final Path projectRoot;
    private final long maxContentSize;
    private final int maxFileReferences;
    private final List<Path> allowedReferenceDirs;
    private final boolean debugMode;
    private final boolean reloadBeforeEvaluate;
    private final long monitorIntervalSeconds;

    private RulesConfig(Builder builder) {
        Path home = builder.homeDir != null ? builder.homeDir : Path.of(System.getProperty("user.home"));

        EnumMap<RuleScope, Path> directories = new EnumMap<>(RuleScope.class);
        directories.put(RuleScope.GLOBAL, builder.globalDir != null
                ? builder.globalDir
                : home.resolve(HELIOS_DIR).resolve(RULES_DIR));
        if (builder.userDir != null) {
            directories.put(RuleScope.USER, builder.userDir);
        } else if (builder.userId != null) {
            directories.put(RuleScope.USER,
                    home.resolve(HELIOS_DIR).resolve("users").resolve(builder.userId).resolve(RULES_DIR));
        }
        if (builder.projectDir != null) {
            directories.put(RuleScope.PROJECT, builder.projectDir);
        } else if (builder.projectRoot != null) {
            directories.put(RuleScope.PROJECT, builder.projectRoot.resolve(HELIOS_DIR).resolve(RULES_DIR));
        }

        this.scopeDirectories = Collections.unmodifiableMap(directories);
        this.userId = builder.userId;
        this.projectRoot = builder.projectRoot;
        this.maxContentSize = builder.maxContentSize;
        this.maxFileReferences = builder.maxFileReferences;
        this.allowedReferenceDirs = List.copyOf(builder.allowedReferenceDirs);
        this.debugMode = builder.debugMode;
        this.reloadBeforeEvaluate = builder.reloadBeforeEvaluate;
        this.monitorIntervalSeconds = builder.monitorIntervalSeconds;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults overridden by {@code RULES_*} environment variables.
     */
    public static RulesConfig fromEnvironment() {
        return fromProperties(new Properties(), System::getenv);
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES_FILE}, falling back to defaults when it is absent.
     * Environment variables override the file.
     */
    public static RulesConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    /**
     * Loads a properties file from the classpath, or from the file system when the
     * classpath has no such resource. Environment variables override the file.
     */
    public static RulesConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading rules configuration from: " + propertiesPath);
        Properties props = new Properties();

        try (InputStream is = RulesConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (InputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return fromProperties(props, System::getenv);
    }

    /**
     * Resolves a configuration from explicit properties and an environment lookup.
     *
     * @param props       values keyed by {@code rules.*} property names
     * @param environment maps a variable name to its value, or null when unset
     */
    public static RulesConfig fromProperties(Properties props, UnaryOperator<String> environment) {
        Builder builder = builder();
        for (String key : KEYS) {
            String value = props.getProperty(key);
            if (value != null && !value.isBlank()) {
                builder.apply(key, value.trim());
            }
        }
        for (String key : KEYS) {
            String envKey = environmentKey(key);
            String value = environment.apply(envKey);
            if (value != null && !value.isBlank()) {
                logger.fine("Loaded env var: " + envKey + "=" + value);
                builder.apply(key, value.trim());
            }
        }
        return builder.build();
    }

    /**
     * {@code rules.max.content.size} becomes {@code RULES_MAX_CONTENT_SIZE}.
     */
    static String environmentKey(String propertyKey) {
        return propertyKey.replace('.', '_').toUpperCase();
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    /**
     * Directories of the persistent scopes that have one. Session scope never does.
     */
    public Map<RuleScope, Path> scopeDirectories() {
        return scopeDirectories;
    }

    public Optional<Path> directory(RuleScope scope) {
        return Optional.ofNullable(scopeDirectories.get(scope));
    }

    /**
     * Directories file references may resolve into: every scope directory plus
     * the extra allowed directories.
     */
    public List<Path> referenceRoots() {
        Set<Path> roots = new LinkedHashSet<>(scopeDirectories.values());
        roots.addAll(allowedReferenceDirs);
        return List.copyOf(roots);
    }

    public Optional<String> userId() {
        return Optional.ofNullable(userId);
    }

    public Optional<Path> projectRoot() {
        return Optional.ofNullable(projectRoot);
    }

    public long maxContentSize() {
        return maxContentSize;
    }

    public int maxFileReferences() {
        return maxFileReferences;
    }

    public List<Path> allowedReferenceDirs() {
        return allowedReferenceDirs;
    }

    public boolean debugMode() {
        return debugMode;
    }

    public boolean reloadBeforeEvaluate() {
        return reloadBeforeEvaluate;
    }

    public Duration monitorInterval() {
        return Duration.ofSeconds(monitorIntervalSeconds);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.globalDir = scopeDirectories.get(RuleScope.GLOBAL);
        builder.userDir = scopeDirectories.get(RuleScope.USER);
        builder.projectDir = scopeDirectories.get(RuleScope.PROJECT);
        builder.userId = userId;
        builder.projectRoot = projectRoot;
        builder.maxContentSize = maxContentSize;
        builder.maxFileReferences = maxFileReferences;
        builder.allowedReferenceDirs = new ArrayList<>(allowedReferenceDirs);
        builder.debugMode = debugMode;
        builder.reloadBeforeEvaluate = reloadBeforeEvaluate;
        builder.monitorIntervalSeconds = monitorIntervalSeconds;
        return builder;
    }

    public static class Builder {

        private Path homeDir;
        private Path globalDir;
        private Path userDir;
        private String userId;
        private Path projectRoot;
        private Path projectDir;
        private long maxContentSize = RuleMerger.DEFAULT_MAX_CONTENT_SIZE;
        private int maxFileReferences = FileReferenceResolver.DEFAULT_MAX_REFERENCES;
        private List<Path> allowedReferenceDirs = new ArrayList<>();
        private boolean debugMode = false;
        private boolean reloadBeforeEvaluate = false;
        private long monitorIntervalSeconds = DEFAULT_MONITOR_INTERVAL_SECONDS;

        private Builder() {
        }

        /**
         * Base of the default global and user directories. Defaults to {@code user.home}.
         */
        public Builder homeDir(Path homeDir) {
            this.homeDir = homeDir;
            return this;
        }

        public Builder globalDir(Path dir) {
            this.globalDir = dir;
            return this;
        }

        public Builder userDir(Path dir) {
            this.userDir = dir;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder projectRoot(Path projectRoot) {
            this.projectRoot = projectRoot;
            return this;
        }

        public Builder projectDir(Path dir) {
            this.projectDir = dir;
            return this;
        }

        public Builder maxContentSize(long maxContentSize) {
            this.maxContentSize = maxContentSize;
            return this;
        }

        public Builder maxFileReferences(int maxFileReferences) {
            this.maxFileReferences = maxFileReferences;
            return this;
        }

        public Builder allowedReferenceDirs(List<Path> dirs) {
            this.allowedReferenceDirs = new ArrayList<>(dirs);
            return this;
        }

        public Builder allowReferenceDir(Path dir) {
            this.allowedReferenceDirs.add(dir);
            return this;
        }

        public Builder debugMode(boolean debugMode) {
            this.debugMode = debugMode;
            return this;
        }

        public Builder reloadBeforeEvaluate(boolean reloadBeforeEvaluate) {
            this.reloadBeforeEvaluate = reloadBeforeEvaluate;
            return this;
        }

        public Builder monitorIntervalSeconds(long seconds) {
            this.monitorIntervalSeconds = seconds;
            return this;
        }

        public RulesConfig build() {
            return new RulesConfig(this);
        }

        private void apply(String key, String value) {
            switch (key) {
                case KEY_GLOBAL_DIR -> globalDir = toPath(value);
                case KEY_USER_DIR -> userDir = toPath(value);
                case KEY_USER_ID -> userId = value;
                case KEY_PROJECT_ROOT -> projectRoot = toPath(value);
                case KEY_PROJECT_DIR -> projectDir = toPath(value);
                case KEY_MAX_CONTENT_SIZE -> maxContentSize = parseLong(key, value, maxContentSize);
                case KEY_MAX_FILE_REFERENCES -> maxFileReferences = (int) parseLong(key, value, maxFileReferences);
                case KEY_ALLOWED_REFERENCE_DIRS -> allowedReferenceDirs = Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .map(this::toPath)
                        .collect(Collectors.toCollection(ArrayList::new));
                case KEY_DEBUG_MODE -> debugMode = parseBoolean(value);
                case KEY_RELOAD_BEFORE_EVALUATE -> reloadBeforeEvaluate = parseBoolean(value);
                case KEY_MONITOR_INTERVAL_SECONDS ->
                        monitorIntervalSeconds = parseLong(key, value, monitorIntervalSeconds);
                default -> logger.warning("Unknown rules configuration key: " + key);
            }
        }

        private Path toPath(String value) {
            if (value.equals("~") || value.startsWith("~/")) {
                Path home = homeDir != null ? homeDir : Path.of(System.getProperty("user.home"));
                return value.length() == 1 ? home : home.resolve(value.substring(2));
            }
            return Path.of(value);
        }

        private static long parseLong(String key, String value, long fallback) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                logger.warning("Invalid numeric value for " + key + ": " + value + ", keeping " + fallback);
                return fallback;
            }
        }

        private static boolean parseBoolean(String value) {
            String normalized = value.toLowerCase();
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (maxContentSize <= 0) {
            throw new IllegalArgumentException("maxContentSize must be positive: " + maxContentSize);
        }
        if (maxFileReferences <= 0) {
            throw new IllegalArgumentException("maxFileReferences must be positive: " + maxFileReferences);
        }
        if (monitorIntervalSeconds <= 0) {
            throw new IllegalArgumentException(
                    "monitorIntervalSeconds must be positive: " + monitorIntervalSeconds);
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{" +
                "directories=" + scopeDirectories +
                ", maxContentSize=" + maxContentSize +
                ", maxFileReferences=" + maxFileReferences +
                ", allowedReferenceDirs=" + allowedReferenceDirs +
                ", debugMode=" + debugMode +
                ", reloadBeforeEvaluate=" + reloadBeforeEvaluate +
                ", monitorIntervalSeconds=" + monitorIntervalSeconds +
                '}';
    }
}
