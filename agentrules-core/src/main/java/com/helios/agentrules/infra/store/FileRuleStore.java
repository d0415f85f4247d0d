/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.infra.store;

import com.helios.agentrules.api.IRuleParser;
import com.helios.agentrules.api.IRuleStore;
import com.helios.agentrules.api.model.DirectoryScanResult;
import com.helios.agentrules.api.model.ParseFailure;
import com.helios.agentrules.api.model.ReloadReport;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.compiler.FileReferenceResolver;
import com.helios.agentrules.compiler.RuleDocumentWriter;
import com.helios.agentrules.compiler.RuleParser;
import com.helios.agentrules.infra.config.RulesConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rule store backed by one directory per persistent scope, each holding
 * {@code <name>.md} documents.
 *
 * <p><b>Concurrency:</b> the loaded rules live in an immutable map behind an
 * {@link AtomicReference}. Readers never lock and always see a complete snapshot.
 * Reload, save and delete are serialised by a single writer lock; each builds a new
 * map and swaps it in, so a failed reload leaves the previous snapshot active.
 *
 * <p>Rules are loaded lazily on first access. Scopes are loaded global, user, project,
 * and files within a directory in name order.
 */
public class FileRuleStore implements IRuleStore {
    private static final Logger logger = Logger.getLogger(FileRuleStore.class.getName());

    private static final List<RuleScope> LOAD_ORDER = List.of(RuleScope.GLOBAL, RuleScope.USER, RuleScope.PROJECT);

    private final Map<RuleScope, Path> directories;
    private final IRuleParser parser;
    private final RuleDocumentWriter writer = new RuleDocumentWriter();
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Current snapshot keyed by {@code scope:name}; null until the first load.
     */
    private final AtomicReference<Map<String, Rule>> snapshot = new AtomicReference<>();
    private final AtomicReference<ReloadReport> lastReloadReport = new AtomicReference<>();

    private volatile Tracer tracer;

    /**
     * Store over the configured scope directories. File references may resolve into
     * any scope directory or extra allowed directory.
     */
    public FileRuleStore(RulesConfig config) {
        this(config.scopeDirectories(),
                new RuleParser(new FileReferenceResolver(config.referenceRoots(), config.maxFileReferences())),
                OpenTelemetry.noop().getTracer("agent-rules"));
    }

    /**
     * @param directories directory per persistent scope; scopes without an entry cannot be saved to
     * @throws IllegalArgumentException if a directory is given for the session scope
     */
    public FileRuleStore(Map<RuleScope, Path> directories, IRuleParser parser, Tracer tracer) {
        EnumMap<RuleScope, Path> copy = new EnumMap<>(RuleScope.class);
        directories.forEach((scope, dir) -> {
            if (!scope.isPersistent()) {
                throw new IllegalArgumentException("Scope '" + scope.value() + "' cannot be backed by a directory");
            }
            copy.put(scope, dir);
        });
        this.directories = Collections.unmodifiableMap(copy);
        this.parser = parser;
        this.tracer = tracer;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    public Map<RuleScope, Path> directories() {
        return directories;
    }

    public Optional<Path> directory(RuleScope scope) {
        return Optional.ofNullable(directories.get(scope));
    }

    /**
     * File a rule with this name is saved to.
     *
     * @throws IllegalArgumentException if the scope has no directory or the name is not a safe file name
     */
    public Path rulePath(String name, RuleScope scope) {
        Path dir = directories.get(scope);
        if (dir == null) {
            throw new IllegalArgumentException("No rules directory configured for scope: " + scope.value());
        }
        requireSafeName(name);
        return dir.resolve(name + RuleParser.RULE_FILE_EXTENSION);
    }

    /**
     * Report of the most recent reload, if one has run.
     */
    public Optional<ReloadReport> lastReloadReport() {
        return Optional.ofNullable(lastReloadReport.get());
    }

    // ==================== Reads ====================

    @Override
    public List<Rule> listRules(RuleScope scope) {
        return rules().values().stream()
                .filter(rule -> scope == null || rule.scope() == scope)
                .toList();
    }

    @Override
    public Optional<Rule> getRule(String name, RuleScope scope) {
        return Optional.ofNullable(rules().get(Rule.cacheKey(scope, name)));
    }

    private Map<String, Rule> rules() {
        Map<String, Rule> current = snapshot.get();
        if (current != null) {
            return current;
        }
        writeLock.lock();
        try {
            if (snapshot.get() == null) {
                reloadInternal();
            }
            return snapshot.get();
        } finally {
            writeLock.unlock();
        }
    }

    // ==================== Mutations ====================

    @Override
    public ReloadReport reload() {
        writeLock.lock();
        try {
            return reloadInternal();
        } finally {
            writeLock.unlock();
        }
    }

    private ReloadReport reloadInternal() {
        Span span = tracer.spanBuilder("reload-rules").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            Map<String, Rule> loaded = new LinkedHashMap<>();
            List<ParseFailure> failures = new ArrayList<>();

            for (RuleScope scope : LOAD_ORDER) {
                Path dir = directories.get(scope);
                if (dir == null) {
                    continue;
                }
                DirectoryScanResult result = parser.scanDirectory(dir, scope);
                for (Rule rule : result.rules()) {
                    Rule previous = loaded.put(rule.cacheKey(), rule);
                    if (previous != null) {
                        logger.warning(String.format("Rule '%s' is defined twice in %s scope (%s, %s); keeping %s",
                                rule.name(), scope.value(), previous.sourcePath(), rule.sourcePath(), rule.sourcePath()));
                    }
                }
                failures.addAll(result.failures());
            }

            snapshot.set(Collections.unmodifiableMap(loaded));
            ReloadReport report = new ReloadReport(loaded.size(), failures, Instant.now());
            lastReloadReport.set(report);

            span.setAttribute("ruleCount", loaded.size());
            span.setAttribute("failureCount", failures.size());
            if (failures.isEmpty()) {
                logger.info("Loaded " + loaded.size() + " rules");
            } else {
                logger.warning("Loaded " + loaded.size() + " rules, skipped " + failures.size() + " invalid files");
            }
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Writes the rule to {@code <scope dir>/<name>.md}, creating the directory when
     * needed, and publishes it. A previous document of the same rule under another file
     * name in the scope directory is removed.
     *
     * @throws IllegalArgumentException if the rule's scope has no directory or its name is unsafe
     */
    @Override
    public Rule saveRule(Rule rule) throws IOException {
        Path path = rulePath(rule.name(), rule.scope());

        Span span = tracer.spanBuilder("save-rule").startSpan();
        writeLock.lock();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("rule", rule.cacheKey());
            Map<String, Rule> current = rules();

            String document = writer.write(rule);
            Files.createDirectories(path.getParent());
            Files.writeString(path, document, StandardCharsets.UTF_8);
            removeStaleDocument(current.get(rule.cacheKey()), path);

            Rule stored = rule.toBuilder()
                    .sourcePath(path.toString())
                    .updatedAt(Instant.now())
                    .build();
            Map<String, Rule> next = new LinkedHashMap<>(current);
            next.put(stored.cacheKey(), stored);
            snapshot.set(Collections.unmodifiableMap(next));

            logger.info("Saved rule '" + rule.name() + "' to " + path);
            return stored;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            writeLock.unlock();
            span.end();
        }
    }

    // A rule loaded from a differently named file would come back from that file on reload.
    private void removeStaleDocument(Rule previous, Path savedPath) throws IOException {
        if (previous == null || previous.sourcePath() == null) {
            return;
        }
        Path oldPath = Path.of(previous.sourcePath()).toAbsolutePath().normalize();
        Path dir = directories.get(previous.scope()).toAbsolutePath().normalize();
        if (oldPath.equals(savedPath.toAbsolutePath().normalize()) || !oldPath.startsWith(dir)) {
            return;
        }
        if (Files.deleteIfExists(oldPath)) {
            logger.info("Removed previous document of rule '" + previous.name() + "': " + oldPath);
        }
    }

    /**
     * Deletes the rule's document (its recorded source path, or {@code <name>.md}) and
     * drops it from the snapshot.
     *
     * @throws IllegalArgumentException if the scope has no directory or the name is unsafe
     */
    @Override
    public boolean deleteRule(String name, RuleScope scope) throws IOException {
        Path defaultPath = rulePath(name, scope);

        Span span = tracer.spanBuilder("delete-rule").startSpan();
        writeLock.lock();
        try (Scope ignored = span.makeCurrent()) {
            String key = Rule.cacheKey(scope, name);
            span.setAttribute("rule", key);
            Map<String, Rule> current = rules();
            Rule cached = current.get(key);

            Path path = cached != null && cached.sourcePath() != null
                    ? Path.of(cached.sourcePath())
                    : defaultPath;
            boolean fileDeleted = Files.deleteIfExists(path);

            if (cached != null) {
                Map<String, Rule> next = new LinkedHashMap<>(current);
                next.remove(key);
                snapshot.set(Collections.unmodifiableMap(next));
            }

            boolean deleted = fileDeleted || cached != null;
            if (deleted) {
                logger.info("Deleted rule '" + name + "' from " + scope.value() + " scope");
            }
            return deleted;
        } catch (IOException | RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            writeLock.unlock();
            span.end();
        }
    }

    private static void requireSafeName(String name) {
        if (name == null || name.isBlank()
                || name.indexOf('/') >= 0
                || name.indexOf('\\') >= 0
                || name.indexOf('\0') >= 0
                || name.startsWith(".")
                || name.contains("..")) {
            logger.log(Level.WARNING, "Rejected unsafe rule name: {0}", name);
            throw new IllegalArgumentException("Rule name is not a safe file name: '" + name + "'");
        }
    }
}
