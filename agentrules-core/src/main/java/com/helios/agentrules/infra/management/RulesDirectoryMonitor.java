/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.infra.management;

import com.helios.agentrules.api.model.ReloadReport;
import com.helios.agentrules.compiler.RuleParser;
import com.helios.agentrules.infra.config.RulesConfig;
import com.helios.agentrules.infra.store.FileRuleStore;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Polls the rule directories of a {@link FileRuleStore} and reloads the store when
 * their contents change.
 *
 * <p>A change is any difference in the set of rule files or in a file's size or
 * modification time. A reload that throws leaves the previous rules active and is
 * retried on the next change.
 */
public class RulesDirectoryMonitor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RulesDirectoryMonitor.class.getName());

    private final FileRuleStore store;
    private final Duration interval;
    private final Tracer tracer;
    private final ScheduledExecutorService monitoringExecutor;

    private volatile List<String> lastFingerprint;

    public RulesDirectoryMonitor(FileRuleStore store, Duration interval, Tracer tracer) {
        this.store = store;
        this.interval = interval;
        this.tracer = tracer;
        this.monitoringExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Rules-Directory-Monitor");
            t.setDaemon(true);
            return t;
        });
        this.lastFingerprint = fingerprint();
    }

    /**
     * Monitor polling at the configured {@code rules.monitor.interval.seconds}.
     */
    public static RulesDirectoryMonitor create(FileRuleStore store, RulesConfig config, Tracer tracer) {
        return new RulesDirectoryMonitor(store, config.monitorInterval(), tracer);
    }

    public Duration interval() {
        return interval;
    }

    public void start() {
        long millis = interval.toMillis();
        monitoringExecutor.scheduleAtFixedRate(this::checkForUpdates, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("Watching rule directories every " + interval.toSeconds() + "s: " + store.directories().values());
    }

    public void shutdown() {
        monitoringExecutor.shutdown();
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Reloads the store if the directories changed since the last check.
     *
     * @return true if a reload ran
     */
    boolean checkForUpdates() {
        Span span = tracer.spanBuilder("check-for-rule-updates").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            List<String> current = fingerprint();
            if (current.equals(lastFingerprint)) {
                return false;
            }
            span.addEvent("Change detected. Triggering reload.");
            logger.info("Change detected in rule directories. Reloading...");
            ReloadReport report = store.reload();
            lastFingerprint = current;
            span.setAttribute("ruleCount", report.loadedCount());
            return true;
        } catch (Exception e) {
            span.recordException(e);
            logger.log(Level.SEVERE, "Failed to reload rules. Previous rules remain active.", e);
            return false;
        } finally {
            span.end();
        }
    }

    /**
     * One entry per rule file: path, size and modification time, in a stable order.
     */
    List<String> fingerprint() {
        List<String> entries = new ArrayList<>();
        for (Path dir : store.directories().values()) {
            if (!Files.isDirectory(dir)) {
                entries.add(dir + "|absent");
                continue;
            }
            try (Stream<Path> files = Files.list(dir)) {
                files.filter(p -> p.getFileName().toString().endsWith(RuleParser.RULE_FILE_EXTENSION))
                        .sorted()
                        .forEach(p -> entries.add(describe(p)));
            } catch (IOException e) {
                logger.log(Level.WARNING, "Could not list rule directory " + dir, e);
                entries.add(dir + "|unreadable");
            }
        }
        return entries;
    }

    private static String describe(Path file) {
        try {
            return file + "|" + Files.size(file) + "|" + Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            return file + "|unreadable";
        }
    }
}
