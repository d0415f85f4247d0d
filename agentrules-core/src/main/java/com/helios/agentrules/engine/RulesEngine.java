/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.engine;

import com.helios.agentrules.api.IRuleStore;
import com.helios.agentrules.api.IRulesEngine;
import com.helios.agentrules.api.RuleEventListener;
import com.helios.agentrules.api.events.RuleDebugEvent;
import com.helios.agentrules.api.events.RulesAppliedEvent;
import com.helios.agentrules.api.model.ConflictReport;
import com.helios.agentrules.api.model.EvaluationTrace;
import com.helios.agentrules.api.model.MatchContext;
import com.helios.agentrules.api.model.MatchOutcome;
import com.helios.agentrules.api.model.MergeResult;
import com.helios.agentrules.api.model.ReloadReport;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.api.model.RulesEvaluation;
import com.helios.agentrules.compiler.analysis.RuleConflictAnalyzer;
import com.helios.agentrules.infra.config.RulesConfig;
import com.helios.agentrules.infra.store.FileRuleStore;
import com.helios.agentrules.infra.telemetry.TracingService;
import com.helios.agentrules.runtime.context.MatchContextExtractor;
import com.helios.agentrules.runtime.evaluation.RuleMatcher;
import com.helios.agentrules.runtime.evaluation.RuleMerger;
import com.helios.agentrules.runtime.render.PromptSectionRenderer;
import com.helios.agentrules.runtime.render.TraceFormatter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates agent rules for one request at a time: collects stored and session rules,
 * matches them against the request, merges the survivors under the precedence policy,
 * renders the prompt section and records a trace.
 *
 * <p>Thread-safe. The only mutable state is the last trace and the listener list.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RulesEngine engine = RulesEngine.create(RulesConfig.loadDefault());
 * String prompt = engine.applyToSystemPrompt(basePrompt, MatchContext.builder()
 *     .currentFile("src/App.tsx")
 *     .userQuery("refactor this component")
 *     .build());
 * }</pre>
 */
public class RulesEngine implements IRulesEngine {
    private static final Logger logger = Logger.getLogger(RulesEngine.class.getName());

    private final IRuleStore store;
    private final Tracer tracer;
    private final boolean reloadBeforeEvaluate;

    private final RuleMatcher matcher = new RuleMatcher();
    private final RuleMerger merger;
    private final PromptSectionRenderer renderer = new PromptSectionRenderer();
    private final TraceFormatter traceFormatter = new TraceFormatter();
    private final RuleConflictAnalyzer conflictAnalyzer = new RuleConflictAnalyzer();
    private final MatchContextExtractor contextExtractor = new MatchContextExtractor();

    private final List<RuleEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<EvaluationTrace> lastTrace = new AtomicReference<>();
    private volatile boolean debugMode;

    public RulesEngine(IRuleStore store, RulesConfig config, Tracer tracer) {
        this.store = Objects.requireNonNull(store, "IRuleStore cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.merger = new RuleMerger(config.maxContentSize());
        this.debugMode = config.debugMode();
        this.reloadBeforeEvaluate = config.reloadBeforeEvaluate();
        this.store.setTracer(tracer);
    }

    /**
     * Engine over a {@link FileRuleStore} for the configured directories, traced through
     * the process-wide {@link TracingService}.
     */
    public static RulesEngine create(RulesConfig config) {
        return new RulesEngine(new FileRuleStore(config), config, TracingService.getInstance().getTracer());
    }

    public IRuleStore store() {
        return store;
    }

    // ==================== Evaluation ====================

    @Override
    public RulesEvaluation evaluate(MatchContext context, List<Rule> sessionRules) {
        Span span = tracer.spanBuilder("evaluate-rules").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            if (reloadBeforeEvaluate) {
                store.reload();
            }

            List<Rule> candidates = new ArrayList<>(store.listRules());
            for (Rule rule : sessionRules) {
                candidates.add(rule.scope() == RuleScope.SESSION ? rule : rule.withScope(RuleScope.SESSION));
            }

            String requestId = UUID.randomUUID().toString().substring(0, 8);
            Instant timestamp = Instant.now();
            MatchOutcome outcome = matcher.match(candidates, context);
            MergeResult merged = merger.merge(outcome.matched());

            EvaluationTrace trace = new EvaluationTrace(
                    requestId,
                    timestamp,
                    candidates.stream().map(Rule::name).toList(),
                    outcome.matched(),
                    outcome.skipped(),
                    merged.conflicts(),
                    merged.finalRuleNames(),
                    merged.totalContentSize());
            lastTrace.set(trace);

            span.setAttribute("requestId", requestId);
            span.setAttribute("evaluatedCount", candidates.size());
            span.setAttribute("matchedCount", outcome.matched().size());
            span.setAttribute("finalCount", merged.finalRules().size());
            span.setAttribute("totalContentSize", merged.totalContentSize());

            boolean debug = debugMode;
            emitEvents(trace, debug);

            String section = renderer.render(merged.finalRules());
            if (debug) {
                section = section + traceFormatter.format(trace);
            }

            logger.fine(() -> String.format("Request %s: %d evaluated, %d matched, %d applied (%d bytes)",
                    requestId, candidates.size(), outcome.matched().size(),
                    merged.finalRules().size(), merged.totalContentSize()));
            return new RulesEvaluation(section, merged.finalRules(), trace);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public String applyToSystemPrompt(String systemPrompt, MatchContext context) {
        return PromptSectionRenderer.appendToPrompt(systemPrompt, evaluate(context).promptSection());
    }

    /**
     * Evaluates rules for a raw user message, picking up {@code @rule} mentions and
     * file references from its text.
     */
    public RulesEvaluation evaluateMessage(String userText, String sessionId, String assistantId) {
        return evaluate(contextExtractor.extract(userText, sessionId, assistantId));
    }

    private void emitEvents(EvaluationTrace trace, boolean debug) {
        if (listeners.isEmpty()) {
            return;
        }
        RulesAppliedEvent applied = RulesAppliedEvent.fromTrace(trace);
        RuleDebugEvent debugEvent = debug ? new RuleDebugEvent(trace) : null;
        for (RuleEventListener listener : listeners) {
            try {
                listener.onRulesApplied(applied);
                if (debugEvent != null) {
                    listener.onRuleDebug(debugEvent);
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Rule event listener failed for request " + trace.requestId(), e);
            }
        }
    }

    // ==================== Conflicts ====================

    @Override
    public ConflictReport detectConflicts() {
        Span span = tracer.spanBuilder("detect-rule-conflicts").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            ConflictReport report = conflictAnalyzer.analyze(store.listRules());
            span.setAttribute("conflictCount", report.conflictCount());
            span.setAttribute("warningCount", report.warnings().size());
            return report;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    // ==================== Trace & Debug ====================

    @Override
    public Optional<EvaluationTrace> lastTrace() {
        return Optional.ofNullable(lastTrace.get());
    }

    /**
     * Names of the rules applied by the last evaluation, in output order.
     */
    public List<String> triggeredRules() {
        EvaluationTrace trace = lastTrace.get();
        return trace == null ? List.of() : trace.finalRules();
    }

    public void setDebugMode(boolean enabled) {
        this.debugMode = enabled;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    @Override
    public void addListener(RuleEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(RuleEventListener listener) {
        listeners.remove(listener);
    }

    // ==================== Rule management ====================

    public List<Rule> listRules(RuleScope scope) {
        return store.listRules(scope);
    }

    public List<Rule> listRules() {
        return store.listRules();
    }

    public Optional<Rule> getRule(String name) {
        return store.getRule(name);
    }

    public Optional<Rule> getRule(String name, RuleScope scope) {
        return store.getRule(name, scope);
    }

    public Rule saveRule(Rule rule) throws IOException {
        return store.saveRule(rule);
    }

    public boolean deleteRule(String name, RuleScope scope) throws IOException {
        return store.deleteRule(name, scope);
    }

    public ReloadReport reload() {
        return store.reload();
    }
}
