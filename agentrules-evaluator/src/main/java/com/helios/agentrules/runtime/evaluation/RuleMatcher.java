/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.runtime.evaluation;

import com.helios.agentrules.api.model.MatchContext;
import com.helios.agentrules.api.model.MatchOutcome;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleMatch;
import com.helios.agentrules.api.model.SkippedRule;
import com.helios.agentrules.runtime.operators.GlobPattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

/**
 * Decides which rules apply to a request.
 *
 * <p>Matching is a pure function of the rule list and the {@link MatchContext}:
 * <ol>
 *   <li>Disabled rules are skipped first, whatever their inclusion mode.</li>
 *   <li>{@code always} rules match.</li>
 *   <li>{@code manual} rules match when their name is in {@link MatchContext#manualRules()}.</li>
 *   <li>{@code fileMatch} rules match when at least one current file matches the glob,
 *       either as a full path or by its file name. Every matching file is recorded.</li>
 * </ol>
 * Output order follows input order.
 *
 * <p>Compiled globs are cached; the cache is the only state and is safe for concurrent use.
 */
public final class RuleMatcher {
    private static final Logger logger = Logger.getLogger(RuleMatcher.class.getName());

    public static final String REASON_ALWAYS = "always included";
    public static final String REASON_MANUAL = "manually referenced";
    public static final String REASON_FILE_MATCH = "file pattern matched: ";

    public static final String SKIP_DISABLED = "disabled";
    public static final String SKIP_NOT_REFERENCED = "not manually referenced";
    public static final String SKIP_NO_PATTERN = "no file pattern specified";
    public static final String SKIP_NO_FILES = "no files matched pattern: ";
    public static final String SKIP_INVALID_PATTERN = "invalid file pattern: ";

    private static final int MAX_CACHED_GLOBS = 1024;

    private final Map<String, GlobPattern> globCache = new ConcurrentHashMap<>();

    public MatchOutcome match(List<Rule> rules, MatchContext context) {
        List<RuleMatch> matched = new ArrayList<>();
        List<SkippedRule> skipped = new ArrayList<>();
        Map<String, Object> contextVars = contextVars(context);

        for (Rule rule : rules) {
            if (!rule.enabled()) {
                skipped.add(new SkippedRule(rule.name(), SKIP_DISABLED));
                continue;
            }

            Decision decision = switch (rule.inclusion()) {
                case ALWAYS -> Decision.matched(REASON_ALWAYS, List.of());
                case MANUAL -> context.manualRules().contains(rule.name())
                    ? Decision.matched(REASON_MANUAL, List.of())
                    : Decision.skipped(SKIP_NOT_REFERENCED);
                case FILE_MATCH -> matchFiles(rule, context.currentFiles());
            };

            if (decision.matched()) {
                matched.add(new RuleMatch(rule, decision.reason(), decision.files(), contextVars));
                logger.fine(() -> "Rule '" + rule.name() + "' matched: " + decision.reason());
            } else {
                skipped.add(new SkippedRule(rule.name(), decision.reason()));
                logger.fine(() -> "Rule '" + rule.name() + "' skipped: " + decision.reason());
            }
        }
        return new MatchOutcome(matched, skipped);
    }

    private Decision matchFiles(Rule rule, List<String> files) {
        String pattern = rule.fileMatchPattern();
        if (pattern == null || pattern.isBlank()) {
            logger.warning("Rule '" + rule.name() + "' has fileMatch inclusion but no pattern");
            return Decision.skipped(SKIP_NO_PATTERN);
        }

        GlobPattern glob;
        try {
            glob = glob(pattern);
        } catch (PatternSyntaxException e) {
            logger.warning("Rule '" + rule.name() + "' has an invalid file pattern '" + pattern + "': "
                + e.getDescription());
            return Decision.skipped(SKIP_INVALID_PATTERN + pattern);
        }

        List<String> matchedFiles = new ArrayList<>();
        for (String file : files) {
            if (glob.matchesPathOrBasename(file)) {
                matchedFiles.add(file);
            }
        }
        return matchedFiles.isEmpty()
            ? Decision.skipped(SKIP_NO_FILES + pattern)
            : Decision.matched(REASON_FILE_MATCH + pattern, matchedFiles);
    }

    private GlobPattern glob(String pattern) {
        GlobPattern cached = globCache.get(pattern);
        if (cached != null) {
            return cached;
        }
        GlobPattern compiled = GlobPattern.compile(pattern);
        if (globCache.size() < MAX_CACHED_GLOBS) {
            globCache.put(pattern, compiled);
        }
        return compiled;
    }

    private static Map<String, Object> contextVars(MatchContext context) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("session_id", context.sessionId());
        vars.put("assistant_id", context.assistantId());
        vars.putAll(context.extraVars());
        return Collections.unmodifiableMap(vars);
    }

    private record Decision(boolean matched, String reason, List<String> files) {

        static Decision matched(String reason, List<String> files) {
            return new Decision(true, reason, files);
        }

        static Decision skipped(String reason) {
            return new Decision(false, reason, List.of());
        }
    }
}
