/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.compiler;

import com.helios.agentrules.api.exceptions.RuleValidationException;
import com.helios.agentrules.api.model.Rule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Serialises a {@link Rule} to the on-disk document format read by {@link RuleParser}.
 *
 * <p>Only non-default optional fields are written. Metadata entries that are not standard
 * fields are appended to the header so they survive a save. Parsing the output yields a rule
 * with the same name, description, content, inclusion, pattern, priority and flags.
 */
public final class RuleDocumentWriter {

    private static final Pattern KEY = Pattern.compile("\\w+");

    public String write(Rule rule) {
        requireSingleLine("name", rule.name());
        requireSingleLine("description", rule.description());

        List<String> lines = new ArrayList<>();
        lines.add("---");
        lines.add(RuleParser.KEY_NAME + ": " + quoteIfNeeded(rule.name()));
        lines.add(RuleParser.KEY_DESCRIPTION + ": " + quoteIfNeeded(rule.description()));
        lines.add(RuleParser.KEY_INCLUSION + ": " + rule.inclusion().value());
        if (rule.fileMatchPattern() != null) {
            requireSingleLine("fileMatchPattern", rule.fileMatchPattern());
            lines.add(RuleParser.KEY_FILE_MATCH_PATTERN + ": " + quoteIfNeeded(rule.fileMatchPattern()));
        }
        if (rule.priority() != Rule.DEFAULT_PRIORITY) {
            lines.add(RuleParser.KEY_PRIORITY + ": " + rule.priority());
        }
        if (rule.override()) {
            lines.add(RuleParser.KEY_OVERRIDE + ": true");
        }
        if (!rule.enabled()) {
            lines.add(RuleParser.KEY_ENABLED + ": false");
        }
        for (Map.Entry<String, String> entry : rule.metadata().entrySet()) {
            if (isExtraField(entry.getKey(), entry.getValue())) {
                lines.add(entry.getKey() + ": " + quoteIfNeeded(entry.getValue()));
            }
        }
        lines.add("---");
        lines.add("");
        lines.add(rule.content());
        return String.join("\n", lines);
    }

    private static boolean isExtraField(String key, String value) {
        return !RuleParser.STANDARD_KEYS.contains(key)
            && KEY.matcher(key).matches()
            && value != null
            && !containsLineBreak(value);
    }

    // Outer quotes and whitespace are stripped on parse unless a matching pair encloses them.
    private static String quoteIfNeeded(String value) {
        if (value.isEmpty() || !value.equals(value.strip()) || isQuote(value.charAt(0))
                || isQuote(value.charAt(value.length() - 1))) {
            return "\"" + value + "\"";
        }
        return value;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }

    private static void requireSingleLine(String field, String value) {
        if (containsLineBreak(value)) {
            throw new RuleValidationException("Rule " + field + " cannot contain line breaks: " + value);
        }
    }

    private static boolean containsLineBreak(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }
}
