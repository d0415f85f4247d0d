/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code key: value} header of a rule document and the body that follows it.
 *
 * <p>The header is delimited by {@code ---} lines at the very start of the document.
 * Only single-level scalar pairs are understood: blank lines and lines starting with
 * {@code #} are ignored, keys are word characters, and surrounding quotes are stripped
 * from values. One matching pair of quotes protects whatever it encloses, including
 * quote characters and outer whitespace. Lines that are not key/value pairs are ignored.
 *
 * @param fields header entries in document order
 * @param body   everything after the closing delimiter, untrimmed
 */
record Frontmatter(Map<String, String> fields, String body) {

    private static final Pattern DOCUMENT = Pattern.compile("\\A---[ \\t]*\\n(.*?)\\n---[ \\t]*(?:\\n|\\z)", Pattern.DOTALL);
    private static final Pattern FIELD = Pattern.compile("^(\\w+):\\s*(.*)$");

    Frontmatter {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Splits a document into header and body.
     *
     * @return empty when the document does not start with a delimited header
     */
    static Optional<Frontmatter> read(String document) {
        String normalized = normalizeLineEndings(document);
        Matcher matcher = DOCUMENT.matcher(normalized);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Map<String, String> fields = new LinkedHashMap<>();
        for (String rawLine : matcher.group(1).split("\n")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            Matcher field = FIELD.matcher(line);
            if (field.matches()) {
                fields.put(field.group(1), unquote(field.group(2).strip()));
            }
        }
        return Optional.of(new Frontmatter(fields, normalized.substring(matcher.end())));
    }

    String get(String key) {
        return fields.get(key);
    }

    boolean hasValue(String key) {
        String value = fields.get(key);
        return value != null && !value.isBlank();
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    // A value wrapped in one matching pair of quotes keeps everything inside them. Otherwise
    // any run of double quotes, then any run of single quotes, is stripped from both ends.
    static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
                return value.substring(1, value.length() - 1);
            }
        }
        return stripChar(stripChar(value, '"'), '\'');
    }

    private static String stripChar(String value, char c) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == c) start++;
        while (end > start && value.charAt(end - 1) == c) end--;
        return value.substring(start, end);
    }
}
