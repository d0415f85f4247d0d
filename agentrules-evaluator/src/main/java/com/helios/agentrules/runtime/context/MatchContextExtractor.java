/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.runtime.context;

import com.helios.agentrules.api.model.MatchContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link MatchContext} from a raw user message.
 *
 * <p>Recognized references:
 * <ul>
 *   <li>manual rule mentions: {@code @rule-name}</li>
 *   <li>file names in backticks with an extension: {@code `src/app.py`}</li>
 *   <li>{@code file:path} and {@code path:path} prefixes</li>
 * </ul>
 * Duplicates are removed, first occurrence wins.
 */
public final class MatchContextExtractor {

    static final Pattern MANUAL_REFERENCE = Pattern.compile("@(\\w[\\w\\-]*)");
    static final Pattern BACKTICK_FILE = Pattern.compile("`([^`]+\\.\\w+)`");
    static final Pattern FILE_PREFIX = Pattern.compile("file:(\\S+)");
    static final Pattern PATH_PREFIX = Pattern.compile("path:(\\S+)");

    public MatchContext extract(String userText, String sessionId, String assistantId) {
        String text = userText == null ? "" : userText;
        return MatchContext.builder()
            .userQuery(text)
            .currentFiles(fileReferences(text))
            .manualRules(manualReferences(text))
            .sessionId(sessionId)
            .assistantId(assistantId)
            .build();
    }

    public List<String> manualReferences(String text) {
        return List.copyOf(findAll(MANUAL_REFERENCE, text, new LinkedHashSet<>()));
    }

    public List<String> fileReferences(String text) {
        Set<String> files = new LinkedHashSet<>();
        findAll(BACKTICK_FILE, text, files);
        findAll(FILE_PREFIX, text, files);
        findAll(PATH_PREFIX, text, files);
        return new ArrayList<>(files);
    }

    private static Set<String> findAll(Pattern pattern, String text, Set<String> into) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            into.add(matcher.group(1));
        }
        return into;
    }
}
