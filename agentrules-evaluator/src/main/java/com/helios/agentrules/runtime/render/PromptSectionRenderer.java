/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.runtime.render;

import com.helios.agentrules.api.model.Rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders merged rules as a Markdown section for the system prompt.
 *
 * <pre>
 * ## Agent Rules
 *
 * The following rules guide your behavior:
 *
 * ### style
 *
 * *Coding style*
 *
 * Prefer small functions.
 * </pre>
 *
 * The output depends only on the argument; an empty list renders as an empty string.
 */
public final class PromptSectionRenderer {

    public static final String HEADER = "## Agent Rules\n";
    public static final String PREAMBLE = "The following rules guide your behavior:\n";

    public String render(List<Rule> rules) {
        if (rules.isEmpty()) {
            return "";
        }
        List<String> sections = new ArrayList<>(2 + rules.size() * 4);
        sections.add(HEADER);
        sections.add(PREAMBLE);
        for (Rule rule : rules) {
            sections.add("### " + rule.name() + "\n");
            sections.add("*" + rule.description() + "*\n");
            sections.add(rule.content());
            sections.add("\n");
        }
        return String.join("\n", sections);
    }

    /**
     * Appends a rendered section to an existing system prompt.
     *
     * @return the prompt and section separated by a blank line, the section alone when the
     *         prompt is blank, or the prompt unchanged when the section is empty
     */
    public static String appendToPrompt(String systemPrompt, String section) {
        if (section == null || section.isEmpty()) {
            return systemPrompt == null ? "" : systemPrompt;
        }
        if (systemPrompt == null || systemPrompt.isBlank()) {
            return section;
        }
        return systemPrompt + "\n\n" + section;
    }
}
