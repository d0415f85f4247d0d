/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.model;

import java.util.List;

/**
 * Everything the agent runtime needs after evaluating rules for one request.
 *
 * @param promptSection rendered text to append to the system prompt, empty when no rule applies
 * @param finalRules    rules that made it into {@code promptSection}, in order
 * @param trace         audit trace of the evaluation
 */
public record RulesEvaluation(String promptSection, List<Rule> finalRules, EvaluationTrace trace) {

    public RulesEvaluation {
        promptSection = promptSection == null ? "" : promptSection;
        finalRules = List.copyOf(finalRules);
    }

    public boolean hasRules() {
        return !finalRules.isEmpty();
    }
}
