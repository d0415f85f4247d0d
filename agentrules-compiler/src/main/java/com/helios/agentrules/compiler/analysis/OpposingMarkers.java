/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.compiler.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Two sets of words that suggest opposite instructions, e.g. "always" against "never".
 * Words are matched whole and case-insensitively.
 *
 * @param positive words asking for something
 * @param negative words asking for the opposite
 */
public record OpposingMarkers(Set<String> positive, Set<String> negative) {

    public static final List<OpposingMarkers> DEFAULTS = List.of(
        of(List.of("always", "must", "required"), List.of("never", "forbidden", "prohibited")),
        of(List.of("enable", "allow", "permit"), List.of("disable", "deny", "block")),
        of(List.of("include", "add"), List.of("exclude", "remove"))
    );

    public OpposingMarkers {
        if (positive.isEmpty() || negative.isEmpty()) {
            throw new IllegalArgumentException("Both marker sets must be non-empty");
        }
        positive = lowercase(positive);
        negative = lowercase(negative);
    }

    public static OpposingMarkers of(List<String> positive, List<String> negative) {
        return new OpposingMarkers(Set.copyOf(positive), Set.copyOf(negative));
    }

    boolean hasPositive(Set<String> words) {
        return containsAny(words, positive);
    }

    boolean hasNegative(Set<String> words) {
        return containsAny(words, negative);
    }

    private static boolean containsAny(Set<String> words, Set<String> markers) {
        for (String marker : markers) {
            if (words.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> lowercase(Set<String> words) {
        return words.stream()
            .map(w -> w.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }
}
