/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.infra.store;

import com.helios.agentrules.api.IRuleStore;
import com.helios.agentrules.api.model.ReloadReport;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleScope;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Rule store without persistence. Accepts every scope, including session.
 *
 * <p>Used for tests and for hosts that manage rule documents themselves. Follows the
 * same snapshot discipline as {@link FileRuleStore}: each mutation publishes a new
 * immutable map.
 */
public class InMemoryRuleStore implements IRuleStore {

    private final AtomicReference<Map<String, Rule>> rules = new AtomicReference<>(Map.of());

    public InMemoryRuleStore() {
    }

    public InMemoryRuleStore(Collection<Rule> initialRules) {
        initialRules.forEach(this::put);
    }

    @Override
    public List<Rule> listRules(RuleScope scope) {
        return rules.get().values().stream()
                .filter(rule -> scope == null || rule.scope() == scope)
                .toList();
    }

    @Override
    public Optional<Rule> getRule(String name, RuleScope scope) {
        return Optional.ofNullable(rules.get().get(Rule.cacheKey(scope, name)));
    }

    @Override
    public Rule saveRule(Rule rule) {
        put(rule);
        return rule;
    }

    @Override
    public boolean deleteRule(String name, RuleScope scope) {
        String key = Rule.cacheKey(scope, name);
        if (!rules.get().containsKey(key)) {
            return false;
        }
        update(current -> {
            Map<String, Rule> next = new LinkedHashMap<>(current);
            next.remove(key);
            return next;
        });
        return true;
    }

    /**
     * Nothing to re-read; reports the current rule count.
     */
    @Override
    public ReloadReport reload() {
        return new ReloadReport(rules.get().size(), List.of(), null);
    }

    public void clear() {
        rules.set(Map.of());
    }

    private void put(Rule rule) {
        update(current -> {
            Map<String, Rule> next = new LinkedHashMap<>(current);
            next.put(rule.cacheKey(), rule);
            return next;
        });
    }

    private void update(UnaryOperator<Map<String, Rule>> change) {
        rules.updateAndGet(current -> Collections.unmodifiableMap(change.apply(current)));
    }
}
