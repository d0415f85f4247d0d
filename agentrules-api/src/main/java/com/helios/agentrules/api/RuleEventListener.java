/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api;

import com.helios.agentrules.api.events.RuleDebugEvent;
import com.helios.agentrules.api.events.RulesAppliedEvent;

/**
 * Callback interface for rule evaluation events.
 * Lets the agent runtime forward rule activity to its own event stream or UI.
 *
 * <p>Listeners are invoked synchronously on the evaluating thread. An exception
 * thrown by a listener is logged and does not affect the evaluation result.
 *
 * <h2>Usage</h2>
 * <pre>
 * engine.addListener(new RuleEventListener() {
 *     {@literal @}Override
 *     public void onRulesApplied(RulesAppliedEvent event) {
 *         System.out.printf("%d rules applied%n", event.triggeredRules().size());
 *     }
 * });
 * </pre>
 */
public interface RuleEventListener {

    /**
     * Called after every evaluation, including ones where no rule applied.
     *
     * @param event summary of the applied rules
     */
    void onRulesApplied(RulesAppliedEvent event);

    /**
     * Called after every evaluation while debug mode is enabled.
     *
     * @param event full evaluation trace
     */
    default void onRuleDebug(RuleDebugEvent event) {
    }
}
