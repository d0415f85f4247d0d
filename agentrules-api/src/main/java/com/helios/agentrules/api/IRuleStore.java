package com.helios.agentrules.api;

import com.helios.agentrules.api.model.ReloadReport;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleScope;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Contract for a catalogue of rules across scopes.
 *
 * <p>Reads are served from an in-memory snapshot and never block. Implementations
 * must publish changes atomically: a reader sees either the old or the new rule set,
 * never a mix.
 */
public interface IRuleStore {

    /**
     * Lists all rules, optionally restricted to one scope.
     *
     * @param scope scope filter, or null for all scopes
     */
    List<Rule> listRules(RuleScope scope);

    default List<Rule> listRules() {
        return listRules(null);
    }

    /**
     * Looks a rule up by name in one scope.
     */
    Optional<Rule> getRule(String name, RuleScope scope);

    /**
     * Looks a rule up by name, searching project, user, then global scope.
     * Session rules are never returned.
     */
    default Optional<Rule> getRule(String name) {
        for (RuleScope scope : RuleScope.LOOKUP_ORDER) {
            Optional<Rule> rule = getRule(name, scope);
            if (rule.isPresent()) {
                return rule;
            }
        }
        return Optional.empty();
    }

    default boolean ruleExists(String name, RuleScope scope) {
        return getRule(name, scope).isPresent();
    }

    /**
     * Persists a rule in its scope, replacing any rule with the same name there.
     *
     * @return the stored rule (with its source path set when backed by a file)
     * @throws IOException if the rule cannot be written
     */
    Rule saveRule(Rule rule) throws IOException;

    /**
     * Removes a rule.
     *
     * @return true if a rule was deleted
     * @throws IOException if the backing document cannot be removed
     */
    boolean deleteRule(String name, RuleScope scope) throws IOException;

    /**
     * Rebuilds the rule set from its source and swaps it in.
     */
    ReloadReport reload();

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
