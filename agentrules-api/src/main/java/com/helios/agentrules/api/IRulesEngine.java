package com.helios.agentrules.api;

import com.helios.agentrules.api.model.ConflictReport;
import com.helios.agentrules.api.model.EvaluationTrace;
import com.helios.agentrules.api.model.MatchContext;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RulesEvaluation;

import java.util.List;
import java.util.Optional;

/**
 * Contract for evaluating agent rules against a request.
 *
 * <p>Called once per request by the agent runtime, before the model is invoked.
 */
public interface IRulesEngine {

    /**
     * Evaluates the stored rules against a request context.
     */
    default RulesEvaluation evaluate(MatchContext context) {
        return evaluate(context, List.of());
    }

    /**
     * Evaluates the stored rules plus caller-supplied session rules.
     *
     * @param context      request facts
     * @param sessionRules runtime-only rules for this request (may be empty)
     */
    RulesEvaluation evaluate(MatchContext context, List<Rule> sessionRules);

    /**
     * Appends the rendered rules to a system prompt.
     *
     * @return the prompt with rules appended after a blank line, the rules alone if the
     *         prompt is blank, or the prompt unchanged if no rule applies
     */
    String applyToSystemPrompt(String systemPrompt, MatchContext context);

    /**
     * Runs static conflict analysis over every stored rule.
     */
    ConflictReport detectConflicts();

    /**
     * Trace of the most recent evaluation, if any.
     */
    Optional<EvaluationTrace> lastTrace();

    void addListener(RuleEventListener listener);

    void removeListener(RuleEventListener listener);
}
