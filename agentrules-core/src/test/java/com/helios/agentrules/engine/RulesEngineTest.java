package com.helios.agentrules.engine;

import com.helios.agentrules.api.IRuleStore;
import com.helios.agentrules.api.RuleEventListener;
import com.helios.agentrules.api.events.RuleDebugEvent;
import com.helios.agentrules.api.events.RulesAppliedEvent;
import com.helios.agentrules.api.model.ConflictReport;
import com.helios.agentrules.api.model.EvaluationTrace;
import com.helios.agentrules.api.model.MatchContext;
import com.helios.agentrules.api.model.MergeConflict;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleInclusion;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.api.model.RulesEvaluation;
import com.helios.agentrules.api.model.SkippedRule;
import com.helios.agentrules.infra.config.RulesConfig;
import com.helios.agentrules.infra.store.FileRuleStore;
import com.helios.agentrules.infra.store.InMemoryRuleStore;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RulesEngine")
class RulesEngineTest {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");

    @TempDir
    Path tempDir;

    @Mock
    private RuleEventListener listener;

    private InMemoryRuleStore store;
    private RulesConfig config;

    @BeforeEach
    void setUp() {
        store = new InMemoryRuleStore();
        config = RulesConfig.builder().homeDir(tempDir).build();
    }

    private RulesEngine engine() {
        return new RulesEngine(store, config, tracer);
    }

    private static Rule always(String name, RuleScope scope, int priority, String content) {
        return Rule.builder(name, name + " rule")
                .scope(scope)
                .priority(priority)
                .content(content)
                .build();
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("project style replaces global style and the duplicate is recorded")
        void scopePrecedence() {
            store.saveRule(always("style", RuleScope.GLOBAL, 50, "global style"));
            store.saveRule(always("style", RuleScope.PROJECT, 50, "project style"));

            RulesEvaluation evaluation = engine().evaluate(MatchContext.empty());

            assertThat(evaluation.finalRules()).singleElement()
                    .extracting(Rule::scope).isEqualTo(RuleScope.PROJECT);
            assertThat(evaluation.promptSection()).contains("project style").doesNotContain("global style");
            assertThat(evaluation.trace().conflicts()).containsExactly(
                    new MergeConflict("style", "style", "duplicate name, keeping project scope"));
        }

        @Test
        @DisplayName("an override rule from the user scope wins over a high-priority global rule")
        void overrideEscapeHatch() {
            store.saveRule(always("security", RuleScope.GLOBAL, 90, "global security"));
            store.saveRule(always("security", RuleScope.USER, 10, "user security")
                    .toBuilder().override(true).build());

            RulesEvaluation evaluation = engine().evaluate(MatchContext.empty());

            assertThat(evaluation.finalRules()).singleElement()
                    .extracting(Rule::content).isEqualTo("user security");
            assertThat(evaluation.trace().conflicts()).singleElement()
                    .extracting(MergeConflict::reason).isEqualTo("overridden by user scope");
        }

        @Test
        @DisplayName("a fileMatch rule records only the files that matched")
        void fileMatch() {
            store.saveRule(Rule.builder("react-rules", "React").fileMatch("**/*.tsx").content("hooks").build());

            RulesEvaluation evaluation = engine().evaluate(MatchContext.builder()
                    .currentFiles(List.of("src/App.tsx", "README.md"))
                    .build());

            assertThat(evaluation.trace().matchedRules()).singleElement().satisfies(match -> {
                assertThat(match.rule().name()).isEqualTo("react-rules");
                assertThat(match.matchedFiles()).containsExactly("src/App.tsx");
            });
        }

        @Test
        @DisplayName("truncation keeps the highest-precedence prefix within the size limit")
        void truncation() {
            store.saveRule(always("A", RuleScope.PROJECT, 50, "aaaaaa"));
            store.saveRule(always("B", RuleScope.PROJECT, 50, "bbbbbb"));
            RulesEngine engine = new RulesEngine(store, config.toBuilder().maxContentSize(10).build(), tracer);

            RulesEvaluation evaluation = engine.evaluate(MatchContext.empty());

            assertThat(evaluation.trace().finalRules()).containsExactly("A");
            assertThat(evaluation.trace().matchedRuleNames()).containsExactly("A", "B");
            assertThat(evaluation.trace().totalContentSize()).isEqualTo(6);
        }

        @Test
        @DisplayName("a reference outside the allowed directories renders as a blocked marker")
        void blockedReference() throws IOException {
            Path projectDir = tempDir.resolve("project/.helios/rules");
            Files.createDirectories(projectDir);
            Files.writeString(tempDir.resolve("project/secrets.env"), "API_KEY=hunter2");
            Files.writeString(projectDir.resolve("env.md"),
                    "---\nname: env\ndescription: Environment\n---\nSettings: #[[file:../../secrets.env]]");

            RulesConfig fileConfig = config.toBuilder().projectRoot(tempDir.resolve("project")).build();
            RulesEngine engine = new RulesEngine(new FileRuleStore(fileConfig), fileConfig, tracer);

            RulesEvaluation evaluation = engine.evaluate(MatchContext.empty());

            assertThat(evaluation.promptSection())
                    .contains("[File reference blocked: ../../secrets.env]")
                    .doesNotContain("hunter2");
        }
    }

    @Nested
    @DisplayName("Evaluation")
    class Evaluation {

        @Test
        @DisplayName("the trace lists evaluated, matched and skipped rules with reasons")
        void traceContents() {
            store.saveRule(always("style", RuleScope.PROJECT, 50, "tabs"));
            store.saveRule(Rule.builder("review", "Review checklist").inclusion(RuleInclusion.MANUAL).build());
            store.saveRule(always("old", RuleScope.PROJECT, 50, "x").withEnabled(false));
            RulesEngine engine = engine();

            RulesEvaluation evaluation = engine.evaluate(MatchContext.empty());
            EvaluationTrace trace = evaluation.trace();

            assertThat(trace.requestId()).hasSize(8);
            assertThat(trace.evaluatedRules()).containsExactly("style", "review", "old");
            assertThat(trace.matchedRuleNames()).containsExactly("style");
            assertThat(trace.skippedRules()).containsExactly(
                    new SkippedRule("review", "not manually referenced"),
                    new SkippedRule("old", "disabled"));
            assertThat(engine.lastTrace()).contains(trace);
            assertThat(engine.triggeredRules()).containsExactly("style");
        }

        @Test
        @DisplayName("session rules join the stored rules and outrank every persistent scope")
        void sessionRules() {
            store.saveRule(always("style", RuleScope.PROJECT, 100, "project style"));

            RulesEvaluation evaluation = engine().evaluate(MatchContext.empty(),
                    List.of(always("style", RuleScope.PROJECT, 1, "session style")));

            assertThat(evaluation.finalRules()).singleElement().satisfies(rule -> {
                assertThat(rule.scope()).isEqualTo(RuleScope.SESSION);
                assertThat(rule.content()).isEqualTo("session style");
            });
        }

        @Test
        @DisplayName("no applicable rules yields an empty section")
        void emptySection() {
            store.saveRule(Rule.builder("review", "Review").inclusion(RuleInclusion.MANUAL).build());

            RulesEvaluation evaluation = engine().evaluate(MatchContext.empty());

            assertThat(evaluation.hasRules()).isFalse();
            assertThat(evaluation.promptSection()).isEmpty();
        }

        @Test
        @DisplayName("raw user messages are mined for manual references and files")
        void evaluateMessage() {
            store.saveRule(Rule.builder("security-review", "Security").inclusion(RuleInclusion.MANUAL)
                    .content("check auth").build());
            store.saveRule(Rule.builder("react", "React").fileMatch("**/*.tsx").content("hooks").build());

            RulesEvaluation evaluation = engine().evaluateMessage(
                    "@security-review please look at `src/App.tsx`", "s-1", "a-1");

            assertThat(evaluation.trace().matchedRuleNames()).containsExactlyInAnyOrder("security-review", "react");
            assertThat(evaluation.trace().matchedRules().get(0).contextVars()).containsEntry("session_id", "s-1");
        }

        @Test
        @DisplayName("the store is reloaded first when configured")
        void reloadBeforeEvaluate() {
            IRuleStore mockStore = mock(IRuleStore.class);
            when(mockStore.listRules()).thenReturn(List.of(always("style", RuleScope.GLOBAL, 50, "tabs")));
            RulesEngine engine = new RulesEngine(mockStore,
                    config.toBuilder().reloadBeforeEvaluate(true).build(), tracer);

            RulesEvaluation evaluation = engine.evaluate(MatchContext.empty());

            verify(mockStore).reload();
            assertThat(evaluation.hasRules()).isTrue();
        }
    }

    @Nested
    @DisplayName("System prompt")
    class SystemPrompt {

        @BeforeEach
        void addRule() {
            store.saveRule(always("style", RuleScope.PROJECT, 50, "Use tabs."));
        }

        @Test
        void appendsAfterBlankLine() {
            String prompt = engine().applyToSystemPrompt("You are helpful.", MatchContext.empty());

            assertThat(prompt).startsWith("You are helpful.\n\n## Agent Rules\n");
            assertThat(prompt).contains("### style\n", "Use tabs.");
        }

        @Test
        void blankPromptYieldsSectionOnly() {
            assertThat(engine().applyToSystemPrompt("  ", MatchContext.empty())).startsWith("## Agent Rules\n");
        }

        @Test
        void promptUnchangedWithoutRules() {
            store.clear();

            assertThat(engine().applyToSystemPrompt("You are helpful.", MatchContext.empty()))
                    .isEqualTo("You are helpful.");
        }

        @Test
        void debugModeAppendsTrace() {
            RulesEngine engine = engine();
            engine.setDebugMode(true);

            String prompt = engine.applyToSystemPrompt("Base.", MatchContext.empty());

            assertThat(engine.isDebugMode()).isTrue();
            assertThat(prompt).contains("## [DEBUG] Rule Evaluation Trace", "- style (project): always included");
            assertThat(prompt).endsWith("---\n");
        }
    }

    @Nested
    @DisplayName("Events")
    class Events {

        @Test
        @DisplayName("listeners receive a summary after each evaluation")
        void rulesApplied() {
            store.saveRule(always("style", RuleScope.PROJECT, 50, "Use tabs."));
            RulesEngine engine = engine();
            engine.addListener(listener);

            RulesEvaluation evaluation = engine.evaluate(MatchContext.empty());

            ArgumentCaptor<RulesAppliedEvent> captor = ArgumentCaptor.forClass(RulesAppliedEvent.class);
            verify(listener).onRulesApplied(captor.capture());
            RulesAppliedEvent event = captor.getValue();
            assertThat(event.requestId()).isEqualTo(evaluation.trace().requestId());
            assertThat(event.triggeredRules()).extracting(RulesAppliedEvent.TriggeredRule::name)
                    .containsExactly("style");
            assertThat(event.totalSize()).isEqualTo(9);
            verify(listener, never()).onRuleDebug(any());
        }

        @Test
        @DisplayName("an evaluation without applicable rules still notifies listeners")
        void emptyEvaluationNotifies() {
            RulesEngine engine = engine();
            engine.addListener(listener);

            engine.evaluate(MatchContext.empty());

            verify(listener).onRulesApplied(any(RulesAppliedEvent.class));
        }

        @Test
        @DisplayName("debug mode adds a debug event carrying the trace")
        void debugEvent() {
            RulesEngine engine = new RulesEngine(store, config.toBuilder().debugMode(true).build(), tracer);
            engine.addListener(listener);

            RulesEvaluation evaluation = engine.evaluate(MatchContext.empty());

            ArgumentCaptor<RuleDebugEvent> captor = ArgumentCaptor.forClass(RuleDebugEvent.class);
            verify(listener).onRuleDebug(captor.capture());
            assertThat(captor.getValue().trace()).isEqualTo(evaluation.trace());
        }

        @Test
        @DisplayName("a failing listener does not break the evaluation or other listeners")
        void failingListener() {
            RuleEventListener failing = mock(RuleEventListener.class);
            doThrow(new IllegalStateException("boom")).when(failing).onRulesApplied(any());
            store.saveRule(always("style", RuleScope.PROJECT, 50, "Use tabs."));
            RulesEngine engine = engine();
            engine.addListener(failing);
            engine.addListener(listener);

            RulesEvaluation evaluation = engine.evaluate(MatchContext.empty());

            assertThat(evaluation.hasRules()).isTrue();
            verify(listener).onRulesApplied(any(RulesAppliedEvent.class));
        }

        @Test
        @DisplayName("removed listeners are no longer notified")
        void removeListener() {
            RulesEngine engine = engine();
            engine.addListener(listener);
            engine.removeListener(listener);

            engine.evaluate(MatchContext.empty());

            verify(listener, never()).onRulesApplied(any());
        }
    }

    @Nested
    @DisplayName("Management")
    class Management {

        @Test
        @DisplayName("conflict detection reports rules defined in several scopes")
        void detectConflicts() {
            store.saveRule(always("style", RuleScope.GLOBAL, 50, "tabs"));
            store.saveRule(always("style", RuleScope.PROJECT, 50, "spaces"));

            ConflictReport report = engine().detectConflicts();

            assertThat(report.sameNameConflicts()).singleElement().satisfies(conflict ->
                    assertThat(conflict.resolution()).isEqualTo("project scope takes precedence"));
        }

        @Test
        @DisplayName("rule management passes through to the store")
        void crudPassThrough() throws IOException {
            RulesEngine engine = engine();

            engine.saveRule(always("style", RuleScope.USER, 50, "tabs"));

            assertThat(engine.getRule("style")).map(Rule::scope).contains(RuleScope.USER);
            assertThat(engine.listRules(RuleScope.USER)).hasSize(1);
            assertThat(engine.deleteRule("style", RuleScope.USER)).isTrue();
            assertThat(engine.listRules()).isEmpty();
            assertThat(engine.reload().loadedCount()).isZero();
        }
    }
}
