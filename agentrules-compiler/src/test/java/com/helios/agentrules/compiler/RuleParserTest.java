package com.helios.agentrules.compiler;

import com.helios.agentrules.api.exceptions.RuleValidationException;
import com.helios.agentrules.api.model.DirectoryScanResult;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleInclusion;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.api.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleParserTest {

    private RuleParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new RuleParser();
    }

    @Nested
    @DisplayName("Single document parsing")
    class Parse {

        @Test
        @DisplayName("Should parse all standard fields")
        void shouldParseAllFields() {
            String document = """
                ---
                name: react-rules
                description: "React conventions"
                inclusion: fileMatch
                fileMatchPattern: '*.tsx'
                priority: 70
                override: yes
                enabled: off
                owner: web-team
                ---

                # React

                Use function components.
                """;

            Rule rule = parser.parse(document, RuleScope.PROJECT, null);

            assertThat(rule.name()).isEqualTo("react-rules");
            assertThat(rule.description()).isEqualTo("React conventions");
            assertThat(rule.inclusion()).isEqualTo(RuleInclusion.FILE_MATCH);
            assertThat(rule.fileMatchPattern()).isEqualTo("*.tsx");
            assertThat(rule.priority()).isEqualTo(70);
            assertThat(rule.override()).isTrue();
            assertThat(rule.enabled()).isFalse();
            assertThat(rule.scope()).isEqualTo(RuleScope.PROJECT);
            assertThat(rule.content()).isEqualTo("# React\n\nUse function components.");
            assertThat(rule.metadata())
                .containsEntry("owner", "web-team")
                .containsEntry("name", "react-rules");
        }

        @Test
        @DisplayName("Should apply defaults for optional fields")
        void shouldApplyDefaults() {
            Rule rule = parser.parse("---\nname: a\ndescription: b\n---\nbody", RuleScope.GLOBAL, "/rules/a.md");

            assertThat(rule.inclusion()).isEqualTo(RuleInclusion.ALWAYS);
            assertThat(rule.priority()).isEqualTo(50);
            assertThat(rule.override()).isFalse();
            assertThat(rule.enabled()).isTrue();
            assertThat(rule.sourcePath()).isEqualTo("/rules/a.md");
            assertThat(rule.content()).isEqualTo("body");
        }

        @Test
        @DisplayName("Should ignore comments, blank lines and CRLF line endings")
        void shouldHandleCommentsAndCrlf() {
            String document = "---\r\n# a comment\r\n\r\nname: a\r\ndescription: b\r\n---\r\ncontent\r\n";

            Rule rule = parser.parse(document, RuleScope.USER, null);

            assertThat(rule.name()).isEqualTo("a");
            assertThat(rule.content()).isEqualTo("content");
        }

        @Test
        @DisplayName("Should reject document without frontmatter")
        void shouldRejectMissingFrontmatter() {
            assertThatThrownBy(() -> parser.parse("# Just markdown", RuleScope.PROJECT, null))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("Missing or invalid frontmatter");
        }

        @Test
        @DisplayName("Should reject an in-memory document over the size limit")
        void shouldRejectOversizedDocument() {
            String document = "---\nname: big\ndescription: d\n---\n"
                + "x".repeat((int) RuleParser.MAX_RULE_FILE_SIZE + 1);

            assertThatThrownBy(() -> parser.parse(document, RuleScope.PROJECT, null))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("exceeds size limit");
        }

        @Test
        @DisplayName("Should name the missing required field")
        void shouldNameMissingField() {
            assertThatThrownBy(() -> parser.parse("---\ndescription: b\n---\n", RuleScope.PROJECT, null))
                .isInstanceOf(RuleValidationException.class)
                .hasMessage("Missing required field: name");
            assertThatThrownBy(() -> parser.parse("---\nname: a\ndescription:\n---\n", RuleScope.PROJECT, null))
                .isInstanceOf(RuleValidationException.class)
                .hasMessage("Missing required field: description");
        }

        @Test
        @DisplayName("Should reject invalid inclusion mode")
        void shouldRejectInvalidInclusion() {
            assertThatThrownBy(() -> parser.parse("---\nname: a\ndescription: b\ninclusion: sometimes\n---\n",
                RuleScope.PROJECT, null))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("Invalid inclusion mode");
        }

        @ParameterizedTest
        @CsvSource({"0, Priority must be between", "101, Priority must be between", "high, Invalid priority value"})
        @DisplayName("Should reject bad priorities")
        void shouldRejectBadPriority(String priority, String message) {
            String document = "---\nname: a\ndescription: b\npriority: " + priority + "\n---\n";
            assertThatThrownBy(() -> parser.parse(document, RuleScope.PROJECT, null))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining(message);
        }

        @Test
        @DisplayName("Should reject fileMatch without pattern")
        void shouldRejectFileMatchWithoutPattern() {
            assertThatThrownBy(() -> parser.parse("---\nname: a\ndescription: b\ninclusion: fileMatch\n---\n",
                RuleScope.PROJECT, null))
                .isInstanceOf(RuleValidationException.class);
        }

        @ParameterizedTest
        @CsvSource({"true, true", "YES, true", "1, true", "on, true", "false, false", "nope, false"})
        @DisplayName("Should parse boolean spellings")
        void shouldParseBooleans(String value, boolean expected) {
            Rule rule = parser.parse("---\nname: a\ndescription: b\noverride: " + value + "\n---\n",
                RuleScope.PROJECT, null);
            assertThat(rule.override()).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("File parsing")
    class ParseFile {

        @Test
        @DisplayName("Should return empty for a missing file")
        void shouldReturnEmptyForMissingFile() {
            assertThat(parser.parseFile(tempDir.resolve("missing.md"), RuleScope.PROJECT)).isEmpty();
        }

        @Test
        @DisplayName("Should record the source path")
        void shouldRecordSourcePath() throws IOException {
            Path file = tempDir.resolve("style.md");
            Files.writeString(file, "---\nname: style\ndescription: Style\n---\nBe terse.");

            Optional<Rule> rule = parser.parseFile(file, RuleScope.USER);

            assertThat(rule).isPresent();
            assertThat(rule.get().sourcePath()).isEqualTo(file.toString());
            assertThat(rule.get().scope()).isEqualTo(RuleScope.USER);
        }

        @Test
        @DisplayName("Should reject files over 1 MiB")
        void shouldRejectOversizedFile() throws IOException {
            Path file = tempDir.resolve("huge.md");
            Files.writeString(file, "---\nname: huge\ndescription: d\n---\n" + "x".repeat(1024 * 1024));

            assertThatThrownBy(() -> parser.parseFile(file, RuleScope.PROJECT))
                .isInstanceOf(RuleValidationException.class)
                .hasMessageContaining("exceeds size limit");
        }
    }

    @Nested
    @DisplayName("Directory scan")
    class ScanDirectory {

        @Test
        @DisplayName("Should load valid files and report the malformed one")
        void shouldSkipMalformedFiles() throws IOException {
            for (int i = 1; i <= 3; i++) {
                Files.writeString(tempDir.resolve("rule" + i + ".md"),
                    "---\nname: rule" + i + "\ndescription: Rule " + i + "\n---\nContent " + i);
            }
            Files.writeString(tempDir.resolve("broken.md"), "no frontmatter here");
            Files.writeString(tempDir.resolve("notes.txt"), "ignored");

            DirectoryScanResult result = parser.scanDirectory(tempDir, RuleScope.GLOBAL);

            assertThat(result.rules()).extracting(Rule::name).containsExactly("rule1", "rule2", "rule3");
            assertThat(result.failures()).singleElement().satisfies(failure -> {
                assertThat(failure.path()).endsWith("broken.md");
                assertThat(failure.reason()).contains("frontmatter");
            });
        }

        @Test
        @DisplayName("Should skip oversized files instead of failing")
        void shouldSkipOversizedFiles() throws IOException {
            Files.writeString(tempDir.resolve("ok.md"), "---\nname: ok\ndescription: d\n---\n");
            Files.writeString(tempDir.resolve("huge.md"),
                "---\nname: huge\ndescription: d\n---\n" + "x".repeat(1024 * 1024 + 1));

            DirectoryScanResult result = parser.scanDirectory(tempDir, RuleScope.PROJECT);

            assertThat(result.rules()).extracting(Rule::name).containsExactly("ok");
            assertThat(result.failures()).hasSize(1);
        }

        @Test
        @DisplayName("Should return an empty result for a missing directory")
        void shouldHandleMissingDirectory() {
            DirectoryScanResult result = parser.scanDirectory(tempDir.resolve("nope"), RuleScope.PROJECT);

            assertThat(result.rules()).isEmpty();
            assertThat(result.failures()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validate {

        @Test
        @DisplayName("Should collect all errors without throwing")
        void shouldCollectErrors() {
            ValidationReport report = parser.validate("---\ninclusion: weird\npriority: 500\n---\n");

            assertThat(report.valid()).isFalse();
            assertThat(report.errors()).contains(
                "Missing required field: name",
                "Missing required field: description");
            assertThat(report.errors()).anyMatch(e -> e.contains("Invalid inclusion mode"));
            assertThat(report.errors()).anyMatch(e -> e.contains("Priority must be between"));
        }

        @Test
        @DisplayName("Should warn on very large content")
        void shouldWarnOnLargeContent() {
            ValidationReport report = parser.validate("---\nname: a\ndescription: b\n---\n" + "y".repeat(50_001));

            assertThat(report.valid()).isTrue();
            assertThat(report.warnings()).hasSize(1);
        }

        @Test
        @DisplayName("Should flag missing frontmatter")
        void shouldFlagMissingFrontmatter() {
            ValidationReport report = parser.validate("plain text");

            assertThat(report.valid()).isFalse();
            assertThat(report.errors()).containsExactly("Missing or invalid frontmatter");
        }
    }
}
