package com.helios.agentrules.runtime.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class GlobPatternTest {

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource(delimiter = '|', value = {
        "*.py            | app.py                 | true",
        "*.py            | src/app.py             | false",
        "src/*.py        | src/app.py             | true",
        "src/*.py        | src/pkg/app.py         | false",
        "src/**/*.py     | src/app.py             | true",
        "src/**/*.py     | src/a/b/c/app.py       | true",
        "src/**/*.py     | lib/app.py             | false",
        "**/*.tsx        | App.tsx                | true",
        "**/*.tsx        | src/components/App.tsx | true",
        "**/*.tsx        | src/App.ts             | false",
        "docs/**         | docs/a/b.md            | true",
        "file?.txt       | file1.txt              | true",
        "file?.txt       | file10.txt             | false",
        "file?.txt       | file/.txt              | false",
        "[abc].md        | b.md                   | true",
        "[!abc].md       | d.md                   | true",
        "[!abc].md       | a.md                   | false",
        "[a-c]x          | bx                     | true",
        "*.{ts,tsx}      | index.tsx              | true",
        "*.{ts,tsx}      | index.ts               | true",
        "*.{ts,tsx}      | index.js               | false",
        "{src,lib}/**    | lib/x/y.rs             | true",
        "a+b(1).txt      | a+b(1).txt             | true",
        "a.txt           | abtxt                  | false",
        "[unclosed       | [unclosed              | true",
        "{open           | {open                  | true",
    })
    @DisplayName("Should match full paths with glob semantics")
    void shouldMatch(String glob, String path, boolean expected) {
        assertThat(GlobPattern.compile(glob).matches(path)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should fall back to the file name")
    void shouldMatchBasename() {
        GlobPattern pattern = GlobPattern.compile("*.py");

        assertThat(pattern.matchesPathOrBasename("src/deep/app.py")).isTrue();
        assertThat(pattern.matchesPathOrBasename("src/deep/app.pyc")).isFalse();
    }

    @Test
    @DisplayName("Should treat backslashes in paths as separators")
    void shouldNormalizeBackslashes() {
        GlobPattern pattern = GlobPattern.compile("src/**/*.java");

        assertThat(pattern.matches("src\\main\\App.java")).isTrue();
        assertThat(GlobPattern.compile("*.java").matchesPathOrBasename("src\\main\\App.java")).isTrue();
    }

    @Test
    @DisplayName("Should honour escapes in the glob")
    void shouldHonourEscapes() {
        GlobPattern pattern = GlobPattern.compile("\\*.md");

        assertThat(pattern.matches("*.md")).isTrue();
        assertThat(pattern.matches("readme.md")).isFalse();
    }
}
