/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.runtime.operators;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A file glob compiled to a regular expression.
 *
 * <p>Supported syntax, with {@code /} as the only separator:
 * <ul>
 *   <li>{@code *}: any run of characters except {@code /}</li>
 *   <li>{@code ?}: one character except {@code /}</li>
 *   <li>{@code **}: any run of characters, separators included</li>
 *   <li>{@code **} followed by {@code /}: zero or more whole directories</li>
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [!abc]}: character classes</li>
 *   <li>{@code {a,b}}: alternatives, which may nest</li>
 *   <li>{@code \}: escapes the next character</li>
 * </ul>
 * Unlike shell-style {@code fnmatch} matching, {@code *} never crosses a directory boundary:
 * {@code src/*.py} matches {@code src/app.py} but not {@code src/pkg/app.py}. Use
 * {@code src/**}{@code /*.py} to match at any depth.
 * Unbalanced brackets and braces are matched literally. Backslashes in candidate paths
 * are treated as separators.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class GlobPattern {

    private static final String REGEX_META = "\\.^$|+()[]{}*?";

    private final String glob;
    private final Pattern pattern;

    private GlobPattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobPattern compile(String glob) {
        Objects.requireNonNull(glob, "glob");
        return new GlobPattern(glob, Pattern.compile(toRegex(glob)));
    }

    public String glob() {
        return glob;
    }

    /**
     * Whether the whole path matches.
     */
    public boolean matches(String path) {
        return pattern.matcher(normalize(path)).matches();
    }

    /**
     * Whether the whole path or its last segment matches.
     */
    public boolean matchesPathOrBasename(String path) {
        String normalized = normalize(path);
        if (pattern.matcher(normalized).matches()) {
            return true;
        }
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 && pattern.matcher(normalized.substring(slash + 1)).matches();
    }

    private static String normalize(String path) {
        return path.replace('\\', '/');
    }

    static String toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        int braceDepth = 0;
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> {
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                        if (i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                            regex.append("(?:.*/)?");
                            i += 3;
                        } else {
                            regex.append(".*");
                            i += 2;
                        }
                        continue;
                    }
                    regex.append("[^/]*");
                }
                case '?' -> regex.append("[^/]");
                case '[' -> {
                    int close = findClassEnd(glob, i);
                    if (close < 0) {
                        regex.append("\\[");
                    } else {
                        appendClass(regex, glob.substring(i + 1, close));
                        i = close;
                    }
                }
                case '{' -> {
                    if (hasClosingBrace(glob, i)) {
                        regex.append("(?:");
                        braceDepth++;
                    } else {
                        regex.append("\\{");
                    }
                }
                case '}' -> {
                    if (braceDepth > 0) {
                        regex.append(')');
                        braceDepth--;
                    } else {
                        regex.append("\\}");
                    }
                }
                case ',' -> regex.append(braceDepth > 0 ? "|" : ",");
                case '\\' -> {
                    if (i + 1 < glob.length()) {
                        appendLiteral(regex, glob.charAt(++i));
                    } else {
                        regex.append("\\\\");
                    }
                }
                default -> appendLiteral(regex, c);
            }
            i++;
        }
        return regex.toString();
    }

    // Index of the ']' closing the class opened at 'open', or -1. A ']' right after
    // '[' or '[!' is a literal member.
    private static int findClassEnd(String glob, int open) {
        int i = open + 1;
        if (i < glob.length() && (glob.charAt(i) == '!' || glob.charAt(i) == '^')) i++;
        if (i < glob.length() && glob.charAt(i) == ']') i++;
        while (i < glob.length()) {
            if (glob.charAt(i) == ']') {
                return i;
            }
            i++;
        }
        return -1;
    }

    private static void appendClass(StringBuilder regex, String body) {
        regex.append('[');
        int start = 0;
        if (!body.isEmpty() && (body.charAt(0) == '!' || body.charAt(0) == '^')) {
            regex.append('^');
            start = 1;
        }
        for (int k = start; k < body.length(); k++) {
            char ch = body.charAt(k);
            if (ch == '\\' || ch == '[' || ch == ']' || ch == '&' || ch == '^') {
                regex.append('\\');
            }
            regex.append(ch);
        }
        regex.append(']');
    }

    private static boolean hasClosingBrace(String glob, int open) {
        int depth = 0;
        for (int k = open; k < glob.length(); k++) {
            char ch = glob.charAt(k);
            if (ch == '\\') {
                k++;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return true;
                }
            }
        }
        return false;
    }

    private static void appendLiteral(StringBuilder regex, char c) {
        if (REGEX_META.indexOf(c) >= 0) {
            regex.append('\\');
        }
        regex.append(c);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GlobPattern other && glob.equals(other.glob);
    }

    @Override
    public int hashCode() {
        return glob.hashCode();
    }

    @Override
    public String toString() {
        return "GlobPattern[" + glob + "]";
    }
}
