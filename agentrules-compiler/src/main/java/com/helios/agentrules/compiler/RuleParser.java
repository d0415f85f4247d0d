/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.compiler;

import com.helios.agentrules.api.IRuleParser;
import com.helios.agentrules.api.exceptions.RuleValidationException;
import com.helios.agentrules.api.model.DirectoryScanResult;
import com.helios.agentrules.api.model.ParseFailure;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleInclusion;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.api.model.ValidationReport;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parses Markdown rule documents with a {@code ---} delimited header into {@link Rule}s.
 *
 * <p>Document format:
 * <pre>
 * ---
 * name: coding-standards
 * description: Python coding standards
 * inclusion: fileMatch
 * fileMatchPattern: *.py
 * priority: 60
 * ---
 *
 * Follow PEP 8.
 * </pre>
 *
 * <h2>Error contract</h2>
 * <ul>
 *   <li>{@link #parse} and {@link #parseFile} throw {@link RuleValidationException}
 *       for malformed headers, missing required fields, invalid values and oversized files</li>
 *   <li>{@link #scanDirectory} never throws for a single bad file; it reports the file as a
 *       {@link ParseFailure} and continues</li>
 * </ul>
 *
 * <p>When constructed with a {@link FileReferenceResolver}, {@code #[[file:...]]} references
 * in the body are expanded relative to the document's directory.
 *
 * <p>The parser holds no mutable state and can be shared between threads.
 */
public class RuleParser implements IRuleParser {
    private static final Logger logger = Logger.getLogger(RuleParser.class.getName());

    /** Hard cap on the size of a rule document: 1 MiB. */
    public static final long MAX_RULE_FILE_SIZE = 1024L * 1024L;

    /** Bodies longer than this produce a validation warning. */
    public static final int LARGE_CONTENT_WARNING_THRESHOLD = 50_000;

    public static final String RULE_FILE_EXTENSION = ".md";

    static final String KEY_NAME = "name";
    static final String KEY_DESCRIPTION = "description";
    static final String KEY_INCLUSION = "inclusion";
    static final String KEY_FILE_MATCH_PATTERN = "fileMatchPattern";
    static final String KEY_PRIORITY = "priority";
    static final String KEY_OVERRIDE = "override";
    static final String KEY_ENABLED = "enabled";

    static final Set<String> STANDARD_KEYS = Set.of(
        KEY_NAME, KEY_DESCRIPTION, KEY_INCLUSION, KEY_FILE_MATCH_PATTERN,
        KEY_PRIORITY, KEY_OVERRIDE, KEY_ENABLED);

    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1", "on");

    private static final String MISSING_FRONTMATTER =
        "Missing or invalid frontmatter. Rule files must start with '---' followed by key: value lines";

    private final FileReferenceResolver referenceResolver;
    private final Tracer tracer;

    /**
     * Creates a parser that leaves file references untouched.
     */
    public RuleParser() {
        this(null, OpenTelemetry.noop().getTracer("agent-rules"));
    }

    public RuleParser(FileReferenceResolver referenceResolver) {
        this(referenceResolver, OpenTelemetry.noop().getTracer("agent-rules"));
    }

    public RuleParser(FileReferenceResolver referenceResolver, Tracer tracer) {
        this.referenceResolver = referenceResolver;
        this.tracer = tracer;
    }

    public Optional<FileReferenceResolver> referenceResolver() {
        return Optional.ofNullable(referenceResolver);
    }

    @Override
    public Rule parse(String document, RuleScope scope, String sourcePath) {
        if (document == null) {
            throw new RuleValidationException(MISSING_FRONTMATTER);
        }
        long size = document.getBytes(StandardCharsets.UTF_8).length;
        if (size > MAX_RULE_FILE_SIZE) {
            throw new RuleValidationException(
                "Rule document exceeds size limit (" + size + " > " + MAX_RULE_FILE_SIZE + ")");
        }
        Frontmatter frontmatter = Frontmatter.read(document)
            .orElseThrow(() -> new RuleValidationException(MISSING_FRONTMATTER));

        requireField(frontmatter, KEY_NAME);
        requireField(frontmatter, KEY_DESCRIPTION);

        String content = frontmatter.body().strip();
        if (referenceResolver != null && sourcePath != null) {
            Path base = Path.of(sourcePath).toAbsolutePath().getParent();
            content = referenceResolver.resolve(content, base);
        }

        return Rule.builder(frontmatter.get(KEY_NAME), frontmatter.get(KEY_DESCRIPTION))
            .content(content)
            .scope(scope)
            .inclusion(parseInclusion(frontmatter.get(KEY_INCLUSION)))
            .fileMatchPattern(frontmatter.get(KEY_FILE_MATCH_PATTERN))
            .priority(parsePriority(frontmatter.get(KEY_PRIORITY)))
            .override(parseBoolean(frontmatter.get(KEY_OVERRIDE), false))
            .enabled(parseBoolean(frontmatter.get(KEY_ENABLED), true))
            .sourcePath(sourcePath)
            .metadata(frontmatter.fields())
            .build();
    }

    @Override
    public Optional<Rule> parseFile(Path file, RuleScope scope) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        String document;
        try {
            long size = Files.size(file);
            if (size > MAX_RULE_FILE_SIZE) {
                throw new RuleValidationException(
                    "Rule file exceeds size limit (" + size + " > " + MAX_RULE_FILE_SIZE + "): " + file);
            }
            document = Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new RuleValidationException("Failed to read rule file (encoding error): " + file, e);
        } catch (IOException e) {
            throw new RuleValidationException("Failed to read rule file: " + file, e);
        }
        return Optional.of(parse(document, scope, file.toString()));
    }

    @Override
    public DirectoryScanResult scanDirectory(Path directory, RuleScope scope) {
        if (directory == null || !Files.isDirectory(directory)) {
            return DirectoryScanResult.empty();
        }

        Span span = tracer.spanBuilder("scan-rule-directory").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("directory", directory.toString());
            span.setAttribute("scope", scope.value());

            List<Path> files;
            try (Stream<Path> entries = Files.list(directory)) {
                files = entries
                    .filter(p -> p.getFileName().toString().endsWith(RULE_FILE_EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
            } catch (IOException e) {
                span.recordException(e);
                logger.warning("Failed to list rule directory " + directory + ": " + e.getMessage());
                return new DirectoryScanResult(List.of(),
                    List.of(new ParseFailure(directory.toString(), "Failed to list directory: " + e.getMessage())));
            }

            List<Rule> rules = new ArrayList<>();
            List<ParseFailure> failures = new ArrayList<>();
            for (Path file : files) {
                try {
                    parseFile(file, scope).ifPresent(rules::add);
                } catch (RuleValidationException e) {
                    logger.warning("Failed to parse rule file " + file + ": " + e.getMessage());
                    failures.add(new ParseFailure(file.toString(), e.getMessage()));
                } catch (RuntimeException e) {
                    logger.severe("Unexpected error loading rule " + file + ": " + e);
                    failures.add(new ParseFailure(file.toString(), "Unexpected error: " + e));
                }
            }

            span.setAttribute("ruleCount", rules.size());
            span.setAttribute("failureCount", failures.size());
            logger.fine(() -> "Loaded " + rules.size() + " " + scope.value() + " rules from " + directory);
            return new DirectoryScanResult(rules, failures);
        } finally {
            span.end();
        }
    }

    @Override
    public ValidationReport validate(String document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Optional<Frontmatter> parsed = document == null ? Optional.empty() : Frontmatter.read(document);
        if (parsed.isEmpty()) {
            errors.add("Missing or invalid frontmatter");
            return new ValidationReport(false, errors, warnings);
        }
        Frontmatter frontmatter = parsed.get();

        for (String key : List.of(KEY_NAME, KEY_DESCRIPTION)) {
            if (!frontmatter.hasValue(key)) {
                errors.add("Missing required field: " + key);
            }
        }
        RuleInclusion inclusion = RuleInclusion.ALWAYS;
        try {
            inclusion = parseInclusion(frontmatter.get(KEY_INCLUSION));
        } catch (RuleValidationException e) {
            errors.add(e.getMessage());
        }
        try {
            int priority = parsePriority(frontmatter.get(KEY_PRIORITY));
            if (priority < Rule.MIN_PRIORITY || priority > Rule.MAX_PRIORITY) {
                errors.add("Priority must be between " + Rule.MIN_PRIORITY + " and " + Rule.MAX_PRIORITY
                    + ", got " + priority);
            }
        } catch (RuleValidationException e) {
            errors.add(e.getMessage());
        }
        if (inclusion == RuleInclusion.FILE_MATCH && !frontmatter.hasValue(KEY_FILE_MATCH_PATTERN)) {
            errors.add("fileMatch inclusion requires fileMatchPattern");
        }

        if (frontmatter.body().length() > LARGE_CONTENT_WARNING_THRESHOLD) {
            warnings.add("Rule content is very large, may impact performance");
        }
        return new ValidationReport(errors.isEmpty(), errors, warnings);
    }

    private static void requireField(Frontmatter frontmatter, String key) {
        if (!frontmatter.hasValue(key)) {
            throw new RuleValidationException("Missing required field: " + key);
        }
    }

    static RuleInclusion parseInclusion(String value) {
        if (value == null || value.isBlank()) {
            return RuleInclusion.ALWAYS;
        }
        return RuleInclusion.fromValue(value.strip());
    }

    static int parsePriority(String value) {
        if (value == null || value.isBlank()) {
            return Rule.DEFAULT_PRIORITY;
        }
        try {
            return Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            throw new RuleValidationException("Invalid priority value: '" + value + "'", e);
        }
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return TRUE_VALUES.contains(value.strip().toLowerCase(Locale.ROOT));
    }
}
