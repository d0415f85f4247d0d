/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.compiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inlines {@code #[[file:relative/path]]} references found in rule content.
 *
 * <p>Each reference is replaced by the text of the referenced file, or by a marker when
 * the file cannot be used:
 * <ul>
 *   <li>{@code [File reference blocked: path]}: outside every allowed directory, or the
 *       expansion budget is spent</li>
 *   <li>{@code [File not found: path]}</li>
 *   <li>{@code [File too large: path]}: larger than {@link RuleParser#MAX_RULE_FILE_SIZE}</li>
 *   <li>{@code [Error reading file: path]}</li>
 * </ul>
 * Resolution never throws.
 *
 * <p>Referenced files may reference further files. All references reached from one
 * document share a single budget of {@code maxReferences} expansions; once it is used up
 * every remaining reference is blocked, so chains and cycles always terminate.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class FileReferenceResolver {
    private static final Logger logger = Logger.getLogger(FileReferenceResolver.class.getName());

    public static final int DEFAULT_MAX_REFERENCES = 50;

    static final Pattern FILE_REFERENCE = Pattern.compile("#\\[\\[file:([^\\]]+)\\]\\]");

    private final List<Path> allowedDirectories;
    private final int maxReferences;

    public FileReferenceResolver(Collection<Path> allowedDirectories) {
        this(allowedDirectories, DEFAULT_MAX_REFERENCES);
    }

    public FileReferenceResolver(Collection<Path> allowedDirectories, int maxReferences) {
        if (maxReferences < 0) {
            throw new IllegalArgumentException("maxReferences must be >= 0, got: " + maxReferences);
        }
        List<Path> roots = new ArrayList<>();
        for (Path dir : allowedDirectories) {
            roots.add(canonical(dir));
        }
        this.allowedDirectories = List.copyOf(roots);
        this.maxReferences = maxReferences;
    }

    public List<Path> allowedDirectories() {
        return allowedDirectories;
    }

    public int maxReferences() {
        return maxReferences;
    }

    /**
     * Expands every reference in {@code content}.
     *
     * @param content       rule content
     * @param baseDirectory directory relative references are resolved against
     * @return content with references replaced
     */
    public String resolve(String content, Path baseDirectory) {
        if (content == null || content.indexOf("#[[file:") < 0) {
            return content;
        }
        return expand(content, baseDirectory, new Budget(maxReferences));
    }

    private String expand(String content, Path baseDirectory, Budget budget) {
        Matcher matcher = FILE_REFERENCE.matcher(content);
        StringBuilder out = new StringBuilder(content.length());
        while (matcher.find()) {
            String ref = matcher.group(1).strip();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement(ref, baseDirectory, budget)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String replacement(String ref, Path baseDirectory, Budget budget) {
        if (!budget.tryConsume()) {
            logger.warning("File reference blocked (expansion limit of " + maxReferences + " reached): " + ref);
            return blocked(ref);
        }

        Path target;
        try {
            Path refPath = Path.of(ref);
            target = canonical(refPath.isAbsolute() ? refPath : baseDirectory.resolve(refPath));
        } catch (InvalidPathException e) {
            logger.warning("File reference blocked (invalid path): " + ref);
            return blocked(ref);
        }

        if (!isAllowed(target)) {
            logger.warning("File reference blocked (outside allowed dirs): " + ref);
            return blocked(ref);
        }
        if (!Files.isRegularFile(target)) {
            logger.warning("Referenced file not found: " + ref);
            return "[File not found: " + ref + "]";
        }

        String text;
        try {
            if (Files.size(target) > RuleParser.MAX_RULE_FILE_SIZE) {
                logger.warning("Referenced file too large: " + ref);
                return "[File too large: " + ref + "]";
            }
            text = Files.readString(target, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warning("Error reading referenced file " + ref + ": " + e.getMessage());
            return "[Error reading file: " + ref + "]";
        }
        return expand(text, target.getParent(), budget);
    }

    private boolean isAllowed(Path target) {
        for (Path root : allowedDirectories) {
            if (target.startsWith(root)) {
                return true;
            }
        }
        return false;
    }

    private static String blocked(String ref) {
        return "[File reference blocked: " + ref + "]";
    }

    // Real path when the file exists so symlinks cannot escape an allowed directory.
    private static Path canonical(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            return absolute;
        }
    }

    private static final class Budget {
        private int remaining;

        Budget(int remaining) {
            this.remaining = remaining;
        }

        boolean tryConsume() {
            if (remaining <= 0) {
                return false;
            }
            remaining--;
            return true;
        }
    }
}
