/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.agentrules.api.exceptions;

/**
 * Exception thrown when a rule document or rule value is invalid.
 *
 * <p>Covers malformed frontmatter, missing required fields, invalid enum values,
 * out-of-range priorities and oversized documents. Raised by direct parse calls
 * and by the {@code Rule} constructor; directory scans catch it and report the
 * offending file instead.
 */
public class RuleValidationException extends RuntimeException {

    public RuleValidationException(String message) {
        super(message);
    }

    public RuleValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
