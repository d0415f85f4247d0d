package com.helios.agentrules.api;

import com.helios.agentrules.api.model.DirectoryScanResult;
import com.helios.agentrules.api.model.Rule;
import com.helios.agentrules.api.model.RuleScope;
import com.helios.agentrules.api.model.ValidationReport;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Contract for turning rule documents into {@link Rule} values.
 *
 * <p>Single-document entry points raise
 * {@link com.helios.agentrules.api.exceptions.RuleValidationException};
 * {@link #scanDirectory(Path, RuleScope)} collects failures instead.
 */
public interface IRuleParser {

    /**
     * Parses a rule document held in memory.
     *
     * @param document   full document text, frontmatter included
     * @param scope      scope to assign to the rule
     * @param sourcePath where the document came from (nullable); file references resolve relative to it
     * @return the parsed rule
     */
    Rule parse(String document, RuleScope scope, String sourcePath);

    /**
     * Parses one rule file.
     *
     * @return the rule, or empty if the file does not exist
     * @throws com.helios.agentrules.api.exceptions.RuleValidationException if the file cannot be read or parsed
     */
    Optional<Rule> parseFile(Path file, RuleScope scope);

    /**
     * Loads every rule document in a directory. Never fails because of a single bad file.
     */
    DirectoryScanResult scanDirectory(Path directory, RuleScope scope);

    /**
     * Checks a document without building a rule.
     */
    ValidationReport validate(String document);
}
