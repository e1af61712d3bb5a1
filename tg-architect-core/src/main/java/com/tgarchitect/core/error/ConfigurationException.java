package com.tgarchitect.core.error;

import com.tgarchitect.core.config.ConfigValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fail-fast configuration error.
 *
 * <p>Thrown before any file is parsed when the operator supplied settings are out of
 * range. Carries every issue found, not just the first one.
 */
public class ConfigurationException extends TerragruntException {

    private final List<ConfigValidationIssue> issues;

    public ConfigurationException(List<ConfigValidationIssue> issues) {
        super(ErrorCode.INVALID_CONFIGURATION, buildMessage(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ConfigValidationIssue> getIssues() {
        return issues;
    }

    public List<ConfigValidationIssue> getErrors() {
        return issues.stream().filter(ConfigValidationIssue::isError).toList();
    }

    public List<ConfigValidationIssue> getWarnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }

    private static String buildMessage(List<ConfigValidationIssue> issues) {
        return "Terragrunt configuration validation failed: " + issues.stream()
            .filter(ConfigValidationIssue::isError)
            .map(issue -> issue.field() + ": " + issue.message())
            .collect(Collectors.joining("; "));
    }
}
