package com.tgarchitect.core.validation;

import java.util.List;
import java.util.Set;

/**
 * Outcome of validating one file.
 *
 * @param valid true when no error-level issue was found
 * @param issues issues in discovery order
 * @param errorCount error issues
 * @param warningCount warning issues
 * @param infoCount info issues
 * @param rulesChecked ids of the rules that ran
 * @param durationMillis validation time
 */
public record ValidationResult(
    boolean valid,
    List<ValidationIssue> issues,
    int errorCount,
    int warningCount,
    int infoCount,
    Set<String> rulesChecked,
    long durationMillis
) {
    public ValidationResult {
        issues = List.copyOf(issues);
        rulesChecked = Set.copyOf(rulesChecked);
    }

    static ValidationResult of(List<ValidationIssue> issues, Set<String> rulesChecked, long durationMillis) {
        int errors = count(issues, ValidationSeverity.ERROR);
        return new ValidationResult(errors == 0, issues, errors, count(issues, ValidationSeverity.WARNING),
            count(issues, ValidationSeverity.INFO), rulesChecked, durationMillis);
    }

    public List<ValidationIssue> issuesWithCode(String code) {
        return issues.stream().filter(issue -> issue.code().equals(code)).toList();
    }

    private static int count(List<ValidationIssue> issues, ValidationSeverity severity) {
        return (int) issues.stream().filter(issue -> issue.severity() == severity).count();
    }
}
