package com.tgarchitect.core.validation;

import java.util.Set;

/**
 * Switches for {@link ValidationService}.
 *
 * @param checkDuplicates run the TG01x duplicate rules
 * @param checkCrossReferences run the TG02x rules against resolved includes and dependencies
 * @param checkBestPractices run the TG03x rules
 * @param disabledRules rule ids whose issues are dropped
 */
public record ValidationOptions(
    boolean checkDuplicates,
    boolean checkCrossReferences,
    boolean checkBestPractices,
    Set<String> disabledRules
) {
    public ValidationOptions {
        disabledRules = disabledRules == null ? Set.of() : Set.copyOf(disabledRules);
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(true, true, true, Set.of());
    }

    public ValidationOptions withBestPractices(boolean enabled) {
        return new ValidationOptions(checkDuplicates, checkCrossReferences, enabled, disabledRules);
    }

    public ValidationOptions withDisabledRules(Set<String> rules) {
        return new ValidationOptions(checkDuplicates, checkCrossReferences, checkBestPractices, rules);
    }

    public boolean isEnabled(ValidationRule rule) {
        return !disabledRules.contains(rule.id()) && (checkBestPractices || !rule.bestPractice());
    }
}
