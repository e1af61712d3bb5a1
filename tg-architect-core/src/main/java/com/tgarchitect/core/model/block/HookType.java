package com.tgarchitect.core.model.block;

/**
 * When a terraform hook runs.
 */
public enum HookType {
    BEFORE,
    AFTER,
    ERROR
}
