package com.tgarchitect.core.model.block;

import com.tgarchitect.core.model.SourceLocation;

import java.util.List;

/**
 * {@code retry_config { ... }} block.
 *
 * @param retryableErrors error patterns that trigger a retry
 * @param maxRetryAttempts max_retry_attempts, default 3
 * @param sleepBetweenRetries sleep_between_retries in seconds, default 5
 * @param location location
 * @param raw raw text
 */
public record RetryConfigBlock(
    List<String> retryableErrors,
    long maxRetryAttempts,
    long sleepBetweenRetries,
    SourceLocation location,
    String raw
) implements TerragruntBlock {

    public static final long DEFAULT_MAX_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_SLEEP_BETWEEN_RETRIES = 5;

    public RetryConfigBlock {
        retryableErrors = retryableErrors == null ? List.of() : List.copyOf(retryableErrors);
        raw = raw == null ? "" : raw;
    }

    @Override
    public BlockKind kind() {
        return BlockKind.RETRY_CONFIG;
    }
}
