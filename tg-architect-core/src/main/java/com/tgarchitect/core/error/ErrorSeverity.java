package com.tgarchitect.core.error;

import java.util.Locale;

/**
 * Severity of a parse, resolution or validation finding.
 *
 * <p>Severity tells a consumer whether the produced output is still usable:
 * {@link #WARNING} and {@link #INFO} findings leave the output complete,
 * {@link #ERROR} findings mean part of the output is missing.
 */
public enum ErrorSeverity {

    /**
     * Output is incomplete for the affected item.
     */
    ERROR,

    /**
     * Output is usable but something looks wrong.
     */
    WARNING,

    /**
     * Best-practice hint only.
     */
    INFO;

    /**
     * Returns the lower-case wire name ({@code error}, {@code warning}, {@code info}).
     *
     * @return wire name
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
