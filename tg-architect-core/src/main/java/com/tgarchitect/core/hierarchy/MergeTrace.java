package com.tgarchitect.core.hierarchy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Records which file contributed each merged field.
 *
 * <p>Keys are {@code locals.<name>}, {@code inputs.<name>}, {@code remote_state} and
 * {@code terraform}.
 *
 * @param origins field key to contributing file path
 */
public record MergeTrace(Map<String, String> origins) {

    public static final String REMOTE_STATE = "remote_state";
    public static final String TERRAFORM = "terraform";

    public MergeTrace {
        origins = origins == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(origins));
    }

    public Optional<String> originOf(String field) {
        return Optional.ofNullable(origins.get(field));
    }

    public Optional<String> localOrigin(String name) {
        return originOf("locals." + name);
    }

    public Optional<String> inputOrigin(String name) {
        return originOf("inputs." + name);
    }
}
