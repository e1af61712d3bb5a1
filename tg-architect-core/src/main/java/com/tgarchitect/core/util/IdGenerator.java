package com.tgarchitect.core.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic identifier generation based on SHA-256.
 *
 * <p>The same components always produce the same id, so node and edge ids are stable
 * across scans of an unchanged repository.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String id = IdGenerator.generate(scanId, "live/prod/vpc/terragrunt.hcl");
 * }</pre>
 *
 * @since 1.0.0
 */
public final class IdGenerator {

    /** Length of the shortened ids returned by {@link #generate(String...)}. */
    public static final int ID_LENGTH = 16;

    private static final String SEPARATOR = ":";

    private IdGenerator() {
        // Utility class
    }

    /**
     * Generates a short id from one or more components.
     *
     * @param components id components, joined in order
     * @return first 16 hex characters of the SHA-256 hash
     * @throws IllegalArgumentException if no component is given
     */
    public static String generate(String... components) {
        if (components == null || components.length == 0) {
            throw new IllegalArgumentException("At least one component required");
        }
        return generateFromString(String.join(SEPARATOR, components));
    }

    /**
     * Generates a short id from a single string.
     *
     * @param input input text
     * @return first 16 hex characters of the SHA-256 hash
     * @throws IllegalArgumentException if input is null or blank
     */
    public static String generateFromString(String input) {
        return generateFullHash(input).substring(0, ID_LENGTH);
    }

    /**
     * Returns the full SHA-256 hash of the input as lowercase hex.
     *
     * @param input input text
     * @return 64 hex characters
     * @throws IllegalArgumentException if input is null or blank
     */
    public static String generateFullHash(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Input must not be null or blank");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
