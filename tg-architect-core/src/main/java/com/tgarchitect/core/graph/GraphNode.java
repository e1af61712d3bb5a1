package com.tgarchitect.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Node handed to graph storage.
 *
 * <p>One node is created per Terragrunt configuration file. The source linker reuses the
 * same record with {@link NodeType#TERRAFORM_MODULE} for modules that live outside the
 * scanned tree.
 *
 * @param id unique identifier
 * @param type node type
 * @param name display name, the directory name for configuration nodes
 * @param location declaration location
 * @param dependencyCount number of dependencies declared
 * @param includeCount number of include blocks
 * @param hasRemoteState whether a remote_state block is present
 * @param terraformSource terraform.source text, or null
 * @param metadata additional attributes (scanId, absolutePath, counts, names)
 */
public record GraphNode(
    String id,
    NodeType type,
    String name,
    NodeLocation location,
    int dependencyCount,
    int includeCount,
    boolean hasRemoteState,
    String terraformSource,
    Map<String, Object> metadata
) {
    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(location, "location must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<String> getTerraformSource() {
        return Optional.ofNullable(terraformSource);
    }

    /**
     * Returns a metadata value as a string.
     *
     * @param key metadata key
     * @return value, or empty when absent
     */
    public Optional<String> metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }
}
