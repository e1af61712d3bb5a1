package com.tgarchitect.core.linker;

import java.util.Objects;
import java.util.Optional;

/**
 * A classified {@code terraform.source} string and the components that apply to its type.
 *
 * <table>
 *   <caption>Components per type</caption>
 *   <tr><th>Type</th><th>Components</th></tr>
 *   <tr><td>local</td><td>path</td></tr>
 *   <tr><td>registry</td><td>host (private registries), registryAddress, version, subdirectory</td></tr>
 *   <tr><td>git</td><td>url, host, ref, subdirectory</td></tr>
 *   <tr><td>s3, gcs</td><td>url, host, bucket, path, subdirectory</td></tr>
 *   <tr><td>http</td><td>url, host, subdirectory</td></tr>
 * </table>
 *
 * @param raw trimmed source text
 * @param type classification
 * @param path local path, or object path inside a bucket
 * @param url remote URL without subdirectory and query
 * @param host remote host
 * @param registryAddress {@code NAMESPACE/NAME/PROVIDER}
 * @param ref git ref
 * @param version registry version
 * @param subdirectory subdirectory after {@code //}
 * @param bucket s3 or gcs bucket
 */
public record TerraformSourceExpression(
    String raw,
    SourceType type,
    String path,
    String url,
    String host,
    String registryAddress,
    String ref,
    String version,
    String subdirectory,
    String bucket
) {
    public TerraformSourceExpression {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public boolean isExternal() {
        return type.isExternal();
    }

    public Optional<String> getPath() {
        return Optional.ofNullable(path);
    }

    public Optional<String> getRef() {
        return Optional.ofNullable(ref);
    }

    public Optional<String> getVersion() {
        return Optional.ofNullable(version);
    }

    public Optional<String> getSubdirectory() {
        return Optional.ofNullable(subdirectory);
    }

    /**
     * Version pin of the source: the registry version, else the git ref.
     *
     * @return version constraint, or null
     */
    public String versionConstraint() {
        return version != null ? version : ref;
    }
}
