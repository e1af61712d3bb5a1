package com.tgarchitect.core.linker;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies {@code terraform.source} strings.
 *
 * <p>Matchers run in a fixed order and the first match wins: local, s3, gcs, git,
 * registry, http, then unknown. The {@code //} subdirectory separator is searched after the
 * scheme's {@code ://}, so {@code git::https://github.com/org/repo.git//modules/vpc?ref=v1.0}
 * yields url {@code https://github.com/org/repo.git}, subdirectory {@code modules/vpc} and
 * ref {@code v1.0}.
 *
 * @since 1.0.0
 */
public final class SourceExpressionParser {

    private static final String GIT_PREFIX = "git::";
    private static final String S3_PREFIX = "s3::";
    private static final String GCS_PREFIX = "gcs::";
    private static final String PUBLIC_REGISTRY_PREFIX = "registry.terraform.io/";
    private static final String TFR_PREFIX = "tfr://";

    private static final Pattern GIT_SUFFIX = Pattern.compile("\\.git(/|$|\\?)");
    private static final Pattern GIT_HOSTS = Pattern.compile("(^|[/@.])(github\\.com|bitbucket\\.org)[/:]",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern REGISTRY_ADDRESS = Pattern.compile(
        "^(?:([a-z0-9][a-z0-9.-]*\\.[a-z]{2,})/)?([a-z0-9][a-z0-9_-]*)/([a-z0-9][a-z0-9_-]*)/([a-z0-9][a-z0-9_-]*)$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern HTTP = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern GCS_OBJECT = Pattern.compile("/storage/v1/([^/]+)/(.+)$");

    private SourceExpressionParser() {
        // Utility class
    }

    /**
     * Classifies a source string and extracts its components.
     *
     * @param raw source text
     * @return parsed source, {@link SourceType#UNKNOWN} for blank input
     */
    public static TerraformSourceExpression parseSource(String raw) {
        String text = raw == null ? "" : raw.strip();
        if (text.isEmpty()) {
            return new TerraformSourceExpression(text, SourceType.UNKNOWN, null, null, null, null, null, null, null, null);
        }
        SourceType type = classify(text);
        switch (type) {
            case LOCAL:
                return parseLocal(text);
            case S3:
                return parseBucket(text, SourceType.S3, S3_PREFIX);
            case GCS:
                return parseBucket(text, SourceType.GCS, GCS_PREFIX);
            case GIT:
                return parseGit(text);
            case REGISTRY:
                return parseRegistry(text);
            case HTTP:
                return parseHttp(text);
            default:
                Parts parts = Parts.split(text);
                return new TerraformSourceExpression(text, SourceType.UNKNOWN, null, null, null, null,
                    parts.query.get("ref"), parts.query.get("version"), parts.subdirectory, null);
        }
    }

    /**
     * Returns the source type only.
     *
     * @param raw source text
     * @return classification
     */
    public static SourceType classify(String raw) {
        String text = raw == null ? "" : raw.strip();
        if (text.startsWith("./") || text.startsWith("../") || text.startsWith("/")) {
            return SourceType.LOCAL;
        }
        if (text.startsWith(S3_PREFIX)) {
            return SourceType.S3;
        }
        if (text.startsWith(GCS_PREFIX)) {
            return SourceType.GCS;
        }
        if (text.startsWith(GIT_PREFIX) || text.startsWith("git@")
                || GIT_SUFFIX.matcher(text).find() || GIT_HOSTS.matcher(text).find()) {
            return SourceType.GIT;
        }
        if (isRegistry(text)) {
            return SourceType.REGISTRY;
        }
        if (HTTP.matcher(text).find()) {
            return SourceType.HTTP;
        }
        return SourceType.UNKNOWN;
    }

    // ==================== Per type ====================

    private static TerraformSourceExpression parseLocal(String text) {
        int query = text.indexOf('?');
        String path = query >= 0 ? text.substring(0, query) : text;
        return new TerraformSourceExpression(text, SourceType.LOCAL, path, null, null, null, null, null, null, null);
    }

    private static TerraformSourceExpression parseGit(String text) {
        String withoutPrefix = text.startsWith(GIT_PREFIX) ? text.substring(GIT_PREFIX.length()) : text;
        Parts parts = Parts.split(withoutPrefix);
        return new TerraformSourceExpression(text, SourceType.GIT, null, parts.base, gitHost(parts.base),
            null, parts.query.get("ref"), null, parts.subdirectory, null);
    }

    private static TerraformSourceExpression parseRegistry(String text) {
        Parts parts = Parts.split(stripRegistryPrefix(text));
        Matcher m = REGISTRY_ADDRESS.matcher(parts.base);
        String host = null;
        String address = parts.base;
        if (m.matches()) {
            host = m.group(1);
            address = m.group(2) + "/" + m.group(3) + "/" + m.group(4);
        }
        if (host == null && text.startsWith(PUBLIC_REGISTRY_PREFIX)) {
            host = "registry.terraform.io";
        }
        return new TerraformSourceExpression(text, SourceType.REGISTRY, null, null, host, address,
            null, parts.query.get("version"), parts.subdirectory, null);
    }

    private static TerraformSourceExpression parseBucket(String text, SourceType type, String prefix) {
        Parts parts = Parts.split(text.substring(prefix.length()));
        String host = urlHost(parts.base);
        String bucket = null;
        String path = null;
        String urlPath = urlPath(parts.base);
        if (type == SourceType.GCS) {
            Matcher m = GCS_OBJECT.matcher(urlPath);
            if (m.find()) {
                bucket = m.group(1);
                path = m.group(2);
            }
        } else if (!urlPath.isEmpty()) {
            String trimmed = urlPath.startsWith("/") ? urlPath.substring(1) : urlPath;
            int slash = trimmed.indexOf('/');
            bucket = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
            path = slash >= 0 ? trimmed.substring(slash + 1) : null;
        }
        return new TerraformSourceExpression(text, type, path, parts.base, host, null,
            null, null, parts.subdirectory, bucket);
    }

    private static TerraformSourceExpression parseHttp(String text) {
        Parts parts = Parts.split(text);
        return new TerraformSourceExpression(text, SourceType.HTTP, null, parts.base, urlHost(parts.base),
            null, null, null, parts.subdirectory, null);
    }

    // ==================== Helpers ====================

    private static boolean isRegistry(String text) {
        if (text.startsWith(PUBLIC_REGISTRY_PREFIX) || text.startsWith(TFR_PREFIX)) {
            return true;
        }
        return REGISTRY_ADDRESS.matcher(Parts.split(text).base).matches();
    }

    private static String stripRegistryPrefix(String text) {
        String result = text;
        if (result.startsWith(TFR_PREFIX)) {
            result = result.substring(TFR_PREFIX.length());
            while (result.startsWith("/")) {
                result = result.substring(1);
            }
        }
        if (result.startsWith(PUBLIC_REGISTRY_PREFIX)) {
            result = result.substring(PUBLIC_REGISTRY_PREFIX.length());
        }
        return result;
    }

    private static String gitHost(String url) {
        if (url.startsWith("git@")) {
            int colon = url.indexOf(':');
            return colon > 4 ? url.substring(4, colon) : null;
        }
        String host = urlHost(url);
        if (host == null) {
            int slash = url.indexOf('/');
            host = slash > 0 ? url.substring(0, slash) : null;
        }
        return host;
    }

    private static String urlHost(String url) {
        int scheme = url.indexOf("://");
        if (scheme < 0) {
            return null;
        }
        String rest = url.substring(scheme + 3);
        int at = rest.indexOf('@');
        int slash = rest.indexOf('/');
        if (at >= 0 && (slash < 0 || at < slash)) {
            rest = rest.substring(at + 1);
            slash = rest.indexOf('/');
        }
        String host = slash >= 0 ? rest.substring(0, slash) : rest;
        return host.toLowerCase(Locale.ROOT);
    }

    private static String urlPath(String url) {
        int scheme = url.indexOf("://");
        String rest = scheme >= 0 ? url.substring(scheme + 3) : url;
        int slash = rest.indexOf('/');
        return slash >= 0 ? rest.substring(slash) : "";
    }

    /**
     * A source split into base, subdirectory and query parameters.
     */
    private static final class Parts {
        private String base;
        private String subdirectory;
        private final Map<String, String> query = new LinkedHashMap<>();

        static Parts split(String text) {
            Parts parts = new Parts();
            String rest = text;
            int question = rest.indexOf('?');
            if (question >= 0) {
                for (String pair : rest.substring(question + 1).split("&")) {
                    int eq = pair.indexOf('=');
                    if (eq > 0) {
                        parts.query.putIfAbsent(pair.substring(0, eq), pair.substring(eq + 1));
                    }
                }
                rest = rest.substring(0, question);
            }
            int scheme = rest.indexOf("://");
            int searchFrom = scheme >= 0 ? scheme + 3 : 0;
            int separator = rest.indexOf("//", searchFrom);
            if (separator >= 0) {
                String subdirectory = rest.substring(separator + 2);
                parts.subdirectory = subdirectory.isEmpty() ? null : subdirectory;
                rest = rest.substring(0, separator);
            }
            parts.base = rest;
            return parts;
        }
    }
}
