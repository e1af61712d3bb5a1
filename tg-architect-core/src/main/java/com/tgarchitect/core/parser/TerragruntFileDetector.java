package com.tgarchitect.core.parser;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a file is a Terragrunt configuration.
 */
public final class TerragruntFileDetector {

    public static final String TERRAGRUNT_FILE_NAME = "terragrunt.hcl";

    private static final Pattern MARKER = Pattern.compile(
        "(?m)^\\s*(include|dependency|dependencies|remote_state|terraform|inputs|generate)\\b"
            + "|\\b(find_in_parent_folders|get_terragrunt_dir|path_relative_to_include)\\s*\\(");

    private TerragruntFileDetector() {
        // Utility class
    }

    /**
     * Accepts {@code terragrunt.hcl}, or any {@code .hcl} file whose content carries a
     * Terragrunt block keyword or function.
     *
     * @param path file path
     * @param content file content, may be null when only the name is known
     * @return true if the file should be parsed
     */
    public static boolean canParse(Path path, String content) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        if (name.equals(TERRAGRUNT_FILE_NAME)) {
            return true;
        }
        if (!name.endsWith(".hcl") || content == null) {
            return false;
        }
        return MARKER.matcher(content).find();
    }

    /**
     * Tests the file name against glob patterns such as {@code *.hcl}.
     *
     * @param path file path
     * @param patterns glob patterns
     * @return true if any pattern matches
     */
    public static boolean matchesPattern(Path path, List<String> patterns) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        for (String pattern : patterns) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            if (matcher.matches(fileName)) {
                return true;
            }
        }
        return false;
    }
}
