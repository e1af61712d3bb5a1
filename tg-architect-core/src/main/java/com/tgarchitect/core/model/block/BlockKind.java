package com.tgarchitect.core.model.block;

import java.util.Optional;

/**
 * Kinds of top-level Terragrunt blocks.
 */
public enum BlockKind {
    TERRAFORM("terraform"),
    REMOTE_STATE("remote_state"),
    INCLUDE("include"),
    LOCALS("locals"),
    DEPENDENCY("dependency"),
    DEPENDENCIES("dependencies"),
    GENERATE("generate"),
    INPUTS("inputs"),
    IAM_ROLE("iam_role"),
    RETRY_CONFIG("retry_config"),
    /** Any other top-level attribute or block, such as {@code download_dir} or {@code skip}. */
    GENERIC("generic");

    private final String keyword;

    BlockKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * HCL keyword introducing the block.
     *
     * @return keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Maps a top-level keyword to its typed kind.
     *
     * @param keyword keyword
     * @return typed kind, or empty for keywords parsed as {@link #GENERIC}
     */
    public static Optional<BlockKind> fromKeyword(String keyword) {
        for (BlockKind kind : values()) {
            if (kind != GENERIC && kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
