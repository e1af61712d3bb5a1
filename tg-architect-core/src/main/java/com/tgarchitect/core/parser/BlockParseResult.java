package com.tgarchitect.core.parser;

import com.tgarchitect.core.model.ParseError;
import com.tgarchitect.core.model.block.TerragruntBlock;

import java.util.List;

/**
 * Output of {@link BlockParser#parse}.
 *
 * @param blocks parsed blocks in source order
 * @param errors syntax errors and block-level warnings
 * @param aborted true if the recovery strategy stopped parsing before the end of the file
 */
public record BlockParseResult(List<TerragruntBlock> blocks, List<ParseError> errors, boolean aborted) {
    public BlockParseResult {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
