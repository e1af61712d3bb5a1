package com.tgarchitect.core.linker;

import com.tgarchitect.core.model.ParseError;

import java.util.List;
import java.util.Optional;

/**
 * Result of following chained module references.
 *
 * @param links one resolution per hop, in order
 * @param error why the chain stopped early, or null when it ended normally
 */
public record ChainResolution(
    List<SourceResolution> links,
    ParseError error
) {
    public ChainResolution {
        links = links == null ? List.of() : List.copyOf(links);
    }

    public boolean isComplete() {
        return error == null;
    }

    public Optional<ParseError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the last hop.
     *
     * @return final resolution, or empty for an empty chain
     */
    public Optional<SourceResolution> terminal() {
        return links.isEmpty() ? Optional.empty() : Optional.of(links.get(links.size() - 1));
    }
}
