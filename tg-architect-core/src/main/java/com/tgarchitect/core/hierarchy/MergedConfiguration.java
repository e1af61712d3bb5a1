package com.tgarchitect.core.hierarchy;

import com.tgarchitect.core.expression.HclExpression;
import com.tgarchitect.core.model.ResolvedDependency;
import com.tgarchitect.core.model.block.RemoteStateBlock;
import com.tgarchitect.core.model.block.TerraformBlock;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Effective configuration of a file after its ancestors were merged in.
 *
 * @param sourcePath file the configuration belongs to
 * @param locals merged locals
 * @param inputs merged inputs
 * @param remoteState effective remote_state block, may be null
 * @param terraform effective terraform block, may be null
 * @param dependencies dependencies of the file and of ancestors merged into it
 * @param mergeTrace origin of each merged field
 */
public record MergedConfiguration(
    String sourcePath,
    Map<String, HclExpression> locals,
    Map<String, HclExpression> inputs,
    RemoteStateBlock remoteState,
    TerraformBlock terraform,
    List<ResolvedDependency> dependencies,
    MergeTrace mergeTrace
) {
    public MergedConfiguration {
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        locals = locals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(locals));
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        mergeTrace = mergeTrace == null ? new MergeTrace(Map.of()) : mergeTrace;
    }

    public Optional<RemoteStateBlock> getRemoteState() {
        return Optional.ofNullable(remoteState);
    }

    public Optional<TerraformBlock> getTerraform() {
        return Optional.ofNullable(terraform);
    }
}
