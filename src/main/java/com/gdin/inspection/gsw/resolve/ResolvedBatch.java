package com.gdin.inspection.gsw.resolve;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * All merge decisions for a batch, computed against one workspace version and
 * applied as a unit. Holds no reference to the workspace itself.
 */
@Value
@Builder
public class ResolvedBatch {

    int fromIndex;

    int toIndex;

    /** checkpoint of the workspace the decisions were taken against */
    long basedOnCheckpoint;

    @Singular
    List<ResolvedChunk> chunks;

    @Singular
    List<String> droppedQuestionIds;

    /** candidates rejected during validation */
    int malformedCandidates;

    public int candidateCount() {
        return chunks.stream().mapToInt(c -> c.getEntities().size()).sum();
    }
}
