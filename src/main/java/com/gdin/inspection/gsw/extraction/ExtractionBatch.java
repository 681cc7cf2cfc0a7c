package com.gdin.inspection.gsw.extraction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One unit of commit: the extractions of documents {@code [fromIndex, toIndex)}.
 */
@Value
@Builder
public class ExtractionBatch {

    int fromIndex;

    int toIndex;

    @Singular
    List<ChunkExtraction> documents;

    /** unanswered questions the caller wants gone */
    @Singular
    List<String> droppedQuestionIds;
}
