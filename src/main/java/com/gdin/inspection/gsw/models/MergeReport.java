package com.gdin.inspection.gsw.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one applied batch.
 */
@Data
@Builder
public class MergeReport {

    private int newEntities;

    private int mergedEntities;

    private int newEvents;

    private int newQuestions;

    private int answeredQuestions;

    private int droppedQuestions;

    private int skippedDuplicateEvents;

    private int malformedCandidates;

    /** candidates resolved with exact-alias matching only because the oracle failed */
    @Builder.Default
    private List<String> degradedMatches = new ArrayList<>();

    /** {chunkId/localId -> workspace entity id} */
    @Builder.Default
    private Map<String, String> entityIdMapping = new LinkedHashMap<>();

    public int getDegradedMatchCount() {
        return degradedMatches.size();
    }

    public static MergeReport empty() {
        return MergeReport.builder().build();
    }
}
