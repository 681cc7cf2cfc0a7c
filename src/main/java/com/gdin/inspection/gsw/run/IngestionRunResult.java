package com.gdin.inspection.gsw.run;

import com.gdin.inspection.gsw.mode.BatchResult;
import com.gdin.inspection.gsw.mode.RunMode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestionRunResult {

    String domain;

    RunMode mode;

    int startIndex;

    /** first document not covered by this run */
    int endIndex;

    int totalDocuments;

    @Singular
    List<BatchResult> batches;

    public boolean isComplete() {
        return endIndex >= totalDocuments;
    }

    public int newEntities() {
        return batches.stream().mapToInt(b -> b.getReport().getNewEntities()).sum();
    }

    public int degradedMatches() {
        return batches.stream().mapToInt(b -> b.getReport().getDegradedMatchCount()).sum();
    }
}
