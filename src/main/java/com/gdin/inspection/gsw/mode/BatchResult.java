package com.gdin.inspection.gsw.mode;

import com.gdin.inspection.gsw.models.MergeReport;
import com.gdin.inspection.gsw.pipeline.context.BatchRunStats;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchResult {

    String domain;

    RunMode mode;

    int fromIndex;

    int toIndex;

    MergeReport report;

    /** workspace checkpoint after the commit */
    long checkpoint;

    boolean persisted;

    /**
     * false in calibration, and in production when the cursor write failed after a durable snapshot;
     * the batch is then committed and will be re-ingested on resume
     */
    boolean cursorAdvanced;

    BatchRunStats stats;
}
