package com.gdin.inspection.gsw.resolve;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Resolution {

    public enum Reason {
        EXACT_ALIAS,
        SIMILARITY,
        NO_MATCH
    }

    MergeDecision decision;

    Reason reason;

    /** best oracle score, null when the oracle was not consulted or failed */
    Double score;

    /** oracle failed or timed out; only exact-alias matching was applied */
    boolean degraded;
}
