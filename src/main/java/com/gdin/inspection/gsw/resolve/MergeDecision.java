package com.gdin.inspection.gsw.resolve;

import lombok.Value;

@Value
public class MergeDecision {

    public enum Kind {
        MERGE_INTO,
        CREATE_NEW
    }

    Kind kind;

    /** only set for MERGE_INTO */
    String targetId;

    public static MergeDecision mergeInto(String existingId) {
        return new MergeDecision(Kind.MERGE_INTO, existingId);
    }

    public static MergeDecision createNew() {
        return new MergeDecision(Kind.CREATE_NEW, null);
    }

    public boolean isMerge() {
        return kind == Kind.MERGE_INTO;
    }
}
