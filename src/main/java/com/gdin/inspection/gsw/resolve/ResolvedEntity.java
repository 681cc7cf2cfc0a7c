package com.gdin.inspection.gsw.resolve;

import com.gdin.inspection.gsw.extraction.CandidateEntity;
import com.gdin.inspection.gsw.models.EntityType;
import lombok.Value;

@Value
public class ResolvedEntity {

    CandidateEntity candidate;

    EntityType type;

    Resolution resolution;

    /** report key, {@code chunkId/localId} (falls back to the name when the candidate has no local id) */
    public String key(String chunkId) {
        String local = candidate.getLocalId() != null ? candidate.getLocalId() : candidate.getName();
        return chunkId + "/" + local;
    }
}
