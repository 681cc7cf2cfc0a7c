package com.gdin.inspection.gsw.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Verb phrase candidate. References name either a candidate local id of the same
 * chunk or an id already in the workspace.
 */
@Value
@Jacksonized
@Builder
public class CandidateEvent {

    @JsonProperty("verb")
    String verb;

    @JsonProperty("agent_id")
    String agentRef;

    @Singular
    @JsonProperty("patient_ids")
    List<String> patientRefs;

    @JsonProperty("temporal_id")
    String temporalRef;

    @JsonProperty("spatial_id")
    String spatialRef;

    @JsonProperty("is_implicit")
    boolean implicit;
}
