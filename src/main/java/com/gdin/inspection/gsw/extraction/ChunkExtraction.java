package com.gdin.inspection.gsw.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Structured output of the extraction step for one document chunk.
 * {@code caseId} and {@code chunkId} are provenance attached by the core, not by the model.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class ChunkExtraction {

    @JsonProperty("case_id")
    String caseId;

    @JsonProperty("chunk_id")
    String chunkId;

    @Singular
    @JsonProperty("actors")
    List<CandidateEntity> entities;

    @Singular
    @JsonProperty("verb_phrases")
    List<CandidateEvent> events;

    @Singular
    @JsonProperty("questions")
    List<CandidateQuestion> questions;
}
