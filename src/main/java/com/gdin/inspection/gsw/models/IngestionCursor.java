package com.gdin.inspection.gsw.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Where production ingestion of a domain resumes. Documents before
 * {@code lastCommittedIndex} are in the committed workspace.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestionCursor {

    @JsonProperty("domain")
    String domain;

    @JsonProperty("last_committed_index")
    int lastCommittedIndex;

    @JsonProperty("batch_size")
    int batchSize;

    @JsonProperty("total_documents")
    int totalDocuments;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonIgnore
    public boolean isComplete() {
        return lastCommittedIndex >= totalDocuments;
    }
}
