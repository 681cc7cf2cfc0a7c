package com.gdin.inspection.gsw.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * An actor as proposed by one document's extraction, before it is merged.
 * {@code localId} is only meaningful inside its own {@link ChunkExtraction}.
 */
@Value
@Jacksonized
@Builder(toBuilder = true)
public class CandidateEntity {

    @JsonProperty("id")
    String localId;

    @JsonProperty("type")
    String type;

    @JsonProperty("name")
    String name;

    @Singular
    @JsonProperty("aliases")
    List<String> aliases;

    @Singular
    @JsonProperty("roles")
    List<String> roles;

    @Singular
    @JsonProperty("states")
    List<CandidateState> states;
}
