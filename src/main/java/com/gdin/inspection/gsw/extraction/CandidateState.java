package com.gdin.inspection.gsw.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class CandidateState {

    @JsonProperty("key")
    String key;

    @JsonProperty("value")
    String value;

    /** free text as written in the source, parsed leniently later */
    @JsonProperty("date")
    String date;

    @JsonProperty("confidence")
    Double confidence;
}
