package com.gdin.inspection.gsw.extraction;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Jacksonized
@Builder
public class CandidateQuestion {

    /** set when the extraction answers a question already in the workspace */
    @JsonProperty("question_id")
    String questionId;

    @JsonProperty("about_id")
    String subjectRef;

    @JsonProperty("question")
    String text;

    @JsonProperty("answer")
    String answer;
}
