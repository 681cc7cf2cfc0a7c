package com.gdin.inspection.gsw.resolve;

import com.gdin.inspection.gsw.extraction.CandidateEvent;
import com.gdin.inspection.gsw.extraction.CandidateQuestion;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One document's extraction after validation and resolution, in input order.
 */
@Value
@Builder
public class ResolvedChunk {

    String caseId;

    String chunkId;

    @Singular
    List<ResolvedEntity> entities;

    @Singular
    List<CandidateEvent> events;

    @Singular
    List<CandidateQuestion> questions;
}
