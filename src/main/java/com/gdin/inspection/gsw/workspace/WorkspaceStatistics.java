package com.gdin.inspection.gsw.workspace;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class WorkspaceStatistics {

    String domain;

    long checkpoint;

    int entities;

    int events;

    int questions;

    int unansweredQuestions;

    int cases;

    /** entities involved in more than one case */
    int crossCaseEntities;

    int ontologyTerms;

    /** type label -> count, every type present */
    Map<String, Integer> entitiesByType;
}
