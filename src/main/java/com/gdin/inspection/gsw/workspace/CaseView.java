package com.gdin.inspection.gsw.workspace;

import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.Question;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class CaseView {

    String caseId;

    @Singular
    List<Entity> entities;

    @Singular
    List<Event> events;

    @Singular
    List<Question> questions;

    /** entity id -> the other cases it is involved in; only entities with at least one */
    @Singular("crossCaseEntity")
    Map<String, Set<String>> crossCaseEntities;
}
