package com.gdin.inspection.gsw.workspace;

import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.Question;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * An entity with the events and questions that reference it.
 */
@Value
@Builder
public class EntityView {

    Entity entity;

    @Singular
    List<Event> events;

    @Singular
    List<Question> questions;
}
