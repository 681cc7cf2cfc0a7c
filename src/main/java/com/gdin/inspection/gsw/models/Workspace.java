package com.gdin.inspection.gsw.models;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-domain graph of entities, events, questions and ontology counts.
 * Only the workspace store mutates it, and only while applying a batch.
 */
@Data
public class Workspace {

    private String domain;

    /** id -> entity, creation order */
    private Map<String, Entity> entities = new LinkedHashMap<>();

    private List<Event> events = new ArrayList<>();

    /** id -> question, creation order */
    private Map<String, Question> questions = new LinkedHashMap<>();

    private OntologyDictionary ontology = new OntologyDictionary();

    /** bumped once per committed batch */
    private long checkpoint;

    // next ids; ids are never reused even if a question is dropped
    private int nextEntitySeq;
    private int nextEventSeq;
    private int nextQuestionSeq;

    public Workspace() {
    }

    public Workspace(String domain) {
        this.domain = domain;
    }

    public String allocateEntityId(Entity target) {
        int seq = nextEntitySeq++;
        target.setHumanReadableId(seq);
        target.setId(Entity.idOf(seq));
        return target.getId();
    }

    public String allocateEventId() {
        return Event.idOf(nextEventSeq++);
    }

    public String allocateQuestionId() {
        return Question.idOf(nextQuestionSeq++);
    }
}
