package com.gdin.inspection.gsw.workspace;

import com.gdin.inspection.gsw.exception.SnapshotSchemaMismatchException;
import com.gdin.inspection.gsw.exception.WorkspaceStorageException;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.FuzzyDate;
import com.gdin.inspection.gsw.models.OntologyDictionary;
import com.gdin.inspection.gsw.models.Question;
import com.gdin.inspection.gsw.models.StateValue;
import com.gdin.inspection.gsw.models.TermCount;
import com.gdin.inspection.gsw.models.TermKind;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.toon.ToonCodec;
import com.gdin.inspection.gsw.toon.ToonDocument;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Workspace &lt;-&gt; TOON document. One block per table, plus a {@code Meta} row carrying the
 * schema tag and the id sequences.
 */
public final class WorkspaceSnapshotCodec {

    public static final String SCHEMA_VERSION = "gsw-toon/1";

    static final String META = "Meta";
    static final String ENTITIES = "Entities";
    static final String STATES = "States";
    static final String EVENTS = "Events";
    static final String QUESTIONS = "Questions";
    static final String ONTOLOGY = "Ontology";

    private WorkspaceSnapshotCodec() {}

    public static byte[] encode(Workspace ws) {
        return ToonCodec.encode(toDocument(ws)).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @throws SnapshotSchemaMismatchException when the schema tag is missing or different
     * @throws WorkspaceStorageException       when the content cannot be read as a snapshot
     */
    public static Workspace decode(byte[] content) {
        ToonDocument doc;
        try {
            doc = ToonCodec.decode(new String(content, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new WorkspaceStorageException("snapshot is not valid TOON", e);
        }
        List<Map<String, Object>> meta = doc.get(META);
        String version = meta.size() == 1 ? str(meta.get(0), "schema_version") : null;
        if (!SCHEMA_VERSION.equals(version)) throw new SnapshotSchemaMismatchException(SCHEMA_VERSION, version);
        try {
            return fromDocument(doc);
        } catch (RuntimeException e) {
            throw new WorkspaceStorageException("snapshot content is corrupt", e);
        }
    }

    static ToonDocument toDocument(Workspace ws) {
        ToonDocument doc = new ToonDocument();
        doc.comment("workspace snapshot, domain=" + ws.getDomain());

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("schema_version", SCHEMA_VERSION);
        meta.put("domain", ws.getDomain());
        meta.put("checkpoint", String.valueOf(ws.getCheckpoint()));
        meta.put("next_entity_seq", String.valueOf(ws.getNextEntitySeq()));
        meta.put("next_event_seq", String.valueOf(ws.getNextEventSeq()));
        meta.put("next_question_seq", String.valueOf(ws.getNextQuestionSeq()));
        doc.put(META, List.of(meta));

        List<Map<String, Object>> entities = new ArrayList<>();
        List<Map<String, Object>> states = new ArrayList<>();
        for (Entity e : ws.getEntities().values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", e.getId());
            row.put("hrid", String.valueOf(e.getHumanReadableId()));
            row.put("type", e.getType().getLabel());
            row.put("name", e.getName());
            row.put("aliases", new ArrayList<>(e.getAliases()));
            row.put("roles", new ArrayList<>(e.getRoles()));
            row.put("cases", new ArrayList<>(e.getInvolvedCases()));
            row.put("chunks", new ArrayList<>(e.getSourceChunkIds()));
            entities.add(row);

            e.getStates().forEach((key, sv) -> {
                Map<String, Object> s = new LinkedHashMap<>();
                s.put("entity_id", e.getId());
                s.put("key", key);
                s.put("value", sv.getValue());
                s.put("date", sv.getDate() == null ? null : sv.getDate().getRawText());
                s.put("date_parsed", sv.hasTimestamp() ? sv.getDate().getParsed().toString() : null);
                s.put("case_id", sv.getCaseId());
                s.put("confidence", sv.getConfidence() == null ? null : sv.getConfidence().toString());
                states.add(s);
            });
        }
        doc.put(ENTITIES, entities);
        doc.put(STATES, states);

        List<Map<String, Object>> events = new ArrayList<>();
        for (Event v : ws.getEvents()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", v.getId());
            row.put("verb", v.getVerb());
            row.put("agent_id", v.getAgentId());
            row.put("patient_ids", new ArrayList<>(v.getPatientIds()));
            row.put("temporal_id", v.getTemporalId());
            row.put("spatial_id", v.getSpatialId());
            row.put("implicit", String.valueOf(v.isImplicit()));
            row.put("case_id", v.getCaseId());
            row.put("chunk_id", v.getChunkId());
            events.add(row);
        }
        doc.put(EVENTS, events);

        List<Map<String, Object>> questions = new ArrayList<>();
        for (Question q : ws.getQuestions().values()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", q.getId());
            row.put("subject_id", q.getSubjectId());
            row.put("text", q.getText());
            row.put("answered", String.valueOf(q.isAnswered()));
            row.put("answer", q.getAnswer());
            row.put("case_id", q.getCaseId());
            row.put("answered_in_chunk_id", q.getAnsweredInChunkId());
            questions.add(row);
        }
        doc.put(QUESTIONS, questions);

        List<Map<String, Object>> ontology = new ArrayList<>();
        for (TermCount tc : ws.getOntology().entries()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("kind", tc.getKind().name());
            row.put("term", tc.getTerm());
            row.put("count", String.valueOf(tc.getCount()));
            ontology.add(row);
        }
        doc.put(ONTOLOGY, ontology);
        return doc;
    }

    static Workspace fromDocument(ToonDocument doc) {
        Map<String, Object> meta = doc.get(META).get(0);
        Workspace ws = new Workspace(str(meta, "domain"));
        ws.setCheckpoint(Long.parseLong(str(meta, "checkpoint")));
        ws.setNextEntitySeq(Integer.parseInt(str(meta, "next_entity_seq")));
        ws.setNextEventSeq(Integer.parseInt(str(meta, "next_event_seq")));
        ws.setNextQuestionSeq(Integer.parseInt(str(meta, "next_question_seq")));

        for (Map<String, Object> row : doc.get(ENTITIES)) {
            EntityType type = EntityType.fromLabel(str(row, "type"));
            if (type == null) throw new IllegalArgumentException("unknown entity type " + row.get("type"));
            Entity e = Entity.builder()
                    .id(str(row, "id"))
                    .humanReadableId(Integer.parseInt(str(row, "hrid")))
                    .type(type)
                    .name(str(row, "name"))
                    .aliases(new LinkedHashSet<>(list(row, "aliases")))
                    .roles(new ArrayList<>(list(row, "roles")))
                    .involvedCases(new LinkedHashSet<>(list(row, "cases")))
                    .sourceChunkIds(new LinkedHashSet<>(list(row, "chunks")))
                    .build();
            ws.getEntities().put(e.getId(), e);
        }

        for (Map<String, Object> row : doc.get(STATES)) {
            Entity e = ws.getEntities().get(str(row, "entity_id"));
            if (e == null) throw new IllegalArgumentException("state for unknown entity " + row.get("entity_id"));
            String raw = str(row, "date");
            String parsed = str(row, "date_parsed");
            String confidence = str(row, "confidence");
            e.getStates().put(str(row, "key"), StateValue.builder()
                    .value(str(row, "value"))
                    .date(raw == null ? null : new FuzzyDate(raw, parsed == null ? null : LocalDateTime.parse(parsed)))
                    .caseId(str(row, "case_id"))
                    .confidence(confidence == null ? null : Double.valueOf(confidence))
                    .build());
        }

        for (Map<String, Object> row : doc.get(EVENTS)) {
            ws.getEvents().add(Event.builder()
                    .id(str(row, "id"))
                    .verb(str(row, "verb"))
                    .agentId(str(row, "agent_id"))
                    .patientIds(new ArrayList<>(list(row, "patient_ids")))
                    .temporalId(str(row, "temporal_id"))
                    .spatialId(str(row, "spatial_id"))
                    .implicit(Boolean.parseBoolean(str(row, "implicit")))
                    .caseId(str(row, "case_id"))
                    .chunkId(str(row, "chunk_id"))
                    .build());
        }

        for (Map<String, Object> row : doc.get(QUESTIONS)) {
            Question q = Question.builder()
                    .id(str(row, "id"))
                    .subjectId(str(row, "subject_id"))
                    .text(str(row, "text"))
                    .answered(Boolean.parseBoolean(str(row, "answered")))
                    .answer(str(row, "answer"))
                    .caseId(str(row, "case_id"))
                    .answeredInChunkId(str(row, "answered_in_chunk_id"))
                    .build();
            ws.getQuestions().put(q.getId(), q);
        }

        OntologyDictionary dictionary = ws.getOntology();
        for (Map<String, Object> row : doc.get(ONTOLOGY)) {
            dictionary.increment(TermKind.valueOf(str(row, "kind")), str(row, "term"), Long.parseLong(str(row, "count")));
        }
        return ws;
    }

    private static String str(Map<String, Object> row, String key) {
        Object v = row.get(key);
        if (v == null) return null;
        if (v instanceof List) throw new IllegalArgumentException(key + " should be a scalar");
        return (String) v;
    }

    @SuppressWarnings("unchecked")
    private static List<String> list(Map<String, Object> row, String key) {
        Object v = row.get(key);
        if (v == null) return List.of();
        if (!(v instanceof List)) throw new IllegalArgumentException(key + " should be a list");
        return (List<String>) v;
    }
}
