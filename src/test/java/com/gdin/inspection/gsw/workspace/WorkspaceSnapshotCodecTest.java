package com.gdin.inspection.gsw.workspace;

import com.gdin.inspection.gsw.exception.SnapshotSchemaMismatchException;
import com.gdin.inspection.gsw.exception.WorkspaceStorageException;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.FuzzyDate;
import com.gdin.inspection.gsw.models.Question;
import com.gdin.inspection.gsw.models.StateValue;
import com.gdin.inspection.gsw.models.TermKind;
import com.gdin.inspection.gsw.models.Workspace;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.gdin.inspection.gsw.WorkspaceFixtures.put;

public class WorkspaceSnapshotCodecTest {

    private static Workspace sample() {
        Workspace ws = new Workspace("family law");
        Entity john = put(ws, EntityType.PERSON, "John Smith", "husband", "applicant, later respondent");
        john.addAlias("J. Smith");
        john.addAlias("Smith | John");
        john.addCase("case-1");
        john.addCase("case-2");
        john.addSourceChunk("c0");
        john.getStates().put("marital status", StateValue.builder()
                .value("divorced").date(FuzzyDate.of("2020-06-30")).caseId("case-2").confidence(0.75).build());
        john.getStates().put("employer", StateValue.builder()
                .value("Acme: \"Widgets\"\nLtd").date(FuzzyDate.of("around Easter")).caseId("case-1").build());
        john.getStates().put("address", StateValue.builder().value("~").caseId("case-1").build());

        Entity court = put(ws, EntityType.LOCATION, "[Leeds] County Court");
        court.addCase("case-1");
        Entity marker = put(ws, EntityType.TEMPORAL_MARKER, "2019-03-15");
        put(ws, EntityType.ASSET, "");

        ws.getEvents().add(Event.builder().id(ws.allocateEventId()).verb("filed").agentId(john.getId())
                .patientIds(List.of(court.getId())).temporalId(marker.getId()).spatialId(court.getId())
                .caseId("case-1").chunkId("c0").build());
        ws.getEvents().add(Event.builder().id(ws.allocateEventId()).verb("was summoned").agentId(court.getId())
                .patientIds(List.of()).implicit(true).caseId("case-1").chunkId("c0").build());

        Question open = Question.builder().id(ws.allocateQuestionId()).subjectId(john.getId())
                .text("Where was he, on 5 May?").caseId("case-1").build();
        Question answered = Question.builder().id(ws.allocateQuestionId()).text("Who paid the rent?")
                .caseId("case-2").build();
        answered.markAnswered("Nobody", "c3");
        ws.allocateQuestionId();
        ws.getQuestions().put(open.getId(), open);
        ws.getQuestions().put(answered.getId(), answered);

        ws.getOntology().increment(TermKind.ROLE, "husband", 3);
        ws.getOntology().increment(TermKind.VERB, "filed", 1);
        ws.getOntology().increment(TermKind.STATE_KEY, "marital status", 2);
        ws.setCheckpoint(7);
        return ws;
    }

    @Test
    public void testDecodeRestoresEveryField() {
        Workspace ws = sample();
        byte[] encoded = WorkspaceSnapshotCodec.encode(ws);

        Workspace decoded = WorkspaceSnapshotCodec.decode(encoded);

        Assertions.assertEquals(ws, decoded);
        Assertions.assertArrayEquals(encoded, WorkspaceSnapshotCodec.encode(decoded));
        Assertions.assertTrue(decoded.getEntities().get("E0").getStates().get("marital status").hasTimestamp());
        Assertions.assertFalse(decoded.getEntities().get("E0").getStates().get("employer").hasTimestamp());
        Assertions.assertEquals("Q3", decoded.allocateQuestionId());
    }

    @Test
    public void testEmptyWorkspace() {
        Workspace ws = new Workspace("empty");
        Assertions.assertEquals(ws, WorkspaceSnapshotCodec.decode(WorkspaceSnapshotCodec.encode(ws)));
    }

    @Test
    public void testSchemaVersionIsChecked() {
        String text = new String(WorkspaceSnapshotCodec.encode(sample()), StandardCharsets.UTF_8)
                .replace(WorkspaceSnapshotCodec.SCHEMA_VERSION, "gsw-toon/0");

        SnapshotSchemaMismatchException e = Assertions.assertThrows(SnapshotSchemaMismatchException.class,
                () -> WorkspaceSnapshotCodec.decode(text.getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals(WorkspaceSnapshotCodec.SCHEMA_VERSION, e.getExpected());
        Assertions.assertEquals("gsw-toon/0", e.getActual());

        Assertions.assertThrows(SnapshotSchemaMismatchException.class,
                () -> WorkspaceSnapshotCodec.decode("Entities[0]{}\n".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void testCorruptContent() {
        Assertions.assertThrows(WorkspaceStorageException.class,
                () -> WorkspaceSnapshotCodec.decode("not a snapshot".getBytes(StandardCharsets.UTF_8)));

        String text = new String(WorkspaceSnapshotCodec.encode(sample()), StandardCharsets.UTF_8)
                .replace(",person,", ",spaceship,");
        Assertions.assertThrows(WorkspaceStorageException.class,
                () -> WorkspaceSnapshotCodec.decode(text.getBytes(StandardCharsets.UTF_8)));
    }
}
