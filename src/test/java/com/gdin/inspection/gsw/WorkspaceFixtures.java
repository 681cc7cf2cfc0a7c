package com.gdin.inspection.gsw;

import com.gdin.inspection.gsw.extraction.CandidateEntity;
import com.gdin.inspection.gsw.extraction.CandidateEvent;
import com.gdin.inspection.gsw.extraction.CandidateQuestion;
import com.gdin.inspection.gsw.extraction.ChunkExtraction;
import com.gdin.inspection.gsw.extraction.ExtractionBatch;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.ontology.OntologyAggregator;
import com.gdin.inspection.gsw.resolve.EntityResolver;
import com.gdin.inspection.gsw.resolve.SimilarityOracle;
import com.gdin.inspection.gsw.storage.WorkspaceStorage;
import com.gdin.inspection.gsw.update.BatchMergeService;
import com.gdin.inspection.gsw.update.EntityMergeService;
import com.gdin.inspection.gsw.update.StateConflictPolicy;
import com.gdin.inspection.gsw.workspace.GlobalWorkspaceStore;
import com.gdin.inspection.gsw.workspace.WorkspaceStoreFactory;

import java.util.List;

/**
 * Builders shared by the tests.
 */
public final class WorkspaceFixtures {

    private WorkspaceFixtures() {}

    public static EntityResolver resolver(SimilarityOracle oracle, double threshold) {
        return new EntityResolver(oracle, threshold, 2000);
    }

    public static GlobalWorkspaceStore store(String domain, SimilarityOracle oracle, double threshold) {
        return new GlobalWorkspaceStore(new Workspace(domain), resolver(oracle, threshold),
                new BatchMergeService(new EntityMergeService(StateConflictPolicy.EXTRACTION_ORDER)),
                new OntologyAggregator(), 2);
    }

    public static GlobalWorkspaceStore store(String domain) {
        return store(domain, SimilarityOracle.unavailable(), 0.85);
    }

    public static WorkspaceStoreFactory factory(WorkspaceStorage storage, SimilarityOracle oracle, double threshold) {
        return new WorkspaceStoreFactory(storage, resolver(oracle, threshold),
                new BatchMergeService(new EntityMergeService(StateConflictPolicy.EXTRACTION_ORDER)),
                new OntologyAggregator(), 2);
    }

    public static CandidateEntity person(String localId, String name, String... roles) {
        return CandidateEntity.builder()
                .localId(localId)
                .type("person")
                .name(name)
                .roles(List.of(roles))
                .build();
    }

    public static CandidateEntity entity(String localId, String type, String name) {
        return CandidateEntity.builder().localId(localId).type(type).name(name).build();
    }

    public static CandidateEvent event(String verb, String agentRef, String... patientRefs) {
        return CandidateEvent.builder().verb(verb).agentRef(agentRef).patientRefs(List.of(patientRefs)).build();
    }

    public static CandidateQuestion question(String subjectRef, String text) {
        return CandidateQuestion.builder().subjectRef(subjectRef).text(text).build();
    }

    public static ChunkExtraction chunk(String caseId, String chunkId, CandidateEntity... entities) {
        return ChunkExtraction.builder().caseId(caseId).chunkId(chunkId).entities(List.of(entities)).build();
    }

    public static ExtractionBatch batch(int from, ChunkExtraction... documents) {
        return ExtractionBatch.builder()
                .fromIndex(from)
                .toIndex(from + documents.length)
                .documents(List.of(documents))
                .build();
    }

    /** entity placed straight into a workspace, bypassing resolution */
    public static Entity put(Workspace ws, EntityType type, String name, String... roles) {
        Entity e = Entity.builder().type(type).name(name).build();
        ws.allocateEntityId(e);
        e.addAlias(name);
        for (String r : roles) e.addRole(r);
        ws.getEntities().put(e.getId(), e);
        return e;
    }
}
