package com.gdin.inspection.gsw.resolve;

import com.gdin.inspection.gsw.WorkspaceFixtures;
import com.gdin.inspection.gsw.exception.BatchAbortedException;
import com.gdin.inspection.gsw.extraction.CandidateEntity;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import com.gdin.inspection.gsw.models.Workspace;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class EntityResolverTest {

    private ExecutorService oraclePool;
    private Workspace ws;

    @BeforeEach
    public void setUp() {
        oraclePool = Executors.newFixedThreadPool(2);
        ws = new Workspace("family");
    }

    @AfterEach
    public void tearDown() {
        oraclePool.shutdownNow();
    }

    private List<Entity> persons() {
        return new ArrayList<>(ws.getEntities().values());
    }

    @Test
    public void testExactAliasWinsWithoutConsultingOracle() {
        Entity john = WorkspaceFixtures.put(ws, EntityType.PERSON, "John Smith", "husband");
        SimilarityOracle oracle = mock(SimilarityOracle.class);
        EntityResolver resolver = new EntityResolver(oracle, 0.8, 1000);

        Resolution r = resolver.resolve(WorkspaceFixtures.person("a", "  john   SMITH "), EntityType.PERSON, persons(), oraclePool);

        Assertions.assertEquals(MergeDecision.mergeInto(john.getId()), r.getDecision());
        Assertions.assertEquals(Resolution.Reason.EXACT_ALIAS, r.getReason());
        verify(oracle, never()).score(any(), any());
    }

    @Test
    public void testSimilarityMustBeStrictlyAboveThreshold() {
        Entity john = WorkspaceFixtures.put(ws, EntityType.PERSON, "John Smith");
        SimilarityOracle oracle = mock(SimilarityOracle.class);
        when(oracle.score(any(), any())).thenReturn(0.8);
        EntityResolver atThreshold = new EntityResolver(oracle, 0.8, 1000);
        EntityResolver belowThreshold = new EntityResolver(oracle, 0.79, 1000);
        CandidateEntity candidate = WorkspaceFixtures.person("b", "J. Smith");

        Resolution equal = atThreshold.resolve(candidate, EntityType.PERSON, persons(), oraclePool);
        Resolution above = belowThreshold.resolve(candidate, EntityType.PERSON, persons(), oraclePool);

        Assertions.assertFalse(equal.getDecision().isMerge());
        Assertions.assertEquals(0.8, equal.getScore().doubleValue());
        Assertions.assertEquals(MergeDecision.mergeInto(john.getId()), above.getDecision());
        Assertions.assertEquals(Resolution.Reason.SIMILARITY, above.getReason());
    }

    @Test
    public void testTieGoesToSharedRolesThenOldestEntity() {
        WorkspaceFixtures.put(ws, EntityType.PERSON, "J. Smith Sr.");
        Entity applicant = WorkspaceFixtures.put(ws, EntityType.PERSON, "J. Smith Jr.", "applicant");
        WorkspaceFixtures.put(ws, EntityType.PERSON, "Jon Smith");
        SimilarityOracle oracle = (a, b) -> 0.9;
        EntityResolver resolver = new EntityResolver(oracle, 0.8, 1000);

        Resolution byRole = resolver.resolve(WorkspaceFixtures.person("c", "J Smith", "Applicant"),
                EntityType.PERSON, persons(), oraclePool);
        Resolution byAge = resolver.resolve(WorkspaceFixtures.person("d", "J Smith"),
                EntityType.PERSON, persons(), oraclePool);

        Assertions.assertEquals(applicant.getId(), byRole.getDecision().getTargetId());
        Assertions.assertEquals("E0", byAge.getDecision().getTargetId());
    }

    @Test
    public void testFailingOracleDegradesToCreateNew() {
        WorkspaceFixtures.put(ws, EntityType.PERSON, "John Smith");
        EntityResolver resolver = new EntityResolver(SimilarityOracle.unavailable(), 0.8, 1000);

        Resolution r = resolver.resolve(WorkspaceFixtures.person("b", "J. Smith"), EntityType.PERSON, persons(), oraclePool);

        Assertions.assertTrue(r.isDegraded());
        Assertions.assertFalse(r.getDecision().isMerge());
        Assertions.assertNull(r.getScore());
    }

    @Test
    public void testOutOfRangeScoreCountsAsFailure() {
        WorkspaceFixtures.put(ws, EntityType.PERSON, "John Smith");
        EntityResolver resolver = new EntityResolver((a, b) -> 1.5, 0.8, 1000);

        Resolution r = resolver.resolve(WorkspaceFixtures.person("b", "J. Smith"), EntityType.PERSON, persons(), oraclePool);

        Assertions.assertTrue(r.isDegraded());
    }

    @Test
    public void testSlowOracleTimesOut() {
        WorkspaceFixtures.put(ws, EntityType.PERSON, "John Smith");
        SimilarityOracle slow = (a, b) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 0.99;
        };
        EntityResolver resolver = new EntityResolver(slow, 0.8, 100);

        long t0 = System.nanoTime();
        Resolution r = resolver.resolve(WorkspaceFixtures.person("b", "J. Smith"), EntityType.PERSON, persons(), oraclePool);

        Assertions.assertTrue(r.isDegraded());
        Assertions.assertFalse(r.getDecision().isMerge());
        Assertions.assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0) < 4000);
    }

    @Test
    public void testInterruptAbortsResolution() throws Exception {
        WorkspaceFixtures.put(ws, EntityType.PERSON, "John Smith");
        CountDownLatch release = new CountDownLatch(1);
        SimilarityOracle blocking = (a, b) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return 0.5;
        };
        EntityResolver resolver = new EntityResolver(blocking, 0.8, 5000);

        Thread.currentThread().interrupt();
        try {
            Assertions.assertThrows(BatchAbortedException.class, () -> resolver.resolve(
                    WorkspaceFixtures.person("b", "J. Smith"), EntityType.PERSON, persons(), oraclePool));
        } finally {
            Thread.interrupted();
            release.countDown();
        }
    }

    @Test
    public void testEmptyWorkspaceCreatesNewWithoutDegrading() {
        EntityResolver resolver = new EntityResolver(SimilarityOracle.unavailable(), 0.8, 1000);

        Resolution r = resolver.resolve(WorkspaceFixtures.person("a", "John Smith"), EntityType.PERSON, List.of(), oraclePool);

        Assertions.assertFalse(r.isDegraded());
        Assertions.assertEquals(MergeDecision.createNew(), r.getDecision());
    }
}
