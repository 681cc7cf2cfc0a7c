package com.gdin.inspection.gsw.run;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gdin.inspection.gsw.config.properties.WorkspaceProperties;
import com.gdin.inspection.gsw.exception.BatchAbortedException;
import com.gdin.inspection.gsw.extraction.ChunkExtraction;
import com.gdin.inspection.gsw.extraction.DocumentSource;
import com.gdin.inspection.gsw.extraction.ExtractionSupplier;
import com.gdin.inspection.gsw.extraction.SourceDocument;
import com.gdin.inspection.gsw.mode.ModeController;
import com.gdin.inspection.gsw.mode.RunMode;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.Question;
import com.gdin.inspection.gsw.state.CursorStore;
import com.gdin.inspection.gsw.storage.FileWorkspaceStorage;
import com.gdin.inspection.gsw.util.IOUtil;
import com.gdin.inspection.gsw.workspace.EntityView;
import com.gdin.inspection.gsw.workspace.GlobalWorkspaceStore;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Slf4j
@SpringBootTest
@ActiveProfiles("dev")
public class BatchIngestionRunnerTest {

    @Resource
    private BatchIngestionRunner runner;

    @Resource
    private ModeController modeController;

    @Resource
    private CursorStore cursorStore;

    @Resource
    private WorkspaceProperties workspaceProperties;

    private final List<SourceDocument> documents = new ArrayList<>();
    private final Map<String, ChunkExtraction> extractions = new HashMap<>();
    private final List<String> contexts = new ArrayList<>();
    private String domain;

    @BeforeEach
    public void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/sample-extractions.json")) {
            List<Map<String, Object>> rows = IOUtil.mapper().readValue(in, new TypeReference<List<Map<String, Object>>>() {});
            for (Map<String, Object> row : rows) {
                String text = (String) row.get("text");
                documents.add(new SourceDocument((String) row.get("case_id"), text));
                extractions.put(text, IOUtil.mapper().convertValue(row.get("extraction"), ChunkExtraction.class));
            }
        }
        domain = "family-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private ExtractionSupplier fixtureSupplier() {
        return (text, chunkId, ontologyContext) -> {
            contexts.add(ontologyContext);
            return extractions.get(text);
        };
    }

    private Path snapshotFile() {
        return Path.of(workspaceProperties.getStorageDir()).resolve(domain + FileWorkspaceStorage.SUFFIX);
    }

    @Test
    public void testProductionRunBuildsOneWorkspaceAcrossCases() {
        IngestionRunResult result = runner.run(domain, DocumentSource.of(documents), fixtureSupplier(), RunMode.PRODUCTION);

        Assertions.assertTrue(result.isComplete());
        Assertions.assertEquals(3, result.getBatches().size());
        Assertions.assertEquals(5, result.newEntities());
        Assertions.assertEquals(1, result.degradedMatches());
        Assertions.assertTrue(Files.exists(snapshotFile()));
        Assertions.assertEquals(5, cursorStore.read(domain).orElseThrow().getLastCommittedIndex());
        Assertions.assertEquals("", contexts.get(0));
        Assertions.assertTrue(contexts.get(2).contains("husband"));

        GlobalWorkspaceStore store = modeController.open(domain, RunMode.PRODUCTION).getStore();
        EntityView john = store.queryByEntity("E0").orElseThrow();
        Entity e = john.getEntity();
        Assertions.assertEquals("John Smith", e.getName());
        Assertions.assertEquals(List.of("husband", "Respondent", "applicant"), e.getRoles());
        Assertions.assertEquals(List.of("case-A", "case-B"), List.copyOf(e.getInvolvedCases()));
        Assertions.assertEquals("divorced", e.getStates().get("marital status").getValue());
        Assertions.assertEquals(4, john.getEvents().size());

        Question where = john.getQuestions().get(0);
        Assertions.assertTrue(where.isAnswered());
        Assertions.assertEquals("Leeds", where.getAnswer());
        Assertions.assertEquals(domain + "-1", where.getAnsweredInChunkId());

        Event heard = store.queryByCase("case-B").getEvents().get(2);
        Assertions.assertTrue(heard.isImplicit());
        Assertions.assertEquals(domain + "-4", heard.getChunkId());
        Assertions.assertEquals(List.of("E1"), store.queryByRole("wife").stream().map(Entity::getId).collect(Collectors.toList()));
        Assertions.assertEquals(1, store.unansweredQuestions().size());
        Assertions.assertEquals(3L, store.checkpoint());
        log.info("statistics: {}", store.statistics());
    }

    @Test
    public void testLimitStopsRunAndNextRunResumesAfterIt() {
        IngestionRunResult capped = runner.run(domain, DocumentSource.of(documents), fixtureSupplier(), RunMode.PRODUCTION, 3);

        Assertions.assertFalse(capped.isComplete());
        Assertions.assertEquals(3, capped.getEndIndex());
        Assertions.assertEquals(2, capped.getBatches().size());
        Assertions.assertEquals(3, contexts.size());
        Assertions.assertEquals(3, cursorStore.read(domain).orElseThrow().getLastCommittedIndex());

        IngestionRunResult rest = runner.run(domain, DocumentSource.of(documents), fixtureSupplier(), RunMode.PRODUCTION);

        Assertions.assertEquals(3, rest.getStartIndex());
        Assertions.assertTrue(rest.isComplete());
        Assertions.assertEquals(1, rest.getBatches().size());
        Assertions.assertEquals(5, contexts.size());
        Assertions.assertEquals(5, cursorStore.read(domain).orElseThrow().getLastCommittedIndex());
        Assertions.assertEquals(5, modeController.open(domain, RunMode.PRODUCTION).getStore().statistics().getEntities());
    }

    @Test
    public void testFailedExtractionStopsAndRunResumesAtCursor() {
        AtomicInteger calls = new AtomicInteger();
        ExtractionSupplier failingOnFourth = (text, chunkId, ctx) -> {
            if (calls.incrementAndGet() == 4) throw new IllegalStateException("model endpoint unavailable");
            return extractions.get(text);
        };
        Assertions.assertThrows(BatchAbortedException.class,
                () -> runner.run(domain, DocumentSource.of(documents), failingOnFourth, RunMode.PRODUCTION));
        Assertions.assertEquals(2, cursorStore.read(domain).orElseThrow().getLastCommittedIndex());
        Assertions.assertEquals(1L, modeController.open(domain, RunMode.PRODUCTION).getStore().checkpoint());

        IngestionRunResult resumed = runner.run(domain, DocumentSource.of(documents), fixtureSupplier(), RunMode.PRODUCTION);

        Assertions.assertEquals(2, resumed.getStartIndex());
        Assertions.assertEquals(5, resumed.getEndIndex());
        Assertions.assertEquals(2, resumed.getBatches().size());
        Assertions.assertEquals(3, contexts.size());
        Assertions.assertEquals(5, modeController.open(domain, RunMode.PRODUCTION).getStore().statistics().getEntities());

        IngestionRunResult nothingLeft = runner.run(domain, DocumentSource.of(documents), fixtureSupplier(), RunMode.PRODUCTION);
        Assertions.assertTrue(nothingLeft.getBatches().isEmpty());
        Assertions.assertTrue(nothingLeft.isComplete());
    }

    @Test
    public void testCalibrationRunLeavesNoTrace() {
        IngestionRunResult result = runner.run(domain, DocumentSource.of(documents), fixtureSupplier(), RunMode.CALIBRATION);

        Assertions.assertTrue(result.isComplete());
        Assertions.assertEquals(5, result.newEntities());
        Assertions.assertTrue(result.getBatches().stream().noneMatch(b -> b.isPersisted() || b.isCursorAdvanced()));
        Assertions.assertFalse(Files.exists(snapshotFile()));
        Assertions.assertTrue(cursorStore.read(domain).isEmpty());
        Assertions.assertEquals(0L, modeController.open(domain, RunMode.PRODUCTION).getStore().checkpoint());
    }
}
