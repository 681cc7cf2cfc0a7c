package com.gdin.inspection.gsw.run;

import com.gdin.inspection.gsw.config.properties.WorkspaceProperties;
import com.gdin.inspection.gsw.exception.BatchAbortedException;
import com.gdin.inspection.gsw.extraction.ChunkExtraction;
import com.gdin.inspection.gsw.extraction.DocumentSource;
import com.gdin.inspection.gsw.extraction.ExtractionBatch;
import com.gdin.inspection.gsw.extraction.ExtractionSupplier;
import com.gdin.inspection.gsw.extraction.SourceDocument;
import com.gdin.inspection.gsw.mode.BatchResult;
import com.gdin.inspection.gsw.mode.ModeController;
import com.gdin.inspection.gsw.mode.RunMode;
import com.gdin.inspection.gsw.mode.WorkspaceSession;
import com.gdin.inspection.gsw.state.CursorStore;
import com.gdin.inspection.gsw.state.IndexRange;
import com.gdin.inspection.gsw.state.IngestionStateTracker;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Drives a document source through extraction and the mode controller, one batch at a time,
 * starting where the domain's cursor left off. Failures propagate; retrying is up to the caller.
 */
@Slf4j
@Service
public class BatchIngestionRunner {
    @Resource
    private WorkspaceProperties workspaceProperties;

    @Resource
    private ModeController modeController;

    @Resource
    private CursorStore cursorStore;

    public IngestionRunResult run(String domain, DocumentSource source, ExtractionSupplier supplier, RunMode mode) {
        return run(domain, source, supplier, mode, workspaceProperties.getIngestion().getLimit());
    }

    /**
     * @param maxDocuments documents to process in this run, counted from the cursor; {@code null} or
     *                     {@code <= 0} runs to the end of the source. The last batch is cut short at the cap.
     */
    public IngestionRunResult run(String domain, DocumentSource source, ExtractionSupplier supplier, RunMode mode,
                                  Integer maxDocuments) {
        WorkspaceSession session = modeController.open(domain, mode);
        IngestionStateTracker tracker = IngestionStateTracker.open(
                cursorStore, domain, workspaceProperties.getIngestion().getBatchSize(), source.size());
        int topK = workspaceProperties.getOntology().getTopK();

        IngestionRunResult.IngestionRunResultBuilder result = IngestionRunResult.builder()
                .domain(domain)
                .mode(mode)
                .startIndex(tracker.getPosition())
                .totalDocuments(source.size());

        int next = tracker.getPosition();
        int stopAt = maxDocuments == null || maxDocuments <= 0
                ? source.size()
                : (int) Math.min(source.size(), (long) next + maxDocuments);
        Optional<IndexRange> range;
        while (next < stopAt && (range = tracker.rangeFrom(next)).isPresent()) {
            IndexRange r = range.get();
            if (r.getTo() > stopAt) r = new IndexRange(r.getFrom(), stopAt);
            if (Thread.currentThread().isInterrupted()) {
                throw new BatchAbortedException("ingestion of " + domain + " interrupted before document " + r.getFrom());
            }
            ExtractionBatch batch = extract(domain, source, supplier, r, session.getStore().ontologyContext(topK));
            // calibration never hands the tracker over, so the durable cursor cannot move
            BatchResult br = session.process(batch, mode == RunMode.PRODUCTION ? tracker : null);
            log.info("[{}] {} documents [{}, {}) committed at checkpoint {}, stats={}",
                    mode, domain, r.getFrom(), r.getTo(), br.getCheckpoint(), br.getStats().getStepSeconds());
            result.batch(br);
            next = r.getTo();
        }
        if (next < source.size()) {
            log.info("[{}] {} stopped at document {} of {}, limit {}", mode, domain, next, source.size(), maxDocuments);
        }
        return result.endIndex(next).build();
    }

    private ExtractionBatch extract(String domain, DocumentSource source, ExtractionSupplier supplier,
                                    IndexRange range, String ontologyContext) {
        ExtractionBatch.ExtractionBatchBuilder batch = ExtractionBatch.builder()
                .fromIndex(range.getFrom())
                .toIndex(range.getTo());
        for (int i = range.getFrom(); i < range.getTo(); i++) {
            SourceDocument doc = source.get(i);
            String chunkId = domain + "-" + i;
            ChunkExtraction extraction;
            try {
                extraction = supplier.extract(doc.getText(), chunkId, ontologyContext);
            } catch (RuntimeException e) {
                throw new BatchAbortedException("extraction of document " + i + " of " + domain + " failed", e);
            }
            if (extraction == null) {
                log.warn("no extraction for document {} of {}", i, domain);
                extraction = ChunkExtraction.builder().build();
            }
            batch.document(extraction.toBuilder()
                    .caseId(doc.getCaseId())
                    .chunkId(chunkId)
                    .build());
        }
        return batch.build();
    }
}
