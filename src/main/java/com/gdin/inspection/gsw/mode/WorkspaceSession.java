package com.gdin.inspection.gsw.mode;

import com.gdin.inspection.gsw.exception.BatchAbortedException;
import com.gdin.inspection.gsw.exception.BatchFailedException;
import com.gdin.inspection.gsw.extraction.ExtractionBatch;
import com.gdin.inspection.gsw.models.MergeReport;
import com.gdin.inspection.gsw.pipeline.BatchPipeline;
import com.gdin.inspection.gsw.pipeline.StepOutput;
import com.gdin.inspection.gsw.pipeline.context.BatchRunContext;
import com.gdin.inspection.gsw.pipeline.context.RunBatchPipeline;
import com.gdin.inspection.gsw.pipeline.context.StepResult;
import com.gdin.inspection.gsw.resolve.ResolvedBatch;
import com.gdin.inspection.gsw.state.IngestionStateTracker;
import com.gdin.inspection.gsw.workspace.GlobalWorkspaceStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One domain opened in one mode. Batches go through
 * resolve_candidates -> apply_batch -> persist_snapshot -> advance_cursor; a failure in the first
 * three leaves the workspace exactly as it was before the batch.
 */
@Slf4j
public class WorkspaceSession {

    public static final String RESOLVE = "resolve_candidates";
    public static final String APPLY = "apply_batch";
    public static final String PERSIST = "persist_snapshot";
    public static final String ADVANCE = "advance_cursor";

    private static final String K_TRACKER = "tracker";
    private static final String K_RESOLVED = "resolved";
    private static final String K_BEFORE = "pre_batch_snapshot";
    private static final String K_REPORT = "report";
    private static final String K_PERSISTED = "persisted";
    private static final String K_CURSOR_ADVANCED = "cursor_advanced";

    @Getter
    private final String domain;
    @Getter
    private final RunMode mode;
    @Getter
    private final GlobalWorkspaceStore store;
    private final WorkspacePersister persister;
    private final ReentrantLock writer;
    private final BatchPipeline<ExtractionBatch> pipeline;

    WorkspaceSession(RunMode mode, GlobalWorkspaceStore store, WorkspacePersister persister, ReentrantLock writer) {
        this.domain = store.getDomain();
        this.mode = mode;
        this.store = store;
        this.persister = persister;
        this.writer = writer;
        this.pipeline = new BatchPipeline<ExtractionBatch>()
                .add(RESOLVE, this::resolveCandidates)
                .add(APPLY, this::applyBatch)
                .add(PERSIST, this::persistSnapshot)
                .add(ADVANCE, this::advanceCursor);
    }

    /**
     * Commits one batch.
     *
     * @param tracker may be null when the caller keeps no cursor
     * @throws BatchAbortedException when interrupted during resolve; nothing changed
     * @throws BatchFailedException  when resolve, apply or the snapshot write failed; workspace rolled back, cursor untouched
     */
    public BatchResult process(ExtractionBatch batch, IngestionStateTracker tracker) {
        writer.lock();
        try {
            BatchRunContext context = new BatchRunContext();
            if (tracker != null) context.put(K_TRACKER, tracker);

            List<StepResult> results = new RunBatchPipeline<ExtractionBatch>().run(pipeline, batch, context);
            StepResult last = results.get(results.size() - 1);
            if (last.failed()) fail(last, context);

            MergeReport report = context.get(K_REPORT);
            return BatchResult.builder()
                    .domain(domain)
                    .mode(mode)
                    .fromIndex(batch.getFromIndex())
                    .toIndex(batch.getToIndex())
                    .report(report)
                    .checkpoint(store.checkpoint())
                    .persisted(Boolean.TRUE.equals(context.get(K_PERSISTED)))
                    .cursorAdvanced(Boolean.TRUE.equals(context.get(K_CURSOR_ADVANCED)))
                    .stats(context.getStats())
                    .build();
        } finally {
            writer.unlock();
        }
    }

    private void fail(StepResult failed, BatchRunContext context) {
        Exception e = failed.getError();
        if (e instanceof BatchAbortedException) throw (BatchAbortedException) e;
        byte[] before = context.get(K_BEFORE);
        if (before != null) {
            store.restore(before);
            log.error("[{}] batch rolled back at step {}, workspace back at checkpoint {}", mode, failed.getStep(), store.checkpoint());
        }
        throw new BatchFailedException(failed.getStep(), e);
    }

    // ======================= steps =======================

    private StepOutput resolveCandidates(ExtractionBatch batch, BatchRunContext context) {
        ResolvedBatch resolved = store.resolve(batch);
        context.put(K_RESOLVED, resolved);
        return StepOutput.of(resolved.candidateCount());
    }

    private StepOutput applyBatch(ExtractionBatch batch, BatchRunContext context) {
        context.put(K_BEFORE, store.snapshot());
        MergeReport report = store.apply(context.get(K_RESOLVED));
        context.put(K_REPORT, report);
        return StepOutput.of(report);
    }

    private StepOutput persistSnapshot(ExtractionBatch batch, BatchRunContext context) {
        persister.persist(domain, store.snapshot());
        context.put(K_PERSISTED, persister.isDurable());
        return StepOutput.of(persister.isDurable());
    }

    private StepOutput advanceCursor(ExtractionBatch batch, BatchRunContext context) {
        IngestionStateTracker tracker = context.get(K_TRACKER);
        if (!persister.isDurable() || tracker == null) return StepOutput.of(false);
        try {
            tracker.advance(batch.getToIndex());
            context.put(K_CURSOR_ADVANCED, true);
            return StepOutput.of(true);
        } catch (RuntimeException e) {
            // snapshot is durable: keep the commit, the batch is re-read on resume
            log.error("cursor of {} not advanced to {}: {}", domain, batch.getToIndex(), e.getMessage());
            return StepOutput.of(false);
        }
    }
}
