package com.gdin.inspection.gsw.workspace;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.gsw.exception.BatchAbortedException;
import com.gdin.inspection.gsw.exception.MalformedExtractionException;
import com.gdin.inspection.gsw.extraction.CandidateEntity;
import com.gdin.inspection.gsw.extraction.CandidateEvent;
import com.gdin.inspection.gsw.extraction.CandidateQuestion;
import com.gdin.inspection.gsw.extraction.CandidateState;
import com.gdin.inspection.gsw.extraction.ChunkExtraction;
import com.gdin.inspection.gsw.extraction.ExtractionBatch;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.FuzzyDate;
import com.gdin.inspection.gsw.models.MergeReport;
import com.gdin.inspection.gsw.models.Question;
import com.gdin.inspection.gsw.models.StateValue;
import com.gdin.inspection.gsw.models.TermCount;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.ontology.OntologyAggregator;
import com.gdin.inspection.gsw.resolve.EntityResolver;
import com.gdin.inspection.gsw.resolve.ResolvedBatch;
import com.gdin.inspection.gsw.resolve.ResolvedChunk;
import com.gdin.inspection.gsw.resolve.ResolvedEntity;
import com.gdin.inspection.gsw.resolve.Resolution;
import com.gdin.inspection.gsw.toon.ToonCodec;
import com.gdin.inspection.gsw.toon.ToonDocument;
import com.gdin.inspection.gsw.update.BatchMergeService;
import com.gdin.inspection.gsw.util.TermUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Owns one domain's {@link Workspace}. Mutation goes through {@link #apply(ResolvedBatch)} (or
 * {@link #appendBatch(ExtractionBatch)}, which wraps resolve and apply); every read sees a fully
 * committed workspace.
 * <p>
 * Queries hand out the stored objects; callers must not modify them.
 */
@Slf4j
public class GlobalWorkspaceStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @Getter
    private final String domain;
    private final EntityResolver resolver;
    private final BatchMergeService merger;
    @Getter
    private final OntologyAggregator ontology;
    private final int resolveConcurrency;

    private Workspace workspace;

    public GlobalWorkspaceStore(Workspace workspace, EntityResolver resolver, BatchMergeService merger,
                                OntologyAggregator ontology, int resolveConcurrency) {
        this.workspace = Objects.requireNonNull(workspace, "workspace");
        this.domain = workspace.getDomain();
        this.resolver = resolver;
        this.merger = merger;
        this.ontology = ontology;
        this.resolveConcurrency = Math.max(1, resolveConcurrency);
    }

    // ======================= write path =======================

    /**
     * Resolve then apply; on any failure during apply the workspace is restored to its pre-batch state.
     */
    public MergeReport appendBatch(ExtractionBatch batch) {
        ResolvedBatch resolved = resolve(batch);
        byte[] before = snapshot();
        try {
            return apply(resolved);
        } catch (RuntimeException e) {
            log.error("apply failed, restoring checkpoint {}: {}", resolved.getBasedOnCheckpoint(), e.getMessage());
            restore(before);
            throw e;
        }
    }

    /**
     * Validates the batch and classifies every candidate entity against the current workspace.
     * Read-only; candidates are resolved in parallel, results come back in input order.
     *
     * @throws BatchAbortedException when the calling thread is interrupted
     */
    public ResolvedBatch resolve(ExtractionBatch batch) {
        lock.readLock().lock();
        ExecutorService resolvePool = Executors.newFixedThreadPool(resolveConcurrency);
        ExecutorService oraclePool = Executors.newFixedThreadPool(resolveConcurrency);
        try {
            Map<EntityType, List<Entity>> byType = new EnumMap<>(EntityType.class);
            for (Entity e : workspace.getEntities().values()) {
                byType.computeIfAbsent(e.getType(), k -> new ArrayList<>()).add(e);
            }

            int malformed = 0;
            List<ResolvedChunk.ResolvedChunkBuilder> chunks = new ArrayList<>();
            List<PendingEntity> pending = new ArrayList<>();
            List<ChunkExtraction> docs = batch.getDocuments();
            for (int i = 0; i < docs.size(); i++) {
                ChunkExtraction doc = docs.get(i);
                if (doc == null) {
                    log.warn("document {} of the batch has no extraction, skipped", batch.getFromIndex() + i);
                    continue;
                }
                String caseId = TermUtil.clean(doc.getCaseId());
                String chunkId = Optional.ofNullable(TermUtil.clean(doc.getChunkId()))
                        .orElse("chunk-" + (batch.getFromIndex() + i));
                if (caseId == null) {
                    int dropped = doc.getEntities().size() + doc.getEvents().size() + doc.getQuestions().size();
                    log.warn("chunk {} has no case id, {} candidates dropped", chunkId, dropped);
                    malformed += dropped;
                    continue;
                }
                ResolvedChunk.ResolvedChunkBuilder chunk = ResolvedChunk.builder().caseId(caseId).chunkId(chunkId);
                int chunkIndex = chunks.size();
                chunks.add(chunk);

                Set<String> localIds = new HashSet<>();
                Set<String> droppedLocalIds = new HashSet<>();
                for (CandidateEntity ce : doc.getEntities()) {
                    if (ce == null) {
                        log.warn("chunk {}: null actor skipped", chunkId);
                        malformed++;
                        continue;
                    }
                    try {
                        EntityType type = checkEntity(ce, localIds);
                        List<CandidateState> states = ce.getStates().stream()
                                .filter(GlobalWorkspaceStore::isCompleteState)
                                .collect(Collectors.toList());
                        int badStates = ce.getStates().size() - states.size();
                        if (badStates > 0) {
                            log.warn("chunk {}: {} state(s) of {} without key or value dropped", chunkId, badStates, ce.getName());
                            malformed += badStates;
                            ce = ce.toBuilder().clearStates().states(states).build();
                        }
                        pending.add(new PendingEntity(chunkIndex, ce, type));
                    } catch (MalformedExtractionException e) {
                        log.warn("chunk {}: {}", chunkId, e.getMessage());
                        malformed++;
                        if (ce.getLocalId() != null && !localIds.contains(ce.getLocalId().trim())) {
                            droppedLocalIds.add(ce.getLocalId().trim());
                        }
                    }
                }
                for (CandidateEvent ev : doc.getEvents()) {
                    if (ev == null) {
                        log.warn("chunk {}: null verb phrase skipped", chunkId);
                        malformed++;
                        continue;
                    }
                    try {
                        checkEvent(ev, droppedLocalIds);
                        chunk.event(ev);
                    } catch (MalformedExtractionException e) {
                        log.warn("chunk {}: {}", chunkId, e.getMessage());
                        malformed++;
                    }
                }
                for (CandidateQuestion q : doc.getQuestions()) {
                    if (q == null) {
                        log.warn("chunk {}: null question skipped", chunkId);
                        malformed++;
                        continue;
                    }
                    try {
                        checkQuestion(q, droppedLocalIds);
                        chunk.question(q);
                    } catch (MalformedExtractionException e) {
                        log.warn("chunk {}: {}", chunkId, e.getMessage());
                        malformed++;
                    }
                }
            }

            List<CompletableFuture<Resolution>> futures = new ArrayList<>(pending.size());
            for (PendingEntity p : pending) {
                List<Entity> sameType = byType.getOrDefault(p.type, List.of());
                futures.add(CompletableFuture.supplyAsync(
                        () -> resolver.resolve(p.candidate, p.type, sameType, oraclePool), resolvePool));
            }
            for (int i = 0; i < pending.size(); i++) {
                PendingEntity p = pending.get(i);
                chunks.get(p.chunkIndex).entity(new ResolvedEntity(p.candidate, p.type, await(futures.get(i))));
            }

            return ResolvedBatch.builder()
                    .fromIndex(batch.getFromIndex())
                    .toIndex(batch.getToIndex())
                    .basedOnCheckpoint(workspace.getCheckpoint())
                    .chunks(chunks.stream().map(ResolvedChunk.ResolvedChunkBuilder::build).collect(Collectors.toList()))
                    .droppedQuestionIds(batch.getDroppedQuestionIds())
                    .malformedCandidates(malformed)
                    .build();
        } finally {
            resolvePool.shutdownNow();
            oraclePool.shutdownNow();
            lock.readLock().unlock();
        }
    }

    /**
     * Applies decisions serially, updates the ontology and bumps the checkpoint.
     * Not atomic on its own: a failure leaves a partly applied workspace for the caller to restore.
     *
     * @throws IllegalStateException when the decisions were taken against another workspace version
     */
    public MergeReport apply(ResolvedBatch resolved) {
        lock.writeLock().lock();
        try {
            if (resolved.getBasedOnCheckpoint() != workspace.getCheckpoint()) {
                throw new IllegalStateException("stale resolution: based on checkpoint " + resolved.getBasedOnCheckpoint()
                        + ", workspace is at " + workspace.getCheckpoint());
            }
            BatchMergeService.ApplyResult result = merger.apply(workspace, resolved);
            ontology.update(workspace.getOntology(), result.getTerms());
            workspace.setCheckpoint(workspace.getCheckpoint() + 1);

            MergeReport report = result.getReport();
            log.info("batch [{}, {}) applied: domain={}, checkpoint={}, newEntities={}, merged={}, newEvents={}, newQuestions={}, degraded={}",
                    resolved.getFromIndex(), resolved.getToIndex(), domain, workspace.getCheckpoint(),
                    report.getNewEntities(), report.getMergedEntities(), report.getNewEvents(),
                    report.getNewQuestions(), report.getDegradedMatchCount());
            return report;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public byte[] snapshot() {
        return read(() -> WorkspaceSnapshotCodec.encode(workspace));
    }

    /**
     * Replaces the in-memory workspace with the decoded snapshot.
     */
    public void restore(byte[] snapshot) {
        Workspace restored = WorkspaceSnapshotCodec.decode(snapshot);
        if (!Objects.equals(domain, restored.getDomain())) {
            throw new IllegalArgumentException("snapshot of domain " + restored.getDomain() + " cannot restore " + domain);
        }
        lock.writeLock().lock();
        try {
            workspace = restored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** explicit ontology reset */
    public void rebuildOntology() {
        lock.writeLock().lock();
        try {
            ontology.rebuild(workspace);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ======================= queries =======================

    public long checkpoint() {
        return read(() -> workspace.getCheckpoint());
    }

    public Optional<EntityView> queryByEntity(String entityId) {
        return read(() -> {
            Entity e = workspace.getEntities().get(entityId);
            if (e == null) return Optional.empty();
            return Optional.of(EntityView.builder()
                    .entity(e)
                    .events(workspace.getEvents().stream()
                            .filter(v -> v.references().contains(entityId))
                            .collect(Collectors.toList()))
                    .questions(workspace.getQuestions().values().stream()
                            .filter(q -> entityId.equals(q.getSubjectId()))
                            .collect(Collectors.toList()))
                    .build());
        });
    }

    public CaseView queryByCase(String caseId) {
        return read(() -> {
            CaseView.CaseViewBuilder view = CaseView.builder().caseId(caseId);
            for (Entity e : workspace.getEntities().values()) {
                if (!e.getInvolvedCases().contains(caseId)) continue;
                view.entity(e);
                Set<String> others = new LinkedHashSet<>(e.getInvolvedCases());
                others.remove(caseId);
                if (!others.isEmpty()) view.crossCaseEntity(e.getId(), others);
            }
            workspace.getEvents().stream().filter(v -> caseId.equals(v.getCaseId())).forEach(view::event);
            workspace.getQuestions().values().stream().filter(q -> caseId.equals(q.getCaseId())).forEach(view::question);
            return view.build();
        });
    }

    public List<Question> unansweredQuestions() {
        return read(() -> workspace.getQuestions().values().stream()
                .filter(q -> !q.isAnswered())
                .collect(Collectors.toList()));
    }

    public List<Entity> queryByRole(String role) {
        String r = TermUtil.normalize(role);
        if (r == null) return List.of();
        return read(() -> workspace.getEntities().values().stream()
                .filter(e -> TermUtil.normalizeAll(e.getRoles()).contains(r))
                .collect(Collectors.toList()));
    }

    /**
     * Entities carrying the state key; when {@code value} is given, only those whose current value matches it.
     */
    public List<Entity> queryByState(String key, String value) {
        String k = TermUtil.normalize(key);
        String v = TermUtil.normalize(value);
        if (k == null) return List.of();
        return read(() -> workspace.getEntities().values().stream()
                .filter(e -> {
                    StateValue sv = e.getStates().get(k);
                    return sv != null && (v == null || v.equals(TermUtil.normalize(sv.getValue())));
                })
                .collect(Collectors.toList()));
    }

    /**
     * Events with a temporal reference. Parsed dates come first in chronological order,
     * then unparsed ones by their raw text; ties keep insertion order.
     */
    public List<TimelineEntry> timeline() {
        return read(() -> {
            List<TimelineEntry> out = new ArrayList<>();
            for (Event v : workspace.getEvents()) {
                if (v.getTemporalId() == null) continue;
                Entity marker = workspace.getEntities().get(v.getTemporalId());
                String when = marker == null ? v.getTemporalId() : marker.getName();
                out.add(new TimelineEntry(v, when, FuzzyDate.of(when)));
            }
            out.sort(Comparator
                    .comparing((TimelineEntry t) -> t.getDate() == null || !t.getDate().isParsed())
                    .thenComparing(t -> t.getDate() == null ? null : t.getDate().getParsed(),
                            Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
                    .thenComparing(TimelineEntry::getWhen, Comparator.nullsLast(Comparator.<String>naturalOrder())));
            return out;
        });
    }

    public WorkspaceStatistics statistics() {
        return read(() -> {
            Map<String, Integer> byType = new LinkedHashMap<>();
            Set<String> cases = new HashSet<>();
            int crossCase = 0;
            for (Entity e : workspace.getEntities().values()) {
                byType.merge(e.getType().getLabel(), 1, Integer::sum);
                cases.addAll(e.getInvolvedCases());
                if (e.getInvolvedCases().size() > 1) crossCase++;
            }
            workspace.getEvents().forEach(v -> cases.add(v.getCaseId()));
            workspace.getQuestions().values().forEach(q -> cases.add(q.getCaseId()));
            cases.remove(null);
            return WorkspaceStatistics.builder()
                    .domain(domain)
                    .checkpoint(workspace.getCheckpoint())
                    .entities(workspace.getEntities().size())
                    .events(workspace.getEvents().size())
                    .questions(workspace.getQuestions().size())
                    .unansweredQuestions((int) workspace.getQuestions().values().stream().filter(q -> !q.isAnswered()).count())
                    .cases(cases.size())
                    .crossCaseEntities(crossCase)
                    .ontologyTerms(workspace.getOntology().size())
                    .entitiesByType(byType)
                    .build();
        });
    }

    /**
     * Compact TOON context for the extraction step: the most connected entities (by number of
     * events referencing them) and the open questions.
     */
    public String contextSummary(int maxEntities) {
        return read(() -> {
            Map<String, Integer> degree = new HashMap<>();
            for (Event v : workspace.getEvents()) {
                v.references().forEach(id -> degree.merge(id, 1, Integer::sum));
            }
            List<Map<String, Object>> actors = workspace.getEntities().values().stream()
                    .sorted(Comparator.comparingInt((Entity e) -> degree.getOrDefault(e.getId(), 0)).reversed()
                            .thenComparingInt(Entity::getHumanReadableId))
                    .limit(Math.max(0, maxEntities))
                    .map(e -> {
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("id", e.getId());
                        row.put("type", e.getType().getLabel());
                        row.put("name", e.getName());
                        row.put("roles", new ArrayList<>(e.getRoles()));
                        row.put("events", String.valueOf(degree.getOrDefault(e.getId(), 0)));
                        return row;
                    })
                    .collect(Collectors.toList());
            List<Map<String, Object>> open = workspace.getQuestions().values().stream()
                    .filter(q -> !q.isAnswered())
                    .map(q -> {
                        Map<String, Object> row = new LinkedHashMap<>();
                        row.put("id", q.getId());
                        row.put("about_id", q.getSubjectId());
                        row.put("question", q.getText());
                        return row;
                    })
                    .collect(Collectors.toList());
            ToonDocument doc = new ToonDocument().put("Actors", actors).put("OpenQuestions", open);
            return ToonCodec.encode(doc);
        });
    }

    public List<TermCount> ontologySummary(int topK) {
        return read(() -> ontology.summary(workspace.getOntology(), topK));
    }

    /** ontology summary as handed to the extraction step */
    public String ontologyContext(int topK) {
        return read(() -> ontology.summaryContext(workspace.getOntology(), topK));
    }

    // ======================= internals =======================

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static EntityType checkEntity(CandidateEntity ce, Set<String> localIds) {
        EntityType type = EntityType.fromLabel(ce.getType());
        if (type == null) throw new MalformedExtractionException("unknown entity type '" + ce.getType() + "' for " + ce.getName());
        if (TermUtil.clean(ce.getName()) == null) throw new MalformedExtractionException("entity " + ce.getLocalId() + " has no name");
        String local = TermUtil.clean(ce.getLocalId());
        if (local != null && !localIds.add(local)) {
            throw new MalformedExtractionException("duplicate local id " + local);
        }
        return type;
    }

    private static boolean isCompleteState(CandidateState s) {
        return s != null && TermUtil.normalize(s.getKey()) != null && TermUtil.clean(s.getValue()) != null;
    }

    private static void checkEvent(CandidateEvent ev, Set<String> droppedLocalIds) {
        if (TermUtil.clean(ev.getVerb()) == null) throw new MalformedExtractionException("event without verb");
        if (TermUtil.clean(ev.getAgentRef()) == null) throw new MalformedExtractionException("event '" + ev.getVerb() + "' without agent");
        if (CollectionUtil.isEmpty(droppedLocalIds)) return;
        List<String> refs = new ArrayList<>(ev.getPatientRefs());
        refs.add(ev.getAgentRef());
        refs.add(ev.getTemporalRef());
        refs.add(ev.getSpatialRef());
        for (String ref : refs) {
            if (ref != null && droppedLocalIds.contains(ref.trim())) {
                throw new MalformedExtractionException("event '" + ev.getVerb() + "' references dropped entity " + ref);
            }
        }
    }

    private static void checkQuestion(CandidateQuestion q, Set<String> droppedLocalIds) {
        if (TermUtil.clean(q.getText()) == null && TermUtil.clean(q.getQuestionId()) == null) {
            throw new MalformedExtractionException("question without text");
        }
        if (q.getSubjectRef() != null && droppedLocalIds.contains(q.getSubjectRef().trim())) {
            throw new MalformedExtractionException("question about dropped entity " + q.getSubjectRef());
        }
    }

    private static Resolution await(CompletableFuture<Resolution> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchAbortedException("interrupted while resolving candidates", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("candidate resolution failed", cause);
        }
    }

    private static class PendingEntity {
        final int chunkIndex;
        final CandidateEntity candidate;
        final EntityType type;

        PendingEntity(int chunkIndex, CandidateEntity candidate, EntityType type) {
            this.chunkIndex = chunkIndex;
            this.candidate = candidate;
            this.type = type;
        }
    }
}
