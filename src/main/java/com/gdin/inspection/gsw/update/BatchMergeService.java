package com.gdin.inspection.gsw.update;

import com.gdin.inspection.gsw.extraction.CandidateEvent;
import com.gdin.inspection.gsw.extraction.CandidateQuestion;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.MergeReport;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.ontology.BatchTerms;
import com.gdin.inspection.gsw.resolve.EntityResolver;
import com.gdin.inspection.gsw.resolve.ResolvedBatch;
import com.gdin.inspection.gsw.resolve.ResolvedChunk;
import com.gdin.inspection.gsw.resolve.ResolvedEntity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Apply phase: turns a {@link ResolvedBatch} into workspace mutations, serially and in input order.
 * Mutates the workspace in place; the caller owns rollback.
 */
@Slf4j
public class BatchMergeService {

    @Data
    @AllArgsConstructor
    public static class ApplyResult {
        private MergeReport report;
        private BatchTerms terms;
    }

    private final EntityMergeService entityMergeService;
    private final EventMergeService eventMergeService;
    private final QuestionMergeService questionMergeService;

    public BatchMergeService(EntityMergeService entityMergeService) {
        this(entityMergeService, new EventMergeService(), new QuestionMergeService());
    }

    public BatchMergeService(EntityMergeService entityMergeService, EventMergeService eventMergeService,
                             QuestionMergeService questionMergeService) {
        this.entityMergeService = entityMergeService;
        this.eventMergeService = eventMergeService;
        this.questionMergeService = questionMergeService;
    }

    public ApplyResult apply(Workspace workspace, ResolvedBatch batch) {
        MergeReport report = MergeReport.empty();
        report.setMalformedCandidates(batch.getMalformedCandidates());
        BatchTerms terms = new BatchTerms();
        Set<List<Object>> knownFacts = workspace.getEvents().stream()
                .map(Event::factKey)
                .collect(Collectors.toCollection(HashSet::new));

        for (ResolvedChunk chunk : batch.getChunks()) {
            String caseId = chunk.getCaseId();
            String chunkId = chunk.getChunkId();
            Map<String, String> localIds = new HashMap<>();

            // 1) entities: ids become final here
            for (ResolvedEntity re : chunk.getEntities()) {
                Entity target = target(workspace, re);
                if (target == null) {
                    target = entityMergeService.create(workspace, re.getCandidate(), re.getType(), caseId, chunkId, terms);
                    report.setNewEntities(report.getNewEntities() + 1);
                } else {
                    entityMergeService.merge(target, re.getCandidate(), caseId, chunkId, terms);
                    report.setMergedEntities(report.getMergedEntities() + 1);
                }
                String key = re.key(chunkId);
                if (re.getResolution().isDegraded()) report.getDegradedMatches().add(key);
                if (re.getCandidate().getLocalId() != null) localIds.put(re.getCandidate().getLocalId().trim(), target.getId());
                report.getEntityIdMapping().put(key, target.getId());
            }

            // 2) events
            for (CandidateEvent ce : chunk.getEvents()) {
                Event appended = eventMergeService.append(workspace, knownFacts, ce, localIds, caseId, chunkId, terms);
                if (appended == null) {
                    report.setSkippedDuplicateEvents(report.getSkippedDuplicateEvents() + 1);
                } else {
                    report.setNewEvents(report.getNewEvents() + 1);
                }
            }

            // 3) questions
            for (CandidateQuestion cq : chunk.getQuestions()) {
                switch (questionMergeService.apply(workspace, cq, localIds, caseId, chunkId)) {
                    case CREATED:
                        report.setNewQuestions(report.getNewQuestions() + 1);
                        break;
                    case CREATED_ANSWERED:
                        report.setNewQuestions(report.getNewQuestions() + 1);
                        report.setAnsweredQuestions(report.getAnsweredQuestions() + 1);
                        break;
                    case ANSWERED:
                        report.setAnsweredQuestions(report.getAnsweredQuestions() + 1);
                        break;
                    case UNKNOWN_QUESTION:
                        report.setMalformedCandidates(report.getMalformedCandidates() + 1);
                        break;
                    default:
                        break;
                }
            }
        }

        for (String qid : batch.getDroppedQuestionIds()) {
            if (questionMergeService.drop(workspace, qid)) {
                report.setDroppedQuestions(report.getDroppedQuestions() + 1);
            } else {
                log.debug("drop of unknown question {} ignored", qid);
            }
        }
        return new ApplyResult(report, terms);
    }

    /**
     * Existing entity the candidate folds into, or {@code null} for a new one. A CreateNew decision is
     * re-checked by exact alias, since an earlier candidate of this batch may have introduced the alias.
     */
    private Entity target(Workspace workspace, ResolvedEntity re) {
        if (re.getResolution().getDecision().isMerge()) {
            String id = re.getResolution().getDecision().getTargetId();
            Entity t = workspace.getEntities().get(id);
            if (t == null) throw new IllegalStateException("merge target " + id + " is not in the workspace");
            return t;
        }
        return entityMergeService
                .findByAlias(workspace, re.getType(), EntityResolver.candidateAliases(re.getCandidate()))
                .orElse(null);
    }
}
