package com.gdin.inspection.gsw.resolve;

import com.gdin.inspection.gsw.exception.BatchAbortedException;
import com.gdin.inspection.gsw.exception.OracleUnavailableException;
import com.gdin.inspection.gsw.extraction.CandidateEntity;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import com.gdin.inspection.gsw.util.TermUtil;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a candidate is an entity the workspace already knows.
 * Read-only with respect to the workspace; safe to call for many candidates in parallel.
 *
 * <ol>
 *   <li>exact normalized alias match against same-type entities, oracle not consulted</li>
 *   <li>best oracle score strictly above the threshold; ties go to more shared roles, then the older entity</li>
 *   <li>otherwise a new entity</li>
 * </ol>
 */
@Slf4j
public class EntityResolver {

    private static final Comparator<Entity> BY_SEQUENCE = Comparator.comparingInt(Entity::getHumanReadableId);

    private static final Comparator<Scored> PREFERENCE = Comparator.comparingDouble(Scored::getScore).reversed()
            .thenComparing(Comparator.comparingInt(Scored::getRoleOverlap).reversed())
            .thenComparingInt(s -> s.getEntity().getHumanReadableId());

    private final SimilarityOracle oracle;
    @Getter
    private final double threshold;
    private final long oracleTimeoutMillis;

    public EntityResolver(SimilarityOracle oracle, double threshold, long oracleTimeoutMillis) {
        if (threshold < 0 || threshold > 1) throw new IllegalArgumentException("threshold must be in [0,1]: " + threshold);
        this.oracle = oracle == null ? SimilarityOracle.unavailable() : oracle;
        this.threshold = threshold;
        this.oracleTimeoutMillis = oracleTimeoutMillis;
    }

    /**
     * @param sameType        existing entities of the candidate's type
     * @param oracleExecutor  pool the oracle calls run on, so they can be timed out
     */
    public Resolution resolve(CandidateEntity candidate, EntityType type, Collection<Entity> sameType,
                              ExecutorService oracleExecutor) {
        Set<String> candidateAliases = candidateAliases(candidate);

        Optional<Entity> exact = sameType.stream()
                .filter(e -> !Collections.disjoint(e.normalizedAliases(), candidateAliases))
                .min(BY_SEQUENCE);
        if (exact.isPresent()) {
            return Resolution.builder()
                    .decision(MergeDecision.mergeInto(exact.get().getId()))
                    .reason(Resolution.Reason.EXACT_ALIAS)
                    .build();
        }
        if (sameType.isEmpty()) return noMatch(null, false);

        List<Scored> scores;
        try {
            scores = scoreAll(EntityProfile.of(candidate, type), sameType, oracleExecutor);
        } catch (OracleUnavailableException e) {
            log.warn("similarity oracle unavailable for candidate '{}', exact-alias only: {}", candidate.getName(), e.getMessage());
            return noMatch(null, true);
        }

        Double best = scores.stream().map(Scored::getScore).max(Double::compare).orElse(null);
        Optional<Scored> winner = scores.stream()
                .filter(s -> s.getScore() > threshold)
                .min(PREFERENCE);
        if (winner.isEmpty()) return noMatch(best, false);

        Scored w = winner.get();
        log.debug("candidate '{}' -> {} by similarity {}", candidate.getName(), w.getEntity().getId(), w.getScore());
        return Resolution.builder()
                .decision(MergeDecision.mergeInto(w.getEntity().getId()))
                .reason(Resolution.Reason.SIMILARITY)
                .score(w.getScore())
                .build();
    }

    /** display name plus aliases, normalized */
    public static Set<String> candidateAliases(CandidateEntity candidate) {
        Set<String> out = new LinkedHashSet<>();
        String name = TermUtil.normalize(candidate.getName());
        if (name != null) out.add(name);
        out.addAll(TermUtil.normalizeAll(candidate.getAliases()));
        return out;
    }

    private List<Scored> scoreAll(EntityProfile profile, Collection<Entity> sameType, ExecutorService executor) {
        Set<String> candidateRoles = TermUtil.normalizeAll(profile.getRoles());
        Future<List<Scored>> future = executor.submit(() -> {
            List<Scored> out = new ArrayList<>(sameType.size());
            for (Entity e : sameType) {
                double s = oracle.score(profile, EntityProfile.of(e));
                if (Double.isNaN(s) || s < 0 || s > 1) {
                    throw new OracleUnavailableException("score out of range: " + s);
                }
                Set<String> shared = new LinkedHashSet<>(TermUtil.normalizeAll(e.getRoles()));
                shared.retainAll(candidateRoles);
                out.add(new Scored(e, s, shared.size()));
            }
            return out;
        });
        try {
            return future.get(oracleTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OracleUnavailableException("similarity oracle timed out after " + oracleTimeoutMillis + "ms");
        } catch (ExecutionException e) {
            throw new OracleUnavailableException("similarity oracle failed", e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BatchAbortedException("interrupted while resolving '" + profile.getName() + "'", e);
        }
    }

    private static Resolution noMatch(Double bestScore, boolean degraded) {
        return Resolution.builder()
                .decision(MergeDecision.createNew())
                .reason(Resolution.Reason.NO_MATCH)
                .score(bestScore)
                .degraded(degraded)
                .build();
    }

    @Value
    static class Scored {
        Entity entity;
        double score;
        int roleOverlap;
    }
}
