package com.gdin.inspection.gsw.update;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.gsw.extraction.CandidateEntity;
import com.gdin.inspection.gsw.extraction.CandidateState;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import com.gdin.inspection.gsw.models.FuzzyDate;
import com.gdin.inspection.gsw.models.StateValue;
import com.gdin.inspection.gsw.models.TermKind;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.ontology.BatchTerms;
import com.gdin.inspection.gsw.util.TermUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Comparator;
import java.util.Optional;
import java.util.Set;

/**
 * Creates entities and folds candidates into existing ones. Aliases and roles only grow;
 * states follow the configured {@link StateConflictPolicy}.
 */
@Slf4j
public class EntityMergeService {

    @Getter
    private final StateConflictPolicy statePolicy;

    public EntityMergeService(StateConflictPolicy statePolicy) {
        this.statePolicy = statePolicy == null ? StateConflictPolicy.EXTRACTION_ORDER : statePolicy;
    }

    /**
     * New entity with the next id of the workspace sequence.
     */
    public Entity create(Workspace workspace, CandidateEntity candidate, EntityType type,
                         String caseId, String chunkId, BatchTerms terms) {
        Entity e = Entity.builder()
                .type(type)
                .name(TermUtil.clean(candidate.getName()))
                .build();
        workspace.allocateEntityId(e);
        fold(e, candidate, caseId, chunkId, terms);
        workspace.getEntities().put(e.getId(), e);
        return e;
    }

    public void merge(Entity target, CandidateEntity candidate, String caseId, String chunkId, BatchTerms terms) {
        fold(target, candidate, caseId, chunkId, terms);
    }

    /**
     * Same-type entity sharing a normalized alias with {@code aliases}; the oldest one when several do.
     */
    public Optional<Entity> findByAlias(Workspace workspace, EntityType type, Set<String> aliases) {
        if (CollectionUtil.isEmpty(aliases)) return Optional.empty();
        return workspace.getEntities().values().stream()
                .filter(e -> e.getType() == type)
                .filter(e -> !Collections.disjoint(e.normalizedAliases(), aliases))
                .min(Comparator.comparingInt(Entity::getHumanReadableId));
    }

    private void fold(Entity target, CandidateEntity candidate, String caseId, String chunkId, BatchTerms terms) {
        // the incoming display name always becomes an alias
        target.addAlias(candidate.getName());
        candidate.getAliases().forEach(target::addAlias);

        for (String role : candidate.getRoles()) {
            target.addRole(role);
            terms.add(TermKind.ROLE, role);
        }

        for (CandidateState s : candidate.getStates()) {
            if (s == null) continue;
            String key = TermUtil.normalize(s.getKey());
            String value = TermUtil.clean(s.getValue());
            if (key == null || value == null) {
                log.debug("state without key or value ignored on {}: {}", target.getId(), s);
                continue;
            }
            StateValue incoming = StateValue.builder()
                    .value(value)
                    .date(FuzzyDate.of(s.getDate()))
                    .caseId(caseId)
                    .confidence(s.getConfidence())
                    .build();
            StateValue existing = target.getStates().get(key);
            if (statePolicy.incomingWins(existing, incoming)) {
                target.getStates().put(key, incoming);
            }
            terms.add(TermKind.STATE_KEY, key);
        }

        target.addCase(caseId);
        target.addSourceChunk(chunkId);
    }
}
