package com.gdin.inspection.gsw.update;

import cn.hutool.core.util.StrUtil;
import com.gdin.inspection.gsw.exception.ReferenceIntegrityException;
import com.gdin.inspection.gsw.extraction.CandidateEvent;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.TermKind;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.ontology.BatchTerms;
import com.gdin.inspection.gsw.util.TermUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Appends verb phrases once every entity id is final.
 */
public class EventMergeService {

    /**
     * @param knownFacts fact keys already in the workspace; updated in place
     * @param localIds   candidate local id of the same chunk -> workspace entity id
     * @return the appended event, or {@code null} when the same fact is already recorded
     * @throws ReferenceIntegrityException when a reference names neither a local nor a workspace entity
     */
    public Event append(Workspace workspace, Set<List<Object>> knownFacts, CandidateEvent candidate,
                        Map<String, String> localIds, String caseId, String chunkId, BatchTerms terms) {
        List<String> patients = new ArrayList<>();
        for (String ref : candidate.getPatientRefs()) {
            String id = resolveRef(workspace, localIds, ref, chunkId);
            if (id != null) patients.add(id);
        }
        Event event = Event.builder()
                .verb(TermUtil.clean(candidate.getVerb()))
                .agentId(resolveRef(workspace, localIds, candidate.getAgentRef(), chunkId))
                .patientIds(patients)
                .temporalId(resolveRef(workspace, localIds, candidate.getTemporalRef(), chunkId))
                .spatialId(resolveRef(workspace, localIds, candidate.getSpatialRef(), chunkId))
                .implicit(candidate.isImplicit())
                .caseId(caseId)
                .chunkId(chunkId)
                .build();
        terms.add(TermKind.VERB, event.getVerb());

        if (!knownFacts.add(event.factKey())) return null;
        event.setId(workspace.allocateEventId());
        workspace.getEvents().add(event);
        return event;
    }

    /** local ids shadow workspace ids */
    static String resolveRef(Workspace workspace, Map<String, String> localIds, String ref, String chunkId) {
        if (StrUtil.isBlank(ref)) return null;
        String r = ref.trim();
        String local = localIds.get(r);
        if (local != null) return local;
        if (workspace.getEntities().containsKey(r)) return r;
        throw new ReferenceIntegrityException(r, "unresolved entity reference '" + r + "' in chunk " + chunkId);
    }
}
