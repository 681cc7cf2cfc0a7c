package com.gdin.inspection.gsw.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A verb phrase: agent does verb to patients, optionally at a time and place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    private String id;

    private String verb;

    private String agentId;

    @Builder.Default
    private List<String> patientIds = new ArrayList<>();

    private String temporalId;

    private String spatialId;

    /** inferred rather than stated in the text */
    private boolean implicit;

    private String caseId;

    private String chunkId;

    public static String idOf(int seq) {
        return "V" + seq;
    }

    /** every entity id this event points at, agent first */
    public Set<String> references() {
        Set<String> refs = new LinkedHashSet<>();
        if (agentId != null) refs.add(agentId);
        if (patientIds != null) patientIds.stream().filter(Objects::nonNull).forEach(refs::add);
        if (temporalId != null) refs.add(temporalId);
        if (spatialId != null) refs.add(spatialId);
        return refs;
    }

    /** identity of the fact, independent of id and chunk */
    public List<Object> factKey() {
        return List.of(
                String.valueOf(verb).toLowerCase(),
                String.valueOf(agentId),
                patientIds == null ? List.of() : List.copyOf(patientIds),
                String.valueOf(temporalId),
                String.valueOf(spatialId),
                implicit,
                String.valueOf(caseId));
    }
}
