package com.gdin.inspection.gsw.models;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * term -> frequency, kept per term kind. Counts only go up; {@link #clear()} is the explicit rebuild hook.
 */
@EqualsAndHashCode
@ToString
public class OntologyDictionary {

    private final Map<TermKind, Map<String, Long>> counts = new EnumMap<>(TermKind.class);

    public void increment(TermKind kind, String term, long by) {
        if (by <= 0) throw new IllegalArgumentException("ontology counts never decrease: " + by);
        counts.computeIfAbsent(kind, k -> new LinkedHashMap<>()).merge(term, by, Long::sum);
    }

    public long count(TermKind kind, String term) {
        return counts.getOrDefault(kind, Collections.emptyMap()).getOrDefault(term, 0L);
    }

    public List<TermCount> entries() {
        List<TermCount> out = new ArrayList<>();
        counts.forEach((kind, terms) -> terms.forEach((t, c) -> out.add(new TermCount(kind, t, c))));
        return out;
    }

    public int size() {
        return counts.values().stream().mapToInt(Map::size).sum();
    }

    public void clear() {
        counts.clear();
    }
}
