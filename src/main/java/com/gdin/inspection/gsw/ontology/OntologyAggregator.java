package com.gdin.inspection.gsw.ontology;

import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.Event;
import com.gdin.inspection.gsw.models.OntologyDictionary;
import com.gdin.inspection.gsw.models.TermCount;
import com.gdin.inspection.gsw.models.TermKind;
import com.gdin.inspection.gsw.models.Workspace;
import com.gdin.inspection.gsw.toon.ToonCodec;
import com.gdin.inspection.gsw.util.TermUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Frequency table over role names, verb labels and state keys of committed batches.
 * The vocabulary is open: unknown terms are counted as written. An optional canonical mapping
 * (normalized term -> canonical term) folds known variants together.
 */
@Slf4j
public class OntologyAggregator {

    private static final Comparator<TermCount> BY_FREQUENCY = Comparator
            .comparingLong(TermCount::getCount).reversed()
            .thenComparing(TermCount::getKind)
            .thenComparing(TermCount::getTerm);

    private final Map<String, String> canonicalTerms;

    public OntologyAggregator() {
        this(Collections.emptyMap());
    }

    public OntologyAggregator(Map<String, String> canonicalTerms) {
        Map<String, String> m = new LinkedHashMap<>();
        if (canonicalTerms != null) {
            canonicalTerms.forEach((k, v) -> {
                String key = TermUtil.normalize(k);
                String value = TermUtil.clean(v);
                if (key != null && value != null) m.put(key, value);
            });
        }
        this.canonicalTerms = Collections.unmodifiableMap(m);
    }

    /**
     * Adds one occurrence per term. O(terms).
     */
    public void update(OntologyDictionary dictionary, BatchTerms terms) {
        if (terms == null || terms.isEmpty()) return;
        terms.forEach((kind, term) -> {
            String t = canonical(term);
            if (t != null) dictionary.increment(kind, t, 1);
        });
    }

    /** most frequent terms of all kinds; computed on read */
    public List<TermCount> summary(OntologyDictionary dictionary, int topK) {
        return dictionary.entries().stream()
                .sorted(BY_FREQUENCY)
                .limit(Math.max(0, topK))
                .collect(Collectors.toList());
    }

    public List<TermCount> summary(OntologyDictionary dictionary, TermKind kind, int topK) {
        return dictionary.entries().stream()
                .filter(tc -> tc.getKind() == kind)
                .sorted(BY_FREQUENCY)
                .limit(Math.max(0, topK))
                .collect(Collectors.toList());
    }

    /** summary as a TOON block, the shape handed to the extraction step */
    public String summaryContext(OntologyDictionary dictionary, int topK) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (TermCount tc : summary(dictionary, topK)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("kind", tc.getKind().name().toLowerCase());
            row.put("term", tc.getTerm());
            row.put("count", String.valueOf(tc.getCount()));
            rows.add(row);
        }
        return rows.isEmpty() ? "" : ToonCodec.encode("Ontology", rows);
    }

    /**
     * Explicit reset: recount the dictionary from the entity and event tables.
     */
    public void rebuild(Workspace workspace) {
        OntologyDictionary dictionary = workspace.getOntology();
        dictionary.clear();
        BatchTerms terms = new BatchTerms();
        for (Entity e : workspace.getEntities().values()) {
            e.getRoles().forEach(r -> terms.add(TermKind.ROLE, r));
            e.getStates().keySet().forEach(k -> terms.add(TermKind.STATE_KEY, k));
        }
        for (Event v : workspace.getEvents()) {
            terms.add(TermKind.VERB, v.getVerb());
        }
        update(dictionary, terms);
        log.info("ontology rebuilt: domain={}, terms={}", workspace.getDomain(), dictionary.size());
    }

    public String canonical(String term) {
        String n = TermUtil.normalize(term);
        if (n == null) return null;
        String mapped = canonicalTerms.get(n);
        return mapped != null ? mapped : term.trim();
    }
}
