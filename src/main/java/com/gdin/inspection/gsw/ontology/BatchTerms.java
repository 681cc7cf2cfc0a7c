package com.gdin.inspection.gsw.ontology;

import com.gdin.inspection.gsw.models.TermKind;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Terms seen in one committed batch, in the order they were applied.
 */
public class BatchTerms {

    private final List<TermKind> kinds = new ArrayList<>();
    private final List<String> terms = new ArrayList<>();

    public BatchTerms add(TermKind kind, String term) {
        if (term == null || term.isBlank()) return this;
        kinds.add(kind);
        terms.add(term);
        return this;
    }

    public void forEach(BiConsumer<TermKind, String> consumer) {
        for (int i = 0; i < terms.size(); i++) consumer.accept(kinds.get(i), terms.get(i));
    }

    public int size() {
        return terms.size();
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
