package com.gdin.inspection.gsw.extraction;

import java.util.List;

/**
 * Ordered, index-addressable corpus of one domain.
 */
public interface DocumentSource {

    int size();

    SourceDocument get(int index);

    static DocumentSource of(List<SourceDocument> documents) {
        List<SourceDocument> docs = List.copyOf(documents);
        return new DocumentSource() {
            @Override
            public int size() {
                return docs.size();
            }

            @Override
            public SourceDocument get(int index) {
                return docs.get(index);
            }
        };
    }
}
