package com.gdin.inspection.gsw.extraction;

/**
 * The language-model extraction step. Opaque to the core.
 */
@FunctionalInterface
public interface ExtractionSupplier {

    /**
     * @param documentText    raw text of one document (or chunk)
     * @param chunkId         id the core will attach as provenance
     * @param ontologyContext compact TOON summary of the most frequent terms, may be empty
     * @return actors, roles, states, verb phrases and questions; provenance is overwritten by the caller
     */
    ChunkExtraction extract(String documentText, String chunkId, String ontologyContext);
}
