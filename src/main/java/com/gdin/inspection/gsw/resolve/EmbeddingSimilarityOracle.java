package com.gdin.inspection.gsw.resolve;

import com.gdin.inspection.gsw.exception.OracleUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;

/**
 * Cosine similarity of the profiles' embeddings. Embeddings are cached per profile text,
 * at most {@code cacheSize} of them; a profile's text changes whenever its entity gains an
 * alias or a role, so old versions are evicted rather than kept.
 */
@Slf4j
public class EmbeddingSimilarityOracle implements SimilarityOracle {

    private final EmbeddingModel embeddingModel;
    private final Cache<String, Embedding> cache;

    public EmbeddingSimilarityOracle(EmbeddingModel embeddingModel, long cacheSize) {
        this.embeddingModel = embeddingModel;
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, cacheSize))
                .build();
    }

    @Override
    public double score(EntityProfile candidate, EntityProfile existing) {
        double cos = CosineSimilarity.between(embed(candidate.text()), embed(existing.text()));
        // cosine can go negative, the contract is [0,1]
        return Math.max(0.0, Math.min(1.0, cos));
    }

    /** entries currently held, after pending evictions have run */
    long cachedEmbeddings() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private Embedding embed(String text) {
        Embedding cached = cache.getIfPresent(text);
        if (cached != null) return cached;
        try {
            Embedding e = embeddingModel.embed(text).content();
            if (e == null) throw new OracleUnavailableException("embedding model returned no vector");
            cache.put(text, e);
            return e;
        } catch (OracleUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("embedding call failed: {}", e.getMessage());
            throw new OracleUnavailableException("embedding model unavailable", e);
        }
    }
}
