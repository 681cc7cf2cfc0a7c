package com.gdin.inspection.gsw.resolve;

import com.gdin.inspection.gsw.exception.OracleUnavailableException;

/**
 * External similarity scorer. Pure function of its two inputs from the core's point of view.
 * Implementations signal failure with {@link OracleUnavailableException} (or any runtime exception);
 * the resolver degrades instead of failing the batch.
 */
@FunctionalInterface
public interface SimilarityOracle {

    /**
     * @return similarity in [0,1]
     */
    double score(EntityProfile candidate, EntityProfile existing);

    static SimilarityOracle unavailable() {
        return (a, b) -> {
            throw new OracleUnavailableException("no similarity oracle configured");
        };
    }
}
