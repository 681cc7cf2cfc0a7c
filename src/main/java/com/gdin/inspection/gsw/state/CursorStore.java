package com.gdin.inspection.gsw.state;

import com.gdin.inspection.gsw.models.IngestionCursor;

import java.util.Optional;

/**
 * Minimal contract for ingestion progress, one cursor per domain.
 * Implementations must replace a cursor atomically.
 */
public interface CursorStore {

    /**
     * @return the recorded cursor, empty when the domain has never committed a batch
     */
    Optional<IngestionCursor> read(String domain);

    /**
     * Only called after the snapshot covering {@code cursor.lastCommittedIndex} is durable.
     */
    void write(IngestionCursor cursor);

    /** forget the domain's progress; the next run starts at document 0 */
    void clear(String domain);
}
