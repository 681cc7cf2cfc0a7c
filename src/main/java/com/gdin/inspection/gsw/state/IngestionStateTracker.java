package com.gdin.inspection.gsw.state;

import com.gdin.inspection.gsw.models.IngestionCursor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;

/**
 * Tracks how far ingestion of one domain got. The cursor is read once when the tracker is opened;
 * afterwards the tracker's position is the truth and every {@link #advance(int)} writes it through.
 */
@Slf4j
public class IngestionStateTracker {

    private final CursorStore store;
    @Getter
    private final String domain;
    @Getter
    private final int batchSize;
    @Getter
    private final int totalDocuments;

    @Getter
    private int position;

    private IngestionStateTracker(CursorStore store, String domain, int batchSize, int totalDocuments, int position) {
        this.store = store;
        this.domain = domain;
        this.batchSize = batchSize;
        this.totalDocuments = totalDocuments;
        this.position = position;
    }

    /**
     * @throws IllegalStateException when the recorded cursor lies beyond {@code totalDocuments}
     */
    public static IngestionStateTracker open(CursorStore store, String domain, int batchSize, int totalDocuments) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        if (totalDocuments < 0) throw new IllegalArgumentException("totalDocuments must not be negative: " + totalDocuments);
        Optional<IngestionCursor> cursor = store.read(domain);
        int start = cursor.map(IngestionCursor::getLastCommittedIndex).orElse(0);
        if (start > totalDocuments) {
            throw new IllegalStateException("cursor of " + domain + " is at " + start + " but only " + totalDocuments + " documents exist");
        }
        cursor.ifPresent(c -> {
            if (c.getBatchSize() != batchSize) {
                log.info("batch size changed for {}: {} -> {}", domain, c.getBatchSize(), batchSize);
            }
        });
        log.info("ingestion of {} resumes at {}/{}", domain, start, totalDocuments);
        return new IngestionStateTracker(store, domain, batchSize, totalDocuments, start);
    }

    /** {@code [position, min(position + batchSize, total))}; empty once everything is committed */
    public Optional<IndexRange> nextRange() {
        return rangeFrom(position);
    }

    public Optional<IndexRange> rangeFrom(int from) {
        if (from >= totalDocuments) return Optional.empty();
        return Optional.of(new IndexRange(from, Math.min(from + batchSize, totalDocuments)));
    }

    /**
     * Records that documents before {@code to} are committed. Call only after the snapshot is durable.
     * The in-memory position moves only when the write succeeded.
     */
    public void advance(int to) {
        if (to <= position || to > totalDocuments) {
            throw new IllegalArgumentException("cannot advance " + domain + " from " + position + " to " + to);
        }
        IngestionCursor next = current().toBuilder()
                .lastCommittedIndex(to)
                .updatedAt(Instant.now())
                .build();
        store.write(next);
        position = to;
    }

    public boolean isComplete() {
        return position >= totalDocuments;
    }

    public IngestionCursor current() {
        return IngestionCursor.builder()
                .domain(domain)
                .lastCommittedIndex(position)
                .batchSize(batchSize)
                .totalDocuments(totalDocuments)
                .build();
    }
}
