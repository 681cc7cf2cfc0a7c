package com.gdin.inspection.gsw.storage;

import java.util.Optional;

/**
 * Durable home of workspace snapshots, one per domain. Implementations replace a snapshot atomically:
 * a reader sees either the previous or the new content, never a mix.
 */
public interface WorkspaceStorage {

    /** @return the last saved snapshot, empty when the domain was never saved */
    Optional<byte[]> load(String domain);

    void save(String domain, byte[] snapshot);
}
