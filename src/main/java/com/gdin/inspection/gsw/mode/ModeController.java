package com.gdin.inspection.gsw.mode;

import com.gdin.inspection.gsw.storage.WorkspaceStorage;
import com.gdin.inspection.gsw.workspace.GlobalWorkspaceStore;
import com.gdin.inspection.gsw.workspace.WorkspaceStoreFactory;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out sessions. Production sessions of a domain share one live store and one writer lock;
 * every calibration session gets its own copy loaded from the durable snapshot.
 */
@Slf4j
public class ModeController {

    private final WorkspaceStoreFactory storeFactory;
    private final WorkspacePersister durable;
    private final WorkspacePersister noOp = new NoOpWorkspacePersister();

    private final Map<String, GlobalWorkspaceStore> live = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> writers = new ConcurrentHashMap<>();

    public ModeController(WorkspaceStoreFactory storeFactory, WorkspaceStorage storage) {
        this.storeFactory = storeFactory;
        this.durable = new DurableWorkspacePersister(storage);
    }

    public WorkspaceSession open(String domain, RunMode mode) {
        if (mode == RunMode.CALIBRATION) {
            log.info("calibration session on {}: working on a private copy", domain);
            return new WorkspaceSession(mode, storeFactory.load(domain), noOp, new ReentrantLock());
        }
        GlobalWorkspaceStore store = live.computeIfAbsent(domain, storeFactory::load);
        return new WorkspaceSession(mode, store, durable, writers.computeIfAbsent(domain, d -> new ReentrantLock()));
    }

    /** drop the live store so the next production session reloads from disk */
    public void evict(String domain) {
        live.remove(domain);
    }
}
