package com.gdin.inspection.gsw.mode;

import com.gdin.inspection.gsw.storage.WorkspaceStorage;

public class DurableWorkspacePersister implements WorkspacePersister {

    private final WorkspaceStorage storage;

    public DurableWorkspacePersister(WorkspaceStorage storage) {
        this.storage = storage;
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    @Override
    public void persist(String domain, byte[] snapshot) {
        storage.save(domain, snapshot);
    }
}
