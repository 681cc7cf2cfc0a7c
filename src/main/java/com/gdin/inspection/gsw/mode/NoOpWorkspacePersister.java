package com.gdin.inspection.gsw.mode;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class NoOpWorkspacePersister implements WorkspacePersister {

    @Override
    public boolean isDurable() {
        return false;
    }

    @Override
    public void persist(String domain, byte[] snapshot) {
        log.debug("calibration: snapshot of {} discarded ({} bytes)", domain, snapshot.length);
    }
}
