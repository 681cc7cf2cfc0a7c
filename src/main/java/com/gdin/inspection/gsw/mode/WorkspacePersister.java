package com.gdin.inspection.gsw.mode;

/**
 * What a committed batch leaves behind. The merge engine is the same in every mode; only this differs.
 */
public interface WorkspacePersister {

    /** whether {@link #persist} reaches durable storage; the cursor only advances behind a durable write */
    boolean isDurable();

    void persist(String domain, byte[] snapshot);
}
