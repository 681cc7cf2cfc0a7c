package com.gdin.inspection.gsw.storage;

import com.gdin.inspection.gsw.exception.WorkspaceStorageException;
import com.gdin.inspection.gsw.util.IOUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@code <dir>/<domain>_workspace.toon}, written through a temp file and a rename.
 */
@Slf4j
public class FileWorkspaceStorage implements WorkspaceStorage {

    public static final String SUFFIX = "_workspace.toon";

    @Getter
    private final Path directory;

    public FileWorkspaceStorage(Path directory) {
        this.directory = directory;
    }

    public Path pathOf(String domain) {
        return directory.resolve(domain + SUFFIX);
    }

    @Override
    public Optional<byte[]> load(String domain) {
        Path p = pathOf(domain);
        if (!Files.exists(p)) return Optional.empty();
        try {
            return Optional.of(Files.readAllBytes(p));
        } catch (IOException e) {
            throw new WorkspaceStorageException("cannot read snapshot " + p, e);
        }
    }

    @Override
    public void save(String domain, byte[] snapshot) {
        Path p = pathOf(domain);
        try {
            IOUtil.writeAtomically(p, snapshot);
            log.debug("snapshot written: {} ({} bytes)", p, snapshot.length);
        } catch (IOException e) {
            throw new WorkspaceStorageException("cannot write snapshot " + p, e);
        }
    }
}
