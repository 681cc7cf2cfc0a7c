package com.gdin.inspection.gsw.state;

import com.gdin.inspection.gsw.exception.WorkspaceStorageException;
import com.gdin.inspection.gsw.models.IngestionCursor;
import com.gdin.inspection.gsw.util.IOUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * {@code <dir>/<domain>_state.json}, JSON through Jackson, replaced atomically.
 */
@Slf4j
public class FileCursorStore implements CursorStore {

    public static final String SUFFIX = "_state.json";

    @Getter
    private final Path directory;

    public FileCursorStore(Path directory) {
        this.directory = directory;
    }

    public Path pathOf(String domain) {
        return directory.resolve(domain + SUFFIX);
    }

    @Override
    public Optional<IngestionCursor> read(String domain) {
        Path p = pathOf(domain);
        if (!Files.exists(p)) return Optional.empty();
        try {
            return Optional.ofNullable(IOUtil.jsonDeserialize(Files.readAllBytes(p), IngestionCursor.class));
        } catch (IOException e) {
            throw new WorkspaceStorageException("cannot read cursor " + p, e);
        }
    }

    @Override
    public void write(IngestionCursor cursor) {
        Path p = pathOf(cursor.getDomain());
        try {
            IOUtil.writeAtomically(p, IOUtil.jsonSerialize(cursor, true).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new WorkspaceStorageException("cannot write cursor " + p, e);
        }
    }

    @Override
    public void clear(String domain) {
        Path p = pathOf(domain);
        try {
            if (Files.deleteIfExists(p)) log.info("cursor cleared: {}", p);
        } catch (IOException e) {
            throw new WorkspaceStorageException("cannot delete cursor " + p, e);
        }
    }
}
