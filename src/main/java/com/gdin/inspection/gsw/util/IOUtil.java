package com.gdin.inspection.gsw.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        simpleMapper.registerModule(new JavaTimeModule());
        // Instant 写成 ISO 字符串，不写 long
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private IOUtil() {}

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    public static String jsonSerialize(Object obj) throws JsonProcessingException {
        return jsonSerialize(obj, false);
    }

    public static String jsonSerialize(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        return pretty
                ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj)
                : simpleMapper.writeValueAsString(obj);
    }

    public static <T> T jsonDeserialize(byte[] content, Class<T> clazz) throws IOException {
        return content == null ? null : simpleMapper.readValue(content, clazz);
    }

    /**
     * Writes {@code content} to a sibling temp file, forces it to disk and renames it over
     * {@code target}, so readers only ever see the old or the new file.
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("atomic move not supported for {}, falling back to replace", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
