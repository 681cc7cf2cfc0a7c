package com.gdin.inspection.gsw.state;

import com.gdin.inspection.gsw.models.IngestionCursor;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 简单的内存实现，线程安全。用于测试和本地调试，进程退出后游标即丢失。
 */
public class InMemoryCursorStore implements CursorStore {

    private final Map<String, IngestionCursor> store = new ConcurrentHashMap<>();

    @Override
    public Optional<IngestionCursor> read(String domain) {
        return Optional.ofNullable(store.get(domain));
    }

    @Override
    public void write(IngestionCursor cursor) {
        store.put(cursor.getDomain(), cursor);
    }

    @Override
    public void clear(String domain) {
        store.remove(domain);
    }
}
