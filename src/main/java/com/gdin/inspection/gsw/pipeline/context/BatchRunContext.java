package com.gdin.inspection.gsw.pipeline.context;

import lombok.Getter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * State shared by the steps of one batch run.
 */
@Getter
public class BatchRunContext {

    private final BatchRunStats stats = new BatchRunStats();
    private final Map<String, Object> state = new ConcurrentHashMap<>();

    public void put(String key, Object value) { state.put(key, value); }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) { return (T) state.get(key); }
}
