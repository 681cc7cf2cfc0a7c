package com.gdin.inspection.gsw.toon;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of named record blocks. Comments are carried along but are not part of equality.
 */
@Getter
@ToString
@EqualsAndHashCode(of = "tables")
public class ToonDocument {

    private final List<String> comments = new ArrayList<>();

    private final Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();

    public ToonDocument comment(String comment) {
        comments.add(comment);
        return this;
    }

    public ToonDocument put(String name, List<Map<String, Object>> records) {
        tables.put(name, records);
        return this;
    }

    /** @return the block's records, empty when the block is absent */
    public List<Map<String, Object>> get(String name) {
        return tables.getOrDefault(name, List.of());
    }

    public boolean has(String name) {
        return tables.containsKey(name);
    }
}
