package com.gdin.inspection.gsw.models;

import com.gdin.inspection.gsw.util.TermUtil;
import lombok.Getter;

import java.util.Map;

/**
 * Closed set of actor types. Labels coming from the extraction step are mapped leniently;
 * anything else is rejected as a malformed candidate.
 */
@Getter
public enum EntityType {
    PERSON("person"),
    ORGANIZATION("organization"),
    LOCATION("location"),
    TEMPORAL_MARKER("temporal-marker"),
    ASSET("asset");

    private static final Map<String, EntityType> SYNONYMS = Map.ofEntries(
            Map.entry("person", PERSON),
            Map.entry("people", PERSON),
            Map.entry("individual", PERSON),
            Map.entry("organization", ORGANIZATION),
            Map.entry("organisation", ORGANIZATION),
            Map.entry("org", ORGANIZATION),
            Map.entry("location", LOCATION),
            Map.entry("place", LOCATION),
            Map.entry("temporal-marker", TEMPORAL_MARKER),
            Map.entry("temporal_marker", TEMPORAL_MARKER),
            Map.entry("temporal", TEMPORAL_MARKER),
            Map.entry("date", TEMPORAL_MARKER),
            Map.entry("time", TEMPORAL_MARKER),
            Map.entry("asset", ASSET),
            Map.entry("object", ASSET),
            Map.entry("property", ASSET)
    );

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    /**
     * @return the matching type, or {@code null} when the label is blank or unknown
     */
    public static EntityType fromLabel(String raw) {
        String key = TermUtil.normalize(raw);
        return key == null ? null : SYNONYMS.get(key);
    }
}
