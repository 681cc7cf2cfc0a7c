package com.gdin.inspection.gsw.resolve;

import com.gdin.inspection.gsw.extraction.CandidateEntity;
import com.gdin.inspection.gsw.models.Entity;
import com.gdin.inspection.gsw.models.EntityType;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * What the similarity oracle gets to see of an entity.
 */
@Value
public class EntityProfile {
    EntityType type;
    String name;
    List<String> aliases;
    List<String> roles;

    public static EntityProfile of(Entity e) {
        return new EntityProfile(e.getType(), e.getName(), List.copyOf(e.getAliases()), List.copyOf(e.getRoles()));
    }

    public static EntityProfile of(CandidateEntity c, EntityType type) {
        return new EntityProfile(type, c.getName(), nonNull(c.getAliases()), nonNull(c.getRoles()));
    }

    private static List<String> nonNull(List<String> values) {
        return values.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    /** single-line rendering used as embedding input */
    public String text() {
        List<String> parts = new ArrayList<>();
        parts.add(name + " (" + type.getLabel() + ")");
        if (!aliases.isEmpty()) parts.add("aliases: " + String.join(", ", aliases));
        if (!roles.isEmpty()) parts.add("roles: " + String.join(", ", roles));
        return String.join("; ", parts);
    }
}
