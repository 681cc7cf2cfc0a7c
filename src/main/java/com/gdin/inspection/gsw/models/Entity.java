package com.gdin.inspection.gsw.models;

import com.gdin.inspection.gsw.util.TermUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Entity {

    private String id;

    /** workspace sequence the id was built from; orders entities deterministically */
    private Integer humanReadableId;

    private EntityType type;

    private String name;

    /** surface forms, unique by normalized form, first-seen spelling kept */
    @Builder.Default
    private Set<String> aliases = new LinkedHashSet<>();

    /** first-seen order, no duplicates */
    @Builder.Default
    private List<String> roles = new ArrayList<>();

    @Builder.Default
    private Map<String, StateValue> states = new LinkedHashMap<>();

    @Builder.Default
    private Set<String> involvedCases = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> sourceChunkIds = new LinkedHashSet<>();

    public static String idOf(int humanReadableId) {
        return "E" + humanReadableId;
    }

    public Set<String> normalizedAliases() {
        return TermUtil.normalizeAll(aliases);
    }

    public boolean hasAlias(String alias) {
        String n = TermUtil.normalize(alias);
        return n != null && normalizedAliases().contains(n);
    }

    /** @return true when the alias was new */
    public boolean addAlias(String alias) {
        String surface = TermUtil.clean(alias);
        if (surface == null || hasAlias(surface)) return false;
        return aliases.add(surface);
    }

    /** @return true when the role was new; existing roles keep their position */
    public boolean addRole(String role) {
        String surface = TermUtil.clean(role);
        if (surface == null) return false;
        String n = TermUtil.normalize(surface);
        for (String r : roles) {
            if (n.equals(TermUtil.normalize(r))) return false;
        }
        return roles.add(surface);
    }

    public boolean addCase(String caseId) {
        String c = TermUtil.clean(caseId);
        return c != null && involvedCases.add(c);
    }

    public boolean addSourceChunk(String chunkId) {
        String c = TermUtil.clean(chunkId);
        return c != null && sourceChunkIds.add(c);
    }
}
