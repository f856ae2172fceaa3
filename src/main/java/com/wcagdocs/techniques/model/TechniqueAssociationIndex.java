package com.wcagdocs.techniques.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Technique id to the ordered, de-duplicated criteria that reference it.
 * Techniques without associations are absent rather than mapped to an empty list.
 */
@EqualsAndHashCode
@ToString
public class TechniqueAssociationIndex {
    private final Map<String, List<TechniqueAssociation>> associations;

    public TechniqueAssociationIndex(Map<String, List<TechniqueAssociation>> associations) {
        Map<String, List<TechniqueAssociation>> copy = new LinkedHashMap<>();
        associations.forEach((id, list) -> {
            if (!list.isEmpty()) {
                copy.put(id, List.copyOf(list));
            }
        });
        this.associations = Collections.unmodifiableMap(copy);
    }

    public static TechniqueAssociationIndex empty() {
        return new TechniqueAssociationIndex(Map.of());
    }

    /**
     * Associations of a technique; empty when the technique is not referenced.
     */
    public List<TechniqueAssociation> get(String techniqueId) {
        return associations.getOrDefault(techniqueId, List.of());
    }

    public boolean contains(String techniqueId) {
        return associations.containsKey(techniqueId);
    }

    public Set<String> getTechniqueIds() {
        return associations.keySet();
    }

    public int size() {
        return associations.size();
    }

    public int getAssociationCount() {
        return associations.values().stream().mapToInt(List::size).sum();
    }

    public Map<String, List<TechniqueAssociation>> asMap() {
        return associations;
    }
}
