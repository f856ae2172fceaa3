package com.wcagdocs.techniques.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known techniques, by technology and by id.
 * The association engine never consults this; it is used to spot index keys
 * that have no technique page or whose technique is obsolete.
 */
public class TechniqueRegistry {
    private final Map<Technology, List<Technique>> byTechnology = new EnumMap<>(Technology.class);
    private final Map<String, Technique> byId = new LinkedHashMap<>();

    public TechniqueRegistry(Collection<Technique> techniques) {
        for (Technology technology : Technology.values()) {
            byTechnology.put(technology, new ArrayList<>());
        }
        for (Technique technique : techniques) {
            byTechnology.get(technique.getTechnology()).add(technique);
            byId.put(technique.getId(), technique);
        }
        byTechnology.values().forEach(list -> list.sort(Comparator.comparingInt(Technique::getNumber)));
    }

    public Optional<Technique> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public List<Technique> getTechniques(Technology technology) {
        return List.copyOf(byTechnology.get(technology));
    }

    public int size() {
        return byId.size();
    }

    /**
     * Ids from {@code ids} that are not registered, in iteration order.
     */
    public List<String> findUnknown(Collection<String> ids) {
        return ids.stream()
                .filter(id -> !byId.containsKey(id))
                .toList();
    }

    /**
     * Ids from {@code ids} whose technique is obsolete as of {@code version}, in iteration order.
     */
    public List<String> findObsolete(Collection<String> ids, WcagVersion version) {
        return ids.stream()
                .map(byId::get)
                .filter(technique -> technique != null && technique.isObsoleteIn(version))
                .map(Technique::getId)
                .toList();
    }
}
