package com.wcagdocs.techniques.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Validated technique specification of one success criterion.
 * <p>
 * The sufficient techniques are authored either as a flat list or as a list of
 * sections; exactly one of {@link #getSufficient()} and {@link #getSufficientSections()}
 * is populated.
 */
@Value
@Builder
public class CriterionTechniques {
    String sufficientIntro;
    String sufficientNote;
    @Singular("sufficientEntry")
    List<TechniqueEntry> sufficient;
    @Singular
    List<TechniqueSection> sufficientSections;
    @Singular("advisoryEntry")
    List<TechniqueEntry> advisory;
    @Singular("failureEntry")
    List<TechniqueEntry> failure;

    public boolean isSectioned() {
        return !sufficientSections.isEmpty();
    }

    /**
     * Top-level technique lists for one association type, in traversal order.
     * For sectioned sufficient techniques this is each section's list followed
     * by the lists of its groups.
     */
    public List<List<TechniqueEntry>> entryListsFor(AssociationType type) {
        return switch (type) {
            case SUFFICIENT -> sufficientLists();
            case ADVISORY -> nonEmpty(advisory);
            case FAILURE -> nonEmpty(failure);
        };
    }

    private List<List<TechniqueEntry>> sufficientLists() {
        if (!isSectioned()) {
            return nonEmpty(sufficient);
        }
        List<List<TechniqueEntry>> lists = new ArrayList<>();
        for (TechniqueSection section : sufficientSections) {
            lists.add(section.getTechniques());
            for (TechniqueGroup group : section.getGroups()) {
                lists.add(group.getTechniques());
            }
        }
        return lists;
    }

    private static List<List<TechniqueEntry>> nonEmpty(List<TechniqueEntry> entries) {
        return entries.isEmpty() ? List.of() : List.of(entries);
    }
}
