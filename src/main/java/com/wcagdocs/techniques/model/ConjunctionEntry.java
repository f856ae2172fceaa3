package com.wcagdocs.techniques.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A set of techniques that must be applied together.
 * Members are plain references: they carry an id and/or a title but never {@code using}.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ConjunctionEntry extends TechniqueEntry {
    private final List<ReferenceEntry> and;
    private final String andConjunction;

    @Builder
    public ConjunctionEntry(@NonNull List<ReferenceEntry> and, String andConjunction, List<TechniqueEntry> using,
                            Boolean skipUsingText, String usingConjunction, String usingPrefix,
                            String usingQuantity) {
        super(using, skipUsingText, usingConjunction, usingPrefix, usingQuantity);
        this.and = List.copyOf(and);
        this.andConjunction = andConjunction;
    }

    /**
     * Ids of the members, in authored order, skipping title-only members.
     */
    @Override
    public List<String> getTechniqueIds() {
        return and.stream()
                .filter(ReferenceEntry::hasId)
                .map(ReferenceEntry::getId)
                .toList();
    }

    /**
     * Ids of the other members, skipping every member that carries {@code memberId}.
     */
    public List<String> getSiblingIds(String memberId) {
        List<String> ids = new ArrayList<>();
        for (ReferenceEntry member : and) {
            if (member.hasId() && !member.getId().equals(memberId)) {
                ids.add(member.getId());
            }
        }
        return List.copyOf(ids);
    }
}
