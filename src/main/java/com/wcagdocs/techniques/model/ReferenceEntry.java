package com.wcagdocs.techniques.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * A reference to a single technique, either by id, by display title, or both.
 * Title-only references stand in for techniques that have no published page yet.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ReferenceEntry extends TechniqueEntry {
    private final String id;
    private final String title;

    @Builder
    public ReferenceEntry(String id, String title, List<TechniqueEntry> using, Boolean skipUsingText,
                          String usingConjunction, String usingPrefix, String usingQuantity) {
        super(using, skipUsingText, usingConjunction, usingPrefix, usingQuantity);
        this.id = id;
        this.title = title;
    }

    public static ReferenceEntry ofId(String id) {
        return ReferenceEntry.builder().id(id).build();
    }

    public static ReferenceEntry ofTitle(String title) {
        return ReferenceEntry.builder().title(title).build();
    }

    public boolean hasId() {
        return id != null && !id.isEmpty();
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    @Override
    public List<String> getTechniqueIds() {
        return hasId() ? List.of(id) : List.of();
    }
}
