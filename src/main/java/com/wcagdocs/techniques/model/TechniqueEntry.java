package com.wcagdocs.techniques.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Base class for the validated entries of a technique list.
 * <p>
 * Both variants may declare {@code using}: a list of child entries, one (or
 * {@link #getUsingQuantity() some quantity}) of which completes this entry.
 * A {@code null} list means the entry declares no children; an empty list is
 * still a declaration.
 */
@Getter
@EqualsAndHashCode
@ToString
public abstract class TechniqueEntry {
    protected final List<TechniqueEntry> using;
    protected final Boolean skipUsingText;
    protected final String usingConjunction;
    protected final String usingPrefix;
    protected final String usingQuantity;

    protected TechniqueEntry(List<TechniqueEntry> using, Boolean skipUsingText, String usingConjunction,
                             String usingPrefix, String usingQuantity) {
        this.using = using != null ? List.copyOf(using) : null;
        this.skipUsingText = skipUsingText;
        this.usingConjunction = usingConjunction;
        this.usingPrefix = usingPrefix;
        this.usingQuantity = usingQuantity;
    }

    public boolean declaresUsing() {
        return using != null;
    }

    /**
     * Ids this entry contributes when it acts as the usage parent of its children.
     */
    public abstract List<String> getTechniqueIds();
}
