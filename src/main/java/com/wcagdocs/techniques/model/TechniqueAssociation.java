package com.wcagdocs.techniques.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One "referenced by" record: a criterion that references a technique, and how.
 * <p>
 * {@code usageParentDescription} is only non-empty when {@code usageParentIds} is empty.
 * {@code with} lists the other members of the same conjunction and is empty otherwise.
 */
@Value
@Builder
public class TechniqueAssociation {
    @NonNull
    Criterion criterion;
    @NonNull
    AssociationType type;
    @Getter(AccessLevel.NONE)
    boolean hasUsageChildren;
    @Singular
    List<String> usageParentIds;
    @Builder.Default
    String usageParentDescription = "";
    @Builder.Default
    List<String> with = List.of();

    /**
     * Whether this technique must be paired with specific child techniques to fulfil the criterion.
     */
    public boolean hasUsageChildren() {
        return hasUsageChildren;
    }
}
