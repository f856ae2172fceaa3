package com.wcagdocs.techniques.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * A node of the guidelines document, as supplied by the guideline loader.
 * The hierarchical {@code num} (e.g. 1.2.2) is used only for ordering.
 */
@Value
@Builder
public class Criterion {
    @NonNull
    String id;
    String name;
    String num;
    @NonNull
    CriterionType type;
    @Singular
    Set<WcagVersion> versions;

    public boolean isSuccessCriterion() {
        return type == CriterionType.SUCCESS_CRITERION;
    }

    /**
     * Nodes without explicit versions are treated as applying to every version.
     */
    public boolean appliesTo(WcagVersion version) {
        return versions.isEmpty() || versions.contains(version);
    }
}
