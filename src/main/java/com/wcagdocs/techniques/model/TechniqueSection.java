package com.wcagdocs.techniques.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Presentation grouping ("Situation A", "Situation B"...) of a criterion's sufficient techniques.
 * Section and group titles are not carried into the association index.
 */
@Value
@Builder
public class TechniqueSection {
    String id;
    String title;
    @Singular
    List<TechniqueEntry> techniques;
    @Singular
    List<TechniqueGroup> groups;
    String note;
}
