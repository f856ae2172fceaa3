package com.wcagdocs.techniques.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A titled subgroup within a {@link TechniqueSection}, typically the target of
 * a {@code using} reference such as "text-equiv-all-situation-a-shorttext".
 */
@Value
@Builder
public class TechniqueGroup {
    String id;
    String title;
    @Singular
    List<TechniqueEntry> techniques;
}
