package com.wcagdocs.techniques.association;

import com.wcagdocs.techniques.model.TechniqueAssociationIndex;

import lombok.Builder;
import lombok.Value;

/**
 * Resolved index plus counters describing the run.
 */
@Value
@Builder
public class ResolutionResult {
    TechniqueAssociationIndex index;
    int criteriaProcessed;
    /** Specifications whose criterion is absent from the active version or is not a success criterion. */
    int criteriaSkipped;
    int associationsEmitted;
    int duplicatesRemoved;
}
