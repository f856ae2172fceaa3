package com.wcagdocs.techniques.model;

/**
 * Relationship a technique has to a success criterion.
 */
public enum AssociationType {
    /**
     * The technique is sufficient to meet the criterion.
     */
    SUFFICIENT("sufficient", "Sufficient"),

    /**
     * The technique optionally improves conformance beyond the criterion.
     */
    ADVISORY("advisory", "Advisory"),

    /**
     * The technique documents a common failure of the criterion.
     */
    FAILURE("failure", "Failure");

    private final String key;
    private final String label;

    AssociationType(String key, String label) {
        this.key = key;
        this.label = label;
    }

    /**
     * Field name used for this type in authored specifications.
     */
    public String getKey() {
        return key;
    }

    /**
     * Capitalized form used in the resolved index.
     */
    public String getLabel() {
        return label;
    }
}
