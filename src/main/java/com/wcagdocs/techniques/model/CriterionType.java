package com.wcagdocs.techniques.model;

/**
 * Kinds of node found in a guidelines document.
 * Only {@link #SUCCESS_CRITERION} nodes take part in technique associations.
 */
public enum CriterionType {
    PRINCIPLE("principle"),
    GUIDELINE("guideline"),
    SUCCESS_CRITERION("SC");

    private final String code;

    CriterionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static CriterionType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Guideline node type is required");
        }
        for (CriterionType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown guideline node type: " + code);
    }
}
