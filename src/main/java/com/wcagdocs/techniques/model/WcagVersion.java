package com.wcagdocs.techniques.model;

/**
 * Published guideline versions a build can target.
 */
public enum WcagVersion {
    WCAG20("20", "2.0"),
    WCAG21("21", "2.1"),
    WCAG22("22", "2.2");

    private final String code;
    private final String displayName;

    WcagVersion(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Accepts the two-digit form ("22"), the dotted form ("2.2") or the constant name ("WCAG22").
     */
    public static WcagVersion fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("WCAG version is required");
        }
        String normalized = value.trim();
        for (WcagVersion version : values()) {
            if (version.code.equals(normalized)
                    || version.displayName.equals(normalized)
                    || version.name().equalsIgnoreCase(normalized)) {
                return version;
            }
        }
        throw new IllegalArgumentException("Invalid WCAG version: " + value);
    }
}
