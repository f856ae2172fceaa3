package com.wcagdocs.techniques.parser;

/**
 * Raised when a criterion's technique specification does not match the association grammar.
 * Carries enough context for an author to find the offending entry.
 */
public class AssociationSchemaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String criterionId;
    private final String path;
    private final transient Object offendingValue;

    public AssociationSchemaException(String criterionId, String path, Object offendingValue, String problem) {
        super("Invalid technique associations for criterion '" + criterionId + "' at " + path
                + ": " + problem + " (found: " + offendingValue + ")");
        this.criterionId = criterionId;
        this.path = path;
        this.offendingValue = offendingValue;
    }

    public String getCriterionId() {
        return criterionId;
    }

    /**
     * Location of the offending entry, e.g. {@code /sufficient/2/using/0}.
     */
    public String getPath() {
        return path;
    }

    public Object getOffendingValue() {
        return offendingValue;
    }
}
