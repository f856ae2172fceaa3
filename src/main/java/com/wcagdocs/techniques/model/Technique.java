package com.wcagdocs.techniques.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Registry metadata for one technique page.
 */
@Value
@Builder
public class Technique {
    /** Letter(s)-then-number technique code. */
    @NonNull
    String id;
    @NonNull
    Technology technology;
    String title;
    /** Version as of which the technique is obsolete, if any. */
    WcagVersion obsoleteSince;
    String obsoleteMessage;

    public boolean isObsoleteIn(WcagVersion version) {
        return obsoleteSince != null && obsoleteSince.compareTo(version) <= 0;
    }

    /**
     * Numeric part of the id, used to order techniques within a technology (H2 before H10).
     */
    public int getNumber() {
        String digits = id.replaceAll("\\D", "");
        return digits.isEmpty() ? 0 : Integer.parseInt(digits);
    }
}
