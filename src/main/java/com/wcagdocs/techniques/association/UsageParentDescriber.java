package com.wcagdocs.techniques.association;

import com.wcagdocs.techniques.model.ConjunctionEntry;
import com.wcagdocs.techniques.model.ReferenceEntry;
import com.wcagdocs.techniques.model.TechniqueEntry;
import com.wcagdocs.techniques.util.TextUtil;

import java.util.Set;

/**
 * Derives the "when used for ..." qualifier shown for a technique whose usage parent
 * cannot be cited by id.
 */
public class UsageParentDescriber {

    static final String PREFIX = "when used for ";
    static final String COMBINED_FALLBACK = "when combined with other techniques";

    private static final Set<String> SINGULAR_QUANTITIES = Set.of("one", "any");

    /**
     * Returns an empty string when there is no parent or the parent declares no {@code using}.
     */
    public String describe(TechniqueEntry parent) {
        if (parent == null || !parent.declaresUsing()) {
            return "";
        }
        if (isSingular(parent.getUsingQuantity())) {
            if (parent instanceof ReferenceEntry reference && reference.hasTitle()) {
                return PREFIX + TextUtil.lowerFirst(reference.getTitle().trim());
            }
            if (parent instanceof ConjunctionEntry conjunction) {
                String titles = joinMemberTitles(conjunction);
                if (!titles.isEmpty()) {
                    return PREFIX + titles;
                }
            }
        }
        return COMBINED_FALLBACK;
    }

    boolean isSingular(String usingQuantity) {
        return usingQuantity == null || SINGULAR_QUANTITIES.contains(usingQuantity);
    }

    private String joinMemberTitles(ConjunctionEntry conjunction) {
        StringBuilder description = new StringBuilder();
        for (ReferenceEntry member : conjunction.getAnd()) {
            if (!member.hasTitle()) {
                continue;
            }
            if (description.length() > 0) {
                description.append(" and ");
            }
            description.append(TextUtil.lowerFirst(member.getTitle().trim()));
        }
        return description.toString();
    }
}
