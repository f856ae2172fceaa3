package com.wcagdocs.techniques.parser;

import com.wcagdocs.techniques.model.ReferenceEntry;
import com.wcagdocs.techniques.model.TechniqueEntry;

import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

/**
 * Expands shorthand technique references.
 * <p>
 * A bare string made of uppercase letters followed by digits ("G90", "ARIA16") is a
 * technique id; any other string is a display title for a technique without a page.
 */
@UtilityClass
public class TechniqueReferenceNormalizer {

    private final Pattern TECHNIQUE_ID = Pattern.compile("^[A-Z]+\\d+$");

    public boolean isTechniqueId(String value) {
        return value != null && TECHNIQUE_ID.matcher(value).matches();
    }

    public ReferenceEntry expand(String idOrTitle) {
        if (isTechniqueId(idOrTitle)) {
            return ReferenceEntry.ofId(idOrTitle);
        }
        return ReferenceEntry.ofTitle(idOrTitle);
    }

    /**
     * Strings are expanded; entries that are already objects are returned unchanged.
     */
    public TechniqueEntry normalize(Object entry) {
        if (entry instanceof String shorthand) {
            return expand(shorthand);
        }
        if (entry instanceof TechniqueEntry expanded) {
            return expanded;
        }
        throw new IllegalArgumentException("Not a technique reference: " + entry);
    }

    /**
     * Pulls the technique id out of a link such as "../Techniques/html/H37.html".
     * Directory links yield an empty string.
     */
    public String resolveTechniqueIdFromHref(String href) {
        return href.replaceAll("^.*/", "").replaceAll("\\.html$", "");
    }
}
