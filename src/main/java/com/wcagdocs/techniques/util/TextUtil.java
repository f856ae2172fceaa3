package com.wcagdocs.techniques.util;

import lombok.experimental.UtilityClass;

@UtilityClass
public class TextUtil {

    /**
     * Lowercases only the first character: "Providing keyboard control" becomes "providing keyboard control".
     */
    public String lowerFirst(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }
}
