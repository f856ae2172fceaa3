package com.wcagdocs.techniques.util;

import com.wcagdocs.techniques.model.Criterion;

import lombok.experimental.UtilityClass;

import java.util.Comparator;

/**
 * Ordering of hierarchical criterion numbers such as 1.4.10.
 * Segments compare numerically, so 1.10.1 sorts after 1.9.1.
 */
@UtilityClass
public class CriterionNumbers {

    public final Comparator<Criterion> BY_NUMBER = (a, b) -> compare(a.getNum(), b.getNum());

    /**
     * Missing numbers sort last; a number that is a prefix of another sorts first (1.4 before 1.4.1).
     */
    public int compare(String a, String b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        String[] left = a.split("\\.");
        String[] right = b.split("\\.");
        int length = Math.min(left.length, right.length);
        for (int i = 0; i < length; i++) {
            int result = compareSegment(left[i], right[i]);
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(left.length, right.length);
    }

    private int compareSegment(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            return Long.compare(Long.parseLong(a), Long.parseLong(b));
        }
        return a.compareTo(b);
    }

    private boolean isNumeric(String segment) {
        return !segment.isEmpty() && segment.length() < 19 && segment.chars().allMatch(Character::isDigit);
    }
}
