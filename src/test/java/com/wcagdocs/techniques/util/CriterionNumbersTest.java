package com.wcagdocs.techniques.util;

import com.wcagdocs.techniques.model.Criterion;
import com.wcagdocs.techniques.model.CriterionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CriterionNumbersTest {

    @ParameterizedTest
    @CsvSource({
            "1.9.1, 1.10.1, -1",
            "1.10.1, 1.9.1, 1",
            "1.4.10, 1.4.2, 1",
            "2.4.11, 2.4.11, 0",
            "1.4, 1.4.1, -1",
            "4.1.3, 1.1.1, 1"
    })
    void testCompare(String a, String b, int expectedSign) {
        assertThat(Integer.signum(CriterionNumbers.compare(a, b))).isEqualTo(expectedSign);
    }

    @Test
    void testMissingNumbersSortLast() {
        assertThat(CriterionNumbers.compare(null, "1.1.1")).isPositive();
        assertThat(CriterionNumbers.compare("1.1.1", null)).isNegative();
        assertThat(CriterionNumbers.compare(null, null)).isZero();
    }

    @Test
    void testSortCriteria() {
        List<Criterion> criteria = new ArrayList<>(List.of(sc("reflow", "1.4.10"), sc("captions", "1.2.2"),
                sc("contrast-minimum", "1.4.3"), sc("keyboard", "2.1.1")));

        criteria.sort(CriterionNumbers.BY_NUMBER);

        assertThat(criteria).extracting(Criterion::getNum).containsExactly("1.2.2", "1.4.3", "1.4.10", "2.1.1");
    }

    private static Criterion sc(String id, String num) {
        return Criterion.builder().id(id).num(num).type(CriterionType.SUCCESS_CRITERION).build();
    }
}
