package com.wcagdocs.techniques.parser;

import com.wcagdocs.techniques.model.ReferenceEntry;
import com.wcagdocs.techniques.model.TechniqueEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TechniqueReferenceNormalizer.
 */
class TechniqueReferenceNormalizerTest {

    @ParameterizedTest
    @CsvSource({
            "G90, true",
            "ARIA16, true",
            "SCR20, true",
            "F3, true",
            "g90, false",
            "G, false",
            "90, false",
            "G90a, false",
            "G 90, false",
            "Providing a descriptive label, false"
    })
    void testIsTechniqueId(String value, boolean expected) {
        assertThat(TechniqueReferenceNormalizer.isTechniqueId(value)).isEqualTo(expected);
    }

    @Test
    void testExpandId() {
        ReferenceEntry entry = TechniqueReferenceNormalizer.expand("H37");

        assertThat(entry.getId()).isEqualTo("H37");
        assertThat(entry.getTitle()).isNull();
        assertThat(entry.declaresUsing()).isFalse();
    }

    @Test
    void testExpandTitle() {
        ReferenceEntry entry = TechniqueReferenceNormalizer.expand("Using role=\"marquee\" (future link)");

        assertThat(entry.hasId()).isFalse();
        assertThat(entry.getTitle()).isEqualTo("Using role=\"marquee\" (future link)");
    }

    @Test
    void testGroupIdShorthandIsTitle() {
        ReferenceEntry entry = TechniqueReferenceNormalizer.expand("text-equiv-all-situation-a-shorttext");

        assertThat(entry.hasId()).isFalse();
        assertThat(entry.getTitle()).isEqualTo("text-equiv-all-situation-a-shorttext");
    }

    @Test
    void testNormalizeReturnsObjectsUnchanged() {
        ReferenceEntry entry = ReferenceEntry.builder().id("G87").title("Closed captions").build();

        TechniqueEntry normalized = TechniqueReferenceNormalizer.normalize(entry);

        assertThat(normalized).isSameAs(entry);
    }

    @Test
    void testNormalizeString() {
        assertThat(TechniqueReferenceNormalizer.normalize("G93")).isEqualTo(ReferenceEntry.ofId("G93"));
    }

    @Test
    void testNormalizeRejectsOtherTypes() {
        assertThatThrownBy(() -> TechniqueReferenceNormalizer.normalize(42))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "../Techniques/html/H37.html, H37",
            "../../techniques/general/G94, G94",
            "https://www.w3.org/WAI/WCAG22/Techniques/aria/ARIA6.html, ARIA6",
            "'../Techniques/html/', ''"
    })
    void testResolveTechniqueIdFromHref(String href, String expected) {
        assertThat(TechniqueReferenceNormalizer.resolveTechniqueIdFromHref(href)).isEqualTo(expected);
    }
}
