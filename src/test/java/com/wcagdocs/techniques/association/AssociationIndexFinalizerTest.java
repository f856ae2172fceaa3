package com.wcagdocs.techniques.association;

import com.wcagdocs.techniques.model.AssociationType;
import com.wcagdocs.techniques.model.Criterion;
import com.wcagdocs.techniques.model.CriterionType;
import com.wcagdocs.techniques.model.TechniqueAssociation;
import com.wcagdocs.techniques.model.TechniqueAssociationIndex;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AssociationIndexFinalizerTest {

    private final AssociationIndexFinalizer finalizer = new AssociationIndexFinalizer();

    @Test
    void testRemovesStructuralDuplicatesKeepingFirst() {
        Criterion keyboard = sc("keyboard", "2.1.1");
        TechniqueAssociation first = association(keyboard, AssociationType.SUFFICIENT, List.of());
        TechniqueAssociation copy = association(keyboard, AssociationType.SUFFICIENT, List.of());
        TechniqueAssociation withSibling = association(keyboard, AssociationType.SUFFICIENT, List.of("G9"));

        TechniqueAssociationIndex index = finalizer.finalizeIndex(
                Map.of("G93", new ArrayList<>(List.of(first, withSibling, copy))));

        assertThat(index.get("G93")).containsExactly(first, withSibling);
        assertThat(finalizer.getDuplicatesRemoved()).isEqualTo(1);
    }

    @Test
    void testSortsByCriterionNumberStably() {
        Criterion reflow = sc("reflow", "1.4.10");
        Criterion contrast = sc("contrast-minimum", "1.4.3");
        Criterion keyboard = sc("keyboard", "2.1.1");
        TechniqueAssociation keyboardFailure = association(keyboard, AssociationType.FAILURE, List.of());
        TechniqueAssociation reflowSufficient = association(reflow, AssociationType.SUFFICIENT, List.of());
        TechniqueAssociation reflowAdvisory = association(reflow, AssociationType.ADVISORY, List.of());
        TechniqueAssociation contrastAdvisory = association(contrast, AssociationType.ADVISORY, List.of());

        TechniqueAssociationIndex index = finalizer.finalizeIndex(Map.of("C31",
                List.of(keyboardFailure, reflowSufficient, contrastAdvisory, reflowAdvisory)));

        assertThat(index.get("C31")).containsExactly(contrastAdvisory, reflowSufficient, reflowAdvisory, keyboardFailure);
    }

    @Test
    void testKeysAreSortedAndEmptyListsDropped() {
        Criterion keyboard = sc("keyboard", "2.1.1");
        Map<String, List<TechniqueAssociation>> raw = new LinkedHashMap<>();
        raw.put("SCR20", List.of(association(keyboard, AssociationType.SUFFICIENT, List.of())));
        raw.put("G90", List.of());
        raw.put("F54", List.of(association(keyboard, AssociationType.FAILURE, List.of())));

        TechniqueAssociationIndex index = finalizer.finalizeIndex(raw);

        assertThat(index.getTechniqueIds()).containsExactly("F54", "SCR20");
        assertThat(index.contains("G90")).isFalse();
        assertThat(index.getAssociationCount()).isEqualTo(2);
    }

    @Test
    void testCounterResetsBetweenCalls() {
        Criterion keyboard = sc("keyboard", "2.1.1");
        TechniqueAssociation association = association(keyboard, AssociationType.SUFFICIENT, List.of());

        finalizer.finalizeIndex(Map.of("G1", List.of(association, association)));
        assertThat(finalizer.getDuplicatesRemoved()).isEqualTo(1);

        finalizer.finalizeIndex(Map.of("G1", List.of(association)));
        assertThat(finalizer.getDuplicatesRemoved()).isZero();
    }

    private static TechniqueAssociation association(Criterion criterion, AssociationType type, List<String> with) {
        return TechniqueAssociation.builder().criterion(criterion).type(type).with(with).build();
    }

    private static Criterion sc(String id, String num) {
        return Criterion.builder().id(id).num(num).name(id).type(CriterionType.SUCCESS_CRITERION).build();
    }
}
