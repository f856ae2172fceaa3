package com.wcagdocs.techniques.association;

import com.wcagdocs.techniques.model.TechniqueAssociation;
import com.wcagdocs.techniques.model.TechniqueAssociationIndex;
import com.wcagdocs.techniques.util.CriterionNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Removes structurally identical associations and orders each technique's list by criterion number.
 * Several criteria documents share the same shape, so the same relationship is often declared twice.
 */
public class AssociationIndexFinalizer {
    private static final Logger log = LoggerFactory.getLogger(AssociationIndexFinalizer.class);

    private static final Comparator<TechniqueAssociation> BY_CRITERION =
            Comparator.comparing(TechniqueAssociation::getCriterion, CriterionNumbers.BY_NUMBER);

    private int duplicatesRemoved;

    public TechniqueAssociationIndex finalizeIndex(Map<String, List<TechniqueAssociation>> associations) {
        duplicatesRemoved = 0;
        Map<String, List<TechniqueAssociation>> finalized = new TreeMap<>();

        for (Map.Entry<String, List<TechniqueAssociation>> entry : associations.entrySet()) {
            List<TechniqueAssociation> unique = new ArrayList<>(new LinkedHashSet<>(entry.getValue()));
            int removed = entry.getValue().size() - unique.size();
            if (removed > 0) {
                duplicatesRemoved += removed;
                log.debug("Removed {} duplicate association(s) for {}", removed, entry.getKey());
            }
            if (unique.isEmpty()) {
                continue;
            }
            // List.sort is stable: same-criterion records keep their authored order
            unique.sort(BY_CRITERION);
            finalized.put(entry.getKey(), unique);
        }

        return new TechniqueAssociationIndex(finalized);
    }

    /**
     * Duplicates dropped by the last {@link #finalizeIndex} call.
     */
    public int getDuplicatesRemoved() {
        return duplicatesRemoved;
    }
}
