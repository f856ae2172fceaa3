package com.wcagdocs.techniques.association;

import com.wcagdocs.techniques.model.AssociationType;
import com.wcagdocs.techniques.model.ConjunctionEntry;
import com.wcagdocs.techniques.model.Criterion;
import com.wcagdocs.techniques.model.CriterionTechniques;
import com.wcagdocs.techniques.model.ReferenceEntry;
import com.wcagdocs.techniques.model.TechniqueAssociation;
import com.wcagdocs.techniques.model.TechniqueAssociationIndex;
import com.wcagdocs.techniques.model.TechniqueEntry;
import com.wcagdocs.techniques.parser.AssociationSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inverts per-criterion technique specifications into a per-technique index.
 * <p>
 * Each specification is walked depth-first. Every technique id encountered yields
 * one {@link TechniqueAssociation} recording the criterion, the association type,
 * the usage parent (by id, or by description when it has none) and any conjunction
 * siblings. Title-only entries emit nothing but their {@code using} children are still visited.
 * <p>
 * Specifications of criteria missing from the supplied criteria map, or whose node is not
 * a success criterion, are skipped: they belong to another guideline version or level.
 * Each call builds an independent index; the resolver keeps no state between calls.
 */
public class TechniqueAssociationResolver {
    private static final Logger log = LoggerFactory.getLogger(TechniqueAssociationResolver.class);

    private final AssociationSchemaValidator validator;
    private final UsageParentDescriber describer;

    public TechniqueAssociationResolver() {
        this(new AssociationSchemaValidator(), new UsageParentDescriber());
    }

    public TechniqueAssociationResolver(AssociationSchemaValidator validator, UsageParentDescriber describer) {
        this.validator = validator;
        this.describer = describer;
    }

    public TechniqueAssociationIndex resolve(Map<String, CriterionTechniques> specifications,
                                             Map<String, Criterion> criteria) {
        return resolveWithStats(specifications, criteria).getIndex();
    }

    public ResolutionResult resolveWithStats(Map<String, CriterionTechniques> specifications,
                                             Map<String, Criterion> criteria) {
        return run(specifications, criteria, (id, spec) -> spec);
    }

    /**
     * Validates and resolves raw specifications. Only the specifications of criteria that
     * are processed are validated; an {@link com.wcagdocs.techniques.parser.AssociationSchemaException}
     * aborts the whole resolution.
     */
    public ResolutionResult validateAndResolve(Map<String, ?> rawSpecifications, Map<String, Criterion> criteria) {
        return run(rawSpecifications, criteria, validator::validate);
    }

    private <S> ResolutionResult run(Map<String, S> specifications, Map<String, Criterion> criteria,
                                     SpecificationReader<S> reader) {
        Map<String, List<TechniqueAssociation>> associations = new LinkedHashMap<>();
        int processed = 0;
        int skipped = 0;

        for (Map.Entry<String, S> entry : specifications.entrySet()) {
            Criterion criterion = criteria.get(entry.getKey());
            if (criterion == null || !criterion.isSuccessCriterion()) {
                log.debug("Skipping {}: not a success criterion of the active version", entry.getKey());
                skipped++;
                continue;
            }
            CriterionTechniques specification = reader.read(entry.getKey(), entry.getValue());
            for (AssociationType type : AssociationType.values()) {
                for (List<TechniqueEntry> entries : specification.entryListsFor(type)) {
                    traverse(entries, criterion, type, null, associations);
                }
            }
            processed++;
        }

        int emitted = associations.values().stream().mapToInt(List::size).sum();
        AssociationIndexFinalizer finalizer = new AssociationIndexFinalizer();
        TechniqueAssociationIndex index = finalizer.finalizeIndex(associations);
        log.debug("Resolved {} criteria into {} techniques ({} skipped)", processed, index.size(), skipped);

        return ResolutionResult.builder()
                .index(index)
                .criteriaProcessed(processed)
                .criteriaSkipped(skipped)
                .associationsEmitted(emitted)
                .duplicatesRemoved(finalizer.getDuplicatesRemoved())
                .build();
    }

    private void traverse(List<TechniqueEntry> entries, Criterion criterion, AssociationType type,
                          TechniqueEntry parent, Map<String, List<TechniqueAssociation>> associations) {
        List<String> usageParentIds = parent != null ? parent.getTechniqueIds() : List.of();
        String usageParentDescription = usageParentIds.isEmpty() ? describer.describe(parent) : "";

        for (TechniqueEntry entry : entries) {
            if (entry instanceof ConjunctionEntry conjunction) {
                for (ReferenceEntry member : conjunction.getAnd()) {
                    if (!member.hasId()) {
                        continue;
                    }
                    add(associations, member.getId(), TechniqueAssociation.builder()
                            .criterion(criterion)
                            .type(type)
                            .hasUsageChildren(conjunction.declaresUsing())
                            .usageParentIds(usageParentIds)
                            .usageParentDescription(usageParentDescription)
                            .with(conjunction.getSiblingIds(member.getId()))
                            .build());
                }
            } else if (entry instanceof ReferenceEntry reference && reference.hasId()) {
                add(associations, reference.getId(), TechniqueAssociation.builder()
                        .criterion(criterion)
                        .type(type)
                        .hasUsageChildren(reference.declaresUsing())
                        .usageParentIds(usageParentIds)
                        .usageParentDescription(usageParentDescription)
                        .with(List.of())
                        .build());
            }

            if (entry.declaresUsing()) {
                traverse(entry.getUsing(), criterion, type, entry, associations);
            }
        }
    }

    private static void add(Map<String, List<TechniqueAssociation>> associations, String techniqueId,
                            TechniqueAssociation association) {
        associations.computeIfAbsent(techniqueId, id -> new ArrayList<>()).add(association);
    }

    @FunctionalInterface
    private interface SpecificationReader<S> {
        CriterionTechniques read(String criterionId, S specification);
    }
}
