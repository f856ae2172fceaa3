package com.wcagdocs.techniques.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wcagdocs.techniques.association.ResolutionResult;
import com.wcagdocs.techniques.association.TechniqueAssociationResolver;
import com.wcagdocs.techniques.loader.AssociationSpecificationLoader;
import com.wcagdocs.techniques.loader.GuidelinesLoader;
import com.wcagdocs.techniques.loader.TechniqueRegistryLoader;
import com.wcagdocs.techniques.model.Criterion;
import com.wcagdocs.techniques.model.TechniqueAssociationIndex;
import com.wcagdocs.techniques.model.TechniqueRegistry;
import com.wcagdocs.techniques.output.AssociationIndexWriter;
import com.wcagdocs.techniques.parser.AssociationSchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * Builds the technique association index for one guideline version:
 * loads the inputs, resolves the associations, checks them against the
 * technique registry and writes the result.
 */
public class TechniqueIndexGenerator {
    private static final Logger log = LoggerFactory.getLogger(TechniqueIndexGenerator.class);

    private final IndexerConfig config;
    private final ObjectMapper mapper;
    private final OutputStream standardOut;
    private final TechniqueAssociationResolver resolver;

    public TechniqueIndexGenerator(IndexerConfig config) {
        this(config, new ObjectMapper(), System.out);
    }

    public TechniqueIndexGenerator(IndexerConfig config, ObjectMapper mapper, OutputStream standardOut) {
        this.config = config;
        this.mapper = mapper;
        this.standardOut = standardOut;
        this.resolver = new TechniqueAssociationResolver();
    }

    public IndexResult generate() {
        try {
            log.info("Step 1: Loading WCAG {} guidelines...", config.getWcagVersion().getDisplayName());
            Map<String, Criterion> criteria =
                    new GuidelinesLoader(mapper).load(config.getGuidelinesFile(), config.getWcagVersion());

            log.info("Step 2: Loading technique specifications...");
            Map<String, Object> specifications =
                    new AssociationSpecificationLoader(mapper).load(config.getAssociationsFile());

            log.info("Step 3: Resolving technique associations...");
            ResolutionResult resolution = resolver.validateAndResolve(specifications, criteria);
            TechniqueAssociationIndex index = resolution.getIndex();

            List<String> unknownIds = List.of();
            List<String> obsoleteIds = List.of();
            if (config.getTechniquesFile() != null) {
                log.info("Step 4: Checking technique ids against the registry...");
                TechniqueRegistry registry = new TechniqueRegistryLoader(mapper).load(config.getTechniquesFile());
                unknownIds = registry.findUnknown(index.getTechniqueIds());
                if (!unknownIds.isEmpty()) {
                    if (config.isStrictTechniques()) {
                        return IndexResult.failure("Associations reference unknown techniques: " + unknownIds);
                    }
                    log.warn("Associations reference {} technique(s) missing from the registry: {}",
                            unknownIds.size(), unknownIds);
                }
                obsoleteIds = registry.findObsolete(index.getTechniqueIds(), config.getWcagVersion());
                if (!obsoleteIds.isEmpty()) {
                    log.warn("Associations reference {} technique(s) obsolete in WCAG {}: {}",
                            obsoleteIds.size(), config.getWcagVersion().getDisplayName(), obsoleteIds);
                }
            }

            log.info("Step 5: Writing association index...");
            AssociationIndexWriter writer = new AssociationIndexWriter(mapper, config.isPrettyPrint());
            if (config.getOutputFile() != null) {
                writer.write(index, config.getOutputFile());
            } else {
                writer.write(index, standardOut);
                standardOut.flush();
            }

            return IndexResult.builder()
                    .success(true)
                    .outputPath(config.getOutputFile())
                    .index(index)
                    .criteriaLoaded(criteria.size())
                    .criteriaProcessed(resolution.getCriteriaProcessed())
                    .criteriaSkipped(resolution.getCriteriaSkipped())
                    .techniquesIndexed(index.size())
                    .associationsEmitted(resolution.getAssociationsEmitted())
                    .duplicatesRemoved(resolution.getDuplicatesRemoved())
                    .unknownTechniqueIds(unknownIds)
                    .obsoleteTechniqueIds(obsoleteIds)
                    .build();

        } catch (AssociationSchemaException e) {
            log.error("Invalid technique specification for {} at {}", e.getCriterionId(), e.getPath());
            return IndexResult.failure(e.getMessage());
        } catch (IOException | IllegalArgumentException e) {
            log.error("Index build failed", e);
            return IndexResult.failure(e.getMessage());
        }
    }
}
