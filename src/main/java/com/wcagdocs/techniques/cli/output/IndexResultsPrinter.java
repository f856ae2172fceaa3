package com.wcagdocs.techniques.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wcagdocs.techniques.index.IndexResult;
import com.wcagdocs.techniques.index.IndexerConfig;

/**
 * Responsible only for printing CLI output for the "index" command.
 * The index itself goes to the output file or standard output; this logs around it.
 */
public class IndexResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(IndexResultsPrinter.class);

    public void printBanner(IndexerConfig config) {
        log.info("=================================================");
        log.info("Technique Association Indexer");
        log.info("=================================================");
        log.info("WCAG Version: {}", config.getWcagVersion().getDisplayName());
        log.info("Guidelines: {}", config.getGuidelinesFile().toAbsolutePath());
        log.info("Associations: {}", config.getAssociationsFile().toAbsolutePath());
        log.info("Technique Registry: {}",
                config.getTechniquesFile() != null ? config.getTechniquesFile().toAbsolutePath() : "None");
        log.info("Output: {}", config.getOutputFile() != null ? config.getOutputFile() : "standard output");
        log.info("=================================================");
    }

    public void printSuccess(IndexResult result) {
        log.info("");
        log.info("=================================================");
        log.info("INDEX BUILT");
        log.info("=================================================");
        log.info("Guideline Nodes Loaded: {}", result.getCriteriaLoaded());
        log.info("Criteria Processed: {}", result.getCriteriaProcessed());
        log.info("Criteria Skipped (other version or not an SC): {}", result.getCriteriaSkipped());
        log.info("Techniques Indexed: {}", result.getTechniquesIndexed());
        log.info("Associations: {} ({} duplicates removed)",
                result.getAssociationsEmitted() - result.getDuplicatesRemoved(), result.getDuplicatesRemoved());
        if (!result.getUnknownTechniqueIds().isEmpty()) {
            log.info("Unregistered Technique Ids: {}", result.getUnknownTechniqueIds());
        }
        if (!result.getObsoleteTechniqueIds().isEmpty()) {
            log.info("Obsolete Technique Ids: {}", result.getObsoleteTechniqueIds());
        }
        log.info("=================================================");
    }

    public void printFailure(IndexResult result) {
        log.error("Index build failed: {}", result.getErrorMessage());
    }
}
