package com.wcagdocs.techniques.index;

import com.wcagdocs.techniques.model.WcagVersion;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Configuration for one index build.
 */
@Value
@Builder
public class IndexerConfig {

    /**
     * Flattened guidelines document (principles, guidelines and success criteria).
     */
    @NonNull
    Path guidelinesFile;

    /**
     * Per-criterion technique specifications.
     */
    @NonNull
    Path associationsFile;

    /**
     * Optional technique registry, used to report ids that have no technique page.
     */
    Path techniquesFile;

    /**
     * Guideline version the build targets.
     */
    @NonNull
    @Builder.Default
    WcagVersion wcagVersion = WcagVersion.WCAG22;

    /**
     * Destination of the index JSON; standard output when absent.
     */
    Path outputFile;

    /**
     * Fail instead of warn when the index references techniques missing from the registry.
     */
    boolean strictTechniques;

    @Builder.Default
    boolean prettyPrint = true;
}
