package com.wcagdocs.techniques.index;

import com.wcagdocs.techniques.model.TechniqueAssociationIndex;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of an index build.
 */
@Data
@Builder
public class IndexResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private TechniqueAssociationIndex index;

    private int criteriaLoaded;
    private int criteriaProcessed;
    private int criteriaSkipped;
    private int techniquesIndexed;
    private int associationsEmitted;
    private int duplicatesRemoved;
    @Builder.Default
    private List<String> unknownTechniqueIds = List.of();
    @Builder.Default
    private List<String> obsoleteTechniqueIds = List.of();

    public static IndexResult failure(String errorMessage) {
        return IndexResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
