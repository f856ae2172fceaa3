package com.wcagdocs.techniques.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wcagdocs.techniques.model.Criterion;
import com.wcagdocs.techniques.model.CriterionType;
import com.wcagdocs.techniques.model.WcagVersion;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the flattened guidelines document and keeps the nodes that apply to one version.
 * <p>
 * Expected JSON: {@code [{"id": "captions", "num": "1.2.2", "type": "SC", "name": "Captions", "versions": ["20", "21", "22"]}]}.
 * Principle and guideline nodes are kept so callers can tell them apart from success criteria.
 */
public class GuidelinesLoader {
    private static final Logger log = LoggerFactory.getLogger(GuidelinesLoader.class);

    private final ObjectMapper mapper;

    public GuidelinesLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, Criterion> load(Path file, WcagVersion version) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, version);
        }
    }

    public Map<String, Criterion> load(InputStream in, WcagVersion version) throws IOException {
        List<GuidelineNode> nodes = mapper.readValue(in, new TypeReference<List<GuidelineNode>>() { });
        if (nodes == null) {
            throw new IOException("Guidelines document must be a JSON array");
        }
        Map<String, Criterion> criteria = new LinkedHashMap<>();
        int excluded = 0;

        for (GuidelineNode node : nodes) {
            if (node == null) {
                throw new IllegalArgumentException("Null guideline node");
            }
            Criterion criterion = node.toCriterion();
            if (!criterion.appliesTo(version)) {
                excluded++;
                continue;
            }
            if (criteria.put(criterion.getId(), criterion) != null) {
                throw new IOException("Duplicate guideline node id: " + criterion.getId());
            }
        }

        log.debug("Loaded {} guideline nodes for WCAG {} ({} belong to other versions)",
                criteria.size(), version.getDisplayName(), excluded);
        return criteria;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GuidelineNode {
        private String id;
        private String num;
        private String name;
        private String type;
        private List<String> versions = new ArrayList<>();

        Criterion toCriterion() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Guideline node without id (num " + num + ")");
            }
            Criterion.CriterionBuilder builder = Criterion.builder()
                    .id(id)
                    .num(num)
                    .name(name)
                    .type(CriterionType.fromCode(type));
            if (versions != null) {
                versions.forEach(v -> builder.version(WcagVersion.fromString(v)));
            }
            return builder.build();
        }
    }
}
