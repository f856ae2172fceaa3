package com.wcagdocs.techniques.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wcagdocs.techniques.model.Technique;
import com.wcagdocs.techniques.model.TechniqueRegistry;
import com.wcagdocs.techniques.model.Technology;
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
 * Reads the technique registry: {@code {"html": [{"id": "H37", "title": "..."}], ...}}.
 * Keys are technology directory names.
 */
public class TechniqueRegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(TechniqueRegistryLoader.class);

    private final ObjectMapper mapper;

    public TechniqueRegistryLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public TechniqueRegistry load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public TechniqueRegistry load(InputStream in) throws IOException {
        Map<String, List<TechniqueRecord>> raw =
                mapper.readValue(in, new TypeReference<LinkedHashMap<String, List<TechniqueRecord>>>() { });
        if (raw == null) {
            throw new IOException("Technique registry must be a JSON object");
        }
        List<Technique> techniques = new ArrayList<>();

        raw.forEach((technologyName, records) -> {
            Technology technology = Technology.fromDirectoryName(technologyName);
            if (records == null) {
                throw new IllegalArgumentException("Technique list for " + technologyName + " is null");
            }
            for (TechniqueRecord record : records) {
                if (record == null) {
                    throw new IllegalArgumentException("Null technique entry under " + technologyName);
                }
                techniques.add(record.toTechnique(technology));
            }
        });

        TechniqueRegistry registry = new TechniqueRegistry(techniques);
        log.debug("Loaded {} techniques across {} technologies", registry.size(), raw.size());
        return registry;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TechniqueRecord {
        private String id;
        private String title;
        private String obsoleteSince;
        private String obsoleteMessage;

        Technique toTechnique(Technology technology) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Technique without id under " + technology.getDirectoryName()
                        + " (title " + title + ")");
            }
            return Technique.builder()
                    .id(id)
                    .technology(technology)
                    .title(title)
                    .obsoleteSince(obsoleteSince != null ? WcagVersion.fromString(obsoleteSince) : null)
                    .obsoleteMessage(obsoleteMessage)
                    .build();
        }
    }
}
