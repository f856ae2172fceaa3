package com.wcagdocs.techniques.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the hand-authored criterion to technique-specification map, untyped.
 * Validation happens when the specifications are resolved.
 * <p>
 * The file holds either the map itself or an object wrapping it under {@code associatedTechniques}.
 */
public class AssociationSpecificationLoader {
    private static final Logger log = LoggerFactory.getLogger(AssociationSpecificationLoader.class);

    static final String WRAPPER_KEY = "associatedTechniques";

    private final ObjectMapper mapper;

    public AssociationSpecificationLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Map<String, Object> load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> load(InputStream in) throws IOException {
        Map<String, Object> root = mapper.readValue(in, new TypeReference<LinkedHashMap<String, Object>>() { });
        if (root == null) {
            throw new IOException("Technique specifications must be a JSON object");
        }
        Map<String, Object> specifications = root;
        if (root.size() == 1 && root.get(WRAPPER_KEY) instanceof Map<?, ?> wrapped) {
            specifications = (Map<String, Object>) wrapped;
        }
        log.debug("Loaded technique specifications for {} criteria", specifications.size());
        return specifications;
    }
}
