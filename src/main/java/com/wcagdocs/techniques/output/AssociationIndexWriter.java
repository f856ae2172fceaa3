package com.wcagdocs.techniques.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wcagdocs.techniques.model.Criterion;
import com.wcagdocs.techniques.model.TechniqueAssociation;
import com.wcagdocs.techniques.model.TechniqueAssociationIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes an association index as JSON, technique ids in sorted order:
 * <pre>
 * {"G9": [{"criterion": {"id": "captions-live", "num": "1.2.4", "name": "Captions (Live)"},
 *          "type": "Sufficient", "hasUsageChildren": false, "usageParentIds": [],
 *          "usageParentDescription": "", "with": ["G93"]}]}
 * </pre>
 */
public class AssociationIndexWriter {
    private static final Logger log = LoggerFactory.getLogger(AssociationIndexWriter.class);

    private final ObjectMapper mapper;

    public AssociationIndexWriter(ObjectMapper mapper, boolean prettyPrint) {
        this.mapper = mapper.copy()
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint)
                // the caller owns the stream, e.g. System.out
                .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    public void write(TechniqueAssociationIndex index, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(file)) {
            write(index, out);
        }
        log.info("Wrote {} technique entries to {}", index.size(), file);
    }

    public void write(TechniqueAssociationIndex index, OutputStream out) throws IOException {
        mapper.writeValue(out, toTree(index));
    }

    public String toJson(TechniqueAssociationIndex index) throws JsonProcessingException {
        return mapper.writeValueAsString(toTree(index));
    }

    Map<String, List<Map<String, Object>>> toTree(TechniqueAssociationIndex index) {
        Map<String, List<Map<String, Object>>> tree = new TreeMap<>();
        index.asMap().forEach((techniqueId, associations) -> {
            List<Map<String, Object>> records = new ArrayList<>(associations.size());
            for (TechniqueAssociation association : associations) {
                records.add(toRecord(association));
            }
            tree.put(techniqueId, records);
        });
        return tree;
    }

    private static Map<String, Object> toRecord(TechniqueAssociation association) {
        Criterion criterion = association.getCriterion();
        Map<String, Object> criterionRecord = new LinkedHashMap<>();
        criterionRecord.put("id", criterion.getId());
        criterionRecord.put("num", criterion.getNum());
        criterionRecord.put("name", criterion.getName());

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("criterion", criterionRecord);
        record.put("type", association.getType().getLabel());
        record.put("hasUsageChildren", association.hasUsageChildren());
        record.put("usageParentIds", association.getUsageParentIds());
        record.put("usageParentDescription", association.getUsageParentDescription());
        record.put("with", association.getWith());
        return record;
    }
}
