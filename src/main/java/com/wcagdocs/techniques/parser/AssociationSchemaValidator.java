package com.wcagdocs.techniques.parser;

import com.wcagdocs.techniques.model.AssociationType;
import com.wcagdocs.techniques.model.ConjunctionEntry;
import com.wcagdocs.techniques.model.CriterionTechniques;
import com.wcagdocs.techniques.model.ReferenceEntry;
import com.wcagdocs.techniques.model.TechniqueEntry;
import com.wcagdocs.techniques.model.TechniqueGroup;
import com.wcagdocs.techniques.model.TechniqueSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Validates untyped technique specifications (nested maps, lists and strings, as
 * produced by a JSON reader) and converts them into typed entries.
 * <p>
 * Grammar of a technique list element:
 * <ul>
 *   <li>a string: a technique id or a title (see {@link TechniqueReferenceNormalizer})</li>
 *   <li>{@code {id?, title?}} plus the optional {@code using} qualifiers</li>
 *   <li>{@code {and: [string | {id?, title?}], andConjunction?}} plus the optional {@code using} qualifiers</li>
 * </ul>
 * {@code using} is itself a technique list, nested to any depth. The sufficient list may
 * instead be a list of sections {@code {id?, title?, techniques, groups?, note?}}, detected
 * by a {@code techniques} field on its first element. Unrecognized fields are rejected.
 */
public class AssociationSchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(AssociationSchemaValidator.class);

    private static final Set<String> SPECIFICATION_KEYS = union(Set.of("sufficientIntro", "sufficientNote"),
            Arrays.stream(AssociationType.values()).map(AssociationType::getKey).collect(Collectors.toSet()));
    private static final Set<String> SIMPLE_KEYS = Set.of("id", "title");
    private static final Set<String> USING_KEYS =
            Set.of("using", "skipUsingText", "usingConjunction", "usingPrefix", "usingQuantity");
    private static final Set<String> ENTRY_KEYS = union(SIMPLE_KEYS, USING_KEYS);
    private static final Set<String> CONJUNCTION_KEYS = union(Set.of("and", "andConjunction"), USING_KEYS);
    private static final Set<String> SECTION_KEYS = Set.of("id", "title", "techniques", "groups", "note");
    private static final Set<String> GROUP_KEYS = Set.of("id", "title", "techniques");

    /**
     * Validates every criterion of a specification map, failing on the first invalid one.
     */
    public Map<String, CriterionTechniques> validateAll(Map<String, ?> rawSpecifications) {
        Map<String, CriterionTechniques> result = new LinkedHashMap<>();
        rawSpecifications.forEach((criterionId, raw) -> result.put(criterionId, validate(criterionId, raw)));
        return result;
    }

    public CriterionTechniques validate(String criterionId, Object raw) {
        Map<String, Object> spec = requireMap(criterionId, raw, "");
        checkKeys(criterionId, spec, SPECIFICATION_KEYS, "");

        CriterionTechniques.CriterionTechniquesBuilder builder = CriterionTechniques.builder()
                .sufficientIntro(optionalString(criterionId, spec, "sufficientIntro", ""))
                .sufficientNote(optionalString(criterionId, spec, "sufficientNote", ""));

        for (AssociationType type : AssociationType.values()) {
            if (!spec.containsKey(type.getKey())) {
                continue;
            }
            Object list = spec.get(type.getKey());
            String path = "/" + type.getKey();
            switch (type) {
                case SUFFICIENT -> {
                    if (isSectionList(list)) {
                        builder.sufficientSections(parseSections(criterionId, (List<?>) list, path));
                    } else {
                        builder.sufficient(parseEntryList(criterionId, list, path));
                    }
                }
                case ADVISORY -> builder.advisory(parseEntryList(criterionId, list, path));
                case FAILURE -> builder.failure(parseEntryList(criterionId, list, path));
            }
        }

        log.debug("Validated technique associations for {}", criterionId);
        return builder.build();
    }

    private static boolean isSectionList(Object raw) {
        return raw instanceof List<?> list
                && !list.isEmpty()
                && list.get(0) instanceof Map<?, ?> first
                && first.containsKey("techniques");
    }

    private List<TechniqueSection> parseSections(String criterionId, List<?> rawSections, String path) {
        List<TechniqueSection> sections = new ArrayList<>();
        for (int i = 0; i < rawSections.size(); i++) {
            String sectionPath = path + "/" + i;
            Map<String, Object> section = requireMap(criterionId, rawSections.get(i), sectionPath);
            checkKeys(criterionId, section, SECTION_KEYS, sectionPath);
            if (!section.containsKey("techniques")) {
                throw new AssociationSchemaException(criterionId, sectionPath, section,
                        "section is missing 'techniques'");
            }

            TechniqueSection.TechniqueSectionBuilder builder = TechniqueSection.builder()
                    .id(optionalString(criterionId, section, "id", sectionPath))
                    .title(optionalString(criterionId, section, "title", sectionPath))
                    .note(optionalString(criterionId, section, "note", sectionPath))
                    .techniques(parseEntryList(criterionId, section.get("techniques"), sectionPath + "/techniques"));

            if (section.containsKey("groups")) {
                List<?> groups = requireList(criterionId, section.get("groups"), sectionPath + "/groups");
                for (int g = 0; g < groups.size(); g++) {
                    builder.group(parseGroup(criterionId, groups.get(g), sectionPath + "/groups/" + g));
                }
            }
            sections.add(builder.build());
        }
        return sections;
    }

    private TechniqueGroup parseGroup(String criterionId, Object raw, String path) {
        Map<String, Object> group = requireMap(criterionId, raw, path);
        checkKeys(criterionId, group, GROUP_KEYS, path);
        if (!group.containsKey("techniques")) {
            throw new AssociationSchemaException(criterionId, path, group, "group is missing 'techniques'");
        }
        return TechniqueGroup.builder()
                .id(optionalString(criterionId, group, "id", path))
                .title(optionalString(criterionId, group, "title", path))
                .techniques(parseEntryList(criterionId, group.get("techniques"), path + "/techniques"))
                .build();
    }

    private List<TechniqueEntry> parseEntryList(String criterionId, Object raw, String path) {
        List<?> list = requireList(criterionId, raw, path);
        List<TechniqueEntry> entries = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            entries.add(parseEntry(criterionId, list.get(i), path + "/" + i));
        }
        return entries;
    }

    private TechniqueEntry parseEntry(String criterionId, Object raw, String path) {
        if (raw instanceof String shorthand) {
            return TechniqueReferenceNormalizer.expand(shorthand);
        }
        if (raw instanceof Map<?, ?>) {
            Map<String, Object> entry = requireMap(criterionId, raw, path);
            return entry.containsKey("and")
                    ? parseConjunction(criterionId, entry, path)
                    : parseReference(criterionId, entry, path);
        }
        throw new AssociationSchemaException(criterionId, path, raw,
                "expected a technique id, a title or a technique object");
    }

    private ReferenceEntry parseReference(String criterionId, Map<String, Object> entry, String path) {
        checkKeys(criterionId, entry, ENTRY_KEYS, path);
        return ReferenceEntry.builder()
                .id(optionalString(criterionId, entry, "id", path))
                .title(optionalString(criterionId, entry, "title", path))
                .using(optionalUsing(criterionId, entry, path))
                .skipUsingText(optionalBoolean(criterionId, entry, "skipUsingText", path))
                .usingConjunction(optionalString(criterionId, entry, "usingConjunction", path))
                .usingPrefix(optionalString(criterionId, entry, "usingPrefix", path))
                .usingQuantity(optionalString(criterionId, entry, "usingQuantity", path))
                .build();
    }

    private ConjunctionEntry parseConjunction(String criterionId, Map<String, Object> entry, String path) {
        if (entry.containsKey("id")) {
            throw new AssociationSchemaException(criterionId, path, entry, "'and' cannot be combined with 'id'");
        }
        checkKeys(criterionId, entry, CONJUNCTION_KEYS, path);

        List<?> rawMembers = requireList(criterionId, entry.get("and"), path + "/and");
        List<ReferenceEntry> members = new ArrayList<>(rawMembers.size());
        for (int i = 0; i < rawMembers.size(); i++) {
            members.add(parseConjunctionMember(criterionId, rawMembers.get(i), path + "/and/" + i));
        }

        return ConjunctionEntry.builder()
                .and(members)
                .andConjunction(optionalString(criterionId, entry, "andConjunction", path))
                .using(optionalUsing(criterionId, entry, path))
                .skipUsingText(optionalBoolean(criterionId, entry, "skipUsingText", path))
                .usingConjunction(optionalString(criterionId, entry, "usingConjunction", path))
                .usingPrefix(optionalString(criterionId, entry, "usingPrefix", path))
                .usingQuantity(optionalString(criterionId, entry, "usingQuantity", path))
                .build();
    }

    private ReferenceEntry parseConjunctionMember(String criterionId, Object raw, String path) {
        if (raw instanceof String shorthand) {
            return TechniqueReferenceNormalizer.expand(shorthand);
        }
        Map<String, Object> member = requireMap(criterionId, raw, path);
        checkKeys(criterionId, member, SIMPLE_KEYS, path);
        return ReferenceEntry.builder()
                .id(optionalString(criterionId, member, "id", path))
                .title(optionalString(criterionId, member, "title", path))
                .build();
    }

    private List<TechniqueEntry> optionalUsing(String criterionId, Map<String, Object> entry, String path) {
        if (!entry.containsKey("using")) {
            return null;
        }
        return parseEntryList(criterionId, entry.get("using"), path + "/using");
    }

    private static String optionalString(String criterionId, Map<String, Object> map, String key, String path) {
        if (!map.containsKey(key)) {
            return null;
        }
        Object value = map.get(key);
        if (value instanceof String text) {
            return text;
        }
        throw new AssociationSchemaException(criterionId, path + "/" + key, value, "expected a string");
    }

    private static Boolean optionalBoolean(String criterionId, Map<String, Object> map, String key, String path) {
        if (!map.containsKey(key)) {
            return null;
        }
        Object value = map.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw new AssociationSchemaException(criterionId, path + "/" + key, value, "expected a boolean");
    }

    private static List<?> requireList(String criterionId, Object raw, String path) {
        if (raw instanceof List<?> list) {
            return list;
        }
        throw new AssociationSchemaException(criterionId, path.isEmpty() ? "/" : path, raw, "expected a list");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireMap(String criterionId, Object raw, String path) {
        if (raw instanceof Map<?, ?> map) {
            for (Object key : map.keySet()) {
                if (!(key instanceof String)) {
                    throw new AssociationSchemaException(criterionId, path.isEmpty() ? "/" : path, raw,
                            "field names must be strings");
                }
            }
            return (Map<String, Object>) map;
        }
        throw new AssociationSchemaException(criterionId, path.isEmpty() ? "/" : path, raw, "expected an object");
    }

    private static void checkKeys(String criterionId, Map<String, Object> map, Set<String> allowed, String path) {
        Set<String> unrecognized = new TreeSet<>(map.keySet());
        unrecognized.removeAll(allowed);
        if (!unrecognized.isEmpty()) {
            throw new AssociationSchemaException(criterionId, path.isEmpty() ? "/" : path, map,
                    "unrecognized field(s) " + unrecognized);
        }
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
