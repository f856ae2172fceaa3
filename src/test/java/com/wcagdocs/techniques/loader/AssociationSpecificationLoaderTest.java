package com.wcagdocs.techniques.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AssociationSpecificationLoaderTest {

    private final AssociationSpecificationLoader loader = new AssociationSpecificationLoader(new ObjectMapper());

    @Test
    void testUnwrapsAssociatedTechniques() throws IOException {
        Map<String, Object> specifications;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/associations.json")) {
            specifications = loader.load(in);
        }

        assertThat(specifications).doesNotContainKey(AssociationSpecificationLoader.WRAPPER_KEY);
        assertThat(specifications.keySet()).startsWith("non-text-content", "captions-prerecorded", "captions-live");
        assertThat(specifications.get("reflow")).isEqualTo(Map.of(
                "sufficient", List.of("C32", "C31"),
                "failure", List.of("F102")));
    }

    @Test
    void testReadsBareMap(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("associations.json");
        Files.writeString(file, "{\"keyboard\": {\"sufficient\": [\"G202\"]}, \"reflow\": {\"sufficient\": [\"C32\"]}}");

        Map<String, Object> specifications = loader.load(file);

        assertThat(specifications).containsOnlyKeys("keyboard", "reflow");
        assertThat(specifications.get("keyboard")).isEqualTo(Map.of("sufficient", List.of("G202")));
    }

    @Test
    void testMalformedJsonFails(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("associations.json");
        Files.writeString(file, "{\"keyboard\": {\"sufficient\": [\"G202\"");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(IOException.class);
    }

    @Test
    void testRejectsNullDocument(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("associations.json");
        Files.writeString(file, "null");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("JSON object");
    }
}
