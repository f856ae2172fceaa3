package com.wcagdocs.techniques.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wcagdocs.techniques.model.Technique;
import com.wcagdocs.techniques.model.TechniqueRegistry;
import com.wcagdocs.techniques.model.Technology;
import com.wcagdocs.techniques.model.WcagVersion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TechniqueRegistryLoaderTest {

    private final TechniqueRegistryLoader loader = new TechniqueRegistryLoader(new ObjectMapper());

    @Test
    void testLoadsFixtureRegistry() throws IOException {
        TechniqueRegistry registry;
        try (InputStream in = getClass().getResourceAsStream("/fixtures/techniques.json")) {
            registry = loader.load(in);
        }

        assertThat(registry.contains("H37")).isTrue();
        assertThat(registry.find("H37")).map(Technique::getTechnology).contains(Technology.HTML);
        assertThat(registry.getTechniques(Technology.GENERAL))
                .extracting(Technique::getId)
                .containsExactly("G9", "G87", "G93", "G94", "G143", "G144", "G199", "G202");
        assertThat(registry.findUnknown(List.of("G9X", "G93", "G1"))).containsExactly("G9X", "G1");
        assertThat(registry.findObsolete(List.of("C18", "C31", "G9X"), WcagVersion.WCAG22)).containsExactly("C18");
        assertThat(registry.findObsolete(List.of("C18"), WcagVersion.WCAG21)).isEmpty();
    }

    @Test
    void testReadsObsoleteMetadata(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("techniques.json");
        Files.writeString(file, "{\"flash\": [{\"id\": \"FLASH1\", \"title\": \"Setting the name property\","
                + " \"obsoleteSince\": \"20\", \"obsoleteMessage\": \"Flash is no longer supported.\"}]}");

        Technique flash = loader.load(file).find("FLASH1").orElseThrow();

        assertThat(flash.getObsoleteSince()).isEqualTo(WcagVersion.WCAG20);
        assertThat(flash.getObsoleteMessage()).isEqualTo("Flash is no longer supported.");
        assertThat(flash.isObsoleteIn(WcagVersion.WCAG22)).isTrue();
    }

    @Test
    void testRejectsUnknownTechnology(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("techniques.json");
        Files.writeString(file, "{\"java\": [{\"id\": \"J1\", \"title\": \"Nope\"}]}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid technology name: java");
        assertThat(Technology.fromDirectoryName("client-side-script").getTitle()).isEqualTo("Client-Side Script Techniques");
    }

    @Test
    void testRejectsTechniqueWithoutId(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("techniques.json");
        Files.writeString(file, "{\"html\": [{\"title\": \"Using alt attributes\"}]}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("without id")
                .hasMessageContaining("html");
    }

    @Test
    void testRejectsNullTechniqueList(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("techniques.json");
        Files.writeString(file, "{\"html\": null}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("html");
    }

    @Test
    void testRejectsNullDocument(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("techniques.json");
        Files.writeString(file, "null");

        assertThatThrownBy(() -> loader.load(file)).isInstanceOf(IOException.class);
    }
}
