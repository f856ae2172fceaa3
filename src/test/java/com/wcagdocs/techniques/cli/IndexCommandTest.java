package com.wcagdocs.techniques.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class IndexCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testSuccessfulRun() throws IOException {
        Path output = tempDir.resolve("techniques-associations.json");

        int exitCode = new CommandLine(new IndexCommand()).execute(
                "-g", copyFixture("guidelines.json").toString(),
                "-a", copyFixture("associations.json").toString(),
                "-t", copyFixture("techniques.json").toString(),
                "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(new ObjectMapper().readTree(output.toFile()).has("G202")).isTrue();
    }

    @Test
    void testBuildFailureExitCode() throws IOException {
        int exitCode = new CommandLine(new IndexCommand()).execute(
                "-g", copyFixture("guidelines.json").toString(),
                "-a", copyFixture("associations.json").toString(),
                "-t", copyFixture("techniques.json").toString(),
                "--strict-techniques",
                "-o", tempDir.resolve("strict.json").toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testInvalidOptionsExitCode() throws IOException {
        int exitCode = new CommandLine(new IndexCommand()).execute(
                "-g", copyFixture("guidelines.json").toString(),
                "-a", copyFixture("associations.json").toString(),
                "-w", "19");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void testMissingRequiredOption() {
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new IndexCommand());
        commandLine.setErr(new PrintWriter(err));

        int exitCode = commandLine.execute("-g", "guidelines.json");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--associations");
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }
}
