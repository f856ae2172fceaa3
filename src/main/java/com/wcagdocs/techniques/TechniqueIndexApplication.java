package com.wcagdocs.techniques;

import com.wcagdocs.techniques.cli.IndexCommand;
import picocli.CommandLine;

/**
 * Main entry point for the technique association indexer.
 * Reads the guidelines and the per-criterion technique specifications of a documentation
 * build and writes, for every technique, the criteria that reference it.
 */
public class TechniqueIndexApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new IndexCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
