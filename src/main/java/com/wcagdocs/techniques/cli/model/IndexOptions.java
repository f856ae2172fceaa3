package com.wcagdocs.techniques.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "index" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class IndexOptions {

	@Option(names = { "--guidelines", "-g" }, required = true,
			description = "JSON file of guideline nodes (principles, guidelines, success criteria)")
	private Path guidelinesFile;

	@Option(names = { "--associations", "-a" }, required = true,
			description = "JSON file mapping criterion ids to their technique specifications")
	private Path associationsFile;

	@Option(names = { "--techniques", "-t" },
			description = "Technique registry JSON, used to report ids without a technique page")
	private Path techniquesFile;

	@Option(names = { "--wcag-version", "-w" }, defaultValue = "22",
			description = "Guideline version to build for: 20, 21 or 22 (default: 22)")
	private String wcagVersion;

	@Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
	private Path outputFile;

	@Option(names = { "--strict-techniques" },
			description = "Fail when associations reference techniques missing from the registry")
	private boolean strictTechniques;

	@Option(names = { "--compact" }, description = "Write the index without indentation")
	private boolean compact;

}
