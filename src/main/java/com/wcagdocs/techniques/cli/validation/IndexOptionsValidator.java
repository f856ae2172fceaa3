package com.wcagdocs.techniques.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.wcagdocs.techniques.cli.exception.OptionsValidationException;
import com.wcagdocs.techniques.cli.model.IndexOptions;
import com.wcagdocs.techniques.index.IndexerConfig;
import com.wcagdocs.techniques.model.WcagVersion;

public class IndexOptionsValidator {

	public IndexerConfig validate(IndexOptions o) {
		List<String> errors = new ArrayList<>();

		requireReadableFile(o.getGuidelinesFile(), "Guidelines file (--guidelines / -g)", errors);
		requireReadableFile(o.getAssociationsFile(), "Associations file (--associations / -a)", errors);

		if (o.getTechniquesFile() != null) {
			requireReadableFile(o.getTechniquesFile(), "Technique registry (--techniques / -t)", errors);
		} else if (o.isStrictTechniques()) {
			errors.add("--strict-techniques requires a technique registry (--techniques / -t).");
		}

		WcagVersion version = null;
		try {
			version = WcagVersion.fromString(o.getWcagVersion());
		} catch (IllegalArgumentException e) {
			errors.add(e.getMessage() + ". Expected one of 20, 21, 22.");
		}

		Path output = o.getOutputFile() == null ? null : o.getOutputFile().toAbsolutePath().normalize();
		if (output != null && Files.isDirectory(output)) {
			errors.add("Output path is a directory: " + output);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return IndexerConfig.builder()
				.guidelinesFile(o.getGuidelinesFile())
				.associationsFile(o.getAssociationsFile())
				.techniquesFile(o.getTechniquesFile())
				.wcagVersion(version)
				.outputFile(output)
				.strictTechniques(o.isStrictTechniques())
				.prettyPrint(!o.isCompact())
				.build();
	}

	private static void requireReadableFile(Path p, String label, List<String> errors) {
		if (p == null) {
			errors.add(label + " is required.");
		} else if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
			errors.add(label + " does not exist or is not a readable file: " + p);
		}
	}
}
