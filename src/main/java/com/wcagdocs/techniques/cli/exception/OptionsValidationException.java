package com.wcagdocs.techniques.cli.exception;

import java.util.List;

/**
 * Reports every invalid "index" option at once instead of failing on the first.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** Exit code used when options are rejected; matches picocli's usage error code. */
	public static final int EXIT_CODE = 2;

	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super("Invalid options:" + System.lineSeparator() + "  - "
				+ String.join(System.lineSeparator() + "  - ", errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
