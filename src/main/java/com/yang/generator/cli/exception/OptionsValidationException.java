package com.yang.generator.cli.exception;

import java.util.List;

/**
 * Every problem found in the command line options, reported at once.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private static final String HEADER = "Invalid options:";

	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(HEADER + System.lineSeparator() + "  - " + String.join(System.lineSeparator() + "  - ", errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
