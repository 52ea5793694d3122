package org.javai.fedquery.sql;

import java.util.List;

/**
 * Thrown when generated SQL violates the schema whitelist or the structural limits.
 */
public class SqlValidationException extends RuntimeException {

	private final List<String> violations;

	public SqlValidationException(String message) {
		this(List.of(message));
	}

	public SqlValidationException(List<String> violations) {
		super(String.join("; ", violations));
		this.violations = List.copyOf(violations);
	}

	public SqlValidationException(String message, Throwable cause) {
		super(message, cause);
		this.violations = List.of(message);
	}

	public List<String> violations() {
		return violations;
	}
}
