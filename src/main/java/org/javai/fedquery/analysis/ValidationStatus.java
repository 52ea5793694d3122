package org.javai.fedquery.analysis;

/**
 * State of the SQL attached to a {@link DatabaseQueryIntent}.
 */
public enum ValidationStatus {
	/** No SQL synthesized yet. */
	PENDING,
	/** SQL passed whitelist and dialect validation and may be executed. */
	VALID,
	/** Synthesis or validation failed; the sub-query is never executed. */
	INVALID
}
