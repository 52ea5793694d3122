package org.javai.fedquery.config;

/**
 * Structural ceiling imposed on generated SQL, stated in the prompt and enforced by validation.
 *
 * @param maxJoins joins allowed in one statement
 * @param maxWherePredicates comparison predicates allowed in the WHERE clause
 * @param maxOrderByColumns ORDER BY expressions allowed
 * @param sampleRowsPerTable sample rows shown per table for value-format grounding
 */
public record SynthesisSettings(
		int maxJoins,
		int maxWherePredicates,
		int maxOrderByColumns,
		int sampleRowsPerTable
) {

	public static final int DEFAULT_MAX_JOINS = 2;
	public static final int DEFAULT_MAX_WHERE_PREDICATES = 2;
	public static final int DEFAULT_MAX_ORDER_BY_COLUMNS = 1;
	public static final int DEFAULT_SAMPLE_ROWS_PER_TABLE = 3;

	public SynthesisSettings {
		if (maxJoins < 0 || maxWherePredicates < 0 || maxOrderByColumns < 0 || sampleRowsPerTable < 0) {
			throw new IllegalArgumentException("synthesis limits must be non-negative");
		}
	}

	public static SynthesisSettings defaults() {
		return new SynthesisSettings(DEFAULT_MAX_JOINS, DEFAULT_MAX_WHERE_PREDICATES,
				DEFAULT_MAX_ORDER_BY_COLUMNS, DEFAULT_SAMPLE_ROWS_PER_TABLE);
	}
}
