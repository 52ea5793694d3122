package org.javai.fedquery.config;

/**
 * Limits applied while mapping a query onto databases.
 *
 * @param maxTablesPerDatabase tables of one schema listed in the analysis prompt
 * @param maxColumnsPerTable columns of one table listed in the analysis prompt
 * @param fallbackConfidence confidence assigned to the vocabulary-matching fallback intent
 * @param fallbackMaxTables tables per database selected by the fallback intent
 */
public record AnalysisSettings(
		int maxTablesPerDatabase,
		int maxColumnsPerTable,
		double fallbackConfidence,
		int fallbackMaxTables
) {

	public static final int DEFAULT_MAX_TABLES_PER_DATABASE = 15;
	public static final int DEFAULT_MAX_COLUMNS_PER_TABLE = 6;
	public static final double DEFAULT_FALLBACK_CONFIDENCE = 0.3;
	public static final int DEFAULT_FALLBACK_MAX_TABLES = 5;

	public AnalysisSettings {
		if (maxTablesPerDatabase < 1 || maxColumnsPerTable < 1 || fallbackMaxTables < 1) {
			throw new IllegalArgumentException("analysis limits must be >= 1");
		}
		if (fallbackConfidence < 0.0 || fallbackConfidence > 1.0) {
			throw new IllegalArgumentException("fallbackConfidence must lie within [0, 1]");
		}
	}

	public static AnalysisSettings defaults() {
		return new AnalysisSettings(DEFAULT_MAX_TABLES_PER_DATABASE, DEFAULT_MAX_COLUMNS_PER_TABLE,
				DEFAULT_FALLBACK_CONFIDENCE, DEFAULT_FALLBACK_MAX_TABLES);
	}
}
