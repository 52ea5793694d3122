package org.javai.fedquery.exec;

import java.util.Objects;

/**
 * Outcome of executing one database's statement. A failed result carries the error message and
 * no data.
 */
public record QueryExecutionResult(
		String databaseId,
		String executedSql,
		int rowCount,
		TabularResult data,
		boolean success,
		String errorMessage,
		long elapsedMillis
) {

	public QueryExecutionResult {
		Objects.requireNonNull(databaseId, "databaseId must not be null");
		data = data != null ? data : TabularResult.empty();
	}

	public static QueryExecutionResult success(String databaseId, String sql, TabularResult data, long elapsedMillis) {
		return new QueryExecutionResult(databaseId, sql, data.rowCount(), data, true, null, elapsedMillis);
	}

	public static QueryExecutionResult failure(String databaseId, String sql, String errorMessage, long elapsedMillis) {
		return new QueryExecutionResult(databaseId, sql, 0, TabularResult.empty(), false,
				errorMessage != null ? errorMessage : "Unknown error", elapsedMillis);
	}

	public boolean hasRows() {
		return success && rowCount > 0;
	}
}
