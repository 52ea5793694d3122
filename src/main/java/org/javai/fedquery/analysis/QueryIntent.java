package org.javai.fedquery.analysis;

import java.util.List;
import java.util.Objects;

/**
 * Where the data for one informational query is expected to live.
 *
 * @param originalQuery the query as asked
 * @param understanding the model's restatement of the query
 * @param confidence certainty in [0, 1] that the selected databases satisfy the query
 * @param databaseQueries one entry per selected database, ordered by priority
 * @param requiresCrossDatabaseJoin whether rows from different databases must be combined
 * @param reasoning the model's explanation of the selection
 */
public record QueryIntent(
		String originalQuery,
		String understanding,
		double confidence,
		List<DatabaseQueryIntent> databaseQueries,
		boolean requiresCrossDatabaseJoin,
		String reasoning
) {

	public QueryIntent {
		Objects.requireNonNull(originalQuery, "originalQuery must not be null");
		understanding = understanding != null ? understanding : originalQuery;
		confidence = Math.max(0.0, Math.min(1.0, confidence));
		databaseQueries = databaseQueries != null ? List.copyOf(databaseQueries) : List.of();
		reasoning = reasoning != null ? reasoning : "";
	}

	/**
	 * An intent that selects no database.
	 */
	public static QueryIntent none(String originalQuery, double confidence, String reasoning) {
		return new QueryIntent(originalQuery, originalQuery, confidence, List.of(), false, reasoning);
	}

	public QueryIntent withDatabaseQueries(List<DatabaseQueryIntent> updated) {
		return new QueryIntent(originalQuery, understanding, confidence, updated, requiresCrossDatabaseJoin, reasoning);
	}

	public List<String> databaseIds() {
		return databaseQueries.stream().map(DatabaseQueryIntent::databaseId).toList();
	}
}
