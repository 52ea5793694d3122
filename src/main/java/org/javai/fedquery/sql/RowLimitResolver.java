package org.javai.fedquery.sql;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a requested row count such as "top 5" or "10 largest" from a query.
 */
public final class RowLimitResolver {

	private static final Pattern LEADING_COUNT = Pattern.compile(
			"\\b(?:top|first|last|best|bottom|worst)\\s+(\\d{1,6})\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern TRAILING_COUNT = Pattern.compile(
			"\\b(\\d{1,6})\\s+(?:most|least|largest|smallest|highest|lowest|biggest|latest|newest|oldest|recent)\\b",
			Pattern.CASE_INSENSITIVE);

	private RowLimitResolver() {
	}

	public static OptionalInt requestedRows(String query) {
		if (query == null) {
			return OptionalInt.empty();
		}
		for (Pattern pattern : new Pattern[] { LEADING_COUNT, TRAILING_COUNT }) {
			Matcher matcher = pattern.matcher(query);
			if (matcher.find()) {
				int requested = Integer.parseInt(matcher.group(1));
				if (requested > 0) {
					return OptionalInt.of(requested);
				}
			}
		}
		return OptionalInt.empty();
	}

	/**
	 * @return the requested row count capped at {@code maxRows}, or {@code maxRows} if the query
	 * requests none
	 */
	public static int resolve(String query, int maxRows) {
		OptionalInt requested = requestedRows(query);
		return requested.isPresent() ? Math.min(requested.getAsInt(), maxRows) : maxRows;
	}
}
