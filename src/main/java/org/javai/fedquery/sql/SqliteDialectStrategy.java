package org.javai.fedquery.sql;

import java.util.List;
import java.util.regex.Pattern;
import org.javai.fedquery.schema.DatabaseDialect;

/**
 * SQLite: {@code LIMIT n}, {@code ||} concatenation and text-based dates.
 */
public class SqliteDialectStrategy extends AbstractDialectStrategy {

	private static final Pattern ILIKE = Pattern.compile("\\bILIKE\\b", Pattern.CASE_INSENSITIVE);

	@Override
	public DatabaseDialect dialect() {
		return DatabaseDialect.SQLITE;
	}

	@Override
	protected List<String> dialectRules() {
		return List.of(
				"Use || for string concatenation.",
				"Dates are stored as text; use date(), datetime() and strftime() to compare or extract parts.",
				"LIKE is case-insensitive for ASCII; ILIKE does not exist.",
				"Limit rows with LIMIT n at the end of the statement. Never use TOP.");
	}

	@Override
	protected String checkDialectRules(String maskedSql) {
		if (SELECT_TOP.matcher(maskedSql).find()) {
			return "TOP is not valid in SQLite, use LIMIT";
		}
		if (ILIKE.matcher(maskedSql).find()) {
			return "ILIKE is not valid in SQLite, use LIKE";
		}
		return null;
	}
}
