package org.javai.fedquery.sql;

import java.util.List;
import java.util.regex.Pattern;
import org.javai.fedquery.schema.DatabaseDialect;

/**
 * PostgreSQL: {@code LIMIT n}, double-quoted identifiers, and quoting of any identifier that is
 * not all lowercase since unquoted names are folded to lowercase.
 */
public class PostgreSqlDialectStrategy extends AbstractDialectStrategy {

	private static final Pattern LOWERCASE_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

	@Override
	public DatabaseDialect dialect() {
		return DatabaseDialect.POSTGRESQL;
	}

	@Override
	protected List<String> dialectRules() {
		return List.of(
				"Identifiers containing uppercase letters MUST be written in double quotes exactly as listed.",
				"Use ILIKE for case-insensitive text matching.",
				"Cast with CAST(x AS type) or x::type.",
				"Limit rows with LIMIT n at the end of the statement. Never use TOP.");
	}

	@Override
	protected String checkDialectRules(String maskedSql) {
		if (maskedSql.indexOf('`') >= 0) {
			return "Backtick quoting is not valid in PostgreSQL";
		}
		if (SELECT_TOP.matcher(maskedSql).find()) {
			return "TOP is not valid in PostgreSQL, use LIMIT";
		}
		return null;
	}

	@Override
	public String quoteIdentifier(String identifier) {
		if (identifier == null || LOWERCASE_IDENTIFIER.matcher(identifier).matches()) {
			return identifier;
		}
		return quote(identifier);
	}
}
