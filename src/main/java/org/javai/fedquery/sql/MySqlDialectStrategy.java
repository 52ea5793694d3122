package org.javai.fedquery.sql;

import java.util.List;
import java.util.regex.Pattern;
import org.javai.fedquery.schema.DatabaseDialect;

/**
 * MySQL: {@code LIMIT n} and backtick-quoted identifiers.
 */
public class MySqlDialectStrategy extends AbstractDialectStrategy {

	private static final Pattern BRACKET_IDENTIFIER = Pattern.compile("\\[[^\\]]+\\]");

	@Override
	public DatabaseDialect dialect() {
		return DatabaseDialect.MYSQL;
	}

	@Override
	protected List<String> dialectRules() {
		return List.of(
				"Quote identifiers with backticks when they contain spaces or special characters.",
				"Use CONCAT() for string concatenation.",
				"Limit rows with LIMIT n at the end of the statement. Never use TOP or FETCH FIRST.");
	}

	@Override
	protected String checkDialectRules(String maskedSql) {
		if (SELECT_TOP.matcher(maskedSql).find()) {
			return "TOP is not valid in MySQL, use LIMIT";
		}
		if (BRACKET_IDENTIFIER.matcher(maskedSql).find()) {
			return "Square-bracket quoting is not valid in MySQL, use backticks";
		}
		return null;
	}

	@Override
	protected String quote(String identifier) {
		return "`" + identifier.replace("`", "``") + "`";
	}
}
