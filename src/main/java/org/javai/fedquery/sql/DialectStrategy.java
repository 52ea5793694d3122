package org.javai.fedquery.sql;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.statement.Statement;
import org.javai.fedquery.schema.DatabaseDialect;
import org.javai.fedquery.schema.SchemaSnapshot;

/**
 * Vendor-specific rules for prompting, formatting and validating SQL.
 */
public interface DialectStrategy {

	DatabaseDialect dialect();

	/**
	 * Build the system prompt for synthesizing a statement over the given (whitelisted) schema.
	 */
	String buildSystemPrompt(SchemaSnapshot schema, String query);

	/**
	 * Check the statement against read-only rules and this dialect's syntax.
	 */
	SyntaxCheck validateSyntax(String sql);

	/**
	 * Repair common formatting defects of generated SQL without changing its meaning.
	 */
	String formatSql(String sql);

	/**
	 * @return this dialect's row-limit syntax for {@code n} rows, e.g. {@code LIMIT 5} or {@code TOP 5}
	 */
	String limitClause(int n);

	/**
	 * Ensure the statement returns at most {@code n} rows, keeping a smaller limit already present.
	 */
	String applyRowLimit(String sql, int n);

	/**
	 * Quote an identifier if this dialect requires it.
	 */
	String quoteIdentifier(String identifier);

	/**
	 * Parse a statement with the parser options this dialect needs.
	 */
	Statement parse(String sql) throws JSQLParserException;
}
