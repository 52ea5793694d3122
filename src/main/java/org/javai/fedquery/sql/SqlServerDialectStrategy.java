package org.javai.fedquery.sql;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.javai.fedquery.schema.DatabaseDialect;

/**
 * SQL Server: {@code SELECT TOP n}, bracket-quoted identifiers. Generated {@code LIMIT} and
 * {@code FETCH FIRST} clauses are rewritten to {@code TOP}.
 */
public class SqlServerDialectStrategy extends AbstractDialectStrategy {

	private static final Pattern TOP_CLAUSE = Pattern.compile(
			"^(\\s*SELECT\\s+(?:DISTINCT\\s+)?)TOP\\s*\\(?\\s*(\\d+)\\s*\\)?\\s*", Pattern.CASE_INSENSITIVE);
	private static final Pattern SELECT_HEAD = Pattern.compile(
			"^(\\s*SELECT\\s+(?:DISTINCT\\s+)?)", Pattern.CASE_INSENSITIVE);
	private static final Pattern LIMIT_KEYWORD = Pattern.compile("\\bLIMIT\\s+\\d+", Pattern.CASE_INSENSITIVE);
	private static final Pattern TOP_KEYWORD = Pattern.compile("\\bTOP\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern ORDER_BY = Pattern.compile("\\bORDER\\s+BY\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern OFFSET = Pattern.compile("\\bOFFSET\\b", Pattern.CASE_INSENSITIVE);

	@Override
	public DatabaseDialect dialect() {
		return DatabaseDialect.SQLSERVER;
	}

	@Override
	protected List<String> dialectRules() {
		return List.of(
				"Limit rows with SELECT TOP n directly after SELECT (or SELECT DISTINCT). Never use LIMIT.",
				"Quote identifiers with [square brackets] when they contain spaces or special characters.",
				"Use + or CONCAT() for string concatenation.",
				"Use GETDATE() for the current date and DATEPART()/YEAR()/MONTH() to extract parts.");
	}

	@Override
	protected String checkDialectRules(String maskedSql) {
		if (maskedSql.indexOf('`') >= 0) {
			return "Backtick quoting is not valid in SQL Server, use [brackets]";
		}
		if (LIMIT_KEYWORD.matcher(maskedSql).find()) {
			return "LIMIT is not valid in SQL Server, use TOP";
		}
		Matcher top = TOP_KEYWORD.matcher(maskedSql);
		Matcher orderBy = ORDER_BY.matcher(maskedSql);
		if (top.find() && orderBy.find() && top.start() > orderBy.start()) {
			return "TOP must follow SELECT, not ORDER BY";
		}
		return null;
	}

	@Override
	protected String formatDialect(String sql) {
		Integer requested = trailingLimit(sql);
		if (requested == null) {
			return sql;
		}
		return withTop(stripTrailingLimit(sql), requested);
	}

	@Override
	public String limitClause(int n) {
		return "TOP " + n;
	}

	@Override
	public String applyRowLimit(String sql, int n) {
		String trimmed = sql.trim();
		Integer requested = trailingLimit(trimmed);
		if (requested != null) {
			trimmed = stripTrailingLimit(trimmed);
		}
		if (OFFSET.matcher(maskStringLiterals(trimmed)).find()) {
			// OFFSET ... FETCH paging cannot be combined with TOP
			return trimmed;
		}
		int effective = requested != null ? Math.min(requested, n) : n;
		return withTop(trimmed, effective);
	}

	private String withTop(String sql, int n) {
		Matcher top = TOP_CLAUSE.matcher(sql);
		if (top.find()) {
			int existing = parseRowCount(top.group(2));
			return top.group(1) + limitClause(Math.min(existing, n)) + " " + sql.substring(top.end());
		}
		Matcher head = SELECT_HEAD.matcher(sql);
		if (head.find()) {
			return head.group(1) + limitClause(n) + " " + sql.substring(head.end());
		}
		return sql;
	}

	private static Integer trailingLimit(String sql) {
		Matcher limit = TRAILING_LIMIT.matcher(sql);
		if (limit.find() && limit.group(2) == null) {
			return parseRowCount(limit.group(1));
		}
		if (!sql.toUpperCase(Locale.ROOT).contains("OFFSET")) {
			Matcher fetch = TRAILING_FETCH.matcher(sql);
			if (fetch.find()) {
				return parseRowCount(fetch.group(1));
			}
		}
		return null;
	}

	private static String stripTrailingLimit(String sql) {
		Matcher limit = TRAILING_LIMIT.matcher(sql);
		if (limit.find()) {
			return sql.substring(0, limit.start()).trim();
		}
		Matcher fetch = TRAILING_FETCH.matcher(sql);
		if (fetch.find()) {
			return sql.substring(0, fetch.start()).trim();
		}
		return sql;
	}

	@Override
	protected String quote(String identifier) {
		return "[" + identifier.replace("]", "]]") + "]";
	}

	@Override
	public Statement parse(String sql) throws JSQLParserException {
		return CCJSqlParserUtil.parse(sql, parser -> parser.withSquareBracketQuotation(true));
	}
}
