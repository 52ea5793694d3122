package org.javai.fedquery.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import org.javai.fedquery.ai.StructuredResponseParser;
import org.javai.fedquery.schema.ColumnSchema;
import org.javai.fedquery.schema.ForeignKey;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.javai.fedquery.schema.TableSchema;

/**
 * Rules shared by every dialect: read-only enforcement, formatting repairs, prompt layout and
 * {@code LIMIT}-style row limiting. Subclasses add their own prompt rules and syntax checks.
 */
public abstract class AbstractDialectStrategy implements DialectStrategy {

	public static final List<String> FORBIDDEN_KEYWORDS = List.of(
			"DROP", "DELETE", "TRUNCATE", "ALTER", "CREATE", "GRANT", "REVOKE",
			"INSERT", "UPDATE", "MERGE", "EXEC", "EXECUTE");

	private static final Pattern FORBIDDEN = Pattern.compile(
			"\\b(" + String.join("|", FORBIDDEN_KEYWORDS) + ")\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
	private static final Pattern LEADING_SELECT = Pattern.compile("^\\s*(?:SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern DUPLICATE_BY = Pattern.compile("\\b(GROUP|ORDER)\\s+BY\\s+BY\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern JOINED_BY = Pattern.compile("\\b(GROUP|ORDER)BY\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern TRAILING_COMMA = Pattern.compile(
			",\\s*(?=(?:FROM|WHERE|GROUP\\s+BY|ORDER\\s+BY|HAVING|LIMIT)\\b)", Pattern.CASE_INSENSITIVE);
	private static final Pattern TRAILING_SEMICOLONS = Pattern.compile("[;\\s]+$");
	private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	protected static final Pattern TRAILING_LIMIT = Pattern.compile(
			"\\s+LIMIT\\s+(\\d+)(\\s+OFFSET\\s+\\d+)?\\s*$", Pattern.CASE_INSENSITIVE);
	protected static final Pattern TRAILING_FETCH = Pattern.compile(
			"\\s+FETCH\\s+(?:FIRST|NEXT)\\s+(\\d+)\\s+ROWS?\\s+ONLY\\s*$", Pattern.CASE_INSENSITIVE);
	protected static final Pattern SELECT_TOP = Pattern.compile(
			"^\\s*SELECT\\s+(?:DISTINCT\\s+)?TOP\\b", Pattern.CASE_INSENSITIVE);

	@Override
	public String buildSystemPrompt(SchemaSnapshot schema, String query) {
		String name = dialect().displayName();
		StringBuilder prompt = new StringBuilder();
		prompt.append("You are an expert ").append(name).append(" developer. ")
				.append("Write ONE read-only SELECT statement that answers the question.\n\n");
		prompt.append("OUTPUT:\n- Return only the SQL inside a ```sql code block. No explanation.\n\n");
		prompt.append("RULES:\n");
		prompt.append("- SELECT only. Never use ").append(String.join(", ", FORBIDDEN_KEYWORDS)).append(".\n");
		prompt.append("- Use ONLY the tables and columns listed under ALLOWED SCHEMA. Anything else is rejected.\n");
		prompt.append("- No comments, no semicolons, a single statement.\n");
		for (String rule : dialectRules()) {
			prompt.append("- ").append(rule).append("\n");
		}
		prompt.append("\n");

		prompt.append("ALLOWED SCHEMA (").append(schema.databaseName()).append(", ").append(name).append("):\n");
		for (TableSchema table : schema.tables()) {
			prompt.append("- ").append(quoteIdentifier(table.name())).append(": ");
			List<String> columns = new ArrayList<>();
			for (ColumnSchema column : table.columns()) {
				String rendered = quoteIdentifier(column.name()) + " " + column.dataType();
				columns.add(column.primaryKey() ? rendered + " PK" : rendered);
			}
			prompt.append(String.join(", ", columns)).append("\n");
			for (ForeignKey fk : table.foreignKeys()) {
				prompt.append("    ").append(quoteIdentifier(fk.column())).append(" references ")
						.append(quoteIdentifier(fk.referencedTable())).append(".")
						.append(quoteIdentifier(fk.referencedColumn())).append("\n");
			}
		}
		if (query != null && !query.isBlank()) {
			prompt.append("\nQUESTION: ").append(query.trim()).append("\n");
		}
		return prompt.toString();
	}

	/**
	 * Prompt rules specific to this dialect, one per line.
	 */
	protected abstract List<String> dialectRules();

	@Override
	public SyntaxCheck validateSyntax(String sql) {
		if (sql == null || sql.isBlank()) {
			return SyntaxCheck.failed("SQL is empty");
		}
		String masked = maskStringLiterals(sql);
		Matcher forbidden = FORBIDDEN.matcher(masked);
		if (forbidden.find()) {
			return SyntaxCheck.failed("Forbidden keyword: " + forbidden.group(1).toUpperCase(Locale.ROOT));
		}
		if (!LEADING_SELECT.matcher(masked).find()) {
			return SyntaxCheck.failed("Only SELECT statements are allowed");
		}
		if (masked.contains(";")) {
			return SyntaxCheck.failed("Multiple statements are not allowed");
		}
		if (masked.contains("--") || masked.contains("/*")) {
			return SyntaxCheck.failed("Comments are not allowed");
		}
		String dialectError = checkDialectRules(masked);
		if (dialectError != null) {
			return SyntaxCheck.failed(dialectError);
		}
		try {
			parse(sql);
		} catch (JSQLParserException e) {
			return SyntaxCheck.failed("Invalid " + dialect().displayName() + " syntax: " + firstLine(e.getMessage()));
		}
		return SyntaxCheck.passed();
	}

	/**
	 * Dialect-specific checks on the statement with string literals masked out.
	 *
	 * @return an error message, or null if the statement passes
	 */
	protected abstract String checkDialectRules(String maskedSql);

	@Override
	public String formatSql(String sql) {
		if (sql == null) {
			return "";
		}
		String formatted = StructuredResponseParser.stripCodeFences(sql);
		formatted = TRAILING_SEMICOLONS.matcher(formatted).replaceAll("");
		formatted = JOINED_BY.matcher(formatted).replaceAll("$1 BY");
		formatted = DUPLICATE_BY.matcher(formatted).replaceAll("$1 BY");
		formatted = TRAILING_COMMA.matcher(formatted).replaceAll(" ");
		return formatDialect(formatted.trim());
	}

	/**
	 * Dialect-specific formatting, applied after the shared repairs.
	 */
	protected String formatDialect(String sql) {
		return sql;
	}

	@Override
	public String limitClause(int n) {
		return "LIMIT " + n;
	}

	@Override
	public String applyRowLimit(String sql, int n) {
		String trimmed = sql.trim();
		Matcher limit = TRAILING_LIMIT.matcher(trimmed);
		if (limit.find()) {
			int existing = parseRowCount(limit.group(1));
			if (existing <= n) {
				return trimmed;
			}
			String offset = limit.group(2) != null ? limit.group(2) : "";
			return trimmed.substring(0, limit.start()) + " " + limitClause(n) + offset;
		}
		Matcher fetch = TRAILING_FETCH.matcher(trimmed);
		if (fetch.find()) {
			int existing = parseRowCount(fetch.group(1));
			return trimmed.substring(0, fetch.start()) + " " + limitClause(Math.min(existing, n));
		}
		return trimmed + " " + limitClause(n);
	}

	/**
	 * Row count written by the model, saturating at {@link Integer#MAX_VALUE} for counts too large
	 * for an int.
	 */
	protected static int parseRowCount(String digits) {
		try {
			return Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			return Integer.MAX_VALUE;
		}
	}

	@Override
	public String quoteIdentifier(String identifier) {
		if (identifier == null || PLAIN_IDENTIFIER.matcher(identifier).matches()) {
			return identifier;
		}
		return quote(identifier);
	}

	/**
	 * Wrap an identifier in this dialect's quote characters.
	 */
	protected String quote(String identifier) {
		return "\"" + identifier.replace("\"", "\"\"") + "\"";
	}

	@Override
	public Statement parse(String sql) throws JSQLParserException {
		return CCJSqlParserUtil.parse(sql);
	}

	/**
	 * Replace the contents of every single-quoted literal so keyword checks cannot match inside it.
	 */
	public static String maskStringLiterals(String sql) {
		return STRING_LITERAL.matcher(sql).replaceAll("''");
	}

	/**
	 * Remove identifier quoting of any supported dialect.
	 */
	public static String unquote(String identifier) {
		if (identifier == null || identifier.length() < 2) {
			return identifier;
		}
		char first = identifier.charAt(0);
		char last = identifier.charAt(identifier.length() - 1);
		if ((first == '"' && last == '"') || (first == '`' && last == '`') || (first == '[' && last == ']')) {
			return identifier.substring(1, identifier.length() - 1);
		}
		return identifier;
	}

	private static String firstLine(String message) {
		if (message == null) {
			return "parse error";
		}
		int newline = message.indexOf('\n');
		return newline < 0 ? message : message.substring(0, newline);
	}
}
