package org.javai.fedquery.sql;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.javai.fedquery.config.SynthesisSettings;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.javai.fedquery.schema.SchemaVocabulary;
import org.javai.fedquery.schema.TableSchema;

/**
 * Validates a generated SELECT against the whitelisted schema subset it was generated for.
 *
 * <p>By the time a statement passes, the following hold:</p>
 * <ul>
 *   <li><b>SELECT-only</b> - a single plain SELECT without common table expressions</li>
 *   <li><b>Whitelist compliance</b> - every table and every column reference exists in the
 *   whitelist</li>
 *   <li><b>Structural ceiling</b> - joins, WHERE predicates and ORDER BY expressions stay within
 *   the configured limits</li>
 *   <li><b>No invented filters</b> - no forbidden term appears in a string literal of the WHERE or
 *   HAVING clause</li>
 * </ul>
 */
public class SchemaWhitelistValidator {

	private static final Set<String> PSEUDO_COLUMNS = Set.of(
			"true", "false", "null", "current_date", "current_time", "current_timestamp", "sysdate", "now");

	private final SynthesisSettings limits;

	public SchemaWhitelistValidator(SynthesisSettings limits) {
		this.limits = Objects.requireNonNull(limits, "limits must not be null");
	}

	/**
	 * @param sql the statement to check
	 * @param whitelist the schema subset the statement may reference
	 * @param forbiddenTerms lowercase words that must not appear in filter literals
	 * @param strategy the dialect, used for parsing
	 * @throws SqlValidationException listing every violation found
	 */
	public void validate(String sql, SchemaSnapshot whitelist, Set<String> forbiddenTerms, DialectStrategy strategy) {
		if (sql == null || sql.isBlank()) {
			throw new SqlValidationException("SQL string cannot be null or blank");
		}

		Statement stmt;
		try {
			stmt = strategy.parse(sql);
		} catch (JSQLParserException e) {
			throw new SqlValidationException("Invalid SQL syntax: " + e.getMessage(), e);
		}
		if (!(stmt instanceof Select select)) {
			throw new SqlValidationException("Only SELECT statements are allowed, got: " + stmt.getClass().getSimpleName());
		}
		if (select.getWithItemsList() != null && !select.getWithItemsList().isEmpty()) {
			throw new SqlValidationException("Common table expressions are not allowed");
		}
		if (!(select instanceof PlainSelect plainSelect)) {
			throw new SqlValidationException("Only a single plain SELECT is allowed, got: " + select.getClass().getSimpleName());
		}

		List<String> violations = new ArrayList<>();
		Map<String, TableSchema> aliasToTable = validateTables(select, plainSelect, whitelist, violations);
		validateColumns(plainSelect, aliasToTable, violations);
		validateStructure(plainSelect, violations);
		validateFilterLiterals(plainSelect, forbiddenTerms, violations);

		if (!violations.isEmpty()) {
			throw new SqlValidationException(violations);
		}
	}

	private Map<String, TableSchema> validateTables(Select select, PlainSelect plainSelect, SchemaSnapshot whitelist,
			List<String> violations) {
		Set<String> tables = new TablesNamesFinder().getTables((Statement) select);
		for (String table : tables) {
			String tableName = bareName(table);
			if (whitelist.findTable(tableName).isEmpty()) {
				violations.add("Table not allowed: " + tableName + ". Allowed tables: " + whitelist.tableNames());
			}
		}

		Map<String, TableSchema> aliasToTable = new HashMap<>();
		registerTable(plainSelect.getFromItem(), whitelist, aliasToTable);
		if (plainSelect.getJoins() != null) {
			for (Join join : plainSelect.getJoins()) {
				registerTable(join.getRightItem(), whitelist, aliasToTable);
			}
		}
		return aliasToTable;
	}

	private static void registerTable(Object fromItem, SchemaSnapshot whitelist, Map<String, TableSchema> aliasToTable) {
		if (!(fromItem instanceof Table table)) {
			return;
		}
		Optional<TableSchema> schema = whitelist.findTable(bareName(table.getName()));
		if (schema.isEmpty()) {
			return;
		}
		aliasToTable.put(bareName(table.getName()).toLowerCase(Locale.ROOT), schema.get());
		if (table.getAlias() != null) {
			aliasToTable.put(AbstractDialectStrategy.unquote(table.getAlias().getName()).toLowerCase(Locale.ROOT), schema.get());
		}
	}

	private void validateColumns(PlainSelect plainSelect, Map<String, TableSchema> aliasToTable, List<String> violations) {
		Set<String> selectAliases = new HashSet<>();
		List<Expression> expressions = new ArrayList<>();
		for (SelectItem<?> item : plainSelect.getSelectItems()) {
			expressions.add(item.getExpression());
			if (item.getAlias() != null) {
				selectAliases.add(AbstractDialectStrategy.unquote(item.getAlias().getName()).toLowerCase(Locale.ROOT));
			}
		}
		if (plainSelect.getWhere() != null) {
			expressions.add(plainSelect.getWhere());
		}
		if (plainSelect.getHaving() != null) {
			expressions.add(plainSelect.getHaving());
		}
		if (plainSelect.getGroupBy() != null && plainSelect.getGroupBy().getGroupByExpressionList() != null) {
			expressions.add(plainSelect.getGroupBy().getGroupByExpressionList());
		}
		if (plainSelect.getOrderByElements() != null) {
			for (OrderByElement element : plainSelect.getOrderByElements()) {
				expressions.add(element.getExpression());
			}
		}
		if (plainSelect.getJoins() != null) {
			for (Join join : plainSelect.getJoins()) {
				if (join.getOnExpressions() != null) {
					expressions.addAll(join.getOnExpressions());
				}
			}
		}

		List<Column> columns = new ArrayList<>();
		ExpressionVisitorAdapter collector = new ExpressionVisitorAdapter() {
			@Override
			public void visit(Column column) {
				columns.add(column);
			}
		};
		for (Expression expression : expressions) {
			if (expression != null) {
				expression.accept(collector);
			}
		}

		for (Column column : columns) {
			String columnName = AbstractDialectStrategy.unquote(column.getColumnName());
			String qualifier = column.getTable() != null && column.getTable().getName() != null
					? bareName(column.getTable().getName()).toLowerCase(Locale.ROOT)
					: null;
			if (qualifier != null) {
				TableSchema table = aliasToTable.get(qualifier);
				if (table == null) {
					violations.add("Unknown table or alias: " + qualifier);
				} else if (!table.hasColumn(columnName)) {
					violations.add("Column not allowed: " + table.name() + "." + columnName);
				}
				continue;
			}
			String lower = columnName.toLowerCase(Locale.ROOT);
			if (PSEUDO_COLUMNS.contains(lower) || selectAliases.contains(lower)) {
				continue;
			}
			boolean known = aliasToTable.values().stream().anyMatch(t -> t.hasColumn(columnName));
			if (!known) {
				violations.add("Column not allowed: " + columnName);
			}
		}
	}

	private void validateStructure(PlainSelect plainSelect, List<String> violations) {
		int joins = plainSelect.getJoins() != null ? plainSelect.getJoins().size() : 0;
		if (joins > limits.maxJoins()) {
			violations.add("Too many joins: " + joins + " (max " + limits.maxJoins() + ")");
		}
		int predicates = plainSelect.getWhere() != null ? countPredicates(plainSelect.getWhere()) : 0;
		if (predicates > limits.maxWherePredicates()) {
			violations.add("Too many WHERE predicates: " + predicates + " (max " + limits.maxWherePredicates() + ")");
		}
		int orderBy = plainSelect.getOrderByElements() != null ? plainSelect.getOrderByElements().size() : 0;
		if (orderBy > limits.maxOrderByColumns()) {
			violations.add("Too many ORDER BY columns: " + orderBy + " (max " + limits.maxOrderByColumns() + ")");
		}
	}

	/**
	 * Counts the atomic predicates of a condition: one more than the number of AND/OR connectives,
	 * wherever they are nested.
	 */
	static int countPredicates(Expression expression) {
		int[] connectives = {0};
		expression.accept(new ExpressionVisitorAdapter() {
			@Override
			public void visit(AndExpression and) {
				connectives[0]++;
				super.visit(and);
			}

			@Override
			public void visit(OrExpression or) {
				connectives[0]++;
				super.visit(or);
			}
		});
		return connectives[0] + 1;
	}

	private void validateFilterLiterals(PlainSelect plainSelect, Set<String> forbiddenTerms, List<String> violations) {
		if (forbiddenTerms == null || forbiddenTerms.isEmpty()) {
			return;
		}
		Set<String> forbiddenStems = new HashSet<>();
		for (String term : forbiddenTerms) {
			forbiddenStems.add(SchemaVocabulary.stem(term));
		}
		List<String> literals = new ArrayList<>();
		ExpressionVisitorAdapter collector = new ExpressionVisitorAdapter() {
			@Override
			public void visit(StringValue value) {
				literals.add(value.getValue());
			}
		};
		if (plainSelect.getWhere() != null) {
			plainSelect.getWhere().accept(collector);
		}
		if (plainSelect.getHaving() != null) {
			plainSelect.getHaving().accept(collector);
		}
		for (String literal : literals) {
			for (String word : SchemaVocabulary.fragments(literal)) {
				if (forbiddenStems.contains(SchemaVocabulary.stem(word))) {
					violations.add("Filter uses a term that matches no column: '" + literal + "'");
					break;
				}
			}
		}
	}

	private static String bareName(String qualifiedName) {
		String name = qualifiedName;
		int dot = lastUnquotedDot(name);
		if (dot >= 0) {
			name = name.substring(dot + 1);
		}
		return AbstractDialectStrategy.unquote(name);
	}

	private static int lastUnquotedDot(String name) {
		boolean quoted = false;
		int last = -1;
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			if (c == '"' || c == '`' || c == '[' || c == ']') {
				quoted = c != ']' && !quoted;
			} else if (c == '.' && !quoted) {
				last = i;
			}
		}
		return last;
	}
}
