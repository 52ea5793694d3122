package org.javai.fedquery.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.fedquery.analysis.DatabaseQueryIntent;
import org.javai.fedquery.config.SynthesisSettings;
import org.javai.fedquery.schema.CrossDatabaseMapping;
import org.javai.fedquery.schema.ForeignKey;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.javai.fedquery.schema.TableSchema;

/**
 * Builds the user prompt for synthesizing one database's statement. The dialect's system prompt
 * carries the whitelist; this prompt carries the request-specific grounding.
 */
public class SqlPromptBuilder {

	private final SynthesisSettings settings;

	public SqlPromptBuilder(SynthesisSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	/**
	 * @param query the user's question
	 * @param target the sub-query being synthesized
	 * @param whitelist the schema restricted to the sub-query's tables
	 * @param mappings cross-database mappings touching this database
	 * @param crossDatabase whether rows from several databases will be combined
	 * @param forbiddenTerms words that must not be used as filter values
	 * @param rowLimit rows the statement may return
	 * @param strategy the target dialect
	 */
	public String build(String query, DatabaseQueryIntent target, SchemaSnapshot whitelist,
			List<CrossDatabaseMapping> mappings, boolean crossDatabase, Set<String> forbiddenTerms,
			int rowLimit, DialectStrategy strategy) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("QUESTION: ").append(query.trim()).append("\n");
		if (!target.purpose().isBlank()) {
			prompt.append("PURPOSE OF THIS DATABASE: ").append(target.purpose()).append("\n");
		}
		prompt.append("\n");

		List<String> joinHints = joinHints(whitelist, strategy);
		if (!joinHints.isEmpty()) {
			prompt.append("JOIN HINTS:\n");
			joinHints.forEach(hint -> prompt.append("- ").append(hint).append("\n"));
			prompt.append("\n");
		}

		appendSampleRows(prompt, whitelist);

		if (!forbiddenTerms.isEmpty()) {
			prompt.append("FORBIDDEN FILTER TERMS: ").append(String.join(", ", forbiddenTerms)).append("\n");
			prompt.append("These words match no column. Never use them as values in WHERE, HAVING or LIKE.\n\n");
		}

		prompt.append("LIMITS:\n");
		prompt.append("- At most ").append(settings.maxJoins()).append(" joins.\n");
		prompt.append("- At most ").append(settings.maxWherePredicates()).append(" predicates in WHERE.\n");
		prompt.append("- At most ").append(settings.maxOrderByColumns()).append(" ORDER BY column(s).\n");
		prompt.append("- Return at most ").append(rowLimit).append(" rows using ")
				.append(strategy.limitClause(rowLimit)).append(".\n");

		if (crossDatabase && !mappings.isEmpty()) {
			prompt.append("\nCROSS-DATABASE KEYS (rows are combined after execution, never join across databases):\n");
			for (CrossDatabaseMapping mapping : mappings) {
				prompt.append("- ").append(mapping.render());
				if (!mapping.description().isBlank()) {
					prompt.append(" (").append(mapping.description()).append(")");
				}
				prompt.append("\n");
			}
			prompt.append("Always SELECT the key column on this database's side. If a requested metric is not in ")
					.append("this database, project the key plus a descriptive column instead.\n");
		}
		return prompt.toString();
	}

	private static List<String> joinHints(SchemaSnapshot whitelist, DialectStrategy strategy) {
		List<String> hints = new ArrayList<>();
		for (TableSchema table : whitelist.tables()) {
			for (ForeignKey fk : table.foreignKeys()) {
				if (whitelist.hasTable(fk.referencedTable())) {
					hints.add(strategy.quoteIdentifier(table.name()) + "." + strategy.quoteIdentifier(fk.column())
							+ " = " + strategy.quoteIdentifier(fk.referencedTable()) + "."
							+ strategy.quoteIdentifier(fk.referencedColumn()));
				}
			}
		}
		return hints;
	}

	private void appendSampleRows(StringBuilder prompt, SchemaSnapshot whitelist) {
		if (settings.sampleRowsPerTable() == 0) {
			return;
		}
		boolean header = false;
		for (TableSchema table : whitelist.tables()) {
			if (table.sampleRows().isEmpty()) {
				continue;
			}
			if (!header) {
				prompt.append("SAMPLE ROWS (value formats only):\n");
				header = true;
			}
			prompt.append(table.name()).append(":\n");
			table.sampleRows().stream()
					.limit(settings.sampleRowsPerTable())
					.forEach(row -> prompt.append("  ").append(renderRow(row)).append("\n"));
		}
		if (header) {
			prompt.append("\n");
		}
	}

	private static String renderRow(Map<String, Object> row) {
		return row.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.collect(Collectors.joining(", ", "{", "}"));
	}
}
