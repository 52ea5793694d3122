package org.javai.fedquery.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.fedquery.ai.ParsedResponse;
import org.javai.fedquery.ai.StructuredResponseParser;
import org.javai.fedquery.ai.TextGenerator;
import org.javai.fedquery.config.AnalysisSettings;
import org.javai.fedquery.schema.ColumnSchema;
import org.javai.fedquery.schema.CrossDatabaseMapping;
import org.javai.fedquery.schema.FederatedSchemaView;
import org.javai.fedquery.schema.ForeignKey;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.javai.fedquery.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an informational query onto the databases and tables that can answer it.
 *
 * <p>The model proposes databases and tables; its proposal is never trusted as is:</p>
 * <ul>
 *   <li>databases absent from the schema view are dropped</li>
 *   <li>tables absent from their database are moved to the one other database that has them, or
 *   dropped</li>
 *   <li>table names are rewritten with the schema's own casing</li>
 *   <li>tables directly referenced by a foreign key of a selected table are added</li>
 *   <li>entries naming the same database are merged</li>
 * </ul>
 *
 * <p>When the model fails or proposes nothing usable, databases are selected by matching the
 * query vocabulary against table and column names.</p>
 */
public class QueryIntentAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(QueryIntentAnalyzer.class);

	private static final double DEFAULT_MODEL_CONFIDENCE = 0.5;

	private final TextGenerator textGenerator;
	private final AnalysisSettings settings;
	private final StructuredResponseParser parser = new StructuredResponseParser();
	private final SchemaVocabularyMatcher matcher = new SchemaVocabularyMatcher();

	public QueryIntentAnalyzer(TextGenerator textGenerator, AnalysisSettings settings) {
		this.textGenerator = Objects.requireNonNull(textGenerator, "textGenerator must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	/**
	 * Analyse a query against every schema in the view.
	 *
	 * @param query the original query
	 * @param tokens search tokens from classification
	 * @param view schemas and mappings of the enabled databases
	 * @return the analysed intent; never null
	 */
	public QueryIntent analyze(String query, List<String> tokens, FederatedSchemaView view) {
		Objects.requireNonNull(query, "query must not be null");
		Objects.requireNonNull(view, "view must not be null");
		List<String> searchTokens = tokens != null ? tokens : List.of();

		if (view.isEmpty()) {
			logger.info("No databases available for analysis");
			return QueryIntent.none(query, 0.0, "No databases are configured");
		}

		String raw;
		try {
			raw = textGenerator.generate(buildPrompt(query, searchTokens, view), buildInstructions());
		} catch (RuntimeException e) {
			logger.warn("Intent analysis call failed, using vocabulary fallback: {}", e.getMessage());
			return fallback(query, searchTokens, view);
		}

		ParsedResponse parsed = parser.parse(raw);
		if (!(parsed instanceof ParsedResponse.ParsedStructured structured)) {
			logger.warn("Intent analysis returned no usable JSON, using vocabulary fallback");
			return fallback(query, searchTokens, view);
		}

		JsonNode databases = structured.json().get("databases");
		boolean proposedAny = databases != null && databases.isArray() && !databases.isEmpty();
		List<DatabaseQueryIntent> intents = validate(databases, view);
		if (proposedAny && intents.isEmpty()) {
			logger.warn("None of the proposed databases or tables exist, using vocabulary fallback");
			return fallback(query, searchTokens, view);
		}

		double confidence = structured.number("confidence", DEFAULT_MODEL_CONFIDENCE);
		boolean crossDatabase = intents.size() > 1
				&& (structured.flag("requiresCrossDatabaseJoin") || spansSchemas(searchTokens, intents, view));
		QueryIntent intent = new QueryIntent(query, structured.text("understanding"), confidence, intents,
				crossDatabase, structured.text("reasoning"));
		logger.info("Analysed query: confidence={}, databases={}, crossDatabase={}",
				intent.confidence(), intent.databaseIds(), intent.requiresCrossDatabaseJoin());
		return intent;
	}

	private List<DatabaseQueryIntent> validate(JsonNode databases, FederatedSchemaView view) {
		Map<String, Draft> drafts = new LinkedHashMap<>();
		if (databases == null || !databases.isArray()) {
			return List.of();
		}
		for (JsonNode entry : databases) {
			String reference = text(entry, "databaseId");
			Optional<SchemaSnapshot> schema = view.resolve(reference);
			if (schema.isEmpty()) {
				schema = view.resolve(text(entry, "databaseName"));
			}
			if (schema.isEmpty()) {
				logger.warn("Dropping unknown database '{}' proposed by intent analysis", reference);
				continue;
			}
			String purpose = text(entry, "purpose");
			int priority = entry.path("priority").asInt(1);
			for (String table : textList(entry, "requiredTables")) {
				assignTable(table, schema.get(), view, purpose, priority, drafts);
			}
		}

		List<DatabaseQueryIntent> intents = new ArrayList<>();
		for (Draft draft : drafts.values()) {
			SchemaSnapshot schema = view.schema(draft.databaseId).orElseThrow();
			List<String> tables = expandForeignKeys(schema, draft.tables);
			intents.add(DatabaseQueryIntent.of(draft.databaseId, tables, String.join("; ", draft.purposes), draft.priority));
		}
		intents.sort(Comparator.comparingInt(DatabaseQueryIntent::priority));
		return intents;
	}

	private void assignTable(String table, SchemaSnapshot schema, FederatedSchemaView view, String purpose,
			int priority, Map<String, Draft> drafts) {
		Optional<TableSchema> found = schema.findTable(table);
		SchemaSnapshot owner = schema;
		if (found.isEmpty()) {
			List<SchemaSnapshot> others = view.schemas().stream()
					.filter(s -> !s.databaseId().equals(schema.databaseId()) && s.hasTable(table))
					.toList();
			if (others.size() != 1) {
				logger.warn("Dropping table '{}': not present in database '{}'", table, schema.databaseId());
				return;
			}
			owner = others.get(0);
			found = owner.findTable(table);
			logger.info("Moving table '{}' from database '{}' to '{}'", table, schema.databaseId(), owner.databaseId());
		}
		Draft draft = drafts.computeIfAbsent(owner.databaseId(), Draft::new);
		draft.tables.add(found.get().name());
		if (purpose != null && !draft.purposes.contains(purpose)) {
			draft.purposes.add(purpose);
		}
		draft.priority = Math.min(draft.priority, priority);
	}

	private static List<String> expandForeignKeys(SchemaSnapshot schema, Set<String> tables) {
		Set<String> expanded = new LinkedHashSet<>(tables);
		for (String tableName : tables) {
			schema.findTable(tableName).ifPresent(table -> {
				for (ForeignKey fk : table.foreignKeys()) {
					schema.findTable(fk.referencedTable()).ifPresent(ref -> {
						if (expanded.add(ref.name())) {
							logger.debug("Added table '{}' referenced by {}.{}", ref.name(), table.name(), fk.column());
						}
					});
				}
			});
		}
		return new ArrayList<>(expanded);
	}

	private boolean spansSchemas(List<String> tokens, List<DatabaseQueryIntent> intents, FederatedSchemaView view) {
		Set<String> selected = intents.stream().map(DatabaseQueryIntent::databaseId).collect(Collectors.toSet());
		List<SchemaSnapshot> schemas = view.schemas().stream().filter(s -> selected.contains(s.databaseId())).toList();
		return matcher.match(schemas, tokens).size() > 1;
	}

	QueryIntent fallback(String query, List<String> tokens, FederatedSchemaView view) {
		Map<String, List<SchemaVocabularyMatcher.TableMatch>> matches = matcher.match(view.schemas(), tokens);
		if (matches.isEmpty()) {
			logger.info("No schema matches the query vocabulary");
			return QueryIntent.none(query, 0.0, "No table or column matches the query vocabulary");
		}
		List<DatabaseQueryIntent> intents = new ArrayList<>();
		int priority = 1;
		for (Map.Entry<String, List<SchemaVocabularyMatcher.TableMatch>> entry : matches.entrySet()) {
			SchemaSnapshot schema = view.schema(entry.getKey()).orElseThrow();
			Set<String> tables = entry.getValue().stream()
					.limit(settings.fallbackMaxTables())
					.map(SchemaVocabularyMatcher.TableMatch::table)
					.collect(Collectors.toCollection(LinkedHashSet::new));
			intents.add(DatabaseQueryIntent.of(schema.databaseId(), expandForeignKeys(schema, tables),
					"Tables matching the query vocabulary", priority++));
		}
		boolean crossDatabase = intents.size() > 1;
		logger.info("Vocabulary fallback selected databases {}", matches.keySet());
		return new QueryIntent(query, query, settings.fallbackConfidence(), intents, crossDatabase,
				"Selected by matching query words against table and column names");
	}

	private String buildInstructions() {
		return """
				You route a user's question to the databases that can answer it.
				Respond with ONLY a JSON object of this shape:
				{
				  "understanding": "the question restated in one sentence",
				  "confidence": 0.0 to 1.0,
				  "requiresCrossDatabaseJoin": true or false,
				  "reasoning": "why these databases and tables",
				  "databases": [
				    {"databaseId": "...", "databaseName": "...", "requiredTables": ["..."], "purpose": "...", "priority": 1}
				  ]
				}

				Rules:
				- Use ONLY database ids and table names listed in the schema section. Never invent tables.
				- Select the smallest set of tables that answers the question.
				- Omit databases that hold nothing relevant. An empty "databases" list is allowed.
				- "confidence" is your certainty that the selected tables contain the answer.
				- Set "requiresCrossDatabaseJoin" when rows from different databases must be combined;
				  use the listed cross-database keys for that.
				""";
	}

	private String buildPrompt(String query, List<String> tokens, FederatedSchemaView view) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("User question: \"").append(query).append("\"\n");
		if (!tokens.isEmpty()) {
			prompt.append("Search terms: ").append(String.join(", ", tokens)).append("\n");
		}
		prompt.append("\nDATABASES:\n");
		for (SchemaSnapshot schema : view.schemas()) {
			prompt.append("Database: ").append(schema.databaseName())
					.append(" (id: ").append(schema.databaseId())
					.append(", dialect: ").append(schema.dialect().displayName()).append(")\n");
			List<TableSchema> tables = schema.tables();
			tables.stream().limit(settings.maxTablesPerDatabase()).forEach(table -> appendTable(prompt, table));
			if (tables.size() > settings.maxTablesPerDatabase()) {
				prompt.append("  ... ").append(tables.size() - settings.maxTablesPerDatabase()).append(" more tables\n");
			}
		}
		if (!view.mappings().isEmpty()) {
			prompt.append("\nCROSS-DATABASE KEYS:\n");
			for (CrossDatabaseMapping mapping : view.mappings()) {
				prompt.append("- ").append(mapping.render()).append("\n");
			}
		}
		return prompt.toString();
	}

	private void appendTable(StringBuilder prompt, TableSchema table) {
		prompt.append("  - ").append(table.name());
		if (table.rowCount() > 0) {
			prompt.append(" (").append(table.rowCount()).append(" rows)");
		}
		prompt.append(": ");
		List<String> columns = new ArrayList<>();
		for (ColumnSchema column : table.columns().stream().limit(settings.maxColumnsPerTable()).toList()) {
			StringBuilder c = new StringBuilder(column.name()).append(" ").append(column.dataType());
			if (column.primaryKey()) {
				c.append(" PK");
			}
			table.foreignKeys().stream()
					.filter(fk -> fk.column().equalsIgnoreCase(column.name()))
					.findFirst()
					.ifPresent(fk -> c.append(" FK->").append(fk.referencedTable()).append(".").append(fk.referencedColumn()));
			columns.add(c.toString());
		}
		prompt.append(String.join(", ", columns));
		if (table.columns().size() > settings.maxColumnsPerTable()) {
			prompt.append(", ...");
		}
		prompt.append("\n");
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull() || !value.isValueNode()) {
			return null;
		}
		String text = value.asText().trim();
		return text.isEmpty() ? null : text;
	}

	private static List<String> textList(JsonNode node, String field) {
		List<String> values = new ArrayList<>();
		JsonNode array = node.get(field);
		if (array != null && array.isArray()) {
			for (JsonNode element : array) {
				if (element.isTextual() && !element.asText().isBlank()) {
					values.add(element.asText().trim());
				}
			}
		}
		return values;
	}

	private static final class Draft {
		private final String databaseId;
		private final Set<String> tables = new LinkedHashSet<>();
		private final List<String> purposes = new ArrayList<>();
		private int priority = Integer.MAX_VALUE;

		private Draft(String databaseId) {
			this.databaseId = databaseId;
		}
	}
}
