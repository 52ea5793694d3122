package org.javai.fedquery.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.fedquery.schema.CrossDatabaseMapping;
import org.javai.fedquery.schema.DatabaseDialect;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link FederationSettings} from YAML.
 *
 * <p>Every key is optional; missing sections fall back to the built-in defaults. Example:</p>
 *
 * <pre>
 * routing:
 *   high_confidence: 0.7
 *   low_confidence: 0.3
 * execution:
 *   default_timeout_seconds: 30
 *   default_max_rows: 100
 * connections:
 *   - id: sales
 *     dialect: postgresql
 *     jdbc_url: jdbc:postgresql://localhost/sales
 *     max_rows: 50
 *     excluded_tables: [audit_log]
 * </pre>
 */
public class FederationSettingsLoader {

	public static final String DEFAULTS_RESOURCE = "fedquery-defaults.yml";

	private final Yaml yaml = new Yaml();

	/**
	 * Load the settings bundled on the classpath.
	 */
	public FederationSettings loadDefaults() {
		InputStream stream = FederationSettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
		if (stream == null) {
			return FederationSettings.defaults();
		}
		try (stream) {
			return parse(stream);
		} catch (FederationConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new FederationConfigException("Failed to read " + DEFAULTS_RESOURCE, e);
		}
	}

	public FederationSettings parse(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (FederationConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new FederationConfigException("Failed to read federation settings from path: " + path, e);
		}
	}

	public FederationSettings parse(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return build(data);
		} catch (FederationConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new FederationConfigException("Failed to read federation settings from input stream", e);
		}
	}

	public FederationSettings parse(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return build(data);
		} catch (FederationConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new FederationConfigException("Failed to read federation settings from reader", e);
		}
	}

	public FederationSettings parseString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return build(data);
		} catch (FederationConfigException e) {
			throw e;
		} catch (Exception e) {
			throw new FederationConfigException("Failed to read federation settings from string", e);
		}
	}

	private FederationSettings build(Map<String, Object> data) {
		FederationSettings defaults = FederationSettings.defaults();
		if (data == null) {
			return defaults;
		}
		try {
			return new FederationSettings(
					buildRouting(section(data, "routing"), defaults.routing()),
					buildClassifier(section(data, "classifier"), defaults.classifier()),
					buildAnalysis(section(data, "analysis"), defaults.analysis()),
					buildSynthesis(section(data, "synthesis"), defaults.synthesis()),
					buildExecution(section(data, "execution"), defaults.execution()),
					intValue(section(data, "documents"), "max_results", defaults.maxDocumentResults()),
					buildConnections(data.get("connections")));
		} catch (IllegalArgumentException | ClassCastException | NullPointerException e) {
			throw new FederationConfigException("Invalid federation settings: " + e.getMessage(), e);
		}
	}

	private RoutingThresholds buildRouting(Map<String, Object> map, RoutingThresholds defaults) {
		return new RoutingThresholds(
				doubleValue(map, "high_confidence", defaults.highConfidence()),
				doubleValue(map, "low_confidence", defaults.lowConfidence()));
	}

	private ClassifierSettings buildClassifier(Map<String, Object> map, ClassifierSettings defaults) {
		return ClassifierSettings.builder()
				.informationScore(intValue(map, "information_score", defaults.informationScore()))
				.longQueryInformationScore(intValue(map, "long_query_information_score", defaults.longQueryInformationScore()))
				.longQueryMinTokens(intValue(map, "long_query_min_tokens", defaults.longQueryMinTokens()))
				.shortQueryMaxTokens(intValue(map, "short_query_max_tokens", defaults.shortQueryMaxTokens()))
				.shortQueryMaxChars(intValue(map, "short_query_max_chars", defaults.shortQueryMaxChars()))
				.overrideMinChars(intValue(map, "override_min_chars", defaults.overrideMinChars()))
				.overrideMinTokens(intValue(map, "override_min_tokens", defaults.overrideMinTokens()))
				.aiTokenBounds(intValue(map, "min_ai_tokens", defaults.minAiTokens()),
						intValue(map, "max_ai_tokens", defaults.maxAiTokens()))
				.historyMaxChars(intValue(map, "history_max_chars", defaults.historyMaxChars()))
				.build();
	}

	private AnalysisSettings buildAnalysis(Map<String, Object> map, AnalysisSettings defaults) {
		return new AnalysisSettings(
				intValue(map, "max_tables_per_database", defaults.maxTablesPerDatabase()),
				intValue(map, "max_columns_per_table", defaults.maxColumnsPerTable()),
				doubleValue(map, "fallback_confidence", defaults.fallbackConfidence()),
				intValue(map, "fallback_max_tables", defaults.fallbackMaxTables()));
	}

	private SynthesisSettings buildSynthesis(Map<String, Object> map, SynthesisSettings defaults) {
		return new SynthesisSettings(
				intValue(map, "max_joins", defaults.maxJoins()),
				intValue(map, "max_where_predicates", defaults.maxWherePredicates()),
				intValue(map, "max_order_by_columns", defaults.maxOrderByColumns()),
				intValue(map, "sample_rows_per_table", defaults.sampleRowsPerTable()));
	}

	private ExecutionSettings buildExecution(Map<String, Object> map, ExecutionSettings defaults) {
		return new ExecutionSettings(
				Duration.ofSeconds(intValue(map, "default_timeout_seconds", (int) defaults.defaultTimeout().toSeconds())),
				intValue(map, "default_max_rows", defaults.defaultMaxRows()),
				intValue(map, "thread_pool_size", defaults.threadPoolSize()),
				Duration.ofSeconds(intValue(map, "ai_call_timeout_seconds", (int) defaults.aiCallTimeout().toSeconds())));
	}

	@SuppressWarnings("unchecked")
	private List<DatabaseConnectionSettings> buildConnections(Object raw) {
		List<DatabaseConnectionSettings> connections = new ArrayList<>();
		if (raw == null) {
			return connections;
		}
		if (!(raw instanceof List<?> list)) {
			throw new FederationConfigException("'connections' must be a list");
		}
		for (Object entry : list) {
			if (!(entry instanceof Map<?, ?>)) {
				throw new FederationConfigException("Each connection must be a mapping");
			}
			connections.add(buildConnection((Map<String, Object>) entry));
		}
		return connections;
	}

	private DatabaseConnectionSettings buildConnection(Map<String, Object> map) {
		String id = stringValue(map, "id", null);
		if (id == null || id.isBlank()) {
			throw new FederationConfigException("Connection is missing an 'id'");
		}
		String dialectName = stringValue(map, "dialect", null);
		if (dialectName == null) {
			throw new FederationConfigException("Connection '" + id + "' is missing a 'dialect'");
		}
		int timeoutSeconds = intValue(map, "timeout_seconds", 0);
		return new DatabaseConnectionSettings(
				id,
				stringValue(map, "name", id),
				DatabaseDialect.fromConfigValue(dialectName),
				stringValue(map, "jdbc_url", null),
				stringValue(map, "username", null),
				stringValue(map, "password", null),
				booleanValue(map, "enabled", true),
				intValue(map, "max_rows", 0),
				timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null,
				stringList(map.get("included_tables")),
				stringList(map.get("excluded_tables")),
				buildMappings(id, map.get("mappings")));
	}

	@SuppressWarnings("unchecked")
	private List<CrossDatabaseMapping> buildMappings(String sourceId, Object raw) {
		List<CrossDatabaseMapping> mappings = new ArrayList<>();
		if (!(raw instanceof List<?> list)) {
			return mappings;
		}
		for (Object entry : list) {
			Map<String, Object> map = (Map<String, Object>) entry;
			mappings.add(new CrossDatabaseMapping(
					sourceId,
					stringValue(map, "source_table", null),
					stringValue(map, "source_column", null),
					stringValue(map, "target_database", null),
					stringValue(map, "target_table", null),
					stringValue(map, "target_column", null),
					stringValue(map, "description", "Configured mapping")));
		}
		return mappings;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> section(Map<String, Object> data, String key) {
		Object value = data.get(key);
		return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
	}

	private static int intValue(Map<String, Object> map, String key, int defaultValue) {
		Object value = map.get(key);
		return value instanceof Number n ? n.intValue() : defaultValue;
	}

	private static double doubleValue(Map<String, Object> map, String key, double defaultValue) {
		Object value = map.get(key);
		return value instanceof Number n ? n.doubleValue() : defaultValue;
	}

	private static boolean booleanValue(Map<String, Object> map, String key, boolean defaultValue) {
		Object value = map.get(key);
		return value instanceof Boolean b ? b : defaultValue;
	}

	private static String stringValue(Map<String, Object> map, String key, String defaultValue) {
		Object value = map.get(key);
		return value != null ? value.toString() : defaultValue;
	}

	private static List<String> stringList(Object value) {
		if (value instanceof List<?> list) {
			return list.stream().map(String::valueOf).toList();
		}
		return List.of();
	}
}
