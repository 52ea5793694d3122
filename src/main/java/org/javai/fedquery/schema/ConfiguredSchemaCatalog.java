package org.javai.fedquery.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.javai.fedquery.config.DatabaseConnectionSettings;

/**
 * Applies connection settings to another catalog: disabled databases are hidden and each
 * snapshot is reduced to the connection's included tables minus its excluded tables.
 *
 * <p>Databases without connection settings are passed through unchanged.</p>
 */
public class ConfiguredSchemaCatalog implements SchemaCatalog {

	private final SchemaCatalog delegate;
	private final Map<String, DatabaseConnectionSettings> connections;

	public ConfiguredSchemaCatalog(SchemaCatalog delegate, List<DatabaseConnectionSettings> connections) {
		this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
		this.connections = Objects.requireNonNull(connections, "connections must not be null").stream()
				.collect(Collectors.toUnmodifiableMap(DatabaseConnectionSettings::id, Function.identity()));
	}

	@Override
	public Optional<SchemaSnapshot> getSchema(String databaseId) {
		return delegate.getSchema(databaseId).flatMap(this::applySettings);
	}

	@Override
	public List<SchemaSnapshot> getAllSchemas() {
		return delegate.getAllSchemas().stream()
				.map(this::applySettings)
				.flatMap(Optional::stream)
				.toList();
	}

	private Optional<SchemaSnapshot> applySettings(SchemaSnapshot snapshot) {
		DatabaseConnectionSettings settings = connections.get(snapshot.databaseId());
		if (settings == null) {
			return Optional.of(snapshot);
		}
		if (!settings.enabled()) {
			return Optional.empty();
		}
		return Optional.of(snapshot.filterTables(settings.includedTables(), settings.excludedTables()));
	}
}
