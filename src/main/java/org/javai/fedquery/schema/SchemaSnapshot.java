package org.javai.fedquery.schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only view of one database's schema as captured by a {@link SchemaCatalog}.
 *
 * <p>Snapshots are immutable. Restricting a snapshot to a subset of its tables
 * ({@link #restrictTo(Collection)}) or applying include/exclude lists
 * ({@link #filterTables(Collection, Collection)}) yields a new snapshot.</p>
 *
 * <pre>{@code
 * SchemaSnapshot sales = SchemaSnapshot.builder("sales", DatabaseDialect.POSTGRESQL)
 *     .table("customers")
 *         .column("id", "integer", true)
 *         .column("name", "varchar")
 *     .table("orders")
 *         .column("id", "integer", true)
 *         .column("customer_id", "integer")
 *         .foreignKey("customer_id", "customers", "id")
 *     .build();
 * }</pre>
 */
public record SchemaSnapshot(
		String databaseId,
		String databaseName,
		DatabaseDialect dialect,
		List<TableSchema> tables,
		Instant lastRefreshed
) {

	public SchemaSnapshot {
		Objects.requireNonNull(databaseId, "databaseId must not be null");
		Objects.requireNonNull(dialect, "dialect must not be null");
		databaseName = databaseName != null ? databaseName : databaseId;
		tables = tables != null ? List.copyOf(tables) : List.of();
		lastRefreshed = lastRefreshed != null ? lastRefreshed : Instant.EPOCH;
	}

	/**
	 * Finds a table by name, ignoring case.
	 */
	public Optional<TableSchema> findTable(String tableName) {
		if (tableName == null) {
			return Optional.empty();
		}
		String bare = stripQualifier(tableName);
		return tables.stream().filter(t -> t.matchesName(tableName) || t.matchesName(bare)).findFirst();
	}

	public boolean hasTable(String tableName) {
		return findTable(tableName).isPresent();
	}

	public List<String> tableNames() {
		return tables.stream().map(TableSchema::name).toList();
	}

	/**
	 * Returns a snapshot holding only the named tables, in the order given. Names that do not exist
	 * in this snapshot are ignored.
	 */
	public SchemaSnapshot restrictTo(Collection<String> tableNames) {
		Map<String, TableSchema> selected = new LinkedHashMap<>();
		for (String tableName : tableNames) {
			findTable(tableName).ifPresent(t -> selected.putIfAbsent(t.name().toLowerCase(Locale.ROOT), t));
		}
		return new SchemaSnapshot(databaseId, databaseName, dialect, new ArrayList<>(selected.values()), lastRefreshed);
	}

	/**
	 * Applies configured include/exclude lists. An empty include list keeps every table; excluded
	 * tables are always removed.
	 */
	public SchemaSnapshot filterTables(Collection<String> included, Collection<String> excluded) {
		Set<String> include = lowerCase(included);
		Set<String> exclude = lowerCase(excluded);
		if (include.isEmpty() && exclude.isEmpty()) {
			return this;
		}
		List<TableSchema> kept = tables.stream()
				.filter(t -> include.isEmpty() || include.contains(t.name().toLowerCase(Locale.ROOT)))
				.filter(t -> !exclude.contains(t.name().toLowerCase(Locale.ROOT)))
				.toList();
		return new SchemaSnapshot(databaseId, databaseName, dialect, kept, lastRefreshed);
	}

	private static Set<String> lowerCase(Collection<String> names) {
		if (names == null) {
			return Set.of();
		}
		return names.stream()
				.filter(Objects::nonNull)
				.map(n -> n.trim().toLowerCase(Locale.ROOT))
				.collect(Collectors.toSet());
	}

	private static String stripQualifier(String tableName) {
		int dot = tableName.lastIndexOf('.');
		return dot >= 0 ? tableName.substring(dot + 1) : tableName;
	}

	public static Builder builder(String databaseId, DatabaseDialect dialect) {
		return new Builder(databaseId, dialect);
	}

	/**
	 * Fluent builder used by schema loaders and tests.
	 */
	public static final class Builder {
		private final String databaseId;
		private final DatabaseDialect dialect;
		private String databaseName;
		private Instant lastRefreshed = Instant.now();
		private final Map<String, TableDraft> tables = new LinkedHashMap<>();
		private TableDraft current;

		private Builder(String databaseId, DatabaseDialect dialect) {
			this.databaseId = databaseId;
			this.dialect = dialect;
		}

		public Builder name(String databaseName) {
			this.databaseName = databaseName;
			return this;
		}

		public Builder lastRefreshed(Instant lastRefreshed) {
			this.lastRefreshed = lastRefreshed;
			return this;
		}

		public Builder table(String tableName) {
			current = tables.computeIfAbsent(tableName, TableDraft::new);
			return this;
		}

		public Builder rowCount(long rowCount) {
			requireTable().rowCount = rowCount;
			return this;
		}

		public Builder column(String name, String dataType) {
			return column(name, dataType, false);
		}

		public Builder column(String name, String dataType, boolean primaryKey) {
			requireTable().columns.add(new ColumnSchema(name, dataType, primaryKey, !primaryKey));
			return this;
		}

		public Builder foreignKey(String column, String referencedTable, String referencedColumn) {
			requireTable().foreignKeys.add(new ForeignKey(column, referencedTable, referencedColumn));
			return this;
		}

		public Builder sampleRow(Map<String, Object> row) {
			requireTable().sampleRows.add(new LinkedHashMap<>(row));
			return this;
		}

		public SchemaSnapshot build() {
			List<TableSchema> built = tables.values().stream()
					.map(d -> new TableSchema(d.name, d.columns, d.foreignKeys, d.sampleRows, d.rowCount))
					.toList();
			return new SchemaSnapshot(databaseId, databaseName, dialect, built, lastRefreshed);
		}

		private TableDraft requireTable() {
			if (current == null) {
				throw new IllegalStateException("table(...) must be called before adding columns");
			}
			return current;
		}
	}

	private static final class TableDraft {
		private final String name;
		private final List<ColumnSchema> columns = new ArrayList<>();
		private final List<ForeignKey> foreignKeys = new ArrayList<>();
		private final List<Map<String, Object>> sampleRows = new ArrayList<>();
		private long rowCount;

		private TableDraft(String name) {
			this.name = name;
		}
	}
}
