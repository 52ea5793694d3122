package org.javai.fedquery.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of one table: its columns, outgoing foreign keys, a bounded set of sample rows and the
 * row count observed at refresh time.
 */
public record TableSchema(
		String name,
		List<ColumnSchema> columns,
		List<ForeignKey> foreignKeys,
		List<Map<String, Object>> sampleRows,
		long rowCount
) {

	public TableSchema {
		Objects.requireNonNull(name, "name must not be null");
		columns = columns != null ? List.copyOf(columns) : List.of();
		foreignKeys = foreignKeys != null ? List.copyOf(foreignKeys) : List.of();
		sampleRows = sampleRows != null ? List.copyOf(sampleRows) : List.of();
	}

	public boolean matchesName(String candidate) {
		return candidate != null && name.equalsIgnoreCase(candidate);
	}

	public Optional<ColumnSchema> findColumn(String columnName) {
		return columns.stream().filter(c -> c.matchesName(columnName)).findFirst();
	}

	public boolean hasColumn(String columnName) {
		return findColumn(columnName).isPresent();
	}

	public List<ColumnSchema> primaryKeyColumns() {
		return columns.stream().filter(ColumnSchema::primaryKey).toList();
	}

	public boolean isForeignKeyColumn(String columnName) {
		return foreignKeys.stream().anyMatch(fk -> fk.column().equalsIgnoreCase(columnName));
	}
}
