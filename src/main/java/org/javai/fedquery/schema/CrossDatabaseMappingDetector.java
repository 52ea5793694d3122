package org.javai.fedquery.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects key relationships between tables of different databases by column name.
 *
 * <p>For every ordered pair of schemas, each primary-key or foreign-key column of the source
 * schema is compared against the primary-key columns of the target schema. A column matches when
 * the names are equal ignoring case, or when the source column is {@code <table>_id} /
 * {@code <table>id} and the target is the {@code id} primary key of a table with that name
 * (singular or plural). Plain {@code id} to {@code id} pairs are ignored as too weak.</p>
 */
public class CrossDatabaseMappingDetector {

	private static final Logger logger = LoggerFactory.getLogger(CrossDatabaseMappingDetector.class);

	public List<CrossDatabaseMapping> detect(List<SchemaSnapshot> schemas) {
		Map<String, CrossDatabaseMapping> mappings = new LinkedHashMap<>();
		for (SchemaSnapshot source : schemas) {
			for (SchemaSnapshot target : schemas) {
				if (source.databaseId().equals(target.databaseId())) {
					continue;
				}
				for (CrossDatabaseMapping mapping : detectBetween(source, target)) {
					mappings.putIfAbsent(key(mapping), mapping);
				}
			}
		}
		logger.debug("Detected {} cross-database mappings across {} schemas", mappings.size(), schemas.size());
		return List.copyOf(mappings.values());
	}

	private List<CrossDatabaseMapping> detectBetween(SchemaSnapshot source, SchemaSnapshot target) {
		List<CrossDatabaseMapping> found = new ArrayList<>();
		for (TableSchema sourceTable : source.tables()) {
			for (ColumnSchema sourceColumn : sourceTable.columns()) {
				boolean keyColumn = sourceColumn.primaryKey() || sourceTable.isForeignKeyColumn(sourceColumn.name());
				if (!keyColumn || isBareId(sourceColumn.name())) {
					continue;
				}
				for (TableSchema targetTable : target.tables()) {
					for (ColumnSchema targetColumn : targetTable.primaryKeyColumns()) {
						if (matches(sourceColumn.name(), targetTable.name(), targetColumn.name())) {
							found.add(new CrossDatabaseMapping(
									source.databaseId(), sourceTable.name(), sourceColumn.name(),
									target.databaseId(), targetTable.name(), targetColumn.name(),
									"Detected by key column name"));
						}
					}
				}
			}
		}
		return found;
	}

	static boolean matches(String sourceColumn, String targetTable, String targetColumn) {
		String src = sourceColumn.toLowerCase(Locale.ROOT);
		String tgt = targetColumn.toLowerCase(Locale.ROOT);
		if (!isBareId(tgt)) {
			return src.equals(tgt);
		}
		String table = targetTable.toLowerCase(Locale.ROOT);
		String singular = table.endsWith("s") ? table.substring(0, table.length() - 1) : table;
		return src.equals(singular + "_id") || src.equals(singular + "id")
				|| src.equals(table + "_id") || src.equals(table + "id");
	}

	private static boolean isBareId(String column) {
		return column.equalsIgnoreCase("id");
	}

	private static String key(CrossDatabaseMapping mapping) {
		String a = mapping.sourceDatabaseId() + "." + mapping.sourceTable() + "." + mapping.sourceColumn();
		String b = mapping.targetDatabaseId() + "." + mapping.targetTable() + "." + mapping.targetColumn();
		String first = a.compareTo(b) <= 0 ? a : b;
		String second = a.compareTo(b) <= 0 ? b : a;
		return (first + "|" + second).toLowerCase(Locale.ROOT);
	}
}
