package org.javai.fedquery.schema;

import java.util.Objects;

/**
 * A logical key relationship between columns living in two different databases.
 *
 * <p>No SQL join can cross databases, so mappings are used as join hints during synthesis (each
 * side projects its key) and as join keys when rows are combined in memory.</p>
 */
public record CrossDatabaseMapping(
		String sourceDatabaseId,
		String sourceTable,
		String sourceColumn,
		String targetDatabaseId,
		String targetTable,
		String targetColumn,
		String description
) {

	public CrossDatabaseMapping {
		Objects.requireNonNull(sourceDatabaseId, "sourceDatabaseId must not be null");
		Objects.requireNonNull(sourceTable, "sourceTable must not be null");
		Objects.requireNonNull(sourceColumn, "sourceColumn must not be null");
		Objects.requireNonNull(targetDatabaseId, "targetDatabaseId must not be null");
		Objects.requireNonNull(targetTable, "targetTable must not be null");
		Objects.requireNonNull(targetColumn, "targetColumn must not be null");
		description = description != null ? description : "";
	}

	public boolean involves(String databaseId) {
		return sourceDatabaseId.equals(databaseId) || targetDatabaseId.equals(databaseId);
	}

	public boolean connects(String firstDatabaseId, String secondDatabaseId) {
		return (sourceDatabaseId.equals(firstDatabaseId) && targetDatabaseId.equals(secondDatabaseId))
				|| (sourceDatabaseId.equals(secondDatabaseId) && targetDatabaseId.equals(firstDatabaseId));
	}

	/**
	 * @return the column on the given database's side of the mapping
	 */
	public String columnFor(String databaseId) {
		return sourceDatabaseId.equals(databaseId) ? sourceColumn : targetColumn;
	}

	public String render() {
		return sourceDatabaseId + "." + sourceTable + "." + sourceColumn
				+ " -> " + targetDatabaseId + "." + targetTable + "." + targetColumn;
	}
}
