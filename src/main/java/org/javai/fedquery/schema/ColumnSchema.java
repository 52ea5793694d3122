package org.javai.fedquery.schema;

import java.util.Objects;

/**
 * A column of a table snapshot.
 *
 * @param name column name with the database's own casing
 * @param dataType vendor data type as reported by the database
 * @param primaryKey whether the column is part of the primary key
 * @param nullable whether the column accepts nulls
 */
public record ColumnSchema(String name, String dataType, boolean primaryKey, boolean nullable) {

	public ColumnSchema {
		Objects.requireNonNull(name, "name must not be null");
		dataType = dataType != null ? dataType : "unknown";
	}

	public boolean matchesName(String candidate) {
		return candidate != null && name.equalsIgnoreCase(candidate);
	}
}
