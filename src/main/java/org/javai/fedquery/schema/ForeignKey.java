package org.javai.fedquery.schema;

import java.util.Objects;

/**
 * A foreign key from a column of the owning table to a column of another table in the same
 * database.
 */
public record ForeignKey(String column, String referencedTable, String referencedColumn) {

	public ForeignKey {
		Objects.requireNonNull(column, "column must not be null");
		Objects.requireNonNull(referencedTable, "referencedTable must not be null");
		Objects.requireNonNull(referencedColumn, "referencedColumn must not be null");
	}
}
