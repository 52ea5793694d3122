package org.javai.fedquery.exec;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by one statement, each row keyed by column label in select order.
 *
 * @param columns column labels in select order
 * @param rows the rows read, at most the requested row cap
 * @param truncated whether the database had more rows than were read
 */
public record TabularResult(List<String> columns, List<Map<String, Object>> rows, boolean truncated) {

	public TabularResult {
		columns = columns != null ? List.copyOf(columns) : List.of();
		rows = rows != null ? List.copyOf(rows) : List.of();
	}

	public static TabularResult empty() {
		return new TabularResult(List.of(), List.of(), false);
	}

	public int rowCount() {
		return rows.size();
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}
}
