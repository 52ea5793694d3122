package org.javai.fedquery.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.fedquery.exec.TabularResult;

/**
 * Renders rows as a tab-separated table headed by a row count and column list.
 */
public final class ResultTableRenderer {

	private ResultTableRenderer() {
	}

	public static String render(TabularResult result) {
		if (result.isEmpty()) {
			return "No rows found\n";
		}
		StringBuilder sb = new StringBuilder();
		sb.append("Total rows: ").append(result.rowCount());
		if (result.truncated()) {
			sb.append(" (truncated)");
		}
		sb.append(" | Columns: ").append(String.join(", ", result.columns())).append("\n");
		sb.append(String.join("\t", result.columns())).append("\n");
		for (Map<String, Object> row : result.rows()) {
			List<String> values = new ArrayList<>();
			for (String column : result.columns()) {
				Object value = row.get(column);
				values.add(value != null ? value.toString() : "NULL");
			}
			sb.append(String.join("\t", values)).append("\n");
		}
		return sb.toString();
	}
}
