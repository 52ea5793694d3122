package org.javai.fedquery.merge;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.javai.fedquery.exec.QueryExecutionResult;
import org.javai.fedquery.exec.TabularResult;
import org.javai.fedquery.schema.CrossDatabaseMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Joins rows of results from different databases on a shared key.
 *
 * <p>The first result is the base. Every other result is joined to it on the columns of a
 * cross-database mapping between the two databases, or else on a column ending in {@code id}
 * that both results project. Results without a join key are left out; base rows without a match
 * in every joined result are dropped.</p>
 */
public class InMemoryResultJoiner {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryResultJoiner.class);

	private record JoinKey(String baseColumn, String otherColumn) {
	}

	/**
	 * @param results successful results with rows, in priority order
	 * @param mappings known cross-database mappings
	 * @return the joined rows, or empty if fewer than two results could be joined or no row matched
	 */
	public Optional<TabularResult> join(List<QueryExecutionResult> results, List<CrossDatabaseMapping> mappings) {
		if (results.size() < 2) {
			return Optional.empty();
		}
		QueryExecutionResult base = results.get(0);
		Map<QueryExecutionResult, JoinKey> joinable = new LinkedHashMap<>();
		for (QueryExecutionResult other : results.subList(1, results.size())) {
			findKey(base, other, mappings).ifPresent(key -> joinable.put(other, key));
		}
		if (joinable.isEmpty()) {
			logger.debug("No join key between {} and the other results", base.databaseId());
			return Optional.empty();
		}

		List<String> columns = new ArrayList<>(base.data().columns());
		for (QueryExecutionResult other : joinable.keySet()) {
			for (String column : other.data().columns()) {
				if (indexOfIgnoreCase(columns, column) < 0) {
					columns.add(column);
				}
			}
		}

		List<Map<String, Object>> rows = new ArrayList<>();
		for (Map<String, Object> baseRow : base.data().rows()) {
			Map<String, Object> merged = joinRow(baseRow, joinable);
			if (merged != null) {
				rows.add(merged);
			}
		}
		logger.info("Joined {} base rows from {} with {} other results: {} rows", base.rowCount(),
				base.databaseId(), joinable.size(), rows.size());
		return rows.isEmpty() ? Optional.empty() : Optional.of(new TabularResult(columns, rows, false));
	}

	private Map<String, Object> joinRow(Map<String, Object> baseRow, Map<QueryExecutionResult, JoinKey> joinable) {
		Map<String, Object> merged = new LinkedHashMap<>(baseRow);
		for (Map.Entry<QueryExecutionResult, JoinKey> entry : joinable.entrySet()) {
			JoinKey key = entry.getValue();
			Object baseValue = baseRow.get(key.baseColumn());
			if (baseValue == null) {
				return null;
			}
			Map<String, Object> match = null;
			for (Map<String, Object> otherRow : entry.getKey().data().rows()) {
				if (valuesEqual(baseValue, otherRow.get(key.otherColumn()))) {
					match = otherRow;
					break;
				}
			}
			if (match == null) {
				return null;
			}
			for (Map.Entry<String, Object> cell : match.entrySet()) {
				if (indexOfIgnoreCase(new ArrayList<>(merged.keySet()), cell.getKey()) < 0) {
					merged.put(cell.getKey(), cell.getValue());
				}
			}
		}
		return merged;
	}

	private static Optional<JoinKey> findKey(QueryExecutionResult base, QueryExecutionResult other,
			List<CrossDatabaseMapping> mappings) {
		List<String> baseColumns = base.data().columns();
		List<String> otherColumns = other.data().columns();
		for (CrossDatabaseMapping mapping : mappings) {
			if (!mapping.connects(base.databaseId(), other.databaseId())) {
				continue;
			}
			int baseIndex = indexOfIgnoreCase(baseColumns, mapping.columnFor(base.databaseId()));
			int otherIndex = indexOfIgnoreCase(otherColumns, mapping.columnFor(other.databaseId()));
			if (baseIndex >= 0 && otherIndex >= 0) {
				return Optional.of(new JoinKey(baseColumns.get(baseIndex), otherColumns.get(otherIndex)));
			}
		}
		for (String column : baseColumns) {
			if (!column.toLowerCase(Locale.ROOT).endsWith("id")) {
				continue;
			}
			int otherIndex = indexOfIgnoreCase(otherColumns, column);
			if (otherIndex >= 0) {
				return Optional.of(new JoinKey(column, otherColumns.get(otherIndex)));
			}
		}
		return Optional.empty();
	}

	/**
	 * Numeric values compare by value, anything else by trimmed text ignoring case.
	 */
	static boolean valuesEqual(Object left, Object right) {
		if (left == null || right == null) {
			return false;
		}
		String l = left.toString().trim();
		String r = right.toString().trim();
		if (l.isEmpty() || r.isEmpty()) {
			return false;
		}
		BigDecimal leftNumber = toNumber(l);
		BigDecimal rightNumber = toNumber(r);
		if (leftNumber != null && rightNumber != null) {
			return leftNumber.compareTo(rightNumber) == 0;
		}
		return l.equalsIgnoreCase(r);
	}

	private static BigDecimal toNumber(String text) {
		try {
			return new BigDecimal(text);
		} catch (NumberFormatException e) {
			return null;
		}
	}

	private static int indexOfIgnoreCase(List<String> values, String wanted) {
		if (wanted == null) {
			return -1;
		}
		for (int i = 0; i < values.size(); i++) {
			if (values.get(i).equalsIgnoreCase(wanted)) {
				return i;
			}
		}
		return -1;
	}
}
