package org.javai.fedquery.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.javai.fedquery.schema.CrossDatabaseMapping;
import org.javai.fedquery.schema.DatabaseDialect;

/**
 * Configuration of one federated database.
 *
 * <p>{@code maxRows} and {@code timeout} may be absent ({@code 0} and {@code null}); the
 * execution defaults apply then. Include and exclude lists restrict which tables the analyzer
 * may select.</p>
 */
public record DatabaseConnectionSettings(
		String id,
		String name,
		DatabaseDialect dialect,
		String jdbcUrl,
		String username,
		String password,
		boolean enabled,
		int maxRows,
		Duration timeout,
		List<String> includedTables,
		List<String> excludedTables,
		List<CrossDatabaseMapping> mappings
) {

	public DatabaseConnectionSettings {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(dialect, "dialect must not be null");
		name = name != null ? name : id;
		includedTables = includedTables != null ? List.copyOf(includedTables) : List.of();
		excludedTables = excludedTables != null ? List.copyOf(excludedTables) : List.of();
		mappings = mappings != null ? List.copyOf(mappings) : List.of();
		if (maxRows < 0) {
			throw new IllegalArgumentException("maxRows must be >= 0");
		}
	}

	public int effectiveMaxRows(ExecutionSettings defaults) {
		return maxRows > 0 ? maxRows : defaults.defaultMaxRows();
	}

	public Duration effectiveTimeout(ExecutionSettings defaults) {
		return timeout != null && !timeout.isZero() && !timeout.isNegative() ? timeout : defaults.defaultTimeout();
	}

	/**
	 * Minimal enabled connection, used where only an id and dialect matter.
	 */
	public static DatabaseConnectionSettings of(String id, DatabaseDialect dialect) {
		return new DatabaseConnectionSettings(id, id, dialect, null, null, null, true, 0, null,
				List.of(), List.of(), List.of());
	}
}
