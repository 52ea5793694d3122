package org.javai.fedquery.exec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.sql.DataSource;
import org.javai.fedquery.config.DatabaseConnectionSettings;
import org.javai.fedquery.config.FederationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs statements over JDBC on read-only connections, with the statement timeout and row cap
 * applied by the driver.
 */
public class JdbcReadOnlyQueryRunner implements ReadOnlyQueryRunner, AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(JdbcReadOnlyQueryRunner.class);

	private final Map<String, DataSource> dataSources;

	public JdbcReadOnlyQueryRunner(Map<String, DataSource> dataSources) {
		Objects.requireNonNull(dataSources, "dataSources must not be null");
		this.dataSources = Map.copyOf(dataSources);
	}

	/**
	 * Create pooled data sources for every enabled connection that has a JDBC URL.
	 */
	public static JdbcReadOnlyQueryRunner fromSettings(FederationSettings settings) {
		HikariDataSourceFactory factory = new HikariDataSourceFactory();
		Map<String, DataSource> dataSources = new LinkedHashMap<>();
		for (DatabaseConnectionSettings connection : settings.enabledConnections()) {
			if (connection.jdbcUrl() != null && !connection.jdbcUrl().isBlank()) {
				dataSources.put(connection.id(), factory.create(connection));
			}
		}
		return new JdbcReadOnlyQueryRunner(dataSources);
	}

	@Override
	public TabularResult execute(String connectionId, String sql, int maxRows, Duration timeout) throws SQLException {
		DataSource dataSource = dataSources.get(connectionId);
		if (dataSource == null) {
			throw new SQLException("No data source configured for " + connectionId);
		}
		try (Connection connection = dataSource.getConnection()) {
			connection.setReadOnly(true);
			try (Statement statement = connection.createStatement()) {
				statement.setQueryTimeout(timeoutSeconds(timeout));
				// one extra row reveals truncation
				statement.setMaxRows(Math.min(maxRows, Integer.MAX_VALUE - 1) + 1);
				try (ResultSet resultSet = statement.executeQuery(sql)) {
					return read(resultSet, maxRows);
				}
			}
		}
	}

	static int timeoutSeconds(Duration timeout) {
		if (timeout == null || timeout.isZero() || timeout.isNegative()) {
			return 0;
		}
		long millis = timeout.toMillis();
		return (int) Math.max(1, (millis + 999) / 1000);
	}

	private static TabularResult read(ResultSet resultSet, int maxRows) throws SQLException {
		ResultSetMetaData metaData = resultSet.getMetaData();
		int columnCount = metaData.getColumnCount();
		List<String> columns = new ArrayList<>();
		for (int i = 1; i <= columnCount; i++) {
			columns.add(uniqueLabel(metaData.getColumnLabel(i), columns));
		}
		List<Map<String, Object>> rows = new ArrayList<>();
		boolean truncated = false;
		while (resultSet.next()) {
			if (rows.size() >= maxRows) {
				truncated = true;
				break;
			}
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 1; i <= columnCount; i++) {
				row.put(columns.get(i - 1), resultSet.getObject(i));
			}
			rows.add(row);
		}
		return new TabularResult(columns, rows, truncated);
	}

	/**
	 * Repeated labels, as in {@code SELECT c.name, p.name}, get a numeric suffix: {@code name},
	 * {@code name_2}.
	 */
	static String uniqueLabel(String label, List<String> taken) {
		String base = label != null && !label.isBlank() ? label : "column";
		String candidate = base;
		for (int suffix = 2; containsIgnoreCase(taken, candidate); suffix++) {
			candidate = base + "_" + suffix;
		}
		return candidate;
	}

	private static boolean containsIgnoreCase(List<String> values, String wanted) {
		return values.stream().anyMatch(v -> v.equalsIgnoreCase(wanted));
	}

	@Override
	public void close() {
		for (Map.Entry<String, DataSource> entry : dataSources.entrySet()) {
			if (entry.getValue() instanceof AutoCloseable closeable) {
				try {
					closeable.close();
				} catch (Exception e) {
					logger.warn("Failed to close data source {}", entry.getKey(), e);
				}
			}
		}
	}
}
