package org.javai.fedquery.exec;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.javai.fedquery.config.DatabaseConnectionSettings;
import org.javai.fedquery.config.FederationConfigException;

/**
 * Creates a small read-only connection pool for a configured database.
 */
public class HikariDataSourceFactory {

	private static final int MAXIMUM_POOL_SIZE = 4;
	private static final long CONNECTION_TIMEOUT_MS = 10_000;

	public HikariDataSource create(DatabaseConnectionSettings connection) {
		if (connection.jdbcUrl() == null || connection.jdbcUrl().isBlank()) {
			throw new FederationConfigException("Connection '" + connection.id() + "' has no jdbc_url");
		}
		HikariConfig config = new HikariConfig();
		config.setJdbcUrl(connection.jdbcUrl());
		config.setUsername(connection.username());
		config.setPassword(connection.password());
		config.setReadOnly(true);
		config.setMaximumPoolSize(MAXIMUM_POOL_SIZE);
		config.setMinimumIdle(0);
		config.setConnectionTimeout(CONNECTION_TIMEOUT_MS);
		// Do not fail start-up when a database is unreachable; its queries fail individually.
		config.setInitializationFailTimeout(-1);
		config.setPoolName("fedquery-" + connection.id());
		return new HikariDataSource(config);
	}
}
