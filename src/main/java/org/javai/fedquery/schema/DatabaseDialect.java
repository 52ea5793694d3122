package org.javai.fedquery.schema;

import java.util.Locale;

/**
 * Database vendors the federation can address.
 */
public enum DatabaseDialect {
	POSTGRESQL("PostgreSQL"),
	MYSQL("MySQL"),
	SQLITE("SQLite"),
	SQLSERVER("SQL Server");

	private final String displayName;

	DatabaseDialect(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}

	/**
	 * Resolves a dialect from a configuration value such as {@code postgres}, {@code mssql} or
	 * {@code SqlServer}.
	 *
	 * @param value the configured name
	 * @return the matching dialect
	 * @throws IllegalArgumentException if the name is not recognised
	 */
	public static DatabaseDialect fromConfigValue(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("dialect must not be blank");
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
		return switch (normalized) {
			case "postgresql", "postgres", "pg" -> POSTGRESQL;
			case "mysql", "mariadb" -> MYSQL;
			case "sqlite" -> SQLITE;
			case "sqlserver", "mssql" -> SQLSERVER;
			default -> throw new IllegalArgumentException("Unsupported database dialect: " + value);
		};
	}
}
