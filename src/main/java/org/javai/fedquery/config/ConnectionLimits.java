package org.javai.fedquery.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Resolves the row cap and timeout in force for a database, falling back to the execution
 * defaults for databases that configure neither.
 */
public class ConnectionLimits {

	private final FederationSettings settings;

	public ConnectionLimits(FederationSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public int maxRows(String databaseId) {
		return settings.connection(databaseId)
				.map(c -> c.effectiveMaxRows(settings.execution()))
				.orElse(settings.execution().defaultMaxRows());
	}

	public Duration timeout(String databaseId) {
		return settings.connection(databaseId)
				.map(c -> c.effectiveTimeout(settings.execution()))
				.orElse(settings.execution().defaultTimeout());
	}
}
