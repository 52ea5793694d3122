package org.javai.fedquery.sql;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.javai.fedquery.schema.DatabaseDialect;

/**
 * Lookup of the {@link DialectStrategy} for each supported dialect.
 */
public class DialectStrategyRegistry {

	private final Map<DatabaseDialect, DialectStrategy> strategies = new EnumMap<>(DatabaseDialect.class);

	/**
	 * A registry holding the built-in strategy of every dialect.
	 */
	public static DialectStrategyRegistry defaults() {
		return new DialectStrategyRegistry()
				.register(new PostgreSqlDialectStrategy())
				.register(new MySqlDialectStrategy())
				.register(new SqliteDialectStrategy())
				.register(new SqlServerDialectStrategy());
	}

	/**
	 * Register a strategy, replacing any strategy registered for the same dialect.
	 */
	public DialectStrategyRegistry register(DialectStrategy strategy) {
		Objects.requireNonNull(strategy, "strategy must not be null");
		strategies.put(strategy.dialect(), strategy);
		return this;
	}

	/**
	 * @throws IllegalArgumentException if no strategy is registered for the dialect
	 */
	public DialectStrategy forDialect(DatabaseDialect dialect) {
		DialectStrategy strategy = strategies.get(dialect);
		if (strategy == null) {
			throw new IllegalArgumentException("No dialect strategy registered for " + dialect);
		}
		return strategy;
	}
}
