package org.javai.fedquery.exec;

import java.sql.SQLException;
import java.time.Duration;

/**
 * Executes one read-only statement against a named connection.
 */
public interface ReadOnlyQueryRunner {

	/**
	 * @param connectionId id of the configured database
	 * @param sql a validated SELECT statement
	 * @param maxRows rows to read at most
	 * @param timeout statement timeout
	 * @return the rows read
	 * @throws SQLException on connection, timeout or statement failure
	 */
	TabularResult execute(String connectionId, String sql, int maxRows, Duration timeout) throws SQLException;
}
