package org.javai.fedquery.analysis;

import java.util.List;
import java.util.Objects;

/**
 * The part of a federated query that targets one database.
 *
 * @param databaseId target database id
 * @param requiredTables tables of that database's schema the statement may use, with schema casing
 * @param purpose what this database contributes to the answer
 * @param priority ordering hint, lower runs first in listings
 * @param sql synthesized statement, null until synthesis succeeds
 * @param validationStatus state of {@code sql}
 * @param validationError why synthesis or validation failed, null otherwise
 */
public record DatabaseQueryIntent(
		String databaseId,
		List<String> requiredTables,
		String purpose,
		int priority,
		String sql,
		ValidationStatus validationStatus,
		String validationError
) {

	public DatabaseQueryIntent {
		Objects.requireNonNull(databaseId, "databaseId must not be null");
		requiredTables = requiredTables != null ? List.copyOf(requiredTables) : List.of();
		purpose = purpose != null ? purpose : "";
		validationStatus = validationStatus != null ? validationStatus : ValidationStatus.PENDING;
	}

	public static DatabaseQueryIntent of(String databaseId, List<String> requiredTables, String purpose, int priority) {
		return new DatabaseQueryIntent(databaseId, requiredTables, purpose, priority, null, ValidationStatus.PENDING, null);
	}

	public DatabaseQueryIntent withValidSql(String validatedSql) {
		return new DatabaseQueryIntent(databaseId, requiredTables, purpose, priority, validatedSql, ValidationStatus.VALID, null);
	}

	/**
	 * @param candidateSql the rejected statement, may be null when nothing was generated
	 * @param error why it was rejected
	 */
	public DatabaseQueryIntent withValidationFailure(String candidateSql, String error) {
		return new DatabaseQueryIntent(databaseId, requiredTables, purpose, priority, candidateSql, ValidationStatus.INVALID, error);
	}

	public boolean isExecutable() {
		return validationStatus == ValidationStatus.VALID && sql != null && !sql.isBlank();
	}
}
