package org.javai.fedquery.merge;

import java.util.Objects;
import org.javai.fedquery.exec.QueryExecutionResult;

/**
 * Attribution of an answer to a database or a document chunk, successful or not.
 *
 * @param type database or document
 * @param identifier database name or document name
 * @param excerpt short description of what was used
 * @param rowCountOrRelevance rows returned by a database, relevance of a document chunk
 * @param success whether the source contributed
 * @param errorMessage why the source failed, null on success
 */
public record Source(
		SourceType type,
		String identifier,
		String excerpt,
		double rowCountOrRelevance,
		boolean success,
		String errorMessage
) {

	private static final int MAX_EXCERPT_LENGTH = 160;

	public Source {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(identifier, "identifier must not be null");
		excerpt = excerpt != null ? excerpt : "";
	}

	public static Source database(QueryExecutionResult result, String databaseName) {
		StringBuilder excerpt = new StringBuilder("Database: ").append(databaseName)
				.append(" | Rows: ").append(result.rowCount());
		if (result.executedSql() != null && !result.executedSql().isBlank()) {
			excerpt.append(" | Query: ").append(abbreviate(result.executedSql().replaceAll("\\s+", " ").trim()));
		}
		return new Source(SourceType.DATABASE, databaseName, excerpt.toString(), result.rowCount(),
				result.success(), result.errorMessage());
	}

	public static Source document(DocumentChunk chunk) {
		return new Source(SourceType.DOCUMENT, chunk.documentName(), abbreviate(chunk.content().trim()),
				chunk.relevanceScore(), true, null);
	}

	public static Source documentSearchFailure(String errorMessage) {
		return new Source(SourceType.DOCUMENT, "document search", "", 0, false, errorMessage);
	}

	static String abbreviate(String text) {
		return text.length() > MAX_EXCERPT_LENGTH ? text.substring(0, MAX_EXCERPT_LENGTH) + "..." : text;
	}
}
