package org.javai.fedquery.merge;

import java.util.Objects;

/**
 * A passage returned by document search.
 *
 * @param id chunk id, unique within its document
 * @param documentName name of the source document
 * @param content chunk text
 * @param relevanceScore search relevance, higher is better
 */
public record DocumentChunk(String id, String documentName, String content, double relevanceScore) {

	public DocumentChunk {
		Objects.requireNonNull(id, "id must not be null");
		documentName = documentName != null ? documentName : id;
		content = content != null ? content : "";
	}
}
