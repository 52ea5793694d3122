package org.javai.fedquery.merge;

import java.util.List;

/**
 * Searches the document store. Implementations may throw any runtime exception; the pipeline
 * records it as a failed document source.
 */
@FunctionalInterface
public interface DocumentSearch {

	List<DocumentChunk> search(String query, int maxResults);
}
