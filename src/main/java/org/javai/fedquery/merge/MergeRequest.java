package org.javai.fedquery.merge;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.fedquery.analysis.ConfidenceBucket;
import org.javai.fedquery.analysis.Route;
import org.javai.fedquery.exec.QueryExecutionResult;
import org.javai.fedquery.schema.FederatedSchemaView;

/**
 * Everything the merger combines into one answer.
 *
 * @param query the user's question
 * @param history recent conversation, may be empty
 * @param route the path the request took
 * @param confidenceBucket bucket of the analysis confidence
 * @param results execution results per database id, in priority order
 * @param chunks document chunks, empty when the document branch did not run or found nothing
 * @param documentSearchError why document search failed, null if it succeeded or did not run
 * @param view schemas and mappings of the request
 */
public record MergeRequest(
		String query,
		String history,
		Route route,
		ConfidenceBucket confidenceBucket,
		Map<String, QueryExecutionResult> results,
		List<DocumentChunk> chunks,
		String documentSearchError,
		FederatedSchemaView view
) {

	public MergeRequest {
		Objects.requireNonNull(query, "query must not be null");
		Objects.requireNonNull(route, "route must not be null");
		history = history != null ? history : "";
		results = results != null ? results : Map.of();
		chunks = chunks != null ? List.copyOf(chunks) : List.of();
		view = view != null ? view : FederatedSchemaView.of(List.of());
	}
}
