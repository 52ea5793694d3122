package org.javai.fedquery.merge;

import java.util.List;
import java.util.Objects;
import org.javai.fedquery.analysis.ConfidenceBucket;
import org.javai.fedquery.analysis.Route;

/**
 * The final answer of a request.
 *
 * @param answer answer text
 * @param sources every database and document consulted, failures included
 * @param confidenceBucket bucket of the analysis confidence, null for conversation answers
 * @param route the path the request took
 * @param executionTimeMs wall time of the request
 * @param conversationReset whether the request started a new conversation
 */
public record MergedAnswer(
		String answer,
		List<Source> sources,
		ConfidenceBucket confidenceBucket,
		Route route,
		long executionTimeMs,
		boolean conversationReset
) {

	public MergedAnswer {
		Objects.requireNonNull(answer, "answer must not be null");
		Objects.requireNonNull(route, "route must not be null");
		sources = sources != null ? List.copyOf(sources) : List.of();
	}

	public static MergedAnswer conversation(String answer) {
		return new MergedAnswer(answer, List.of(), null, Route.CONVERSATION, 0, false);
	}

	public MergedAnswer withExecutionTime(long millis) {
		return new MergedAnswer(answer, sources, confidenceBucket, route, millis, conversationReset);
	}

	public MergedAnswer withConversationReset(boolean reset) {
		return new MergedAnswer(answer, sources, confidenceBucket, route, executionTimeMs, reset);
	}

	public List<Source> sourcesOfType(SourceType type) {
		return sources.stream().filter(s -> s.type() == type).toList();
	}
}
