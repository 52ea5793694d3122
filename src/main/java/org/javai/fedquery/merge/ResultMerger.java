package org.javai.fedquery.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.javai.fedquery.ai.TextGenerator;
import org.javai.fedquery.exec.QueryExecutionResult;
import org.javai.fedquery.exec.TabularResult;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines database results and document chunks into one attributed answer.
 *
 * <p>Every consulted database and document appears in the sources, failures included. When there
 * is nothing to answer from, the answer says so without calling the model; when the model fails,
 * the retrieved data is returned as is.</p>
 */
public class ResultMerger {

	private static final Logger logger = LoggerFactory.getLogger(ResultMerger.class);

	public static final String NO_DATA_ANSWER = "I could not find the answer to your question.";
	static final String DOCUMENT_ONLY_NOTE =
			"Note: no database returned data for this question, so this answer is based on documents only.";
	static final String UNSUMMARIZED_NOTE =
			"Note: the answer could not be summarized. The retrieved data is shown as is.";

	private static final Pattern CODE_BLOCK = Pattern.compile("```[a-zA-Z]*\\s*[\\s\\S]*?```");
	private static final Pattern INLINE_SELECT = Pattern.compile(
			"(?im)^\\s*SELECT\\s+.+?\\s+FROM\\s+.+$");
	private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

	private static final String INSTRUCTIONS = """
			You answer questions using ONLY the database results and document excerpts provided.
			RULES:
			- Never invent names, numbers or example data. Copy values exactly as shown.
			- If the provided data does not answer the question, say only: "%s"
			- If a descriptive column is missing, report the identifier and say the description is not available.
			- Never include SQL, code or instructions for running queries.
			- Results marked as errors contributed nothing; do not speculate about them.
			""".formatted(NO_DATA_ANSWER);

	private final TextGenerator textGenerator;
	private final InMemoryResultJoiner joiner = new InMemoryResultJoiner();

	public ResultMerger(TextGenerator textGenerator) {
		this.textGenerator = Objects.requireNonNull(textGenerator, "textGenerator must not be null");
	}

	public MergedAnswer merge(MergeRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		List<Source> sources = collectSources(request);

		List<QueryExecutionResult> withRows = request.results().values().stream()
				.filter(QueryExecutionResult::hasRows)
				.toList();
		boolean hasDocuments = !request.chunks().isEmpty();

		if (withRows.isEmpty() && !hasDocuments) {
			logger.info("No database rows and no documents for query; answering with no-data message");
			return new MergedAnswer(NO_DATA_ANSWER, sources, request.confidenceBucket(), request.route(), 0, false);
		}

		Optional<TabularResult> joined = joiner.join(withRows, request.view().mappings());
		String data = renderData(request, withRows, joined);

		String answer;
		try {
			String prompt = buildPrompt(request, data);
			logger.debug("Merge prompt:\n{}", prompt);
			answer = cleanAnswer(textGenerator.generate(prompt, INSTRUCTIONS));
			if (answer.isBlank()) {
				answer = data + "\n" + UNSUMMARIZED_NOTE;
			}
		} catch (RuntimeException e) {
			logger.warn("Answer generation failed, returning retrieved data: {}", e.getMessage());
			answer = data + "\n" + UNSUMMARIZED_NOTE;
		}

		if (withRows.isEmpty() && request.route().usesDatabases()) {
			answer = DOCUMENT_ONLY_NOTE + "\n\n" + answer;
		}
		return new MergedAnswer(answer.trim(), sources, request.confidenceBucket(), request.route(), 0, false);
	}

	private List<Source> collectSources(MergeRequest request) {
		List<Source> sources = new ArrayList<>();
		for (QueryExecutionResult result : request.results().values()) {
			sources.add(Source.database(result, databaseName(request, result.databaseId())));
		}
		for (DocumentChunk chunk : request.chunks()) {
			sources.add(Source.document(chunk));
		}
		if (request.documentSearchError() != null) {
			sources.add(Source.documentSearchFailure(request.documentSearchError()));
		}
		return sources;
	}

	private static String databaseName(MergeRequest request, String databaseId) {
		return request.view().schema(databaseId).map(SchemaSnapshot::databaseName).orElse(databaseId);
	}

	private String renderData(MergeRequest request, List<QueryExecutionResult> withRows,
			Optional<TabularResult> joined) {
		StringBuilder sb = new StringBuilder();
		if (joined.isPresent()) {
			sb.append("=== Joined across databases ===\n");
			sb.append(ResultTableRenderer.render(joined.get())).append("\n");
		}
		for (QueryExecutionResult result : withRows) {
			sb.append("=== ").append(databaseName(request, result.databaseId())).append(" ===\n");
			sb.append(ResultTableRenderer.render(result.data())).append("\n");
		}
		for (QueryExecutionResult result : request.results().values()) {
			if (!result.success()) {
				sb.append("=== ").append(databaseName(request, result.databaseId())).append(" ===\n");
				sb.append("Error: ").append(result.errorMessage()).append("\n\n");
			}
		}
		if (!request.chunks().isEmpty()) {
			sb.append("=== Documents ===\n");
			for (DocumentChunk chunk : request.chunks()) {
				sb.append("[").append(chunk.documentName()).append("] ").append(chunk.content().trim()).append("\n");
			}
		}
		return sb.toString().trim();
	}

	private static String buildPrompt(MergeRequest request, String data) {
		StringBuilder prompt = new StringBuilder();
		if (!request.history().isBlank()) {
			prompt.append("CONVERSATION SO FAR:\n").append(request.history().trim()).append("\n\n");
		}
		prompt.append("QUESTION: ").append(request.query().trim()).append("\n\n");
		prompt.append("DATA:\n").append(data).append("\n");
		return prompt.toString();
	}

	static String cleanAnswer(String answer) {
		if (answer == null) {
			return "";
		}
		String cleaned = CODE_BLOCK.matcher(answer).replaceAll("");
		cleaned = INLINE_SELECT.matcher(cleaned).replaceAll("");
		cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
		return cleaned.trim();
	}
}
