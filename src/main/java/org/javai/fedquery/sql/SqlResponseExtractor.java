package org.javai.fedquery.sql;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.fedquery.ai.ParsedResponse;
import org.javai.fedquery.ai.StructuredResponseParser;

/**
 * Pulls the SQL statement out of a model reply: a fenced code block, a JSON {@code sql} field, or
 * the text from the first {@code SELECT}/{@code WITH} onwards.
 */
public class SqlResponseExtractor {

	private static final Pattern FENCED = Pattern.compile("```[a-zA-Z]*\\s*(.*?)```", Pattern.DOTALL);
	private static final Pattern STATEMENT_START = Pattern.compile(
			"\\b(?:SELECT\\b|WITH\\s+\\w+\\s+AS\\s*\\()", Pattern.CASE_INSENSITIVE);

	private final StructuredResponseParser parser = new StructuredResponseParser();

	public Optional<String> extract(String response) {
		if (response == null || response.isBlank()) {
			return Optional.empty();
		}
		Matcher fenced = FENCED.matcher(response);
		if (fenced.find()) {
			return nonBlank(fenced.group(1));
		}
		if (parser.parse(response) instanceof ParsedResponse.ParsedStructured structured) {
			String sql = structured.text("sql");
			if (sql != null) {
				return nonBlank(sql);
			}
		}
		Matcher start = STATEMENT_START.matcher(response);
		if (start.find()) {
			return nonBlank(response.substring(start.start()));
		}
		return Optional.empty();
	}

	private static Optional<String> nonBlank(String text) {
		String trimmed = text.trim();
		return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
	}
}
