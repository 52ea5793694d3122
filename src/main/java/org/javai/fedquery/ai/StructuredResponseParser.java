package org.javai.fedquery.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient parser for model output that should contain a single JSON object.
 *
 * <p>Markdown code fences are stripped, then the substring between the first {@code '{'} and the
 * last {@code '}'} is parsed. Output without braces is treated as plain text.</p>
 */
public class StructuredResponseParser {

	private static final Logger logger = LoggerFactory.getLogger(StructuredResponseParser.class);

	private static final Pattern CODE_FENCE_PATTERN = Pattern.compile("```[a-zA-Z]*\\s*\\n?(.*?)\\s*```", Pattern.DOTALL);

	private final ObjectMapper mapper;

	public StructuredResponseParser() {
		this(new ObjectMapper());
	}

	public StructuredResponseParser(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public ParsedResponse parse(String raw) {
		if (raw == null || raw.isBlank()) {
			return new ParsedResponse.ParseFailed("empty response", raw);
		}
		String cleaned = stripCodeFences(raw);
		Optional<String> candidate = outermostObject(cleaned);
		if (candidate.isEmpty()) {
			return new ParsedResponse.ParsedPlainText(cleaned, raw);
		}
		try {
			JsonNode node = mapper.readTree(candidate.get());
			if (node == null || !node.isObject()) {
				return new ParsedResponse.ParseFailed("response is not a JSON object", raw);
			}
			return new ParsedResponse.ParsedStructured(node, raw);
		} catch (JsonProcessingException e) {
			logger.debug("Could not parse JSON from model output: {}", e.getOriginalMessage());
			return new ParsedResponse.ParseFailed("malformed JSON: " + e.getOriginalMessage(), raw);
		}
	}

	/**
	 * Remove a surrounding markdown code fence, keeping its body.
	 */
	public static String stripCodeFences(String text) {
		String trimmed = text.trim();
		Matcher matcher = CODE_FENCE_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			return matcher.group(1).trim();
		}
		return trimmed;
	}

	static Optional<String> outermostObject(String text) {
		int start = text.indexOf('{');
		int end = text.lastIndexOf('}');
		if (start < 0 || end <= start) {
			return Optional.empty();
		}
		return Optional.of(text.substring(start, end + 1));
	}
}
