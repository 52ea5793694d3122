package org.javai.fedquery.intent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Tokenization shared by the classifier and the analyzer.
 */
public final class QueryTokens {

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{P}\\p{S}]+|[\\p{P}\\p{S}]+$");

	private QueryTokens() {
	}

	/**
	 * Whitespace-separated words, punctuation included.
	 */
	public static List<String> words(String text) {
		if (text == null || text.isBlank()) {
			return List.of();
		}
		return List.of(WHITESPACE.split(text.trim()));
	}

	/**
	 * Ordered, unique, lowercase search terms with surrounding punctuation removed.
	 */
	public static List<String> searchTerms(String text) {
		return normalize(words(text));
	}

	/**
	 * Normalizes tokens supplied by a model or a caller the same way as {@link #searchTerms(String)}.
	 */
	public static List<String> normalize(Collection<String> tokens) {
		Set<String> unique = new LinkedHashSet<>();
		for (String token : tokens) {
			if (token == null) {
				continue;
			}
			String cleaned = EDGE_PUNCTUATION.matcher(token.trim()).replaceAll("").toLowerCase(Locale.ROOT);
			if (!cleaned.isEmpty()) {
				unique.add(cleaned);
			}
		}
		return new ArrayList<>(unique);
	}
}
