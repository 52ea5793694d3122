package org.javai.fedquery.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loose matching between query words and schema identifiers such as {@code customer_id},
 * {@code OrderDate} or {@code order_items}.
 */
public final class SchemaVocabulary {

	private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[\\p{Ll}\\p{Nd}])(?=\\p{Lu})");
	private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{Nd}]+");

	private static final Set<String> STOP_WORDS = Set.of(
			"a", "an", "the", "of", "by", "in", "on", "for", "to", "and", "or", "with", "from", "at", "per",
			"is", "are", "was", "were", "be", "me", "my", "our", "all", "any", "each", "every",
			"show", "list", "give", "get", "find", "display", "tell", "top", "first", "last",
			"what", "which", "who", "whom", "whose", "when", "where", "why", "how", "many", "much");

	private SchemaVocabulary() {
	}

	/**
	 * Lowercase fragments of an identifier, split at separators and camel-case boundaries.
	 */
	public static List<String> fragments(String identifier) {
		List<String> fragments = new ArrayList<>();
		if (identifier == null || identifier.isBlank()) {
			return fragments;
		}
		String spaced = CAMEL_BOUNDARY.matcher(identifier).replaceAll("_");
		for (String part : SEPARATORS.split(spaced)) {
			if (!part.isEmpty()) {
				fragments.add(part.toLowerCase(Locale.ROOT));
			}
		}
		return fragments;
	}

	/**
	 * Crude English singularization, enough to match {@code customers} with {@code customer}.
	 */
	public static String stem(String word) {
		String w = word.toLowerCase(Locale.ROOT);
		if (w.length() > 4 && w.endsWith("ies")) {
			return w.substring(0, w.length() - 3) + "y";
		}
		if (w.length() > 4 && (w.endsWith("sses") || w.endsWith("xes") || w.endsWith("ches") || w.endsWith("shes"))) {
			return w.substring(0, w.length() - 2);
		}
		if (w.length() > 3 && w.endsWith("s") && !w.endsWith("ss")) {
			return w.substring(0, w.length() - 1);
		}
		return w;
	}

	/**
	 * Whether a query word refers to an identifier, either to one of its fragments or to the
	 * identifier as a whole.
	 */
	public static boolean matches(String word, String identifier) {
		if (word == null || word.isBlank() || identifier == null) {
			return false;
		}
		String stemmed = stem(word);
		List<String> parts = fragments(identifier);
		if (stem(String.join("", parts)).equals(stemmed)) {
			return true;
		}
		for (String part : parts) {
			if (stem(part).equals(stemmed)) {
				return true;
			}
		}
		return false;
	}

	public static boolean isStopWord(String word) {
		return word != null && STOP_WORDS.contains(word.toLowerCase(Locale.ROOT));
	}

	/**
	 * Whether a token is worth matching against schema names: alphabetic, at least three letters,
	 * and not a stop word.
	 */
	public static boolean isContentWord(String word) {
		if (word == null || word.length() < 3 || isStopWord(word)) {
			return false;
		}
		return word.codePoints().allMatch(Character::isLetter);
	}
}
