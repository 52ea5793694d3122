package org.javai.fedquery.intent;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.fedquery.ai.ParsedResponse;
import org.javai.fedquery.ai.StructuredResponseParser;
import org.javai.fedquery.ai.TextGenerator;
import org.javai.fedquery.config.ClassifierSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a query is conversational or a request for information.
 *
 * <p>The heuristic pass runs first and settles most queries without a model call. Only an
 * {@link HeuristicDecision#UNKNOWN} verdict reaches the model, whose reply is parsed leniently.
 * Any failure on the model path degrades to {@link IntentClassification.Conversation}, which is
 * cheap and safe, while the information path puts load on databases.</p>
 */
public class QueryIntentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(QueryIntentClassifier.class);

	private static final String TYPE_CONVERSATION = "CONVERSATION";
	private static final String TYPE_INFORMATION = "INFORMATION";

	private final TextGenerator textGenerator;
	private final ClassifierSettings settings;
	private final HeuristicScorer scorer;
	private final StructuredResponseParser parser;

	public QueryIntentClassifier(TextGenerator textGenerator, ClassifierSettings settings) {
		this.textGenerator = Objects.requireNonNull(textGenerator, "textGenerator must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.scorer = new HeuristicScorer(settings);
		this.parser = new StructuredResponseParser();
	}

	/**
	 * Classify a query.
	 *
	 * @param query the raw user input
	 * @param conversationHistory recent history, may be null; only its tail is sent to the model
	 * @return the classification
	 * @throws UnclassifiableQueryException if the query is null, blank or has nothing to tokenize
	 */
	public IntentClassification classify(String query, String conversationHistory) {
		requireTokenizable(query);
		String trimmed = query.trim();

		HeuristicVerdict verdict = scorer.score(trimmed);
		switch (verdict.decision()) {
			case CONVERSATION -> {
				logger.debug("Classified as conversation by heuristics (score={}): {}", verdict.score(), trimmed);
				return new IntentClassification.Conversation(null, ClassificationSource.HEURISTIC);
			}
			case INFORMATION -> {
				logger.debug("Classified as information by heuristics (score={}): {}", verdict.score(), trimmed);
				return new IntentClassification.Information(QueryTokens.searchTerms(trimmed), ClassificationSource.HEURISTIC);
			}
			default -> {
				// fall through to the model
			}
		}

		IntentClassification fromModel = classifyWithModel(trimmed, conversationHistory);
		if (fromModel instanceof IntentClassification.Conversation && scorer.strongInformationShape(verdict)) {
			logger.info("Overriding conversation verdict for question-shaped query (score={}, tokens={})",
					verdict.score(), verdict.tokenCount());
			return new IntentClassification.Information(QueryTokens.searchTerms(trimmed), ClassificationSource.OVERRIDE);
		}
		return fromModel;
	}

	private IntentClassification classifyWithModel(String query, String conversationHistory) {
		String raw;
		try {
			raw = textGenerator.generate(buildUserPrompt(query, conversationHistory), buildInstructions());
		} catch (RuntimeException e) {
			logger.warn("Classification call failed, assuming conversation: {}", e.getMessage());
			return new IntentClassification.Conversation(null, ClassificationSource.DEFAULT);
		}

		ParsedResponse parsed = parser.parse(raw);
		if (parsed instanceof ParsedResponse.ParsedStructured structured) {
			String type = structured.text("type");
			if (TYPE_INFORMATION.equalsIgnoreCase(type)) {
				List<String> tokens = QueryTokens.normalize(structured.textList("tokens"));
				if (tokens.isEmpty()) {
					tokens = QueryTokens.searchTerms(query);
				}
				logger.debug("Model classified as information with {} tokens", tokens.size());
				return new IntentClassification.Information(tokens, ClassificationSource.AI);
			}
			if (TYPE_CONVERSATION.equalsIgnoreCase(type)) {
				logger.debug("Model classified as conversation");
				return new IntentClassification.Conversation(structured.text("answer"), ClassificationSource.AI);
			}
			logger.warn("Model returned unknown classification type '{}'", type);
		}
		return scanForVerdict(query, parsed.raw());
	}

	private IntentClassification scanForVerdict(String query, String raw) {
		if (raw != null && !raw.isBlank()) {
			String normalized = raw.toUpperCase(Locale.ROOT);
			if (normalized.contains(TYPE_CONVERSATION)) {
				return new IntentClassification.Conversation(null, ClassificationSource.AI_KEYWORD);
			}
			if (normalized.contains(TYPE_INFORMATION)) {
				return new IntentClassification.Information(QueryTokens.searchTerms(query), ClassificationSource.AI_KEYWORD);
			}
		}
		logger.warn("Model returned an unclear classification, assuming conversation");
		return new IntentClassification.Conversation(null, ClassificationSource.DEFAULT);
	}

	private String buildInstructions() {
		return """
				You classify user input for an assistant that answers questions from databases and documents.
				Respond with ONLY a JSON object of this shape:
				{"type": "CONVERSATION" or "INFORMATION", "tokens": ["..."], "answer": "..."}

				CONVERSATION: greetings in any language, questions about the assistant itself, small talk,
				thanks, farewells. Put a short, friendly reply in "answer" and leave "tokens" empty.

				INFORMATION: requests for data (show, list, find, count, total, compare), questions with
				informational intent, references to numbers, dates, ranges or specific records.
				For INFORMATION, "tokens" must:
				- use only words that appear in the user's input, in the user's language and casing; never translate
				- include every question word present in the input
				- include grammatical variants of the key terms (singular/plural, inflected forms)
				- contain between %d and %d entries
				Leave "answer" empty for INFORMATION.

				If unsure, answer CONVERSATION.
				""".formatted(settings.minAiTokens(), settings.maxAiTokens());
	}

	private String buildUserPrompt(String query, String conversationHistory) {
		StringBuilder prompt = new StringBuilder();
		prompt.append("User input: \"").append(query).append("\"");
		String snippet = historySnippet(conversationHistory);
		if (!snippet.isEmpty()) {
			prompt.append("\nRecent conversation: \"").append(snippet).append("\"");
		}
		return prompt.toString();
	}

	String historySnippet(String conversationHistory) {
		if (conversationHistory == null || conversationHistory.isBlank()) {
			return "";
		}
		String history = conversationHistory.strip();
		int limit = settings.historyMaxChars();
		return history.length() <= limit ? history : history.substring(history.length() - limit);
	}

	private static void requireTokenizable(String query) {
		if (query == null || query.isBlank()) {
			throw new UnclassifiableQueryException("Query must not be null or blank");
		}
		boolean tokenizable = query.codePoints().anyMatch(cp -> Character.isLetterOrDigit(cp)
				|| isPunctuationOrSymbol(Character.getType(cp)));
		if (!tokenizable) {
			throw new UnclassifiableQueryException("Query contains no letters, digits or symbols");
		}
	}

	private static boolean isPunctuationOrSymbol(int type) {
		return switch (type) {
			case Character.CONNECTOR_PUNCTUATION, Character.DASH_PUNCTUATION, Character.START_PUNCTUATION,
					Character.END_PUNCTUATION, Character.INITIAL_QUOTE_PUNCTUATION, Character.FINAL_QUOTE_PUNCTUATION,
					Character.OTHER_PUNCTUATION, Character.MATH_SYMBOL, Character.CURRENCY_SYMBOL,
					Character.MODIFIER_SYMBOL, Character.OTHER_SYMBOL -> true;
			default -> false;
		};
	}
}
