package org.javai.fedquery.intent;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.fedquery.config.ClassifierSettings;

/**
 * Pure scoring of a query's structural shape. Performs no I/O and holds no mutable state.
 *
 * <p>One point is awarded for each signal present:</p>
 * <ul>
 *   <li>question punctuation in any script</li>
 *   <li>a Unicode decimal digit</li>
 *   <li>two or more numeric groups</li>
 *   <li>five or more tokens</li>
 *   <li>an arithmetic, comparison or currency symbol</li>
 *   <li>a date or time</li>
 *   <li>a numeric range or list</li>
 *   <li>an ID-like token</li>
 * </ul>
 */
public class HeuristicScorer {

	private static final Pattern QUESTION = Pattern.compile("[?¿؟？]");
	private static final Pattern DIGIT = Pattern.compile("\\p{Nd}");
	private static final Pattern NUMERIC_GROUP = Pattern.compile("\\p{Nd}+");
	private static final Pattern SYMBOL = Pattern.compile("[><=+\\-*/%€$£¥₺]");
	private static final Pattern DATE = Pattern.compile("\\b\\p{Nd}{4}[-/.]\\p{Nd}{1,2}[-/.]\\p{Nd}{1,2}\\b");
	private static final Pattern TIME = Pattern.compile("\\b\\p{Nd}{1,2}:\\p{Nd}{2}(?::\\p{Nd}{2})?\\b");
	private static final Pattern RANGE = Pattern.compile("\\b\\p{Nd}+\\s*[-–—]\\s*\\p{Nd}+\\b");
	private static final Pattern LIST = Pattern.compile("\\b\\p{Nd}+\\s*,\\s*\\p{Nd}+(?:\\s*,\\s*\\p{Nd}+)+\\b");
	private static final Pattern ID_LIKE = Pattern.compile("\\p{L}*\\p{Nd}+[\\p{L}\\p{Nd}_-]*");
	private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{P}\\p{S}]+|[\\p{P}\\p{S}]+$");

	private static final int MANY_TOKENS = 5;

	private final ClassifierSettings settings;

	public HeuristicScorer(ClassifierSettings settings) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public HeuristicVerdict score(String query) {
		String trimmed = query == null ? "" : query.trim();
		List<String> tokens = QueryTokens.words(trimmed);

		boolean question = QUESTION.matcher(trimmed).find();
		boolean digit = DIGIT.matcher(trimmed).find();
		boolean numericGroups = countMatches(NUMERIC_GROUP, trimmed) >= 2;
		boolean manyTokens = tokens.size() >= MANY_TOKENS;
		boolean symbol = SYMBOL.matcher(trimmed).find();
		boolean dateOrTime = DATE.matcher(trimmed).find() || TIME.matcher(trimmed).find();
		boolean rangeOrList = RANGE.matcher(trimmed).find() || LIST.matcher(trimmed).find();
		boolean idLike = tokens.stream()
				.map(t -> EDGE_PUNCTUATION.matcher(t).replaceAll(""))
				.anyMatch(t -> ID_LIKE.matcher(t).matches());

		int score = count(question, digit, numericGroups, manyTokens, symbol, dateOrTime, rangeOrList, idLike);
		boolean numericOrId = digit || symbol || dateOrTime || rangeOrList || idLike;

		HeuristicDecision decision;
		if (tokens.size() <= settings.shortQueryMaxTokens()
				&& trimmed.length() <= settings.shortQueryMaxChars()
				&& !numericOrId) {
			decision = HeuristicDecision.CONVERSATION;
		} else if (score >= requiredScore(question, tokens.size())) {
			decision = HeuristicDecision.INFORMATION;
		} else {
			decision = HeuristicDecision.UNKNOWN;
		}
		return new HeuristicVerdict(decision, score, tokens.size(), trimmed.length(), question, numericOrId);
	}

	/**
	 * Whether the query's shape alone is a strong indication of a data request, strong enough to
	 * overrule a model's conversation verdict.
	 */
	public boolean strongInformationShape(HeuristicVerdict verdict) {
		return verdict.questionPunctuation()
				&& verdict.length() > settings.overrideMinChars()
				&& verdict.tokenCount() >= settings.overrideMinTokens();
	}

	private int requiredScore(boolean question, int tokenCount) {
		if (question && tokenCount >= settings.longQueryMinTokens()) {
			return settings.longQueryInformationScore();
		}
		return settings.informationScore();
	}

	private static int countMatches(Pattern pattern, String text) {
		Matcher matcher = pattern.matcher(text);
		int count = 0;
		while (matcher.find()) {
			count++;
		}
		return count;
	}

	private static int count(boolean... signals) {
		int total = 0;
		for (boolean signal : signals) {
			if (signal) {
				total++;
			}
		}
		return total;
	}
}
