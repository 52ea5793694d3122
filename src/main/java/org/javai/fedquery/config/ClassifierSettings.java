package org.javai.fedquery.config;

/**
 * Calibration constants of the query-intent classifier.
 *
 * @param informationScore heuristic score at which a query is informational
 * @param longQueryInformationScore score required for long queries that carry question punctuation
 * @param longQueryMinTokens token count from which a punctuated query counts as long
 * @param shortQueryMaxTokens largest token count of a query treated as small talk
 * @param shortQueryMaxChars largest character length of a query treated as small talk
 * @param overrideMinChars length above which a punctuated AI "conversation" verdict is overridden
 * @param overrideMinTokens token count from which a punctuated AI "conversation" verdict is overridden
 * @param minAiTokens lower bound of search tokens requested from the model
 * @param maxAiTokens upper bound of search tokens requested from the model
 * @param historyMaxChars characters of conversation history sent with the classification prompt
 */
public record ClassifierSettings(
		int informationScore,
		int longQueryInformationScore,
		int longQueryMinTokens,
		int shortQueryMaxTokens,
		int shortQueryMaxChars,
		int overrideMinChars,
		int overrideMinTokens,
		int minAiTokens,
		int maxAiTokens,
		int historyMaxChars
) {

	public static final int DEFAULT_INFORMATION_SCORE = 3;
	public static final int DEFAULT_LONG_QUERY_INFORMATION_SCORE = 4;
	public static final int DEFAULT_LONG_QUERY_MIN_TOKENS = 6;
	public static final int DEFAULT_SHORT_QUERY_MAX_TOKENS = 2;
	public static final int DEFAULT_SHORT_QUERY_MAX_CHARS = 25;
	public static final int DEFAULT_OVERRIDE_MIN_CHARS = 40;
	public static final int DEFAULT_OVERRIDE_MIN_TOKENS = 6;
	public static final int DEFAULT_MIN_AI_TOKENS = 8;
	public static final int DEFAULT_MAX_AI_TOKENS = 12;
	public static final int DEFAULT_HISTORY_MAX_CHARS = 400;

	public ClassifierSettings {
		if (informationScore < 1 || longQueryInformationScore < informationScore) {
			throw new IllegalArgumentException("informationScore must be >= 1 and <= longQueryInformationScore");
		}
		if (minAiTokens < 1 || maxAiTokens < minAiTokens) {
			throw new IllegalArgumentException("AI token bounds must satisfy 1 <= min <= max");
		}
		if (shortQueryMaxTokens < 0 || shortQueryMaxChars < 0 || historyMaxChars < 0) {
			throw new IllegalArgumentException("classifier limits must be non-negative");
		}
	}

	public static ClassifierSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		private int informationScore = DEFAULT_INFORMATION_SCORE;
		private int longQueryInformationScore = DEFAULT_LONG_QUERY_INFORMATION_SCORE;
		private int longQueryMinTokens = DEFAULT_LONG_QUERY_MIN_TOKENS;
		private int shortQueryMaxTokens = DEFAULT_SHORT_QUERY_MAX_TOKENS;
		private int shortQueryMaxChars = DEFAULT_SHORT_QUERY_MAX_CHARS;
		private int overrideMinChars = DEFAULT_OVERRIDE_MIN_CHARS;
		private int overrideMinTokens = DEFAULT_OVERRIDE_MIN_TOKENS;
		private int minAiTokens = DEFAULT_MIN_AI_TOKENS;
		private int maxAiTokens = DEFAULT_MAX_AI_TOKENS;
		private int historyMaxChars = DEFAULT_HISTORY_MAX_CHARS;

		public Builder informationScore(int value) {
			this.informationScore = value;
			return this;
		}

		public Builder longQueryInformationScore(int value) {
			this.longQueryInformationScore = value;
			return this;
		}

		public Builder longQueryMinTokens(int value) {
			this.longQueryMinTokens = value;
			return this;
		}

		public Builder shortQueryMaxTokens(int value) {
			this.shortQueryMaxTokens = value;
			return this;
		}

		public Builder shortQueryMaxChars(int value) {
			this.shortQueryMaxChars = value;
			return this;
		}

		public Builder overrideMinChars(int value) {
			this.overrideMinChars = value;
			return this;
		}

		public Builder overrideMinTokens(int value) {
			this.overrideMinTokens = value;
			return this;
		}

		public Builder aiTokenBounds(int min, int max) {
			this.minAiTokens = min;
			this.maxAiTokens = max;
			return this;
		}

		public Builder historyMaxChars(int value) {
			this.historyMaxChars = value;
			return this;
		}

		public ClassifierSettings build() {
			return new ClassifierSettings(informationScore, longQueryInformationScore, longQueryMinTokens,
					shortQueryMaxTokens, shortQueryMaxChars, overrideMinChars, overrideMinTokens,
					minAiTokens, maxAiTokens, historyMaxChars);
		}
	}
}
