package org.javai.fedquery.intent;

/**
 * Output of {@link HeuristicScorer}: the decision plus the facts it was derived from.
 *
 * @param decision the heuristic decision
 * @param score number of structural signals present
 * @param tokenCount whitespace-separated tokens in the query
 * @param length character length of the trimmed query
 * @param questionPunctuation whether question punctuation of any script is present
 * @param numericOrIdSignal whether digits, symbols, dates, ranges or ID-like tokens are present
 */
public record HeuristicVerdict(
		HeuristicDecision decision,
		int score,
		int tokenCount,
		int length,
		boolean questionPunctuation,
		boolean numericOrIdSignal
) {
}
