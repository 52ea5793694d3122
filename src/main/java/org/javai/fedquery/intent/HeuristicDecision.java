package org.javai.fedquery.intent;

/**
 * Verdict of the I/O-free heuristic pass.
 */
public enum HeuristicDecision {
	CONVERSATION,
	INFORMATION,
	/**
	 * The structural signals are inconclusive; the AI pass decides.
	 */
	UNKNOWN
}
