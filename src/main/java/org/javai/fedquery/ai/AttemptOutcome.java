package org.javai.fedquery.ai;

/**
 * Outcome of a single text-generation attempt.
 */
public enum AttemptOutcome {
	/**
	 * The model returned non-blank content.
	 */
	SUCCESS,

	/**
	 * The call completed but the content was null or blank.
	 */
	EMPTY_RESPONSE,

	/**
	 * The provider call threw (network, quota, server error).
	 */
	PROVIDER_ERROR
}
