package org.javai.fedquery.ai;

/**
 * Record of a single generation attempt.
 *
 * @param modelId identifier of the model used (may be null if not specified)
 * @param tierIndex 0-based index of the tier (0 = primary, 1 = first fallback, etc.)
 * @param attemptWithinTier 1-based attempt number within this tier
 * @param outcome result of the attempt
 * @param durationMillis time taken for this attempt in milliseconds
 * @param errorDetails error message if outcome is not SUCCESS, null otherwise
 */
public record AttemptRecord(
		String modelId,
		int tierIndex,
		int attemptWithinTier,
		AttemptOutcome outcome,
		long durationMillis,
		String errorDetails
) {

	public AttemptRecord {
		if (tierIndex < 0) {
			throw new IllegalArgumentException("tierIndex must be >= 0");
		}
		if (attemptWithinTier < 1) {
			throw new IllegalArgumentException("attemptWithinTier must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}

	/**
	 * One-line description, e.g. {@code tier 1 attempt 2 [gpt-4.1-mini] PROVIDER_ERROR (rate limited)}.
	 */
	public String summary() {
		StringBuilder sb = new StringBuilder("tier ").append(tierIndex).append(" attempt ").append(attemptWithinTier);
		if (modelId != null) {
			sb.append(" [").append(modelId).append("]");
		}
		sb.append(" ").append(outcome);
		if (errorDetails != null && !errorDetails.isBlank()) {
			sb.append(" (").append(errorDetails).append(")");
		}
		return sb.toString();
	}
}
