package org.javai.fedquery.config;

/**
 * Confidence bands that decide which retrieval paths run for an informational query.
 *
 * <p>Confidence above {@code highConfidence} is high, confidence below {@code lowConfidence} is
 * low, and everything in between (both bounds inclusive) is medium. The default bands are
 * calibration values and are expected to be tuned per deployment.</p>
 *
 * @param highConfidence exclusive lower bound of the high bucket
 * @param lowConfidence exclusive upper bound of the low bucket
 */
public record RoutingThresholds(double highConfidence, double lowConfidence) {

	public static final double DEFAULT_HIGH_CONFIDENCE = 0.7;
	public static final double DEFAULT_LOW_CONFIDENCE = 0.3;

	public RoutingThresholds {
		if (lowConfidence < 0.0 || highConfidence > 1.0) {
			throw new IllegalArgumentException("confidence thresholds must lie within [0, 1]");
		}
		if (lowConfidence > highConfidence) {
			throw new IllegalArgumentException("lowConfidence must not exceed highConfidence");
		}
	}

	public static RoutingThresholds defaults() {
		return new RoutingThresholds(DEFAULT_HIGH_CONFIDENCE, DEFAULT_LOW_CONFIDENCE);
	}
}
