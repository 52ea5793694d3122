package org.javai.fedquery.analysis;

import java.util.Objects;
import org.javai.fedquery.config.RoutingThresholds;

/**
 * Maps analysis confidence to the retrieval paths that run.
 *
 * <ul>
 *   <li>above the high threshold: databases only when at least one database was selected,
 *   documents only otherwise</li>
 *   <li>between the thresholds (inclusive): databases and documents, merged</li>
 *   <li>below the low threshold: documents only</li>
 * </ul>
 */
public class RoutingPolicy {

	private final RoutingThresholds thresholds;

	public RoutingPolicy(RoutingThresholds thresholds) {
		this.thresholds = Objects.requireNonNull(thresholds, "thresholds must not be null");
	}

	public ConfidenceBucket bucketFor(double confidence) {
		if (confidence > thresholds.highConfidence()) {
			return ConfidenceBucket.HIGH;
		}
		if (confidence >= thresholds.lowConfidence()) {
			return ConfidenceBucket.MEDIUM;
		}
		return ConfidenceBucket.LOW;
	}

	public Route route(QueryIntent intent) {
		return switch (bucketFor(intent.confidence())) {
			case HIGH -> intent.databaseQueries().isEmpty() ? Route.DOCUMENT_ONLY : Route.DATABASE_ONLY;
			case MEDIUM -> Route.HYBRID;
			case LOW -> Route.DOCUMENT_ONLY;
		};
	}
}
