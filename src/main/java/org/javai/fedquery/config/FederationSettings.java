package org.javai.fedquery.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete configuration of the federated query pipeline.
 *
 * <p>Usually produced by {@link FederationSettingsLoader}; {@link #defaults()} gives the
 * built-in calibration with no connections.</p>
 */
public record FederationSettings(
		RoutingThresholds routing,
		ClassifierSettings classifier,
		AnalysisSettings analysis,
		SynthesisSettings synthesis,
		ExecutionSettings execution,
		int maxDocumentResults,
		List<DatabaseConnectionSettings> connections
) {

	public static final int DEFAULT_MAX_DOCUMENT_RESULTS = 5;

	public FederationSettings {
		Objects.requireNonNull(routing, "routing must not be null");
		Objects.requireNonNull(classifier, "classifier must not be null");
		Objects.requireNonNull(analysis, "analysis must not be null");
		Objects.requireNonNull(synthesis, "synthesis must not be null");
		Objects.requireNonNull(execution, "execution must not be null");
		connections = connections != null ? List.copyOf(connections) : List.of();
		if (maxDocumentResults < 0) {
			throw new IllegalArgumentException("maxDocumentResults must be >= 0");
		}
		long distinct = connections.stream().map(DatabaseConnectionSettings::id).distinct().count();
		if (distinct != connections.size()) {
			throw new IllegalArgumentException("connection ids must be unique");
		}
	}

	public static FederationSettings defaults() {
		return new FederationSettings(RoutingThresholds.defaults(), ClassifierSettings.defaults(),
				AnalysisSettings.defaults(), SynthesisSettings.defaults(), ExecutionSettings.defaults(),
				DEFAULT_MAX_DOCUMENT_RESULTS, List.of());
	}

	public Optional<DatabaseConnectionSettings> connection(String databaseId) {
		return connections.stream().filter(c -> c.id().equals(databaseId)).findFirst();
	}

	public List<DatabaseConnectionSettings> enabledConnections() {
		return connections.stream().filter(DatabaseConnectionSettings::enabled).toList();
	}

	public FederationSettings withConnections(List<DatabaseConnectionSettings> newConnections) {
		return new FederationSettings(routing, classifier, analysis, synthesis, execution, maxDocumentResults, newConnections);
	}
}
