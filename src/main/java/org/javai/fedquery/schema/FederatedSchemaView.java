package org.javai.fedquery.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The schemas and cross-database mappings visible to one request.
 *
 * <p>Captured once at the start of a request so every stage reasons over the same snapshots, even
 * if the catalog is refreshed concurrently.</p>
 */
public record FederatedSchemaView(List<SchemaSnapshot> schemas, List<CrossDatabaseMapping> mappings) {

	public FederatedSchemaView {
		schemas = schemas != null ? List.copyOf(schemas) : List.of();
		mappings = mappings != null ? List.copyOf(mappings) : List.of();
	}

	/**
	 * Capture the current schemas of a catalog together with detected and configured mappings.
	 * Configured mappings that reference a database not in the catalog are ignored.
	 */
	public static FederatedSchemaView capture(SchemaCatalog catalog, CrossDatabaseMappingDetector detector,
			List<CrossDatabaseMapping> configuredMappings) {
		Objects.requireNonNull(catalog, "catalog must not be null");
		List<SchemaSnapshot> schemas = catalog.getAllSchemas();
		List<CrossDatabaseMapping> mappings = new ArrayList<>();
		if (configuredMappings != null) {
			for (CrossDatabaseMapping mapping : configuredMappings) {
				if (contains(schemas, mapping.sourceDatabaseId()) && contains(schemas, mapping.targetDatabaseId())) {
					mappings.add(mapping);
				}
			}
		}
		if (detector != null && schemas.size() > 1) {
			mappings.addAll(detector.detect(schemas));
		}
		return new FederatedSchemaView(schemas, mappings);
	}

	public static FederatedSchemaView of(List<SchemaSnapshot> schemas) {
		return new FederatedSchemaView(schemas, List.of());
	}

	public boolean isEmpty() {
		return schemas.isEmpty();
	}

	public Optional<SchemaSnapshot> schema(String databaseId) {
		return schemas.stream().filter(s -> s.databaseId().equals(databaseId)).findFirst();
	}

	/**
	 * Resolve a database reference that may use a different case or the display name.
	 */
	public Optional<SchemaSnapshot> resolve(String reference) {
		if (reference == null || reference.isBlank()) {
			return Optional.empty();
		}
		Optional<SchemaSnapshot> exact = schema(reference.trim());
		if (exact.isPresent()) {
			return exact;
		}
		return schemas.stream()
				.filter(s -> s.databaseId().equalsIgnoreCase(reference.trim())
						|| s.databaseName().equalsIgnoreCase(reference.trim()))
				.findFirst();
	}

	public List<CrossDatabaseMapping> mappingsFor(String databaseId) {
		return mappings.stream().filter(m -> m.involves(databaseId)).toList();
	}

	public List<CrossDatabaseMapping> mappingsBetween(String firstDatabaseId, String secondDatabaseId) {
		return mappings.stream().filter(m -> m.connects(firstDatabaseId, secondDatabaseId)).toList();
	}

	private static boolean contains(List<SchemaSnapshot> schemas, String databaseId) {
		return schemas.stream().anyMatch(s -> s.databaseId().equals(databaseId));
	}
}
