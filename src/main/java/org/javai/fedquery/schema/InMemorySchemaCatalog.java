package org.javai.fedquery.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SchemaCatalog backed by snapshots registered at runtime.
 *
 * <p>This is the single owner of the snapshots it hands out. Registering a snapshot for an id that
 * is already present replaces it, which is how an external refresher publishes a newer
 * snapshot.</p>
 */
public final class InMemorySchemaCatalog implements SchemaCatalog {

	private static final Logger logger = LoggerFactory.getLogger(InMemorySchemaCatalog.class);

	private final Map<String, SchemaSnapshot> snapshots = new ConcurrentHashMap<>();
	private final List<String> order = new CopyOnWriteArrayList<>();

	public InMemorySchemaCatalog register(SchemaSnapshot snapshot) {
		Objects.requireNonNull(snapshot, "snapshot must not be null");
		SchemaSnapshot previous = snapshots.put(snapshot.databaseId(), snapshot);
		if (previous == null) {
			order.add(snapshot.databaseId());
			logger.debug("Registered schema for database '{}' with {} tables",
					snapshot.databaseId(), snapshot.tables().size());
		} else {
			logger.debug("Replaced schema for database '{}' (refreshed {})",
					snapshot.databaseId(), snapshot.lastRefreshed());
		}
		return this;
	}

	public boolean remove(String databaseId) {
		order.remove(databaseId);
		return snapshots.remove(databaseId) != null;
	}

	@Override
	public Optional<SchemaSnapshot> getSchema(String databaseId) {
		if (databaseId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(snapshots.get(databaseId));
	}

	@Override
	public List<SchemaSnapshot> getAllSchemas() {
		List<SchemaSnapshot> all = new ArrayList<>();
		for (String id : order) {
			SchemaSnapshot snapshot = snapshots.get(id);
			if (snapshot != null) {
				all.add(snapshot);
			}
		}
		return List.copyOf(all);
	}
}
