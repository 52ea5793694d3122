package org.javai.fedquery.schema;

import java.util.List;
import java.util.Optional;

/**
 * Source of schema snapshots for every database the federation can query.
 *
 * <p>The catalog owns snapshot creation and refresh. Pipeline components only read from it.</p>
 */
public interface SchemaCatalog {

	/**
	 * @param databaseId the configured database id
	 * @return the current snapshot, or empty if the database is unknown
	 */
	Optional<SchemaSnapshot> getSchema(String databaseId);

	/**
	 * @return snapshots of every enabled database, in configuration order
	 */
	List<SchemaSnapshot> getAllSchemas();
}
