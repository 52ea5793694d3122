package org.javai.fedquery.analysis;

import java.util.Optional;

/**
 * Store for analysed intents so identical queries can skip analysis. Owned and injected by the
 * caller; implementations must be thread-safe.
 */
public interface QueryIntentCache {

	Optional<QueryIntent> get(String query);

	void put(String query, QueryIntent intent);

	void clear();
}
