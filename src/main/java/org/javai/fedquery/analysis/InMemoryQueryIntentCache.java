package org.javai.fedquery.analysis;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded least-recently-used {@link QueryIntentCache}. Keys are the query with whitespace
 * collapsed and case folded.
 */
public class InMemoryQueryIntentCache implements QueryIntentCache {

	public static final int DEFAULT_MAX_ENTRIES = 256;

	private final Map<String, QueryIntent> entries;

	public InMemoryQueryIntentCache() {
		this(DEFAULT_MAX_ENTRIES);
	}

	public InMemoryQueryIntentCache(int maxEntries) {
		if (maxEntries < 1) {
			throw new IllegalArgumentException("maxEntries must be >= 1");
		}
		this.entries = new LinkedHashMap<>(16, 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<String, QueryIntent> eldest) {
				return size() > maxEntries;
			}
		};
	}

	@Override
	public synchronized Optional<QueryIntent> get(String query) {
		return Optional.ofNullable(entries.get(key(query)));
	}

	@Override
	public synchronized void put(String query, QueryIntent intent) {
		entries.put(key(query), intent);
	}

	@Override
	public synchronized void clear() {
		entries.clear();
	}

	synchronized int size() {
		return entries.size();
	}

	static String key(String query) {
		return query == null ? "" : query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
	}
}
