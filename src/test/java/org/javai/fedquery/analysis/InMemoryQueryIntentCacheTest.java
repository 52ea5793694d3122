package org.javai.fedquery.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InMemoryQueryIntentCacheTest {

	@Test
	@DisplayName("lookups ignore case and surrounding whitespace")
	void normalizedKeys() {
		InMemoryQueryIntentCache cache = new InMemoryQueryIntentCache();
		QueryIntent intent = QueryIntent.none("Show orders", 0.0, "none");

		cache.put("Show   orders ", intent);

		assertThat(cache.get("show orders")).contains(intent);
		assertThat(cache.get("show customers")).isEmpty();
	}

	@Test
	@DisplayName("evicts the least recently used entry")
	void evictsEldest() {
		InMemoryQueryIntentCache cache = new InMemoryQueryIntentCache(2);
		cache.put("a", QueryIntent.none("a", 0.0, null));
		cache.put("b", QueryIntent.none("b", 0.0, null));
		cache.get("a");
		cache.put("c", QueryIntent.none("c", 0.0, null));

		assertThat(cache.size()).isEqualTo(2);
		assertThat(cache.get("b")).isEmpty();
		assertThat(cache.get("a")).isPresent();
	}

	@Test
	@DisplayName("clear drops every entry")
	void clear() {
		InMemoryQueryIntentCache cache = new InMemoryQueryIntentCache();
		cache.put("a", QueryIntent.none("a", 0.0, null));

		cache.clear();

		assertThat(cache.get("a")).isEmpty();
	}
}
