package org.javai.fedquery.sql;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.fedquery.testsupport.SampleSchemas;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ForbiddenTermsTest {

	@Test
	@DisplayName("content words that name no table or column are forbidden")
	void forbidden() {
		List<String> words = List.of("Show", "premium", "customers", "in", "Berlin", "by", "total", "2024");

		assertThat(ForbiddenTerms.compute(words, List.of(SampleSchemas.sales())))
				.containsExactly("premium", "berlin");
	}

	@Test
	@DisplayName("words are checked against every whitelist")
	void everyWhitelist() {
		List<String> words = List.of("warehouse", "customers");

		assertThat(ForbiddenTerms.compute(words, List.of(SampleSchemas.sales()))).containsExactly("warehouse");
		assertThat(ForbiddenTerms.compute(words, List.of(SampleSchemas.sales(), SampleSchemas.inventory()))).isEmpty();
	}
}
