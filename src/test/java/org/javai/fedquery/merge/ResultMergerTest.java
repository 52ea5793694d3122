package org.javai.fedquery.merge;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.fedquery.analysis.ConfidenceBucket;
import org.javai.fedquery.analysis.Route;
import org.javai.fedquery.exec.QueryExecutionResult;
import org.javai.fedquery.exec.TabularResult;
import org.javai.fedquery.schema.CrossDatabaseMapping;
import org.javai.fedquery.schema.FederatedSchemaView;
import org.javai.fedquery.testsupport.SampleSchemas;
import org.javai.fedquery.testsupport.ScriptedTextGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ResultMergerTest {

	private static final FederatedSchemaView VIEW = FederatedSchemaView.of(
			List.of(SampleSchemas.sales(), SampleSchemas.inventory()));

	private static final QueryExecutionResult SALES_ROWS = QueryExecutionResult.success("sales",
			"SELECT name, city FROM customers LIMIT 100",
			new TabularResult(List.of("name", "city"), List.of(Map.of("name", "Acme Ltd", "city", "Berlin")), false),
			12);

	private static final QueryExecutionResult INVENTORY_FAILED = QueryExecutionResult.failure("inventory",
			"SELECT TOP 100 product_name FROM products", "Query timed out after 30000 ms", 30000);

	private static final DocumentChunk RETURNS_POLICY = new DocumentChunk("c1", "returns-policy.pdf",
			"Customers may return goods within 30 days.", 0.82);

	private static Map<String, QueryExecutionResult> results(QueryExecutionResult... results) {
		Map<String, QueryExecutionResult> map = new LinkedHashMap<>();
		for (QueryExecutionResult result : results) {
			map.put(result.databaseId(), result);
		}
		return map;
	}

	private static MergeRequest request(Route route, Map<String, QueryExecutionResult> results,
			List<DocumentChunk> chunks, String documentError) {
		return new MergeRequest("Which customers are in Berlin?", null, route, ConfidenceBucket.HIGH, results,
				chunks, documentError, VIEW);
	}

	@Nested
	@DisplayName("Without data")
	class WithoutData {

		@Test
		@DisplayName("answers with the no-data message without calling the model")
		void noData() {
			ScriptedTextGenerator generator = new ScriptedTextGenerator();
			QueryExecutionResult emptySales = QueryExecutionResult.success("sales", "SELECT 1", TabularResult.empty(), 3);

			MergedAnswer answer = new ResultMerger(generator)
					.merge(request(Route.DATABASE_ONLY, results(emptySales, INVENTORY_FAILED), List.of(), null));

			assertThat(answer.answer()).isEqualTo(ResultMerger.NO_DATA_ANSWER);
			assertThat(generator.calls()).isEmpty();
			assertThat(answer.sources()).extracting(Source::identifier).containsExactly("Sales", "Inventory");
			assertThat(answer.sources()).extracting(Source::success).containsExactly(true, false);
			assertThat(answer.sources().get(1).errorMessage()).isEqualTo("Query timed out after 30000 ms");
			assertThat(answer.confidenceBucket()).isEqualTo(ConfidenceBucket.HIGH);
		}
	}

	@Nested
	@DisplayName("With data")
	class WithData {

		@Test
		@DisplayName("the model answers from the rendered data and failures are attributed")
		void modelAnswer() {
			ScriptedTextGenerator generator = new ScriptedTextGenerator()
					.onContext(ScriptedTextGenerator.MERGE, "Acme Ltd is based in Berlin.\n```sql\nSELECT name FROM customers\n```");

			MergedAnswer answer = new ResultMerger(generator)
					.merge(request(Route.DATABASE_ONLY, results(SALES_ROWS, INVENTORY_FAILED), List.of(), null));

			assertThat(answer.answer()).isEqualTo("Acme Ltd is based in Berlin.");
			String prompt = generator.calls().get(0).prompt();
			assertThat(prompt).contains("QUESTION: Which customers are in Berlin?");
			assertThat(prompt).contains("=== Sales ===").contains("Acme Ltd\tBerlin");
			assertThat(prompt).contains("=== Inventory ===").contains("Error: Query timed out after 30000 ms");
			assertThat(answer.sourcesOfType(SourceType.DATABASE)).hasSize(2);
			assertThat(answer.sources().get(0).excerpt()).contains("Rows: 1").contains("Query: SELECT name, city");
		}

		@Test
		@DisplayName("model failure returns the retrieved data with a note")
		void modelFailure() {
			ScriptedTextGenerator generator = new ScriptedTextGenerator()
					.failOnContext(ScriptedTextGenerator.MERGE, "all tiers exhausted");

			MergedAnswer answer = new ResultMerger(generator)
					.merge(request(Route.DATABASE_ONLY, results(SALES_ROWS), List.of(), null));

			assertThat(answer.answer()).contains("Acme Ltd\tBerlin").endsWith(ResultMerger.UNSUMMARIZED_NOTE);
			assertThat(answer.sources()).hasSize(1);
		}

		@Test
		@DisplayName("rows joinable across databases are rendered as one table")
		void joined() {
			QueryExecutionResult orders = QueryExecutionResult.success("sales", "SELECT product_id, total FROM orders",
					new TabularResult(List.of("product_id", "total"), List.of(Map.of("product_id", 7, "total", 100)), false), 5);
			QueryExecutionResult products = QueryExecutionResult.success("inventory", "SELECT id, product_name FROM products",
					new TabularResult(List.of("id", "product_name"), List.of(Map.of("id", 7, "product_name", "Widget")), false), 5);
			FederatedSchemaView view = new FederatedSchemaView(VIEW.schemas(), List.of(new CrossDatabaseMapping(
					"sales", "orders", "product_id", "inventory", "products", "id", null)));
			ScriptedTextGenerator generator = new ScriptedTextGenerator()
					.onContext(ScriptedTextGenerator.MERGE, "Widget sold for 100.");

			new ResultMerger(generator).merge(new MergeRequest("Revenue per product?", null, Route.DATABASE_ONLY,
					ConfidenceBucket.HIGH, results(orders, products), List.of(), null, view));

			assertThat(generator.calls().get(0).prompt())
					.contains("=== Joined across databases ===")
					.contains("7\t100\t7\tWidget");
		}
	}

	@Nested
	@DisplayName("Documents")
	class Documents {

		@Test
		@DisplayName("hybrid answers without database rows are marked as document-only")
		void documentOnlyNote() {
			ScriptedTextGenerator generator = new ScriptedTextGenerator()
					.onContext(ScriptedTextGenerator.MERGE, "Goods can be returned within 30 days.");

			MergedAnswer answer = new ResultMerger(generator)
					.merge(request(Route.HYBRID, results(INVENTORY_FAILED), List.of(RETURNS_POLICY), null));

			assertThat(answer.answer()).startsWith(ResultMerger.DOCUMENT_ONLY_NOTE)
					.endsWith("Goods can be returned within 30 days.");
			assertThat(answer.sourcesOfType(SourceType.DOCUMENT)).singleElement()
					.satisfies(s -> {
						assertThat(s.identifier()).isEqualTo("returns-policy.pdf");
						assertThat(s.rowCountOrRelevance()).isEqualTo(0.82);
					});
			assertThat(generator.calls().get(0).prompt()).contains("[returns-policy.pdf] Customers may return goods");
		}

		@Test
		@DisplayName("document-only route carries no note")
		void documentRoute() {
			ScriptedTextGenerator generator = new ScriptedTextGenerator()
					.onContext(ScriptedTextGenerator.MERGE, "Within 30 days.");

			MergedAnswer answer = new ResultMerger(generator)
					.merge(request(Route.DOCUMENT_ONLY, Map.of(), List.of(RETURNS_POLICY), null));

			assertThat(answer.answer()).isEqualTo("Within 30 days.");
		}

		@Test
		@DisplayName("a failed document search is attributed")
		void documentSearchFailure() {
			ScriptedTextGenerator generator = new ScriptedTextGenerator()
					.onContext(ScriptedTextGenerator.MERGE, "Acme Ltd.");

			MergedAnswer answer = new ResultMerger(generator)
					.merge(request(Route.HYBRID, results(SALES_ROWS), List.of(), "index unavailable"));

			assertThat(answer.sourcesOfType(SourceType.DOCUMENT)).singleElement()
					.satisfies(s -> {
						assertThat(s.success()).isFalse();
						assertThat(s.errorMessage()).isEqualTo("index unavailable");
					});
			assertThat(answer.answer()).isEqualTo("Acme Ltd.");
		}
	}

	@Test
	@DisplayName("SQL is stripped from answers")
	void cleanAnswer() {
		String cleaned = ResultMerger.cleanAnswer("Total is 5.\n\nSELECT count(*) FROM orders\nDone");

		assertThat(cleaned).doesNotContain("SELECT").contains("Total is 5.").endsWith("Done");
		assertThat(ResultMerger.cleanAnswer(null)).isEmpty();
	}
}
