package org.javai.fedquery.sql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.javai.fedquery.CancellationSignal;
import org.javai.fedquery.ai.TextGenerationException;
import org.javai.fedquery.analysis.DatabaseQueryIntent;
import org.javai.fedquery.analysis.QueryIntent;
import org.javai.fedquery.analysis.ValidationStatus;
import org.javai.fedquery.config.ConnectionLimits;
import org.javai.fedquery.config.FederationSettings;
import org.javai.fedquery.config.SynthesisSettings;
import org.javai.fedquery.schema.FederatedSchemaView;
import org.javai.fedquery.testsupport.SampleSchemas;
import org.javai.fedquery.testsupport.ScriptedTextGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SqlSynthesizerTest {

	private static final String TOP_CUSTOMERS = "Show top 5 customers by order count";

	private final FederatedSchemaView view = FederatedSchemaView.of(List.of(SampleSchemas.sales(), SampleSchemas.inventory()));

	private ExecutorService executor;
	private ScriptedTextGenerator generator;

	@BeforeEach
	void setUp() {
		executor = Executors.newFixedThreadPool(4);
		generator = new ScriptedTextGenerator();
	}

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	private SqlSynthesizer synthesizer(Duration timeout) {
		return new SqlSynthesizer(generator, DialectStrategyRegistry.defaults(), SynthesisSettings.defaults(),
				new ConnectionLimits(FederationSettings.defaults()), executor, timeout);
	}

	private static QueryIntent intent(String query, DatabaseQueryIntent... targets) {
		return new QueryIntent(query, query, 0.9, List.of(targets), targets.length > 1, "test");
	}

	private static DatabaseQueryIntent salesTarget(String... tables) {
		return DatabaseQueryIntent.of("sales", List.of(tables), "customer orders", 1);
	}

	private static DatabaseQueryIntent inventoryTarget() {
		return DatabaseQueryIntent.of("inventory", List.of("products"), "product names", 2);
	}

	@Nested
	@DisplayName("Valid statements")
	class ValidStatements {

		@Test
		@DisplayName("top-N question gets a validated statement limited to N rows")
		void topN() {
			generator.onSynthesisFor("Sales", """
					```sql
					SELECT c.name, COUNT(o.id) AS order_count
					FROM customers c JOIN orders o ON o.customer_id = c.id
					GROUP BY c.name ORDER BY order_count DESC;
					```
					""");

			QueryIntent result = synthesizer(Duration.ofSeconds(10))
					.synthesize(intent(TOP_CUSTOMERS, salesTarget("customers", "orders")), List.of(), view, new CancellationSignal());

			DatabaseQueryIntent sales = result.databaseQueries().get(0);
			assertThat(sales.validationStatus()).isEqualTo(ValidationStatus.VALID);
			assertThat(sales.isExecutable()).isTrue();
			assertThat(sales.sql()).endsWith("LIMIT 5");
			assertThat(generator.callsWithContext(ScriptedTextGenerator.SYNTHESIS)).hasSize(1);
		}

		@Test
		@DisplayName("each database gets its own dialect")
		void perDialect() {
			generator.onSynthesisFor("Sales", "SELECT name FROM customers")
					.onSynthesisFor("Inventory", "SELECT product_name FROM products LIMIT 10");

			QueryIntent result = synthesizer(Duration.ofSeconds(10)).synthesize(
					intent("customer and product names", salesTarget("customers"), inventoryTarget()),
					List.of(), view, new CancellationSignal());

			assertThat(result.databaseQueries()).extracting(DatabaseQueryIntent::sql).containsExactly(
					"SELECT name FROM customers LIMIT 100",
					"SELECT TOP 10 product_name FROM products");
		}
	}

	@Nested
	@DisplayName("Rejected statements")
	class Rejected {

		@Test
		@DisplayName("table outside the selected tables is rejected")
		void outsideWhitelist() {
			generator.onSynthesisFor("Sales", "SELECT name FROM customers JOIN orders ON orders.customer_id = customers.id");

			QueryIntent result = synthesizer(Duration.ofSeconds(10)).synthesize(
					intent("customers with orders", salesTarget("customers")), List.of(), view, new CancellationSignal());

			DatabaseQueryIntent sales = result.databaseQueries().get(0);
			assertThat(sales.validationStatus()).isEqualTo(ValidationStatus.INVALID);
			assertThat(sales.isExecutable()).isFalse();
			assertThat(sales.validationError()).contains("Table not allowed: orders");
			assertThat(sales.sql()).startsWith("SELECT name FROM customers");
		}

		@Test
		@DisplayName("write statements are rejected")
		void writeStatement() {
			generator.onSynthesisFor("Sales", "SELECT name FROM customers; DELETE FROM customers");

			QueryIntent result = synthesizer(Duration.ofSeconds(10)).synthesize(
					intent("customer names", salesTarget("customers")), List.of(), view, new CancellationSignal());

			assertThat(result.databaseQueries().get(0).validationError()).isEqualTo("Forbidden keyword: DELETE");
		}

		@Test
		@DisplayName("invented filter values are rejected")
		void inventedFilter() {
			generator.onSynthesisFor("Sales", "SELECT name FROM customers WHERE name LIKE '%premium%'");

			QueryIntent result = synthesizer(Duration.ofSeconds(10)).synthesize(
					intent("Show premium customers", salesTarget("customers")), List.of(), view, new CancellationSignal());

			assertThat(result.databaseQueries().get(0).validationError()).contains("Filter uses a term that matches no column");
			assertThat(generator.calls().get(0).prompt()).contains("FORBIDDEN FILTER TERMS: premium");
		}

		@Test
		@DisplayName("a reply without SQL is rejected")
		void noSql() {
			generator.onSynthesisFor("Sales", "I am not able to help with that.");

			QueryIntent result = synthesizer(Duration.ofSeconds(10)).synthesize(
					intent("customer names", salesTarget("customers")), List.of(), view, new CancellationSignal());

			assertThat(result.databaseQueries().get(0).validationError()).isEqualTo("The model returned no SQL");
			assertThat(result.databaseQueries().get(0).sql()).isNull();
		}

		@Test
		@DisplayName("a database missing from the view is rejected")
		void unknownDatabase() {
			DatabaseQueryIntent archive = DatabaseQueryIntent.of("archive", List.of("orders"), null, 1);

			QueryIntent result = synthesizer(Duration.ofSeconds(10)).synthesize(
					intent("archived orders", archive), List.of(), view, new CancellationSignal());

			assertThat(result.databaseQueries().get(0).validationError()).isEqualTo("Unknown database: archive");
			assertThat(generator.calls()).isEmpty();
		}
	}

	@Nested
	@DisplayName("Failure isolation")
	class FailureIsolation {

		@Test
		@DisplayName("a failed generation does not affect the other database")
		void generationFailure() {
			generator.on((p, c) -> c.contains("ALLOWED SCHEMA (Sales,"), (p, c) -> {
				throw new TextGenerationException("quota exceeded");
			}).onSynthesisFor("Inventory", "SELECT product_name FROM products");

			QueryIntent result = synthesizer(Duration.ofSeconds(10)).synthesize(
					intent("customer and product names", salesTarget("customers"), inventoryTarget()),
					List.of(), view, new CancellationSignal());

			assertThat(result.databaseQueries().get(0).validationError()).contains("quota exceeded");
			assertThat(result.databaseQueries().get(1).isExecutable()).isTrue();
		}

		@Test
		@DisplayName("a slow generation times out alone")
		void timeout() {
			generator.on((p, c) -> c.contains("ALLOWED SCHEMA (Sales,"), (p, c) -> {
				try {
					Thread.sleep(30_000);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
				return "SELECT name FROM customers";
			}).onSynthesisFor("Inventory", "SELECT product_name FROM products");

			QueryIntent result = synthesizer(Duration.ofSeconds(2)).synthesize(
					intent("customer and product names", salesTarget("customers"), inventoryTarget()),
					List.of(), view, new CancellationSignal());

			assertThat(result.databaseQueries().get(0).validationError()).startsWith("SQL synthesis timed out");
			assertThat(result.databaseQueries().get(1).isExecutable()).isTrue();
		}

		@Test
		@DisplayName("time spent queued behind another database does not count against the timeout")
		void queuedGenerationKeepsItsTimeout() {
			generator.on((p, c) -> c.contains("ALLOWED SCHEMA (Sales,"), (p, c) -> slowly("SELECT name FROM customers"))
					.on((p, c) -> c.contains("ALLOWED SCHEMA (Inventory,"), (p, c) -> slowly("SELECT product_name FROM products"));
			ExecutorService singleThread = Executors.newSingleThreadExecutor();
			try {
				SqlSynthesizer synthesizer = new SqlSynthesizer(generator, DialectStrategyRegistry.defaults(),
						SynthesisSettings.defaults(), new ConnectionLimits(FederationSettings.defaults()), singleThread,
						Duration.ofMillis(1500));

				QueryIntent result = synthesizer.synthesize(
						intent("customer and product names", salesTarget("customers"), inventoryTarget()),
						List.of(), view, new CancellationSignal());

				assertThat(result.databaseQueries()).allSatisfy(db -> assertThat(db.isExecutable()).isTrue());
			} finally {
				singleThread.shutdownNow();
			}
		}
	}

	private static String slowly(String sql) {
		try {
			Thread.sleep(900);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		return sql;
	}

	@Test
	@DisplayName("a cancelled request stops before generating")
	void cancelled() {
		CancellationSignal signal = new CancellationSignal();
		signal.cancel();

		assertThatThrownBy(() -> synthesizer(Duration.ofSeconds(10))
				.synthesize(intent("customer names", salesTarget("customers")), List.of(), view, signal))
				.isInstanceOf(CancellationException.class);
		assertThat(generator.calls()).isEmpty();
	}

	@Test
	@DisplayName("an intent without databases is returned unchanged")
	void noDatabases() {
		QueryIntent none = QueryIntent.none("weather", 0.0, "nothing");

		assertThat(synthesizer(Duration.ofSeconds(10)).synthesize(none, List.of(), view, new CancellationSignal()))
				.isSameAs(none);
	}
}
