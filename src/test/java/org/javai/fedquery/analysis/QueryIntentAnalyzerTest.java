package org.javai.fedquery.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.fedquery.config.AnalysisSettings;
import org.javai.fedquery.schema.FederatedSchemaView;
import org.javai.fedquery.testsupport.LogCaptorAppender;
import org.javai.fedquery.testsupport.SampleSchemas;
import org.javai.fedquery.testsupport.ScriptedTextGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryIntentAnalyzerTest {

	private static final String QUERY = "Which customers ordered products?";
	private static final List<String> TOKENS = List.of("which", "customers", "ordered", "products");

	private final FederatedSchemaView view = FederatedSchemaView.of(List.of(SampleSchemas.sales(), SampleSchemas.inventory()));

	private ScriptedTextGenerator generator;
	private QueryIntentAnalyzer analyzer;

	@BeforeEach
	void setUp() {
		generator = new ScriptedTextGenerator();
		analyzer = new QueryIntentAnalyzer(generator, AnalysisSettings.defaults());
	}

	private QueryIntent analyzeWith(String response) {
		generator.onContext(ScriptedTextGenerator.ANALYSIS, response);
		return analyzer.analyze(QUERY, TOKENS, view);
	}

	@Nested
	@DisplayName("Model proposals")
	class ModelProposals {

		@Test
		@DisplayName("accepts a valid proposal with the model's confidence")
		void validProposal() {
			QueryIntent intent = analyzeWith("""
					{"understanding": "customers in the sales database", "confidence": 0.9,
					 "databases": [{"databaseId": "sales", "requiredTables": ["CUSTOMERS"], "purpose": "customer list", "priority": 1}]}
					""");

			assertThat(intent.confidence()).isEqualTo(0.9);
			assertThat(intent.understanding()).isEqualTo("customers in the sales database");
			assertThat(intent.databaseQueries()).singleElement().satisfies(db -> {
				assertThat(db.databaseId()).isEqualTo("sales");
				assertThat(db.requiredTables()).containsExactly("customers");
				assertThat(db.purpose()).isEqualTo("customer list");
				assertThat(db.validationStatus()).isEqualTo(ValidationStatus.PENDING);
			});
			assertThat(intent.requiresCrossDatabaseJoin()).isFalse();
		}

		@Test
		@DisplayName("prompt lists every database with its dialect")
		void promptListsDatabases() {
			analyzeWith("{\"confidence\": 0.8, \"databases\": []}");

			String prompt = generator.callsWithContext(ScriptedTextGenerator.ANALYSIS).get(0).prompt();
			assertThat(prompt).contains("Database: Sales (id: sales, dialect: PostgreSQL)");
			assertThat(prompt).contains("Database: Inventory (id: inventory, dialect: SQL Server)");
			assertThat(prompt).contains("customer_id integer FK->customers.id");
		}

		@Test
		@DisplayName("unknown databases are dropped with a warning")
		void unknownDatabaseDropped() {
			try (LogCaptorAppender logs = LogCaptorAppender.create(QueryIntentAnalyzer.class, Level.WARN)) {
				QueryIntent intent = analyzeWith("""
						{"confidence": 0.8, "databases": [
						  {"databaseId": "warehouse", "requiredTables": ["bins"]},
						  {"databaseId": "sales", "requiredTables": ["customers"]}]}
						""");

				assertThat(intent.databaseIds()).containsExactly("sales");
				assertThat(logs.messagesAt(Level.WARN)).anyMatch(m -> m.contains("Dropping unknown database 'warehouse'"));
			}
		}

		@Test
		@DisplayName("database may be referenced by display name")
		void displayNameReference() {
			QueryIntent intent = analyzeWith("""
					{"confidence": 0.8, "databases": [{"databaseId": "Inventory", "requiredTables": ["stock"]}]}
					""");

			assertThat(intent.databaseIds()).containsExactly("inventory");
		}

		@Test
		@DisplayName("tables are moved to the database that owns them")
		void tableRelocated() {
			QueryIntent intent = analyzeWith("""
					{"confidence": 0.8, "requiresCrossDatabaseJoin": true, "databases": [
					  {"databaseId": "sales", "requiredTables": ["orders", "products"], "purpose": "orders and products"}]}
					""");

			assertThat(intent.databaseIds()).containsExactly("sales", "inventory");
			assertThat(intent.databaseQueries().get(1).requiredTables()).containsExactly("products");
			assertThat(intent.requiresCrossDatabaseJoin()).isTrue();
		}

		@Test
		@DisplayName("tables referenced by a foreign key are added")
		void foreignKeyExpansion() {
			QueryIntent intent = analyzeWith("""
					{"confidence": 0.8, "databases": [{"databaseId": "sales", "requiredTables": ["orders"]}]}
					""");

			assertThat(intent.databaseQueries().get(0).requiredTables()).containsExactly("orders", "customers");
		}

		@Test
		@DisplayName("entries for the same database are merged")
		void sameDatabaseMerged() {
			QueryIntent intent = analyzeWith("""
					{"confidence": 0.8, "databases": [
					  {"databaseId": "sales", "requiredTables": ["customers"], "purpose": "who", "priority": 2},
					  {"databaseId": "sales", "requiredTables": ["orders"], "purpose": "what", "priority": 1}]}
					""");

			assertThat(intent.databaseQueries()).singleElement().satisfies(db -> {
				assertThat(db.requiredTables()).containsExactly("customers", "orders");
				assertThat(db.purpose()).isEqualTo("who; what");
				assertThat(db.priority()).isEqualTo(1);
			});
		}

		@Test
		@DisplayName("an empty selection keeps the model's confidence")
		void emptySelection() {
			QueryIntent intent = analyzeWith("{\"confidence\": 0.2, \"databases\": []}");

			assertThat(intent.databaseQueries()).isEmpty();
			assertThat(intent.confidence()).isEqualTo(0.2);
		}

		@Test
		@DisplayName("missing confidence defaults to the middle of the range")
		void missingConfidence() {
			QueryIntent intent = analyzeWith("{\"databases\": [{\"databaseId\": \"sales\", \"requiredTables\": [\"customers\"]}]}");

			assertThat(intent.confidence()).isEqualTo(0.5);
		}
	}

	@Nested
	@DisplayName("Vocabulary fallback")
	class Fallback {

		@Test
		@DisplayName("model failure selects tables by vocabulary at fallback confidence")
		void modelFailure() {
			generator.failOnContext(ScriptedTextGenerator.ANALYSIS, "timeout");

			QueryIntent intent = analyzer.analyze("customers in berlin", List.of("customers", "berlin"), view);

			assertThat(intent.confidence()).isEqualTo(AnalysisSettings.DEFAULT_FALLBACK_CONFIDENCE);
			assertThat(intent.databaseQueries()).singleElement().satisfies(db -> {
				assertThat(db.databaseId()).isEqualTo("sales");
				assertThat(db.requiredTables()).containsExactly("customers", "orders");
			});
		}

		@Test
		@DisplayName("proposal naming only invalid tables falls back")
		void invalidProposal() {
			QueryIntent intent = analyzeWith("""
					{"confidence": 0.9, "databases": [{"databaseId": "sales", "requiredTables": ["invoices"]}]}
					""");

			assertThat(intent.confidence()).isEqualTo(AnalysisSettings.DEFAULT_FALLBACK_CONFIDENCE);
			assertThat(intent.databaseIds()).containsExactly("sales", "inventory");
			assertThat(intent.requiresCrossDatabaseJoin()).isTrue();
		}

		@Test
		@DisplayName("no vocabulary match yields an empty intent with zero confidence")
		void noMatch() {
			QueryIntent intent = analyzer.fallback("weather today", List.of("weather", "today"), view);

			assertThat(intent.databaseQueries()).isEmpty();
			assertThat(intent.confidence()).isZero();
		}

		@Test
		@DisplayName("no databases yields an empty intent without a model call")
		void noDatabases() {
			QueryIntent intent = analyzer.analyze(QUERY, TOKENS, FederatedSchemaView.of(List.of()));

			assertThat(intent.databaseQueries()).isEmpty();
			assertThat(intent.confidence()).isZero();
			assertThat(generator.calls()).isEmpty();
		}
	}
}
