package org.javai.fedquery.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CrossDatabaseMappingDetectorTest {

	private final CrossDatabaseMappingDetector detector = new CrossDatabaseMappingDetector();

	private static SchemaSnapshot crm() {
		return SchemaSnapshot.builder("crm", DatabaseDialect.POSTGRESQL)
				.table("customers")
					.column("id", "integer", true)
					.column("name", "varchar")
				.build();
	}

	private static SchemaSnapshot shop() {
		return SchemaSnapshot.builder("shop", DatabaseDialect.MYSQL)
				.table("orders")
					.column("id", "int", true)
					.column("customer_id", "int")
					.column("note", "varchar")
					.foreignKey("customer_id", "customer_refs", "id")
				.build();
	}

	@Nested
	@DisplayName("Name rules")
	class NameRules {

		@Test
		@DisplayName("<table>_id matches the id key of the singular or plural table")
		void tableIdSuffix() {
			assertThat(CrossDatabaseMappingDetector.matches("customer_id", "customers", "id")).isTrue();
			assertThat(CrossDatabaseMappingDetector.matches("CustomerId", "Customers", "Id")).isTrue();
			assertThat(CrossDatabaseMappingDetector.matches("customers_id", "customers", "id")).isTrue();
			assertThat(CrossDatabaseMappingDetector.matches("product_id", "customers", "id")).isFalse();
		}

		@Test
		@DisplayName("non-id keys match on equal names")
		void equalNames() {
			assertThat(CrossDatabaseMappingDetector.matches("SKU", "items", "sku")).isTrue();
			assertThat(CrossDatabaseMappingDetector.matches("sku", "items", "code")).isFalse();
		}
	}

	@Test
	@DisplayName("foreign key column maps to the primary key of another database")
	void detectsForeignKeyMapping() {
		List<CrossDatabaseMapping> mappings = detector.detect(List.of(crm(), shop()));

		assertThat(mappings).containsExactly(new CrossDatabaseMapping(
				"shop", "orders", "customer_id", "crm", "customers", "id", "Detected by key column name"));
		assertThat(mappings.get(0).columnFor("crm")).isEqualTo("id");
		assertThat(mappings.get(0).columnFor("shop")).isEqualTo("customer_id");
	}

	@Test
	@DisplayName("shared primary key names are reported once")
	void sharedKeyReportedOnce() {
		SchemaSnapshot warehouse = SchemaSnapshot.builder("warehouse", DatabaseDialect.SQLSERVER)
				.table("items").column("sku", "nvarchar", true)
				.build();
		SchemaSnapshot catalog = SchemaSnapshot.builder("catalog", DatabaseDialect.SQLITE)
				.table("listings").column("sku", "text", true)
				.build();

		assertThat(detector.detect(List.of(warehouse, catalog))).hasSize(1);
	}

	@Test
	@DisplayName("plain columns, bare ids and a single database yield nothing")
	void nothingDetected() {
		SchemaSnapshot other = SchemaSnapshot.builder("other", DatabaseDialect.SQLITE)
				.table("notes").column("id", "integer", true).column("customer_id", "integer")
				.build();

		assertThat(detector.detect(List.of(crm(), other))).isEmpty();
		assertThat(detector.detect(List.of(shop()))).isEmpty();
	}
}
