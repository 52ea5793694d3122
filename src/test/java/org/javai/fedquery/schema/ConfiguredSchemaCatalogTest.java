package org.javai.fedquery.schema;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.fedquery.config.DatabaseConnectionSettings;
import org.javai.fedquery.testsupport.SampleSchemas;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfiguredSchemaCatalogTest {

	private InMemorySchemaCatalog catalog;

	@BeforeEach
	void setUp() {
		catalog = new InMemorySchemaCatalog()
				.register(SampleSchemas.sales())
				.register(SampleSchemas.inventory());
	}

	@Test
	@DisplayName("databases without settings pass through unchanged")
	void passThrough() {
		ConfiguredSchemaCatalog configured = new ConfiguredSchemaCatalog(catalog, List.of());

		assertThat(configured.getAllSchemas()).extracting(SchemaSnapshot::databaseId)
				.containsExactly("sales", "inventory");
	}

	@Test
	@DisplayName("disabled databases are hidden")
	void disabledHidden() {
		DatabaseConnectionSettings disabled = new DatabaseConnectionSettings("inventory", "Inventory",
				DatabaseDialect.SQLSERVER, null, null, null, false, 0, null, List.of(), List.of(), List.of());
		ConfiguredSchemaCatalog configured = new ConfiguredSchemaCatalog(catalog, List.of(disabled));

		assertThat(configured.getAllSchemas()).extracting(SchemaSnapshot::databaseId).containsExactly("sales");
		assertThat(configured.getSchema("inventory")).isEmpty();
	}

	@Test
	@DisplayName("excluded tables are removed from the snapshot")
	void excludedTables() {
		DatabaseConnectionSettings sales = new DatabaseConnectionSettings("sales", "Sales",
				DatabaseDialect.POSTGRESQL, null, null, null, true, 0, null, List.of(), List.of("orders"), List.of());
		ConfiguredSchemaCatalog configured = new ConfiguredSchemaCatalog(catalog, List.of(sales));

		assertThat(configured.getSchema("sales").orElseThrow().tableNames()).containsExactly("customers");
	}

	@Test
	@DisplayName("registering the same id again replaces the snapshot")
	void refreshReplaces() {
		catalog.register(SchemaSnapshot.builder("sales", DatabaseDialect.POSTGRESQL)
				.table("leads").column("id", "integer", true)
				.build());

		assertThat(catalog.getAllSchemas()).extracting(SchemaSnapshot::databaseId).containsExactly("sales", "inventory");
		assertThat(catalog.getSchema("sales").orElseThrow().tableNames()).containsExactly("leads");
	}
}
