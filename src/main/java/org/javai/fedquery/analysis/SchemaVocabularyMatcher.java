package org.javai.fedquery.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.fedquery.schema.ColumnSchema;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.javai.fedquery.schema.SchemaVocabulary;
import org.javai.fedquery.schema.TableSchema;

/**
 * Scores tables by how many query words name them or their columns.
 *
 * <p>A word naming the table scores two points, a word naming one of its columns scores one.
 * Only content words are considered.</p>
 */
public class SchemaVocabularyMatcher {

	public record TableMatch(String table, int score) {
	}

	/**
	 * @return matching tables per database id, best first; databases without a match are absent
	 */
	public Map<String, List<TableMatch>> match(List<SchemaSnapshot> schemas, List<String> tokens) {
		List<String> words = tokens.stream().filter(SchemaVocabulary::isContentWord).toList();
		Map<String, List<TableMatch>> matches = new LinkedHashMap<>();
		for (SchemaSnapshot schema : schemas) {
			List<TableMatch> tableMatches = new ArrayList<>();
			for (TableSchema table : schema.tables()) {
				int score = score(table, words);
				if (score > 0) {
					tableMatches.add(new TableMatch(table.name(), score));
				}
			}
			if (!tableMatches.isEmpty()) {
				tableMatches.sort(Comparator.comparingInt(TableMatch::score).reversed());
				matches.put(schema.databaseId(), tableMatches);
			}
		}
		return matches;
	}

	private int score(TableSchema table, List<String> words) {
		int score = 0;
		for (String word : words) {
			if (SchemaVocabulary.matches(word, table.name())) {
				score += 2;
			} else if (table.columns().stream().map(ColumnSchema::name).anyMatch(c -> SchemaVocabulary.matches(word, c))) {
				score += 1;
			}
		}
		return score;
	}
}
