package org.javai.fedquery.sql;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import org.javai.fedquery.schema.ColumnSchema;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.javai.fedquery.schema.SchemaVocabulary;
import org.javai.fedquery.schema.TableSchema;

/**
 * Query words that name nothing in the selected schemas. Such words must not be turned into
 * filter values, otherwise the model invents predicates like {@code WHERE name LIKE '%premium%'}.
 */
public final class ForbiddenTerms {

	private ForbiddenTerms() {
	}

	/**
	 * @param words query words, in any case
	 * @param whitelists the schema subsets selected for synthesis
	 * @return lowercase content words matching no table or column of any whitelist, in query order
	 */
	public static Set<String> compute(Collection<String> words, Collection<SchemaSnapshot> whitelists) {
		Set<String> forbidden = new LinkedHashSet<>();
		for (String word : words) {
			if (word == null) {
				continue;
			}
			String lower = word.toLowerCase(Locale.ROOT);
			if (SchemaVocabulary.isContentWord(lower) && !namesSchemaElement(lower, whitelists)) {
				forbidden.add(lower);
			}
		}
		return forbidden;
	}

	private static boolean namesSchemaElement(String word, Collection<SchemaSnapshot> whitelists) {
		for (SchemaSnapshot schema : whitelists) {
			for (TableSchema table : schema.tables()) {
				if (SchemaVocabulary.matches(word, table.name())) {
					return true;
				}
				for (ColumnSchema column : table.columns()) {
					if (SchemaVocabulary.matches(word, column.name())) {
						return true;
					}
				}
			}
		}
		return false;
	}
}
