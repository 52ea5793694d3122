package org.javai.fedquery.ai;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of leniently parsing model output that was asked to be JSON.
 *
 * <p>Model output is untrusted: callers switch over the three variants and never assume the
 * requested shape without checking it.</p>
 */
public sealed interface ParsedResponse {

	/**
	 * @return the raw model output
	 */
	String raw();

	/**
	 * A JSON object was found and parsed.
	 */
	record ParsedStructured(JsonNode json, String raw) implements ParsedResponse {

		/**
		 * @return the trimmed text of a field, or null if absent, null or not textual
		 */
		public String text(String field) {
			JsonNode node = json.get(field);
			if (node == null || node.isNull() || !node.isValueNode()) {
				return null;
			}
			String value = node.asText().trim();
			return value.isEmpty() ? null : value;
		}

		/**
		 * @return the textual elements of an array field, empty if absent or not an array
		 */
		public List<String> textList(String field) {
			List<String> values = new ArrayList<>();
			JsonNode node = json.get(field);
			if (node != null && node.isArray()) {
				for (JsonNode element : node) {
					if (element.isValueNode() && !element.isNull()) {
						String value = element.asText().trim();
						if (!value.isEmpty()) {
							values.add(value);
						}
					}
				}
			}
			return values;
		}

		public double number(String field, double defaultValue) {
			JsonNode node = json.get(field);
			if (node == null || node.isNull()) {
				return defaultValue;
			}
			if (node.isNumber()) {
				return node.asDouble();
			}
			if (node.isTextual()) {
				try {
					return Double.parseDouble(node.asText().trim());
				} catch (NumberFormatException e) {
					return defaultValue;
				}
			}
			return defaultValue;
		}

		public boolean flag(String field) {
			JsonNode node = json.get(field);
			if (node == null || node.isNull()) {
				return false;
			}
			return node.isBoolean() ? node.asBoolean() : "true".equalsIgnoreCase(node.asText().trim());
		}
	}

	/**
	 * No JSON object was present; the output is free text.
	 */
	record ParsedPlainText(String text, String raw) implements ParsedResponse {
	}

	/**
	 * The output was empty or contained a JSON object that could not be parsed.
	 */
	record ParseFailed(String reason, String raw) implements ParsedResponse {
	}
}
