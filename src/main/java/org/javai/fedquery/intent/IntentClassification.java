package org.javai.fedquery.intent;

import java.util.List;

/**
 * Whether a query is small talk or a request for information.
 */
public sealed interface IntentClassification {

	/**
	 * @return which stage produced the verdict
	 */
	ClassificationSource source();

	/**
	 * Conversational input. The direct answer, when the model supplied one, may be returned to
	 * the user as is.
	 *
	 * @param directAnswer reply suggested by the model, or null
	 * @param source which stage produced the verdict
	 */
	record Conversation(String directAnswer, ClassificationSource source) implements IntentClassification {

		public boolean hasDirectAnswer() {
			return directAnswer != null && !directAnswer.isBlank();
		}
	}

	/**
	 * A request for information.
	 *
	 * @param tokens ordered, unique, lowercase search tokens
	 * @param source which stage produced the verdict
	 */
	record Information(List<String> tokens, ClassificationSource source) implements IntentClassification {

		public Information {
			tokens = tokens != null ? List.copyOf(tokens) : List.of();
		}
	}
}
