package org.javai.fedquery;

import java.util.Objects;
import org.javai.fedquery.ai.TextGenerator;

/**
 * Produces replies to conversational input.
 */
@FunctionalInterface
public interface ConversationResponder {

	/**
	 * @param message the user's message
	 * @param conversationHistory recent history, may be empty
	 * @return the reply
	 */
	String respond(String message, String conversationHistory);

	/**
	 * A responder that asks the model for a short, friendly reply.
	 */
	static ConversationResponder using(TextGenerator textGenerator) {
		Objects.requireNonNull(textGenerator, "textGenerator must not be null");
		return (message, history) -> {
			String prompt = history == null || history.isBlank()
					? message
					: "Conversation so far:\n" + history.trim() + "\n\nUser: " + message;
			return textGenerator.generate(prompt,
					"You are a helpful assistant for questions about company data and documents. "
							+ "Reply briefly and naturally. Do not make up facts about the data.");
		};
	}
}
