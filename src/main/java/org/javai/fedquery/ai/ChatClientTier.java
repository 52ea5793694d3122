package org.javai.fedquery.ai;

import org.springframework.ai.chat.client.ChatClient;

/**
 * A chat client with its maximum attempt configuration.
 *
 * <p>One tier in the fallback chain of {@link ChatClientTextGenerator}: up to
 * {@code maxAttempts} calls are made to this client before moving to the next tier.</p>
 *
 * @param chatClient the Spring AI ChatClient
 * @param maxAttempts maximum attempts before moving to next tier (≥1)
 * @param modelId optional identifier for logging (e.g., "gpt-4.1-mini")
 */
public record ChatClientTier(
		ChatClient chatClient,
		int maxAttempts,
		String modelId
) {

	public ChatClientTier {
		if (chatClient == null) {
			throw new IllegalArgumentException("chatClient must not be null");
		}
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be >= 1");
		}
	}

	public ChatClientTier(ChatClient chatClient, String modelId) {
		this(chatClient, 1, modelId);
	}

	public ChatClientTier(ChatClient chatClient) {
		this(chatClient, 1, null);
	}

	/**
	 * @return the model id, or a placeholder for log output when none was given
	 */
	public String displayName() {
		return modelId != null && !modelId.isBlank() ? modelId : "unnamed model";
	}
}
