package org.javai.fedquery.ai;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link TextGenerator} over one or more Spring AI {@link ChatClient} tiers.
 *
 * <p>Each tier is tried up to its {@code maxAttempts}, sleeping with exponential backoff between
 * attempts of the same tier. When a tier is exhausted the next tier is tried immediately. If no
 * tier produces non-blank content a {@link TextGenerationException} carrying every
 * {@link AttemptRecord} is thrown.</p>
 *
 * <pre>{@code
 * TextGenerator generator = ChatClientTextGenerator.builder()
 *     .tier(new ChatClientTier(primaryClient, 3, "gpt-4.1"))
 *     .tier(new ChatClientTier(fallbackClient, "gpt-4.1-mini"))
 *     .initialBackoff(Duration.ofMillis(500))
 *     .build();
 * }</pre>
 */
public final class ChatClientTextGenerator implements TextGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientTextGenerator.class);

	private final List<ChatClientTier> tiers;
	private final Duration initialBackoff;
	private final Duration maxBackoff;

	private ChatClientTextGenerator(Builder builder) {
		if (builder.tiers.isEmpty()) {
			throw new IllegalStateException("At least one ChatClientTier is required");
		}
		this.tiers = List.copyOf(builder.tiers);
		this.initialBackoff = builder.initialBackoff;
		this.maxBackoff = builder.maxBackoff;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String generate(String prompt, String context) {
		Objects.requireNonNull(prompt, "prompt must not be null");
		List<AttemptRecord> attempts = new ArrayList<>();
		Exception lastError = null;

		for (int tierIndex = 0; tierIndex < tiers.size(); tierIndex++) {
			ChatClientTier tier = tiers.get(tierIndex);
			for (int attempt = 1; attempt <= tier.maxAttempts(); attempt++) {
				if (attempt > 1) {
					sleepBeforeRetry(attempt, attempts);
				}
				if (Thread.currentThread().isInterrupted()) {
					logAttempts(attempts);
					throw new TextGenerationException("Text generation was interrupted", attempts, lastError);
				}
				long start = System.nanoTime();
				try {
					String content = invokeModel(tier.chatClient(), prompt, context);
					long elapsed = elapsedMillis(start);
					if (content == null || content.isBlank()) {
						attempts.add(new AttemptRecord(tier.modelId(), tierIndex, attempt,
								AttemptOutcome.EMPTY_RESPONSE, elapsed, "empty response"));
						logger.warn("Model {} (tier {}) returned an empty response on attempt {}",
								tier.displayName(), tierIndex, attempt);
						continue;
					}
					attempts.add(new AttemptRecord(tier.modelId(), tierIndex, attempt,
							AttemptOutcome.SUCCESS, elapsed, null));
					if (attempts.size() > 1) {
						logger.info("Text generation succeeded with model {} after {} attempts",
								tier.displayName(), attempts.size());
					}
					return content;
				} catch (RuntimeException e) {
					lastError = e;
					attempts.add(new AttemptRecord(tier.modelId(), tierIndex, attempt,
							AttemptOutcome.PROVIDER_ERROR, elapsedMillis(start), e.getMessage()));
					logger.warn("Model {} (tier {}) failed on attempt {}: {}",
							tier.displayName(), tierIndex, attempt, e.getMessage());
				}
			}
		}
		logAttempts(attempts);
		throw new TextGenerationException(
				"Text generation failed after " + attempts.size() + " attempts across " + tiers.size() + " tiers",
				attempts, lastError);
	}

	private String invokeModel(ChatClient chatClient, String prompt, String context) {
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		if (context != null && !context.isBlank()) {
			request.system(context);
		}
		request.user(prompt);
		String content = request.call().content();
		logger.debug("System message:\n{}", context);
		logger.debug("User message:\n{}", prompt);
		logger.debug("LLM response:\n{}", content);
		return content;
	}

	private void sleepBeforeRetry(int attempt, List<AttemptRecord> attempts) {
		Duration delay = backoffFor(attempt);
		if (delay.isZero()) {
			return;
		}
		try {
			Thread.sleep(delay.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logAttempts(attempts);
			throw new TextGenerationException("Interrupted while waiting to retry text generation", attempts, e);
		}
	}

	private static void logAttempts(List<AttemptRecord> attempts) {
		if (logger.isDebugEnabled()) {
			attempts.forEach(a -> logger.debug("Failed attempt: {}", a.summary()));
		}
	}

	Duration backoffFor(int attempt) {
		long millis = initialBackoff.toMillis();
		for (int i = 2; i < attempt && millis < maxBackoff.toMillis(); i++) {
			millis *= 2;
		}
		return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
	}

	private static long elapsedMillis(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
	}

	public static final class Builder {
		private final List<ChatClientTier> tiers = new ArrayList<>();
		private Duration initialBackoff = Duration.ofMillis(500);
		private Duration maxBackoff = Duration.ofSeconds(8);

		private Builder() {
		}

		public Builder chatClient(ChatClient chatClient) {
			return tier(new ChatClientTier(chatClient));
		}

		public Builder tier(ChatClientTier tier) {
			tiers.add(Objects.requireNonNull(tier, "tier must not be null"));
			return this;
		}

		public Builder initialBackoff(Duration initialBackoff) {
			this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
			return this;
		}

		public Builder maxBackoff(Duration maxBackoff) {
			this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
			return this;
		}

		public ChatClientTextGenerator build() {
			return new ChatClientTextGenerator(this);
		}
	}
}
