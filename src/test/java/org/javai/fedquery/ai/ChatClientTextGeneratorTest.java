package org.javai.fedquery.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

class ChatClientTextGeneratorTest {

	@Nested
	@DisplayName("Single tier")
	class SingleTier {

		@Test
		@DisplayName("returns the model content")
		void returnsContent() {
			ChatClient client = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
			Mockito.when(client.prompt().call().content()).thenReturn("SELECT 1");

			TextGenerator generator = ChatClientTextGenerator.builder().chatClient(client).build();

			assertThat(generator.generate("question", "context")).isEqualTo("SELECT 1");
		}

		@Test
		@DisplayName("retries an empty response within the tier")
		void retriesEmptyResponse() {
			ChatClient client = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
			Mockito.when(client.prompt().call().content()).thenReturn("  ", "answer");

			TextGenerator generator = ChatClientTextGenerator.builder()
					.tier(new ChatClientTier(client, 2, "primary"))
					.initialBackoff(Duration.ZERO)
					.build();

			assertThat(generator.generate("question", null)).isEqualTo("answer");
		}

		@Test
		@DisplayName("throws with every attempt recorded once exhausted")
		void throwsWhenExhausted() {
			ChatClient client = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
			Mockito.when(client.prompt().call().content()).thenThrow(new IllegalStateException("rate limited"));

			TextGenerator generator = ChatClientTextGenerator.builder()
					.tier(new ChatClientTier(client, 3, "primary"))
					.initialBackoff(Duration.ZERO)
					.build();

			assertThatThrownBy(() -> generator.generate("question", null))
					.isInstanceOf(TextGenerationException.class)
					.satisfies(e -> {
						TextGenerationException failure = (TextGenerationException) e;
						assertThat(failure.attempts()).hasSize(3);
						assertThat(failure.attempts()).allMatch(a -> a.outcome() == AttemptOutcome.PROVIDER_ERROR);
						assertThat(failure.attempts().get(2).summary()).contains("tier 0 attempt 3", "rate limited");
					});
		}

		@Test
		@DisplayName("stops retrying once the calling thread is interrupted")
		void stopsWhenInterrupted() {
			ChatClient client = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
			Mockito.when(client.prompt().call().content()).thenAnswer(invocation -> {
				Thread.currentThread().interrupt();
				throw new IllegalStateException("connection reset");
			});

			TextGenerator generator = ChatClientTextGenerator.builder()
					.tier(new ChatClientTier(client, 5, "primary"))
					.initialBackoff(Duration.ZERO)
					.build();

			try {
				assertThatThrownBy(() -> generator.generate("question", null))
						.isInstanceOf(TextGenerationException.class)
						.hasMessageContaining("interrupted")
						.satisfies(e -> assertThat(((TextGenerationException) e).attempts()).hasSize(1));
			} finally {
				Thread.interrupted();
			}
		}
	}

	@Nested
	@DisplayName("Fallback tiers")
	class FallbackTiers {

		@Test
		@DisplayName("falls back to the next tier when the first is exhausted")
		void fallsBack() {
			ChatClient primary = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
			Mockito.when(primary.prompt().call().content()).thenThrow(new IllegalStateException("down"));
			ChatClient fallback = Mockito.mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
			Mockito.when(fallback.prompt().call().content()).thenReturn("from fallback");

			TextGenerator generator = ChatClientTextGenerator.builder()
					.tier(new ChatClientTier(primary, "gpt-4.1"))
					.tier(new ChatClientTier(fallback, "gpt-4.1-mini"))
					.build();

			assertThat(generator.generate("question", "context")).isEqualTo("from fallback");
		}
	}

	@Nested
	@DisplayName("Configuration")
	class Configuration {

		@Test
		@DisplayName("requires at least one tier")
		void requiresTier() {
			assertThatThrownBy(() -> ChatClientTextGenerator.builder().build())
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("At least one ChatClientTier");
		}

		@Test
		@DisplayName("backoff doubles per attempt up to the maximum")
		void backoffDoubles() {
			ChatClient client = Mockito.mock(ChatClient.class);
			ChatClientTextGenerator generator = ChatClientTextGenerator.builder()
					.chatClient(client)
					.initialBackoff(Duration.ofMillis(100))
					.maxBackoff(Duration.ofMillis(300))
					.build();

			assertThat(generator.backoffFor(2)).isEqualTo(Duration.ofMillis(100));
			assertThat(generator.backoffFor(3)).isEqualTo(Duration.ofMillis(200));
			assertThat(generator.backoffFor(4)).isEqualTo(Duration.ofMillis(300));
		}

		@Test
		@DisplayName("tier rejects zero attempts")
		void tierRejectsZeroAttempts() {
			ChatClient client = Mockito.mock(ChatClient.class);

			assertThatThrownBy(() -> new ChatClientTier(client, 0, "model"))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("maxAttempts must be >= 1");
		}

		@Test
		@DisplayName("tier without model id has a placeholder display name")
		void tierDisplayName() {
			ChatClient client = Mockito.mock(ChatClient.class);

			assertThat(new ChatClientTier(client).displayName()).isEqualTo("unnamed model");
			assertThat(new ChatClientTier(client, "gpt-4.1").displayName()).isEqualTo("gpt-4.1");
		}
	}
}
