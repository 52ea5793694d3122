package org.javai.fedquery.intent;

import static org.assertj.core.api.Assertions.assertThat;

import org.javai.fedquery.config.ClassifierSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HeuristicScorerTest {

	private final HeuristicScorer scorer = new HeuristicScorer(ClassifierSettings.defaults());

	@Nested
	@DisplayName("Conversation shape")
	class ConversationShape {

		@ParameterizedTest
		@ValueSource(strings = {"hi", "Hello there", "merhaba", "hola!"})
		@DisplayName("short input without numbers is conversation")
		void shortInput(String query) {
			assertThat(scorer.score(query).decision()).isEqualTo(HeuristicDecision.CONVERSATION);
		}

		@Test
		@DisplayName("short input with a number is not conversation")
		void shortWithNumber() {
			HeuristicVerdict verdict = scorer.score("order 42");

			assertThat(verdict.numericOrIdSignal()).isTrue();
			assertThat(verdict.decision()).isNotEqualTo(HeuristicDecision.CONVERSATION);
		}
	}

	@Nested
	@DisplayName("Information shape")
	class InformationShape {

		@Test
		@DisplayName("digits, many tokens and an id-like token reach the threshold")
		void topN() {
			HeuristicVerdict verdict = scorer.score("Show top 5 customers by order count");

			assertThat(verdict.score()).isEqualTo(3);
			assertThat(verdict.tokenCount()).isEqualTo(7);
			assertThat(verdict.decision()).isEqualTo(HeuristicDecision.INFORMATION);
		}

		@Test
		@DisplayName("date ranges score every numeric signal")
		void dateRange() {
			HeuristicVerdict verdict = scorer.score("Orders between 2023-01-01 and 2023-12-31?");

			assertThat(verdict.score()).isGreaterThanOrEqualTo(6);
			assertThat(verdict.decision()).isEqualTo(HeuristicDecision.INFORMATION);
		}

		@Test
		@DisplayName("question punctuation of other scripts counts")
		void otherScripts() {
			assertThat(scorer.score("¿Cuántos pedidos hay?").questionPunctuation()).isTrue();
			assertThat(scorer.score("كم عدد الطلبات؟").questionPunctuation()).isTrue();
		}
	}

	@Nested
	@DisplayName("Inconclusive shape")
	class Inconclusive {

		@Test
		@DisplayName("long questions need the higher threshold")
		void longQuestion() {
			HeuristicVerdict verdict = scorer.score("What is the total revenue of customers in Berlin?");

			assertThat(verdict.score()).isEqualTo(2);
			assertThat(verdict.decision()).isEqualTo(HeuristicDecision.UNKNOWN);
			assertThat(scorer.strongInformationShape(verdict)).isTrue();
		}

		@Test
		@DisplayName("short questions are not strong enough to override")
		void shortQuestion() {
			HeuristicVerdict verdict = scorer.score("How are you today my friend?");

			assertThat(verdict.decision()).isEqualTo(HeuristicDecision.UNKNOWN);
			assertThat(scorer.strongInformationShape(verdict)).isFalse();
		}

		@Test
		@DisplayName("thresholds come from settings")
		void configurableThreshold() {
			HeuristicScorer lenient = new HeuristicScorer(ClassifierSettings.builder().informationScore(1).build());

			assertThat(lenient.score("thanks a lot").decision()).isEqualTo(HeuristicDecision.UNKNOWN);
			assertThat(lenient.score("list every customer please").decision()).isEqualTo(HeuristicDecision.UNKNOWN);
			assertThat(lenient.score("list customer 7").decision()).isEqualTo(HeuristicDecision.INFORMATION);
		}
	}
}
