package org.javai.fedquery.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import org.javai.fedquery.ai.TextGenerationException;
import org.javai.fedquery.ai.TextGenerator;

/**
 * Test double that answers each call with the first rule whose condition matches the prompt and
 * context, and records every call. Calls that match no rule fail like an exhausted provider.
 */
public final class ScriptedTextGenerator implements TextGenerator {

	public record Call(String prompt, String context) {

		public boolean contextContains(String text) {
			return context != null && context.contains(text);
		}
	}

	private record Rule(BiPredicate<String, String> condition, BiFunction<String, String, String> response) {
	}

	public static final String CLASSIFICATION = "You classify user input";
	public static final String ANALYSIS = "You route a user's question";
	public static final String SYNTHESIS = "Write ONE read-only SELECT statement";
	public static final String MERGE = "You answer questions using ONLY";

	private final List<Rule> rules = new CopyOnWriteArrayList<>();
	private final List<Call> calls = new CopyOnWriteArrayList<>();

	public ScriptedTextGenerator onContext(String contextFragment, String response) {
		return on((prompt, context) -> context != null && context.contains(contextFragment), (p, c) -> response);
	}

	/**
	 * Answer synthesis calls whose schema section names the given database.
	 */
	public ScriptedTextGenerator onSynthesisFor(String databaseName, String response) {
		return on((prompt, context) -> context != null && context.contains(SYNTHESIS)
				&& context.contains("ALLOWED SCHEMA (" + databaseName + ","), (p, c) -> response);
	}

	public ScriptedTextGenerator failOnContext(String contextFragment, String message) {
		return on((prompt, context) -> context != null && context.contains(contextFragment), (p, c) -> {
			throw new TextGenerationException(message);
		});
	}

	public ScriptedTextGenerator on(BiPredicate<String, String> condition, BiFunction<String, String, String> response) {
		rules.add(new Rule(condition, response));
		return this;
	}

	@Override
	public String generate(String prompt, String context) {
		calls.add(new Call(prompt, context));
		for (Rule rule : rules) {
			if (rule.condition().test(prompt, context)) {
				return rule.response().apply(prompt, context);
			}
		}
		throw new TextGenerationException("No scripted response for prompt: " + prompt);
	}

	public List<Call> calls() {
		return List.copyOf(calls);
	}

	public List<Call> callsWithContext(String contextFragment) {
		return calls.stream().filter(c -> c.contextContains(contextFragment)).toList();
	}
}
