package org.javai.fedquery.ai;

/**
 * Text-generation capability used by every AI-backed pipeline stage.
 *
 * <p>Implementations own their retry, backoff and provider fallback policy. Callers treat a
 * thrown {@link TextGenerationException} as final and never retry on their own.</p>
 */
@FunctionalInterface
public interface TextGenerator {

	/**
	 * Generate a completion.
	 *
	 * @param prompt the user prompt
	 * @param context instructions and background sent ahead of the prompt (may be null)
	 * @return the generated text
	 * @throws TextGenerationException when every attempt failed
	 */
	String generate(String prompt, String context);
}
