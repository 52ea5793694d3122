package org.javai.fedquery.ai;

import java.util.List;

/**
 * Thrown by a {@link TextGenerator} once its retry and fallback options are exhausted.
 */
public class TextGenerationException extends RuntimeException {

	private final List<AttemptRecord> attempts;

	public TextGenerationException(String message) {
		this(message, List.of(), null);
	}

	public TextGenerationException(String message, Throwable cause) {
		this(message, List.of(), cause);
	}

	public TextGenerationException(String message, List<AttemptRecord> attempts, Throwable cause) {
		super(message, cause);
		this.attempts = attempts != null ? List.copyOf(attempts) : List.of();
	}

	/**
	 * @return every attempt made before giving up, in order
	 */
	public List<AttemptRecord> attempts() {
		return attempts;
	}
}
