package org.javai.fedquery.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Defaults for concurrent work.
 *
 * @param defaultTimeout query timeout for connections that configure none
 * @param defaultMaxRows row cap for connections that configure none
 * @param threadPoolSize size of the pool shared by synthesis and execution tasks
 * @param aiCallTimeout upper bound for one text-generation call made by a pipeline stage
 */
public record ExecutionSettings(
		Duration defaultTimeout,
		int defaultMaxRows,
		int threadPoolSize,
		Duration aiCallTimeout
) {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
	public static final int DEFAULT_MAX_ROWS = 100;
	public static final int DEFAULT_THREAD_POOL_SIZE = 8;
	public static final Duration DEFAULT_AI_CALL_TIMEOUT = Duration.ofSeconds(120);

	public ExecutionSettings {
		Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
		Objects.requireNonNull(aiCallTimeout, "aiCallTimeout must not be null");
		if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
			throw new IllegalArgumentException("defaultTimeout must be positive");
		}
		if (defaultMaxRows < 1 || threadPoolSize < 1) {
			throw new IllegalArgumentException("defaultMaxRows and threadPoolSize must be >= 1");
		}
	}

	public static ExecutionSettings defaults() {
		return new ExecutionSettings(DEFAULT_TIMEOUT, DEFAULT_MAX_ROWS, DEFAULT_THREAD_POOL_SIZE, DEFAULT_AI_CALL_TIMEOUT);
	}
}
