package org.javai.fedquery;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A task on a shared executor whose timeout runs from the moment it starts, not from submission.
 * Time spent queued behind other work does not count against it.
 *
 * @param <T> the result type
 */
public final class TimedTask<T> {

	private static final long START_POLL_MILLIS = 50;

	private final CountDownLatch started = new CountDownLatch(1);
	private volatile long startNanos;
	private Future<T> future;

	private TimedTask() {
	}

	public static <T> TimedTask<T> submit(ExecutorService executor, Callable<T> work) {
		Objects.requireNonNull(executor, "executor must not be null");
		Objects.requireNonNull(work, "work must not be null");
		TimedTask<T> task = new TimedTask<>();
		task.future = executor.submit(() -> {
			task.startNanos = System.nanoTime();
			task.started.countDown();
			return work.call();
		});
		return task;
	}

	public Future<T> future() {
		return future;
	}

	/**
	 * Wait for the result, allowing the task {@code timeout} of running time.
	 *
	 * @throws TimeoutException if the task has run for longer than the timeout
	 * @throws java.util.concurrent.CancellationException if the task was cancelled
	 */
	public T await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
		while (!started.await(START_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
			if (future.isDone()) {
				// cancelled before it ever ran
				return future.get();
			}
		}
		long remaining = startNanos + timeout.toNanos() - System.nanoTime();
		return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
	}
}
