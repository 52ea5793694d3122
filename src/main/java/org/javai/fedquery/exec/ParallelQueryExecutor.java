package org.javai.fedquery.exec;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.javai.fedquery.CancellationSignal;
import org.javai.fedquery.TimedTask;
import org.javai.fedquery.analysis.DatabaseQueryIntent;
import org.javai.fedquery.analysis.QueryIntent;
import org.javai.fedquery.config.ConnectionLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes the validated statements of an intent concurrently, one task per database.
 *
 * <p>Each task is bounded by its connection's timeout, counted from when the task starts running,
 * and by its row cap. A failing or timed-out task
 * yields a failed {@link QueryExecutionResult} and does not affect the others. Results are
 * written to a concurrent map once per database: whichever of the task and the timeout handler
 * writes first wins.</p>
 */
public class ParallelQueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(ParallelQueryExecutor.class);

	private final ReadOnlyQueryRunner runner;
	private final ConnectionLimits connectionLimits;
	private final ExecutorService executor;

	public ParallelQueryExecutor(ReadOnlyQueryRunner runner, ConnectionLimits connectionLimits,
			ExecutorService executor) {
		this.runner = Objects.requireNonNull(runner, "runner must not be null");
		this.connectionLimits = Objects.requireNonNull(connectionLimits, "connectionLimits must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
	}

	/**
	 * Execute every database query of the intent.
	 *
	 * @return one result per database query, in intent order
	 * @throws CancellationException if the request is cancelled
	 */
	public Map<String, QueryExecutionResult> execute(QueryIntent intent, CancellationSignal signal) {
		Objects.requireNonNull(intent, "intent must not be null");
		Objects.requireNonNull(signal, "signal must not be null");
		signal.throwIfCancelled();

		ConcurrentMap<String, QueryExecutionResult> results = new ConcurrentHashMap<>();
		List<PendingQuery> pending = new ArrayList<>();
		for (DatabaseQueryIntent target : intent.databaseQueries()) {
			if (!target.isExecutable()) {
				String reason = target.validationError() != null ? target.validationError() : "No validated SQL";
				results.putIfAbsent(target.databaseId(),
						QueryExecutionResult.failure(target.databaseId(), target.sql(), reason, 0));
				continue;
			}
			Duration timeout = connectionLimits.timeout(target.databaseId());
			int maxRows = connectionLimits.maxRows(target.databaseId());
			TimedTask<Void> task = TimedTask.submit(executor, () -> {
				run(target, maxRows, timeout, results);
				return null;
			});
			signal.track(task.future());
			pending.add(new PendingQuery(target, timeout, task));
		}

		for (PendingQuery query : pending) {
			await(query, results, signal);
		}

		Map<String, QueryExecutionResult> ordered = new LinkedHashMap<>();
		for (DatabaseQueryIntent target : intent.databaseQueries()) {
			QueryExecutionResult result = results.get(target.databaseId());
			if (result != null) {
				ordered.putIfAbsent(target.databaseId(), result);
			}
		}
		return Collections.unmodifiableMap(ordered);
	}

	private void run(DatabaseQueryIntent target, int maxRows, Duration timeout,
			ConcurrentMap<String, QueryExecutionResult> results) {
		String databaseId = target.databaseId();
		long start = System.nanoTime();
		QueryExecutionResult result;
		try {
			TabularResult data = runner.execute(databaseId, target.sql(), maxRows, timeout);
			result = QueryExecutionResult.success(databaseId, target.sql(), data, elapsedMillis(start));
			logger.info("Query on {} returned {} rows in {} ms", databaseId, data.rowCount(), result.elapsedMillis());
		} catch (SQLException e) {
			result = QueryExecutionResult.failure(databaseId, target.sql(), e.getMessage(), elapsedMillis(start));
			logger.warn("Query on {} failed: {}", databaseId, e.getMessage());
		} catch (RuntimeException e) {
			result = QueryExecutionResult.failure(databaseId, target.sql(),
					e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedMillis(start));
			logger.warn("Query on {} failed", databaseId, e);
		}
		results.putIfAbsent(databaseId, result);
	}

	private void await(PendingQuery query, ConcurrentMap<String, QueryExecutionResult> results,
			CancellationSignal signal) {
		String databaseId = query.target().databaseId();
		try {
			query.task().await(query.timeout());
		} catch (TimeoutException e) {
			logger.warn("Query on {} timed out after {}", databaseId, query.timeout());
			results.putIfAbsent(databaseId, QueryExecutionResult.failure(databaseId, query.target().sql(),
					"Query timed out after " + query.timeout().toMillis() + " ms", query.timeout().toMillis()));
			query.task().future().cancel(true);
		} catch (CancellationException e) {
			signal.throwIfCancelled();
			results.putIfAbsent(databaseId,
					QueryExecutionResult.failure(databaseId, query.target().sql(), "Query was cancelled", 0));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			signal.cancel();
			throw new CancellationException("Interrupted while executing queries");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			results.putIfAbsent(databaseId,
					QueryExecutionResult.failure(databaseId, query.target().sql(), cause.getMessage(), 0));
		}
	}

	private static long elapsedMillis(long startNanos) {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
	}

	private record PendingQuery(DatabaseQueryIntent target, Duration timeout, TimedTask<Void> task) {
	}
}
