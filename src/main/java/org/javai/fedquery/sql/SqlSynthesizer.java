package org.javai.fedquery.sql;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import org.javai.fedquery.CancellationSignal;
import org.javai.fedquery.TimedTask;
import org.javai.fedquery.ai.TextGenerationException;
import org.javai.fedquery.ai.TextGenerator;
import org.javai.fedquery.analysis.DatabaseQueryIntent;
import org.javai.fedquery.analysis.QueryIntent;
import org.javai.fedquery.config.ConnectionLimits;
import org.javai.fedquery.config.SynthesisSettings;
import org.javai.fedquery.intent.QueryTokens;
import org.javai.fedquery.schema.FederatedSchemaView;
import org.javai.fedquery.schema.SchemaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates one validated SELECT per selected database, concurrently.
 *
 * <p>Each sub-query is generated against its whitelisted tables only, formatted, capped to the
 * requested row count and validated. A sub-query that fails any step is marked invalid and is
 * never executed. Synthesis is not retried.</p>
 */
public class SqlSynthesizer {

	private static final Logger logger = LoggerFactory.getLogger(SqlSynthesizer.class);

	private final TextGenerator textGenerator;
	private final DialectStrategyRegistry dialects;
	private final ConnectionLimits connectionLimits;
	private final ExecutorService executor;
	private final Duration timeout;
	private final SchemaWhitelistValidator validator;
	private final SqlPromptBuilder promptBuilder;
	private final SqlResponseExtractor extractor = new SqlResponseExtractor();

	public SqlSynthesizer(TextGenerator textGenerator, DialectStrategyRegistry dialects, SynthesisSettings settings,
			ConnectionLimits connectionLimits, ExecutorService executor, Duration timeout) {
		this.textGenerator = Objects.requireNonNull(textGenerator, "textGenerator must not be null");
		this.dialects = Objects.requireNonNull(dialects, "dialects must not be null");
		Objects.requireNonNull(settings, "settings must not be null");
		this.connectionLimits = Objects.requireNonNull(connectionLimits, "connectionLimits must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
		this.validator = new SchemaWhitelistValidator(settings);
		this.promptBuilder = new SqlPromptBuilder(settings);
	}

	/**
	 * Synthesize SQL for every database query of the intent.
	 *
	 * @param intent the analysed intent
	 * @param tokens search tokens from classification
	 * @param view the schema view the intent was analysed against
	 * @param signal request-wide cancellation
	 * @return the intent with each database query either VALID with SQL or INVALID with an error
	 * @throws CancellationException if the request is cancelled
	 */
	public QueryIntent synthesize(QueryIntent intent, List<String> tokens, FederatedSchemaView view,
			CancellationSignal signal) {
		Objects.requireNonNull(intent, "intent must not be null");
		Objects.requireNonNull(view, "view must not be null");
		Objects.requireNonNull(signal, "signal must not be null");
		if (intent.databaseQueries().isEmpty()) {
			return intent;
		}
		signal.throwIfCancelled();

		List<SchemaSnapshot> whitelists = new ArrayList<>();
		for (DatabaseQueryIntent target : intent.databaseQueries()) {
			view.schema(target.databaseId()).map(s -> s.restrictTo(target.requiredTables())).ifPresent(whitelists::add);
		}
		Set<String> words = new LinkedHashSet<>(QueryTokens.searchTerms(intent.originalQuery()));
		if (tokens != null) {
			words.addAll(QueryTokens.normalize(tokens));
		}
		Set<String> forbidden = ForbiddenTerms.compute(words, whitelists);
		if (!forbidden.isEmpty()) {
			logger.debug("Forbidden filter terms: {}", forbidden);
		}

		List<TimedTask<DatabaseQueryIntent>> tasks = new ArrayList<>();
		for (DatabaseQueryIntent target : intent.databaseQueries()) {
			TimedTask<DatabaseQueryIntent> task = TimedTask.submit(executor,
					() -> synthesizeOne(intent, target, view, forbidden));
			signal.track(task.future());
			tasks.add(task);
		}

		List<DatabaseQueryIntent> results = new ArrayList<>();
		for (int i = 0; i < tasks.size(); i++) {
			DatabaseQueryIntent target = intent.databaseQueries().get(i);
			results.add(await(tasks.get(i), target, signal));
		}
		return intent.withDatabaseQueries(results);
	}

	private DatabaseQueryIntent await(TimedTask<DatabaseQueryIntent> task, DatabaseQueryIntent target,
			CancellationSignal signal) {
		try {
			return task.await(timeout);
		} catch (TimeoutException e) {
			task.future().cancel(true);
			logger.warn("SQL synthesis for {} timed out after {}", target.databaseId(), timeout);
			return target.withValidationFailure(null, "SQL synthesis timed out after " + timeout.toSeconds() + "s");
		} catch (CancellationException e) {
			signal.throwIfCancelled();
			return target.withValidationFailure(null, "SQL synthesis was cancelled");
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			signal.cancel();
			throw new CancellationException("Interrupted while synthesizing SQL");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			logger.warn("SQL synthesis for {} failed", target.databaseId(), cause);
			return target.withValidationFailure(null, "SQL synthesis failed: " + cause.getMessage());
		}
	}

	DatabaseQueryIntent synthesizeOne(QueryIntent intent, DatabaseQueryIntent target, FederatedSchemaView view,
			Set<String> forbiddenTerms) {
		String databaseId = target.databaseId();
		Optional<SchemaSnapshot> schema = view.schema(databaseId);
		if (schema.isEmpty()) {
			return reject(target, null, "Unknown database: " + databaseId);
		}
		SchemaSnapshot whitelist = schema.get().restrictTo(target.requiredTables());
		if (whitelist.tables().isEmpty()) {
			return reject(target, null, "No tables selected for " + databaseId);
		}

		DialectStrategy strategy;
		try {
			strategy = dialects.forDialect(whitelist.dialect());
		} catch (IllegalArgumentException e) {
			return reject(target, null, e.getMessage());
		}

		int rowLimit = RowLimitResolver.resolve(intent.originalQuery(), connectionLimits.maxRows(databaseId));
		String systemPrompt = strategy.buildSystemPrompt(whitelist, intent.originalQuery());
		String userPrompt = promptBuilder.build(intent.originalQuery(), target, whitelist,
				view.mappingsFor(databaseId), intent.requiresCrossDatabaseJoin(), forbiddenTerms, rowLimit, strategy);

		String response;
		try {
			response = textGenerator.generate(userPrompt, systemPrompt);
		} catch (TextGenerationException e) {
			return reject(target, null, "SQL generation failed: " + e.getMessage());
		}
		logger.debug("SQL response for {}: {}", databaseId, response);

		Optional<String> extracted = extractor.extract(response);
		if (extracted.isEmpty()) {
			return reject(target, null, "The model returned no SQL");
		}
		String sql = strategy.applyRowLimit(strategy.formatSql(extracted.get()), rowLimit);

		SyntaxCheck syntax = strategy.validateSyntax(sql);
		if (!syntax.ok()) {
			return reject(target, sql, syntax.error());
		}
		try {
			validator.validate(sql, whitelist, forbiddenTerms, strategy);
		} catch (SqlValidationException e) {
			return reject(target, sql, e.getMessage());
		}
		logger.info("Synthesized SQL for {}: {}", databaseId, sql);
		return target.withValidSql(sql);
	}

	private static DatabaseQueryIntent reject(DatabaseQueryIntent target, String sql, String error) {
		logger.warn("Rejected SQL for {}: {}", target.databaseId(), error);
		return target.withValidationFailure(sql, error);
	}
}
