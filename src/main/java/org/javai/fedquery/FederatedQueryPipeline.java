package org.javai.fedquery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.javai.fedquery.ai.TextGenerator;
import org.javai.fedquery.analysis.ConfidenceBucket;
import org.javai.fedquery.analysis.InMemoryQueryIntentCache;
import org.javai.fedquery.analysis.QueryIntent;
import org.javai.fedquery.analysis.QueryIntentAnalyzer;
import org.javai.fedquery.analysis.QueryIntentCache;
import org.javai.fedquery.analysis.Route;
import org.javai.fedquery.analysis.RoutingPolicy;
import org.javai.fedquery.config.ConnectionLimits;
import org.javai.fedquery.config.FederationSettings;
import org.javai.fedquery.exec.JdbcReadOnlyQueryRunner;
import org.javai.fedquery.exec.ParallelQueryExecutor;
import org.javai.fedquery.exec.QueryExecutionResult;
import org.javai.fedquery.exec.ReadOnlyQueryRunner;
import org.javai.fedquery.intent.IntentClassification;
import org.javai.fedquery.intent.QueryIntentClassifier;
import org.javai.fedquery.intent.SlashCommand;
import org.javai.fedquery.intent.UnclassifiableQueryException;
import org.javai.fedquery.merge.DocumentChunk;
import org.javai.fedquery.merge.DocumentSearch;
import org.javai.fedquery.merge.MergeRequest;
import org.javai.fedquery.merge.MergedAnswer;
import org.javai.fedquery.merge.ResultMerger;
import org.javai.fedquery.schema.ConfiguredSchemaCatalog;
import org.javai.fedquery.schema.CrossDatabaseMapping;
import org.javai.fedquery.schema.CrossDatabaseMappingDetector;
import org.javai.fedquery.schema.FederatedSchemaView;
import org.javai.fedquery.schema.SchemaCatalog;
import org.javai.fedquery.sql.DialectStrategyRegistry;
import org.javai.fedquery.sql.SqlSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers natural-language questions from federated databases and documents.
 *
 * <p>A request runs classification, analysis, routing, SQL synthesis, parallel execution and
 * merging in sequence. Conversational input stops after classification. Failures of individual
 * databases or of document search are recorded as failed sources; only an unclassifiable query
 * or a cancellation escapes to the caller.</p>
 *
 * <pre>{@code
 * try (FederatedQueryPipeline pipeline = FederatedQueryPipeline.builder()
 *         .settings(new FederationSettingsLoader().loadDefaults())
 *         .textGenerator(generator)
 *         .schemaCatalog(catalog)
 *         .queryRunner(runner)
 *         .documentSearch(search)
 *         .build()) {
 *     MergedAnswer answer = pipeline.answer("Show top 5 customers by order count");
 * }
 * }</pre>
 */
public class FederatedQueryPipeline implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(FederatedQueryPipeline.class);

	static final String NEW_CONVERSATION_REPLY = "New conversation started.";
	static final String DEFAULT_CONVERSATION_REPLY =
			"Hello! Ask me a question about your data or documents and I will look it up.";

	private final FederationSettings settings;
	private final SchemaCatalog catalog;
	private final CrossDatabaseMappingDetector mappingDetector;
	private final List<CrossDatabaseMapping> configuredMappings;
	private final QueryIntentClassifier classifier;
	private final QueryIntentAnalyzer analyzer;
	private final QueryIntentCache intentCache;
	private final RoutingPolicy routingPolicy;
	private final SqlSynthesizer synthesizer;
	private final ParallelQueryExecutor queryExecutor;
	private final ResultMerger merger;
	private final DocumentSearch documentSearch;
	private final ConversationResponder conversationResponder;
	private final ExecutorService executor;
	private final boolean ownsExecutor;
	private final AutoCloseable ownedRunner;

	private FederatedQueryPipeline(Builder builder) {
		this.settings = builder.settings;
		this.catalog = new ConfiguredSchemaCatalog(builder.schemaCatalog, settings.connections());
		this.mappingDetector = builder.mappingDetector;
		this.configuredMappings = settings.enabledConnections().stream()
				.flatMap(c -> c.mappings().stream())
				.toList();
		this.ownsExecutor = builder.executor == null;
		this.executor = ownsExecutor
				? Executors.newFixedThreadPool(settings.execution().threadPoolSize(), new WorkerThreadFactory())
				: builder.executor;

		ReadOnlyQueryRunner runner = builder.queryRunner;
		if (runner == null) {
			JdbcReadOnlyQueryRunner jdbcRunner = JdbcReadOnlyQueryRunner.fromSettings(settings);
			this.ownedRunner = jdbcRunner;
			runner = jdbcRunner;
		} else {
			this.ownedRunner = null;
		}

		ConnectionLimits limits = new ConnectionLimits(settings);
		TextGenerator generator = builder.textGenerator;
		this.classifier = new QueryIntentClassifier(generator, settings.classifier());
		this.analyzer = new QueryIntentAnalyzer(generator, settings.analysis());
		this.intentCache = builder.intentCache;
		this.routingPolicy = new RoutingPolicy(settings.routing());
		this.synthesizer = new SqlSynthesizer(generator, builder.dialects, settings.synthesis(), limits, executor,
				settings.execution().aiCallTimeout());
		this.queryExecutor = new ParallelQueryExecutor(runner, limits, executor);
		this.merger = new ResultMerger(generator);
		this.documentSearch = builder.documentSearch;
		this.conversationResponder = builder.conversationResponder;
	}

	public static Builder builder() {
		return new Builder();
	}

	public MergedAnswer answer(String query) {
		return answer(query, "", new CancellationSignal());
	}

	/**
	 * Answer one request.
	 *
	 * @param query the user's input, possibly a slash command
	 * @param conversationHistory recent history, may be null
	 * @param signal cancels every outstanding AI and database call of this request
	 * @return the answer with its sources
	 * @throws UnclassifiableQueryException if the query is null, blank or has nothing to tokenize
	 * @throws CancellationException if the request is cancelled
	 */
	public MergedAnswer answer(String query, String conversationHistory, CancellationSignal signal) {
		Objects.requireNonNull(signal, "signal must not be null");
		long start = System.nanoTime();
		String history = conversationHistory != null ? conversationHistory : "";

		MergedAnswer answer;
		SlashCommand.Invocation command = SlashCommand.parse(query).orElse(null);
		if (command == null) {
			answer = process(query, history, signal);
		} else {
			answer = switch (command.command()) {
				case NEW_CONVERSATION -> {
					logger.info("Starting a new conversation");
					MergedAnswer reply = command.hasPayload()
							? process(command.payload(), "", signal)
							: MergedAnswer.conversation(NEW_CONVERSATION_REPLY);
					yield reply.withConversationReset(true);
				}
				case FORCE_CONVERSATION -> conversation(command.payload(), history, null, signal);
			};
		}
		return answer.withExecutionTime(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
	}

	private MergedAnswer process(String query, String history, CancellationSignal signal) {
		signal.throwIfCancelled();
		IntentClassification classification = signal.interruptible(() -> classifier.classify(query, history));
		if (classification instanceof IntentClassification.Conversation conversation) {
			logger.info("Conversation ({}): answering without retrieval", conversation.source());
			return conversation(query, history, conversation.directAnswer(), signal);
		}
		List<String> tokens = ((IntentClassification.Information) classification).tokens();
		String trimmed = query.trim();

		signal.throwIfCancelled();
		FederatedSchemaView view = FederatedSchemaView.capture(catalog, mappingDetector, configuredMappings);
		QueryIntent intent = intentCache.get(trimmed).orElse(null);
		if (intent == null) {
			intent = signal.interruptible(() -> analyzer.analyze(trimmed, tokens, view));
			intentCache.put(trimmed, intent);
		} else {
			logger.debug("Using cached intent for: {}", trimmed);
		}

		Route route = routingPolicy.route(intent);
		ConfidenceBucket bucket = routingPolicy.bucketFor(intent.confidence());
		logger.info("Routing '{}' via {} (confidence {}, {} databases)", trimmed, route, intent.confidence(),
				intent.databaseQueries().size());

		Future<List<DocumentChunk>> documents = null;
		if (route.usesDocuments() && documentSearch != null) {
			documents = signal.track(executor.submit(
					() -> documentSearch.search(trimmed, settings.maxDocumentResults())));
		}

		Map<String, QueryExecutionResult> results = Map.of();
		if (route.usesDatabases() && !intent.databaseQueries().isEmpty()) {
			QueryIntent synthesized = synthesizer.synthesize(intent, tokens, view, signal);
			results = queryExecutor.execute(synthesized, signal);
		}

		List<DocumentChunk> chunks = new ArrayList<>();
		String documentError = null;
		if (documents != null) {
			try {
				chunks.addAll(awaitDocuments(documents));
			} catch (DocumentSearchFailure e) {
				documentError = e.getMessage();
			}
		}
		MergeRequest request = new MergeRequest(trimmed, history, route, bucket, results, chunks, documentError, view);
		return signal.interruptible(() -> merger.merge(request));
	}

	private List<DocumentChunk> awaitDocuments(Future<List<DocumentChunk>> documents) throws DocumentSearchFailure {
		try {
			List<DocumentChunk> chunks = documents.get(settings.execution().defaultTimeout().toMillis(),
					TimeUnit.MILLISECONDS);
			return chunks != null ? chunks : List.of();
		} catch (TimeoutException e) {
			documents.cancel(true);
			logger.warn("Document search timed out");
			throw new DocumentSearchFailure("Document search timed out");
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CancellationException("Interrupted while searching documents");
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			logger.warn("Document search failed: {}", cause.getMessage());
			throw new DocumentSearchFailure("Document search failed: " + cause.getMessage());
		}
	}

	private MergedAnswer conversation(String message, String history, String directAnswer,
			CancellationSignal signal) {
		if (conversationResponder != null) {
			try {
				String reply = signal.interruptible(() -> conversationResponder.respond(message, history));
				if (reply != null && !reply.isBlank()) {
					return MergedAnswer.conversation(reply.trim());
				}
			} catch (CancellationException e) {
				throw e;
			} catch (RuntimeException e) {
				logger.warn("Conversation responder failed: {}", e.getMessage());
			}
		}
		if (directAnswer != null && !directAnswer.isBlank()) {
			return MergedAnswer.conversation(directAnswer.trim());
		}
		return MergedAnswer.conversation(DEFAULT_CONVERSATION_REPLY);
	}

	/**
	 * Forget cached intents, e.g. after schemas were refreshed.
	 */
	public void clearIntentCache() {
		intentCache.clear();
	}

	@Override
	public void close() {
		if (ownsExecutor) {
			executor.shutdownNow();
		}
		if (ownedRunner != null) {
			try {
				ownedRunner.close();
			} catch (Exception e) {
				logger.warn("Failed to close query runner", e);
			}
		}
	}

	private static final class DocumentSearchFailure extends Exception {

		DocumentSearchFailure(String message) {
			super(message);
		}
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "fedquery-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}
	}

	public static final class Builder {

		private FederationSettings settings = FederationSettings.defaults();
		private TextGenerator textGenerator;
		private SchemaCatalog schemaCatalog;
		private ReadOnlyQueryRunner queryRunner;
		private DocumentSearch documentSearch;
		private ConversationResponder conversationResponder;
		private QueryIntentCache intentCache = new InMemoryQueryIntentCache();
		private DialectStrategyRegistry dialects = DialectStrategyRegistry.defaults();
		private CrossDatabaseMappingDetector mappingDetector = new CrossDatabaseMappingDetector();
		private ExecutorService executor;

		private Builder() {
		}

		public Builder settings(FederationSettings settings) {
			this.settings = Objects.requireNonNull(settings, "settings must not be null");
			return this;
		}

		public Builder textGenerator(TextGenerator textGenerator) {
			this.textGenerator = textGenerator;
			return this;
		}

		public Builder schemaCatalog(SchemaCatalog schemaCatalog) {
			this.schemaCatalog = schemaCatalog;
			return this;
		}

		/**
		 * Runner for validated statements. Without one, pooled JDBC connections are created from
		 * the connection settings and closed with the pipeline.
		 */
		public Builder queryRunner(ReadOnlyQueryRunner queryRunner) {
			this.queryRunner = queryRunner;
			return this;
		}

		public Builder documentSearch(DocumentSearch documentSearch) {
			this.documentSearch = documentSearch;
			return this;
		}

		public Builder conversationResponder(ConversationResponder conversationResponder) {
			this.conversationResponder = conversationResponder;
			return this;
		}

		public Builder intentCache(QueryIntentCache intentCache) {
			this.intentCache = Objects.requireNonNull(intentCache, "intentCache must not be null");
			return this;
		}

		public Builder dialects(DialectStrategyRegistry dialects) {
			this.dialects = Objects.requireNonNull(dialects, "dialects must not be null");
			return this;
		}

		public Builder mappingDetector(CrossDatabaseMappingDetector mappingDetector) {
			this.mappingDetector = mappingDetector;
			return this;
		}

		/**
		 * Shared executor for per-database work. Without one, the pipeline creates a fixed pool
		 * sized by the execution settings and shuts it down on close.
		 */
		public Builder executor(ExecutorService executor) {
			this.executor = executor;
			return this;
		}

		public FederatedQueryPipeline build() {
			Objects.requireNonNull(textGenerator, "textGenerator must not be null");
			Objects.requireNonNull(schemaCatalog, "schemaCatalog must not be null");
			return new FederatedQueryPipeline(this);
		}
	}
}
