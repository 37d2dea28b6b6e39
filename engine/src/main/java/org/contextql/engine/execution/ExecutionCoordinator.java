package org.contextql.engine.execution;

import org.contextql.engine.cache.CacheEntry;
import org.contextql.engine.cache.ResultCache;
import org.contextql.engine.config.EngineConfig;
import org.contextql.engine.graph.JoinPath;
import org.contextql.engine.graph.JoinPathResolver;
import org.contextql.engine.graph.RelationshipGraph;
import org.contextql.engine.plan.CompiledPlan;
import org.contextql.engine.plan.QueryCompiler;
import org.contextql.engine.plan.QueryRequest;
import org.contextql.engine.repository.ContextNotFoundException;
import org.contextql.engine.repository.ContextRepository;
import org.contextql.engine.repository.StoredContext;
import org.contextql.engine.validation.ContextValidationException;
import org.contextql.engine.validation.ContextValidator;
import org.contextql.engine.validation.ValidatedContext;
import org.contextql.model.ContextDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs queries against active contexts.
 *
 * A call loads the active version, validates it for the caller unless a
 * validation of the same content is already known, resolves the join path,
 * compiles, and then either serves the result cache or executes against the
 * store under a timeout. Fresh results are formatted, cached with the
 * context's TTL and logged to the execution history.
 *
 * Store queries run on a worker pool so the caller can stop waiting; a timed
 * out worker is left to finish on its own.
 */
public class ExecutionCoordinator implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final ContextRepository repository;
    private final DatasetStore store;
    private final ContextValidator validator;
    private final QueryCompiler compiler;
    private final ResultCache cache;
    private final ExecutionHistory history;
    private final EngineConfig config;
    private final Clock clock;
    private final ExecutorService workers;

    // user + fingerprint -> validated context and its graph
    private final Map<String, Prepared> prepared = new ConcurrentHashMap<>();
    private final AtomicLong preparedSequence = new AtomicLong();

    private record Prepared(ValidatedContext context, RelationshipGraph graph, long sequence) {

        String contextId() {
            return context.document().id();
        }

        String fingerprint() {
            return context.document().fingerprint();
        }
    }

    public ExecutionCoordinator(ContextRepository repository, DatasetStore store, ResultCache cache,
                                ExecutionHistory history, EngineConfig config, Clock clock) {
        this.repository = repository;
        this.store = store;
        this.validator = new ContextValidator(store);
        this.compiler = new QueryCompiler();
        this.cache = cache;
        this.history = history;
        this.config = config;
        this.clock = clock;
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "contextql-query");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ExecutionCoordinator(ContextRepository repository, DatasetStore store, EngineConfig config) {
        this(repository, store, new ResultCache(config.cacheMaxEntries()), new ExecutionHistory(config.historySize()),
                config, Clock.systemUTC());
    }

    public ResultCache cache() {
        return cache;
    }

    public ExecutionHistory history() {
        return history;
    }

    /**
     * @throws ContextNotFoundException   if the context has no active version
     * @throws ContextValidationException if the context fails validation for the caller
     * @throws ExecutionTimeoutException  if the store exceeds the timeout
     * @throws QueryExecutionException    if the store fails
     */
    public ExecutionResponse execute(String userId, String contextId, QueryRequest request,
                                     ExecutionOptions options) {
        long start = System.nanoTime();
        ContextDocument document = activeVersion(contextId).document();
        Prepared context = prepare(document, userId);
        CompiledPlan plan = compile(context, request);

        if (options.useCache()) {
            Optional<CacheEntry> hit = cache.get(plan.cacheKey());
            if (hit.isPresent()) {
                long latency = elapsedMillis(start);
                LOGGER.info("Cache hit for context {} v{} ({} rows)", contextId, document.version(),
                        hit.get().result().rowCount());
                history.append(record(plan, userId, hit.get().result().rowCount(), latency, true, null));
                return new ExecutionResponse(plan, hit.get().result(), true, latency, plan.advisories());
            }
            LOGGER.info("Cache miss for context {} v{}", contextId, document.version());
        }

        Duration timeout = options.timeout() != null ? options.timeout() : config.executionTimeout();
        BufferedResult raw;
        try {
            raw = run(plan, timeout);
        } catch (ExecutionTimeoutException | QueryExecutionException e) {
            history.append(record(plan, userId, -1, elapsedMillis(start), false, e.getMessage()));
            throw e;
        }
        BufferedResult formatted = ValueFormatter.format(raw, plan.outputColumns());
        if (options.useCache()) {
            Duration ttl = document.settings().cacheTtl().orElse(config.cacheTtl());
            cache.put(plan.cacheKey(), contextId, document.fingerprint(), formatted, ttl);
        }
        long latency = elapsedMillis(start);
        history.append(record(plan, userId, formatted.rowCount(), latency, false, null));
        return new ExecutionResponse(plan, formatted, false, latency, plan.advisories());
    }

    public ExecutionResponse execute(String userId, String contextId, QueryRequest request) {
        return execute(userId, contextId, request, ExecutionOptions.DEFAULTS);
    }

    /**
     * Compiles a request against the active version without executing it. The
     * context is validated on behalf of its owner.
     */
    public CompiledPlan explain(String contextId, QueryRequest request) {
        StoredContext active = activeVersion(contextId);
        return compile(prepare(active.document(), active.ownerId()), request);
    }

    /**
     * Forgets validations and cached results of a context, for example after
     * its datasets changed in the store.
     */
    public void invalidate(String contextId) {
        prepared.values().removeIf(p -> p.contextId().equals(contextId));
        cache.evictContext(contextId);
    }

    private StoredContext activeVersion(String contextId) {
        return repository.active(contextId)
                .orElseThrow(() -> ContextNotFoundException.noActiveVersion(contextId));
    }

    private Prepared prepare(ContextDocument document, String userId) {
        String key = userId + "\u0000" + document.fingerprint();
        Prepared context = prepared.get(key);
        if (context == null) {
            ValidatedContext validated = validator.validate(document, userId);
            if (validated.result().blocksActivation()) {
                LOGGER.warn("Context {} v{} failed validation for user {}", document.id(), document.version(),
                        userId);
                throw new ContextValidationException(document.id(), validated.result());
            }
            context = new Prepared(validated, RelationshipGraph.build(validated), preparedSequence.incrementAndGet());
            prepared.put(key, context);
            evictStalePrepared(document);
        }
        return context;
    }

    /**
     * Drops validations of other versions of the same context, then the oldest
     * validations while more than {@code cacheMaxEntries} remain.
     */
    private void evictStalePrepared(ContextDocument current) {
        prepared.values().removeIf(p -> p.contextId().equals(current.id())
                && !p.fingerprint().equals(current.fingerprint()));
        while (prepared.size() > config.cacheMaxEntries()) {
            Optional<Map.Entry<String, Prepared>> oldest = prepared.entrySet().stream()
                    .min(Comparator.comparingLong(e -> e.getValue().sequence()));
            if (oldest.isEmpty()) {
                return;
            }
            prepared.remove(oldest.get().getKey(), oldest.get().getValue());
        }
    }

    int preparedCount() {
        return prepared.size();
    }

    private CompiledPlan compile(Prepared context, QueryRequest request) {
        ContextDocument document = context.context().document();
        JoinPath path = new JoinPathResolver(context.graph())
                .findJoinPath(QueryCompiler.requiredDatasets(request, context.context()), request.joinVia());
        CompiledPlan plan = compiler.compile(request, context.context(), path);
        LOGGER.debug("Compiled query for context {} v{}:\n{}", document.id(), document.version(), plan.sql());
        return plan;
    }

    private BufferedResult run(CompiledPlan plan, Duration timeout) {
        Future<BufferedResult> future = workers.submit(() -> store.execute(plan.sql(), plan.parameters()));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            LOGGER.warn("Query on context {} timed out after {} ms", plan.contextId(), timeout.toMillis());
            throw new ExecutionTimeoutException(plan.contextId(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new QueryExecutionException("Query on context '" + plan.contextId() + "' failed: "
                    + cause.getMessage(), plan.sql(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryExecutionException("Interrupted while waiting for query on context '"
                    + plan.contextId() + "'", plan.sql(), e);
        }
    }

    private ExecutionRecord record(CompiledPlan plan, String userId, long rowCount, long latencyMs,
                                   boolean cached, String error) {
        return new ExecutionRecord(plan.contextId(), plan.contextVersion(), userId, plan.sql(), rowCount,
                latencyMs, cached, clock.instant(), error);
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }
}
