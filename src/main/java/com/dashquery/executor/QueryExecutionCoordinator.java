package com.dashquery.executor;

import com.dashquery.config.ExecutionConfig;
import com.dashquery.engine.SqlEngineClient;
import com.dashquery.engine.SqlEngineException;
import com.dashquery.exception.EngineUnreachableException;
import com.dashquery.exception.ExecutionRejectedException;
import com.dashquery.query.QueryError;
import com.dashquery.query.QueryErrorKind;
import com.dashquery.query.QueryResult;
import com.dashquery.query.ResolvedQuery;
import com.dashquery.query.Result;
import com.dashquery.query.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs resolved panel queries against the SQL engine with bounded concurrency.
 * <p>
 * Every query gets its own timeout and failure isolation: a timeout or engine error is
 * captured as that panel's {@link QueryError} and never affects sibling queries. Transient
 * failures are retried with backoff; all other failures are not. A timed-out engine call is
 * abandoned rather than interrupted, and keeps its engine slot until it actually returns, so a
 * run never has more than {@code concurrencyLimit} calls on the engine.
 */
public class QueryExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutionCoordinator.class);

    private final SqlEngineClient client;
    private final ExecutionConfig config;
    private final RetryPolicy retryPolicy;

    // Engine calls run here so a worker can stop waiting on a call without interrupting it
    private final ExecutorService callPool;

    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicInteger runCounter = new AtomicInteger(0);
    private final AtomicInteger submittedCount = new AtomicInteger(0);
    private final AtomicInteger succeededCount = new AtomicInteger(0);
    private final AtomicInteger failedCount = new AtomicInteger(0);
    private final AtomicInteger timedOutCount = new AtomicInteger(0);
    private final AtomicInteger cancelledCount = new AtomicInteger(0);
    private final AtomicInteger retriedCount = new AtomicInteger(0);
    private final AtomicInteger engineCallCount = new AtomicInteger(0);
    private final AtomicInteger activeCalls = new AtomicInteger(0);

    public QueryExecutionCoordinator(SqlEngineClient client, ExecutionConfig config) {
        this.client = client;
        this.config = config;
        this.retryPolicy = new RetryPolicy(config.retry());
        this.callPool = Executors.newCachedThreadPool(daemonThreads("engine-call-"));

        log.info("QueryExecutionCoordinator initialized: concurrency={}, timeout={}ms, max retries={}",
                config.concurrencyLimit(), config.queryTimeoutMs(), config.retry().maxRetries());
    }

    /**
     * Execute queries with the configured concurrency limit.
     */
    public List<Result<QueryResult, QueryError>> execute(List<ResolvedQuery> queries) {
        return execute(queries, config.concurrencyLimit(), CancellationToken.create());
    }

    /**
     * Execute queries with at most {@code concurrencyLimit} in flight.
     */
    public List<Result<QueryResult, QueryError>> execute(List<ResolvedQuery> queries, int concurrencyLimit) {
        return execute(queries, concurrencyLimit, CancellationToken.create());
    }

    /**
     * Execute queries with at most {@code concurrencyLimit} in flight.
     * Blocks until every query has produced a result, an error, or been cancelled.
     *
     * @param queries          Queries to run; panel ids must be unique
     * @param concurrencyLimit Maximum queries in flight
     * @param cancellation     Cancels queries that have not started yet
     * @return One result per query, in input order
     * @throws EngineUnreachableException if the engine cannot be reached at all
     */
    public List<Result<QueryResult, QueryError>> execute(List<ResolvedQuery> queries, int concurrencyLimit,
                                                        CancellationToken cancellation) {
        if (queries == null) {
            throw new NullPointerException("Queries cannot be null");
        }
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be >= 1, got " + concurrencyLimit);
        }
        if (shutdown.get()) {
            throw new ExecutionRejectedException("Coordinator is shutdown");
        }
        checkUniquePanelIds(queries);
        if (queries.isEmpty()) {
            return List.of();
        }

        client.checkAvailable();

        int runId = runCounter.incrementAndGet();
        int workerCount = Math.min(concurrencyLimit, queries.size());
        submittedCount.addAndGet(queries.size());
        log.info("Run {}: executing {} queries with {} workers", runId, queries.size(), workerCount);

        // Append-only per-run buffer; each worker writes only its own panel's key
        Map<String, Result<QueryResult, QueryError>> results = new ConcurrentHashMap<>();
        // One permit per engine call; released when the call returns, not when its worker stops waiting
        Semaphore engineSlots = new Semaphore(concurrencyLimit);

        ExecutorService workers = Executors.newFixedThreadPool(workerCount, daemonThreads("query-worker-" + runId + "-"));
        try {
            List<Future<?>> futures = new ArrayList<>(queries.size());
            for (ResolvedQuery query : queries) {
                futures.add(workers.submit(() -> results.put(query.panelId(), runQuery(query, engineSlots, cancellation))));
            }
            awaitAll(futures, queries, results);
        } finally {
            workers.shutdown();
        }

        List<Result<QueryResult, QueryError>> ordered = new ArrayList<>(queries.size());
        int ok = 0;
        for (ResolvedQuery query : queries) {
            Result<QueryResult, QueryError> result = results.get(query.panelId());
            if (result.isOk()) {
                ok++;
            }
            ordered.add(result);
        }
        log.info("Run {}: {} of {} queries succeeded", runId, ok, queries.size());
        return ordered;
    }

    private void awaitAll(List<Future<?>> futures, List<ResolvedQuery> queries,
                          Map<String, Result<QueryResult, QueryError>> results) {
        for (int i = 0; i < futures.size(); i++) {
            String panelId = queries.get(i).panelId();
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for panel {}", panelId);
                results.putIfAbsent(panelId, Result.err(QueryError.cancelled(panelId)));
            } catch (ExecutionException e) {
                log.error("Worker for panel {} failed unexpectedly", panelId, e.getCause());
                results.putIfAbsent(panelId, Result.err(new QueryError(panelId, QueryErrorKind.TRANSIENT,
                        "Worker failed: " + e.getCause(), 0)));
            }
        }
    }

    /**
     * Run one query to completion, retrying transient failures.
     */
    private Result<QueryResult, QueryError> runQuery(ResolvedQuery query, Semaphore engineSlots,
                                                     CancellationToken cancellation) {
        String panelId = query.panelId();
        if (cancellation.isCancelled()) {
            cancelledCount.incrementAndGet();
            log.debug("Panel {} cancelled before start", panelId);
            return Result.err(QueryError.cancelled(panelId));
        }

        int attempts = 0;
        while (true) {
            attempts++;
            try {
                RowSet rows = callWithTimeout(query.sql(), engineSlots);
                succeededCount.incrementAndGet();
                log.debug("Panel {} returned {} rows after {} attempt(s)", panelId, rows.rows().size(), attempts);
                return Result.ok(QueryResult.of(panelId, rows));
            } catch (SqlEngineException e) {
                if (retryPolicy.shouldRetry(e.getKind(), attempts) && !cancellation.isCancelled()) {
                    long delay = retryPolicy.backoffMillis(attempts);
                    log.debug("Panel {} attempt {} failed ({}), retrying in {}ms",
                            panelId, attempts, e.getMessage(), delay);
                    if (awaitBackoff(delay, cancellation)) {
                        retriedCount.incrementAndGet();
                        continue;
                    }
                    cancelledCount.incrementAndGet();
                    log.debug("Panel {} cancelled during retry backoff", panelId);
                    return Result.err(new QueryError(panelId, QueryErrorKind.CANCELLED,
                            "Cancelled while waiting to retry: " + e.getMessage(), attempts));
                }
                return failure(panelId, e.getKind(), e.getMessage(), attempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelledCount.incrementAndGet();
                return Result.err(new QueryError(panelId, QueryErrorKind.CANCELLED, "Interrupted", attempts));
            }
        }
    }

    private Result<QueryResult, QueryError> failure(String panelId, QueryErrorKind kind, String message, int attempts) {
        failedCount.incrementAndGet();
        if (kind == QueryErrorKind.TIMEOUT) {
            timedOutCount.incrementAndGet();
        }
        log.warn("Panel {} failed with {} after {} attempt(s): {}", panelId, kind, attempts, message);
        return Result.err(new QueryError(panelId, kind, message, attempts));
    }

    private RowSet callWithTimeout(String sql, Semaphore engineSlots) throws SqlEngineException, InterruptedException {
        Duration timeout = config.queryTimeout();
        if (!engineSlots.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new SqlEngineException(QueryErrorKind.TIMEOUT,
                    "No engine slot freed within " + timeout.toMillis() + "ms, earlier calls still running");
        }
        engineCallCount.incrementAndGet();
        activeCalls.incrementAndGet();

        Future<RowSet> call;
        try {
            call = callPool.submit(() -> {
                try {
                    return client.runQuery(sql, timeout);
                } finally {
                    activeCalls.decrementAndGet();
                    engineSlots.release();
                }
            });
        } catch (RuntimeException e) {
            activeCalls.decrementAndGet();
            engineSlots.release();
            throw new SqlEngineException(QueryErrorKind.TRANSIENT, "Engine call rejected: " + e.getMessage(), e);
        }

        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Not cancelled: the call must run to its finally to give back its slot
            throw new SqlEngineException(QueryErrorKind.TIMEOUT,
                    "Query exceeded timeout of " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SqlEngineException engineException) {
                throw engineException;
            }
            if (cause instanceof EngineUnreachableException) {
                throw new SqlEngineException(QueryErrorKind.TRANSIENT, cause.getMessage(), cause);
            }
            throw new SqlEngineException(QueryErrorKind.SYNTAX,
                    "Engine client failed: " + cause, cause);
        }
    }

    /**
     * @return false if the run was cancelled or the worker interrupted during the wait
     */
    private boolean awaitBackoff(long millis, CancellationToken cancellation) {
        try {
            return !cancellation.await(Math.max(millis, 0));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void checkUniquePanelIds(List<ResolvedQuery> queries) {
        Set<String> seen = new HashSet<>();
        for (ResolvedQuery query : queries) {
            if (!seen.add(query.panelId())) {
                throw new IllegalArgumentException("Duplicate panel id: " + query.panelId());
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            log.info("Shutting down QueryExecutionCoordinator");
            callPool.shutdown();
        }
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return callPool.awaitTermination(timeout, unit);
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public ExecutionConfig getConfig() {
        return config;
    }

    /**
     * Get statistics.
     */
    public ExecutionStats getStats() {
        return new ExecutionStats(
                submittedCount.get(),
                succeededCount.get(),
                failedCount.get(),
                timedOutCount.get(),
                cancelledCount.get(),
                retriedCount.get(),
                engineCallCount.get(),
                activeCalls.get()
        );
    }
}
