package com.dashquery.engine;

import com.dashquery.exception.EngineUnreachableException;
import com.dashquery.query.ColumnSpec;
import com.dashquery.query.ColumnType;
import com.dashquery.query.QueryErrorKind;
import com.dashquery.query.RowSet;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory SqlEngineClient whose answers are scripted per SQL text.
 * Unscripted queries return a single row with one numeric column.
 */
public class ScriptedEngineClient implements SqlEngineClient {

    /**
     * One scripted answer.
     */
    @FunctionalInterface
    public interface Answer {
        RowSet answer(String sql) throws SqlEngineException;
    }

    public static final RowSet ONE_ROW = new RowSet(
            List.of(ColumnSpec.of("value", ColumnType.NUMERIC)),
            List.of(List.<Object>of(1)));

    private final Map<String, Deque<Answer>> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> callsBySql = new ConcurrentHashMap<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile boolean available = true;

    /**
     * Queue answers for a query; the last answer repeats once the others are used.
     */
    public ScriptedEngineClient script(String sql, Answer... answers) {
        scripts.put(sql, new ArrayDeque<>(List.of(answers)));
        return this;
    }

    public ScriptedEngineClient unavailable() {
        this.available = false;
        return this;
    }

    @Override
    public RowSet runQuery(String sql, Duration timeout) throws SqlEngineException {
        calls.incrementAndGet();
        callsBySql.computeIfAbsent(sql, k -> new AtomicInteger()).incrementAndGet();
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            return next(sql).answer(sql);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private Answer next(String sql) {
        Deque<Answer> answers = scripts.get(sql);
        if (answers == null) {
            return s -> ONE_ROW;
        }
        synchronized (answers) {
            return answers.size() > 1 ? answers.poll() : answers.peek();
        }
    }

    @Override
    public void checkAvailable() {
        if (!available) {
            throw new EngineUnreachableException("scripted engine is down");
        }
    }

    public int calls() {
        return calls.get();
    }

    public int calls(String sql) {
        AtomicInteger count = callsBySql.get(sql);
        return count == null ? 0 : count.get();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    // Answers

    public static Answer rows(RowSet rows) {
        return sql -> rows;
    }

    public static Answer fail(QueryErrorKind kind) {
        return sql -> {
            throw new SqlEngineException(kind, kind + " failure for " + sql);
        };
    }

    public static Answer sleep(long millis) {
        return sql -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SqlEngineException(QueryErrorKind.CANCELLED, "interrupted");
            }
            return ONE_ROW;
        };
    }
}
