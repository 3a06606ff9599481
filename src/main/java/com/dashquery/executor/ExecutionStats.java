package com.dashquery.executor;

/**
 * Cumulative coordinator statistics.
 *
 * @param submitted   Queries accepted for execution
 * @param succeeded   Queries that returned rows
 * @param failed      Queries that ended in an error other than cancellation
 * @param timedOut    Failed queries whose error was a timeout
 * @param cancelled   Queries skipped because their run was cancelled
 * @param retried     Retry attempts made after transient failures
 * @param engineCalls Calls made to the engine client
 * @param activeCalls Engine calls currently running
 */
public record ExecutionStats(
        int submitted,
        int succeeded,
        int failed,
        int timedOut,
        int cancelled,
        int retried,
        int engineCalls,
        int activeCalls
) {}
