package org.contextql.engine.execution;

import java.time.Instant;

/**
 * One entry of the execution history.
 *
 * @param contextId      Context queried
 * @param contextVersion Version that served the query
 * @param userId         Caller
 * @param sql            Compiled query text
 * @param rowCount       Rows returned, or -1 when the query failed
 * @param latencyMs      Wall time of the call
 * @param cached         Whether the result came from the cache
 * @param timestamp      When the call finished
 * @param error          Failure message, or null on success
 */
public record ExecutionRecord(
        String contextId,
        String contextVersion,
        String userId,
        String sql,
        long rowCount,
        long latencyMs,
        boolean cached,
        Instant timestamp,
        String error) {

    public boolean succeeded() {
        return error == null;
    }
}
