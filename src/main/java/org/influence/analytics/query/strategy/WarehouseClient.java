package org.influence.analytics.query.strategy;

import org.influence.analytics.query.model.RenderedQuery;
import org.influence.analytics.query.model.WarehouseResult;

/**
 * Strategy interface for running rendered queries against the analytical warehouse.
 * Implementations must be safe to call from several threads at once.
 */
public interface WarehouseClient {

    /**
     * Execute one query with its bound parameters.
     *
     * @param query SQL text with positional placeholders and their values, in order
     * @return column names in select order and one map per row
     * @throws org.influence.analytics.engine.exception.WarehouseExecutionException when the warehouse
     *         rejects the query, times out or cannot be reached
     */
    WarehouseResult execute(RenderedQuery query);

    /**
     * Abort a query that is still running, typically because a sibling plan already failed.
     * Queries that have finished or never started are left alone.
     *
     * @param query the same instance that was passed to {@link #execute(RenderedQuery)}
     */
    void cancel(RenderedQuery query);

    /**
     * Get the name of this client, for logs.
     *
     * @return client name (e.g., "clickhouse-jdbc")
     */
    String getClientName();
}
