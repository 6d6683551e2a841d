package org.influence.analytics.aggregation.model;

import java.util.List;
import java.util.Map;

/**
 * Final ordered rows of an operation, ready for preview and export.
 */
public class AggregatedResult {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;
    private final long bytesScanned;

    public AggregatedResult(List<String> columns, List<Map<String, Object>> rows, long bytesScanned) {
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
        this.bytesScanned = bytesScanned;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int getTotalCount() {
        return rows.size();
    }

    public long getBytesScanned() {
        return bytesScanned;
    }
}
