package org.influence.analytics.query.model;

import java.util.List;
import java.util.Map;

/**
 * Rows returned by the warehouse for one plan, in the order the warehouse produced them.
 */
public class WarehouseResult {

    public static final long BYTES_UNKNOWN = -1;

    private final List<String> columns;
    private final List<Map<String, Object>> rows;
    private final long bytesScanned;

    public WarehouseResult(List<String> columns, List<Map<String, Object>> rows, long bytesScanned) {
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

    /**
     * Bytes the warehouse read, or {@link #BYTES_UNKNOWN} when the client could not tell.
     */
    public long getBytesScanned() {
        return bytesScanned;
    }
}
