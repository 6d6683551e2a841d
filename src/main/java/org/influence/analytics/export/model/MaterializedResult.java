package org.influence.analytics.export.model;

import java.util.List;
import java.util.Map;

/**
 * Preview rows handed back to the caller plus the location of the full export, if it was written.
 */
public class MaterializedResult {

    private final List<String> columns;
    private final List<Map<String, Object>> preview;
    private final int totalCount;
    private final ExportHandle export;

    public MaterializedResult(List<String> columns, List<Map<String, Object>> preview, int totalCount,
                              ExportHandle export) {
        this.columns = List.copyOf(columns);
        this.preview = preview;
        this.totalCount = totalCount;
        this.export = export;
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getPreview() {
        return preview;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public ExportHandle getExport() {
        return export;
    }

    public String getExportUrl() {
        return export != null ? export.getUrl() : null;
    }
}
