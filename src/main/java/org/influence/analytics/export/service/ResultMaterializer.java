package org.influence.analytics.export.service;

import org.influence.analytics.aggregation.model.AggregatedResult;
import org.influence.analytics.export.model.ExportHandle;
import org.influence.analytics.export.model.MaterializedResult;
import org.influence.analytics.export.strategy.ExportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Splits an aggregated result into the caller's preview and a full CSV export.
 * <p>
 * The export is always written, even for an empty result. A failed export leaves the
 * result without a link; it never fails the operation.
 */
@Service
public class ResultMaterializer {

    private static final Logger log = LoggerFactory.getLogger(ResultMaterializer.class);

    private final CsvExportWriter csvWriter;
    private final ExportSink exportSink;
    private final Executor exportExecutor;

    public ResultMaterializer(CsvExportWriter csvWriter, ExportSink exportSink,
                              @Qualifier("exportExecutor") Executor exportExecutor) {
        this.csvWriter = csvWriter;
        this.exportSink = exportSink;
        this.exportExecutor = exportExecutor;
    }

    public MaterializedResult materialize(String logicalName, AggregatedResult result, int previewSize) {
        List<Map<String, Object>> rows = result.getRows();
        List<Map<String, Object>> preview = new ArrayList<>();
        for (Map<String, Object> row : rows.subList(0, Math.min(previewSize, rows.size()))) {
            preview.add(new LinkedHashMap<>(row));
        }

        CompletableFuture<ExportHandle> export;
        try {
            export = CompletableFuture.supplyAsync(
                    () -> exportSink.export(logicalName, csvWriter.write(logicalName, result.getColumns(), rows)),
                    exportExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Export of {} not scheduled, returning preview only: {}", logicalName, e.getMessage());
            return new MaterializedResult(result.getColumns(), preview, result.getTotalCount(), null);
        }
        ExportHandle handle = awaitExport(logicalName, export);

        return new MaterializedResult(result.getColumns(), preview, result.getTotalCount(), handle);
    }

    /**
     * Waits for the export to finish. An interrupt is remembered and restored afterwards,
     * so an export that has started always completes.
     */
    private ExportHandle awaitExport(String logicalName, CompletableFuture<ExportHandle> export) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return export.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.warn("Export of {} via {} failed, returning preview only: {}",
                            logicalName, exportSink.getSinkName(), cause.getMessage(), cause);
                    return null;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
