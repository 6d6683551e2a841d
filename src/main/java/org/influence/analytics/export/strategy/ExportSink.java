package org.influence.analytics.export.strategy;

import org.influence.analytics.export.model.ExportHandle;

/**
 * Strategy interface for storing export records.
 * Implementations are selected with the {@code export.sink} property.
 */
public interface ExportSink {

    /**
     * Write one export record. Objects are written once and never updated.
     *
     * @param logicalName prefix grouping exports, the operation's wire id
     * @param csv         the full record
     * @return handle of the stored object
     * @throws org.influence.analytics.engine.exception.ExportException when the object cannot be stored
     */
    ExportHandle export(String logicalName, byte[] csv);

    /**
     * Get the name of this sink.
     *
     * @return sink name (e.g., "minio", "none")
     */
    String getSinkName();
}
