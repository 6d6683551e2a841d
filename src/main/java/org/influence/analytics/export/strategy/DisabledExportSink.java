package org.influence.analytics.export.strategy;

import org.influence.analytics.export.model.ExportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Sink for deployments without object storage: nothing is stored and no link is published.
 */
@Service
@ConditionalOnProperty(name = "export.sink", havingValue = "none")
public class DisabledExportSink implements ExportSink {

    private static final Logger log = LoggerFactory.getLogger(DisabledExportSink.class);

    private final Clock clock;

    public DisabledExportSink(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ExportHandle export(String logicalName, byte[] csv) {
        String objectName = ExportObjectNames.next(logicalName, clock);
        log.debug("Export sink disabled, dropping {} ({} bytes)", objectName, csv.length);
        return new ExportHandle(objectName, null, null);
    }

    @Override
    public String getSinkName() {
        return "none";
    }
}
