package org.influence.analytics.export.strategy;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Object names of the form {@code <logical name>/<yyyyMMdd'T'HHmmss>-<random>.csv}.
 */
final class ExportObjectNames {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private ExportObjectNames() {
    }

    static String next(String logicalName, Clock clock) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return logicalName + "/" + LocalDateTime.now(clock).format(STAMP) + "-" + random + ".csv";
    }
}
