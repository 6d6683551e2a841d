package org.influence.analytics.engine.controller;

import org.influence.analytics.engine.exception.ErrorKind;
import org.influence.analytics.engine.model.OperationResult;
import org.influence.analytics.engine.model.OperationSummary;
import org.influence.analytics.engine.service.AnalyticsEngine;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.catalog.OperationDescriptor;
import org.influence.analytics.query.model.OperationId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST adapter over the analytics engine.
 */
@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsController.class);

    private final AnalyticsEngine engine;
    private final OperationCatalog catalog;

    public AnalyticsController(AnalyticsEngine engine, OperationCatalog catalog) {
        this.engine = engine;
        this.catalog = catalog;
    }

    /**
     * Run one operation.
     *
     * @param operation  wire id, e.g. {@code search_influencers}
     * @param parameters JSON object of filter parameters; may be omitted
     * @return the result, with a status derived from its error kind
     */
    @PostMapping("/{operation}")
    public ResponseEntity<OperationResult> execute(@PathVariable String operation,
                                                   @RequestBody(required = false) Map<String, Object> parameters) {
        Optional<OperationId> id = OperationId.fromWireName(operation);
        if (id.isEmpty()) {
            log.info("Analytics API: unknown operation {}", operation);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(OperationResult.failure(operation,
                    ErrorKind.VALIDATION_ERROR.getWireName(), "Unknown operation: " + operation, null));
        }

        OperationResult result = engine.execute(id.get(), parameters);
        return ResponseEntity.status(statusOf(result)).body(result);
    }

    @GetMapping("/operations")
    public ResponseEntity<List<OperationSummary>> listOperations() {
        List<OperationSummary> summaries = new ArrayList<>();
        for (OperationDescriptor descriptor : catalog.all()) {
            summaries.add(OperationSummary.of(descriptor));
        }
        return ResponseEntity.ok(summaries);
    }

    static HttpStatus statusOf(OperationResult result) {
        if (result.isSuccess()) {
            return HttpStatus.OK;
        }
        if (ErrorKind.VALIDATION_ERROR.getWireName().equals(result.getErrorKind())) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ErrorKind.EXECUTION_ERROR.getWireName().equals(result.getErrorKind())) {
            return HttpStatus.BAD_GATEWAY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
