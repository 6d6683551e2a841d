package org.influence.analytics.engine.service;

import org.influence.analytics.aggregation.model.AggregatedResult;
import org.influence.analytics.aggregation.service.AggregationEngine;
import org.influence.analytics.engine.exception.AnalyticsException;
import org.influence.analytics.engine.exception.CompilationException;
import org.influence.analytics.engine.exception.ErrorKind;
import org.influence.analytics.engine.exception.ValidationException;
import org.influence.analytics.engine.exception.WarehouseExecutionException;
import org.influence.analytics.engine.model.OperationResult;
import org.influence.analytics.enrichment.model.EnrichmentReport;
import org.influence.analytics.enrichment.service.ProfileImageEnricher;
import org.influence.analytics.export.model.MaterializedResult;
import org.influence.analytics.export.service.ResultMaterializer;
import org.influence.analytics.filter.model.FilterSpecification;
import org.influence.analytics.filter.service.FilterNormalizer;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.catalog.OperationDescriptor;
import org.influence.analytics.query.model.CompiledQuery;
import org.influence.analytics.query.model.OperationId;
import org.influence.analytics.query.model.PlanRole;
import org.influence.analytics.query.model.QueryPlan;
import org.influence.analytics.query.model.RenderedQuery;
import org.influence.analytics.query.model.WarehouseResult;
import org.influence.analytics.query.service.QueryPlanCompiler;
import org.influence.analytics.query.service.SqlRenderer;
import org.influence.analytics.query.strategy.WarehouseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Entry point of the engine: normalize, compile, execute, aggregate, then materialize.
 * <p>
 * Every outcome is classified into an {@link OperationResult}; nothing escapes as an exception.
 * Validation and compilation run before any network call.
 */
@Service
public class AnalyticsEngine {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsEngine.class);

    private final OperationCatalog catalog;
    private final FilterNormalizer normalizer;
    private final QueryPlanCompiler compiler;
    private final SqlRenderer renderer;
    private final WarehouseClient warehouseClient;
    private final AggregationEngine aggregationEngine;
    private final ResultMaterializer materializer;
    private final ProfileImageEnricher imageEnricher;
    private final CriteriaDescriber criteriaDescriber;
    private final Executor warehouseExecutor;

    public AnalyticsEngine(OperationCatalog catalog, FilterNormalizer normalizer, QueryPlanCompiler compiler,
                           SqlRenderer renderer, WarehouseClient warehouseClient,
                           AggregationEngine aggregationEngine, ResultMaterializer materializer,
                           ProfileImageEnricher imageEnricher, CriteriaDescriber criteriaDescriber,
                           @Qualifier("warehouseExecutor") Executor warehouseExecutor) {
        this.catalog = catalog;
        this.normalizer = normalizer;
        this.compiler = compiler;
        this.renderer = renderer;
        this.warehouseClient = warehouseClient;
        this.aggregationEngine = aggregationEngine;
        this.materializer = materializer;
        this.imageEnricher = imageEnricher;
        this.criteriaDescriber = criteriaDescriber;
        this.warehouseExecutor = warehouseExecutor;
    }

    public OperationResult execute(OperationId operation, Map<String, Object> parameters) {
        String name = operation.getWireName();
        long started = System.currentTimeMillis();
        log.info("Executing {} with parameters {}", name, parameters != null ? parameters.keySet() : "[]");

        try {
            OperationDescriptor descriptor = catalog.get(operation);
            FilterSpecification spec = normalizer.normalize(descriptor, parameters != null ? parameters : Map.of());
            CompiledQuery compiled = compile(descriptor, spec);

            Map<PlanRole, WarehouseResult> results = runPlans(compiled);
            AggregatedResult aggregated = aggregationEngine.aggregate(compiled, results);
            MaterializedResult materialized = materializer.materialize(name, aggregated, descriptor.getPreviewSize());

            List<String> columns = new ArrayList<>(materialized.getColumns());
            if (descriptor.isEnrichImages()) {
                EnrichmentReport report = imageEnricher.enrich(materialized.getPreview());
                if (report.getAttempted() > 0) {
                    columns.add(ProfileImageEnricher.IMAGE_COLUMN);
                }
            }

            long bytes = aggregated.getBytesScanned();
            log.info("{} returned {} rows ({} in preview) in {} ms, bytes scanned: {}", name,
                    materialized.getTotalCount(), materialized.getPreview().size(),
                    System.currentTimeMillis() - started, bytes < 0 ? "unknown" : bytes);
            return OperationResult.success(name, criteriaDescriber.describe(spec), columns,
                    materialized.getPreview(), materialized.getTotalCount(), materialized.getExportUrl(),
                    compiled.getPlanSummary());
        } catch (ValidationException e) {
            log.info("{} rejected: {}", name, e.getMessage());
            return failure(name, e);
        } catch (AnalyticsException e) {
            log.error("{} failed: {}", name, e.getMessage(), e);
            return failure(name, e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in {}", name, e);
            return OperationResult.failure(name, ErrorKind.EXECUTION_ERROR.getWireName(),
                    "Unexpected failure: " + e.getMessage(), diagnostic(e) != null ? diagnostic(e) : e.toString());
        }
    }

    private CompiledQuery compile(OperationDescriptor descriptor, FilterSpecification spec) {
        try {
            return compiler.compile(descriptor, spec);
        } catch (CompilationException e) {
            log.error("Could not compile {}: {}", descriptor.getId().getWireName(), e.getMessage());
            throw e;
        }
    }

    /**
     * Runs every plan concurrently. A failed required plan cancels the others and fails the
     * operation; a failed optional plan is left out of the results.
     */
    private Map<PlanRole, WarehouseResult> runPlans(CompiledQuery compiled) {
        List<QueryPlan> plans = compiled.getPlans();
        List<RenderedQuery> queries = new ArrayList<>(plans.size());
        List<CompletableFuture<WarehouseResult>> futures = new ArrayList<>(plans.size());
        for (QueryPlan plan : plans) {
            RenderedQuery query = renderer.render(plan);
            queries.add(query);
            futures.add(CompletableFuture.supplyAsync(() -> warehouseClient.execute(query), warehouseExecutor));
        }

        Map<PlanRole, WarehouseResult> results = new EnumMap<>(PlanRole.class);
        for (int i = 0; i < plans.size(); i++) {
            QueryPlan plan = plans.get(i);
            try {
                results.put(plan.getRole(), futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (plan.isRequired()) {
                    cancelPending(queries, futures);
                    if (cause instanceof AnalyticsException) {
                        throw (AnalyticsException) cause;
                    }
                    throw new WarehouseExecutionException(plan.getRole().getLabel(), cause.getMessage(), cause);
                }
                log.warn("Optional {} plan of {} failed, continuing without it: {}", plan.getRole().getLabel(),
                        compiled.getOperation().getWireName(), cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelPending(queries, futures);
                throw new WarehouseExecutionException(plan.getRole().getLabel(), "interrupted", e);
            }
        }
        return results;
    }

    private void cancelPending(List<RenderedQuery> queries, List<CompletableFuture<WarehouseResult>> futures) {
        for (int i = 0; i < futures.size(); i++) {
            if (!futures.get(i).isDone()) {
                futures.get(i).cancel(true);
                warehouseClient.cancel(queries.get(i));
            }
        }
    }

    private static OperationResult failure(String operation, AnalyticsException e) {
        return OperationResult.failure(operation, e.getErrorKind().getWireName(), e.getMessage(), diagnostic(e));
    }

    /**
     * Text of the innermost cause, kept so callers can tell a timeout from a rejected query.
     */
    private static String diagnostic(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        if (root == e) {
            return null;
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }
}
