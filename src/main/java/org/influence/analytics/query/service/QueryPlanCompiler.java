package org.influence.analytics.query.service;

import org.influence.analytics.engine.exception.CompilationException;
import org.influence.analytics.filter.model.FilterSpecification;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.catalog.OperationDescriptor;
import org.influence.analytics.query.model.CompiledQuery;
import org.influence.analytics.query.model.ContentBranch;
import org.influence.analytics.query.model.Join;
import org.influence.analytics.query.model.OperationId;
import org.influence.analytics.query.model.QueryPlan;
import org.influence.analytics.query.model.WarehouseTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a normalized filter specification into the warehouse plans of one operation.
 * <p>
 * Compilation is deterministic for a given specification and day: joins follow the descriptor,
 * every content branch carries a partition-date bound, and caller values are bound parameters.
 */
@Service
public class QueryPlanCompiler {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanCompiler.class);

    private final Clock clock;

    public QueryPlanCompiler(Clock clock) {
        this.clock = clock;
    }

    public CompiledQuery compile(OperationDescriptor descriptor, FilterSpecification spec) {
        OperationId operation = descriptor.getId();
        checkJoinable(descriptor, spec);
        if (descriptor.isWindowed() && spec.getWindowDays() < 1) {
            throw new CompilationException(operation, "windowed operation compiled without a window");
        }

        LocalDate today = LocalDate.now(clock);
        PlanContext ctx = new PlanContext(descriptor, spec, today);
        QueryShapes.Shape shape = QueryShapes.shape(ctx);

        LocalDate earliest = today.minusDays(OperationCatalog.MAX_WINDOW_DAYS);
        for (QueryPlan plan : shape.plans()) {
            checkPlan(operation, plan, earliest);
        }

        String summary = summarize(descriptor, shape.plans());
        log.debug("Compiled {}", summary);
        return new CompiledQuery(operation, shape.plans(), shape.analysis(), summary);
    }

    private void checkJoinable(OperationDescriptor descriptor, FilterSpecification spec) {
        if (spec.needsSpecializedJoin() && !descriptor.getJoinable().containsKey(WarehouseTable.BEAUTY_PROFILES)) {
            throw new CompilationException(descriptor.getId(), "beauty filters given but beauty profiles are not joinable");
        }
        boolean followerFilter = spec.getFollowerMin() != null || spec.getFollowerMax() != null;
        if (followerFilter && !descriptor.getJoinable().containsKey(WarehouseTable.PROFILE_METRICS)) {
            throw new CompilationException(descriptor.getId(), "follower filters given but profile metrics are not joinable");
        }
    }

    private void checkPlan(OperationId operation, QueryPlan plan, LocalDate earliest) {
        String role = plan.getRole().getLabel();
        if (plan.getLimit() < 1) {
            throw new CompilationException(operation, role + " plan has no row limit");
        }
        if (plan.hasContent()) {
            if (plan.getContent().getBranches().isEmpty()) {
                throw new CompilationException(operation, role + " plan reads no content table");
            }
            for (ContentBranch branch : plan.getContent().getBranches()) {
                if (branch.getLowerBound() == null) {
                    throw new CompilationException(operation,
                            role + " plan scans " + branch.getTable().getQualifiedName() + " without a date bound");
                }
            }
        }
        if (plan.getPartitionLowerBound() != null && plan.getPartitionLowerBound().isBefore(earliest)) {
            throw new CompilationException(operation, role + " plan reaches back past " + earliest);
        }
        if (plan.getKeySource() != null) {
            checkPlan(operation, plan.getKeySource(), earliest);
        }
    }

    /**
     * One line per compilation, e.g.
     * {@code analyze_hashtag_trends: primary on g LEFT p, content feed+reels since 2024-05-01, 1 filter, limit 50}.
     */
    static String summarize(OperationDescriptor descriptor, List<QueryPlan> plans) {
        List<String> parts = new ArrayList<>();
        for (QueryPlan plan : plans) {
            StringBuilder part = new StringBuilder(plan.getRole().getLabel())
                    .append(" on ").append(plan.getBaseTable().getAlias());
            for (Join join : plan.getJoins()) {
                part.append(' ').append(join.getType().name()).append(' ').append(join.getTable().getAlias());
            }
            if (plan.hasContent()) {
                List<String> tables = new ArrayList<>();
                for (ContentBranch branch : plan.getContent().getBranches()) {
                    tables.add(branch.getTable() == WarehouseTable.REELS ? "reels" : "feed");
                }
                ContentBranch first = plan.getContent().getBranches().get(0);
                part.append(", content ").append(String.join("+", tables))
                        .append(" since ").append(first.getLowerBound());
                if (first.getUpperBoundExclusive() != null) {
                    part.append(" until ").append(first.getUpperBoundExclusive());
                }
            } else if (plan.getPartitionLowerBound() != null) {
                part.append(", since ").append(plan.getPartitionLowerBound());
            }
            int filters = plan.getFilterPredicates().size();
            part.append(", ").append(filters).append(filters == 1 ? " filter" : " filters")
                    .append(", limit ").append(plan.getLimit());
            if (plan.getKeySource() != null) {
                part.append(", keys of ").append(plan.getKeySource().getRole().getLabel());
            }
            if (!plan.isRequired()) {
                part.append(" (optional)");
            }
            parts.add(part.toString());
        }
        return descriptor.getId().getWireName() + ": " + String.join("; ", parts);
    }
}
