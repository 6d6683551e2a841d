package org.influence.analytics.aggregation.service;

import org.influence.analytics.aggregation.model.AggregatedResult;
import org.influence.analytics.aggregation.model.AnalysisSpec;
import org.influence.analytics.aggregation.model.ComparisonRecord;
import org.influence.analytics.aggregation.model.Distribution;
import org.influence.analytics.aggregation.model.MetricDerivation;
import org.influence.analytics.aggregation.model.Ranking;
import org.influence.analytics.aggregation.model.WindowComparison;
import org.influence.analytics.engine.exception.CompilationException;
import org.influence.analytics.query.model.CompiledQuery;
import org.influence.analytics.query.model.PlanRole;
import org.influence.analytics.query.model.WarehouseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns warehouse result sets into the final ordered rows of an operation: derived
 * metrics, period-over-period comparison, entity completion, shares and ranks.
 */
@Service
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final WindowComparator windowComparator;
    private final EntityComparator entityComparator;

    public AggregationEngine(WindowComparator windowComparator, EntityComparator entityComparator) {
        this.windowComparator = windowComparator;
        this.entityComparator = entityComparator;
    }

    /**
     * Aggregate the results of every plan of a compiled query.
     *
     * @param compiled the compiled query, carrying its analysis spec
     * @param results  results by plan role; optional plans that failed are simply missing
     * @return final rows in output order
     */
    public AggregatedResult aggregate(CompiledQuery compiled, Map<PlanRole, WarehouseResult> results) {
        AnalysisSpec spec = compiled.getAnalysis();
        long bytesScanned = totalBytes(results);

        if (spec.getWindowComparison() != null) {
            return compareWindows(compiled, results, spec.getWindowComparison(), bytesScanned);
        }

        WarehouseResult primary = require(compiled, results, PlanRole.PRIMARY);
        List<String> columns = outputColumns(primary.getColumns(), spec);
        List<Map<String, Object>> rows = copy(primary.getRows());

        if (spec.getEntityCompletion() != null) {
            rows = entityComparator.complete(rows, primary.getColumns(), spec.getEntityCompletion());
        }
        for (Map<String, Object> row : rows) {
            for (MetricDerivation derivation : spec.getDerivations()) {
                derivation.apply(row);
            }
        }
        if (spec.getDistribution() != null) {
            applyDistribution(rows, spec.getDistribution(), results.get(PlanRole.TOTALS));
        }
        if (spec.getRanking() != null) {
            applyRanking(rows, spec.getRanking());
        }
        return new AggregatedResult(columns, project(rows, columns), bytesScanned);
    }

    private AggregatedResult compareWindows(CompiledQuery compiled, Map<PlanRole, WarehouseResult> results,
                                            WindowComparison comparison, long bytesScanned) {
        WarehouseResult current = require(compiled, results, PlanRole.CURRENT_WINDOW);
        WarehouseResult previous = require(compiled, results, PlanRole.PREVIOUS_WINDOW);

        List<ComparisonRecord> records = windowComparator.compare(current.getRows(), previous.getRows(), comparison);
        log.debug("{}: {} current keys, {} previous keys, {} ranked records",
                compiled.getOperation().getWireName(), current.getRows().size(), previous.getRows().size(),
                records.size());

        List<String> columns = new ArrayList<>(List.of(comparison.getKeyColumn(), WindowComparator.CURRENT_COUNT,
                WindowComparator.PREVIOUS_COUNT, WindowComparator.GROWTH_RATE, WindowComparator.STATUS));
        for (String column : current.getColumns()) {
            if (!column.equals(comparison.getKeyColumn()) && !column.equals(comparison.getCountColumn())) {
                columns.add(column);
            }
        }
        List<Map<String, Object>> rows = windowComparator.toRows(records, comparison);
        return new AggregatedResult(columns, project(rows, columns), bytesScanned);
    }

    private void applyDistribution(List<Map<String, Object>> rows, Distribution distribution,
                                   WarehouseResult totals) {
        if (totals == null) {
            log.warn("Totals unavailable, omitting {}", distribution.getOutputColumn());
            rows.forEach(row -> row.put(distribution.getOutputColumn(), null));
            return;
        }
        Map<String, Double> totalsByGroup = new HashMap<>();
        double overall = 0;
        for (Map<String, Object> row : totals.getRows()) {
            double total = RowValues.doubleValue(row, distribution.getTotalColumn());
            if (distribution.getGroupColumn() != null) {
                totalsByGroup.merge(Objects.toString(row.get(distribution.getGroupColumn()), ""), total, Double::sum);
            } else {
                overall += total;
            }
        }
        for (Map<String, Object> row : rows) {
            double total = distribution.getGroupColumn() != null
                    ? totalsByGroup.getOrDefault(Objects.toString(row.get(distribution.getGroupColumn()), ""), 0.0)
                    : overall;
            double count = RowValues.doubleValue(row, distribution.getCountColumn());
            row.put(distribution.getOutputColumn(), total == 0 ? 0.0 : Rounding.round(count * 100.0 / total, 2));
        }
    }

    private void applyRanking(List<Map<String, Object>> rows, Ranking ranking) {
        Object partition = null;
        int rank = 0;
        boolean first = true;
        for (Map<String, Object> row : rows) {
            if (ranking.getPartitionColumn() != null) {
                Object current = row.get(ranking.getPartitionColumn());
                if (first || !Objects.equals(current, partition)) {
                    rank = 0;
                    partition = current;
                }
            }
            first = false;
            if (ranking.getPresenceColumn() != null && row.get(ranking.getPresenceColumn()) == null) {
                row.put(ranking.getRankColumn(), null);
                continue;
            }
            row.put(ranking.getRankColumn(), ++rank);
        }
    }

    private List<String> outputColumns(List<String> warehouseColumns, AnalysisSpec spec) {
        Set<String> columns = new LinkedHashSet<>(warehouseColumns);
        for (MetricDerivation derivation : spec.getDerivations()) {
            columns.addAll(derivation.outputColumns());
        }
        if (spec.getDistribution() != null) {
            columns.add(spec.getDistribution().getOutputColumn());
        }
        if (spec.getRanking() != null) {
            columns.add(spec.getRanking().getRankColumn());
        }
        columns.removeAll(spec.getHiddenColumns());
        return new ArrayList<>(columns);
    }

    private static WarehouseResult require(CompiledQuery compiled, Map<PlanRole, WarehouseResult> results,
                                           PlanRole role) {
        WarehouseResult result = results.get(role);
        if (result == null) {
            throw new CompilationException(compiled.getOperation(), "no " + role.getLabel() + " result to aggregate");
        }
        return result;
    }

    private static List<Map<String, Object>> copy(List<Map<String, Object>> rows) {
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copies.add(new LinkedHashMap<>(row));
        }
        return copies;
    }

    private static List<Map<String, Object>> project(List<Map<String, Object>> rows, List<String> columns) {
        List<Map<String, Object>> projected = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (String column : columns) {
                out.put(column, row.get(column));
            }
            projected.add(out);
        }
        return projected;
    }

    private static long totalBytes(Map<PlanRole, WarehouseResult> results) {
        long total = 0;
        for (WarehouseResult result : results.values()) {
            if (result.getBytesScanned() == WarehouseResult.BYTES_UNKNOWN) {
                return WarehouseResult.BYTES_UNKNOWN;
            }
            total += result.getBytesScanned();
        }
        return total;
    }
}
