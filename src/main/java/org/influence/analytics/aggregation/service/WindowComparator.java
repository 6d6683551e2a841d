package org.influence.analytics.aggregation.service;

import org.influence.analytics.aggregation.model.ComparisonRecord;
import org.influence.analytics.aggregation.model.WindowComparison;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aligns a current-window result set with the previous window on a shared key and
 * ranks the resulting comparison records.
 */
@Component
public class WindowComparator {

    public static final String CURRENT_COUNT = "current_count";
    public static final String PREVIOUS_COUNT = "previous_count";
    public static final String GROWTH_RATE = "growth_rate";
    public static final String STATUS = "status";

    /**
     * New keys first (by current count), then growth rate descending with current count
     * breaking ties. The key itself makes the order total.
     */
    public static final Comparator<ComparisonRecord> RANKING = Comparator
            .comparing(ComparisonRecord::isNew).reversed()
            .thenComparing(r -> r.isNew() ? 0.0 : r.getGrowthRate(), Comparator.reverseOrder())
            .thenComparing(ComparisonRecord::getCurrentCount, Comparator.reverseOrder())
            .thenComparing(ComparisonRecord::getKey);

    /**
     * Left-join current rows to previous rows on the key column.
     *
     * @param current  rows of the current window; every key here is considered
     * @param previous rows of the previous window; keys only found here are ignored
     * @param spec     key and count columns plus inclusive thresholds
     * @return ranked records, at most {@code spec.getResultLimit()}
     */
    public List<ComparisonRecord> compare(List<Map<String, Object>> current, List<Map<String, Object>> previous,
                                          WindowComparison spec) {
        Map<String, Long> previousCounts = new HashMap<>();
        for (Map<String, Object> row : previous) {
            String key = keyOf(row, spec);
            if (key != null) {
                previousCounts.merge(key, RowValues.longValue(row, spec.getCountColumn()), Long::sum);
            }
        }

        Map<String, Long> currentCounts = new LinkedHashMap<>();
        Map<String, Map<String, Object>> attributes = new HashMap<>();
        for (Map<String, Object> row : current) {
            String key = keyOf(row, spec);
            if (key == null) {
                continue;
            }
            currentCounts.merge(key, RowValues.longValue(row, spec.getCountColumn()), Long::sum);
            attributes.computeIfAbsent(key, k -> attributesOf(row, spec));
        }

        List<ComparisonRecord> records = new ArrayList<>();
        for (Map.Entry<String, Long> entry : currentCounts.entrySet()) {
            String key = entry.getKey();
            ComparisonRecord record = ComparisonRecord.of(key, entry.getValue(),
                    previousCounts.getOrDefault(key, 0L), attributes.get(key));
            if (record != null && passes(record, spec)) {
                records.add(record);
            }
        }
        records.sort(RANKING);
        return records.size() > spec.getResultLimit()
                ? new ArrayList<>(records.subList(0, spec.getResultLimit()))
                : records;
    }

    /**
     * Flatten records into output rows: key, counts, growth rate rounded to two decimals, status, then attributes.
     */
    public List<Map<String, Object>> toRows(List<ComparisonRecord> records, WindowComparison spec) {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (ComparisonRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(spec.getKeyColumn(), record.getKey());
            row.put(CURRENT_COUNT, record.getCurrentCount());
            row.put(PREVIOUS_COUNT, record.getPreviousCount());
            row.put(GROWTH_RATE, record.isNew() ? null : Rounding.round(record.getGrowthRate(), 2));
            row.put(STATUS, record.getStatus().getWireValue());
            row.putAll(record.getAttributes());
            rows.add(row);
        }
        return rows;
    }

    private boolean passes(ComparisonRecord record, WindowComparison spec) {
        if (spec.getMinCurrentCount() != null && record.getCurrentCount() < spec.getMinCurrentCount()) {
            return false;
        }
        if (spec.getMinGrowthRate() != null && !record.isNew()) {
            return record.getGrowthRate() >= spec.getMinGrowthRate();
        }
        return true;
    }

    private static String keyOf(Map<String, Object> row, WindowComparison spec) {
        Object key = row.get(spec.getKeyColumn());
        if (key == null) {
            return null;
        }
        String text = key.toString();
        return text.isEmpty() ? null : text;
    }

    private static Map<String, Object> attributesOf(Map<String, Object> row, WindowComparison spec) {
        Map<String, Object> extra = new LinkedHashMap<>(row);
        extra.remove(spec.getKeyColumn());
        extra.remove(spec.getCountColumn());
        return extra;
    }
}
