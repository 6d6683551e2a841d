package org.influence.analytics.aggregation.service;

import org.influence.analytics.aggregation.model.EntityCompletion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Makes multi-entity comparisons complete: every requested entity appears, in request
 * order, with zero-valued metrics when the warehouse returned no rows for it.
 */
@Component
public class EntityComparator {

    /**
     * @param rows       warehouse rows in warehouse order
     * @param columns    output columns, used to shape filler rows
     * @param completion requested entities and filler values
     * @return rows grouped by entity in request order; rows for unrequested entities follow at the end
     */
    public List<Map<String, Object>> complete(List<Map<String, Object>> rows, List<String> columns,
                                              EntityCompletion completion) {
        List<Map<String, Object>> completed = new ArrayList<>(rows.size() + completion.getEntities().size());
        List<Map<String, Object>> remaining = new ArrayList<>(rows);

        for (String entity : completion.getEntities()) {
            if (completion.hasSecondary()) {
                for (String secondary : completion.getSecondaryValues()) {
                    List<Map<String, Object>> matched = take(remaining, completion, entity, secondary);
                    completed.addAll(matched.isEmpty() ? List.of(filler(columns, completion, entity, secondary)) : matched);
                }
            } else {
                List<Map<String, Object>> matched = take(remaining, completion, entity, null);
                completed.addAll(matched.isEmpty() ? List.of(filler(columns, completion, entity, null)) : matched);
            }
        }
        completed.addAll(remaining);
        return completed;
    }

    private List<Map<String, Object>> take(List<Map<String, Object>> remaining, EntityCompletion completion,
                                           String entity, String secondary) {
        List<Map<String, Object>> matched = new ArrayList<>();
        remaining.removeIf(row -> {
            boolean hit = entity.equals(stringValue(row.get(completion.getEntityColumn())))
                    && (secondary == null
                    || secondary.equals(stringValue(row.get(completion.getSecondaryColumn()))));
            if (hit) {
                matched.add(row);
            }
            return hit;
        });
        return matched;
    }

    private Map<String, Object> filler(List<String> columns, EntityCompletion completion, String entity,
                                       String secondary) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : columns) {
            row.put(column, null);
        }
        row.putAll(completion.getZeroValues());
        row.put(completion.getEntityColumn(), entity);
        if (secondary != null) {
            row.put(completion.getSecondaryColumn(), secondary);
        }
        return row;
    }

    private static String stringValue(Object value) {
        return Objects.toString(value, null);
    }
}
