package org.influence.analytics.aggregation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entities a comparison must report even when the warehouse returned nothing for them.
 * With a secondary dimension, every (entity, secondary) pair is completed.
 */
public final class EntityCompletion {

    private final String entityColumn;
    private final List<String> entities;
    private final String secondaryColumn;
    private final List<String> secondaryValues;
    private final Map<String, Object> zeroValues;

    private EntityCompletion(String entityColumn, List<String> entities, String secondaryColumn,
                             List<String> secondaryValues, Map<String, Object> zeroValues) {
        this.entityColumn = entityColumn;
        this.entities = List.copyOf(entities);
        this.secondaryColumn = secondaryColumn;
        this.secondaryValues = List.copyOf(secondaryValues);
        this.zeroValues = Collections.unmodifiableMap(new LinkedHashMap<>(zeroValues));
    }

    public static EntityCompletion of(String entityColumn, List<String> entities, Map<String, Object> zeroValues) {
        return new EntityCompletion(entityColumn, entities, null, List.of(), zeroValues);
    }

    public static EntityCompletion of(String entityColumn, List<String> entities, String secondaryColumn,
                                      List<String> secondaryValues, Map<String, Object> zeroValues) {
        return new EntityCompletion(entityColumn, entities, secondaryColumn, secondaryValues, zeroValues);
    }

    public String getEntityColumn() {
        return entityColumn;
    }

    public List<String> getEntities() {
        return entities;
    }

    public String getSecondaryColumn() {
        return secondaryColumn;
    }

    public List<String> getSecondaryValues() {
        return secondaryValues;
    }

    public boolean hasSecondary() {
        return secondaryColumn != null && !secondaryValues.isEmpty();
    }

    /**
     * Values for a filler row; columns not listed are left null.
     */
    public Map<String, Object> getZeroValues() {
        return zeroValues;
    }
}
