package org.influence.analytics.aggregation.model;

import java.util.List;
import java.util.Map;

/**
 * A metric computed in memory from columns the warehouse returned for the same row.
 */
public interface MetricDerivation {

    List<String> outputColumns();

    void apply(Map<String, Object> row);
}
