package org.influence.analytics.aggregation.service;

import org.influence.analytics.aggregation.model.MetricDerivation;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Factory for the in-memory metric derivations operations attach to their rows.
 */
public final class Derivations {

    private Derivations() {
    }

    /**
     * {@code out = sum / count}, or 0 when the count is 0.
     */
    public static MetricDerivation mean(String out, String sumColumn, String countColumn, int scale) {
        return new Single(out) {
            @Override
            public void apply(Map<String, Object> row) {
                long count = RowValues.longValue(row, countColumn);
                double sum = RowValues.doubleValue(row, sumColumn);
                row.put(out, count == 0 ? 0.0 : Rounding.round(sum / count, scale));
            }
        };
    }

    /**
     * {@code out = numerator / denominator * 100}, or 0 when the denominator is 0.
     */
    public static MetricDerivation percentOf(String out, String numeratorColumn, String denominatorColumn) {
        return new Single(out) {
            @Override
            public void apply(Map<String, Object> row) {
                double denominator = RowValues.doubleValue(row, denominatorColumn);
                double numerator = RowValues.doubleValue(row, numeratorColumn);
                row.put(out, denominator == 0 ? 0.0 : Rounding.round(numerator * 100.0 / denominator, 2));
            }
        };
    }

    public static MetricDerivation engagementRate(String out, String primaryColumn, String secondaryColumn,
                                                  String followersColumn) {
        return new Single(out) {
            @Override
            public void apply(Map<String, Object> row) {
                double rate = EngagementRate.of(
                        RowValues.doubleValue(row, primaryColumn),
                        RowValues.doubleValue(row, secondaryColumn),
                        RowValues.doubleValue(row, followersColumn));
                row.put(out, Rounding.round(rate, 2));
            }
        };
    }

    /**
     * Nearest-rank percentiles of a sample column, written to {@code p<rank>_<suffix>}.
     */
    public static MetricDerivation percentiles(String sampleColumn, String suffix, int... ranks) {
        List<String> outputs = new ArrayList<>();
        for (int rank : ranks) {
            outputs.add("p" + rank + "_" + suffix);
        }
        return new MetricDerivation() {
            @Override
            public List<String> outputColumns() {
                return outputs;
            }

            @Override
            public void apply(Map<String, Object> row) {
                double[] sample = RowValues.sample(row, sampleColumn);
                for (int i = 0; i < ranks.length; i++) {
                    row.put(outputs.get(i), Rounding.round(Percentiles.nearestRank(sample, ranks[i]), 2));
                }
            }
        };
    }

    /**
     * English day name for an ISO day-of-week number (Monday = 1).
     */
    public static MetricDerivation dayName(String out, String dayColumn) {
        return new Single(out) {
            @Override
            public void apply(Map<String, Object> row) {
                long day = RowValues.longValue(row, dayColumn);
                row.put(out, day >= 1 && day <= 7
                        ? DayOfWeek.of((int) day).getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                        : null);
            }
        };
    }

    private abstract static class Single implements MetricDerivation {
        private final List<String> outputs;

        Single(String out) {
            this.outputs = List.of(out);
        }

        @Override
        public List<String> outputColumns() {
            return outputs;
        }
    }
}
