package org.influence.analytics.aggregation.service;

import org.influence.analytics.aggregation.model.ComparisonRecord;
import org.influence.analytics.aggregation.model.ComparisonStatus;
import org.influence.analytics.aggregation.model.WindowComparison;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WindowComparatorTest {

    private final WindowComparator comparator = new WindowComparator();

    private static Map<String, Object> row(String hashtag, long count) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("hashtag", hashtag);
        row.put("usage_count", count);
        return row;
    }

    private static WindowComparison comparison(Double minGrowth, Long minCurrent, int limit) {
        return new WindowComparison("hashtag", "usage_count", minGrowth, minCurrent, limit);
    }

    @Test
    void keyAbsentFromPreviousWindowIsNew() {
        // Act
        List<ComparisonRecord> records = comparator.compare(List.of(row("glassskin", 12)), List.of(),
                comparison(1.5, null, 10));

        // Assert
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getStatus()).isEqualTo(ComparisonStatus.NEW);
        assertThat(records.get(0).getGrowthRate()).isNull();
        assertThat(records.get(0).getPreviousCount()).isZero();
    }

    @Test
    void keyWithZeroInBothWindowsIsDropped() {
        // Act
        List<ComparisonRecord> records = comparator.compare(List.of(row("silent", 0), row("kbeauty", 4)),
                List.of(row("silent", 0), row("kbeauty", 2)), comparison(null, null, 10));

        // Assert
        assertThat(records).extracting(ComparisonRecord::getKey).containsExactly("kbeauty");
    }

    @Test
    void growthThresholdIsInclusive() {
        // Arrange
        List<Map<String, Object>> current = List.of(row("below", 19), row("exact", 20), row("above", 30));
        List<Map<String, Object>> previous = List.of(row("below", 10), row("exact", 10), row("above", 10));

        // Act
        List<ComparisonRecord> records = comparator.compare(current, previous, comparison(2.0, null, 10));

        // Assert
        assertThat(records).extracting(ComparisonRecord::getKey).containsExactly("above", "exact");
        assertThat(records.get(1).getGrowthRate()).isEqualTo(2.0);
    }

    @Test
    void newKeysRankAheadOfComparedKeys() {
        // Arrange
        List<Map<String, Object>> current = List.of(row("grown", 100), row("fresh", 5));
        List<Map<String, Object>> previous = List.of(row("grown", 1));

        // Act
        List<ComparisonRecord> records = comparator.compare(current, previous, comparison(null, null, 10));

        // Assert
        assertThat(records).extracting(ComparisonRecord::getKey).containsExactly("fresh", "grown");
    }

    @Test
    void equalGrowthIsBrokenByCurrentCountThenKey() {
        // Arrange
        List<Map<String, Object>> current = List.of(row("b", 20), row("a", 20), row("big", 40));
        List<Map<String, Object>> previous = List.of(row("b", 10), row("a", 10), row("big", 20));

        // Act
        List<ComparisonRecord> records = comparator.compare(current, previous, comparison(null, null, 10));

        // Assert
        assertThat(records).extracting(ComparisonRecord::getKey).containsExactly("big", "a", "b");
    }

    @Test
    void appliesMinimumCurrentCountAndResultLimit() {
        // Arrange
        List<Map<String, Object>> current = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            current.add(row("tag" + i, 10 + i));
        }
        current.add(row("rare", 2));

        // Act
        List<ComparisonRecord> records = comparator.compare(current, List.of(), comparison(null, 10L, 3));

        // Assert
        assertThat(records).extracting(ComparisonRecord::getKey).containsExactly("tag4", "tag3", "tag2");
    }

    @Test
    void keysOnlyInPreviousWindowAreIgnored() {
        // Act
        List<ComparisonRecord> records = comparator.compare(List.of(row("kept", 3)),
                List.of(row("kept", 3), row("faded", 50)), comparison(null, null, 10));

        // Assert
        assertThat(records).extracting(ComparisonRecord::getKey).containsExactly("kept");
    }

    @Test
    void rowsCarryRoundedGrowthAndStatus() {
        // Arrange
        WindowComparison spec = comparison(null, null, 10);
        List<ComparisonRecord> records = comparator.compare(List.of(row("third", 10), row("fresh", 1)),
                List.of(row("third", 3)), spec);

        // Act
        List<Map<String, Object>> rows = comparator.toRows(records, spec);

        // Assert
        assertThat(rows.get(0)).containsEntry("hashtag", "fresh")
                .containsEntry(WindowComparator.STATUS, "new")
                .containsEntry(WindowComparator.GROWTH_RATE, null);
        assertThat(rows.get(1)).containsEntry("hashtag", "third")
                .containsEntry(WindowComparator.CURRENT_COUNT, 10L)
                .containsEntry(WindowComparator.PREVIOUS_COUNT, 3L)
                .containsEntry(WindowComparator.GROWTH_RATE, 3.33)
                .containsEntry(WindowComparator.STATUS, "compared");
    }
}
