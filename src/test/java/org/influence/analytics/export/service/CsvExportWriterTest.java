package org.influence.analytics.export.service;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CsvExportWriterTest {

    private final CsvExportWriter writer = new CsvExportWriter();

    @Test
    void writesHeaderThenOneLinePerRowInColumnOrder() {
        // Arrange
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("usage_count", 5L);
        first.put("region", "JP");
        first.put("hashtags", List.of("kbeauty", "glow"));
        first.put("note", null);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("region", "KR");
        second.put("usage_count", 0L);
        second.put("hashtags", List.of());
        second.put("note", "Laneige, Inc");

        // Act
        byte[] csv = writer.write("compare_regional_hashtags",
                List.of("region", "hashtags", "usage_count", "note"), List.of(first, second));

        // Assert
        List<String> lines = Arrays.asList(new String(csv, StandardCharsets.UTF_8).split("\n"));
        assertThat(lines).containsExactly(
                "region,hashtags,usage_count,note",
                "JP,\"kbeauty; glow\",5,",
                "KR,,0,\"Laneige, Inc\"");
    }

    @Test
    void columnsMissingFromARowAreEmpty() {
        // Act
        byte[] csv = writer.write("search_influencers", List.of("user_id", "username"),
                List.of(Map.of("user_id", "u1")));

        // Assert
        assertThat(new String(csv, StandardCharsets.UTF_8)).isEqualTo("user_id,username\nu1,\n");
    }

    @Test
    void flattensArraysAndCollections() {
        assertThat(CsvExportWriter.field(new String[]{"a", "b"})).isEqualTo("a; b");
        assertThat(CsvExportWriter.field(List.of(1, 2, 3))).isEqualTo("1; 2; 3");
        assertThat(CsvExportWriter.field(null)).isEmpty();
        assertThat(CsvExportWriter.field(12.5)).isEqualTo("12.5");
    }
}
