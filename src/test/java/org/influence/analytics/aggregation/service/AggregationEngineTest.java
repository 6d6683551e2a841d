package org.influence.analytics.aggregation.service;

import org.influence.analytics.aggregation.model.AggregatedResult;
import org.influence.analytics.filter.service.FilterNormalizer;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.catalog.OperationDescriptor;
import org.influence.analytics.query.model.CompiledQuery;
import org.influence.analytics.query.model.OperationId;
import org.influence.analytics.query.model.PlanRole;
import org.influence.analytics.query.model.WarehouseResult;
import org.influence.analytics.query.service.QueryPlanCompiler;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AggregationEngineTest {

    private final OperationCatalog catalog = new OperationCatalog();
    private final FilterNormalizer normalizer = new FilterNormalizer();
    private final QueryPlanCompiler compiler =
            new QueryPlanCompiler(Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC));
    private final AggregationEngine engine = new AggregationEngine(new WindowComparator(), new EntityComparator());

    private CompiledQuery compile(OperationId id, Map<String, Object> raw) {
        OperationDescriptor descriptor = catalog.get(id);
        return compiler.compile(descriptor, normalizer.normalize(descriptor, raw));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Test
    void regionWithoutRowsIsStillReportedWithZeroMetrics() {
        // Arrange
        CompiledQuery compiled = compile(OperationId.COMPARE_REGIONAL_HASHTAGS, Map.of("countries", List.of("KR", "JP")));
        List<String> columns = List.of("region", "hashtag", "usage_count", "unique_users", "sum_likes");
        List<Map<String, Object>> rows = List.of(
                row("region", "JP", "hashtag", "kbeauty", "usage_count", 5L, "unique_users", 3L, "sum_likes", 500L),
                row("region", "JP", "hashtag", "skincare", "usage_count", 4L, "unique_users", 2L, "sum_likes", 100L));
        Map<PlanRole, WarehouseResult> results = new EnumMap<>(PlanRole.class);
        results.put(PlanRole.PRIMARY, new WarehouseResult(columns, rows, WarehouseResult.BYTES_UNKNOWN));

        // Act
        AggregatedResult result = engine.aggregate(compiled, results);

        // Assert
        assertThat(result.getColumns())
                .containsExactly("region", "hashtag", "usage_count", "unique_users", "avg_likes", "rank");
        assertThat(result.getRows()).extracting(r -> r.get("region")).containsExactly("JP", "JP", "KR");
        assertThat(result.getRows().get(0)).containsEntry("rank", 1).containsEntry("avg_likes", 100.0);
        assertThat(result.getRows().get(1)).containsEntry("rank", 2).containsEntry("avg_likes", 25.0);
        assertThat(result.getRows().get(2))
                .containsEntry("usage_count", 0L)
                .containsEntry("unique_users", 0L)
                .containsEntry("avg_likes", 0.0)
                .containsEntry("hashtag", null)
                .containsEntry("rank", null);
        assertThat(result.getBytesScanned()).isEqualTo(WarehouseResult.BYTES_UNKNOWN);
    }

    @Test
    void twoWindowOperationIsAlignedOnTheKey() {
        // Arrange
        CompiledQuery compiled = compile(OperationId.DETECT_EMERGING_HASHTAGS,
                Map.of("min_growth_rate", 2.0, "min_current_count", 1));
        List<String> columns = List.of("hashtag", "usage_count");
        Map<PlanRole, WarehouseResult> results = new EnumMap<>(PlanRole.class);
        results.put(PlanRole.CURRENT_WINDOW, new WarehouseResult(columns, List.of(
                row("hashtag", "slow", "usage_count", 19L),
                row("hashtag", "steady", "usage_count", 20L),
                row("hashtag", "debut", "usage_count", 7L)), 1000L));
        results.put(PlanRole.PREVIOUS_WINDOW, new WarehouseResult(columns, List.of(
                row("hashtag", "slow", "usage_count", 10L),
                row("hashtag", "steady", "usage_count", 10L)), 500L));

        // Act
        AggregatedResult result = engine.aggregate(compiled, results);

        // Assert
        assertThat(result.getColumns())
                .containsExactly("hashtag", "current_count", "previous_count", "growth_rate", "status");
        assertThat(result.getRows()).extracting(r -> r.get("hashtag")).containsExactly("debut", "steady");
        assertThat(result.getRows().get(1)).containsEntry("growth_rate", 2.0).containsEntry("status", "compared");
        assertThat(result.getBytesScanned()).isEqualTo(1500L);
    }

    @Test
    void missingOptionalTotalsLeaveShareEmpty() {
        // Arrange
        CompiledQuery compiled = compile(OperationId.ANALYZE_MARKET_DEMOGRAPHICS,
                Map.of("country", "KR", "group_by", List.of("gender")));
        List<String> columns = List.of("gender", "influencer_count", "sum_followers", "follower_sample");
        Map<PlanRole, WarehouseResult> results = new EnumMap<>(PlanRole.class);
        results.put(PlanRole.PRIMARY, new WarehouseResult(columns, List.of(
                row("gender", "Female", "influencer_count", 3L, "sum_followers", 3000L,
                        "follower_sample", List.of(500L, 1000L, 1500L))), WarehouseResult.BYTES_UNKNOWN));

        // Act
        AggregatedResult result = engine.aggregate(compiled, results);

        // Assert
        assertThat(result.getColumns()).doesNotContain("sum_followers", "follower_sample")
                .contains("avg_followers", "p50_followers", "share_pct");
        assertThat(result.getRows().get(0))
                .containsEntry("avg_followers", 1000.0)
                .containsEntry("p50_followers", 1000.0)
                .containsEntry("share_pct", null);
    }

    @Test
    void totalsGiveEachGroupItsShare() {
        // Arrange
        CompiledQuery compiled = compile(OperationId.ANALYZE_MARKET_DEMOGRAPHICS,
                Map.of("country", "KR", "group_by", List.of("gender")));
        List<String> columns = List.of("gender", "influencer_count", "sum_followers", "follower_sample");
        Map<PlanRole, WarehouseResult> results = new EnumMap<>(PlanRole.class);
        results.put(PlanRole.PRIMARY, new WarehouseResult(columns, List.of(
                row("gender", "Female", "influencer_count", 3L),
                row("gender", "Male", "influencer_count", 1L)), WarehouseResult.BYTES_UNKNOWN));
        results.put(PlanRole.TOTALS, new WarehouseResult(List.of("total_influencers"),
                List.of(row("total_influencers", 8L)), WarehouseResult.BYTES_UNKNOWN));

        // Act
        AggregatedResult result = engine.aggregate(compiled, results);

        // Assert
        assertThat(result.getRows()).extracting(r -> r.get("share_pct")).containsExactly(37.5, 12.5);
        assertThat(result.getTotalCount()).isEqualTo(2);
    }
}
