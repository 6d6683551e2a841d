package org.influence.analytics.engine.service;

import org.influence.analytics.aggregation.service.AggregationEngine;
import org.influence.analytics.aggregation.service.EntityComparator;
import org.influence.analytics.aggregation.service.WindowComparator;
import org.influence.analytics.engine.exception.WarehouseExecutionException;
import org.influence.analytics.engine.model.OperationResult;
import org.influence.analytics.enrichment.model.RepresentativeImage;
import org.influence.analytics.enrichment.service.ProfileImageEnricher;
import org.influence.analytics.enrichment.strategy.ImageCatalogClient;
import org.influence.analytics.export.model.ExportHandle;
import org.influence.analytics.export.service.CsvExportWriter;
import org.influence.analytics.export.service.ResultMaterializer;
import org.influence.analytics.export.strategy.ExportSink;
import org.influence.analytics.filter.service.FilterNormalizer;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.model.OperationId;
import org.influence.analytics.query.model.RenderedQuery;
import org.influence.analytics.query.model.WarehouseResult;
import org.influence.analytics.query.service.QueryPlanCompiler;
import org.influence.analytics.query.service.SqlRenderer;
import org.influence.analytics.query.strategy.WarehouseClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalyticsEngineTest {

    @Mock
    private WarehouseClient warehouseClient;

    @Mock
    private ExportSink exportSink;

    @Mock
    private ImageCatalogClient imageCatalogClient;

    private AnalyticsEngine engine;

    @BeforeEach
    void setUp() {
        engine = engine(Runnable::run, Runnable::run);
    }

    private AnalyticsEngine engine(Executor exportExecutor, Executor enrichmentExecutor) {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
        return new AnalyticsEngine(
                new OperationCatalog(),
                new FilterNormalizer(),
                new QueryPlanCompiler(clock),
                new SqlRenderer(),
                warehouseClient,
                new AggregationEngine(new WindowComparator(), new EntityComparator()),
                new ResultMaterializer(new CsvExportWriter(), exportSink, exportExecutor),
                new ProfileImageEnricher(imageCatalogClient, enrichmentExecutor),
                new CriteriaDescriber(),
                Runnable::run);
    }

    private static Executor saturated() {
        return task -> {
            throw new RejectedExecutionException("pool full");
        };
    }

    private static WarehouseResult hashtagCounts(Object... keysAndCounts) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < keysAndCounts.length; i += 2) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("hashtag", keysAndCounts[i]);
            row.put("usage_count", keysAndCounts[i + 1]);
            rows.add(row);
        }
        return new WarehouseResult(List.of("hashtag", "usage_count"), rows, WarehouseResult.BYTES_UNKNOWN);
    }

    private static List<Object> hashtags(OperationResult result) {
        List<Object> keys = new ArrayList<>();
        for (Map<String, Object> row : result.getPreview()) {
            keys.add(row.get("hashtag"));
        }
        return keys;
    }

    private static WarehouseResult influencers() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user_id", "u1");
        row.put("username", "glowwithmina");
        row.put("follower_count", 10_000L);
        row.put("avg_likes", 450.0);
        row.put("avg_comments", 50.0);
        row.put("profile_pic_url", "https://pic.example/u1.jpg");
        return new WarehouseResult(List.copyOf(row.keySet()), List.of(row), WarehouseResult.BYTES_UNKNOWN);
    }

    @Test
    void searchReturnsPreviewExportAndEnrichedImages() {
        // Arrange
        when(warehouseClient.execute(any())).thenReturn(influencers());
        when(exportSink.export(eq("search_influencers"), any()))
                .thenReturn(new ExportHandle("search_influencers/a.csv", "http://minio/a.csv", Instant.EPOCH));
        when(imageCatalogClient.fetchImages("u1"))
                .thenReturn(List.of(new RepresentativeImage("p1", "https://img.example/u1/p1.jpg")));

        // Act
        OperationResult result = engine.execute(OperationId.SEARCH_INFLUENCERS, Map.of("country", List.of("KR")));

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOperation()).isEqualTo("search_influencers");
        assertThat(result.getCriteria()).isEqualTo("country=KR; limit=50");
        assertThat(result.getTotalCount()).isEqualTo(1);
        assertThat(result.getExportUrl()).isEqualTo("http://minio/a.csv");
        assertThat(result.getColumns()).contains("engagement_rate", ProfileImageEnricher.IMAGE_COLUMN);
        assertThat(result.getPreview().get(0))
                .containsEntry(ProfileImageEnricher.IMAGE_COLUMN, "https://img.example/u1/p1.jpg")
                .containsKey("engagement_rate");
        assertThat(result.getPlanSummary()).startsWith("search_influencers: primary on g INNER p");
    }

    @Test
    void invalidParametersFailBeforeAnyWarehouseCall() {
        // Act
        OperationResult result = engine.execute(OperationId.SEARCH_INFLUENCERS, Map.of("skin_type", "Scaly"));

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo("ValidationError");
        assertThat(result.getMessage()).contains("skin_type");
        verifyNoInteractions(warehouseClient, exportSink, imageCatalogClient);
    }

    @Test
    void failedRequiredPlanIsAnExecutionErrorWithDiagnostic() {
        // Arrange
        when(warehouseClient.execute(any())).thenThrow(new WarehouseExecutionException("primary",
                "timed out after 60s", new SQLTimeoutException("Read timed out")));

        // Act
        OperationResult result = engine.execute(OperationId.ANALYZE_HASHTAG_TRENDS, Map.of());

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo("ExecutionError");
        assertThat(result.getMessage()).isEqualTo("timed out after 60s");
        assertThat(result.getDiagnostic()).isEqualTo("SQLTimeoutException: Read timed out");
        verify(exportSink, never()).export(any(), any());
    }

    @Test
    void unexpectedWarehouseFailureIsWrappedAsExecutionError() {
        // Arrange
        when(warehouseClient.execute(any())).thenThrow(new IllegalStateException("driver bug"));

        // Act
        OperationResult result = engine.execute(OperationId.ANALYZE_LIFESTAGE_SEGMENTS, Map.of());

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorKind()).isEqualTo("ExecutionError");
        assertThat(result.getDiagnostic()).isEqualTo("IllegalStateException: driver bug");
    }

    @Test
    void failedOptionalTotalsDegradeInsteadOfFailing() {
        // Arrange
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("link_type", "shopping");
        row.put("channel", "amazon");
        row.put("influencer_count", 12L);
        WarehouseResult primary = new WarehouseResult(List.copyOf(row.keySet()), List.of(row),
                WarehouseResult.BYTES_UNKNOWN);
        when(warehouseClient.execute(any())).thenAnswer(invocation -> {
            RenderedQuery query = invocation.getArgument(0);
            if ("totals".equals(query.getLabel())) {
                throw new WarehouseExecutionException("totals", "memory limit exceeded", null);
            }
            return primary;
        });
        when(exportSink.export(any(), any())).thenReturn(new ExportHandle("o", "http://minio/o.csv", Instant.EPOCH));

        // Act
        OperationResult result = engine.execute(OperationId.ANALYZE_PLATFORM_DISTRIBUTION, Map.of());

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPreview()).hasSize(1);
        assertThat(result.getPreview().get(0)).containsEntry("influencer_count", 12L).containsEntry("percentage", null);
        verifyNoInteractions(imageCatalogClient);
    }

    @Test
    void rerunWithTiesReturnedInAnotherOrderGivesTheSamePreview() {
        // Arrange
        List<WarehouseResult> currentRuns = List.of(
                hashtagCounts("glowup", 20L, "acne", 20L, "cushion", 20L, "slugging", 15L),
                hashtagCounts("cushion", 20L, "slugging", 15L, "acne", 20L, "glowup", 20L));
        WarehouseResult previous = hashtagCounts("acne", 10L, "cushion", 10L, "glowup", 10L);
        int[] currentCalls = {0};
        when(warehouseClient.execute(any())).thenAnswer(invocation -> {
            RenderedQuery query = invocation.getArgument(0);
            return "current".equals(query.getLabel()) ? currentRuns.get(currentCalls[0]++) : previous;
        });
        when(exportSink.export(any(), any())).thenReturn(new ExportHandle("o", "http://minio/o.csv", Instant.EPOCH));

        // Act
        OperationResult first = engine.execute(OperationId.DETECT_EMERGING_HASHTAGS, Map.of());
        OperationResult second = engine.execute(OperationId.DETECT_EMERGING_HASHTAGS, Map.of());

        // Assert
        assertThat(first.isSuccess()).isTrue();
        assertThat(hashtags(first)).containsExactly("slugging", "acne", "cushion", "glowup");
        assertThat(hashtags(second)).isEqualTo(hashtags(first));
        assertThat(second.getPreview()).isEqualTo(first.getPreview());
    }

    @Test
    void saturatedEnrichmentPoolFallsBackToProfilePictures() {
        // Arrange
        AnalyticsEngine saturatedEngine = engine(Runnable::run, saturated());
        when(warehouseClient.execute(any())).thenReturn(influencers());
        when(exportSink.export(any(), any())).thenReturn(new ExportHandle("o", "http://minio/o.csv", Instant.EPOCH));

        // Act
        OperationResult result = saturatedEngine.execute(OperationId.SEARCH_INFLUENCERS, Map.of());

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getExportUrl()).isEqualTo("http://minio/o.csv");
        assertThat(result.getPreview().get(0))
                .containsEntry(ProfileImageEnricher.IMAGE_COLUMN, "https://pic.example/u1.jpg");
        verifyNoInteractions(imageCatalogClient);
    }

    @Test
    void saturatedExportPoolReturnsThePreviewWithoutLink() {
        // Arrange
        AnalyticsEngine saturatedEngine = engine(saturated(), Runnable::run);
        when(warehouseClient.execute(any())).thenReturn(influencers());
        when(imageCatalogClient.fetchImages("u1")).thenReturn(List.of());

        // Act
        OperationResult result = saturatedEngine.execute(OperationId.SEARCH_INFLUENCERS, Map.of());

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPreview()).hasSize(1);
        assertThat(result.getExportUrl()).isNull();
        verifyNoInteractions(exportSink);
    }
}
