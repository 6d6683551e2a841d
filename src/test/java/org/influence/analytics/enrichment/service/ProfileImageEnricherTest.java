package org.influence.analytics.enrichment.service;

import org.influence.analytics.engine.exception.PartialEnrichmentException;
import org.influence.analytics.enrichment.model.EnrichmentReport;
import org.influence.analytics.enrichment.model.RepresentativeImage;
import org.influence.analytics.enrichment.strategy.ImageCatalogClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfileImageEnricherTest {

    @Mock
    private ImageCatalogClient imageCatalogClient;

    private ProfileImageEnricher enricher;

    @BeforeEach
    void setUp() {
        enricher = new ProfileImageEnricher(imageCatalogClient, Runnable::run);
    }

    private static Map<String, Object> row(String userId, String profilePic) {
        Map<String, Object> row = new HashMap<>();
        row.put("user_id", userId);
        row.put("profile_pic_url", profilePic);
        return row;
    }

    @Test
    void usesTheFirstRepresentativeImage() {
        // Arrange
        when(imageCatalogClient.fetchImages("u1")).thenReturn(List.of(
                new RepresentativeImage("p0", ""),
                new RepresentativeImage("p1", "https://img.example/u1/p1.jpg"),
                new RepresentativeImage("p2", "https://img.example/u1/p2.jpg")));
        List<Map<String, Object>> rows = new ArrayList<>(List.of(row("u1", "https://pic.example/u1.jpg")));

        // Act
        EnrichmentReport report = enricher.enrich(rows);

        // Assert
        assertThat(rows.get(0)).containsEntry("primary_image", "https://img.example/u1/p1.jpg");
        assertThat(report.getAttempted()).isEqualTo(1);
        assertThat(report.getFailed()).isZero();
    }

    @Test
    void failedFetchFallsBackToProfilePictureForThatRowOnly() {
        // Arrange
        when(imageCatalogClient.fetchImages("u1"))
                .thenReturn(List.of(new RepresentativeImage("p1", "https://img.example/u1/p1.jpg")));
        when(imageCatalogClient.fetchImages("u2"))
                .thenThrow(new PartialEnrichmentException("u2", "catalog returned 503", null));
        List<Map<String, Object>> rows = new ArrayList<>(List.of(
                row("u1", "https://pic.example/u1.jpg"),
                row("u2", "https://pic.example/u2.jpg")));

        // Act
        EnrichmentReport report = enricher.enrich(rows);

        // Assert
        assertThat(rows.get(0)).containsEntry("primary_image", "https://img.example/u1/p1.jpg");
        assertThat(rows.get(1)).containsEntry("primary_image", "https://pic.example/u2.jpg");
        assertThat(report.getAttempted()).isEqualTo(2);
        assertThat(report.getFailed()).isEqualTo(1);
    }

    @Test
    void emptyCatalogAnswerFallsBackWithoutCountingAFailure() {
        // Arrange
        when(imageCatalogClient.fetchImages("u3")).thenReturn(List.of());
        List<Map<String, Object>> rows = new ArrayList<>(List.of(row("u3", "https://pic.example/u3.jpg")));

        // Act
        EnrichmentReport report = enricher.enrich(rows);

        // Assert
        assertThat(rows.get(0)).containsEntry("primary_image", "https://pic.example/u3.jpg");
        assertThat(report.getFailed()).isZero();
    }

    @Test
    void disabledEnrichmentLeavesRowsUntouched() {
        // Arrange
        ReflectionTestUtils.setField(enricher, "enabled", false);
        List<Map<String, Object>> rows = new ArrayList<>(List.of(row("u1", "https://pic.example/u1.jpg")));

        // Act
        EnrichmentReport report = enricher.enrich(rows);

        // Assert
        assertThat(rows.get(0)).doesNotContainKey("primary_image");
        assertThat(report.getAttempted()).isZero();
        verifyNoInteractions(imageCatalogClient);
    }

    @Test
    void fetchesThePoolRefusesFallBackAndCountAsFailed() {
        // Arrange
        ProfileImageEnricher saturated = new ProfileImageEnricher(imageCatalogClient, task -> {
            throw new RejectedExecutionException("pool full");
        });
        List<Map<String, Object>> rows = new ArrayList<>(List.of(
                row("u1", "https://pic.example/u1.jpg"),
                row("u2", "https://pic.example/u2.jpg")));

        // Act
        EnrichmentReport report = saturated.enrich(rows);

        // Assert
        assertThat(List.of(rows.get(0).get("primary_image"), rows.get(1).get("primary_image")))
                .containsExactly("https://pic.example/u1.jpg", "https://pic.example/u2.jpg");
        assertThat(report.getAttempted()).isEqualTo(2);
        assertThat(report.getFailed()).isEqualTo(2);
        verifyNoInteractions(imageCatalogClient);
    }
}
