package org.influence.analytics.enrichment.service;

import org.influence.analytics.engine.exception.PartialEnrichmentException;
import org.influence.analytics.enrichment.model.EnrichmentReport;
import org.influence.analytics.enrichment.model.RepresentativeImage;
import org.influence.analytics.enrichment.strategy.ImageCatalogClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Adds a representative image to influencer rows.
 * <p>
 * Each row is fetched as its own task on a bounded pool with its own timeout. A row whose
 * fetch fails, times out or finds nothing keeps its profile picture; the batch never fails.
 */
@Service
public class ProfileImageEnricher {

    private static final Logger log = LoggerFactory.getLogger(ProfileImageEnricher.class);

    public static final String IMAGE_COLUMN = "primary_image";
    static final String USER_ID_COLUMN = "user_id";
    static final String FALLBACK_COLUMN = "profile_pic_url";

    private final ImageCatalogClient imageCatalogClient;
    private final Executor enrichmentExecutor;

    @Value("${enrichment.enabled:true}")
    private boolean enabled = true;

    @Value("${enrichment.row-timeout-ms:3000}")
    private long rowTimeoutMs = 3000;

    public ProfileImageEnricher(ImageCatalogClient imageCatalogClient,
                                @Qualifier("enrichmentExecutor") Executor enrichmentExecutor) {
        this.imageCatalogClient = imageCatalogClient;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    public EnrichmentReport enrich(List<Map<String, Object>> rows) {
        if (!enabled || rows.isEmpty()) {
            return EnrichmentReport.skipped();
        }

        List<CompletableFuture<String>> fetches = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object userId = row.get(USER_ID_COLUMN);
            fetches.add(userId == null
                    ? CompletableFuture.completedFuture(null)
                    : submit(userId.toString()));
        }

        int failed = 0;
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> row = rows.get(i);
            String image = null;
            try {
                image = fetches.get(i).get(rowTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                failed++;
                report(row, e.getCause() != null ? e.getCause() : e);
            } catch (TimeoutException e) {
                failed++;
                fetches.get(i).cancel(true);
                report(row, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed++;
                report(row, e);
            }
            row.put(IMAGE_COLUMN, image != null ? image : row.get(FALLBACK_COLUMN));
        }

        if (failed > 0) {
            log.warn("Image enrichment degraded: {} of {} rows fell back to the profile picture", failed, rows.size());
        }
        return new EnrichmentReport(rows.size(), failed);
    }

    /**
     * A fetch the pool refuses completes exceptionally, so the row falls back like any other failure.
     */
    private CompletableFuture<String> submit(String userId) {
        try {
            return CompletableFuture.supplyAsync(() -> firstImage(userId), enrichmentExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String firstImage(String userId) {
        List<RepresentativeImage> images = imageCatalogClient.fetchImages(userId);
        for (RepresentativeImage image : images) {
            if (image.getImageUrl() != null && !image.getImageUrl().isEmpty()) {
                return image.getImageUrl();
            }
        }
        return null;
    }

    private void report(Map<String, Object> row, Throwable cause) {
        String userId = String.valueOf(row.get(USER_ID_COLUMN));
        PartialEnrichmentException failure = cause instanceof PartialEnrichmentException
                ? (PartialEnrichmentException) cause
                : new PartialEnrichmentException(userId, String.valueOf(cause.getMessage()), cause);
        log.warn("{}: {}", failure.getErrorKind().getWireName(), failure.getMessage());
    }
}
