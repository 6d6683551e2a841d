package org.influence.analytics.enrichment.strategy;

import org.influence.analytics.enrichment.model.RepresentativeImage;

import java.util.List;

/**
 * Source of representative images for an influencer.
 */
public interface ImageCatalogClient {

    /**
     * Fetch the representative images of one influencer, best first.
     *
     * @param userId warehouse user id
     * @return images, possibly empty
     * @throws org.influence.analytics.engine.exception.PartialEnrichmentException when the catalog cannot answer
     */
    List<RepresentativeImage> fetchImages(String userId);
}
