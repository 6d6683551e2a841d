package org.influence.analytics.enrichment.strategy;

import org.influence.analytics.engine.exception.PartialEnrichmentException;
import org.influence.analytics.enrichment.model.ImageCatalogResponse;
import org.influence.analytics.enrichment.model.RepresentativeImage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * Image catalog reached over HTTP: {@code GET <base-url>/api/v1/influencers/images/{userId}/representative/url}.
 */
@Service
public class HttpImageCatalogClient implements ImageCatalogClient {

    static final String IMAGES_PATH = "/api/v1/influencers/images/{userId}/representative/url";

    private final RestTemplate restTemplate;

    @Value("${enrichment.image-catalog.base-url:http://localhost:8090}")
    private String baseUrl;

    @Value("${enrichment.image-catalog.token:}")
    private String token;

    public HttpImageCatalogClient(@Qualifier("imageCatalogRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public List<RepresentativeImage> fetchImages(String userId) {
        HttpHeaders headers = new HttpHeaders();
        if (!token.isEmpty()) {
            headers.setBearerAuth(token);
        }
        try {
            ResponseEntity<ImageCatalogResponse> response = restTemplate.exchange(
                    baseUrl + IMAGES_PATH, HttpMethod.GET, new HttpEntity<>(headers),
                    ImageCatalogResponse.class, userId);
            ImageCatalogResponse body = response.getBody();
            return body != null && body.getItem() != null ? body.getItem() : List.of();
        } catch (RestClientException e) {
            throw new PartialEnrichmentException(userId, e.getMessage(), e);
        }
    }
}
