package org.influence.analytics.enrichment.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Envelope returned by the image catalog: a status code and the images as {@code item}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ImageCatalogResponse {

    private String code;
    private List<RepresentativeImage> item = new ArrayList<>();

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public List<RepresentativeImage> getItem() {
        return item;
    }

    public void setItem(List<RepresentativeImage> item) {
        this.item = item;
    }
}
