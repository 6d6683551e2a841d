package org.influence.analytics.enrichment.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RepresentativeImage {

    @JsonProperty("post_id")
    private String postId;

    @JsonProperty("image_url")
    private String imageUrl;

    public RepresentativeImage() {
    }

    public RepresentativeImage(String postId, String imageUrl) {
        this.postId = postId;
        this.imageUrl = imageUrl;
    }

    public String getPostId() {
        return postId;
    }

    public void setPostId(String postId) {
        this.postId = postId;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }
}
