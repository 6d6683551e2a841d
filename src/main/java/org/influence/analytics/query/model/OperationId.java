package org.influence.analytics.query.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of analytic operations the engine can compile.
 */
public enum OperationId {
    SEARCH_INFLUENCERS("search_influencers"),
    SEARCH_BY_BRAND_COLLABORATION("search_by_brand_collaboration"),
    ANALYZE_HASHTAG_TRENDS("analyze_hashtag_trends"),
    DETECT_EMERGING_HASHTAGS("detect_emerging_hashtags"),
    COMPARE_REGIONAL_HASHTAGS("compare_regional_hashtags"),
    ANALYZE_BEAUTY_INGREDIENT_TRENDS("analyze_beauty_ingredient_trends"),
    ANALYZE_BRAND_MENTIONS("analyze_brand_mentions"),
    FIND_BRAND_COLLABORATORS("find_brand_collaborators"),
    ANALYZE_SPONSORED_CONTENT_PERFORMANCE("analyze_sponsored_content_performance"),
    COMPARE_COMPETITOR_BRANDS("compare_competitor_brands"),
    ANALYZE_MARKET_DEMOGRAPHICS("analyze_market_demographics"),
    FIND_K_CULTURE_INFLUENCERS("find_k_culture_influencers"),
    ANALYZE_LIFESTAGE_SEGMENTS("analyze_lifestage_segments"),
    ANALYZE_BEAUTY_PERSONA_SEGMENTS("analyze_beauty_persona_segments"),
    ANALYZE_ENGAGEMENT_METRICS("analyze_engagement_metrics"),
    COMPARE_CONTENT_FORMATS("compare_content_formats"),
    FIND_OPTIMAL_POSTING_TIME("find_optimal_posting_time"),
    ANALYZE_VIRAL_CONTENT_PATTERNS("analyze_viral_content_patterns"),
    ANALYZE_BEAUTY_CONTENT_PERFORMANCE("analyze_beauty_content_performance"),
    SEARCH_MULTIPLATFORM_INFLUENCERS("search_multiplatform_influencers"),
    FIND_INFLUENCERS_WITH_SHOPPING_LINKS("find_influencers_with_shopping_links"),
    FIND_CONTACTABLE_INFLUENCERS("find_contactable_influencers"),
    ANALYZE_PLATFORM_DISTRIBUTION("analyze_platform_distribution"),
    COMPARE_PLATFORM_PRESENCE("compare_platform_presence");

    private final String wireName;

    OperationId(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<OperationId> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(op -> op.wireName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
