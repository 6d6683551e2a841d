package org.influence.analytics.filter.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every raw parameter name an operation may accept. Parameters are normalized in
 * declaration order, so {@code period_days} overrides a window implied by {@code compare_period}.
 */
public enum FilterParameter {
    COUNTRY("country"),
    COUNTRIES("countries"),
    GENDER("gender"),
    AGE_RANGE("age_range"),
    ETHNIC_CATEGORY("ethnic_category"),
    INTERESTS("interests"),
    COLLABORATION_TIER("collaboration_tier"),
    FOLLOWER_MIN("follower_min"),
    FOLLOWER_MAX("follower_max"),
    MIN_FOLLOWERS("min_followers"),
    K_INTEREST("k_interest"),
    SKIN_TYPE("skin_type"),
    SKIN_CONCERNS("skin_concerns"),
    PERSONAL_COLOR("personal_color"),
    BRAND_TIER_SEGMENTS("brand_tier_segments"),
    BEAUTY_INTEREST_AREAS("beauty_interest_areas"),
    BEAUTY_CONTENT_TYPES("beauty_content_types"),
    LIFESTAGE("lifestage"),
    BRAND_NAME("brand_name"),
    BRAND_NAMES("brand_names"),
    BRANDS("brands"),
    EXCLUDE_BRANDS("exclude_brands"),
    GROUP_BY("group_by"),
    CONTENT_TYPE("content_type"),
    CATEGORY("category"),
    LINK_TYPE("link_type"),
    REQUIRED_CHANNELS("required_channels"),
    SHOPPING_CHANNELS("shopping_channels"),
    CONTACT_CHANNELS("contact_channels"),
    CHANNELS("channels"),
    MIN_GROWTH_RATE("min_growth_rate"),
    MIN_CURRENT_COUNT("min_current_count"),
    VIRAL_THRESHOLD("viral_threshold"),
    COMPARE_PERIOD("compare_period"),
    PERIOD_DAYS("period_days"),
    LIMIT("limit");

    private final String wireName;

    FilterParameter(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<FilterParameter> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(p -> p.wireName.equals(name))
                .findFirst();
    }
}
