package org.influence.analytics.query.catalog;

import org.influence.analytics.filter.model.FilterParameter;
import org.influence.analytics.query.model.AggregationKind;
import org.influence.analytics.query.model.OperationId;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.influence.analytics.filter.model.FilterParameter.*;
import static org.influence.analytics.query.catalog.JoinRequirement.ALWAYS_INNER;
import static org.influence.analytics.query.catalog.JoinRequirement.ALWAYS_LEFT;
import static org.influence.analytics.query.catalog.JoinRequirement.ON_SPECIALIZED_FILTER;
import static org.influence.analytics.query.model.WarehouseTable.BEAUTY_PROFILES;
import static org.influence.analytics.query.model.WarehouseTable.PROFILE_METRICS;
import static org.influence.analytics.query.model.WarehouseTable.USER_LINKS;

/**
 * Compiled-in descriptor table for every supported operation.
 */
@Component
public class OperationCatalog {

    /** Absolute ceiling on any scan window. */
    public static final int MAX_WINDOW_DAYS = 365;

    /**
     * Two-window operations scan twice their window, so their window is capped at half the ceiling.
     */
    public static final int MAX_COMPARISON_WINDOW_DAYS = 182;

    private static final Set<FilterParameter> PROFILE_FILTERS =
            EnumSet.of(COUNTRY, GENDER, AGE_RANGE, ETHNIC_CATEGORY, INTERESTS, COLLABORATION_TIER);

    private static final Set<FilterParameter> BEAUTY_FILTERS = EnumSet.of(SKIN_TYPE, SKIN_CONCERNS,
            PERSONAL_COLOR, BRAND_TIER_SEGMENTS, BEAUTY_INTEREST_AREAS, BEAUTY_CONTENT_TYPES);

    private final Map<OperationId, OperationDescriptor> descriptors;

    public OperationCatalog() {
        Map<OperationId, OperationDescriptor> table = new EnumMap<>(OperationId.class);
        for (OperationDescriptor descriptor : definitions()) {
            table.put(descriptor.getId(), descriptor);
        }
        for (OperationId id : OperationId.values()) {
            if (!table.containsKey(id)) {
                throw new IllegalStateException("No descriptor for " + id);
            }
        }
        this.descriptors = Collections.unmodifiableMap(table);
    }

    public OperationDescriptor get(OperationId id) {
        return descriptors.get(id);
    }

    public Collection<OperationDescriptor> all() {
        return descriptors.values();
    }

    private static List<OperationDescriptor> definitions() {
        return List.of(
                OperationDescriptor.builder(OperationId.SEARCH_INFLUENCERS, AggregationKind.RAW_SEARCH)
                        .description("Search influencers by profile, follower range and beauty attributes")
                        .join(BEAUTY_PROFILES, ON_SPECIALIZED_FILTER)
                        .join(PROFILE_METRICS, ALWAYS_INNER)
                        .accepts(PROFILE_FILTERS)
                        .accepts(BEAUTY_FILTERS)
                        .accepts(FOLLOWER_MIN, FOLLOWER_MAX, K_INTEREST)
                        .limit(50, 500)
                        .preview(20)
                        .enrichImages()
                        .build(),

                OperationDescriptor.builder(OperationId.SEARCH_BY_BRAND_COLLABORATION, AggregationKind.RAW_SEARCH)
                        .description("Influencers who have collaborated with a brand")
                        .join(PROFILE_METRICS, ALWAYS_INNER)
                        .requires(BRAND_NAME)
                        .accepts(EXCLUDE_BRANDS, COUNTRY, COLLABORATION_TIER, FOLLOWER_MIN, FOLLOWER_MAX)
                        .limit(50, 500)
                        .preview(20)
                        .enrichImages()
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_HASHTAG_TRENDS, AggregationKind.SINGLE_WINDOW)
                        .description("Most used hashtags and their engagement")
                        .unionsContent()
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(PROFILE_FILTERS)
                        .accepts(CONTENT_TYPE)
                        .window(30, 1, MAX_WINDOW_DAYS)
                        .limit(50, 500)
                        .preview(50)
                        .build(),

                OperationDescriptor.builder(OperationId.DETECT_EMERGING_HASHTAGS, AggregationKind.TWO_WINDOW)
                        .description("Hashtags growing fastest against the previous period")
                        .unionsContent()
                        .accepts(COUNTRY, INTERESTS, CONTENT_TYPE, COMPARE_PERIOD, MIN_GROWTH_RATE, MIN_CURRENT_COUNT)
                        .window(30, 1, MAX_COMPARISON_WINDOW_DAYS)
                        .defaultValue(MIN_GROWTH_RATE, 1.5)
                        .defaultValue(MIN_CURRENT_COUNT, 10)
                        .limit(30, 200)
                        .preview(30)
                        .build(),

                OperationDescriptor.builder(OperationId.COMPARE_REGIONAL_HASHTAGS, AggregationKind.MULTI_ENTITY)
                        .description("Top hashtags per country")
                        .unionsContent()
                        .compares(COUNTRIES, 2)
                        .accepts(INTERESTS, CONTENT_TYPE)
                        .window(30, 1, MAX_WINDOW_DAYS)
                        .limit(20, 100)
                        .preview(100)
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_BEAUTY_INGREDIENT_TRENDS, AggregationKind.TWO_WINDOW)
                        .description("Beauty ingredients and items gaining mentions across the period")
                        .join(BEAUTY_PROFILES, ALWAYS_INNER)
                        .accepts(CATEGORY, COUNTRY, MIN_CURRENT_COUNT)
                        .window(90, 2, MAX_WINDOW_DAYS)
                        .defaultValue(CATEGORY, "skincare")
                        .defaultValue(MIN_CURRENT_COUNT, 3)
                        .limit(30, 200)
                        .preview(30)
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_BRAND_MENTIONS, AggregationKind.MULTI_ENTITY)
                        .description("Caption and hashtag mentions per brand")
                        .unionsContent()
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .compares(BRAND_NAMES, 1)
                        .accepts(COUNTRY, CONTENT_TYPE)
                        .window(90, 1, MAX_WINDOW_DAYS)
                        .limit(50, 500)
                        .preview(50)
                        .build(),

                OperationDescriptor.builder(OperationId.FIND_BRAND_COLLABORATORS, AggregationKind.RAW_SEARCH)
                        .description("Influencers whose collaborations match a brand name")
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .requires(BRAND_NAME)
                        .accepts(COUNTRY, COLLABORATION_TIER, MIN_FOLLOWERS)
                        .limit(50, 500)
                        .preview(20)
                        .enrichImages()
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_SPONSORED_CONTENT_PERFORMANCE, AggregationKind.SINGLE_WINDOW)
                        .description("Sponsored against organic content performance")
                        .unionsContent()
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(BRAND_NAME, COUNTRY, COLLABORATION_TIER, CONTENT_TYPE)
                        .window(90, 1, MAX_WINDOW_DAYS)
                        .limit(10, 10)
                        .preview(20)
                        .build(),

                OperationDescriptor.builder(OperationId.COMPARE_COMPETITOR_BRANDS, AggregationKind.MULTI_ENTITY)
                        .description("Collaborators and sponsored activity across competing brands")
                        .unionsContent()
                        .compares(BRANDS, 2)
                        .accepts(COUNTRY)
                        .window(90, 1, MAX_WINDOW_DAYS)
                        .limit(20, 50)
                        .preview(20)
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_MARKET_DEMOGRAPHICS, AggregationKind.SINGLE_WINDOW)
                        .description("Influencer population broken down by demographic dimensions")
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .requires(COUNTRY)
                        .accepts(INTERESTS, GROUP_BY)
                        .defaultValue(GROUP_BY, List.of("gender", "age_range"))
                        .limit(100, 500)
                        .preview(100)
                        .build(),

                OperationDescriptor.builder(OperationId.FIND_K_CULTURE_INFLUENCERS, AggregationKind.RAW_SEARCH)
                        .description("Influencers with an interest in Korean culture")
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .requires(COUNTRY)
                        .accepts(INTERESTS, COLLABORATION_TIER, MIN_FOLLOWERS)
                        .limit(50, 500)
                        .preview(20)
                        .enrichImages()
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_LIFESTAGE_SEGMENTS, AggregationKind.SINGLE_WINDOW)
                        .description("Influencer segments by life stage and brand readiness")
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(LIFESTAGE, COUNTRY, INTERESTS)
                        .limit(50, 100)
                        .preview(50)
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_BEAUTY_PERSONA_SEGMENTS, AggregationKind.SINGLE_WINDOW)
                        .description("Beauty personas by skin type, personal color and brand tier")
                        .join(BEAUTY_PROFILES, ALWAYS_INNER)
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(BEAUTY_FILTERS)
                        .accepts(COUNTRY)
                        .limit(50, 500)
                        .preview(50)
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_ENGAGEMENT_METRICS, AggregationKind.SINGLE_WINDOW)
                        .description("Engagement distribution per content format")
                        .unionsContent()
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(COUNTRY, INTERESTS, COLLABORATION_TIER, CONTENT_TYPE)
                        .window(30, 1, MAX_WINDOW_DAYS)
                        .limit(10, 10)
                        .preview(20)
                        .build(),

                OperationDescriptor.builder(OperationId.COMPARE_CONTENT_FORMATS, AggregationKind.SINGLE_WINDOW)
                        .description("Feed posts against reels")
                        .unionsContent()
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(COUNTRY, INTERESTS, COLLABORATION_TIER)
                        .window(90, 1, MAX_WINDOW_DAYS)
                        .limit(10, 10)
                        .preview(20)
                        .build(),

                OperationDescriptor.builder(OperationId.FIND_OPTIMAL_POSTING_TIME, AggregationKind.SINGLE_WINDOW)
                        .description("Day and hour slots with the highest engagement")
                        .unionsContent()
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(COUNTRY, INTERESTS, COLLABORATION_TIER, CONTENT_TYPE)
                        .window(90, 1, MAX_WINDOW_DAYS)
                        .limit(50, 168)
                        .preview(50)
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_VIRAL_CONTENT_PATTERNS, AggregationKind.SINGLE_WINDOW)
                        .description("Shared traits of posts above a like threshold")
                        .unionsContent()
                        .accepts(COUNTRY, INTERESTS, CONTENT_TYPE, VIRAL_THRESHOLD)
                        .defaultValue(VIRAL_THRESHOLD, 100_000)
                        .window(180, 1, MAX_WINDOW_DAYS)
                        .limit(10, 10)
                        .preview(20)
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_BEAUTY_CONTENT_PERFORMANCE, AggregationKind.SINGLE_WINDOW)
                        .description("Engagement per beauty content type")
                        .unionsContent()
                        .join(BEAUTY_PROFILES, ALWAYS_INNER)
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .accepts(BEAUTY_CONTENT_TYPES, COUNTRY)
                        .window(90, 1, MAX_WINDOW_DAYS)
                        .limit(20, 50)
                        .preview(20)
                        .build(),

                OperationDescriptor.builder(OperationId.SEARCH_MULTIPLATFORM_INFLUENCERS, AggregationKind.RAW_SEARCH)
                        .description("Influencers present on every required channel")
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .join(USER_LINKS, ALWAYS_INNER)
                        .requires(REQUIRED_CHANNELS)
                        .accepts(COUNTRY, INTERESTS, COLLABORATION_TIER, MIN_FOLLOWERS)
                        .limit(100, 500)
                        .preview(20)
                        .enrichImages()
                        .build(),

                OperationDescriptor.builder(OperationId.FIND_INFLUENCERS_WITH_SHOPPING_LINKS, AggregationKind.RAW_SEARCH)
                        .description("Influencers linking to shopping storefronts")
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .join(USER_LINKS, ALWAYS_INNER)
                        .accepts(SHOPPING_CHANNELS, COUNTRY, INTERESTS, COLLABORATION_TIER, MIN_FOLLOWERS)
                        .limit(50, 500)
                        .preview(20)
                        .enrichImages()
                        .build(),

                OperationDescriptor.builder(OperationId.FIND_CONTACTABLE_INFLUENCERS, AggregationKind.RAW_SEARCH)
                        .description("Influencers with a direct contact channel")
                        .join(PROFILE_METRICS, ALWAYS_LEFT)
                        .join(USER_LINKS, ALWAYS_INNER)
                        .accepts(CONTACT_CHANNELS, COUNTRY, INTERESTS, COLLABORATION_TIER, MIN_FOLLOWERS)
                        .limit(50, 500)
                        .preview(20)
                        .enrichImages()
                        .build(),

                OperationDescriptor.builder(OperationId.ANALYZE_PLATFORM_DISTRIBUTION, AggregationKind.SINGLE_WINDOW)
                        .description("Share of influencers present on each outbound channel")
                        .join(USER_LINKS, ALWAYS_INNER)
                        .accepts(LINK_TYPE, COUNTRY, INTERESTS, COLLABORATION_TIER)
                        .limit(50, 100)
                        .preview(50)
                        .build(),

                OperationDescriptor.builder(OperationId.COMPARE_PLATFORM_PRESENCE, AggregationKind.MULTI_ENTITY)
                        .description("Channel presence of each brand's collaborators")
                        .join(USER_LINKS, ALWAYS_INNER)
                        .compares(BRANDS, 2)
                        .accepts(CHANNELS, COUNTRY)
                        .limit(100, 500)
                        .preview(100)
                        .build()
        );
    }
}
