package org.influence.analytics.query.service;

import org.influence.analytics.aggregation.model.AnalysisSpec;
import org.influence.analytics.aggregation.model.Distribution;
import org.influence.analytics.aggregation.model.EntityCompletion;
import org.influence.analytics.aggregation.model.Ranking;
import org.influence.analytics.aggregation.model.WindowComparison;
import org.influence.analytics.aggregation.service.Derivations;
import org.influence.analytics.aggregation.service.EngagementRate;
import org.influence.analytics.filter.model.BeautyCategory;
import org.influence.analytics.filter.model.CollaborationTier;
import org.influence.analytics.filter.model.DemographicDimension;
import org.influence.analytics.filter.model.FilterSpecification;
import org.influence.analytics.filter.model.LinkType;
import org.influence.analytics.query.model.ContentColumn;
import org.influence.analytics.query.model.PlanRole;
import org.influence.analytics.query.model.QueryPlan;
import org.influence.analytics.query.model.SqlFragment;
import org.influence.analytics.query.model.WarehouseTable;
import org.influence.analytics.query.model.predicate.ArrayContainsAll;
import org.influence.analytics.query.model.predicate.ArrayContainsAny;
import org.influence.analytics.query.model.predicate.Comparison;
import org.influence.analytics.query.model.predicate.ContainsIgnoreCase;
import org.influence.analytics.query.model.predicate.DateRange;
import org.influence.analytics.query.model.predicate.FixedCondition;
import org.influence.analytics.query.model.predicate.InList;
import org.influence.analytics.query.model.predicate.Junction;
import org.influence.analytics.query.model.predicate.Not;
import org.influence.analytics.query.model.predicate.Predicate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.influence.analytics.query.model.ContentColumn.CAPTION;
import static org.influence.analytics.query.model.ContentColumn.COMMENT_COUNT;
import static org.influence.analytics.query.model.ContentColumn.CONTENT_FORMAT;
import static org.influence.analytics.query.model.ContentColumn.HASHTAGS;
import static org.influence.analytics.query.model.ContentColumn.LIKE_COUNT;
import static org.influence.analytics.query.model.ContentColumn.MEDIA_ID;
import static org.influence.analytics.query.model.ContentColumn.PAID_PARTNERSHIP;
import static org.influence.analytics.query.model.ContentColumn.PUBLISHED_AT;
import static org.influence.analytics.query.model.ContentColumn.USER_ID;

/**
 * Query shape of every operation: the plans it runs and how their rows are post-processed.
 * Caller-supplied values only ever reach the SQL as bound parameters.
 */
final class QueryShapes {

    /**
     * Row cap of the current window of a two-window comparison, ranked by count before the cut.
     * The previous window only counts keys the current window returned.
     */
    static final int COMPARISON_ROW_CAP = 50_000;

    static final int SAMPLE_SIZE = 1000;
    static final int SAMPLE_SEED = 42;

    private static final String SAMPLE = "groupArraySample(" + SAMPLE_SIZE + ", " + SAMPLE_SEED + ")";
    private static final String MENTION_TEXT = "concat(c.caption, ' ', arrayStringConcat(c.hashtags, ' '))";
    private static final String HASHTAG = "arrayJoin(arrayDistinct(arrayMap(h -> lower(h), c.hashtags))) AS hashtag";
    private static final String ENGAGEMENT = EngagementRate.sqlExpression("c.like_count", "c.comment_count",
            "t.followed_by");

    private static final long MIN_HASHTAG_USAGE = 3;
    private static final long MIN_SLOT_POSTS = 10;
    private static final long MIN_PERSONA_SIZE = 5;
    private static final long MIN_CONTENT_TYPE_INFLUENCERS = 5;

    private QueryShapes() {
    }

    /**
     * Plans plus analysis of one operation.
     */
    static final class Shape {
        private final List<QueryPlan> plans;
        private final AnalysisSpec analysis;

        Shape(List<QueryPlan> plans, AnalysisSpec analysis) {
            this.plans = plans;
            this.analysis = analysis;
        }

        List<QueryPlan> plans() {
            return plans;
        }

        AnalysisSpec analysis() {
            return analysis;
        }
    }

    static Shape shape(PlanContext ctx) {
        switch (ctx.descriptor().getId()) {
            case SEARCH_INFLUENCERS:
                return searchInfluencers(ctx);
            case SEARCH_BY_BRAND_COLLABORATION:
            case FIND_BRAND_COLLABORATORS:
                return brandCollaborators(ctx);
            case FIND_K_CULTURE_INFLUENCERS:
                return kCultureInfluencers(ctx);
            case SEARCH_MULTIPLATFORM_INFLUENCERS:
                return linkSearch(ctx, null);
            case FIND_INFLUENCERS_WITH_SHOPPING_LINKS:
                return linkSearch(ctx, LinkType.SHOPPING);
            case FIND_CONTACTABLE_INFLUENCERS:
                return linkSearch(ctx, LinkType.CONTACT);
            case ANALYZE_HASHTAG_TRENDS:
                return hashtagTrends(ctx);
            case DETECT_EMERGING_HASHTAGS:
                return emergingHashtags(ctx);
            case COMPARE_REGIONAL_HASHTAGS:
                return regionalHashtags(ctx);
            case ANALYZE_BEAUTY_INGREDIENT_TRENDS:
                return ingredientTrends(ctx);
            case ANALYZE_BRAND_MENTIONS:
                return brandMentions(ctx);
            case ANALYZE_SPONSORED_CONTENT_PERFORMANCE:
                return sponsoredPerformance(ctx);
            case COMPARE_COMPETITOR_BRANDS:
                return competitorBrands(ctx);
            case ANALYZE_MARKET_DEMOGRAPHICS:
                return marketDemographics(ctx);
            case ANALYZE_LIFESTAGE_SEGMENTS:
                return lifestageSegments(ctx);
            case ANALYZE_BEAUTY_PERSONA_SEGMENTS:
                return beautyPersonas(ctx);
            case ANALYZE_ENGAGEMENT_METRICS:
                return engagementMetrics(ctx);
            case COMPARE_CONTENT_FORMATS:
                return contentFormats(ctx);
            case FIND_OPTIMAL_POSTING_TIME:
                return postingTime(ctx);
            case ANALYZE_VIRAL_CONTENT_PATTERNS:
                return viralContent(ctx);
            case ANALYZE_BEAUTY_CONTENT_PERFORMANCE:
                return beautyContentPerformance(ctx);
            case ANALYZE_PLATFORM_DISTRIBUTION:
                return platformDistribution(ctx);
            case COMPARE_PLATFORM_PRESENCE:
                return platformPresence(ctx);
            default:
                throw new IllegalStateException("No query shape for " + ctx.descriptor().getId());
        }
    }

    // ---- influencer searches ----

    private static Shape searchInfluencers(PlanContext ctx) {
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY);
        profileColumns(plan, false);
        if (ctx.joins(WarehouseTable.BEAUTY_PROFILES)) {
            plan.select("b.skin_type AS skin_type")
                    .select("b.personal_color AS personal_color")
                    .select("b.brand_tier AS brand_tier");
        }
        plan.orderBy("follower_count DESC", "user_id ASC");
        return single(plan, searchAnalysis());
    }

    private static Shape brandCollaborators(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY)
                .filterPredicate(ContainsIgnoreCase.inAnyElement("g.collaborate_brand", spec.getBrandName()));
        if (!spec.getExcludedBrands().isEmpty()) {
            List<Predicate> excluded = new ArrayList<>();
            for (String brand : spec.getExcludedBrands()) {
                excluded.add(ContainsIgnoreCase.inAnyElement("g.collaborate_brand", brand));
            }
            plan.filterPredicate(new Not(Junction.anyOf(excluded)));
        }
        profileColumns(plan, false);
        plan.select("g.collaborate_brand AS collaborate_brand")
                .orderBy("follower_count DESC", "user_id ASC");
        return single(plan, searchAnalysis());
    }

    private static Shape kCultureInfluencers(PlanContext ctx) {
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY)
                .shapePredicate(new Comparison("g.k_interest", Comparison.Operator.EQ, true));
        profileColumns(plan, false);
        plan.select("g.k_interest AS k_interest")
                .orderBy("follower_count DESC", "user_id ASC");
        return single(plan, searchAnalysis());
    }

    /**
     * One row per influencer with the channels and links matched by the link filters.
     *
     * @param linkType the link category every matched link must have, or null to match on channels alone
     */
    private static Shape linkSearch(PlanContext ctx, LinkType linkType) {
        FilterSpecification spec = ctx.spec();
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY);
        List<String> channels = PlanContext.wireValues(spec.getChannels());
        if (linkType != null) {
            plan.shapePredicate(new Comparison("l.type", Comparison.Operator.EQ, linkType.getWireValue()));
        }
        if (!channels.isEmpty()) {
            plan.filterPredicate(new InList("l.channel", channels));
        }
        if (linkType == null && !channels.isEmpty()) {
            plan.having(new ArrayContainsAll("channels", channels));
        }
        profileColumns(plan, true);
        plan.select("groupUniqArray(l.channel) AS channels")
                .select("groupUniqArray(l.url) AS link_urls")
                .groupBy("g.user_id")
                .orderBy("follower_count DESC", "user_id ASC");
        return single(plan, searchAnalysis());
    }

    // ---- hashtags and ingredients ----

    private static Shape hashtagTrends(PlanContext ctx) {
        LocalDate from = ctx.windowStart(ctx.spec().getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT, HASHTAGS), from, null, false);
        plan.select(HASHTAG)
                .select("count() AS usage_count")
                .select("uniqExact(c.user_id) AS unique_users");
        engagementSums(ctx, plan);
        plan.select(SAMPLE + "(c.like_count) AS like_sample")
                .groupBy("hashtag")
                .having(new Comparison("usage_count", Comparison.Operator.GE, MIN_HASHTAG_USAGE))
                .orderBy("usage_count DESC", "hashtag ASC");

        AnalysisSpec.Builder analysis = AnalysisSpec.builder();
        engagementMeans(ctx, analysis, "usage_count");
        analysis.derive(Derivations.percentiles("like_sample", "likes", 50, 90))
                .hide("like_sample");
        return single(plan, analysis.build());
    }

    private static Shape emergingHashtags(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        int days = spec.getWindowDays();
        LocalDate currentFrom = ctx.windowStart(days);
        LocalDate previousFrom = ctx.today().minusDays(2L * days);
        List<ContentColumn> columns = List.of(USER_ID, HASHTAGS);

        QueryPlan.Builder current = ctx.contentPlan(PlanRole.CURRENT_WINDOW, columns, currentFrom, null, false);
        hashtagCounts(current);
        if (spec.getMinCurrentCount() != null) {
            current.having(new Comparison("usage_count", Comparison.Operator.GE, spec.getMinCurrentCount()));
        }
        QueryPlan currentPlan = current.build();
        QueryPlan.Builder previous = ctx.contentPlan(PlanRole.PREVIOUS_WINDOW, columns, previousFrom, currentFrom,
                false);
        hashtagCounts(previous);
        previous.keysFrom("hashtag", currentPlan);

        AnalysisSpec analysis = AnalysisSpec.builder()
                .compareWindows(new WindowComparison("hashtag", "usage_count", spec.getMinGrowthRate(),
                        spec.getMinCurrentCount(), spec.getLimit()))
                .build();
        return new Shape(List.of(currentPlan, previous.build()), analysis);
    }

    private static void hashtagCounts(QueryPlan.Builder plan) {
        plan.select(HASHTAG)
                .select("count() AS usage_count")
                .groupBy("hashtag")
                .orderBy("usage_count DESC", "hashtag ASC")
                .limit(COMPARISON_ROW_CAP);
    }

    private static Shape regionalHashtags(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        List<String> countries = new ArrayList<>(spec.getCountries());
        LocalDate from = ctx.windowStart(spec.getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(USER_ID, LIKE_COUNT, HASHTAGS), from, null, false);
        plan.profileProjection(SqlFragment.of(
                        "arrayJoin(arrayIntersect(g.country, [" + placeholders(countries.size()) + "])) AS region",
                        countries))
                .select("t.region AS region")
                .select(HASHTAG)
                .select("count() AS usage_count")
                .select("uniqExact(c.user_id) AS unique_users")
                .select("sum(c.like_count) AS sum_likes")
                .groupBy("region", "hashtag")
                .orderBy("region ASC", "usage_count DESC", "hashtag ASC")
                .limitPerGroup(spec.getLimit(), "region")
                .limit(spec.getLimit() * countries.size());

        AnalysisSpec analysis = AnalysisSpec.builder()
                .complete(EntityCompletion.of("region", countries,
                        zeros("usage_count", "unique_users", "sum_likes")))
                .derive(Derivations.mean("avg_likes", "sum_likes", "usage_count", 1))
                .rank(new Ranking("rank", "region", "hashtag"))
                .hide("sum_likes")
                .build();
        return single(plan, analysis);
    }

    /**
     * Items of the selected beauty category counted over two consecutive halves of the window,
     * dated by when each profile was analyzed.
     */
    private static Shape ingredientTrends(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        BeautyCategory category = spec.getBeautyCategory() != null ? spec.getBeautyCategory() : BeautyCategory.SKINCARE;
        int half = spec.getWindowDays() / 2;
        LocalDate currentFrom = ctx.today().minusDays(half);
        LocalDate previousFrom = ctx.today().minusDays(2L * half);

        QueryPlan.Builder current = ingredientCounts(ctx, category, PlanRole.CURRENT_WINDOW,
                new DateRange("b.analyzed_at", currentFrom, null), currentFrom);
        current.select("topKArray(5)(b.skin_concerns) AS related_concerns");
        if (spec.getMinCurrentCount() != null) {
            current.having(new Comparison("influencer_count", Comparison.Operator.GE, spec.getMinCurrentCount()));
        }
        QueryPlan currentPlan = current.build();
        QueryPlan.Builder previous = ingredientCounts(ctx, category, PlanRole.PREVIOUS_WINDOW,
                new DateRange("b.analyzed_at", previousFrom, currentFrom), previousFrom)
                .keysFrom("ingredient", currentPlan);

        AnalysisSpec analysis = AnalysisSpec.builder()
                .compareWindows(new WindowComparison("ingredient", "influencer_count", null,
                        spec.getMinCurrentCount(), spec.getLimit()))
                .build();
        return new Shape(List.of(currentPlan, previous.build()), analysis);
    }

    private static QueryPlan.Builder ingredientCounts(PlanContext ctx, BeautyCategory category, PlanRole role,
                                                      DateRange analyzedWithin, LocalDate from) {
        return ctx.plan(role)
                .shapePredicate(new ArrayContainsAny("b.beauty_interest_areas",
                        List.of(category.getInterestArea().getWireValue())))
                .shapePredicate(analyzedWithin)
                .partitionLowerBound(from)
                .select("lower(arrayJoin(b." + category.getItemColumn() + ")) AS ingredient")
                .select("uniqExact(g.user_id) AS influencer_count")
                .groupBy("ingredient")
                .orderBy("influencer_count DESC", "ingredient ASC")
                .limit(COMPARISON_ROW_CAP);
    }

    // ---- brands ----

    private static Shape brandMentions(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        List<String> brands = spec.getBrands();
        LocalDate from = ctx.windowStart(spec.getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT, HASHTAGS, CAPTION, PAID_PARTNERSHIP), from, null, false);
        plan.contentPredicate(mentionsAny(brands))
                .select(mentionLabel(brands))
                .select("count() AS mention_count")
                .select("uniqExact(c.user_id) AS unique_influencers")
                .select("countIf(c.is_paid_partnership) AS sponsored_count");
        engagementSums(ctx, plan);
        plan.groupBy("brand")
                .orderBy("mention_count DESC", "brand ASC");

        AnalysisSpec.Builder analysis = AnalysisSpec.builder()
                .complete(EntityCompletion.of("brand", brands,
                        zeros("mention_count", "unique_influencers", "sponsored_count", "sum_likes", "sum_comments",
                                "sum_engagement_rate")));
        engagementMeans(ctx, analysis, "mention_count");
        analysis.derive(Derivations.percentOf("sponsored_pct", "sponsored_count", "mention_count"));
        return single(plan, analysis.build());
    }

    private static Shape sponsoredPerformance(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        LocalDate from = ctx.windowStart(spec.getWindowDays());
        List<ContentColumn> columns = spec.getBrandName() != null
                ? List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT, PAID_PARTNERSHIP, HASHTAGS, CAPTION)
                : List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT, PAID_PARTNERSHIP);
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY, columns, from, null, false);
        if (spec.getBrandName() != null) {
            plan.contentPredicate(ContainsIgnoreCase.inText(MENTION_TEXT, spec.getBrandName()));
        }
        plan.select("if(c.is_paid_partnership, 'Sponsored', 'Organic') AS content_category")
                .select("count() AS content_count")
                .select("uniqExact(c.user_id) AS unique_influencers");
        engagementSums(ctx, plan);
        plan.select(SAMPLE + "(" + ENGAGEMENT + ") AS engagement_sample")
                .groupBy("content_category")
                .orderBy("content_category DESC");

        AnalysisSpec.Builder analysis = AnalysisSpec.builder()
                .complete(EntityCompletion.of("content_category", List.of("Sponsored", "Organic"),
                        zeros("content_count", "unique_influencers", "sum_likes", "sum_comments",
                                "sum_engagement_rate")));
        engagementMeans(ctx, analysis, "content_count");
        analysis.derive(Derivations.percentiles("engagement_sample", "engagement_rate", 50, 90))
                .hide("engagement_sample");
        return single(plan, analysis.build());
    }

    /**
     * Every matching collaborator counts once per brand, with or without content in the window.
     */
    private static Shape competitorBrands(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        List<String> brands = spec.getBrands();
        LocalDate from = ctx.windowStart(spec.getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(MEDIA_ID, USER_ID, LIKE_COUNT, COMMENT_COUNT, PAID_PARTNERSHIP), from, null, true);
        plan.filterPredicate(collaboratesWithAny(brands))
                .profileProjection(collaborationLabel(brands))
                .profileProjection(SqlFragment.of("g.collaboration_tier AS collaboration_tier"))
                .select("t.brand AS brand")
                .select("uniqExact(t.user_id) AS collaborator_count")
                .select("countIf(c.media_id != '') AS content_count")
                .select("countIf(c.media_id != '' AND c.is_paid_partnership) AS sponsored_posts")
                .select("sumIf(c.like_count + c.comment_count, c.media_id != '') AS sum_engagement");
        List<String> tierColumns = new ArrayList<>();
        for (CollaborationTier tier : CollaborationTier.values()) {
            String column = "tier_" + tier.name().toLowerCase(Locale.ROOT);
            tierColumns.add(column);
            plan.select(SqlFragment.of("uniqExactIf(t.user_id, t.collaboration_tier = ?) AS " + column,
                    tier.getWireValue()));
        }
        plan.groupBy("brand")
                .orderBy("collaborator_count DESC", "brand ASC");

        List<String> zeroColumns = new ArrayList<>(List.of("collaborator_count", "content_count",
                "sponsored_posts", "sum_engagement"));
        zeroColumns.addAll(tierColumns);
        AnalysisSpec analysis = AnalysisSpec.builder()
                .complete(EntityCompletion.of("brand", brands, zeros(zeroColumns.toArray(new String[0]))))
                .derive(Derivations.mean("avg_engagement", "sum_engagement", "content_count", 1))
                .derive(Derivations.percentOf("sponsored_pct", "sponsored_posts", "content_count"))
                .hide("sum_engagement")
                .build();
        return single(plan, analysis);
    }

    // ---- market segments ----

    private static Shape marketDemographics(PlanContext ctx) {
        List<String> dimensions = new ArrayList<>();
        for (DemographicDimension dimension : ctx.spec().getGroupBy()) {
            dimensions.add(dimension.getColumn());
        }
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY);
        List<String> order = new ArrayList<>();
        order.add("influencer_count DESC");
        for (String dimension : dimensions) {
            plan.select("g." + dimension + " AS " + dimension);
            order.add(dimension + " ASC");
        }
        plan.select("count() AS influencer_count")
                .select("sum(p.followed_by) AS sum_followers")
                .select(SAMPLE + "(p.followed_by) AS follower_sample")
                .groupBy(dimensions.toArray(new String[0]))
                .orderBy(order.toArray(new String[0]));

        QueryPlan.Builder totals = ctx.plan(PlanRole.TOTALS)
                .required(false)
                .select("count() AS total_influencers")
                .limit(1);

        AnalysisSpec analysis = AnalysisSpec.builder()
                .derive(Derivations.mean("avg_followers", "sum_followers", "influencer_count", 0))
                .derive(Derivations.percentiles("follower_sample", "followers", 50))
                .distribution(new Distribution("influencer_count", "total_influencers", "share_pct", null))
                .hide("sum_followers", "follower_sample")
                .build();
        return new Shape(List.of(plan.build(), totals.build()), analysis);
    }

    private static Shape lifestageSegments(PlanContext ctx) {
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY)
                .shapePredicate(new FixedCondition("g.lifestage != ''"))
                .select("g.lifestage AS lifestage")
                .select("count() AS influencer_count")
                .select("sum(p.followed_by) AS sum_followers")
                .select(SqlFragment.of("countIf(g.collaboration_tier IN (?, ?)) AS ready_tier_count",
                        CollaborationTier.READY_PREMIUM.getWireValue(),
                        CollaborationTier.READY_PROFESSIONAL.getWireValue()))
                .groupBy("lifestage")
                .orderBy("influencer_count DESC", "lifestage ASC");

        AnalysisSpec analysis = AnalysisSpec.builder()
                .derive(Derivations.mean("avg_followers", "sum_followers", "influencer_count", 0))
                .derive(Derivations.percentOf("ready_tier_pct", "ready_tier_count", "influencer_count"))
                .hide("sum_followers")
                .build();
        return single(plan, analysis);
    }

    private static Shape beautyPersonas(PlanContext ctx) {
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY)
                .select("arrayJoin(b.skin_type) AS skin_type")
                .select("b.personal_color AS personal_color")
                .select("b.brand_tier AS brand_tier")
                .select("count() AS influencer_count")
                .select("sum(p.followed_by) AS sum_followers")
                .groupBy("skin_type", "personal_color", "brand_tier")
                .having(new Comparison("influencer_count", Comparison.Operator.GE, MIN_PERSONA_SIZE))
                .orderBy("influencer_count DESC", "skin_type ASC", "personal_color ASC", "brand_tier ASC");

        AnalysisSpec analysis = AnalysisSpec.builder()
                .derive(Derivations.mean("avg_followers", "sum_followers", "influencer_count", 0))
                .hide("sum_followers")
                .build();
        return single(plan, analysis);
    }

    // ---- content performance ----

    private static Shape engagementMetrics(PlanContext ctx) {
        QueryPlan.Builder plan = formatPlan(ctx);
        plan.select(SAMPLE + "(c.comment_count) AS comment_sample");

        AnalysisSpec.Builder analysis = AnalysisSpec.builder();
        engagementMeans(ctx, analysis, "content_count");
        analysis.derive(Derivations.percentiles("like_sample", "likes", 50, 90, 95, 99))
                .derive(Derivations.percentiles("comment_sample", "comments", 50))
                .hide("like_sample", "comment_sample");
        return single(plan, analysis.build());
    }

    private static Shape contentFormats(PlanContext ctx) {
        QueryPlan.Builder plan = formatPlan(ctx);

        AnalysisSpec.Builder analysis = AnalysisSpec.builder()
                .complete(EntityCompletion.of("content_format", List.of("feed", "reels"),
                        zeros("content_count", "unique_influencers", "sum_likes", "sum_comments",
                                "sum_engagement_rate")));
        engagementMeans(ctx, analysis, "content_count");
        analysis.derive(Derivations.percentiles("like_sample", "likes", 50))
                .hide("like_sample");
        return single(plan, analysis.build());
    }

    private static QueryPlan.Builder formatPlan(PlanContext ctx) {
        LocalDate from = ctx.windowStart(ctx.spec().getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT, CONTENT_FORMAT), from, null, false);
        plan.select("c.content_format AS content_format")
                .select("count() AS content_count")
                .select("uniqExact(c.user_id) AS unique_influencers");
        engagementSums(ctx, plan);
        return plan.select(SAMPLE + "(c.like_count) AS like_sample")
                .groupBy("content_format")
                .orderBy("content_format ASC");
    }

    private static Shape postingTime(PlanContext ctx) {
        LocalDate from = ctx.windowStart(ctx.spec().getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT, PUBLISHED_AT), from, null, false);
        plan.select("toDayOfWeek(c.published_at) AS day_of_week")
                .select("toHour(c.published_at) AS hour")
                .select("count() AS post_count");
        engagementSums(ctx, plan);
        plan.groupBy("day_of_week", "hour")
                .having(new Comparison("post_count", Comparison.Operator.GE, MIN_SLOT_POSTS))
                .orderBy("sum_engagement_rate / post_count DESC", "day_of_week ASC", "hour ASC");

        AnalysisSpec.Builder analysis = AnalysisSpec.builder()
                .derive(Derivations.dayName("day_name", "day_of_week"));
        engagementMeans(ctx, analysis, "post_count");
        return single(plan, analysis.build());
    }

    private static Shape viralContent(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        LocalDate from = ctx.windowStart(spec.getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT, HASHTAGS, CAPTION, CONTENT_FORMAT, PUBLISHED_AT),
                from, null, false);
        plan.contentPredicate(new Comparison("c.like_count", Comparison.Operator.GE, spec.getViralThreshold()))
                .select("c.content_format AS content_format")
                .select("count() AS viral_count")
                .select("uniqExact(c.user_id) AS unique_creators")
                .select("sum(c.like_count) AS sum_likes")
                .select("sum(c.comment_count) AS sum_comments")
                .select("sum(lengthUTF8(c.caption)) AS sum_caption_length")
                .select("topKArray(10)(c.hashtags) AS top_hashtags")
                .select("topK(3)(toDayOfWeek(c.published_at)) AS top_days")
                .groupBy("content_format")
                .orderBy("viral_count DESC", "content_format ASC");

        AnalysisSpec analysis = AnalysisSpec.builder()
                .derive(Derivations.mean("avg_likes", "sum_likes", "viral_count", 1))
                .derive(Derivations.mean("avg_comments", "sum_comments", "viral_count", 1))
                .derive(Derivations.mean("avg_caption_length", "sum_caption_length", "viral_count", 1))
                .hide("sum_likes", "sum_comments", "sum_caption_length")
                .build();
        return single(plan, analysis);
    }

    private static Shape beautyContentPerformance(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        LocalDate from = ctx.windowStart(spec.getWindowDays());
        QueryPlan.Builder plan = ctx.contentPlan(PlanRole.PRIMARY,
                List.of(USER_ID, LIKE_COUNT, COMMENT_COUNT), from, null, false);
        plan.profileProjection(SqlFragment.of("arrayJoin(b.beauty_content_types) AS beauty_content_type"));
        if (!spec.getBeautyContentTypes().isEmpty()) {
            plan.contentPredicate(new InList("t.beauty_content_type",
                    PlanContext.wireValues(spec.getBeautyContentTypes())));
        }
        plan.select("t.beauty_content_type AS beauty_content_type")
                .select("count() AS content_count")
                .select("uniqExact(c.user_id) AS unique_influencers");
        engagementSums(ctx, plan);
        plan.select(SAMPLE + "(c.like_count) AS like_sample")
                .groupBy("beauty_content_type")
                .having(new Comparison("unique_influencers", Comparison.Operator.GE, MIN_CONTENT_TYPE_INFLUENCERS))
                .orderBy("sum_engagement_rate / content_count DESC", "beauty_content_type ASC");

        AnalysisSpec.Builder analysis = AnalysisSpec.builder();
        engagementMeans(ctx, analysis, "content_count");
        analysis.derive(Derivations.percentiles("like_sample", "likes", 50))
                .hide("like_sample");
        return single(plan, analysis.build());
    }

    // ---- outbound links ----

    private static Shape platformDistribution(PlanContext ctx) {
        LinkType linkType = ctx.spec().getLinkType();
        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY);
        if (linkType != LinkType.ALL) {
            plan.filterPredicate(new Comparison("l.type", Comparison.Operator.EQ, linkType.getWireValue()));
        }
        plan.select("l.type AS link_type")
                .select("l.channel AS channel")
                .select("uniqExact(g.user_id) AS influencer_count")
                .groupBy("link_type", "channel")
                .orderBy("influencer_count DESC", "link_type ASC", "channel ASC");

        QueryPlan.Builder totals = ctx.plan(PlanRole.TOTALS, EnumSet.of(WarehouseTable.USER_LINKS))
                .required(false)
                .select("uniqExact(g.user_id) AS total_influencers")
                .limit(1);

        AnalysisSpec analysis = AnalysisSpec.builder()
                .distribution(new Distribution("influencer_count", "total_influencers", "percentage", null))
                .build();
        return new Shape(List.of(plan.build(), totals.build()), analysis);
    }

    private static Shape platformPresence(PlanContext ctx) {
        FilterSpecification spec = ctx.spec();
        List<String> brands = spec.getBrands();
        List<String> channels = PlanContext.wireValues(spec.getChannels());

        QueryPlan.Builder plan = ctx.plan(PlanRole.PRIMARY)
                .filterPredicate(collaboratesWithAny(brands));
        if (!channels.isEmpty()) {
            plan.filterPredicate(new InList("l.channel", channels));
        }
        plan.select(collaborationLabel(brands))
                .select("l.channel AS channel")
                .select("uniqExact(g.user_id) AS influencer_count")
                .groupBy("brand", "channel")
                .orderBy("brand ASC", "influencer_count DESC", "channel ASC");

        QueryPlan.Builder totals = ctx.plan(PlanRole.TOTALS, EnumSet.of(WarehouseTable.USER_LINKS))
                .required(false)
                .filterPredicate(collaboratesWithAny(brands))
                .select(collaborationLabel(brands))
                .select("uniqExact(g.user_id) AS collaborator_count")
                .groupBy("brand")
                .orderBy("brand ASC")
                .limit(brands.size());

        AnalysisSpec analysis = AnalysisSpec.builder()
                .complete(EntityCompletion.of("brand", brands, "channel", channels, zeros("influencer_count")))
                .distribution(new Distribution("influencer_count", "collaborator_count", "percentage", "brand"))
                .build();
        return new Shape(List.of(plan.build(), totals.build()), analysis);
    }

    // ---- shared pieces ----

    private static Shape single(QueryPlan.Builder plan, AnalysisSpec analysis) {
        return new Shape(List.of(plan.build()), analysis);
    }

    private static AnalysisSpec searchAnalysis() {
        return AnalysisSpec.builder()
                .derive(Derivations.engagementRate("engagement_rate", "avg_likes", "avg_comments", "follower_count"))
                .build();
    }

    private static void profileColumns(QueryPlan.Builder plan, boolean grouped) {
        plan.select("g.user_id AS user_id");
        String[][] columns = {
                {"g.username", "username"},
                {"g.full_name", "full_name"},
                {"g.country", "country"},
                {"g.gender", "gender"},
                {"g.age_range", "age_range"},
                {"g.interests", "interests"},
                {"g.collaboration_tier", "collaboration_tier"},
                {"g.profile_pic_url", "profile_pic_url"},
                {"p.followed_by", "follower_count"},
                {"p.avg_like_count", "avg_likes"},
                {"p.avg_comment_count", "avg_comments"},
        };
        for (String[] column : columns) {
            String expression = grouped ? "any(" + column[0] + ")" : column[0];
            plan.select(expression + " AS " + column[1]);
        }
    }

    private static void engagementSums(PlanContext ctx, QueryPlan.Builder plan) {
        plan.select("sum(c.like_count) AS sum_likes")
                .select("sum(c.comment_count) AS sum_comments");
        if (ctx.joins(WarehouseTable.PROFILE_METRICS)) {
            plan.select("sum(" + ENGAGEMENT + ") AS sum_engagement_rate");
        }
    }

    private static void engagementMeans(PlanContext ctx, AnalysisSpec.Builder analysis, String countColumn) {
        analysis.derive(Derivations.mean("avg_likes", "sum_likes", countColumn, 1))
                .derive(Derivations.mean("avg_comments", "sum_comments", countColumn, 1))
                .hide("sum_likes", "sum_comments");
        if (ctx.joins(WarehouseTable.PROFILE_METRICS)) {
            analysis.derive(Derivations.mean("avg_engagement_rate", "sum_engagement_rate", countColumn, 2))
                    .hide("sum_engagement_rate");
        }
    }

    private static Predicate mentionsAny(List<String> brands) {
        List<Predicate> mentions = new ArrayList<>();
        for (String brand : brands) {
            mentions.add(ContainsIgnoreCase.inText(MENTION_TEXT, brand));
        }
        return Junction.anyOf(mentions);
    }

    /**
     * Labels each content row with the first requested brand it mentions.
     */
    private static SqlFragment mentionLabel(List<String> brands) {
        StringBuilder text = new StringBuilder("multiIf(");
        List<Object> params = new ArrayList<>();
        for (String brand : brands) {
            text.append(MENTION_TEXT).append(" ILIKE ?, ?, ");
            params.add(ContainsIgnoreCase.containsPattern(brand));
            params.add(brand);
        }
        text.append("'') AS brand");
        return SqlFragment.of(text.toString(), params);
    }

    private static Predicate collaboratesWithAny(List<String> brands) {
        List<Predicate> matches = new ArrayList<>();
        for (String brand : brands) {
            matches.add(ContainsIgnoreCase.inAnyElement("g.collaborate_brand", brand));
        }
        return Junction.anyOf(matches);
    }

    /**
     * One row per requested brand the profile has collaborated with.
     */
    private static SqlFragment collaborationLabel(List<String> brands) {
        List<String> labels = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (String brand : brands) {
            labels.add("if(arrayExists(v -> v ILIKE ?, g.collaborate_brand), ?, '')");
            params.add(ContainsIgnoreCase.containsPattern(brand));
            params.add(brand);
        }
        return SqlFragment.of("arrayJoin(arrayFilter(x -> x != '', [" + String.join(", ", labels) + "])) AS brand",
                params);
    }

    private static String placeholders(int count) {
        List<String> marks = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            marks.add("?");
        }
        return String.join(", ", marks);
    }

    private static Map<String, Object> zeros(String... columns) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String column : columns) {
            values.put(column, 0L);
        }
        return values;
    }
}
