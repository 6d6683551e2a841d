package org.influence.analytics.query.service;

import org.influence.analytics.engine.exception.CompilationException;
import org.influence.analytics.filter.model.FilterSpecification;
import org.influence.analytics.filter.model.WireValue;
import org.influence.analytics.query.catalog.JoinRequirement;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.catalog.OperationDescriptor;
import org.influence.analytics.query.model.ContentBranch;
import org.influence.analytics.query.model.ContentColumn;
import org.influence.analytics.query.model.ContentSource;
import org.influence.analytics.query.model.Join;
import org.influence.analytics.query.model.PlanRole;
import org.influence.analytics.query.model.QueryPlan;
import org.influence.analytics.query.model.SqlFragment;
import org.influence.analytics.query.model.WarehouseTable;
import org.influence.analytics.query.model.predicate.ArrayContainsAny;
import org.influence.analytics.query.model.predicate.Comparison;
import org.influence.analytics.query.model.predicate.InList;
import org.influence.analytics.query.model.predicate.Predicate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inputs of one compilation plus the building blocks shared by all query shapes:
 * descriptor-driven joins, optional-filter predicates and bounded content sources.
 */
final class PlanContext {

    private final OperationDescriptor descriptor;
    private final FilterSpecification spec;
    private final LocalDate today;

    PlanContext(OperationDescriptor descriptor, FilterSpecification spec, LocalDate today) {
        this.descriptor = descriptor;
        this.spec = spec;
        this.today = today;
    }

    OperationDescriptor descriptor() {
        return descriptor;
    }

    FilterSpecification spec() {
        return spec;
    }

    LocalDate today() {
        return today;
    }

    /**
     * First day scanned by a window of the requested length, never further back than the absolute ceiling.
     */
    LocalDate windowStart(int days) {
        return today.minusDays(Math.min(days, OperationCatalog.MAX_WINDOW_DAYS));
    }

    /**
     * Tables joined to the base table: every unconditional join of the descriptor, plus the
     * specialized beauty table when a beauty sub-filter is present.
     */
    List<Join> joins() {
        List<Join> joins = new ArrayList<>();
        for (Map.Entry<WarehouseTable, JoinRequirement> entry : descriptor.getJoinable().entrySet()) {
            JoinRequirement requirement = entry.getValue();
            if (!requirement.isConditional() || spec.needsSpecializedJoin()) {
                joins.add(new Join(entry.getKey(), requirement.getJoinType()));
            }
        }
        return joins;
    }

    boolean joins(WarehouseTable table) {
        return joins().stream().anyMatch(join -> join.getTable() == table);
    }

    /**
     * Profile-side plan with the descriptor's joins, the optional-filter predicates and the requested limit.
     */
    QueryPlan.Builder plan(PlanRole role) {
        return plan(role, EnumSet.noneOf(WarehouseTable.class));
    }

    /**
     * As {@link #plan(PlanRole)} but leaving out some joins, for totals that must not be multiplied by them.
     */
    QueryPlan.Builder plan(PlanRole role, Set<WarehouseTable> excludedJoins) {
        QueryPlan.Builder builder = QueryPlan.builder(descriptor.getId(), role)
                .baseTable(descriptor.getBaseTable())
                .limit(spec.getLimit());
        for (Join join : joins()) {
            if (!excludedJoins.contains(join.getTable())) {
                builder.join(join);
            }
        }
        for (Predicate predicate : profileFilters()) {
            builder.filterPredicate(predicate);
        }
        return builder;
    }

    /**
     * Plan over the content union for {@code [from, toExclusive)}, joined to matching profiles.
     * The follower count is projected whenever the metrics table is joined.
     */
    QueryPlan.Builder contentPlan(PlanRole role, List<ContentColumn> columns, LocalDate from,
                                  LocalDate toExclusive, boolean profileDriven) {
        QueryPlan.Builder builder = plan(role)
                .content(content(columns, from, toExclusive, profileDriven))
                .partitionLowerBound(from);
        if (joins(WarehouseTable.PROFILE_METRICS)) {
            builder.profileProjection(SqlFragment.of("p.followed_by AS followed_by"));
        }
        return builder;
    }

    ContentSource content(List<ContentColumn> columns, LocalDate from, LocalDate toExclusive, boolean profileDriven) {
        if (!descriptor.isUnionsContent()) {
            throw new CompilationException(descriptor.getId(), "operation does not read content tables");
        }
        List<ContentBranch> branches = new ArrayList<>();
        switch (spec.getContentType()) {
            case MEDIA:
                branches.add(new ContentBranch(WarehouseTable.FEED_MEDIA, from, toExclusive));
                break;
            case REELS:
                branches.add(new ContentBranch(WarehouseTable.REELS, from, toExclusive));
                break;
            default:
                branches.add(new ContentBranch(WarehouseTable.FEED_MEDIA, from, toExclusive));
                branches.add(new ContentBranch(WarehouseTable.REELS, from, toExclusive));
                break;
        }
        return new ContentSource(branches, columns, profileDriven);
    }

    /**
     * One predicate per present optional filter on profile attributes. Absent filters
     * contribute nothing, so an empty specification yields an empty list.
     */
    List<Predicate> profileFilters() {
        List<Predicate> predicates = new ArrayList<>();
        if (!spec.getCountries().isEmpty()) {
            predicates.add(new ArrayContainsAny("g.country", new ArrayList<>(spec.getCountries())));
        }
        addIn(predicates, "g.gender", spec.getGenders());
        addIn(predicates, "g.age_range", spec.getAgeRanges());
        addIn(predicates, "g.ethnic_category", spec.getEthnicCategories());
        addAny(predicates, "g.interests", spec.getInterests());
        addIn(predicates, "g.collaboration_tier", spec.getCollaborationTiers());
        addIn(predicates, "g.lifestage", spec.getLifestages());
        if (spec.getKCulture() != null) {
            predicates.add(new Comparison("g.k_interest", Comparison.Operator.EQ, spec.getKCulture()));
        }
        if (spec.getFollowerMin() != null) {
            predicates.add(new Comparison("p.followed_by", Comparison.Operator.GE, spec.getFollowerMin()));
        }
        if (spec.getFollowerMax() != null) {
            predicates.add(new Comparison("p.followed_by", Comparison.Operator.LE, spec.getFollowerMax()));
        }
        addAny(predicates, "b.skin_type", spec.getSkinTypes());
        addAny(predicates, "b.skin_concerns", spec.getSkinConcerns());
        addIn(predicates, "b.personal_color", spec.getPersonalColors());
        addIn(predicates, "b.brand_tier", spec.getBrandTiers());
        addAny(predicates, "b.beauty_interest_areas", spec.getBeautyInterestAreas());
        addAny(predicates, "b.beauty_content_types", spec.getBeautyContentTypes());
        return predicates;
    }

    static List<String> wireValues(Collection<? extends WireValue> values) {
        List<String> wire = new ArrayList<>(values.size());
        for (WireValue value : values) {
            wire.add(value.getWireValue());
        }
        return wire;
    }

    private static void addIn(List<Predicate> predicates, String column, Collection<? extends WireValue> values) {
        if (!values.isEmpty()) {
            predicates.add(new InList(column, wireValues(values)));
        }
    }

    private static void addAny(List<Predicate> predicates, String column, Collection<? extends WireValue> values) {
        if (!values.isEmpty()) {
            predicates.add(new ArrayContainsAny(column, wireValues(values)));
        }
    }
}
