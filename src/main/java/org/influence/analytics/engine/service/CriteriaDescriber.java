package org.influence.analytics.engine.service;

import org.influence.analytics.filter.model.ContentType;
import org.influence.analytics.filter.model.FilterSpecification;
import org.influence.analytics.filter.model.LinkType;
import org.influence.analytics.filter.model.WireValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * One-line, human-readable echo of the filters an invocation ran with,
 * e.g. {@code country=JP, KR; gender=Female; window=30d; limit=50}.
 */
@Component
public class CriteriaDescriber {

    public String describe(FilterSpecification spec) {
        List<String> parts = new ArrayList<>();
        add(parts, "country", spec.getCountries());
        addWire(parts, "gender", spec.getGenders());
        addWire(parts, "age_range", spec.getAgeRanges());
        addWire(parts, "ethnic_category", spec.getEthnicCategories());
        addWire(parts, "interests", spec.getInterests());
        addWire(parts, "collaboration_tier", spec.getCollaborationTiers());
        addWire(parts, "lifestage", spec.getLifestages());
        addWire(parts, "skin_type", spec.getSkinTypes());
        addWire(parts, "skin_concerns", spec.getSkinConcerns());
        addWire(parts, "personal_color", spec.getPersonalColors());
        addWire(parts, "brand_tier", spec.getBrandTiers());
        addWire(parts, "beauty_interest_areas", spec.getBeautyInterestAreas());
        addWire(parts, "beauty_content_types", spec.getBeautyContentTypes());
        if (spec.getFollowerMin() != null) {
            parts.add("followers>=" + spec.getFollowerMin());
        }
        if (spec.getFollowerMax() != null) {
            parts.add("followers<=" + spec.getFollowerMax());
        }
        if (spec.getKCulture() != null) {
            parts.add("k_interest=" + spec.getKCulture());
        }
        if (spec.getBrandName() != null) {
            parts.add("brand=" + spec.getBrandName());
        }
        add(parts, "brands", spec.getBrands());
        add(parts, "exclude_brands", spec.getExcludedBrands());
        addWire(parts, "group_by", spec.getGroupBy());
        if (spec.getContentType() != ContentType.ALL) {
            parts.add("content_type=" + spec.getContentType().getWireValue());
        }
        if (spec.getBeautyCategory() != null) {
            parts.add("category=" + spec.getBeautyCategory().getWireValue());
        }
        if (spec.getLinkType() != LinkType.ALL) {
            parts.add("link_type=" + spec.getLinkType().getWireValue());
        }
        addWire(parts, "channels", spec.getChannels());
        if (spec.getMinGrowthRate() != null) {
            parts.add("min_growth_rate=" + spec.getMinGrowthRate());
        }
        if (spec.getMinCurrentCount() != null) {
            parts.add("min_current_count=" + spec.getMinCurrentCount());
        }
        if (spec.getViralThreshold() != null) {
            parts.add("viral_threshold=" + spec.getViralThreshold());
        }
        if (spec.getWindowDays() > 0) {
            parts.add("window=" + spec.getWindowDays() + "d");
        }
        parts.add("limit=" + spec.getLimit());
        return String.join("; ", parts);
    }

    private static void add(List<String> parts, String name, Collection<String> values) {
        if (!values.isEmpty()) {
            parts.add(name + "=" + String.join(", ", values));
        }
    }

    private static void addWire(List<String> parts, String name, Collection<? extends WireValue> values) {
        List<String> wire = new ArrayList<>();
        for (WireValue value : values) {
            wire.add(value.getWireValue());
        }
        add(parts, name, wire);
    }
}
