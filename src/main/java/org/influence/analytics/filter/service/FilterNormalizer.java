package org.influence.analytics.filter.service;

import org.influence.analytics.engine.exception.ValidationException;
import org.influence.analytics.filter.model.AgeRange;
import org.influence.analytics.filter.model.BeautyCategory;
import org.influence.analytics.filter.model.BeautyContentType;
import org.influence.analytics.filter.model.BeautyInterestArea;
import org.influence.analytics.filter.model.BrandTier;
import org.influence.analytics.filter.model.CollaborationTier;
import org.influence.analytics.filter.model.ComparePeriod;
import org.influence.analytics.filter.model.ContentType;
import org.influence.analytics.filter.model.DemographicDimension;
import org.influence.analytics.filter.model.EthnicCategory;
import org.influence.analytics.filter.model.FilterParameter;
import org.influence.analytics.filter.model.FilterSpecification;
import org.influence.analytics.filter.model.Gender;
import org.influence.analytics.filter.model.InterestCategory;
import org.influence.analytics.filter.model.Lifestage;
import org.influence.analytics.filter.model.LinkChannel;
import org.influence.analytics.filter.model.LinkType;
import org.influence.analytics.filter.model.PersonalColor;
import org.influence.analytics.filter.model.SkinConcern;
import org.influence.analytics.filter.model.SkinType;
import org.influence.analytics.query.catalog.OperationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validates raw operation parameters and canonicalizes them into a {@link FilterSpecification}.
 */
@Service
public class FilterNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FilterNormalizer.class);

    private static final Set<String> ISO_COUNTRIES = Set.of(Locale.getISOCountries());

    /**
     * Normalize raw parameters for one operation.
     *
     * @param descriptor the operation being invoked
     * @param raw        JSON-decoded parameters, may be null
     * @return the canonical filter specification
     * @throws ValidationException naming the first offending parameter
     */
    public FilterSpecification normalize(OperationDescriptor descriptor, Map<String, Object> raw) {
        Map<FilterParameter, Object> values = collect(descriptor, raw);

        FilterSpecification.Builder builder = FilterSpecification.builder();
        Set<FilterParameter> supplied = EnumSet.noneOf(FilterParameter.class);
        Integer requestedWindow = null;
        Long requestedLimit = null;

        for (Map.Entry<FilterParameter, Object> entry : values.entrySet()) {
            FilterParameter parameter = entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Collection && ((Collection<?>) value).isEmpty()) {
                // an empty list is the same as not filtering at all
                continue;
            }
            switch (parameter) {
                case COMPARE_PERIOD:
                    requestedWindow = ParameterReader.enumValue(parameter, ComparePeriod.class, value).getDays();
                    break;
                case PERIOD_DAYS:
                    requestedWindow = toInt(ParameterReader.wholeNumber(parameter, value));
                    break;
                case LIMIT:
                    requestedLimit = ParameterReader.wholeNumber(parameter, value);
                    break;
                default:
                    apply(parameter, value, builder);
                    break;
            }
            supplied.add(parameter);
        }

        for (FilterParameter parameter : descriptor.getRequired()) {
            if (!supplied.contains(parameter)) {
                throw new ValidationException(parameter.getWireName(),
                        "is required by " + descriptor.getId().getWireName());
            }
        }

        FilterSpecification draft = builder.build();
        checkComparisonCardinality(descriptor, draft);
        checkFollowerRange(draft);

        builder.windowDays(clampWindow(descriptor, requestedWindow));
        builder.limit(clampLimit(descriptor, requestedLimit));
        return builder.build();
    }

    private Map<FilterParameter, Object> collect(OperationDescriptor descriptor, Map<String, Object> raw) {
        Map<FilterParameter, Object> values = new EnumMap<>(FilterParameter.class);
        values.putAll(descriptor.getParameterDefaults());
        if (raw == null) {
            return values;
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String name = entry.getKey();
            FilterParameter parameter = FilterParameter.fromWireName(name)
                    .filter(descriptor.getAccepted()::contains)
                    .orElseThrow(() -> new ValidationException(name,
                            "is not accepted by " + descriptor.getId().getWireName()));
            if (entry.getValue() != null) {
                values.put(parameter, entry.getValue());
            }
        }
        return values;
    }

    private void apply(FilterParameter parameter, Object value, FilterSpecification.Builder builder) {
        switch (parameter) {
            case COUNTRY:
            case COUNTRIES:
                builder.countries(countries(parameter, value));
                break;
            case GENDER:
                builder.genders(ParameterReader.enumSet(parameter, Gender.class, value));
                break;
            case AGE_RANGE:
                builder.ageRanges(ParameterReader.enumSet(parameter, AgeRange.class, value));
                break;
            case ETHNIC_CATEGORY:
                builder.ethnicCategories(ParameterReader.enumSet(parameter, EthnicCategory.class, value));
                break;
            case INTERESTS:
                builder.interests(ParameterReader.enumSet(parameter, InterestCategory.class, value));
                break;
            case COLLABORATION_TIER:
                builder.collaborationTiers(ParameterReader.enumSet(parameter, CollaborationTier.class, value));
                break;
            case FOLLOWER_MIN:
            case MIN_FOLLOWERS:
                builder.followerMin(nonNegative(parameter, ParameterReader.wholeNumber(parameter, value)));
                break;
            case FOLLOWER_MAX:
                builder.followerMax(nonNegative(parameter, ParameterReader.wholeNumber(parameter, value)));
                break;
            case K_INTEREST:
                builder.kCulture(ParameterReader.bool(parameter, value));
                break;
            case SKIN_TYPE:
                builder.skinTypes(ParameterReader.enumSet(parameter, SkinType.class, value));
                break;
            case SKIN_CONCERNS:
                builder.skinConcerns(ParameterReader.enumSet(parameter, SkinConcern.class, value));
                break;
            case PERSONAL_COLOR:
                builder.personalColors(ParameterReader.enumSet(parameter, PersonalColor.class, value));
                break;
            case BRAND_TIER_SEGMENTS:
                builder.brandTiers(ParameterReader.enumSet(parameter, BrandTier.class, value));
                break;
            case BEAUTY_INTEREST_AREAS:
                builder.beautyInterestAreas(ParameterReader.enumSet(parameter, BeautyInterestArea.class, value));
                break;
            case BEAUTY_CONTENT_TYPES:
                builder.beautyContentTypes(ParameterReader.enumSet(parameter, BeautyContentType.class, value));
                break;
            case LIFESTAGE:
                builder.lifestages(ParameterReader.enumSet(parameter, Lifestage.class, value));
                break;
            case BRAND_NAME:
                builder.brandName(ParameterReader.text(parameter, value));
                break;
            case BRAND_NAMES:
            case BRANDS:
                builder.brands(brandTerms(parameter, value));
                break;
            case EXCLUDE_BRANDS:
                builder.excludedBrands(brandTerms(parameter, value));
                break;
            case GROUP_BY:
                builder.groupBy(ParameterReader.enumList(parameter, DemographicDimension.class, value));
                break;
            case CONTENT_TYPE:
                builder.contentType(ParameterReader.enumValue(parameter, ContentType.class, value));
                break;
            case CATEGORY:
                builder.beautyCategory(ParameterReader.enumValue(parameter, BeautyCategory.class, value));
                break;
            case LINK_TYPE:
                builder.linkType(ParameterReader.enumValue(parameter, LinkType.class, value));
                break;
            case REQUIRED_CHANNELS:
            case CHANNELS:
                builder.channels(ParameterReader.enumSet(parameter, LinkChannel.class, value));
                break;
            case SHOPPING_CHANNELS:
                builder.channels(channelsOfType(parameter, value, LinkType.SHOPPING));
                break;
            case CONTACT_CHANNELS:
                builder.channels(channelsOfType(parameter, value, LinkType.CONTACT));
                break;
            case MIN_GROWTH_RATE:
                double growth = ParameterReader.number(parameter, value);
                if (growth < 0) {
                    throw new ValidationException(parameter.getWireName(), "must not be negative");
                }
                builder.minGrowthRate(growth);
                break;
            case MIN_CURRENT_COUNT:
                builder.minCurrentCount(nonNegative(parameter, ParameterReader.wholeNumber(parameter, value)));
                break;
            case VIRAL_THRESHOLD:
                builder.viralThreshold(nonNegative(parameter, ParameterReader.wholeNumber(parameter, value)));
                break;
            default:
                throw new IllegalStateException("Unhandled parameter " + parameter);
        }
    }

    private Set<String> countries(FilterParameter parameter, Object value) {
        Set<String> codes = new TreeSet<>();
        for (String code : ParameterReader.strings(parameter, value)) {
            String normalized = code.toUpperCase(Locale.ROOT);
            if (!ISO_COUNTRIES.contains(normalized)) {
                throw new ValidationException(parameter.getWireName(),
                        "'" + code + "' is not an ISO 3166 alpha-2 country code");
            }
            codes.add(normalized);
        }
        return codes;
    }

    /**
     * Free-text brand terms, trimmed, in caller order, without case-insensitive repeats.
     */
    private List<String> brandTerms(FilterParameter parameter, Object value) {
        List<String> terms = new ArrayList<>();
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String term : ParameterReader.strings(parameter, value)) {
            if (seen.add(term)) {
                terms.add(term);
            }
        }
        return terms;
    }

    private Set<LinkChannel> channelsOfType(FilterParameter parameter, Object value, LinkType type) {
        Set<LinkChannel> channels = ParameterReader.enumSet(parameter, LinkChannel.class, value);
        for (LinkChannel channel : channels) {
            if (channel.getLinkType() != type) {
                throw new ValidationException(parameter.getWireName(),
                        "'" + channel.getWireValue() + "' is not a " + type.getWireValue() + " channel");
            }
        }
        return channels;
    }

    private void checkComparisonCardinality(OperationDescriptor descriptor, FilterSpecification spec) {
        FilterParameter parameter = descriptor.getComparisonParameter();
        if (parameter == null) {
            return;
        }
        int size = parameter == FilterParameter.COUNTRIES ? spec.getCountries().size() : spec.getBrands().size();
        if (size < descriptor.getMinComparisonCardinality()) {
            throw new ValidationException(parameter.getWireName(), String.format(
                    "%s compares at least %d distinct entries but got %d",
                    descriptor.getId().getWireName(), descriptor.getMinComparisonCardinality(), size));
        }
    }

    private void checkFollowerRange(FilterSpecification spec) {
        if (spec.getFollowerMin() != null && spec.getFollowerMax() != null
                && spec.getFollowerMin() > spec.getFollowerMax()) {
            throw new ValidationException(FilterParameter.FOLLOWER_MIN.getWireName(),
                    "must not exceed follower_max");
        }
    }

    private int clampWindow(OperationDescriptor descriptor, Integer requested) {
        if (!descriptor.isWindowed()) {
            return 0;
        }
        int days = requested != null ? requested : descriptor.getWindowDefault();
        int clamped = Math.max(descriptor.getWindowMin(), Math.min(descriptor.getWindowMax(), days));
        if (clamped != days) {
            log.debug("Window of {} days for {} clamped to {}", days, descriptor.getId().getWireName(), clamped);
        }
        return clamped;
    }

    private int clampLimit(OperationDescriptor descriptor, Long requested) {
        long limit = requested != null ? requested : descriptor.getLimitDefault();
        int clamped = (int) Math.max(1, Math.min(descriptor.getLimitMax(), limit));
        if (clamped != limit) {
            log.debug("Limit of {} for {} clamped to {}", limit, descriptor.getId().getWireName(), clamped);
        }
        return clamped;
    }

    private static long nonNegative(FilterParameter parameter, long value) {
        if (value < 0) {
            throw new ValidationException(parameter.getWireName(), "must not be negative");
        }
        return value;
    }

    private static int toInt(long value) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
