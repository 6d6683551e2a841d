package org.influence.analytics.filter.service;

import org.influence.analytics.engine.exception.ValidationException;
import org.influence.analytics.filter.model.ContentType;
import org.influence.analytics.filter.model.DemographicDimension;
import org.influence.analytics.filter.model.FilterSpecification;
import org.influence.analytics.filter.model.Gender;
import org.influence.analytics.filter.model.LinkChannel;
import org.influence.analytics.filter.model.SkinType;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.catalog.OperationDescriptor;
import org.influence.analytics.query.model.OperationId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class FilterNormalizerTest {

    private final OperationCatalog catalog = new OperationCatalog();
    private final FilterNormalizer normalizer = new FilterNormalizer();

    private FilterSpecification normalize(OperationId id, Map<String, Object> raw) {
        return normalizer.normalize(catalog.get(id), raw);
    }

    @Test
    void appliesDescriptorDefaultsWhenNothingIsGiven() {
        // Act
        FilterSpecification spec = normalize(OperationId.ANALYZE_HASHTAG_TRENDS, null);

        // Assert
        assertThat(spec.getWindowDays()).isEqualTo(30);
        assertThat(spec.getLimit()).isEqualTo(50);
        assertThat(spec.getContentType()).isEqualTo(ContentType.ALL);
        assertThat(spec.getCountries()).isEmpty();
        assertThat(spec.needsSpecializedJoin()).isFalse();
    }

    @Test
    void canonicalizesCountriesAndEnumValues() {
        // Arrange
        Map<String, Object> raw = new HashMap<>();
        raw.put("country", List.of("kr", "JP", "KR"));
        raw.put("gender", "female");

        // Act
        FilterSpecification spec = normalize(OperationId.SEARCH_INFLUENCERS, raw);

        // Assert
        assertThat(spec.getCountries()).containsExactly("JP", "KR");
        assertThat(spec.getGenders()).containsExactly(Gender.FEMALE);
    }

    @Test
    void equivalentInputsNormalizeToEqualSpecifications() {
        // Act
        FilterSpecification first = normalize(OperationId.SEARCH_INFLUENCERS,
                Map.of("country", List.of("KR", "JP"), "skin_type", List.of("Oily", "Dry")));
        FilterSpecification second = normalize(OperationId.SEARCH_INFLUENCERS,
                Map.of("country", List.of("jp", "kr"), "skin_type", List.of("dry", "oily")));

        // Assert
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    void beautySubFilterAloneSetsSpecializedJoin() {
        // Act
        FilterSpecification spec = normalize(OperationId.SEARCH_INFLUENCERS, Map.of("skin_type", List.of("Oily")));

        // Assert
        assertThat(spec.getSkinTypes()).containsExactly(SkinType.OILY);
        assertThat(spec.needsSpecializedJoin()).isTrue();
    }

    @Test
    void emptyListIsTheSameAsAbsent() {
        // Act
        FilterSpecification spec = normalize(OperationId.SEARCH_INFLUENCERS, Map.of("skin_type", List.of()));

        // Assert
        assertThat(spec.needsSpecializedJoin()).isFalse();
        assertThat(spec).isEqualTo(normalize(OperationId.SEARCH_INFLUENCERS, Map.of()));
    }

    @Test
    void clampsWindowToTheAbsoluteCeiling() {
        // Act
        FilterSpecification spec = normalize(OperationId.ANALYZE_HASHTAG_TRENDS, Map.of("period_days", 400));

        // Assert
        assertThat(spec.getWindowDays()).isEqualTo(OperationCatalog.MAX_WINDOW_DAYS);
    }

    @Test
    void clampsComparisonWindowToHalfTheCeiling() {
        // Act
        FilterSpecification spec = normalize(OperationId.DETECT_EMERGING_HASHTAGS, Map.of("period_days", 300));

        // Assert
        assertThat(spec.getWindowDays()).isEqualTo(OperationCatalog.MAX_COMPARISON_WINDOW_DAYS);
    }

    @Test
    void comparePeriodSelectsTheWindow() {
        // Act
        FilterSpecification spec = normalize(OperationId.DETECT_EMERGING_HASHTAGS, Map.of("compare_period", "2weeks"));

        // Assert
        assertThat(spec.getWindowDays()).isEqualTo(14);
        assertThat(spec.getMinGrowthRate()).isEqualTo(1.5);
        assertThat(spec.getMinCurrentCount()).isEqualTo(10L);
    }

    @Test
    void clampsLimitToTheOperationMaximum() {
        // Act
        FilterSpecification spec = normalize(OperationId.SEARCH_INFLUENCERS, Map.of("limit", 10000));

        // Assert
        assertThat(spec.getLimit()).isEqualTo(500);
    }

    @Test
    void zeroOrNegativeLimitClampsToOne() {
        // Act
        FilterSpecification zero = normalize(OperationId.SEARCH_INFLUENCERS, Map.of("limit", 0));
        FilterSpecification negative = normalize(OperationId.SEARCH_INFLUENCERS, Map.of("limit", -5));

        // Assert
        assertThat(zero.getLimit()).isEqualTo(1);
        assertThat(negative.getLimit()).isEqualTo(1);
    }

    @Test
    void nonWindowedOperationHasNoWindow() {
        // Act
        FilterSpecification spec = normalize(OperationId.SEARCH_INFLUENCERS, Map.of());

        // Assert
        assertThat(spec.getWindowDays()).isZero();
    }

    @Test
    void rejectsUnknownEnumValueNamingTheParameter() {
        // Act
        ValidationException e = catchThrowableOfType(
                () -> normalize(OperationId.SEARCH_INFLUENCERS, Map.of("skin_type", List.of("Scaly"))),
                ValidationException.class);

        // Assert
        assertThat(e.getParameter()).isEqualTo("skin_type");
        assertThat(e.getMessage()).contains("Scaly").contains("Oily");
    }

    @Test
    void rejectsNullEntryInsideAListNamingTheParameter() {
        // Arrange
        List<Object> countries = new ArrayList<>();
        countries.add("KR");
        countries.add(null);

        // Act
        ValidationException e = catchThrowableOfType(
                () -> normalize(OperationId.SEARCH_INFLUENCERS, Map.of("country", countries)),
                ValidationException.class);

        // Assert
        assertThat(e.getParameter()).isEqualTo("country");
        assertThat(e.getMessage()).contains("must not contain null");
    }

    @Test
    void rejectsNullEntryInsideAnEnumList() {
        // Arrange
        List<Object> skinTypes = new ArrayList<>();
        skinTypes.add(null);

        // Act / Assert
        assertThatThrownBy(() -> normalize(OperationId.SEARCH_INFLUENCERS, Map.of("skin_type", skinTypes)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("skin_type");
    }

    @Test
    void comparedCountriesFollowCountryCodeOrder() {
        // Act
        FilterSpecification spec = normalize(OperationId.COMPARE_REGIONAL_HASHTAGS,
                Map.of("countries", List.of("us", "KR", "JP")));

        // Assert
        assertThat(spec.getCountries()).containsExactly("JP", "KR", "US");
    }

    @Test
    void rejectsParameterTheOperationDoesNotAccept() {
        assertThatThrownBy(() -> normalize(OperationId.ANALYZE_MARKET_DEMOGRAPHICS,
                Map.of("country", "KR", "skin_type", "Oily")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("skin_type");
    }

    @Test
    void rejectsMissingRequiredParameter() {
        // Act
        ValidationException e = catchThrowableOfType(
                () -> normalize(OperationId.SEARCH_BY_BRAND_COLLABORATION, Map.of()),
                ValidationException.class);

        // Assert
        assertThat(e.getParameter()).isEqualTo("brand_name");
    }

    @Test
    void rejectsInvalidCountryCode() {
        assertThatThrownBy(() -> normalize(OperationId.SEARCH_INFLUENCERS, Map.of("country", "XX")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("XX");
    }

    @Test
    void rejectsInvertedFollowerRange() {
        assertThatThrownBy(() -> normalize(OperationId.SEARCH_INFLUENCERS,
                Map.of("follower_min", 50000, "follower_max", 1000)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("follower_min");
    }

    @Test
    void rejectsTooFewComparisonEntities() {
        // Act
        ValidationException e = catchThrowableOfType(
                () -> normalize(OperationId.COMPARE_REGIONAL_HASHTAGS, Map.of("countries", List.of("KR", "kr"))),
                ValidationException.class);

        // Assert
        assertThat(e.getParameter()).isEqualTo("countries");
    }

    @Test
    void rejectsNonNumericLimit() {
        assertThatThrownBy(() -> normalize(OperationId.SEARCH_INFLUENCERS, Map.of("limit", "many")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("limit");
    }

    @Test
    void rejectsShoppingChannelOutsideItsCategory() {
        assertThatThrownBy(() -> normalize(OperationId.FIND_INFLUENCERS_WITH_SHOPPING_LINKS,
                Map.of("shopping_channels", List.of("youtube"))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("shopping_channels");
    }

    @Test
    void keepsGroupByOrderAndDropsRepeats() {
        // Act
        FilterSpecification spec = normalize(OperationId.ANALYZE_MARKET_DEMOGRAPHICS,
                Map.of("country", "KR", "group_by", List.of("age_range", "gender", "age_range")));

        // Assert
        assertThat(spec.getGroupBy()).containsExactly(DemographicDimension.AGE_RANGE, DemographicDimension.GENDER);
    }

    @Test
    void readsRequiredChannels() {
        // Arrange
        OperationDescriptor descriptor = catalog.get(OperationId.SEARCH_MULTIPLATFORM_INFLUENCERS);

        // Act
        FilterSpecification spec = normalizer.normalize(descriptor,
                Map.of("required_channels", List.of("youtube", "tiktok")));

        // Assert
        assertThat(spec.getChannels()).containsExactlyInAnyOrder(LinkChannel.YOUTUBE, LinkChannel.TIKTOK);
    }
}
