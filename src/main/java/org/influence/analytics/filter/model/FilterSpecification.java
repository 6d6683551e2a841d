package org.influence.analytics.filter.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Canonical, validated constraints for one operation invocation.
 * <p>
 * Set-valued fields are never "match nothing": an empty set means the filter is absent
 * and contributes no restriction. Enumeration sets iterate in declaration order and
 * country codes in lexical order, so two specifications built from the same values in a
 * different order are equal and compile to the same plan.
 */
public final class FilterSpecification {

    private final Set<String> countries;
    private final Set<Gender> genders;
    private final Set<AgeRange> ageRanges;
    private final Set<EthnicCategory> ethnicCategories;
    private final Set<InterestCategory> interests;
    private final Set<CollaborationTier> collaborationTiers;
    private final Long followerMin;
    private final Long followerMax;
    private final Boolean kCulture;

    private final Set<SkinType> skinTypes;
    private final Set<SkinConcern> skinConcerns;
    private final Set<PersonalColor> personalColors;
    private final Set<BrandTier> brandTiers;
    private final Set<BeautyInterestArea> beautyInterestAreas;
    private final Set<BeautyContentType> beautyContentTypes;

    private final Set<Lifestage> lifestages;
    private final String brandName;
    private final List<String> brands;
    private final List<String> excludedBrands;
    private final List<DemographicDimension> groupBy;
    private final ContentType contentType;
    private final BeautyCategory beautyCategory;
    private final LinkType linkType;
    private final Set<LinkChannel> channels;

    private final Double minGrowthRate;
    private final Long minCurrentCount;
    private final Long viralThreshold;

    private final int windowDays;
    private final int limit;
    private final boolean needsSpecializedJoin;

    private FilterSpecification(Builder builder) {
        this.countries = Collections.unmodifiableSet(new TreeSet<>(builder.countries));
        this.genders = freeze(builder.genders);
        this.ageRanges = freeze(builder.ageRanges);
        this.ethnicCategories = freeze(builder.ethnicCategories);
        this.interests = freeze(builder.interests);
        this.collaborationTiers = freeze(builder.collaborationTiers);
        this.followerMin = builder.followerMin;
        this.followerMax = builder.followerMax;
        this.kCulture = builder.kCulture;
        this.skinTypes = freeze(builder.skinTypes);
        this.skinConcerns = freeze(builder.skinConcerns);
        this.personalColors = freeze(builder.personalColors);
        this.brandTiers = freeze(builder.brandTiers);
        this.beautyInterestAreas = freeze(builder.beautyInterestAreas);
        this.beautyContentTypes = freeze(builder.beautyContentTypes);
        this.lifestages = freeze(builder.lifestages);
        this.brandName = builder.brandName;
        this.brands = List.copyOf(builder.brands);
        this.excludedBrands = List.copyOf(builder.excludedBrands);
        this.groupBy = List.copyOf(builder.groupBy);
        this.contentType = builder.contentType != null ? builder.contentType : ContentType.ALL;
        this.beautyCategory = builder.beautyCategory;
        this.linkType = builder.linkType != null ? builder.linkType : LinkType.ALL;
        this.channels = freeze(builder.channels);
        this.minGrowthRate = builder.minGrowthRate;
        this.minCurrentCount = builder.minCurrentCount;
        this.viralThreshold = builder.viralThreshold;
        this.windowDays = builder.windowDays;
        this.limit = builder.limit;
        this.needsSpecializedJoin = !skinTypes.isEmpty()
                || !skinConcerns.isEmpty()
                || !personalColors.isEmpty()
                || !brandTiers.isEmpty()
                || !beautyInterestAreas.isEmpty()
                || !beautyContentTypes.isEmpty();
    }

    private static <E extends Enum<E>> Set<E> freeze(Collection<E> values) {
        if (values.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getCountries() {
        return countries;
    }

    public Set<Gender> getGenders() {
        return genders;
    }

    public Set<AgeRange> getAgeRanges() {
        return ageRanges;
    }

    public Set<EthnicCategory> getEthnicCategories() {
        return ethnicCategories;
    }

    public Set<InterestCategory> getInterests() {
        return interests;
    }

    public Set<CollaborationTier> getCollaborationTiers() {
        return collaborationTiers;
    }

    public Long getFollowerMin() {
        return followerMin;
    }

    public Long getFollowerMax() {
        return followerMax;
    }

    public Boolean getKCulture() {
        return kCulture;
    }

    public Set<SkinType> getSkinTypes() {
        return skinTypes;
    }

    public Set<SkinConcern> getSkinConcerns() {
        return skinConcerns;
    }

    public Set<PersonalColor> getPersonalColors() {
        return personalColors;
    }

    public Set<BrandTier> getBrandTiers() {
        return brandTiers;
    }

    public Set<BeautyInterestArea> getBeautyInterestAreas() {
        return beautyInterestAreas;
    }

    public Set<BeautyContentType> getBeautyContentTypes() {
        return beautyContentTypes;
    }

    public Set<Lifestage> getLifestages() {
        return lifestages;
    }

    public String getBrandName() {
        return brandName;
    }

    /**
     * Brand terms compared or searched for, in the order the caller listed them.
     */
    public List<String> getBrands() {
        return brands;
    }

    public List<String> getExcludedBrands() {
        return excludedBrands;
    }

    public List<DemographicDimension> getGroupBy() {
        return groupBy;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public BeautyCategory getBeautyCategory() {
        return beautyCategory;
    }

    public LinkType getLinkType() {
        return linkType;
    }

    public Set<LinkChannel> getChannels() {
        return channels;
    }

    public Double getMinGrowthRate() {
        return minGrowthRate;
    }

    public Long getMinCurrentCount() {
        return minCurrentCount;
    }

    public Long getViralThreshold() {
        return viralThreshold;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * True when any beauty attribute filter is present, which requires the beauty profile table.
     */
    public boolean needsSpecializedJoin() {
        return needsSpecializedJoin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterSpecification)) {
            return false;
        }
        FilterSpecification that = (FilterSpecification) o;
        return windowDays == that.windowDays
                && limit == that.limit
                && countries.equals(that.countries)
                && genders.equals(that.genders)
                && ageRanges.equals(that.ageRanges)
                && ethnicCategories.equals(that.ethnicCategories)
                && interests.equals(that.interests)
                && collaborationTiers.equals(that.collaborationTiers)
                && Objects.equals(followerMin, that.followerMin)
                && Objects.equals(followerMax, that.followerMax)
                && Objects.equals(kCulture, that.kCulture)
                && skinTypes.equals(that.skinTypes)
                && skinConcerns.equals(that.skinConcerns)
                && personalColors.equals(that.personalColors)
                && brandTiers.equals(that.brandTiers)
                && beautyInterestAreas.equals(that.beautyInterestAreas)
                && beautyContentTypes.equals(that.beautyContentTypes)
                && lifestages.equals(that.lifestages)
                && Objects.equals(brandName, that.brandName)
                && brands.equals(that.brands)
                && excludedBrands.equals(that.excludedBrands)
                && groupBy.equals(that.groupBy)
                && contentType == that.contentType
                && beautyCategory == that.beautyCategory
                && linkType == that.linkType
                && channels.equals(that.channels)
                && Objects.equals(minGrowthRate, that.minGrowthRate)
                && Objects.equals(minCurrentCount, that.minCurrentCount)
                && Objects.equals(viralThreshold, that.viralThreshold);
    }

    @Override
    public int hashCode() {
        return Objects.hash(countries, genders, ageRanges, ethnicCategories, interests, collaborationTiers,
                followerMin, followerMax, kCulture, skinTypes, skinConcerns, personalColors, brandTiers,
                beautyInterestAreas, beautyContentTypes, lifestages, brandName, brands, excludedBrands, groupBy,
                contentType, beautyCategory, linkType, channels, minGrowthRate, minCurrentCount, viralThreshold,
                windowDays, limit);
    }

    public static final class Builder {
        private final Set<String> countries = new TreeSet<>();
        private final Set<Gender> genders = EnumSet.noneOf(Gender.class);
        private final Set<AgeRange> ageRanges = EnumSet.noneOf(AgeRange.class);
        private final Set<EthnicCategory> ethnicCategories = EnumSet.noneOf(EthnicCategory.class);
        private final Set<InterestCategory> interests = EnumSet.noneOf(InterestCategory.class);
        private final Set<CollaborationTier> collaborationTiers = EnumSet.noneOf(CollaborationTier.class);
        private Long followerMin;
        private Long followerMax;
        private Boolean kCulture;
        private final Set<SkinType> skinTypes = EnumSet.noneOf(SkinType.class);
        private final Set<SkinConcern> skinConcerns = EnumSet.noneOf(SkinConcern.class);
        private final Set<PersonalColor> personalColors = EnumSet.noneOf(PersonalColor.class);
        private final Set<BrandTier> brandTiers = EnumSet.noneOf(BrandTier.class);
        private final Set<BeautyInterestArea> beautyInterestAreas = EnumSet.noneOf(BeautyInterestArea.class);
        private final Set<BeautyContentType> beautyContentTypes = EnumSet.noneOf(BeautyContentType.class);
        private final Set<Lifestage> lifestages = EnumSet.noneOf(Lifestage.class);
        private String brandName;
        private final List<String> brands = new ArrayList<>();
        private final List<String> excludedBrands = new ArrayList<>();
        private final List<DemographicDimension> groupBy = new ArrayList<>();
        private ContentType contentType;
        private BeautyCategory beautyCategory;
        private LinkType linkType;
        private final Set<LinkChannel> channels = EnumSet.noneOf(LinkChannel.class);
        private Double minGrowthRate;
        private Long minCurrentCount;
        private Long viralThreshold;
        private int windowDays;
        private int limit;

        private Builder() {
        }

        public Builder countries(Collection<String> values) {
            countries.addAll(values);
            return this;
        }

        public Builder genders(Collection<Gender> values) {
            genders.addAll(values);
            return this;
        }

        public Builder ageRanges(Collection<AgeRange> values) {
            ageRanges.addAll(values);
            return this;
        }

        public Builder ethnicCategories(Collection<EthnicCategory> values) {
            ethnicCategories.addAll(values);
            return this;
        }

        public Builder interests(Collection<InterestCategory> values) {
            interests.addAll(values);
            return this;
        }

        public Builder collaborationTiers(Collection<CollaborationTier> values) {
            collaborationTiers.addAll(values);
            return this;
        }

        public Builder followerMin(Long value) {
            this.followerMin = value;
            return this;
        }

        public Builder followerMax(Long value) {
            this.followerMax = value;
            return this;
        }

        public Builder kCulture(Boolean value) {
            this.kCulture = value;
            return this;
        }

        public Builder skinTypes(Collection<SkinType> values) {
            skinTypes.addAll(values);
            return this;
        }

        public Builder skinConcerns(Collection<SkinConcern> values) {
            skinConcerns.addAll(values);
            return this;
        }

        public Builder personalColors(Collection<PersonalColor> values) {
            personalColors.addAll(values);
            return this;
        }

        public Builder brandTiers(Collection<BrandTier> values) {
            brandTiers.addAll(values);
            return this;
        }

        public Builder beautyInterestAreas(Collection<BeautyInterestArea> values) {
            beautyInterestAreas.addAll(values);
            return this;
        }

        public Builder beautyContentTypes(Collection<BeautyContentType> values) {
            beautyContentTypes.addAll(values);
            return this;
        }

        public Builder lifestages(Collection<Lifestage> values) {
            lifestages.addAll(values);
            return this;
        }

        public Builder brandName(String value) {
            this.brandName = value;
            return this;
        }

        public Builder brands(Collection<String> values) {
            brands.addAll(values);
            return this;
        }

        public Builder excludedBrands(Collection<String> values) {
            excludedBrands.addAll(values);
            return this;
        }

        public Builder groupBy(Collection<DemographicDimension> values) {
            groupBy.addAll(values);
            return this;
        }

        public Builder contentType(ContentType value) {
            this.contentType = value;
            return this;
        }

        public Builder beautyCategory(BeautyCategory value) {
            this.beautyCategory = value;
            return this;
        }

        public Builder linkType(LinkType value) {
            this.linkType = value;
            return this;
        }

        public Builder channels(Collection<LinkChannel> values) {
            channels.addAll(values);
            return this;
        }

        public Builder minGrowthRate(Double value) {
            this.minGrowthRate = value;
            return this;
        }

        public Builder minCurrentCount(Long value) {
            this.minCurrentCount = value;
            return this;
        }

        public Builder viralThreshold(Long value) {
            this.viralThreshold = value;
            return this;
        }

        public Builder windowDays(int value) {
            this.windowDays = value;
            return this;
        }

        public Builder limit(int value) {
            this.limit = value;
            return this;
        }

        public boolean hasGroupBy() {
            return !groupBy.isEmpty();
        }

        public FilterSpecification build() {
            return new FilterSpecification(this);
        }
    }
}
