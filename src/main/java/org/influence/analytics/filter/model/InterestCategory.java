package org.influence.analytics.filter.model;

/**
 * Interest categories stored in the general profile's interests array.
 */
public enum InterestCategory implements WireValue {
    BEAUTY("Beauty"),
    FASHION("Fashion"),
    FOOD("Food"),
    TRAVEL("Travel"),
    FITNESS("Fitness"),
    HEALTH("Health"),
    PARENTING("Parenting"),
    LIFESTYLE("Lifestyle"),
    MUSIC("Music"),
    DANCE("Dance"),
    GAMING("Gaming"),
    TECHNOLOGY("Technology"),
    PHOTOGRAPHY("Photography"),
    ART("Art"),
    DESIGN("Design"),
    HOME_DECOR("Home Decor"),
    DIY("DIY"),
    PETS("Pets"),
    SPORTS("Sports"),
    OUTDOOR("Outdoor"),
    AUTOMOTIVE("Automotive"),
    FINANCE("Finance"),
    BUSINESS("Business"),
    EDUCATION("Education"),
    BOOKS("Books"),
    MOVIES("Movies"),
    TV("TV"),
    ENTERTAINMENT("Entertainment"),
    COMEDY("Comedy"),
    CELEBRITY("Celebrity"),
    K_POP("K-Pop"),
    ANIME("Anime"),
    LUXURY("Luxury"),
    WELLNESS("Wellness"),
    YOGA("Yoga"),
    COOKING("Cooking"),
    WINE_SPIRITS("Wine & Spirits"),
    COFFEE("Coffee"),
    WEDDING("Wedding"),
    FAMILY("Family"),
    RELATIONSHIPS("Relationships"),
    SUSTAINABILITY("Sustainability"),
    SCIENCE("Science"),
    POLITICS("Politics"),
    NEWS("News"),
    SPIRITUALITY("Spirituality");

    private final String wireValue;

    InterestCategory(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }
}
