package org.influence.analytics.filter.model;

/**
 * Outbound link channels found in an influencer's bio, grouped by link type.
 */
public enum LinkChannel implements WireValue {
    YOUTUBE("youtube", LinkType.SNS),
    TIKTOK("tiktok", LinkType.SNS),
    TWITTER("twitter", LinkType.SNS),
    FACEBOOK("facebook", LinkType.SNS),
    LINKEDIN("linkedin", LinkType.SNS),
    SNAPCHAT("snapchat", LinkType.SNS),
    TELEGRAM("telegram", LinkType.SNS),
    WHATSAPP("whatsapp", LinkType.SNS),
    AMAZON("amazon", LinkType.SHOPPING),
    SHOPLTK("shopltk", LinkType.SHOPPING),
    SEPHORA("sephora", LinkType.SHOPPING),
    SHOPEE("shopee", LinkType.SHOPPING),
    COUPANG("coupang", LinkType.SHOPPING),
    RAKUTEN("rakuten", LinkType.SHOPPING),
    EMAIL("email", LinkType.CONTACT),
    BLOG("blog", LinkType.CONTACT),
    KAKAOTALK("kakaotalk", LinkType.CONTACT);

    private final String wireValue;
    private final LinkType linkType;

    LinkChannel(String wireValue, LinkType linkType) {
        this.wireValue = wireValue;
        this.linkType = linkType;
    }

    @Override
    public String getWireValue() {
        return wireValue;
    }

    public LinkType getLinkType() {
        return linkType;
    }
}
