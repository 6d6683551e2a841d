package org.influence.analytics.query.model;

/**
 * Warehouse tables known to the compiler, each with the alias used in generated SQL.
 * Content tables are partitioned by day on their own partition column.
 */
public enum WarehouseTable {
    GENERAL_PROFILES("gpt_profile.insta_general_profiles", "g", null),
    BEAUTY_PROFILES("gpt_profile.insta_beauty_profiles", "b", null),
    PROFILE_METRICS("sns.insta_profile_mmm_v3", "p", null),
    USER_LINKS("sns.insta_user_links_v3", "l", null),
    FEED_MEDIA("sns.insta_media_mmm_v3", "m", "publish_date"),
    REELS("sns.insta_reels_mmm_v3", "r", "upload_date");

    private final String qualifiedName;
    private final String alias;
    private final String partitionColumn;

    WarehouseTable(String qualifiedName, String alias, String partitionColumn) {
        this.qualifiedName = qualifiedName;
        this.alias = alias;
        this.partitionColumn = partitionColumn;
    }

    public String getQualifiedName() {
        return qualifiedName;
    }

    public String getAlias() {
        return alias;
    }

    public String getPartitionColumn() {
        return partitionColumn;
    }

    public boolean isPartitioned() {
        return partitionColumn != null;
    }

    public String column(String name) {
        return alias + "." + name;
    }
}
