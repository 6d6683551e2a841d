package org.influence.analytics.query.model;

/**
 * Columns projected out of each content branch. Only the columns an operation names
 * are read, which keeps the columnar scan narrow.
 */
public enum ContentColumn {
    MEDIA_ID("media_id"),
    USER_ID("user_id"),
    LIKE_COUNT("like_count"),
    COMMENT_COUNT("comment_count"),
    HASHTAGS("hashtags"),
    CAPTION("caption"),
    PAID_PARTNERSHIP("is_paid_partnership"),
    PUBLISHED_AT("published_at"),
    CONTENT_FORMAT("content_format");

    private final String name;

    ContentColumn(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Source expression for this column in the given content table.
     */
    public String sourceExpression(WarehouseTable table) {
        switch (this) {
            case PUBLISHED_AT:
                return table.column(table.getPartitionColumn());
            case CONTENT_FORMAT:
                return table == WarehouseTable.REELS ? "'reels'" : "'feed'";
            default:
                return table.column(name);
        }
    }
}
