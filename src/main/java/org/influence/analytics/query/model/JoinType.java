package org.influence.analytics.query.model;

public enum JoinType {
    INNER("INNER JOIN"),
    LEFT("LEFT JOIN");

    private final String keyword;

    JoinType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
