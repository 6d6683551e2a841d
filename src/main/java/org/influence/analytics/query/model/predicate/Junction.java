package org.influence.analytics.query.model.predicate;

import java.util.List;

/**
 * AND or OR over child predicates, parenthesised when there is more than one.
 */
public final class Junction implements Predicate {

    private final String keyword;
    private final List<Predicate> children;

    private Junction(String keyword, List<Predicate> children) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("Empty " + keyword + " junction");
        }
        this.keyword = keyword;
        this.children = List.copyOf(children);
    }

    public static Junction allOf(List<Predicate> children) {
        return new Junction("AND", children);
    }

    public static Junction anyOf(List<Predicate> children) {
        return new Junction("OR", children);
    }

    public List<Predicate> getChildren() {
        return children;
    }

    @Override
    public void render(StringBuilder sql, List<Object> params) {
        if (children.size() == 1) {
            children.get(0).render(sql, params);
            return;
        }
        sql.append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sql.append(' ').append(keyword).append(' ');
            }
            children.get(i).render(sql, params);
        }
        sql.append(')');
    }
}
