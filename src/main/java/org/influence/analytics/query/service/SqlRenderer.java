package org.influence.analytics.query.service;

import org.influence.analytics.query.model.ContentBranch;
import org.influence.analytics.query.model.ContentColumn;
import org.influence.analytics.query.model.ContentSource;
import org.influence.analytics.query.model.Join;
import org.influence.analytics.query.model.QueryPlan;
import org.influence.analytics.query.model.RenderedQuery;
import org.influence.analytics.query.model.SqlFragment;
import org.influence.analytics.query.model.WarehouseTable;
import org.influence.analytics.query.model.predicate.Predicate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link QueryPlan} as ClickHouse SQL. Rendering is a pure function of the plan:
 * the same plan always yields the same text and parameter list.
 */
@Component
public class SqlRenderer {

    static final String CONTENT_ALIAS = "c";
    static final String PROFILE_ALIAS = "t";

    public RenderedQuery render(QueryPlan plan) {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();

        sql.append("SELECT ");
        appendList(plan.getSelect(), sql, params);

        if (!plan.hasContent()) {
            appendProfileFrom(plan, sql, params, "");
        } else if (plan.getContent().isProfileDriven()) {
            sql.append("\nFROM (\n");
            appendProfileSubquery(plan, sql, params);
            sql.append("\n) AS ").append(PROFILE_ALIAS).append("\nLEFT JOIN (\n");
            appendUnion(plan.getContent(), sql, params);
            sql.append("\n) AS ").append(CONTENT_ALIAS)
                    .append(" ON ").append(CONTENT_ALIAS).append(".user_id = ").append(PROFILE_ALIAS).append(".user_id");
            appendWhere(plan.getContentPredicates(), sql, params, "");
        } else {
            sql.append("\nFROM (\n");
            appendUnion(plan.getContent(), sql, params);
            sql.append("\n) AS ").append(CONTENT_ALIAS).append("\nINNER JOIN (\n");
            appendProfileSubquery(plan, sql, params);
            sql.append("\n) AS ").append(PROFILE_ALIAS)
                    .append(" ON ").append(PROFILE_ALIAS).append(".user_id = ").append(CONTENT_ALIAS).append(".user_id");
            appendWhere(plan.getContentPredicates(), sql, params, "");
        }

        if (!plan.getGroupBy().isEmpty()) {
            sql.append("\nGROUP BY ").append(String.join(", ", plan.getGroupBy()));
        }
        if (plan.getHaving() != null || plan.getKeySource() != null) {
            sql.append("\nHAVING ");
            if (plan.getHaving() != null) {
                plan.getHaving().render(sql, params);
            }
            if (plan.getKeySource() != null) {
                if (plan.getHaving() != null) {
                    sql.append(" AND ");
                }
                appendKeyRestriction(plan, sql, params);
            }
        }
        if (!plan.getOrderBy().isEmpty()) {
            sql.append("\nORDER BY ").append(String.join(", ", plan.getOrderBy()));
        }
        if (plan.getLimitPerGroup() != null) {
            sql.append("\nLIMIT ").append(plan.getLimitPerGroup()).append(" BY ").append(plan.getLimitPerGroupColumn());
        }
        sql.append("\nLIMIT ").append(plan.getLimit());

        return new RenderedQuery(plan.getRole().getLabel(), sql.toString(), params);
    }

    private void appendProfileSubquery(QueryPlan plan, StringBuilder sql, List<Object> params) {
        String indent = "    ";
        sql.append(indent).append("SELECT ").append(plan.getBaseTable().column("user_id")).append(" AS user_id");
        for (SqlFragment projection : plan.getProfileProjections()) {
            sql.append(", ");
            projection.appendTo(sql, params);
        }
        appendProfileFrom(plan, sql, params, indent);
    }

    private void appendProfileFrom(QueryPlan plan, StringBuilder sql, List<Object> params, String indent) {
        WarehouseTable base = plan.getBaseTable();
        sql.append('\n').append(indent).append("FROM ").append(base.getQualifiedName())
                .append(" AS ").append(base.getAlias());
        for (Join join : plan.getJoins()) {
            WarehouseTable table = join.getTable();
            sql.append('\n').append(indent).append(join.getType().getKeyword()).append(' ')
                    .append(table.getQualifiedName()).append(" AS ").append(table.getAlias())
                    .append(" ON ").append(table.column("user_id")).append(" = ").append(base.column("user_id"));
        }
        List<Predicate> predicates = new ArrayList<>(plan.getShapePredicates());
        predicates.addAll(plan.getFilterPredicates());
        appendWhere(predicates, sql, params, indent);
    }

    private void appendKeyRestriction(QueryPlan plan, StringBuilder sql, List<Object> params) {
        RenderedQuery source = render(plan.getKeySource());
        sql.append(plan.getKeyColumn()).append(" IN (SELECT ").append(plan.getKeyColumn()).append(" FROM (\n")
                .append(source.getSql()).append("\n))");
        params.addAll(source.getParams());
    }

    private void appendUnion(ContentSource content, StringBuilder sql, List<Object> params) {
        String indent = "    ";
        boolean first = true;
        for (ContentBranch branch : content.getBranches()) {
            if (!first) {
                sql.append('\n').append(indent).append("UNION ALL\n");
            }
            first = false;
            WarehouseTable table = branch.getTable();
            sql.append(indent).append("SELECT ");
            List<String> columns = new ArrayList<>();
            for (ContentColumn column : content.getColumns()) {
                columns.add(column.sourceExpression(table) + " AS " + column.getName());
            }
            sql.append(String.join(", ", columns));
            sql.append('\n').append(indent).append("FROM ").append(table.getQualifiedName())
                    .append(" AS ").append(table.getAlias());
            sql.append('\n').append(indent).append("WHERE ");
            branch.partitionPredicate().render(sql, params);
            sql.append('\n').append(indent).append("LIMIT 1 BY ").append(ContentColumn.MEDIA_ID.getName());
        }
    }

    private void appendWhere(List<Predicate> predicates, StringBuilder sql, List<Object> params, String indent) {
        if (predicates.isEmpty()) {
            return;
        }
        sql.append('\n').append(indent).append("WHERE ");
        for (int i = 0; i < predicates.size(); i++) {
            if (i > 0) {
                sql.append("\n").append(indent).append("  AND ");
            }
            predicates.get(i).render(sql, params);
        }
    }

    private void appendList(List<SqlFragment> fragments, StringBuilder sql, List<Object> params) {
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            fragments.get(i).appendTo(sql, params);
        }
    }
}
