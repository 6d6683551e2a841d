package org.influence.analytics.query.service;

import org.influence.analytics.query.model.ContentBranch;
import org.influence.analytics.query.model.ContentColumn;
import org.influence.analytics.query.model.ContentSource;
import org.influence.analytics.query.model.Join;
import org.influence.analytics.query.model.JoinType;
import org.influence.analytics.query.model.OperationId;
import org.influence.analytics.query.model.PlanRole;
import org.influence.analytics.query.model.QueryPlan;
import org.influence.analytics.query.model.RenderedQuery;
import org.influence.analytics.query.model.WarehouseTable;
import org.influence.analytics.query.model.predicate.ArrayContainsAny;
import org.influence.analytics.query.model.predicate.Comparison;
import org.influence.analytics.query.model.predicate.InList;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SqlRendererTest {

    private final SqlRenderer renderer = new SqlRenderer();

    @Test
    void rendersProfilePlanWithJoinsAndBoundParameters() {
        // Arrange
        QueryPlan plan = QueryPlan.builder(OperationId.SEARCH_INFLUENCERS, PlanRole.PRIMARY)
                .baseTable(WarehouseTable.GENERAL_PROFILES)
                .join(new Join(WarehouseTable.PROFILE_METRICS, JoinType.INNER))
                .filterPredicate(new ArrayContainsAny("g.country", List.of("JP", "KR")))
                .filterPredicate(new InList("g.gender", List.of("Female")))
                .filterPredicate(new Comparison("p.followed_by", Comparison.Operator.GE, 10000L))
                .select("g.user_id AS user_id")
                .select("p.followed_by AS follower_count")
                .orderBy("follower_count DESC", "user_id ASC")
                .limit(50)
                .build();

        // Act
        RenderedQuery query = renderer.render(plan);

        // Assert
        assertThat(query.getLabel()).isEqualTo("primary");
        assertThat(query.getSql()).isEqualTo(
                "SELECT g.user_id AS user_id, p.followed_by AS follower_count\n"
                        + "FROM gpt_profile.insta_general_profiles AS g\n"
                        + "INNER JOIN sns.insta_profile_mmm_v3 AS p ON p.user_id = g.user_id\n"
                        + "WHERE (has(g.country, ?) OR has(g.country, ?))\n"
                        + "  AND g.gender IN (?)\n"
                        + "  AND p.followed_by >= ?\n"
                        + "ORDER BY follower_count DESC, user_id ASC\n"
                        + "LIMIT 50");
        assertThat(query.getParams()).containsExactly("JP", "KR", "Female", 10000L);
    }

    @Test
    void rendersContentUnionWithPartitionBoundAndOneRowPerMediaOnEveryBranch() {
        // Arrange
        LocalDate from = LocalDate.of(2024, 5, 2);
        ContentSource content = new ContentSource(List.of(
                new ContentBranch(WarehouseTable.FEED_MEDIA, from, null),
                new ContentBranch(WarehouseTable.REELS, from, null)),
                List.of(ContentColumn.USER_ID, ContentColumn.HASHTAGS), false);
        QueryPlan plan = QueryPlan.builder(OperationId.ANALYZE_HASHTAG_TRENDS, PlanRole.PRIMARY)
                .baseTable(WarehouseTable.GENERAL_PROFILES)
                .content(content)
                .partitionLowerBound(from)
                .select("lower(arrayJoin(c.hashtags)) AS hashtag")
                .select("count() AS usage_count")
                .groupBy("hashtag")
                .limit(10)
                .build();

        // Act
        RenderedQuery query = renderer.render(plan);

        // Assert
        assertThat(query.getSql())
                .contains("SELECT m.media_id AS media_id, m.user_id AS user_id, m.hashtags AS hashtags\n"
                        + "    FROM sns.insta_media_mmm_v3 AS m\n"
                        + "    WHERE m.publish_date >= ?\n"
                        + "    LIMIT 1 BY media_id")
                .contains("UNION ALL")
                .contains("FROM sns.insta_reels_mmm_v3 AS r\n    WHERE r.upload_date >= ?\n    LIMIT 1 BY media_id")
                .contains(") AS c\nINNER JOIN (")
                .contains(") AS t ON t.user_id = c.user_id")
                .contains("GROUP BY hashtag");
        assertThat(query.getParams()).containsExactly(from, from);
    }

    @Test
    void keyRestrictionEmbedsTheSourcePlanAfterItsOwnHaving() {
        // Arrange
        QueryPlan source = QueryPlan.builder(OperationId.ANALYZE_BEAUTY_INGREDIENT_TRENDS, PlanRole.CURRENT_WINDOW)
                .baseTable(WarehouseTable.GENERAL_PROFILES)
                .select("g.user_id AS ingredient")
                .groupBy("ingredient")
                .having(new Comparison("count()", Comparison.Operator.GE, 3L))
                .limit(100)
                .build();
        QueryPlan plan = QueryPlan.builder(OperationId.ANALYZE_BEAUTY_INGREDIENT_TRENDS, PlanRole.PREVIOUS_WINDOW)
                .baseTable(WarehouseTable.GENERAL_PROFILES)
                .select("g.user_id AS ingredient")
                .groupBy("ingredient")
                .having(new Comparison("count()", Comparison.Operator.GE, 1L))
                .keysFrom("ingredient", source)
                .limit(100)
                .build();

        // Act
        RenderedQuery query = renderer.render(plan);

        // Assert
        assertThat(query.getSql()).isEqualTo(
                "SELECT g.user_id AS ingredient\n"
                        + "FROM gpt_profile.insta_general_profiles AS g\n"
                        + "GROUP BY ingredient\n"
                        + "HAVING count() >= ? AND ingredient IN (SELECT ingredient FROM (\n"
                        + "SELECT g.user_id AS ingredient\n"
                        + "FROM gpt_profile.insta_general_profiles AS g\n"
                        + "GROUP BY ingredient\n"
                        + "HAVING count() >= ?\n"
                        + "LIMIT 100\n"
                        + "))\n"
                        + "LIMIT 100");
        assertThat(query.getParams()).containsExactly(1L, 3L);
    }

    @Test
    void renderingTheSamePlanTwiceIsIdentical() {
        // Arrange
        QueryPlan plan = QueryPlan.builder(OperationId.FIND_K_CULTURE_INFLUENCERS, PlanRole.PRIMARY)
                .baseTable(WarehouseTable.GENERAL_PROFILES)
                .shapePredicate(new Comparison("g.k_interest", Comparison.Operator.EQ, true))
                .select("g.user_id AS user_id")
                .limit(5)
                .build();

        // Act / Assert
        assertThat(renderer.render(plan)).isEqualTo(renderer.render(plan));
    }
}
