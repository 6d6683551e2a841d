package org.influence.analytics.query.strategy;

import org.influence.analytics.engine.exception.WarehouseExecutionException;
import org.influence.analytics.query.model.RenderedQuery;
import org.influence.analytics.query.model.WarehouseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@Testcontainers(disabledWithoutDocker = true)
class JdbcWarehouseClientIntegrationTest {

    @Container
    private static final GenericContainer<?> CLICKHOUSE =
            new GenericContainer<>(DockerImageName.parse("clickhouse/clickhouse-server:23.8"))
                    .withExposedPorts(8123)
                    .waitingFor(Wait.forHttp("/ping").forPort(8123));

    private JdbcWarehouseClient client;

    @BeforeEach
    void setUp() {
        client = new JdbcWarehouseClient();
        ReflectionTestUtils.setField(client, "url",
                "jdbc:clickhouse://" + CLICKHOUSE.getHost() + ":" + CLICKHOUSE.getMappedPort(8123) + "/default");
        ReflectionTestUtils.setField(client, "user", "default");
        ReflectionTestUtils.setField(client, "password", "");
        ReflectionTestUtils.setField(client, "queryTimeoutSeconds", 30);
    }

    @Test
    void bindsParametersAndReadsArraysAsLists() {
        // Arrange
        RenderedQuery query = new RenderedQuery("primary",
                "SELECT toInt32(number) AS n, [toInt32(number), toInt32(number) * 2] AS pair\n"
                        + "FROM numbers(10)\n"
                        + "WHERE number >= ? AND toDate('2024-06-01') >= ?\n"
                        + "ORDER BY n\n"
                        + "LIMIT 3",
                List.of(2L, LocalDate.of(2024, 5, 1)));

        // Act
        WarehouseResult result = client.execute(query);

        // Assert
        assertThat(result.getColumns()).containsExactly("n", "pair");
        assertThat(result.getRows().stream().map(row -> ((Number) row.get("n")).intValue())
                .collect(Collectors.toList())).containsExactly(2, 3, 4);
        Object pair = result.getRows().get(0).get("pair");
        assertThat(pair).isInstanceOf(List.class);
        assertThat(((List<?>) pair).stream().map(v -> ((Number) v).intValue()).collect(Collectors.toList()))
                .containsExactly(2, 4);
        assertThat(result.getBytesScanned()).isEqualTo(WarehouseResult.BYTES_UNKNOWN);
    }

    @Test
    void rejectedQueryIsAnExecutionErrorNamingThePlan() {
        // Arrange
        RenderedQuery query = new RenderedQuery("totals", "SELECT missing_column FROM numbers(1) LIMIT 1", List.of());

        // Act
        WarehouseExecutionException e = catchThrowableOfType(() -> client.execute(query),
                WarehouseExecutionException.class);

        // Assert
        assertThat(e.getPlanLabel()).isEqualTo("totals");
        assertThat(e.getCause()).isNotNull();
    }

    @Test
    void cancellingAFinishedQueryIsANoOp() {
        // Arrange
        RenderedQuery query = new RenderedQuery("primary", "SELECT 1 AS one", List.of());
        Map<String, Object> row = client.execute(query).getRows().get(0);

        // Act
        client.cancel(query);

        // Assert
        assertThat(((Number) row.get("one")).intValue()).isEqualTo(1);
    }
}
