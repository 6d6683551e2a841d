package org.influence.analytics.query.strategy;

import org.influence.analytics.engine.exception.WarehouseExecutionException;
import org.influence.analytics.query.model.RenderedQuery;
import org.influence.analytics.query.model.WarehouseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.sql.Array;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ClickHouse over JDBC. One connection per query; every parameter is bound with {@code setObject}.
 * The driver does not report scanned bytes, so results carry {@link WarehouseResult#BYTES_UNKNOWN}.
 */
@Service
@ConditionalOnProperty(name = "warehouse.client", havingValue = "jdbc", matchIfMissing = true)
public class JdbcWarehouseClient implements WarehouseClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcWarehouseClient.class);

    @Value("${warehouse.clickhouse.url:jdbc:clickhouse://localhost:8123/default}")
    private String url;

    @Value("${warehouse.clickhouse.user:default}")
    private String user;

    @Value("${warehouse.clickhouse.password:}")
    private String password;

    @Value("${warehouse.clickhouse.query-timeout-seconds:60}")
    private int queryTimeoutSeconds;

    private final Map<RenderedQuery, Statement> running = Collections.synchronizedMap(new IdentityHashMap<>());

    @Override
    public WarehouseResult execute(RenderedQuery query) {
        long started = System.currentTimeMillis();
        try (Connection conn = DriverManager.getConnection(url, user, password);
             PreparedStatement pstmt = conn.prepareStatement(query.getSql())) {

            pstmt.setQueryTimeout(queryTimeoutSeconds);
            running.put(query, pstmt);
            List<Object> params = query.getParams();
            for (int i = 0; i < params.size(); i++) {
                pstmt.setObject(i + 1, bindable(params.get(i)));
            }

            try (ResultSet rs = pstmt.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                int columnCount = meta.getColumnCount();
                List<String> columns = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    columns.add(meta.getColumnLabel(i));
                }
                List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        row.put(columns.get(i - 1), readable(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                log.debug("Query {} returned {} rows in {} ms", query.getLabel(), rows.size(),
                        System.currentTimeMillis() - started);
                return new WarehouseResult(columns, rows, WarehouseResult.BYTES_UNKNOWN);
            }
        } catch (SQLTimeoutException e) {
            throw new WarehouseExecutionException(query.getLabel(),
                    "timed out after " + queryTimeoutSeconds + "s", e);
        } catch (SQLException e) {
            throw new WarehouseExecutionException(query.getLabel(), e.getMessage(), e);
        } finally {
            running.remove(query);
        }
    }

    @Override
    public void cancel(RenderedQuery query) {
        Statement statement = running.remove(query);
        if (statement == null) {
            return;
        }
        try {
            statement.cancel();
            log.info("Cancelled query {}", query.getLabel());
        } catch (SQLException e) {
            log.warn("Could not cancel query {}: {}", query.getLabel(), e.getMessage());
        }
    }

    @Override
    public String getClientName() {
        return "clickhouse-jdbc";
    }

    private static Object bindable(Object value) {
        if (value instanceof LocalDate) {
            return java.sql.Date.valueOf((LocalDate) value);
        }
        return value;
    }

    /**
     * JDBC arrays become lists so rows can be serialized and aggregated without a live connection.
     */
    private static Object readable(Object value) throws SQLException {
        if (value instanceof Array) {
            Array array = (Array) value;
            try {
                return toList(array.getArray());
            } finally {
                array.free();
            }
        }
        if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
            return toList(value);
        }
        return value;
    }

    private static Object toList(Object array) throws SQLException {
        if (array instanceof Object[]) {
            List<Object> elements = new ArrayList<>();
            for (Object element : (Object[]) array) {
                elements.add(readable(element));
            }
            return elements;
        }
        if (array instanceof long[]) {
            return Arrays.stream((long[]) array).boxed().collect(Collectors.toList());
        }
        if (array instanceof int[]) {
            return Arrays.stream((int[]) array).boxed().collect(Collectors.toList());
        }
        if (array instanceof double[]) {
            return Arrays.stream((double[]) array).boxed().collect(Collectors.toList());
        }
        return array;
    }
}
