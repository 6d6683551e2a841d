package org.influence.analytics.export.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.influence.analytics.engine.exception.ExportException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Serializes a result set as CSV: a header row, then one line per row in result order.
 * Array values are joined with {@code "; "}; nulls become empty fields.
 */
@Component
public class CsvExportWriter {

    static final String ELEMENT_SEPARATOR = "; ";

    private final CsvMapper csvMapper = new CsvMapper();

    public byte[] write(String logicalName, List<String> columns, List<Map<String, Object>> rows) {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String column : columns) {
            builder.addColumn(column);
        }
        CsvSchema schema = builder.build().withoutHeader();

        Map<String, String> header = new LinkedHashMap<>();
        for (String column : columns) {
            header.put(column, column);
        }
        List<Map<String, String>> lines = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, String> line = new LinkedHashMap<>();
            for (String column : columns) {
                line.put(column, field(row.get(column)));
            }
            lines.add(line);
        }

        try {
            String csv = csvMapper.writer(schema).writeValueAsString(header)
                    + csvMapper.writer(schema).writeValueAsString(lines);
            return csv.getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new ExportException(logicalName, "could not serialize CSV: " + e.getOriginalMessage(), e);
        }
    }

    static String field(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(CsvExportWriter::field)
                    .collect(Collectors.joining(ELEMENT_SEPARATOR));
        }
        if (value instanceof Object[]) {
            return field(Arrays.asList((Object[]) value));
        }
        return value.toString();
    }
}
