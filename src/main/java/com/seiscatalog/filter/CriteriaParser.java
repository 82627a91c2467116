package com.seiscatalog.filter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seiscatalog.AppLogger;
import com.seiscatalog.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reads filter criteria from their configuration form:
 *
 * <pre>
 * {
 *   "station": { "type": "list",  "data_type": "str",      "value": ["ABC", "XYZ"] },
 *   "time":    { "type": "range", "data_type": "datetime", "value": ["2023-01-01 00:00:00", "2023-01-02 00:00:00"] },
 *   "size":    { "type": "range", "data_type": "int",      "value": [100, 2000] }
 * }
 * </pre>
 *
 * List values are kept as given. Range bounds are paired; with a datetime
 * type their strings are parsed into {@link LocalDateTime}.
 */
public class CriteriaParser {

    private static final DateTimeFormatter SPACED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public CriteriaParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    public CriteriaParser() {
        this(null);
    }

    public FilterCriteria parseFile(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read criteria file " + file + ": " + e.getMessage(), e);
        }
    }

    public FilterCriteria parse(String json) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ConfigurationException("Criteria are not valid JSON: " + e.getMessage(), e);
        }
        return parse(node);
    }

    /**
     * @throws ConfigurationException if the criteria are not a JSON object
     */
    public FilterCriteria parse(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return FilterCriteria.empty();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Criteria must be a JSON object keyed by field name");
        }
        Map<String, Object> criteria = objectMapper.convertValue(root, new TypeReference<Map<String, Object>>() {});
        return parse(criteria);
    }

    /**
     * @throws ConfigurationException if an entry lacks "type" or "value"
     */
    public FilterCriteria parse(Map<String, ?> criteria) {
        FilterCriteria.Builder builder = FilterCriteria.builder();
        if (criteria == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : criteria.entrySet()) {
            String fieldName = entry.getKey();
            if (!(entry.getValue() instanceof Map)) {
                logger.error("[CriteriaParser] Field '" + fieldName + "' is invalid, it must contain 'type' and 'value'");
                throw new ConfigurationException("Criterion for field '" + fieldName + "' must contain 'type' and 'value'");
            }
            Map<?, ?> cfg = (Map<?, ?>) entry.getValue();
            if (!cfg.containsKey("type") || !cfg.containsKey("value")) {
                logger.error("[CriteriaParser] Field '" + fieldName + "' is invalid, it must contain 'type' and 'value'");
                throw new ConfigurationException("Criterion for field '" + fieldName + "' must contain 'type' and 'value'");
            }

            Object typeName = cfg.get("type");
            Object dataTypeName = cfg.get("data_type");
            DataType dataType = dataTypeName != null ? DataType.fromName(dataTypeName.toString()) : null;
            if (dataTypeName != null && dataType == null) {
                logger.warn("[CriteriaParser] Field '" + fieldName + "' has unknown data_type '" + dataTypeName
                        + "', values will not be type-checked");
            }
            Object value = cfg.get("value");

            FilterMode mode = FilterMode.fromName(typeName != null ? typeName.toString() : null);
            if (mode == null) {
                logger.error("[CriteriaParser] Field '" + fieldName + "' has unknown filter type '" + typeName + "', skipped");
                continue;
            }
            if (!(value instanceof Collection)) {
                logger.error("[CriteriaParser] Field '" + fieldName + "' claims '" + typeName
                        + "' type but 'value' is not a list: " + value);
                continue;
            }

            List<Object> values = new ArrayList<>((Collection<?>) value);
            if (mode == FilterMode.LIST) {
                builder.list(fieldName, dataType, values);
            } else {
                if (dataType == DataType.DATETIME) {
                    values = toDateTimes(fieldName, values);
                }
                builder.range(fieldName, dataType, values);
            }
        }
        return builder.build();
    }

    private List<Object> toDateTimes(String fieldName, List<Object> values) {
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value instanceof String) {
                converted.add(parseDateTime(fieldName, (String) value));
            } else {
                converted.add(value);
            }
        }
        return converted;
    }

    /**
     * Accepts {@code 2023-01-02T00:00:00}, {@code 2023-01-02 00:00:00} and {@code 2023-01-02}.
     */
    static LocalDateTime parseDateTime(String fieldName, String text) {
        String trimmed = text.trim();
        try {
            return LocalDateTime.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // try the next layout
        }
        try {
            return LocalDateTime.parse(trimmed, SPACED);
        } catch (DateTimeParseException ignored) {
            // try the next layout
        }
        try {
            return LocalDate.parse(trimmed).atStartOfDay();
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Field '" + fieldName + "' has an unparseable datetime bound: " + text, e);
        }
    }
}
