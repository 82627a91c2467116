package com.seiscatalog.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fields extracted from one matched file, plus its {@code path} and,
 * when it could be derived, its {@code time}.
 */
public class CatalogRecord {
    public static final String PATH = "path";
    public static final String TIME = "time";

    private final Map<String, Object> fields;

    /**
     * Null values are dropped, as with {@link #put}.
     */
    public CatalogRecord(Map<String, ?> fields) {
        this.fields = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            if (entry.getValue() != null) {
                this.fields.put(entry.getKey(), entry.getValue());
            }
        }
    }

    public CatalogRecord() {
        this.fields = new LinkedHashMap<>();
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value != null ? value.toString() : null;
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Attach a value, e.g. a file size used later by a range criterion.
     */
    public CatalogRecord put(String field, Object value) {
        if (value == null) {
            fields.remove(field);
        } else {
            fields.put(field, value);
        }
        return this;
    }

    @JsonIgnore
    public String getPath() {
        return getString(PATH);
    }

    @JsonIgnore
    public LocalDateTime getTime() {
        Object value = fields.get(TIME);
        return value instanceof LocalDateTime ? (LocalDateTime) value : null;
    }

    @JsonAnyGetter
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatalogRecord)) return false;
        return fields.equals(((CatalogRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
