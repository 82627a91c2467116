package com.seiscatalog.filter;

import com.seiscatalog.AppLogger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed filter criteria, at most one per field. A record passes when it
 * satisfies every list criterion and every range criterion.
 */
public class FilterCriteria {

    private final Map<String, Criterion> listCriteria;
    private final Map<String, Criterion> rangeCriteria;

    private FilterCriteria(Map<String, Criterion> listCriteria, Map<String, Criterion> rangeCriteria) {
        this.listCriteria = Collections.unmodifiableMap(new LinkedHashMap<>(listCriteria));
        this.rangeCriteria = Collections.unmodifiableMap(new LinkedHashMap<>(rangeCriteria));
    }

    public static FilterCriteria empty() {
        return new FilterCriteria(Map.of(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Criterion> getListCriteria() {
        return listCriteria;
    }

    public Map<String, Criterion> getRangeCriteria() {
        return rangeCriteria;
    }

    /**
     * Declared type per field, null where none was declared.
     */
    public Map<String, DataType> getTypeMap() {
        Map<String, DataType> types = new LinkedHashMap<>();
        for (Criterion c : listCriteria.values()) {
            types.put(c.getField(), c.getDataType());
        }
        for (Criterion c : rangeCriteria.values()) {
            types.put(c.getField(), c.getDataType());
        }
        return types;
    }

    public boolean isEmpty() {
        return listCriteria.isEmpty() && rangeCriteria.isEmpty();
    }

    public static class Builder {
        private final Map<String, Criterion> listCriteria = new LinkedHashMap<>();
        private final Map<String, Criterion> rangeCriteria = new LinkedHashMap<>();

        public Builder add(Criterion criterion) {
            listCriteria.remove(criterion.getField());
            rangeCriteria.remove(criterion.getField());
            if (criterion.getMode() == FilterMode.LIST) {
                listCriteria.put(criterion.getField(), criterion);
            } else {
                rangeCriteria.put(criterion.getField(), criterion);
            }
            return this;
        }

        public Builder list(String field, DataType dataType, Object... values) {
            return add(Criterion.list(field, dataType, Arrays.asList(values)));
        }

        public Builder list(String field, DataType dataType, List<?> values) {
            return add(Criterion.list(field, dataType, values));
        }

        /**
         * Consecutive values are paired into inclusive ranges; a trailing
         * unpaired value is dropped with a warning. No pairs, no criterion.
         */
        public Builder range(String field, DataType dataType, List<?> bounds) {
            List<?> values = bounds;
            if (values.size() % 2 != 0) {
                AppLogger.get().warn("[FilterCriteria] Field '" + field
                        + "' has an odd number of range items, discarding the last one");
                values = values.subList(0, values.size() - 1);
            }
            List<Criterion.Range> pairs = new ArrayList<>();
            for (int i = 0; i < values.size(); i += 2) {
                pairs.add(new Criterion.Range(values.get(i), values.get(i + 1)));
            }
            if (!pairs.isEmpty()) {
                add(Criterion.range(field, dataType, pairs));
            }
            return this;
        }

        public Builder range(String field, DataType dataType, Object... bounds) {
            return range(field, dataType, Arrays.asList(bounds));
        }

        public FilterCriteria build() {
            return new FilterCriteria(listCriteria, rangeCriteria);
        }
    }
}
