package com.seiscatalog.filter;

import com.seiscatalog.AppLogger;
import com.seiscatalog.models.CatalogRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A predicate on one record field: membership in a list of values, or
 * membership in any of a set of inclusive ranges.
 */
public class Criterion {

    private final String field;
    private final FilterMode mode;
    private final DataType dataType;
    private final List<Object> values;
    private final List<Range> ranges;

    private Criterion(String field, FilterMode mode, DataType dataType, List<Object> values, List<Range> ranges) {
        this.field = field;
        this.mode = mode;
        this.dataType = dataType;
        this.values = values;
        this.ranges = ranges;
    }

    public static Criterion list(String field, DataType dataType, List<?> values) {
        return new Criterion(field, FilterMode.LIST, dataType,
                Collections.unmodifiableList(new ArrayList<>(values)), List.of());
    }

    public static Criterion range(String field, DataType dataType, List<Range> ranges) {
        return new Criterion(field, FilterMode.RANGE, dataType, List.of(), List.copyOf(ranges));
    }

    public String getField() {
        return field;
    }

    public FilterMode getMode() {
        return mode;
    }

    /** May be null: no type check. */
    public DataType getDataType() {
        return dataType;
    }

    public List<Object> getValues() {
        return values;
    }

    public List<Range> getRanges() {
        return ranges;
    }

    public boolean test(CatalogRecord record) {
        if (!record.has(field)) {
            return false;
        }
        Object value = record.get(field);
        if (value == null) {
            return false;
        }
        if (dataType != null && !dataType.accepts(value)) {
            AppLogger.get().warn("[FileFilter] Field '" + field + "' of " + record.getPath()
                    + " is not of type " + dataType + " (" + value.getClass().getSimpleName() + ")");
            return false;
        }
        if (mode == FilterMode.LIST) {
            for (Object allowed : values) {
                if (valuesEqual(value, allowed)) {
                    return true;
                }
            }
            return false;
        }
        for (Range range : ranges) {
            try {
                if (range.contains(value, dataType)) {
                    return true;
                }
            } catch (IllegalArgumentException e) {
                AppLogger.get().warn("[FileFilter] Field '" + field + "' of " + record.getPath()
                        + " cannot be compared with range " + range + ": " + e.getMessage());
                return false;
            }
        }
        return false;
    }

    /**
     * Strict membership: a string never equals a number, numbers equal by value.
     */
    static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }
        return Objects.equals(a, b);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compare(Object a, Object b, DataType dataType) {
        boolean numeric = (dataType != null && dataType.isNumeric())
                || a instanceof Number || b instanceof Number;
        if (numeric) {
            Double da = DataType.toDouble(a);
            Double db = DataType.toDouble(b);
            if (da != null && db != null) {
                return Double.compare(da, db);
            }
            throw new IllegalArgumentException(a + " and " + b + " are not both numeric");
        }
        if (a instanceof Comparable && b != null
                && (a.getClass().isInstance(b) || b.getClass().isInstance(a))) {
            return ((Comparable) a).compareTo(b);
        }
        throw new IllegalArgumentException("incomparable types "
                + (a == null ? "null" : a.getClass().getSimpleName()) + " and "
                + (b == null ? "null" : b.getClass().getSimpleName()));
    }

    @Override
    public String toString() {
        Object data = mode == FilterMode.LIST ? values : ranges;
        return "Field '" + field + "' [" + mode + ", type: " + (dataType != null ? dataType : "N/A") + "] => " + data;
    }

    /**
     * Inclusive interval {@code [start, end]}.
     */
    public static class Range {
        private final Object start;
        private final Object end;

        public Range(Object start, Object end) {
            this.start = start;
            this.end = end;
        }

        public Object getStart() {
            return start;
        }

        public Object getEnd() {
            return end;
        }

        /**
         * @throws IllegalArgumentException if the value cannot be ordered against the bounds
         */
        public boolean contains(Object value, DataType dataType) {
            return compare(start, value, dataType) <= 0 && compare(value, end, dataType) <= 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Range)) return false;
            Range other = (Range) o;
            return Objects.equals(start, other.start) && Objects.equals(end, other.end);
        }

        @Override
        public int hashCode() {
            return Objects.hash(start, end);
        }

        @Override
        public String toString() {
            return "(" + start + ", " + end + ")";
        }
    }
}
