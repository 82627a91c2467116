package com.seiscatalog.group;

import com.seiscatalog.AppLogger;
import com.seiscatalog.models.CatalogRecord;
import com.seiscatalog.models.OutputMode;
import com.seiscatalog.models.VirtualArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions and nests records by the values of their label fields.
 */
public class RecordGrouper {

    private final AppLogger logger = AppLogger.get();

    /**
     * Group records by the values at {@code labels}.
     *
     * The key is the bare value for a single label, otherwise an immutable
     * list of values. Groups appear in first-seen order after an optional
     * stable sort on {@code sortLabels}. Records missing a label are left out.
     */
    public Map<Object, List<CatalogRecord>> group(List<CatalogRecord> records, List<String> labels, List<String> sortLabels) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("At least one group label is required");
        }
        List<CatalogRecord> ordered = records;
        if (sortLabels != null && !sortLabels.isEmpty()) {
            ordered = new ArrayList<>(records);
            ordered.sort(byLabels(sortLabels));
        }

        Map<Object, List<CatalogRecord>> groups = new LinkedHashMap<>();
        int skipped = 0;
        for (CatalogRecord record : ordered) {
            List<Object> key = keyOf(record, labels);
            if (key == null) {
                skipped++;
                continue;
            }
            Object groupKey = labels.size() == 1 ? key.get(0) : Collections.unmodifiableList(key);
            groups.computeIfAbsent(groupKey, k -> new ArrayList<>()).add(record);
        }
        if (skipped > 0) {
            logger.debug("[RecordGrouper] " + skipped + " records lack one of " + labels + " and were not grouped");
        }
        logger.info("[RecordGrouper] " + records.size() + " files grouped into " + groups.size() + " groups by " + labels);
        return groups;
    }

    /**
     * Nest records one level per label, in {@code labelOrder}.
     */
    public VirtualArray organize(List<CatalogRecord> records, List<String> labelOrder, OutputMode outputMode) {
        VirtualArray array = new VirtualArray(labelOrder, outputMode);
        int skipped = 0;
        for (CatalogRecord record : records) {
            List<Object> key = keyOf(record, labelOrder);
            if (key == null) {
                skipped++;
                continue;
            }
            array.add(key, array.getOutputMode() == OutputMode.PATH ? record.getPath() : record);
        }
        if (skipped > 0) {
            logger.debug("[RecordGrouper] " + skipped + " records lack one of " + labelOrder + " and were not organized");
        }
        logger.info("[RecordGrouper] " + array.getLeafCount() + " files organized by " + labelOrder);
        return array;
    }

    private static List<Object> keyOf(CatalogRecord record, List<String> labels) {
        List<Object> key = new ArrayList<>(labels.size());
        for (String label : labels) {
            Object value = record.get(label);
            if (value == null) {
                return null;
            }
            key.add(value);
        }
        return key;
    }

    static Comparator<CatalogRecord> byLabels(List<String> sortLabels) {
        Comparator<CatalogRecord> comparator = null;
        for (String label : sortLabels) {
            Comparator<CatalogRecord> next = Comparator.comparing(r -> r.get(label), RecordGrouper::compareValues);
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        return comparator;
    }

    /**
     * Total order over mixed values: numbers, then strings, then other
     * comparables grouped by class name, then everything else by text.
     * Nulls sort last.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static int compareValues(Object a, Object b) {
        if (a == b) return 0;
        if (a == null) return 1;
        if (b == null) return -1;
        int rankA = rank(a);
        int rankB = rank(b);
        if (rankA != rankB) {
            return Integer.compare(rankA, rankB);
        }
        switch (rankA) {
            case 0:
                return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            case 1:
                return ((String) a).compareTo((String) b);
            case 2:
                if (a.getClass() != b.getClass()) {
                    return a.getClass().getName().compareTo(b.getClass().getName());
                }
                return ((Comparable) a).compareTo(b);
            default:
                return a.toString().compareTo(b.toString());
        }
    }

    private static int rank(Object value) {
        if (value instanceof Number) return 0;
        if (value instanceof String) return 1;
        if (value instanceof Comparable) return 2;
        return 3;
    }
}
