package com.seiscatalog.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records nested by an ordered list of labels.
 *
 * With labels {@code [station, component]} the structure is
 * {@code station -> component -> [leaf, ...]}, where a leaf is either the
 * record or its path depending on the {@link OutputMode}.
 */
public class VirtualArray {
    private final List<String> labels;
    private final OutputMode outputMode;
    private final Map<Object, Object> root = new LinkedHashMap<>();
    private int leafCount;

    public VirtualArray(List<String> labels, OutputMode outputMode) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("At least one label is required");
        }
        this.labels = List.copyOf(labels);
        this.outputMode = outputMode != null ? outputMode : OutputMode.DICT;
    }

    public List<String> getLabels() {
        return labels;
    }

    public OutputMode getOutputMode() {
        return outputMode;
    }

    public int getLeafCount() {
        return leafCount;
    }

    /**
     * Append a leaf under the given label values, one per label.
     */
    @SuppressWarnings("unchecked")
    public void add(List<?> keyPath, Object leaf) {
        if (keyPath.size() != labels.size()) {
            throw new IllegalArgumentException("Expected " + labels.size() + " keys, got " + keyPath.size());
        }
        Map<Object, Object> node = root;
        for (int i = 0; i < keyPath.size() - 1; i++) {
            node = (Map<Object, Object>) node.computeIfAbsent(keyPath.get(i), k -> new LinkedHashMap<>());
        }
        List<Object> leaves = (List<Object>) node.computeIfAbsent(keyPath.get(keyPath.size() - 1), k -> new ArrayList<>());
        leaves.add(leaf);
        leafCount++;
    }

    /**
     * Leaves stored under a full key path, or an empty list.
     */
    @SuppressWarnings("unchecked")
    public List<Object> leaves(Object... keys) {
        if (keys.length != labels.size()) {
            return List.of();
        }
        Object current = root;
        for (Object key : keys) {
            if (!(current instanceof Map)) {
                return List.of();
            }
            current = ((Map<Object, Object>) current).get(key);
            if (current == null) {
                return List.of();
            }
        }
        return current instanceof List ? Collections.unmodifiableList((List<Object>) current) : List.of();
    }

    /**
     * Label values present one level below the given key prefix.
     */
    @SuppressWarnings("unchecked")
    public List<Object> keys(Object... prefix) {
        Object current = root;
        for (Object key : prefix) {
            if (!(current instanceof Map)) {
                return List.of();
            }
            current = ((Map<Object, Object>) current).get(key);
        }
        if (!(current instanceof Map)) {
            return List.of();
        }
        return new ArrayList<>(((Map<Object, Object>) current).keySet());
    }

    @JsonValue
    public Map<Object, Object> toMap() {
        return Collections.unmodifiableMap(root);
    }
}
