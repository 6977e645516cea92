package me.golemcore.orchestrator.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable parameter bag of a tool call or recorded action.
 *
 * <p>
 * Only primitive values are accepted: {@link String}, {@link Boolean} and
 * numbers. Integral numbers are normalized to {@link Long} and floating point
 * numbers to {@link Double}, so {@code 1} and {@code 1L} compare equal. Keys are
 * kept sorted, which makes {@link #toCanonicalJson()} independent of the order
 * in which parameters were supplied.
 */
public final class ToolParameters {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private static final ToolParameters EMPTY = new ToolParameters(new TreeMap<>());

    private final SortedMap<String, Object> values;

    private ToolParameters(SortedMap<String, Object> values) {
        this.values = Collections.unmodifiableSortedMap(values);
    }

    public static ToolParameters empty() {
        return EMPTY;
    }

    public static ToolParameters of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        SortedMap<String, Object> normalized = new TreeMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Parameter name must not be blank");
            }
            normalized.put(key, normalize(key, entry.getValue()));
        }
        return new ToolParameters(normalized);
    }

    public static ToolParameters of(String key, Object value) {
        return of(Map.of(key, value));
    }

    public static ToolParameters of(String key1, Object value1, String key2, Object value2) {
        return of(Map.of(key1, value1, key2, value2));
    }

    /**
     * Returns a copy with one parameter added or replaced.
     */
    public ToolParameters with(String key, Object value) {
        SortedMap<String, Object> copy = new TreeMap<>(values);
        copy.put(key, normalize(key, value));
        return new ToolParameters(copy);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<String> getString(String key) {
        Object value = values.get(key);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Optional<Long> getLong(String key) {
        Object value = values.get(key);
        return value instanceof Long l ? Optional.of(l) : Optional.empty();
    }

    public Optional<Boolean> getBoolean(String key) {
        Object value = values.get(key);
        return value instanceof Boolean b ? Optional.of(b) : Optional.empty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    /**
     * Sorted-key JSON encoding used as the stable identity of a parameter set.
     */
    public String toCanonicalJson() {
        try {
            return CANONICAL_MAPPER.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode tool parameters", e);
        }
    }

    private static Object normalize(String key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + key + "' must not be null");
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("Parameter '" + key + "' has unsupported type "
                + value.getClass().getSimpleName() + "; only strings, booleans and numbers are allowed");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ToolParameters other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
