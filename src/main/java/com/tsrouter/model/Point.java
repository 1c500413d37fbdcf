package com.tsrouter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A single time-series point as accepted by the write endpoint.
 * Tags are kept sorted by key; fields keep the order the client used.
 */
public class Point {

    private final String measurement;
    private final SortedMap<String, String> tags;
    private final Map<String, FieldValue> fields;
    private final long timestamp;

    public Point(String measurement, Map<String, String> tags, Map<String, FieldValue> fields, long timestamp) {
        this.measurement = Objects.requireNonNull(measurement, "Measurement cannot be null");
        if (measurement.isEmpty()) {
            throw new IllegalArgumentException("Measurement cannot be empty");
        }
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("A point requires at least one field");
        }
        this.tags = Collections.unmodifiableSortedMap(tags != null ? new TreeMap<>(tags) : new TreeMap<>());
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.timestamp = timestamp;
    }

    public String getMeasurement() {
        return measurement;
    }

    public SortedMap<String, String> getTags() {
        return tags;
    }

    public Map<String, FieldValue> getFields() {
        return fields;
    }

    /**
     * Nanoseconds since the epoch.
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Point point = (Point) o;
        return timestamp == point.timestamp &&
               measurement.equals(point.measurement) &&
               tags.equals(point.tags) &&
               fields.equals(point.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, tags, fields, timestamp);
    }

    @Override
    public String toString() {
        return LineProtocol.format(this);
    }
}
