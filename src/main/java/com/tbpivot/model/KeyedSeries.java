package com.tbpivot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Telemetry points of one entity, grouped by metric key.
 * Key order is the order in which keys were first added.
 */
public class KeyedSeries {

    private final Map<String, List<Point>> pointsByKey = new LinkedHashMap<>();

    public KeyedSeries() {
    }

    public KeyedSeries(Map<String, List<Point>> pointsByKey) {
        pointsByKey.forEach(this::putAll);
    }

    public void putAll(String key, List<Point> points) {
        pointsByKey.computeIfAbsent(key, k -> new ArrayList<>()).addAll(points);
    }

    public void add(String key, Point point) {
        pointsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(point);
    }

    public Set<String> getKeys() {
        return Collections.unmodifiableSet(pointsByKey.keySet());
    }

    public List<Point> getPoints(String key) {
        List<Point> points = pointsByKey.get(key);
        return points == null ? Collections.emptyList() : Collections.unmodifiableList(points);
    }

    public Map<String, List<Point>> asMap() {
        return Collections.unmodifiableMap(pointsByKey);
    }

    public int countPoints() {
        int count = 0;
        for (List<Point> points : pointsByKey.values()) {
            count += points.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return countPoints() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyedSeries)) {
            return false;
        }
        return pointsByKey.equals(((KeyedSeries) o).pointsByKey);
    }

    @Override
    public int hashCode() {
        return pointsByKey.hashCode();
    }

    @Override
    public String toString() {
        return "KeyedSeries" + pointsByKey;
    }
}
