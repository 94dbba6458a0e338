package com.tbpivot.model;

import java.util.Objects;

/**
 * A single telemetry sample as returned by the timeseries endpoint.
 */
public class Point {

    private final Long timestamp;
    private final Double value;

    public Point(Long timestamp, Double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * Epoch milliseconds, or null when the server omitted it
     */
    public Long getTimestamp() {
        return timestamp;
    }

    public Double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Point)) {
            return false;
        }
        Point other = (Point) o;
        return Objects.equals(timestamp, other.timestamp)
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "Point{ts=" + timestamp + ", value=" + value + "}";
    }
}
