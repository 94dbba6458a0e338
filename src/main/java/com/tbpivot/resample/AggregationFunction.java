package com.tbpivot.resample;

import java.util.List;
import java.util.Locale;

/**
 * Per-column reduction applied when pivot rows are folded into a calendar period.
 * Null cells never take part in a reduction.
 */
public enum AggregationFunction {
    MEAN,
    SUM,
    MIN,
    MAX,
    FIRST,
    LAST;

    public static AggregationFunction fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Aggregation function must not be null");
        }
        try {
            return AggregationFunction.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported aggregation function '" + name
                    + "' (expected one of mean, sum, min, max, first, last)", e);
        }
    }

    /**
     * Reduce values given in chronological order.
     *
     * @return the reduced value; null when there is nothing to reduce, except for
     *         {@link #SUM} which yields 0
     */
    public Double apply(List<Double> chronologicalValues) {
        Double result = null;
        int count = 0;
        double sum = 0.0;

        for (Double value : chronologicalValues) {
            if (value == null || value.isNaN()) {
                continue;
            }
            count++;
            sum += value;
            switch (this) {
                case MIN:
                    result = result == null ? value : Math.min(result, value);
                    break;
                case MAX:
                    result = result == null ? value : Math.max(result, value);
                    break;
                case FIRST:
                    if (result == null) {
                        result = value;
                    }
                    break;
                case LAST:
                    result = value;
                    break;
                default:
                    break;
            }
        }

        if (this == SUM) {
            return sum;
        }
        if (this == MEAN) {
            return count == 0 ? null : sum / count;
        }
        return result;
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
