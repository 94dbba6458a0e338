package com.tbpivot.resample;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class AggregationFunctionTest {

    private final List<Double> values = Arrays.asList(3.0, null, 1.0, Double.NaN, 2.0);

    @Test
    public void testReductionsIgnoreNulls() {
        assertEquals(2.0, AggregationFunction.MEAN.apply(values));
        assertEquals(6.0, AggregationFunction.SUM.apply(values));
        assertEquals(1.0, AggregationFunction.MIN.apply(values));
        assertEquals(3.0, AggregationFunction.MAX.apply(values));
        assertEquals(3.0, AggregationFunction.FIRST.apply(values));
        assertEquals(2.0, AggregationFunction.LAST.apply(values));
    }

    @Test
    public void testEmptyGroup() {
        List<Double> empty = Arrays.asList(null, null);
        assertEquals(0.0, AggregationFunction.SUM.apply(empty));
        assertEquals(0.0, AggregationFunction.SUM.apply(Collections.<Double>emptyList()));
        assertNull(AggregationFunction.MEAN.apply(empty));
        assertNull(AggregationFunction.MIN.apply(empty));
        assertNull(AggregationFunction.MAX.apply(empty));
        assertNull(AggregationFunction.FIRST.apply(empty));
        assertNull(AggregationFunction.LAST.apply(empty));
    }

    @Test
    public void testFromName() {
        assertEquals(AggregationFunction.LAST, AggregationFunction.fromName(" Last "));
        assertEquals("mean", AggregationFunction.MEAN.getName());
        assertThrows(IllegalArgumentException.class, () -> AggregationFunction.fromName("median"));
        assertThrows(IllegalArgumentException.class, () -> AggregationFunction.fromName(null));
    }
}
