package com.tbpivot.table;

import java.util.Comparator;
import java.util.Objects;

/**
 * One entity x metric column of the pivot table, named "&lt;entity&gt; &lt;metric&gt;".
 */
public class PivotColumn {

    public static final Comparator<PivotColumn> BY_ENTITY_THEN_METRIC =
            Comparator.comparing(PivotColumn::getEntity).thenComparing(PivotColumn::getMetric);

    private final String entity;
    private final String metric;
    private final String name;

    public PivotColumn(String entity, String metric) {
        this.entity = entity;
        this.metric = metric;
        this.name = columnName(entity, metric);
    }

    public static String columnName(String entity, String metric) {
        return entity + " " + metric;
    }

    public String getEntity() { return entity; }
    public String getMetric() { return metric; }
    public String getName() { return name; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PivotColumn)) return false;
        PivotColumn other = (PivotColumn) o;
        return entity.equals(other.entity) && metric.equals(other.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, metric);
    }

    @Override
    public String toString() {
        return name;
    }
}
