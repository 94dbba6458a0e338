package com.tbpivot.resample;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A calendar period [start, end) on wall-clock time.
 */
public class Period {

    private final Granularity granularity;
    private final LocalDateTime start;
    private final LocalDateTime end;
    private final LocalDateTime completionMark;

    Period(Granularity granularity, LocalDateTime start, LocalDateTime end, LocalDateTime completionMark) {
        this.granularity = granularity;
        this.start = start;
        this.end = end;
        this.completionMark = completionMark;
    }

    public Granularity getGranularity() { return granularity; }
    public LocalDateTime getStart() { return start; }

    /**
     * Exclusive end: the start of the following period
     */
    public LocalDateTime getEnd() { return end; }

    /**
     * Latest timestamp the data has to reach for this period to count as covered
     */
    public LocalDateTime getCompletionMark() { return completionMark; }

    public LocalDate getStartDate() {
        return start.toLocalDate();
    }

    public boolean contains(LocalDateTime timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    @Override
    public String toString() {
        return granularity + "[" + start + ", " + end + ")";
    }
}
