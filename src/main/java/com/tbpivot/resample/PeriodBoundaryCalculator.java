package com.tbpivot.resample;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar boundaries for one granularity. Months and years use their real
 * lengths; weeks are anchored to the configured first day of the week.
 */
public class PeriodBoundaryCalculator {

    private final Granularity granularity;
    private final DayOfWeek weekStart;

    public PeriodBoundaryCalculator(Granularity granularity, DayOfWeek weekStart) {
        this.granularity = granularity;
        this.weekStart = weekStart;
    }

    public Period periodContaining(LocalDateTime timestamp) {
        return periodStartingOn(startDateOf(timestamp.toLocalDate()));
    }

    public Period next(Period period) {
        return periodStartingOn(period.getEnd().toLocalDate());
    }

    private LocalDate startDateOf(LocalDate date) {
        switch (granularity) {
            case DAY:
                return date;
            case WEEK:
                return date.with(TemporalAdjusters.previousOrSame(weekStart));
            case MONTH:
                return date.withDayOfMonth(1);
            case YEAR:
                return date.withDayOfYear(1);
            default:
                throw new IllegalStateException("Unknown granularity " + granularity);
        }
    }

    private Period periodStartingOn(LocalDate startDate) {
        LocalDateTime start = startDate.atStartOfDay();
        LocalDateTime end;
        LocalDateTime completionMark;

        switch (granularity) {
            case DAY:
                end = start.plusDays(1);
                completionMark = end.minusSeconds(1);
                break;
            case WEEK:
                // covered once the 7th day is reached
                end = start.plusWeeks(1);
                completionMark = start.plusDays(6);
                break;
            case MONTH:
                end = start.plusMonths(1);
                completionMark = end.minusSeconds(1);
                break;
            case YEAR:
                // covered once Dec 31 is reached
                end = start.plusYears(1);
                completionMark = end.minusDays(1);
                break;
            default:
                throw new IllegalStateException("Unknown granularity " + granularity);
        }
        return new Period(granularity, start, end, completionMark);
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public DayOfWeek getWeekStart() {
        return weekStart;
    }
}
