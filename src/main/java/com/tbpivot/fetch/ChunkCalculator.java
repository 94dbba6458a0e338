package com.tbpivot.fetch;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an aggregated time range into sub-ranges the server accepts in one request.
 */
public class ChunkCalculator {

    /**
     * Number of aggregation intervals covered by [startTs, endTs]
     */
    public static double calculateIntervalCount(long startTs, long endTs, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Interval must be positive");
        }
        if (startTs > endTs) {
            throw new IllegalArgumentException("Start time must not be after end time");
        }
        return (double) (endTs - startTs) / intervalMs;
    }

    public static boolean requiresChunking(long startTs, long endTs, long intervalMs, int maxIntervalsPerRequest) {
        return calculateIntervalCount(startTs, endTs, intervalMs) > maxIntervalsPerRequest;
    }

    /**
     * Consecutive sub-ranges of maxIntervalsPerRequest * intervalMs width, the last
     * one truncated to endTs. Each sub-range starts where the previous one ended.
     */
    public static List<TimeRange> calculateChunks(long startTs, long endTs, long intervalMs, int maxIntervalsPerRequest) {
        if (maxIntervalsPerRequest <= 0) {
            throw new IllegalArgumentException("Max intervals per request must be positive");
        }
        calculateIntervalCount(startTs, endTs, intervalMs);

        long chunkMs = (long) maxIntervalsPerRequest * intervalMs;
        List<TimeRange> chunks = new ArrayList<>();
        long t = startTs;
        while (t < endTs) {
            long chunkEnd = Math.min(t + chunkMs, endTs);
            chunks.add(new TimeRange(t, chunkEnd));
            t = chunkEnd;
        }
        if (chunks.isEmpty()) {
            chunks.add(new TimeRange(startTs, endTs));
        }
        return chunks;
    }

    /**
     * Calculate how many requests a range will take
     */
    public static int calculateExpectedRequests(long startTs, long endTs, long intervalMs, int maxIntervalsPerRequest) {
        if (!requiresChunking(startTs, endTs, intervalMs, maxIntervalsPerRequest)) {
            return 1;
        }
        long chunkMs = (long) maxIntervalsPerRequest * intervalMs;
        return (int) ((endTs - startTs + chunkMs - 1) / chunkMs);
    }

    public static class TimeRange {
        private final long startTs;
        private final long endTs;

        public TimeRange(long startTs, long endTs) {
            this.startTs = startTs;
            this.endTs = endTs;
        }

        public long getStartTs() { return startTs; }
        public long getEndTs() { return endTs; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof TimeRange)) return false;
            TimeRange other = (TimeRange) o;
            return startTs == other.startTs && endTs == other.endTs;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(startTs) * 31 + Long.hashCode(endTs);
        }

        @Override
        public String toString() {
            return "[" + startTs + ", " + endTs + "]";
        }
    }
}
