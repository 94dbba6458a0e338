package com.tbpivot.fetch;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.fetch.ChunkCalculator.TimeRange;
import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.KeyedSeries;
import com.tbpivot.model.Point;

/**
 * Fetches a full time range for one entity, splitting aggregated requests that
 * would exceed the server's interval cap into sequential sub-range requests and
 * stitching the pages back together per key.
 */
public class ChunkedFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedFetcher.class);

    private final TelemetrySource source;
    private final int maxIntervalsPerRequest;

    public ChunkedFetcher(TelemetrySource source, int maxIntervalsPerRequest) {
        if (maxIntervalsPerRequest <= 0) {
            throw new IllegalArgumentException("Max intervals per request must be positive");
        }
        this.source = source;
        this.maxIntervalsPerRequest = maxIntervalsPerRequest;
    }

    public KeyedSeries fetch(EntityRef entity, List<String> keys, long startTs, long endTs,
                             int limit, Aggregation aggregation, Long intervalMs) {

        if (!aggregation.isActive() || intervalMs == null
                || !ChunkCalculator.requiresChunking(startTs, endTs, intervalMs, maxIntervalsPerRequest)) {
            return source.fetch(entity, keys, startTs, endTs, limit, aggregation, intervalMs);
        }

        List<TimeRange> chunks = ChunkCalculator.calculateChunks(startTs, endTs, intervalMs, maxIntervalsPerRequest);
        logger.info("Splitting request for {} into {} chunks of up to {} intervals",
                entity.getName(), chunks.size(), maxIntervalsPerRequest);

        Map<String, SeriesAccumulator> merged = new LinkedHashMap<>();
        int chunkNum = 1;
        for (TimeRange chunk : chunks) {
            KeyedSeries page = source.fetch(entity, keys, chunk.getStartTs(), chunk.getEndTs(),
                    limit, aggregation, intervalMs);

            logger.debug("Chunk {}/{} {} for {}: {} points", chunkNum, chunks.size(), chunk,
                    entity.getName(), page.countPoints());

            for (String key : page.getKeys()) {
                merged.computeIfAbsent(key, k -> new SeriesAccumulator())
                      .append(page.getPoints(key), key, entity, chunkNum);
            }
            chunkNum++;
        }

        KeyedSeries result = new KeyedSeries();
        merged.forEach((key, accumulator) -> result.putAll(key, accumulator.points));
        return result;
    }

    /**
     * Points of one key in request order. A timestamp that reappears in a later
     * chunk replaces the earlier value in place.
     */
    private static class SeriesAccumulator {
        private final List<Point> points = new ArrayList<>();
        private final Map<Long, Integer> positions = new HashMap<>();

        void append(List<Point> page, String key, EntityRef entity, int chunkNum) {
            for (Point point : page) {
                Long ts = point.getTimestamp();
                if (ts == null) {
                    points.add(point);
                    continue;
                }
                Integer existing = positions.get(ts);
                if (existing != null) {
                    logger.warn("Timestamp overlap for {} {} at {} in chunk {}, keeping the later value",
                            entity.getName(), key, ts, chunkNum);
                    points.set(existing, point);
                } else {
                    positions.put(ts, points.size());
                    points.add(point);
                }
            }
        }
    }
}
