package com.tbpivot.clients;

import java.net.URI;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

import com.tbpivot.fetch.TelemetrySource;
import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.KeyedSeries;
import com.tbpivot.util.TelemetryUtils;

/**
 * ThingsBoard client for the entity timeseries telemetry endpoint
 */
public class ThingsboardTelemetryClient implements TelemetrySource {

    private static final Logger logger = LoggerFactory.getLogger(ThingsboardTelemetryClient.class);

    private final ThingsboardApiBase apiBase;

    public ThingsboardTelemetryClient(ThingsboardApiBase apiBase) {
        this.apiBase = apiBase;
    }

    /**
     * Get timeseries values of an entity for one bounded time range
     */
    @Override
    public KeyedSeries fetch(EntityRef entity, List<String> keys, long startTs, long endTs,
                             int limit, Aggregation aggregation, Long intervalMs) {

        URI uri = buildTimeseriesUri(entity, keys, startTs, endTs, limit, aggregation, intervalMs);

        logger.debug("Fetching {} keys for {} between {} and {}", keys.size(), entity, startTs, endTs);
        String responseBody = apiBase.getResponseBody(uri);

        KeyedSeries series = new KeyedSeries();
        if (responseBody == null || responseBody.isBlank()) {
            logger.debug("Empty timeseries response for {}", entity);
            return series;
        }

        Map<?, ?> responseMap = apiBase.parseResponse(responseBody, Map.class);
        for (Map.Entry<?, ?> entry : responseMap.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object rawPoints = entry.getValue();
            if (rawPoints instanceof List) {
                series.putAll(key, TelemetryUtils.extractPoints(key, (List<?>) rawPoints));
            } else {
                logger.warn("Unexpected payload for key {} of {}, skipping", key, entity);
            }
        }

        logger.debug("Received {} points across {} keys for {}", series.countPoints(), series.getKeys().size(), entity);
        return series;
    }

    URI buildTimeseriesUri(EntityRef entity, List<String> keys, long startTs, long endTs,
                           int limit, Aggregation aggregation, Long intervalMs) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(apiBase.getBaseUrl())
                .path("/api/plugins/telemetry/{entityType}/{entityId}/values/timeseries")
                .queryParam("keys", String.join(",", keys))
                .queryParam("startTs", startTs)
                .queryParam("endTs", endTs)
                .queryParam("limit", limit)
                .queryParam("agg", aggregation.name());

        if (intervalMs != null && aggregation.isActive()) {
            builder.queryParam("interval", intervalMs)
                   .queryParam("intervalType", "MILLISECONDS");
        }
        builder.queryParam("useStrictDataTypes", true);

        return builder.buildAndExpand(entity.getType(), entity.getId()).encode().toUri();
    }
}
