package com.tbpivot.fetch;

import java.util.List;

import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.KeyedSeries;

/**
 * One bounded timeseries request against the telemetry backend.
 */
public interface TelemetrySource {

    /**
     * Fetch the points of the given keys within [startTs, endTs].
     *
     * @param intervalMs aggregation interval, or null when the request is not aggregated
     * @throws com.tbpivot.clients.ThingsboardApiBase.ThingsboardApiException when the
     *         request fails after the credential refresh retry
     */
    KeyedSeries fetch(EntityRef entity, List<String> keys, long startTs, long endTs,
                      int limit, Aggregation aggregation, Long intervalMs);
}
