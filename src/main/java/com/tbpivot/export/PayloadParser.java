package com.tbpivot.export;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.config.ExportLimits;
import com.tbpivot.config.InvalidPayloadException;
import com.tbpivot.config.ReportConfig;
import com.tbpivot.config.ReportConfigResolver;
import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.SortOrder;
import com.tbpivot.util.TelemetryUtils;

/**
 * Turns a widget payload into an {@link ExportRequest}. Everything is validated
 * here so that no fetch starts for a request that cannot succeed.
 */
public class PayloadParser {

    private static final Logger logger = LoggerFactory.getLogger(PayloadParser.class);

    public static final String DEFAULT_ENTITY_TYPE = "ASSET";

    private final ExportLimits limits;
    private final ReportConfig defaults;
    private final ReportConfigResolver resolver;

    public PayloadParser(ExportLimits limits) {
        this(limits, ReportConfig.defaults(), new ReportConfigResolver());
    }

    public PayloadParser(ExportLimits limits, ReportConfig defaults, ReportConfigResolver resolver) {
        this.limits = limits;
        this.defaults = defaults;
        this.resolver = resolver;
    }

    public ExportRequest parse(Map<String, Object> payload) {
        if (payload == null) {
            payload = Collections.emptyMap();
        }

        Map<?, ?> timeEpoch = asMap(payload.get("timeEpoch"));
        Long startTs = requireEpoch(timeEpoch, "startTs_ms");
        Long endTs = requireEpoch(timeEpoch, "endTs_ms");
        if (startTs > endTs) {
            throw new InvalidPayloadException("timeEpoch.startTs_ms " + startTs + " is after endTs_ms " + endTs);
        }

        ZoneId timezone = parseTimezone(payload.get("timezone"));
        List<EntityRef> entities = parseEntities(payload.get("entities"));
        List<String> keys = parseKeys(payload.get("keys"));

        Map<?, ?> query = asMap(payload.get("query"));
        Aggregation aggregation = parseAggregation(query.get("agg"));
        Long intervalMs = parseInterval(query.get("interval"));
        int limit = parseLimit(query.get("limit"));
        SortOrder order = SortOrder.fromString(stringOrNull(query.get("order")));

        ReportConfig reportConfig = resolver.resolve(defaults, payload.get("reportConfig"));

        ExportRequest request = new ExportRequest(timezone, startTs, endTs, entities, keys,
                aggregation, intervalMs, limit, order, reportConfig);
        logger.debug("Parsed {}", request);
        return request;
    }

    private Long requireEpoch(Map<?, ?> timeEpoch, String field) {
        Object value = timeEpoch.get(field);
        if (value == null) {
            throw new InvalidPayloadException("Missing timeEpoch.startTs_ms or timeEpoch.endTs_ms");
        }
        Long epoch = TelemetryUtils.toLong(value);
        if (epoch == null) {
            throw new InvalidPayloadException("timeEpoch." + field + " is not a number: " + value);
        }
        return epoch;
    }

    private ZoneId parseTimezone(Object value) {
        String zone = stringOrNull(value);
        if (zone == null || zone.isBlank()) {
            return limits.getDefaultTimezone();
        }
        try {
            return ZoneId.of(zone.trim());
        } catch (DateTimeException e) {
            throw new InvalidPayloadException("Unknown timezone: " + zone, e);
        }
    }

    private List<EntityRef> parseEntities(Object value) {
        List<?> raw = asList(value);
        if (raw.size() > limits.getMaxEntities()) {
            logger.warn("Payload lists {} entities, only the first {} are exported",
                    raw.size(), limits.getMaxEntities());
            raw = raw.subList(0, limits.getMaxEntities());
        }

        List<EntityRef> entities = new ArrayList<>();
        for (Object item : raw) {
            Map<?, ?> entity = asMap(item);
            String id = stringOrNull(entity.get("id"));
            if (id == null || id.isEmpty()) {
                logger.debug("Skipping entity without id: {}", item);
                continue;
            }
            String type = stringOrNull(entity.get("type"));
            type = type == null || type.isEmpty() ? DEFAULT_ENTITY_TYPE : type.toUpperCase(Locale.ROOT);
            String name = stringOrNull(entity.get("name"));
            entities.add(new EntityRef(type, id, name == null || name.isEmpty() ? id : name));
        }

        if (entities.isEmpty()) {
            throw new InvalidPayloadException("No entities in payload");
        }
        return entities;
    }

    private List<String> parseKeys(Object value) {
        List<?> raw = asList(value);
        if (raw.size() > limits.getMaxKeys()) {
            logger.warn("Payload lists {} keys, only the first {} are exported", raw.size(), limits.getMaxKeys());
            raw = raw.subList(0, limits.getMaxKeys());
        }

        List<String> keys = new ArrayList<>();
        for (Object item : raw) {
            if (item != null && !item.toString().isBlank()) {
                keys.add(item.toString());
            }
        }
        if (keys.isEmpty()) {
            throw new InvalidPayloadException("No keys in payload");
        }
        return keys;
    }

    private Aggregation parseAggregation(Object value) {
        try {
            return Aggregation.fromString(stringOrNull(value));
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(e.getMessage(), e);
        }
    }

    private Long parseInterval(Object value) {
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        Long interval = TelemetryUtils.toLong(value);
        if (interval == null || interval <= 0) {
            throw new InvalidPayloadException("query.interval must be a positive number of milliseconds: " + value);
        }
        return interval;
    }

    private int parseLimit(Object value) {
        Long limit = TelemetryUtils.toLong(value);
        if (limit == null || limit <= 0) {
            return limits.getMaxPointsPerKey();
        }
        if (limit > limits.getMaxPointsPerKey()) {
            logger.debug("Clamping limit {} to {}", limit, limits.getMaxPointsPerKey());
            return limits.getMaxPointsPerKey();
        }
        return limit.intValue();
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map ? (Map<?, ?>) value : Collections.emptyMap();
    }

    private static List<?> asList(Object value) {
        return value instanceof List ? (List<?>) value : Collections.emptyList();
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
