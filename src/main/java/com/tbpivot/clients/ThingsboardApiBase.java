package com.tbpivot.clients;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Base ThingsBoard API client that handles JWT authentication, the single
 * token-refresh retry and common HTTP operations.
 * Specialized clients for different API categories are built on top of this.
 */
public class ThingsboardApiBase {

    private static final Logger logger = LoggerFactory.getLogger(ThingsboardApiBase.class);
    private static final Logger requestLogger = LoggerFactory.getLogger("TbRequestLogger");

    public static final String AUTH_HEADER = "X-Authorization";
    public static final int REQUEST_TIMEOUT_SECONDS = 60;

    private final String baseUrl;
    private final TokenProvider tokenProvider;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();
    private int totalRequests = 0;
    private int tokenRefreshes = 0;
    private int debugLevel = 0;

    public ThingsboardApiBase(String baseUrl, TokenProvider tokenProvider) {
        this(baseUrl, tokenProvider, createRestClient());
    }

    public ThingsboardApiBase(String baseUrl, TokenProvider tokenProvider, RestClient restClient) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.tokenProvider = tokenProvider;
        this.restClient = restClient;
        this.objectMapper = new ObjectMapper();

        logger.debug("ThingsBoard API base client initialized for {}", this.baseUrl);
    }

    /**
     * RestClient over Apache HttpClient 5 with the request timeout applied
     */
    public static RestClient createRestClient() {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(REQUEST_TIMEOUT_SECONDS))
                .setResponseTimeout(Timeout.ofSeconds(REQUEST_TIMEOUT_SECONDS))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .build();

        HttpComponentsClientHttpRequestFactory factory = new HttpComponentsClientHttpRequestFactory(httpClient);
        return RestClient.builder().requestFactory(factory).build();
    }

    static String stripTrailingSlash(String url) {
        if (url == null) {
            throw new IllegalArgumentException("ThingsBoard base URL must not be null");
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Authenticated GET. A 401 triggers one token refresh and one retry; any other
     * failure, or a second failure, is raised as {@link ThingsboardApiException}.
     */
    protected String getResponseBody(URI uri) {
        logRequest(uri);
        trackRequest(uri);

        try {
            return executeGet(uri);
        } catch (HttpClientErrorException.Unauthorized e) {
            logger.warn("Access token rejected for {}, refreshing and retrying once", uri.getPath());
            tokenRefreshes++;
            tokenProvider.refresh();
            try {
                return executeGet(uri);
            } catch (RestClientResponseException retryFailure) {
                throw responseFailure(uri, retryFailure);
            } catch (RestClientException retryFailure) {
                requestLogger.error("Request failed after token refresh: {} - {}", uri, retryFailure.getMessage());
                throw new ThingsboardApiException("Request failed after token refresh: " + uri.getPath(), retryFailure);
            }
        } catch (RestClientResponseException e) {
            throw responseFailure(uri, e);
        } catch (RestClientException e) {
            requestLogger.error("Request failed: {} - {}", uri, e.getMessage());
            throw new ThingsboardApiException("Request failed: " + uri.getPath(), e);
        }
    }

    private String executeGet(URI uri) {
        long startTime = System.currentTimeMillis();
        String response = restClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .header(AUTH_HEADER, "Bearer " + tokenProvider.getToken())
                .retrieve()
                .body(String.class);
        long endTime = System.currentTimeMillis();

        if (debugLevel >= 2) {
            requestLogger.debug("Response time: {} ms for URL: {}", (endTime - startTime), uri);
        }
        return response;
    }

    private ThingsboardApiException responseFailure(URI uri, RestClientResponseException e) {
        String body = e.getResponseBodyAsString();
        if (body.length() > 500) {
            body = body.substring(0, 500);
        }
        requestLogger.error("[TB ERROR {}] {} - {}", e.getStatusCode().value(), uri.getPath(), body);
        return new ThingsboardApiException("ThingsBoard responded " + e.getStatusCode().value()
                + " for " + uri.getPath(), e);
    }

    /**
     * Generic method to parse API responses
     */
    protected <T> T parseResponse(String responseBody, Class<T> responseType) {
        try {
            return objectMapper.readValue(responseBody, responseType);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON response: {}", e.getMessage());
            throw new ThingsboardApiException("Failed to parse JSON response", e);
        }
    }

    private void logRequest(URI uri) {
        if (debugLevel <= 0) return;

        AtomicInteger count = endpointCounts.computeIfAbsent(uri.getPath(), k -> new AtomicInteger(0));
        requestLogger.debug("Request #{}: {}", count.get() + 1, uri.getPath());

        if (debugLevel >= 2) {
            requestLogger.debug("Full URL: {}", uri);
        }
    }

    private synchronized void trackRequest(URI uri) {
        endpointCounts.computeIfAbsent(uri.getPath(), k -> new AtomicInteger(0)).incrementAndGet();
        totalRequests++;

        if (totalRequests % 10 == 0) {
            logRequestStats();
        }
    }

    public void logRequestStats() {
        logger.debug("API request stats: {} total, {} endpoints, {} token refreshes",
                totalRequests, endpointCounts.size(), tokenRefreshes);
    }

    public void setDebugLevel(int level) {
        this.debugLevel = Math.max(0, Math.min(3, level));
        logger.debug("Debug level set to {}", this.debugLevel);
    }

    public Map<String, Object> getApiStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalRequests", totalRequests);
        stats.put("tokenRefreshes", tokenRefreshes);

        Map<String, Integer> endpointStats = new HashMap<>();
        endpointCounts.forEach((endpoint, count) -> endpointStats.put(endpoint, count.get()));
        stats.put("endpointStats", endpointStats);

        return stats;
    }

    public static class ThingsboardApiException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public ThingsboardApiException(String message) {
            super(message);
        }

        public ThingsboardApiException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
