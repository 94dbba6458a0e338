package com.tbpivot.clients;

import java.util.Map;

import org.springframework.web.client.RestClient;

import com.tbpivot.config.PivotExportConfig;

/**
 * Main entry point for ThingsBoard API operations.
 * Provides access to specialized clients for different API categories.
 */
public class ThingsboardApiClient {

    private final ThingsboardAuthClient auth;
    private final ThingsboardApiBase apiBase;
    private final ThingsboardTelemetryClient telemetry;

    public ThingsboardApiClient(String baseUrl, String username, String password) {
        this(baseUrl, username, password, ThingsboardApiBase.createRestClient());
    }

    public ThingsboardApiClient(String baseUrl, String username, String password, RestClient restClient) {
        this.auth = new ThingsboardAuthClient(baseUrl, username, password, restClient);
        this.apiBase = new ThingsboardApiBase(baseUrl, auth, restClient);
        this.telemetry = new ThingsboardTelemetryClient(apiBase);
    }

    public static ThingsboardApiClient fromConfig(PivotExportConfig config) {
        config.validateConfiguration();
        return new ThingsboardApiClient(config.getTbUrl(), config.getTbUsername(), config.getTbPassword());
    }

    /**
     * Get the timeseries telemetry client
     */
    public ThingsboardTelemetryClient telemetry() {
        return telemetry;
    }

    public ThingsboardAuthClient auth() {
        return auth;
    }

    public void setDebugLevel(int level) {
        apiBase.setDebugLevel(level);
    }

    public Map<String, Object> getApiStats() {
        return apiBase.getApiStats();
    }
}
