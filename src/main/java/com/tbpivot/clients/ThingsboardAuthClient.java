package com.tbpivot.clients;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tbpivot.clients.ThingsboardApiBase.ThingsboardApiException;

/**
 * Obtains JWTs from ThingsBoard's login endpoint and caches the current one in memory.
 */
public class ThingsboardAuthClient implements TokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(ThingsboardAuthClient.class);

    public static final String LOGIN_PATH = "/api/auth/login";

    private final String baseUrl;
    private final String username;
    private final String password;
    private final RestClient restClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private String token;
    private String refreshToken;

    public ThingsboardAuthClient(String baseUrl, String username, String password, RestClient restClient) {
        this.baseUrl = ThingsboardApiBase.stripTrailingSlash(baseUrl);
        this.username = username;
        this.password = password;
        this.restClient = restClient;
    }

    @Override
    public synchronized String getToken() {
        if (token == null) {
            login();
        }
        return token;
    }

    @Override
    public synchronized String refresh() {
        logger.debug("Discarding cached ThingsBoard token for {}", username);
        token = null;
        refreshToken = null;
        login();
        return token;
    }

    /**
     * Refresh token from the last login, kept for callers that want it
     */
    public synchronized String getRefreshToken() {
        return refreshToken;
    }

    private void login() {
        if (username == null || password == null) {
            throw new ThingsboardApiException("ThingsBoard credentials are not configured");
        }

        URI uri = UriComponentsBuilder.fromUriString(baseUrl).path(LOGIN_PATH).build().toUri();
        Map<String, String> credentials = new LinkedHashMap<>();
        credentials.put("username", username);
        credentials.put("password", password);

        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(credentials))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            logger.error("ThingsBoard login failed for {} with status {}", username, e.getStatusCode().value());
            throw new ThingsboardApiException("ThingsBoard login failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException | JsonProcessingException e) {
            logger.error("ThingsBoard login failed for {}: {}", username, e.getMessage());
            throw new ThingsboardApiException("ThingsBoard login failed", e);
        }

        Map<?, ?> response;
        try {
            response = objectMapper.readValue(responseBody == null ? "{}" : responseBody, Map.class);
        } catch (JsonProcessingException e) {
            throw new ThingsboardApiException("Failed to parse ThingsBoard login response", e);
        }

        Object newToken = response.get("token");
        if (newToken == null) {
            throw new ThingsboardApiException("ThingsBoard login response did not contain a token");
        }
        this.token = newToken.toString();
        Object newRefreshToken = response.get("refreshToken");
        this.refreshToken = newRefreshToken == null ? null : newRefreshToken.toString();

        logger.info("Obtained ThingsBoard access token for {}", username);
    }
}
