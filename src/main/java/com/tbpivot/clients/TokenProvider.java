package com.tbpivot.clients;

/**
 * Supplies the JWT sent with every ThingsBoard request.
 */
public interface TokenProvider {

    /**
     * Current access token, obtaining one first if none is cached
     */
    String getToken();

    /**
     * Discard the cached token and obtain a fresh one
     */
    String refresh();
}
