package com.musicapi.client;

import com.musicapi.MusicApiException.RemoteRequestFailedException;

/**
 * Issues authenticated requests and returns raw response bodies.
 *
 * <p>Implementations own authentication headers and retry policy. Callers such as
 * page traversal and bulk chunking add neither.
 */
public interface RequestExecutor {

    /**
     * Performs a GET request.
     *
     * @param url absolute URL, or a path relative to the configured base URL
     * @return the response body
     * @throws RemoteRequestFailedException if the service rejects the request or cannot be reached
     */
    String get(String url);

    /**
     * Performs a PUT request with an optional JSON body.
     *
     * @param url absolute URL, or a path relative to the configured base URL
     * @param body JSON body, or null to send none
     * @return the response body, empty when the service returns none
     */
    String put(String url, String body);

    /**
     * Performs a DELETE request.
     *
     * @param url absolute URL, or a path relative to the configured base URL
     * @return the response body, empty when the service returns none
     */
    String delete(String url);
}
