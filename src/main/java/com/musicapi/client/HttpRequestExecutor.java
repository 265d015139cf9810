package com.musicapi.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicapi.ClientOptions;
import com.musicapi.ClientOptions.RetryConfig;
import com.musicapi.MusicApiException.RemoteRequestFailedException;
import com.musicapi.auth.AccessToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link RequestExecutor} backed by the JDK {@link HttpClient}.
 * Includes retry logic with exponential backoff for resilience.
 *
 * <p>Transport failures, 5xx responses and 429 responses are retried up to
 * {@link RetryConfig#maxRetries()} attempts. Other 4xx responses fail immediately.
 * An interrupt while waiting is treated as cancellation and never retried.
 *
 * <p>Example usage:
 * <pre>{@code
 * RequestExecutor executor = new HttpRequestExecutor(
 *     ClientOptions.defaults(),
 *     () -> AccessToken.of("BQD...", "user-library-read")
 * );
 * String body = executor.get("/me/tracks?limit=20");
 * }</pre>
 */
public class HttpRequestExecutor implements RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ClientOptions options;
    private final Supplier<AccessToken> tokenSupplier;

    /**
     * Creates an executor with a fresh {@link HttpClient}.
     *
     * @param options base URL, timeouts and retry policy
     * @param tokenSupplier supplies the current token for every request
     */
    public HttpRequestExecutor(ClientOptions options, Supplier<AccessToken> tokenSupplier) {
        this(
                HttpClient.newBuilder()
                        .connectTimeout(options.connectTimeout())
                        .build(),
                new ObjectMapper(),
                options,
                tokenSupplier
        );
    }

    /**
     * Creates an executor with a pre-configured HttpClient and ObjectMapper.
     */
    public HttpRequestExecutor(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            ClientOptions options,
            Supplier<AccessToken> tokenSupplier
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.options = Objects.requireNonNull(options, "options");
        this.tokenSupplier = Objects.requireNonNull(tokenSupplier, "tokenSupplier");
    }

    @Override
    public String get(String url) {
        return execute("GET", url, HttpRequest.BodyPublishers.noBody());
    }

    @Override
    public String put(String url, String body) {
        return execute("PUT", url, body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body));
    }

    @Override
    public String delete(String url) {
        return execute("DELETE", url, HttpRequest.BodyPublishers.noBody());
    }

    /**
     * Resolves a path against the base URL. Absolute URLs, such as the
     * next/previous links the service returns, are used as they are.
     */
    String resolve(String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        return options.baseUrl() + (url.startsWith("/") ? url : "/" + url);
    }

    private String execute(String method, String url, HttpRequest.BodyPublisher body) {
        URI uri = URI.create(resolve(url));
        return executeWithRetry(method, uri, () -> doExecute(method, uri, body));
    }

    private String doExecute(String method, URI uri, HttpRequest.BodyPublisher body)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + tokenSupplier.get().value())
                .timeout(options.requestTimeout())
                .method(method, body);
        if (!"GET".equals(method)) {
            builder.header("Content-Type", "application/json");
        }

        log.debug("{} {}", method, uri);
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

        int statusCode = response.statusCode();
        if (statusCode == 429) {
            // Rate limited - extract retry-after header if present
            String retryAfter = response.headers()
                    .firstValue("Retry-After")
                    .orElse("1");
            throw new RateLimitedException(parseRetryAfter(retryAfter));
        }

        if (statusCode >= 500) {
            throw new ServerErrorException(statusCode, errorMessage(statusCode, response.body()));
        }

        if (statusCode >= 400) {
            throw new RemoteRequestFailedException(statusCode, errorMessage(statusCode, response.body()));
        }

        return response.body() == null ? "" : response.body();
    }

    private String executeWithRetry(String method, URI uri, RetryableSupplier<String> action) {
        RetryConfig retryConfig = options.retry();
        int attempts = 0;
        Exception lastException = null;

        while (attempts < retryConfig.maxRetries()) {
            try {
                return action.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteRequestFailedException("Request cancelled: " + method + " " + uri, e);
            } catch (RateLimitedException e) {
                lastException = e;
                attempts++;
                if (attempts < retryConfig.maxRetries()) {
                    log.warn("Rate limited on {} {}, retrying in {}s", method, uri, e.getRetryAfterSeconds());
                    sleep(e.getRetryAfterSeconds() * 1000);
                }
            } catch (IOException e) {
                lastException = e;
                attempts++;
                if (attempts < retryConfig.maxRetries()) {
                    long backoffMs = retryConfig.backoffMillis() * (1L << (attempts - 1));
                    backoffMs = Math.min(backoffMs, retryConfig.maxBackoffMillis());
                    log.warn("{} {} failed (attempt {}/{}): {}; retrying in {}ms",
                            method, uri, attempts, retryConfig.maxRetries(), e.getMessage(), backoffMs);
                    sleep(backoffMs);
                }
            }
        }

        if (lastException instanceof ServerErrorException serverError) {
            throw new RemoteRequestFailedException(serverError.getStatusCode(), serverError.getMessage());
        }
        if (lastException instanceof RateLimitedException) {
            throw new RemoteRequestFailedException(429, lastException.getMessage());
        }
        throw new RemoteRequestFailedException(
                method + " " + uri + " failed after " + attempts + " attempts",
                lastException
        );
    }

    private String errorMessage(int statusCode, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(body).path("error");
                if (error.isObject() && error.hasNonNull("message")) {
                    return "Received status code " + statusCode + ". Error cause: " + error.get("message").asText();
                }
                if (error.isTextual()) {
                    return "Received status code " + statusCode + ". Error cause: " + error.asText();
                }
            } catch (IOException e) {
                log.debug("Error body is not JSON: {}", body);
            }
        }
        return "Received status code " + statusCode;
    }

    private static long parseRetryAfter(String retryAfter) {
        try {
            return Math.max(0, Long.parseLong(retryAfter.trim()));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteRequestFailedException("Interrupted during backoff", e);
        }
    }

    @FunctionalInterface
    private interface RetryableSupplier<T> {
        T get() throws IOException, InterruptedException;
    }

    /**
     * Retryable 5xx response.
     */
    static class ServerErrorException extends IOException {
        private final int statusCode;

        ServerErrorException(int statusCode, String message) {
            super(message);
            this.statusCode = statusCode;
        }

        int getStatusCode() {
            return statusCode;
        }
    }

    /**
     * Exception thrown when rate limited (HTTP 429).
     */
    static class RateLimitedException extends IOException {
        private final long retryAfterSeconds;

        RateLimitedException(long retryAfterSeconds) {
            super("Rate limited. Retry after " + retryAfterSeconds + " seconds");
            this.retryAfterSeconds = retryAfterSeconds;
        }

        long getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
