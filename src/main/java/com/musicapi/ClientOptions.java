package com.musicapi;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Client-wide settings.
 *
 * <p>Example usage:
 * <pre>{@code
 * ClientOptions options = ClientOptions.defaults()
 *     .withAllowBulkRequests(true)
 *     .withDefaultLimit(20);
 * }</pre>
 *
 * @param baseUrl prefix for relative endpoint paths
 * @param defaultLimit page size sent when an endpoint caller passes none, or null to let the service decide
 * @param allowBulkRequests whether identifier lists larger than one request allows are split into chunks
 * @param connectTimeout HTTP connect timeout
 * @param requestTimeout timeout of a single HTTP exchange
 * @param retry retry policy of the HTTP executor
 */
public record ClientOptions(
        String baseUrl,
        Integer defaultLimit,
        boolean allowBulkRequests,
        Duration connectTimeout,
        Duration requestTimeout,
        RetryConfig retry
) {
    public static final String DEFAULT_BASE_URL = "https://api.spotify.com/v1";

    public ClientOptions {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(retry, "retry");
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    public static ClientOptions defaults() {
        return new ClientOptions(
                DEFAULT_BASE_URL,
                50,
                false,
                Duration.ofSeconds(10),
                Duration.ofSeconds(30),
                RetryConfig.defaults()
        );
    }

    /**
     * Reads options from {@code musicapi.*} keys, falling back to {@link #defaults()}
     * for every key that is absent.
     */
    public static ClientOptions fromProperties(Properties properties) {
        ClientOptions defaults = defaults();
        RetryConfig retry = new RetryConfig(
                intProperty(properties, "musicapi.retry.max-attempts", defaults.retry().maxRetries()),
                longProperty(properties, "musicapi.retry.backoff-ms", defaults.retry().backoffMillis()),
                longProperty(properties, "musicapi.retry.max-backoff-ms", defaults.retry().maxBackoffMillis())
        );
        String limit = properties.getProperty("musicapi.default-limit");
        return new ClientOptions(
                properties.getProperty("musicapi.base-url", defaults.baseUrl()),
                limit == null ? defaults.defaultLimit() : (limit.isBlank() ? null : Integer.valueOf(limit.trim())),
                Boolean.parseBoolean(properties.getProperty("musicapi.allow-bulk-requests",
                        String.valueOf(defaults.allowBulkRequests()))),
                Duration.ofMillis(longProperty(properties, "musicapi.connect-timeout-ms",
                        defaults.connectTimeout().toMillis())),
                Duration.ofMillis(longProperty(properties, "musicapi.request-timeout-ms",
                        defaults.requestTimeout().toMillis())),
                retry
        );
    }

    public ClientOptions withBaseUrl(String baseUrl) {
        return new ClientOptions(baseUrl, defaultLimit, allowBulkRequests, connectTimeout, requestTimeout, retry);
    }

    public ClientOptions withDefaultLimit(Integer defaultLimit) {
        return new ClientOptions(baseUrl, defaultLimit, allowBulkRequests, connectTimeout, requestTimeout, retry);
    }

    public ClientOptions withAllowBulkRequests(boolean allowBulkRequests) {
        return new ClientOptions(baseUrl, defaultLimit, allowBulkRequests, connectTimeout, requestTimeout, retry);
    }

    public ClientOptions withRetry(RetryConfig retry) {
        return new ClientOptions(baseUrl, defaultLimit, allowBulkRequests, connectTimeout, requestTimeout, retry);
    }

    private static int intProperty(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        return value == null ? fallback : Integer.parseInt(value.trim());
    }

    private static long longProperty(Properties properties, String key, long fallback) {
        String value = properties.getProperty(key);
        return value == null ? fallback : Long.parseLong(value.trim());
    }

    /**
     * Configuration for retry behavior.
     */
    public record RetryConfig(
            int maxRetries,
            long backoffMillis,
            long maxBackoffMillis
    ) {
        public RetryConfig {
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
            }
        }

        public static RetryConfig defaults() {
            return new RetryConfig(3, 100, 5000);
        }

        public static RetryConfig noRetry() {
            return new RetryConfig(1, 0, 0);
        }
    }
}
