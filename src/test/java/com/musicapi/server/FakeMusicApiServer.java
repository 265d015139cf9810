package com.musicapi.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * HTTP server imitating the parts of the music service the tests talk to.
 * Uses the JDK's built-in com.sun.net.httpserver.HttpServer.
 *
 * <p>Routes, all under {@code /v1}:
 * <ul>
 *   <li>{@code GET /me/tracks}: offset-paged saved tracks {@code track-0 .. track-(n-1)}</li>
 *   <li>{@code PUT|DELETE /me/tracks?ids=}: accepted and recorded</li>
 *   <li>{@code GET /me/tracks/contains?ids=}: {@code track-i} is saved when i is even</li>
 *   <li>{@code GET /me/following?type=artist}: cursor-paged artists wrapped under {@code "artists"}</li>
 *   <li>{@code GET /flaky}: answers 500 a configured number of times, then 200</li>
 *   <li>{@code GET /limited}: answers 429 with {@code Retry-After: 0} once, then 200</li>
 * </ul>
 * Anything else gets a 404 error object; a wrong bearer token gets a 401.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (FakeMusicApiServer server = FakeMusicApiServer.create(120, 5)) {
 *     server.start();
 *     ClientOptions options = ClientOptions.defaults().withBaseUrl(server.getBaseUrl());
 *     // Use options...
 * }
 * }</pre>
 */
public class FakeMusicApiServer implements AutoCloseable {

    public static final String TOKEN = "test-token";

    private final HttpServer server;
    private final ExecutorService executor;
    private final int port;
    private final int savedTracks;
    private final int followedArtists;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> requests = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger flakyFailuresLeft = new AtomicInteger();
    private final AtomicInteger rateLimitsLeft = new AtomicInteger(1);

    /**
     * Creates a server with the given library sizes.
     *
     * @param savedTracks number of saved tracks
     * @param followedArtists number of followed artists
     * @return configured server (not yet started)
     */
    public static FakeMusicApiServer create(int savedTracks, int followedArtists) {
        try {
            return new FakeMusicApiServer(savedTracks, followedArtists);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create server", e);
        }
    }

    private FakeMusicApiServer(int savedTracks, int followedArtists) throws IOException {
        this.savedTracks = savedTracks;
        this.followedArtists = followedArtists;
        this.server = HttpServer.create(new InetSocketAddress(0), 0);
        this.port = server.getAddress().getPort();

        server.createContext("/v1", new ApiHandler());
        this.executor = Executors.newSingleThreadExecutor();
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
    }

    /**
     * Returns the base URL clients should be configured with, {@code /v1} included.
     */
    public String getBaseUrl() {
        return "http://localhost:" + port + "/v1";
    }

    /**
     * Makes {@code /flaky} fail with a 500 the next {@code times} requests.
     */
    public FakeMusicApiServer failFlaky(int times) {
        flakyFailuresLeft.set(times);
        return this;
    }

    /**
     * Returns every request received as {@code "METHOD /path?query"}, in order.
     */
    public List<String> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public long requestCount(String method, String pathPrefix) {
        return requests().stream()
                .filter(request -> request.startsWith(method + " " + pathPrefix))
                .count();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private class ApiHandler implements HttpHandler {

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            URI uri = exchange.getRequestURI();
            String method = exchange.getRequestMethod();
            String path = uri.getPath().substring("/v1".length());
            requests.add(method + " " + uri.getPath() + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : ""));

            try {
                if (!("Bearer " + TOKEN).equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
                    sendError(exchange, 401, "Invalid access token");
                    return;
                }

                Map<String, String> params = parseQueryParams(uri);
                switch (method + " " + path) {
                    case "GET /me/tracks":
                        sendJson(exchange, 200, savedTracksPage(params));
                        break;
                    case "PUT /me/tracks":
                    case "DELETE /me/tracks":
                        sendEmpty(exchange);
                        break;
                    case "GET /me/tracks/contains":
                        sendJson(exchange, 200, containsTracks(params));
                        break;
                    case "GET /me/following":
                        sendJson(exchange, 200, followedArtistsPage(params));
                        break;
                    case "GET /flaky":
                        if (flakyFailuresLeft.getAndDecrement() > 0) {
                            sendError(exchange, 500, "Temporarily unavailable");
                        } else {
                            sendJson(exchange, 200, "{\"ok\":true}");
                        }
                        break;
                    case "GET /limited":
                        if (rateLimitsLeft.getAndDecrement() > 0) {
                            exchange.getResponseHeaders().set("Retry-After", "0");
                            sendError(exchange, 429, "API rate limit exceeded");
                        } else {
                            sendJson(exchange, 200, "{\"ok\":true}");
                        }
                        break;
                    default:
                        sendError(exchange, 404, "Service not found");
                }
            } catch (Exception e) {
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            }
        }

        private String savedTracksPage(Map<String, String> params) throws IOException {
            int limit = Integer.parseInt(params.getOrDefault("limit", "20"));
            int offset = Integer.parseInt(params.getOrDefault("offset", "0"));
            int end = Math.min(offset + limit, savedTracks);

            List<Map<String, Object>> items = new ArrayList<>();
            for (int i = offset; i < end; i++) {
                Map<String, Object> track = new LinkedHashMap<>();
                track.put("id", "track-" + i);
                track.put("name", "Track " + i);
                track.put("uri", "spotify:track:track-" + i);
                track.put("duration_ms", 180_000 + i);
                track.put("artists", List.of(Map.of("id", "artist-" + (i % 3), "name", "Artist " + (i % 3))));

                Map<String, Object> saved = new LinkedHashMap<>();
                saved.put("added_at", "2020-01-01T00:00:00Z");
                saved.put("track", track);
                items.add(saved);
            }

            Map<String, Object> page = new LinkedHashMap<>();
            page.put("href", tracksUrl(offset, limit));
            page.put("items", items);
            page.put("limit", limit);
            page.put("next", end < savedTracks ? tracksUrl(end, limit) : null);
            page.put("offset", offset);
            page.put("previous", offset > 0 ? tracksUrl(Math.max(0, offset - limit), limit) : null);
            page.put("total", savedTracks);
            return objectMapper.writeValueAsString(page);
        }

        private String containsTracks(Map<String, String> params) throws IOException {
            List<Boolean> flags = Arrays.stream(params.getOrDefault("ids", "").split(","))
                    .map(id -> id.startsWith("track-") && Integer.parseInt(id.substring(6)) % 2 == 0)
                    .collect(Collectors.toList());
            return objectMapper.writeValueAsString(flags);
        }

        private String followedArtistsPage(Map<String, String> params) throws IOException {
            int limit = Integer.parseInt(params.getOrDefault("limit", "20"));
            String after = params.get("after");
            int start = after == null ? 0 : Integer.parseInt(after.substring("artist-".length())) + 1;
            int end = Math.min(start + limit, followedArtists);

            List<Map<String, Object>> items = new ArrayList<>();
            for (int i = start; i < end; i++) {
                Map<String, Object> artist = new LinkedHashMap<>();
                artist.put("id", "artist-" + i);
                artist.put("name", "Artist " + i);
                artist.put("uri", "spotify:artist:artist-" + i);
                artist.put("genres", List.of("rock"));
                items.add(artist);
            }

            String lastId = end > start ? "artist-" + (end - 1) : null;
            Map<String, Object> cursors = new HashMap<>();
            cursors.put("after", end < followedArtists ? lastId : null);

            Map<String, Object> page = new LinkedHashMap<>();
            page.put("href", followingUrl(limit, after));
            page.put("items", items);
            page.put("limit", limit);
            page.put("next", end < followedArtists ? followingUrl(limit, lastId) : null);
            page.put("cursors", cursors);
            page.put("total", followedArtists);
            return objectMapper.writeValueAsString(Map.of("artists", page));
        }

        private String tracksUrl(int offset, int limit) {
            return getBaseUrl() + "/me/tracks?offset=" + offset + "&limit=" + limit;
        }

        private String followingUrl(int limit, String after) {
            return getBaseUrl() + "/me/following?type=artist&limit=" + limit + (after != null ? "&after=" + after : "");
        }

        private Map<String, String> parseQueryParams(URI uri) {
            Map<String, String> params = new HashMap<>();
            String query = uri.getRawQuery();
            if (query != null) {
                for (String param : query.split("&")) {
                    String[] pair = param.split("=");
                    if (pair.length == 2) {
                        params.put(pair[0], URLDecoder.decode(pair[1], StandardCharsets.UTF_8));
                    }
                }
            }
            return params;
        }

        private void sendJson(HttpExchange exchange, int statusCode, String json) throws IOException {
            byte[] response = json.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(statusCode, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        }

        private void sendEmpty(HttpExchange exchange) throws IOException {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        }

        private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("status", statusCode);
            error.put("message", message);
            sendJson(exchange, statusCode, objectMapper.writeValueAsString(Map.of("error", error)));
        }
    }
}
