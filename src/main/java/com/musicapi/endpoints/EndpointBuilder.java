package com.musicapi.endpoints;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds a relative endpoint URL with query parameters. Null values are skipped
 * so optional parameters can be passed through unconditionally.
 */
public class EndpointBuilder {

    private final String path;
    private final Map<String, String> params = new LinkedHashMap<>();

    public EndpointBuilder(String path) {
        this.path = path;
    }

    public EndpointBuilder with(String key, Object value) {
        if (value != null) {
            params.put(key, encode(value.toString()));
        }
        return this;
    }

    /**
     * Adds a comma separated id list, encoding each id on its own.
     */
    public EndpointBuilder withIds(String key, List<String> ids) {
        params.put(key, ids.stream().map(EndpointBuilder::encode).collect(Collectors.joining(",")));
        return this;
    }

    @Override
    public String toString() {
        if (params.isEmpty()) {
            return path;
        }

        StringBuilder urlBuilder = new StringBuilder(path);
        urlBuilder.append(path.contains("?") ? "&" : "?");

        boolean first = true;
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (!first) {
                urlBuilder.append("&");
            }
            urlBuilder.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return urlBuilder.toString();
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
