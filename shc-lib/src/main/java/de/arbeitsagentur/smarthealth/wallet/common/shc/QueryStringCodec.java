/*
 * Copyright 2026 Bundesagentur für Arbeit
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.arbeitsagentur.smarthealth.wallet.common.shc;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Percent-encoded {@code key=value&key=value} query strings.
 */
public final class QueryStringCodec {

    private QueryStringCodec() {
    }

    public static String encode(Map<String, String> parameters) {
        StringJoiner query = new StringJoiner("&");
        parameters.forEach((key, value) -> {
            if (value != null) {
                query.add(encodeComponent(key) + "=" + encodeComponent(value));
            }
        });
        return query.toString();
    }

    /**
     * Splits a query string into its decoded parameters, keeping their order.
     *
     * @throws MalformedRequestException on duplicate keys or undecodable escapes
     */
    public static Map<String, String> decode(String query) {
        Map<String, String> parameters = new LinkedHashMap<>();
        if (query == null || query.isBlank()) {
            return parameters;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] parts = pair.split("=", 2);
            String key = decodeComponent(parts[0]);
            String value = parts.length == 2 ? decodeComponent(parts[1]) : "";
            if (parameters.putIfAbsent(key, value) != null) {
                throw new MalformedRequestException("Duplicate request parameter '%s'".formatted(key));
            }
        }
        return parameters;
    }

    /**
     * Returns the part after the first {@code ?} for URLs, the input itself otherwise.
     */
    public static String queryOf(String urlOrQuery) {
        if (urlOrQuery == null) {
            return null;
        }
        int separator = urlOrQuery.indexOf('?');
        String query = separator >= 0 ? urlOrQuery.substring(separator + 1) : urlOrQuery;
        int fragment = query.indexOf('#');
        return fragment >= 0 ? query.substring(0, fragment) : query;
    }

    static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String decodeComponent(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedRequestException("Invalid percent-encoding in request parameter", e);
        }
    }
}
