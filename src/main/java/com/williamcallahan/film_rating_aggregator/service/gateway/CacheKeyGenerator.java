package com.williamcallahan.film_rating_aggregator.service.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.film_rating_aggregator.util.HashUtils;
import org.springframework.http.HttpMethod;

import java.util.Map;
import java.util.TreeMap;

/**
 * Builds deterministic response-cache keys: {@code api_cache:} followed by the MD5 hex of
 * {@code METHOD:baseUrl:endpoint:{params as JSON with sorted keys}}.
 */
public final class CacheKeyGenerator {

    private CacheKeyGenerator() {
    }

    public static String generate(ObjectMapper objectMapper, HttpMethod method, String baseUrl,
                                  String endpoint, Map<String, ?> params) {
        Map<String, Object> sorted = new TreeMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (v != null) {
                    sorted.put(k, v);
                }
            });
        }
        String paramsJson;
        try {
            paramsJson = objectMapper.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request parameters are not serializable", e);
        }
        String raw = method.name() + ":" + baseUrl + ":" + endpoint + ":" + paramsJson;
        return ApiResponseCache.KEY_PREFIX + HashUtils.md5Hex(raw);
    }
}
