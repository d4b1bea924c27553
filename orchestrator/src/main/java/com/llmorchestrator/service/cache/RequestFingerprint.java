package com.llmorchestrator.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.llmorchestrator.service.LlmOperation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Cache keys of the form {@code llm:{operation}:{provider}:{model}:{sha256}}, where the hash
 * covers the canonical JSON of the fully resolved request.
 */
public class RequestFingerprint {

    public static final String KEY_PREFIX = "llm:";
    private static final Set<String> EXCLUDED_FIELDS = Set.of("stream", "user");

    private final ObjectMapper canonicalMapper;

    public RequestFingerprint(ObjectMapper objectMapper) {
        this.canonicalMapper = JsonMapper.builder(objectMapper.getFactory().copy())
                .findAndAddModules()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    public String key(LlmOperation operation, String providerId, String model, Map<String, Object> request) {
        return prefix(operation, providerId) + (model != null ? model : "default") + ":" + hash(request);
    }

    public static String prefix(LlmOperation operation, String providerId) {
        return KEY_PREFIX + operation.getValue() + ":" + providerId + ":";
    }

    String hash(Map<String, Object> request) {
        Map<String, Object> canonical = new TreeMap<>(request);
        canonical.keySet().removeAll(EXCLUDED_FIELDS);
        try {
            byte[] json = canonicalMapper.writeValueAsBytes(canonical);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Request cannot be serialized for fingerprinting", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    String canonicalJson(Map<String, Object> request) throws JsonProcessingException {
        Map<String, Object> canonical = new TreeMap<>(request);
        canonical.keySet().removeAll(EXCLUDED_FIELDS);
        return canonicalMapper.writeValueAsString(canonical);
    }
}
