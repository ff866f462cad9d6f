package com.linlay.agentclient.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-tool JSON buffer; yields input only once the whole buffer is one complete object.
 */
public class ToolInputAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ToolInputAccumulator.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final int maxChars;

    private final Map<String, StringBuilder> buffers = new HashMap<>();
    private final Set<String> abandonedIds = new HashSet<>();

    /**
     * @param maxChars upper bound for one buffer; {@code 0} or less means unbounded
     */
    public ToolInputAccumulator(ObjectMapper objectMapper, int maxChars) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.maxChars = Math.max(maxChars, 0);
    }

    public void reset(String toolId) {
        buffers.put(toolId, new StringBuilder());
        abandonedIds.remove(toolId);
    }

    /**
     * Appends a fragment and returns the parsed input when the buffer is complete JSON.
     */
    public Optional<Map<String, Object>> append(String toolId, String fragment) {
        if (abandonedIds.contains(toolId)) {
            return Optional.empty();
        }
        StringBuilder buffer = buffers.computeIfAbsent(toolId, k -> new StringBuilder());
        String piece = fragment == null ? "" : fragment;
        if (maxChars > 0 && buffer.length() + piece.length() > maxChars) {
            log.warn("tool input for {} exceeded {} chars, ignoring further fragments until completion", toolId, maxChars);
            buffers.remove(toolId);
            abandonedIds.add(toolId);
            return Optional.empty();
        }
        buffer.append(piece);
        return tryParse(buffer.toString());
    }

    public String buffered(String toolId) {
        StringBuilder buffer = buffers.get(toolId);
        return buffer == null ? null : buffer.toString();
    }

    public boolean isAbandoned(String toolId) {
        return abandonedIds.contains(toolId);
    }

    public void remove(String toolId) {
        buffers.remove(toolId);
        abandonedIds.remove(toolId);
    }

    public void clear() {
        buffers.clear();
        abandonedIds.clear();
    }

    public int size() {
        return buffers.size();
    }

    private Optional<Map<String, Object>> tryParse(String json) {
        if (json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = strictReader.readTree(json);
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.convertValue(node, MAP_TYPE));
        } catch (JsonProcessingException ex) {
            // incomplete so far; wait for more fragments
            return Optional.empty();
        }
    }
}
