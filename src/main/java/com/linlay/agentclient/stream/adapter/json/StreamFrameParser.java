package com.linlay.agentclient.stream.adapter.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentclient.stream.model.StreamFrame;
import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

import static com.linlay.agentclient.stream.adapter.json.ContentBlockParser.optionalBoolean;
import static com.linlay.agentclient.stream.adapter.json.ContentBlockParser.optionalText;

/**
 * Decodes the logical frame shapes from already-received JSON text.
 * Unknown frame types become {@link StreamFrame.Unknown}; malformed input yields null.
 */
public class StreamFrameParser {

    private static final Logger log = LoggerFactory.getLogger(StreamFrameParser.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ContentBlockParser blockParser;

    public StreamFrameParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.blockParser = new ContentBlockParser(objectMapper);
    }

    public StreamFrame parseOrNull(String rawFrame) {
        if (rawFrame == null || rawFrame.isBlank()) {
            return null;
        }
        try {
            return parseOrNull(objectMapper.readTree(rawFrame));
        } catch (Exception ex) {
            log.warn("Failed to parse stream frame: {}", rawFrame, ex);
            return null;
        }
    }

    public StreamFrame parseOrNull(JsonNode root) {
        if (root == null || !root.isObject()) {
            return null;
        }
        String type = optionalText(root.get("type"));
        try {
            return parse(type, root);
        } catch (IllegalArgumentException ex) {
            log.warn("Invalid {} frame: {}", type, ex.getMessage());
            return null;
        }
    }

    private StreamFrame parse(String type, JsonNode root) {
        if (type == null) {
            return new StreamFrame.Unknown(null, objectMapper.convertValue(root, MAP_TYPE));
        }
        switch (type) {
            case "message_start":
                return new StreamFrame.MessageStart(
                        optionalText(root.get("messageId")),
                        blockParser.parseList(root.get("content"))
                );
            case "text_delta":
                return new StreamFrame.TextDelta(textOrEmpty(root.get("text")));
            case "thinking_delta":
                return new StreamFrame.ThinkingDelta(textOrEmpty(root.get("thinking")));
            case "tool_start":
                return new StreamFrame.ToolStart(
                        optionalText(root.get("toolId")),
                        optionalText(root.get("toolName")),
                        optionalText(root.get("toolType"))
                );
            case "tool_progress":
                return new StreamFrame.ToolProgress(
                        optionalText(root.get("toolId")),
                        optionalText(root.get("status")),
                        optionalText(root.get("outputPreview"))
                );
            case "tool_complete":
                return new StreamFrame.ToolComplete(
                        optionalText(root.get("toolId")),
                        blockParser.parseOrNull(root.get("result"))
                );
            case "message_complete":
                return new StreamFrame.MessageComplete(parseUsage(root.get("usage")));
            case "user":
                return new StreamFrame.User(
                        blockParser.parseList(messageContent(root)),
                        optionalBoolean(root.get("isReplay"))
                );
            case "assistant":
                return new StreamFrame.Assistant(blockParser.parseList(messageContent(root)));
            case "error":
                return new StreamFrame.Error(optionalText(root.get("message")));
            default:
                return new StreamFrame.Unknown(type, objectMapper.convertValue(root, MAP_TYPE));
        }
    }

    public List<ContentBlock> parseContent(JsonNode content) {
        return blockParser.parseList(content);
    }

    private JsonNode messageContent(JsonNode root) {
        JsonNode content = root.get("content");
        if (content != null && content.isArray()) {
            return content;
        }
        return root.path("message").get("content");
    }

    private TokenUsage parseUsage(JsonNode usageNode) {
        if (usageNode == null || !usageNode.isObject()) {
            return null;
        }
        JsonNode cached = usageNode.get("cachedInputTokens");
        return new TokenUsage(
                usageNode.path("inputTokens").asLong(0),
                usageNode.path("outputTokens").asLong(0),
                cached != null && cached.isNumber() ? cached.asLong() : null
        );
    }

    private String textOrEmpty(JsonNode node) {
        String text = optionalText(node);
        return text == null ? "" : text;
    }
}
