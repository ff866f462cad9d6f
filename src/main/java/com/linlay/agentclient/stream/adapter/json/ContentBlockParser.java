package com.linlay.agentclient.stream.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentclient.transcript.model.ContentBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class ContentBlockParser {

    private static final Logger log = LoggerFactory.getLogger(ContentBlockParser.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ContentBlockParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public List<ContentBlock> parseList(JsonNode node) {
        List<ContentBlock> blocks = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return blocks;
        }
        for (JsonNode item : node) {
            ContentBlock block = parseOrNull(item);
            if (block != null) {
                blocks.add(block);
            }
        }
        return blocks;
    }

    /**
     * Decodes one block; non-object nodes and blocks missing required ids yield null.
     */
    public ContentBlock parseOrNull(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String type = optionalText(node.get("type"));
        try {
            return parse(type, node);
        } catch (IllegalArgumentException ex) {
            log.warn("Skipping invalid {} content block: {}", type, ex.getMessage());
            return null;
        }
    }

    private ContentBlock parse(String type, JsonNode node) {
        if (type == null) {
            return new ContentBlock.UnknownBlock(null, toMap(node));
        }
        switch (type) {
            case "text":
                return new ContentBlock.TextBlock(optionalText(node.get("text")));
            case "thinking":
                return new ContentBlock.ThinkingBlock(
                        optionalText(node.get("thinking")),
                        optionalText(node.get("signature"))
                );
            case "tool_use":
                return new ContentBlock.ToolUseBlock(
                        optionalText(node.get("id")),
                        firstText(node, "toolName", "name", "tool_name"),
                        firstText(node, "toolType", "tool_type"),
                        inputMap(node)
                );
            case "tool_result":
                return new ContentBlock.ToolResultBlock(
                        firstText(node, "tool_use_id", "toolUseId"),
                        jsonOrValue(node, "content_json", "content"),
                        optionalBoolean(node.has("is_error") ? node.get("is_error") : node.get("isError"))
                );
            case "image":
                JsonNode source = node.path("source");
                return new ContentBlock.ImageBlock(
                        defaultIfNull(optionalText(source.get("type")), "base64"),
                        defaultIfNull(firstText(source, "media_type", "mediaType"), "image/png"),
                        optionalText(source.get("data")),
                        optionalText(source.get("url"))
                );
            case "command_execution":
                return new ContentBlock.CommandExecutionBlock(
                        defaultIfNull(optionalText(node.get("command")), ""),
                        optionalText(node.get("output")),
                        optionalInt(firstPresent(node, "exit_code", "exitCode")),
                        defaultIfNull(optionalText(node.get("status")), "in_progress")
                );
            case "file_change":
                List<ContentBlock.FileChange> changes = new ArrayList<>();
                for (JsonNode change : node.path("changes")) {
                    changes.add(new ContentBlock.FileChange(
                            optionalText(change.get("path")),
                            optionalText(change.get("kind"))
                    ));
                }
                return new ContentBlock.FileChangeBlock(
                        defaultIfNull(optionalText(node.get("status")), "completed"),
                        changes
                );
            case "mcp_tool_call":
                return new ContentBlock.McpToolCallBlock(
                        optionalText(node.get("server")),
                        optionalText(node.get("tool")),
                        jsonOrValue(node, "arguments_json", "arguments"),
                        jsonOrValue(node, "result_json", "result"),
                        defaultIfNull(optionalText(node.get("status")), "in_progress")
                );
            case "web_search":
                return new ContentBlock.WebSearchBlock(defaultIfNull(optionalText(node.get("query")), ""));
            case "todo_list":
                List<ContentBlock.TodoItem> items = new ArrayList<>();
                for (JsonNode item : node.path("items")) {
                    items.add(new ContentBlock.TodoItem(
                            defaultIfNull(optionalText(item.get("text")), ""),
                            item.path("completed").asBoolean(false)
                    ));
                }
                return new ContentBlock.TodoListBlock(items);
            case "error":
                return new ContentBlock.ErrorBlock(optionalText(node.get("message")));
            default:
                return new ContentBlock.UnknownBlock(type, toMap(node));
        }
    }

    private Map<String, Object> inputMap(JsonNode node) {
        Object value = jsonOrValue(node, "input_json", "input");
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> input = new LinkedHashMap<>();
            map.forEach((k, v) -> input.put(String.valueOf(k), v));
            return input;
        }
        return null;
    }

    /**
     * Reads {@code jsonField} as embedded JSON text when present, otherwise {@code plainField}.
     * Embedded text that does not parse is kept as the raw string.
     */
    private Object jsonOrValue(JsonNode node, String jsonField, String plainField) {
        JsonNode embedded = node.get(jsonField);
        if (embedded != null && !embedded.isNull()) {
            if (!embedded.isTextual()) {
                return toValue(embedded);
            }
            try {
                return toValue(objectMapper.readTree(embedded.asText()));
            } catch (JsonProcessingException ex) {
                return embedded.asText();
            }
        }
        return toValue(node.get(plainField));
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private Map<String, Object> toMap(JsonNode node) {
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    static String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    static Boolean optionalBoolean(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isTextual()) {
            return Boolean.parseBoolean(node.asText().trim());
        }
        return null;
    }

    static Integer optionalInt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isInt() || node.isLong()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        return optionalText(firstPresent(node, fields));
    }

    private static JsonNode firstPresent(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String defaultIfNull(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
