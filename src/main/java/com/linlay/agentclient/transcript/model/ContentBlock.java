package com.linlay.agentclient.transcript.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of message content. Blocks are immutable values; appending to a
 * block produces a new instance.
 */
public sealed interface ContentBlock permits
        ContentBlock.TextBlock,
        ContentBlock.ThinkingBlock,
        ContentBlock.ToolUseBlock,
        ContentBlock.ToolResultBlock,
        ContentBlock.ImageBlock,
        ContentBlock.CommandExecutionBlock,
        ContentBlock.FileChangeBlock,
        ContentBlock.McpToolCallBlock,
        ContentBlock.WebSearchBlock,
        ContentBlock.TodoListBlock,
        ContentBlock.ErrorBlock,
        ContentBlock.UnknownBlock {

    String TEXT = "text";
    String THINKING = "thinking";
    String TOOL_USE = "tool_use";
    String TOOL_RESULT = "tool_result";

    String type();

    record TextBlock(String text) implements ContentBlock {
        public TextBlock {
            if (text == null) {
                text = "";
            }
        }

        public TextBlock append(String delta) {
            return new TextBlock(text + delta);
        }

        public boolean isBlank() {
            return text.isBlank();
        }

        @Override
        public String type() {
            return TEXT;
        }
    }

    record ThinkingBlock(String thinking, String signature) implements ContentBlock {
        public ThinkingBlock {
            if (thinking == null) {
                thinking = "";
            }
        }

        public ThinkingBlock(String thinking) {
            this(thinking, null);
        }

        public ThinkingBlock append(String delta) {
            return new ThinkingBlock(thinking + delta, signature);
        }

        @Override
        public String type() {
            return THINKING;
        }
    }

    /**
     * A null {@code input} means the block carried no input at all, which is not the same as {@code {}}.
     */
    record ToolUseBlock(String id, String toolName, String toolType, Map<String, Object> input) implements ContentBlock {
        public ToolUseBlock {
            requireNonBlank(id, "id");
            input = input == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(input));
        }

        public boolean hasInput() {
            return input != null;
        }

        public ToolUseBlock withInput(Map<String, Object> newInput) {
            return new ToolUseBlock(id, toolName, toolType, newInput);
        }

        @Override
        public String type() {
            return TOOL_USE;
        }
    }

    record ToolResultBlock(String toolUseId, Object content, Boolean isError) implements ContentBlock {
        public ToolResultBlock {
            requireNonBlank(toolUseId, "toolUseId");
        }

        public boolean failed() {
            return Boolean.TRUE.equals(isError);
        }

        @Override
        public String type() {
            return TOOL_RESULT;
        }
    }

    record ImageBlock(String sourceType, String mediaType, String data, String url) implements ContentBlock {
        @Override
        public String type() {
            return "image";
        }
    }

    record CommandExecutionBlock(String command, String output, Integer exitCode, String status) implements ContentBlock {
        @Override
        public String type() {
            return "command_execution";
        }
    }

    record FileChange(String path, String kind) {
    }

    record FileChangeBlock(String status, List<FileChange> changes) implements ContentBlock {
        public FileChangeBlock {
            changes = changes == null ? List.of() : List.copyOf(changes);
        }

        @Override
        public String type() {
            return "file_change";
        }
    }

    record McpToolCallBlock(String server, String tool, Object arguments, Object result, String status) implements ContentBlock {
        @Override
        public String type() {
            return "mcp_tool_call";
        }
    }

    record WebSearchBlock(String query) implements ContentBlock {
        @Override
        public String type() {
            return "web_search";
        }
    }

    record TodoItem(String text, boolean completed) {
    }

    record TodoListBlock(List<TodoItem> items) implements ContentBlock {
        public TodoListBlock {
            items = items == null ? List.of() : List.copyOf(items);
        }

        @Override
        public String type() {
            return "todo_list";
        }
    }

    record ErrorBlock(String message) implements ContentBlock {
        public ErrorBlock {
            if (message == null || message.isBlank()) {
                message = "Unknown error";
            }
        }

        @Override
        public String type() {
            return "error";
        }
    }

    /**
     * Block of a type this client does not model; the raw payload is kept for display.
     */
    record UnknownBlock(String originalType, Map<String, Object> raw) implements ContentBlock {
        public UnknownBlock {
            raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        }

        @Override
        public String type() {
            return "unknown";
        }
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }
}
