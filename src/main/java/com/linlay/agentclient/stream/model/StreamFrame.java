package com.linlay.agentclient.stream.model;

import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.TokenUsage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public sealed interface StreamFrame permits
        StreamFrame.MessageStart,
        StreamFrame.TextDelta,
        StreamFrame.ThinkingDelta,
        StreamFrame.ToolStart,
        StreamFrame.ToolProgress,
        StreamFrame.ToolComplete,
        StreamFrame.MessageComplete,
        StreamFrame.User,
        StreamFrame.Assistant,
        StreamFrame.Error,
        StreamFrame.Unknown {

    String type();

    record MessageStart(String messageId, List<ContentBlock> content) implements StreamFrame {
        public MessageStart {
            content = content == null ? List.of() : List.copyOf(content);
        }

        public MessageStart(String messageId) {
            this(messageId, null);
        }

        @Override
        public String type() {
            return "message_start";
        }
    }

    record TextDelta(String text) implements StreamFrame {
        public TextDelta {
            requireNonNull(text, "text");
        }

        @Override
        public String type() {
            return "text_delta";
        }
    }

    record ThinkingDelta(String thinking) implements StreamFrame {
        public ThinkingDelta {
            requireNonNull(thinking, "thinking");
        }

        @Override
        public String type() {
            return "thinking_delta";
        }
    }

    record ToolStart(String toolId, String toolName, String toolType) implements StreamFrame {
        public ToolStart {
            requireNonBlank(toolId, "toolId");
        }

        @Override
        public String type() {
            return "tool_start";
        }
    }

    record ToolProgress(String toolId, String status, String outputPreview) implements StreamFrame {
        public ToolProgress {
            requireNonBlank(toolId, "toolId");
            if (outputPreview == null) {
                outputPreview = "";
            }
        }

        public ToolProgress(String toolId, String outputPreview) {
            this(toolId, null, outputPreview);
        }

        @Override
        public String type() {
            return "tool_progress";
        }
    }

    record ToolComplete(String toolId, ContentBlock result) implements StreamFrame {
        public ToolComplete {
            requireNonBlank(toolId, "toolId");
        }

        @Override
        public String type() {
            return "tool_complete";
        }
    }

    record MessageComplete(TokenUsage usage) implements StreamFrame {
        @Override
        public String type() {
            return "message_complete";
        }
    }

    record User(List<ContentBlock> content, Boolean isReplay) implements StreamFrame {
        public User {
            content = content == null ? List.of() : List.copyOf(content);
        }

        @Override
        public String type() {
            return "user";
        }
    }

    record Assistant(List<ContentBlock> content) implements StreamFrame {
        public Assistant {
            content = content == null ? List.of() : List.copyOf(content);
        }

        @Override
        public String type() {
            return "assistant";
        }
    }

    record Error(String message) implements StreamFrame {
        public Error {
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
     * Catch-all for frame types this client does not handle.
     */
    record Unknown(String rawType, Map<String, Object> raw) implements StreamFrame {
        public Unknown {
            raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        }

        @Override
        public String type() {
            return rawType == null ? "unknown" : rawType;
        }
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
