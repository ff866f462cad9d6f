package com.linlay.agentclient.stream.adapter.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentclient.stream.model.StreamFrame;
import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.TokenUsage;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StreamFrameParserTest {

    private final StreamFrameParser parser = new StreamFrameParser(new ObjectMapper());

    @Test
    void shouldParseMessageStartWithInitialContent() {
        StreamFrame frame = parser.parseOrNull("""
                {"type":"message_start","messageId":"msg_1","content":[{"type":"thinking","thinking":"","signature":"sig"}],"provider":"claude"}
                """);

        assertThat(frame).isInstanceOf(StreamFrame.MessageStart.class);
        StreamFrame.MessageStart start = (StreamFrame.MessageStart) frame;
        assertThat(start.messageId()).isEqualTo("msg_1");
        assertThat(start.content()).containsExactly(new ContentBlock.ThinkingBlock("", "sig"));
    }

    @Test
    void shouldParseToolLifecycleFrames() {
        StreamFrame start = parser.parseOrNull("""
                {"type":"tool_start","toolId":"tool_1","toolName":"Read","toolType":"CLAUDE_READ"}
                """);
        StreamFrame progress = parser.parseOrNull("""
                {"type":"tool_progress","toolId":"tool_1","status":"in_progress","outputPreview":"{\\"path\\":"}
                """);
        StreamFrame complete = parser.parseOrNull("""
                {"type":"tool_complete","toolId":"tool_1","result":{"type":"tool_use","id":"tool_1","name":"Read","input_json":"{\\"path\\":\\"a.ts\\"}"}}
                """);

        assertThat(start).isEqualTo(new StreamFrame.ToolStart("tool_1", "Read", "CLAUDE_READ"));
        assertThat(progress).isEqualTo(new StreamFrame.ToolProgress("tool_1", "in_progress", "{\"path\":"));
        assertThat(complete).isInstanceOf(StreamFrame.ToolComplete.class);
        ContentBlock result = ((StreamFrame.ToolComplete) complete).result();
        assertThat(result).isEqualTo(new ContentBlock.ToolUseBlock("tool_1", "Read", null, Map.of("path", "a.ts")));
    }

    @Test
    void shouldDistinguishEmptyInputFromMissingInput() {
        StreamFrame empty = parser.parseOrNull("""
                {"type":"tool_complete","toolId":"tool_1","result":{"type":"tool_use","id":"tool_1","input":{}}}
                """);
        StreamFrame missing = parser.parseOrNull("""
                {"type":"tool_complete","toolId":"tool_1","result":{"type":"tool_use","id":"tool_1"}}
                """);

        ContentBlock.ToolUseBlock emptyInput = (ContentBlock.ToolUseBlock) ((StreamFrame.ToolComplete) empty).result();
        ContentBlock.ToolUseBlock noInput = (ContentBlock.ToolUseBlock) ((StreamFrame.ToolComplete) missing).result();
        assertThat(emptyInput.hasInput()).isTrue();
        assertThat(emptyInput.input()).isEmpty();
        assertThat(noInput.hasInput()).isFalse();
    }

    @Test
    void shouldParseUsageAndUserMessages() {
        StreamFrame complete = parser.parseOrNull("""
                {"type":"message_complete","usage":{"inputTokens":12,"outputTokens":34,"cachedInputTokens":5}}
                """);
        StreamFrame user = parser.parseOrNull("""
                {"type":"user","isReplay":false,"message":{"content":[{"type":"tool_result","tool_use_id":"t1","content":"ok","is_error":true}]}}
                """);

        assertThat(complete).isEqualTo(new StreamFrame.MessageComplete(new TokenUsage(12, 34, 5L)));
        StreamFrame.User userFrame = (StreamFrame.User) user;
        assertThat(userFrame.isReplay()).isFalse();
        assertThat(userFrame.content()).containsExactly(new ContentBlock.ToolResultBlock("t1", "ok", true));
    }

    @Test
    void shouldKeepUnknownTypesAsCatchAll() {
        StreamFrame frame = parser.parseOrNull("{\"type\":\"status_system\",\"status\":\"compacting\"}");
        StreamFrame block = parser.parseOrNull("""
                {"type":"assistant","content":[{"type":"reasoning_summary","text":"x"},{"type":"web_search","query":"jdk"}]}
                """);

        assertThat(frame).isInstanceOf(StreamFrame.Unknown.class);
        assertThat(frame.type()).isEqualTo("status_system");
        assertThat(((StreamFrame.Unknown) frame).raw()).containsEntry("status", "compacting");
        StreamFrame.Assistant assistant = (StreamFrame.Assistant) block;
        assertThat(assistant.content()).hasSize(2);
        assertThat(assistant.content().get(0)).isInstanceOf(ContentBlock.UnknownBlock.class);
        assertThat(assistant.content().get(1)).isEqualTo(new ContentBlock.WebSearchBlock("jdk"));
    }

    @Test
    void shouldReturnNullForMalformedOrInvalidFrames() {
        assertThat(parser.parseOrNull("{not json")).isNull();
        assertThat(parser.parseOrNull("  ")).isNull();
        assertThat(parser.parseOrNull("[1,2]")).isNull();
        assertThat(parser.parseOrNull("{\"type\":\"tool_start\",\"toolName\":\"Read\"}")).isNull();
    }

    @Test
    void shouldTreatMissingDeltaTextAsEmpty() {
        StreamFrame frame = parser.parseOrNull("{\"type\":\"text_delta\"}");

        assertThat(frame).isEqualTo(new StreamFrame.TextDelta(""));
    }
}
