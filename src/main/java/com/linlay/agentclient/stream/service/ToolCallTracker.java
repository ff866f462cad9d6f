package com.linlay.agentclient.stream.service;

import com.linlay.agentclient.stream.model.FrameResult;
import com.linlay.agentclient.stream.model.StreamFrame;
import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class ToolCallTracker {

    private static final Logger log = LoggerFactory.getLogger(ToolCallTracker.class);

    private final MessageAccumulator messageAccumulator;
    private final ToolInputAccumulator inputAccumulator;

    public ToolCallTracker(MessageAccumulator messageAccumulator, ToolInputAccumulator inputAccumulator) {
        this.messageAccumulator = Objects.requireNonNull(messageAccumulator, "messageAccumulator cannot be null");
        this.inputAccumulator = Objects.requireNonNull(inputAccumulator, "inputAccumulator cannot be null");
    }

    public FrameResult start(Transcript transcript, StreamFrame.ToolStart frame) {
        int index = messageAccumulator.openOrCreate(transcript);
        Message message = transcript.get(index);
        if (indexOfToolUse(message, frame.toolId()) >= 0) {
            log.debug("tool_start for existing tool {} ignored", frame.toolId());
            return FrameResult.unchanged(FrameResult.GeneratingSignal.ASSERT_TRUE);
        }
        ContentBlock.ToolUseBlock block = new ContentBlock.ToolUseBlock(
                frame.toolId(),
                frame.toolName(),
                frame.toolType(),
                Map.of()
        );
        transcript.replace(index, message.appendBlock(block));
        inputAccumulator.reset(frame.toolId());
        return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
    }

    public FrameResult progress(Transcript transcript, StreamFrame.ToolProgress frame) {
        int index = transcript.openAssistantIndex();
        int blockIndex = index >= 0 ? indexOfToolUse(transcript.get(index), frame.toolId()) : -1;
        if (blockIndex < 0) {
            log.warn("tool_progress references unknown toolId: {}", frame.toolId());
            return FrameResult.unchanged(FrameResult.GeneratingSignal.ASSERT_TRUE);
        }
        Optional<Map<String, Object>> parsed = inputAccumulator.append(frame.toolId(), frame.outputPreview());
        if (parsed.isEmpty()) {
            return FrameResult.noOp();
        }
        Message message = transcript.get(index);
        ContentBlock.ToolUseBlock block = (ContentBlock.ToolUseBlock) message.content().get(blockIndex);
        transcript.replace(index, message.replaceBlock(blockIndex, block.withInput(parsed.get())));
        return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
    }

    public FrameResult complete(Transcript transcript, StreamFrame.ToolComplete frame) {
        int index = transcript.openAssistantIndex();
        int blockIndex = index >= 0 ? indexOfToolUse(transcript.get(index), frame.toolId()) : -1;
        if (blockIndex < 0) {
            log.warn("tool_complete references unknown toolId: {}", frame.toolId());
            return FrameResult.unchanged(FrameResult.GeneratingSignal.ASSERT_TRUE);
        }
        inputAccumulator.remove(frame.toolId());
        if (frame.result() instanceof ContentBlock.ToolUseBlock authoritative && authoritative.hasInput()) {
            Message message = transcript.get(index);
            ContentBlock.ToolUseBlock block = (ContentBlock.ToolUseBlock) message.content().get(blockIndex);
            transcript.replace(index, message.replaceBlock(blockIndex, block.withInput(authoritative.input())));
            return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
        }
        if (frame.result() instanceof ContentBlock.ToolResultBlock) {
            log.debug("tool_complete for {} carried a tool_result; status resolves from the transcript", frame.toolId());
        }
        return FrameResult.unchanged(FrameResult.GeneratingSignal.ASSERT_TRUE);
    }

    static int indexOfToolUse(Message message, String toolId) {
        List<ContentBlock> content = message.content();
        for (int i = 0; i < content.size(); i++) {
            if (content.get(i) instanceof ContentBlock.ToolUseBlock toolUse && toolUse.id().equals(toolId)) {
                return i;
            }
        }
        return -1;
    }
}
