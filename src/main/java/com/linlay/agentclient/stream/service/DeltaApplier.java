package com.linlay.agentclient.stream.service;

import com.linlay.agentclient.stream.model.FrameResult;
import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.Message;

import java.util.List;
import java.util.Objects;

public class DeltaApplier {

    private final MessageAccumulator messageAccumulator;

    public DeltaApplier(MessageAccumulator messageAccumulator) {
        this.messageAccumulator = Objects.requireNonNull(messageAccumulator, "messageAccumulator cannot be null");
    }

    public FrameResult applyText(Transcript transcript, String text) {
        if (text == null || text.isEmpty()) {
            return FrameResult.noOp();
        }
        int index = messageAccumulator.openOrCreate(transcript);
        Message message = transcript.get(index);
        List<ContentBlock> content = message.content();
        for (int i = content.size() - 1; i >= 0; i--) {
            if (content.get(i) instanceof ContentBlock.TextBlock existing) {
                transcript.replace(index, message.replaceBlock(i, existing.append(text)));
                return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
            }
        }
        transcript.replace(index, message.appendBlock(new ContentBlock.TextBlock(text)));
        return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
    }

    public FrameResult applyThinking(Transcript transcript, String thinking) {
        if (thinking == null || thinking.isEmpty()) {
            return FrameResult.noOp();
        }
        int index = messageAccumulator.openOrCreate(transcript);
        Message message = transcript.get(index);
        List<ContentBlock> content = message.content();
        for (int i = content.size() - 1; i >= 0; i--) {
            if (content.get(i) instanceof ContentBlock.ThinkingBlock existing) {
                transcript.replace(index, message.replaceBlock(i, existing.append(thinking)));
                return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
            }
        }
        transcript.replace(index, message.appendBlock(new ContentBlock.ThinkingBlock(thinking)));
        return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
    }
}
