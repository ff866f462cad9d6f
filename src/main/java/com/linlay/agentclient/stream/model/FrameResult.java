package com.linlay.agentclient.stream.model;

import com.linlay.agentclient.transcript.model.Message;

public record FrameResult(
        boolean transcriptChanged,
        GeneratingSignal generating,
        Message newMessage
) {

    private static final FrameResult NO_OP = new FrameResult(false, GeneratingSignal.UNCHANGED, null);

    public FrameResult {
        if (generating == null) {
            generating = GeneratingSignal.UNCHANGED;
        }
    }

    public static FrameResult noOp() {
        return NO_OP;
    }

    public static FrameResult changed(GeneratingSignal generating) {
        return new FrameResult(true, generating, null);
    }

    public static FrameResult appended(Message message) {
        return new FrameResult(true, GeneratingSignal.ASSERT_TRUE, message);
    }

    public static FrameResult unchanged(GeneratingSignal generating) {
        return new FrameResult(false, generating, null);
    }

    public enum GeneratingSignal {
        ASSERT_TRUE,
        ASSERT_FALSE,
        UNCHANGED
    }
}
