package com.linlay.agentclient.stream.model;

import com.linlay.agentclient.transcript.model.Message;

import java.util.List;

public record TranscriptUpdate(
        long version,
        List<Message> messages,
        FrameResult result,
        boolean generating
) {

    public TranscriptUpdate {
        messages = messages == null ? List.of() : List.copyOf(messages);
        if (result == null) {
            result = FrameResult.noOp();
        }
    }
}
