package com.linlay.agentclient.transcript.model;

public record TokenUsage(
        long inputTokens,
        long outputTokens,
        Long cachedInputTokens
) {

    public TokenUsage(long inputTokens, long outputTokens) {
        this(inputTokens, outputTokens, null);
    }
}
