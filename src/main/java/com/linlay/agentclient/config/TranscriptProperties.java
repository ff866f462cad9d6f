package com.linlay.agentclient.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent-client.transcript")
public record TranscriptProperties(
        Integer maxToolInputChars,
        Boolean recordErrorFrames,
        String compactSummaryMarker
) {

    public static final int DEFAULT_MAX_TOOL_INPUT_CHARS = 1024 * 1024;
    public static final String DEFAULT_COMPACT_SUMMARY_MARKER = "This session is being continued";

    public TranscriptProperties {
        if (maxToolInputChars == null) {
            maxToolInputChars = DEFAULT_MAX_TOOL_INPUT_CHARS;
        }
        if (recordErrorFrames == null) {
            recordErrorFrames = Boolean.FALSE;
        }
        if (compactSummaryMarker == null || compactSummaryMarker.isBlank()) {
            compactSummaryMarker = DEFAULT_COMPACT_SUMMARY_MARKER;
        }
    }

    public static TranscriptProperties defaults() {
        return new TranscriptProperties(null, null, null);
    }
}
