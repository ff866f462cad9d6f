package com.linlay.agentclient.tool;

import com.linlay.agentclient.transcript.model.ContentBlock;

public record ToolStatusResolution(ToolStatus status, ContentBlock.ToolResultBlock result) {

    private static final ToolStatusResolution RUNNING = new ToolStatusResolution(ToolStatus.RUNNING, null);

    public ToolStatusResolution {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public static ToolStatusResolution running() {
        return RUNNING;
    }

    public static ToolStatusResolution of(ContentBlock.ToolResultBlock result) {
        return new ToolStatusResolution(result.failed() ? ToolStatus.ERROR : ToolStatus.SUCCESS, result);
    }
}
