package com.linlay.agentclient.transcript.model;

public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM
}
