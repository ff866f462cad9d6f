package com.linlay.agentclient.tool;

public enum ToolStatus {
    RUNNING,
    SUCCESS,
    ERROR
}
