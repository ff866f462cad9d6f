package com.linlay.agentclient.transcript.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One transcript entry. Every change produces a new instance with a new content list,
 * so observers holding an older snapshot never see it change underneath them.
 */
public record Message(
        String id,
        MessageRole role,
        List<ContentBlock> content,
        long timestamp,
        Boolean isReplay,
        boolean compactSummary,
        TokenUsage tokenUsage
) {

    public Message {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static Message assistant(String id, List<ContentBlock> content, long timestamp) {
        return new Message(id, MessageRole.ASSISTANT, content, timestamp, null, false, null);
    }

    public static Message user(String id, List<ContentBlock> content, long timestamp, Boolean isReplay, boolean compactSummary) {
        return new Message(id, MessageRole.USER, content, timestamp, isReplay, compactSummary, null);
    }

    public boolean isAssistant() {
        return role == MessageRole.ASSISTANT;
    }

    public Message withId(String newId) {
        return new Message(newId, role, content, timestamp, isReplay, compactSummary, tokenUsage);
    }

    public Message withContent(List<ContentBlock> newContent) {
        return new Message(id, role, newContent, timestamp, isReplay, compactSummary, tokenUsage);
    }

    public Message withTimestamp(long newTimestamp) {
        return new Message(id, role, content, newTimestamp, isReplay, compactSummary, tokenUsage);
    }

    public Message withTokenUsage(TokenUsage usage) {
        return new Message(id, role, content, timestamp, isReplay, compactSummary, usage);
    }

    public Message appendBlock(ContentBlock block) {
        List<ContentBlock> next = new ArrayList<>(content);
        next.add(block);
        return withContent(next);
    }

    public Message replaceBlock(int index, ContentBlock block) {
        List<ContentBlock> next = new ArrayList<>(content);
        next.set(index, block);
        return withContent(next);
    }

    /**
     * True when there is nothing to show: no blocks, or only whitespace text blocks.
     */
    public boolean isSemanticallyEmpty() {
        for (ContentBlock block : content) {
            if (!(block instanceof ContentBlock.TextBlock text) || !text.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
