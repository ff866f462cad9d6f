package com.linlay.agentclient.stream.service;

import com.linlay.agentclient.transcript.model.Message;

import java.util.UUID;

public final class MessageIds {

    public static final String PLACEHOLDER_PREFIX = "assistant-";
    public static final String USER_PREFIX = "user-";

    private MessageIds() {
    }

    public static boolean isPlaceholder(Message message) {
        return message != null && message.isAssistant() && message.id().startsWith(PLACEHOLDER_PREFIX);
    }

    public static String placeholderId(Transcript transcript, long now) {
        return uniqueGenerated(transcript, PLACEHOLDER_PREFIX, now);
    }

    public static String userId(Transcript transcript, long now) {
        return uniqueGenerated(transcript, USER_PREFIX, now);
    }

    /**
     * Returns {@code desiredId} unless another message (other than {@code excludeId}) already
     * uses it, in which case a random suffix is appended until the id is free.
     * A blank desired id yields a fresh placeholder id.
     */
    public static String ensureUnique(String desiredId, Transcript transcript, String excludeId, long now) {
        if (desiredId == null || desiredId.isBlank()) {
            return placeholderId(transcript, now);
        }
        String candidate = desiredId;
        while (transcript.containsId(candidate, excludeId)) {
            candidate = desiredId + "-" + shortRandom();
        }
        return candidate;
    }

    private static String uniqueGenerated(Transcript transcript, String prefix, long now) {
        String candidate;
        do {
            candidate = prefix + now + "-" + shortRandom();
        } while (transcript.containsId(candidate, null));
        return candidate;
    }

    private static String shortRandom() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
