package com.linlay.agentclient.stream.service;

import com.linlay.agentclient.transcript.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered message list of one session. Each mutation publishes a fresh immutable list,
 * so {@link #snapshot()} is safe to read from any thread while frames are still arriving.
 * Only the session's single writer may call the mutators.
 */
public class Transcript {

    private volatile List<Message> messages;
    private volatile long version;

    public Transcript() {
        this(List.of());
    }

    public Transcript(List<Message> initial) {
        this.messages = initial == null ? List.of() : List.copyOf(initial);
    }

    public List<Message> snapshot() {
        return messages;
    }

    public long version() {
        return version;
    }

    public int size() {
        return messages.size();
    }

    public Message get(int index) {
        return messages.get(index);
    }

    public void append(Message message) {
        Objects.requireNonNull(message, "message must not be null");
        List<Message> next = new ArrayList<>(messages.size() + 1);
        next.addAll(messages);
        next.add(message);
        publish(next);
    }

    public void replace(int index, Message message) {
        Objects.requireNonNull(message, "message must not be null");
        List<Message> next = new ArrayList<>(messages);
        next.set(index, message);
        publish(next);
    }

    /**
     * Index of the assistant message that may still receive content: the tail message
     * when it is an assistant message, otherwise -1.
     */
    public int openAssistantIndex() {
        List<Message> current = messages;
        if (current.isEmpty()) {
            return -1;
        }
        int last = current.size() - 1;
        return current.get(last).isAssistant() ? last : -1;
    }

    public boolean containsId(String id, String excludeId) {
        for (Message message : messages) {
            if (excludeId != null && excludeId.equals(message.id())) {
                continue;
            }
            if (message.id().equals(id)) {
                return true;
            }
        }
        return false;
    }

    private void publish(List<Message> next) {
        messages = List.copyOf(next);
        version++;
    }
}
