package com.linlay.agentclient.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentclient.config.TranscriptProperties;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

public class TranscriptSessionFactory {

    private final ObjectMapper objectMapper;
    private final TranscriptProperties properties;
    private final Clock clock;

    public TranscriptSessionFactory(ObjectMapper objectMapper, TranscriptProperties properties) {
        this(objectMapper, properties, Clock.systemUTC());
    }

    public TranscriptSessionFactory(ObjectMapper objectMapper, TranscriptProperties properties, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.properties = properties != null ? properties : TranscriptProperties.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public TranscriptSession create() {
        return create("session_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
    }

    public TranscriptSession create(String sessionId) {
        StreamFrameProcessor processor = new StreamFrameProcessor(new Transcript(), objectMapper, properties, clock);
        return new TranscriptSession(sessionId, processor);
    }

    public TranscriptProperties properties() {
        return properties;
    }
}
