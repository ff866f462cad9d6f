package com.linlay.agentclient.stream.service;

import com.linlay.agentclient.stream.model.FrameResult;
import com.linlay.agentclient.stream.model.StreamFrame;
import com.linlay.agentclient.stream.model.TranscriptUpdate;
import com.linlay.agentclient.tool.ToolStatusResolution;
import com.linlay.agentclient.tool.ToolStatusResolver;
import com.linlay.agentclient.transcript.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One session's transcript together with its coarse "generating" flag.
 * Frame results may assert the flag; only {@link #markResult()} clears it.
 */
public class TranscriptSession {

    private static final Logger log = LoggerFactory.getLogger(TranscriptSession.class);

    private final String sessionId;
    private final StreamFrameProcessor processor;
    private final Sinks.Many<TranscriptUpdate> updates = Sinks.many().multicast().directBestEffort();

    private volatile boolean generating;

    public TranscriptSession(String sessionId, StreamFrameProcessor processor) {
        this.sessionId = sessionId;
        this.processor = Objects.requireNonNull(processor, "processor cannot be null");
    }

    public String sessionId() {
        return sessionId;
    }

    public synchronized FrameResult accept(StreamFrame frame) {
        FrameResult result = processor.process(frame);
        boolean before = generating;
        switch (result.generating()) {
            case ASSERT_TRUE -> generating = true;
            case ASSERT_FALSE -> generating = false;
            case UNCHANGED -> {
            }
        }
        if (result.transcriptChanged() || before != generating) {
            publish(result);
        }
        return result;
    }

    /**
     * Processes a transport's frames strictly in order.
     */
    public Flux<FrameResult> bind(Flux<StreamFrame> frames) {
        Objects.requireNonNull(frames, "frames cannot be null");
        return frames.concatMap(frame -> Flux.just(accept(frame)));
    }

    /**
     * Session-level "result" signal: the agent finished the whole request.
     */
    public synchronized void markResult() {
        if (!generating) {
            return;
        }
        generating = false;
        publish(FrameResult.unchanged(FrameResult.GeneratingSignal.ASSERT_FALSE));
    }

    public boolean isGenerating() {
        return generating;
    }

    public List<Message> messages() {
        return processor.transcript().snapshot();
    }

    public Flux<TranscriptUpdate> updates() {
        return updates.asFlux();
    }

    public ToolStatusResolution toolStatus(String toolUseId) {
        return ToolStatusResolver.resolve(toolUseId, messages());
    }

    public Map<String, ToolStatusResolution> toolStatuses(Collection<String> toolUseIds) {
        return ToolStatusResolver.resolveAll(toolUseIds, messages());
    }

    public void close() {
        updates.tryEmitComplete();
    }

    private void publish(FrameResult result) {
        Transcript transcript = processor.transcript();
        TranscriptUpdate update = new TranscriptUpdate(transcript.version(), transcript.snapshot(), result, generating);
        Sinks.EmitResult emitResult = updates.tryEmitNext(update);
        if (emitResult.isFailure() && emitResult != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("session {} dropped transcript update v{}: {}", sessionId, update.version(), emitResult);
        }
    }
}
