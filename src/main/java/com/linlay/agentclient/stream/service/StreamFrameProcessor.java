package com.linlay.agentclient.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentclient.config.TranscriptProperties;
import com.linlay.agentclient.stream.model.FrameResult;
import com.linlay.agentclient.stream.model.StreamFrame;
import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Routes one frame at a time into the transcript of a single session.
 * Frames must be delivered sequentially by one writer; nothing thrown while handling a
 * frame escapes {@link #process(StreamFrame)}.
 */
public class StreamFrameProcessor {

    private static final Logger log = LoggerFactory.getLogger(StreamFrameProcessor.class);

    private final Transcript transcript;
    private final Clock clock;
    private final TranscriptProperties properties;
    private final MessageAccumulator messageAccumulator;
    private final DeltaApplier deltaApplier;
    private final ToolInputAccumulator inputAccumulator;
    private final ToolCallTracker toolCallTracker;

    public StreamFrameProcessor(Transcript transcript, ObjectMapper objectMapper, TranscriptProperties properties, Clock clock) {
        this.transcript = Objects.requireNonNull(transcript, "transcript cannot be null");
        this.properties = properties != null ? properties : TranscriptProperties.defaults();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.messageAccumulator = new MessageAccumulator(this.clock);
        this.deltaApplier = new DeltaApplier(messageAccumulator);
        this.inputAccumulator = new ToolInputAccumulator(
                Objects.requireNonNull(objectMapper, "objectMapper cannot be null"),
                this.properties.maxToolInputChars()
        );
        this.toolCallTracker = new ToolCallTracker(messageAccumulator, inputAccumulator);
    }

    public Transcript transcript() {
        return transcript;
    }

    /**
     * Number of tool calls whose streamed input is still being buffered.
     */
    public int pendingToolInputs() {
        return inputAccumulator.size();
    }

    public FrameResult process(StreamFrame frame) {
        if (frame == null) {
            return FrameResult.noOp();
        }
        try {
            return dispatch(frame);
        } catch (RuntimeException ex) {
            log.error("Failed to apply {} frame, transcript left as is", frame.type(), ex);
            return FrameResult.noOp();
        }
    }

    private FrameResult dispatch(StreamFrame frame) {
        log.debug("processing frame type={}", frame.type());
        if (frame instanceof StreamFrame.MessageStart value) {
            return messageAccumulator.start(transcript, value);
        }
        if (frame instanceof StreamFrame.TextDelta value) {
            return deltaApplier.applyText(transcript, value.text());
        }
        if (frame instanceof StreamFrame.ThinkingDelta value) {
            return deltaApplier.applyThinking(transcript, value.thinking());
        }
        if (frame instanceof StreamFrame.ToolStart value) {
            return toolCallTracker.start(transcript, value);
        }
        if (frame instanceof StreamFrame.ToolProgress value) {
            return toolCallTracker.progress(transcript, value);
        }
        if (frame instanceof StreamFrame.ToolComplete value) {
            return toolCallTracker.complete(transcript, value);
        }
        if (frame instanceof StreamFrame.MessageComplete value) {
            return completeMessage(value);
        }
        if (frame instanceof StreamFrame.User value) {
            return appendUser(value);
        }
        if (frame instanceof StreamFrame.Assistant value) {
            return verifyAssistant(value);
        }
        if (frame instanceof StreamFrame.Error value) {
            return handleError(value);
        }
        if (frame instanceof StreamFrame.Unknown value) {
            log.warn("Ignoring unknown frame type: {}", value.type());
            return FrameResult.noOp();
        }
        throw new IllegalStateException("Unhandled frame: " + frame.getClass().getName());
    }

    private FrameResult completeMessage(StreamFrame.MessageComplete frame) {
        inputAccumulator.clear();
        int index = transcript.openAssistantIndex();
        if (index < 0) {
            log.debug("message_complete without an open assistant message");
            return FrameResult.noOp();
        }
        Message message = transcript.get(index).withTimestamp(clock.millis());
        if (frame.usage() != null) {
            message = message.withTokenUsage(frame.usage());
        }
        transcript.replace(index, message);
        return FrameResult.changed(FrameResult.GeneratingSignal.UNCHANGED);
    }

    private FrameResult appendUser(StreamFrame.User frame) {
        long now = clock.millis();
        boolean compactSummary = isCompactSummary(frame);
        Message message = Message.user(
                MessageIds.userId(transcript, now),
                frame.content(),
                now,
                frame.isReplay(),
                compactSummary
        );
        transcript.append(message);
        if (compactSummary) {
            log.debug("user message {} classified as compact summary", message.id());
        } else if (Boolean.TRUE.equals(frame.isReplay())) {
            log.debug("user message {} is a replay", message.id());
        }
        return FrameResult.appended(message);
    }

    private boolean isCompactSummary(StreamFrame.User frame) {
        if (!Boolean.FALSE.equals(frame.isReplay())) {
            return false;
        }
        for (ContentBlock block : frame.content()) {
            if (block instanceof ContentBlock.TextBlock text) {
                return text.text().startsWith(properties.compactSummaryMarker());
            }
        }
        return false;
    }

    private FrameResult verifyAssistant(StreamFrame.Assistant frame) {
        int index = transcript.openAssistantIndex();
        if (log.isDebugEnabled()) {
            String openId = index >= 0 ? transcript.get(index).id() : null;
            int streamedBlocks = index >= 0 ? transcript.get(index).content().size() : 0;
            log.debug("assistant snapshot received: openMessage={}, streamedBlocks={}, snapshotBlocks={}",
                    openId, streamedBlocks, frame.content().size());
        }
        return FrameResult.noOp();
    }

    private FrameResult handleError(StreamFrame.Error frame) {
        log.error("Stream error frame: {}", frame.message());
        if (!Boolean.TRUE.equals(properties.recordErrorFrames())) {
            return FrameResult.noOp();
        }
        int index = messageAccumulator.openOrCreate(transcript);
        Message message = transcript.get(index);
        transcript.replace(index, message.appendBlock(new ContentBlock.ErrorBlock(frame.message())));
        return FrameResult.changed(FrameResult.GeneratingSignal.UNCHANGED);
    }
}
