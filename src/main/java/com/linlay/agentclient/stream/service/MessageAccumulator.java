package com.linlay.agentclient.stream.service;

import com.linlay.agentclient.stream.model.FrameResult;
import com.linlay.agentclient.stream.model.StreamFrame;
import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides which assistant message a frame belongs to: a reused placeholder, a reused
 * empty message, or a brand-new message.
 */
public class MessageAccumulator {

    private static final Logger log = LoggerFactory.getLogger(MessageAccumulator.class);

    private final Clock clock;

    public MessageAccumulator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public FrameResult start(Transcript transcript, StreamFrame.MessageStart frame) {
        long now = clock.millis();
        int index = transcript.openAssistantIndex();
        Message open = index >= 0 ? transcript.get(index) : null;

        if (open != null && MessageIds.isPlaceholder(open)) {
            String resolvedId = MessageIds.ensureUnique(frame.messageId(), transcript, open.id(), now);
            List<ContentBlock> merged = mergeContent(open.content(), frame.content());
            transcript.replace(index, open.withId(resolvedId).withContent(merged));
            log.debug("message_start reused placeholder {} -> {}, blocks={}", open.id(), resolvedId, merged.size());
            return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
        }

        if (open != null && open.isSemanticallyEmpty()) {
            String resolvedId = MessageIds.ensureUnique(frame.messageId(), transcript, open.id(), now);
            Message reused = open.withId(resolvedId);
            if (!frame.content().isEmpty()) {
                reused = reused.withContent(frame.content());
            }
            transcript.replace(index, reused);
            log.debug("message_start reused empty message {} -> {}", open.id(), resolvedId);
            return FrameResult.changed(FrameResult.GeneratingSignal.ASSERT_TRUE);
        }

        Message created = Message.assistant(
                MessageIds.ensureUnique(frame.messageId(), transcript, null, now),
                frame.content(),
                now
        );
        transcript.append(created);
        log.debug("message_start created message {}", created.id());
        return FrameResult.appended(created);
    }

    /**
     * Index of the open assistant message, appending a placeholder when there is none.
     */
    public int openOrCreate(Transcript transcript) {
        int index = transcript.openAssistantIndex();
        if (index >= 0) {
            return index;
        }
        long now = clock.millis();
        Message placeholder = Message.assistant(MessageIds.placeholderId(transcript, now), List.of(), now);
        transcript.append(placeholder);
        log.debug("created placeholder assistant message {}", placeholder.id());
        return transcript.size() - 1;
    }

    private List<ContentBlock> mergeContent(List<ContentBlock> existing, List<ContentBlock> incoming) {
        List<ContentBlock> merged = new ArrayList<>(existing);
        if (incoming.isEmpty()) {
            return merged;
        }
        Set<String> existingTypes = new HashSet<>();
        for (ContentBlock block : existing) {
            existingTypes.add(block.type());
        }
        for (ContentBlock block : incoming) {
            boolean streamedKind = ContentBlock.TEXT.equals(block.type()) || ContentBlock.THINKING.equals(block.type());
            if (streamedKind && existingTypes.contains(block.type())) {
                continue;
            }
            merged.add(block);
        }
        return merged;
    }
}
