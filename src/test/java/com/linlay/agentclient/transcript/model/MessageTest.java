package com.linlay.agentclient.transcript.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageTest {

    @Test
    void shouldTreatWhitespaceTextAsEmpty() {
        assertThat(Message.assistant("a", List.of(), 1L).isSemanticallyEmpty()).isTrue();
        assertThat(Message.assistant("a", List.of(new ContentBlock.TextBlock("  \n")), 1L).isSemanticallyEmpty()).isTrue();
        assertThat(Message.assistant("a", List.of(new ContentBlock.ThinkingBlock("")), 1L).isSemanticallyEmpty()).isFalse();
        assertThat(Message.assistant("a", List.of(new ContentBlock.ToolUseBlock("t1", "Read", null, null)), 1L)
                .isSemanticallyEmpty()).isFalse();
    }

    @Test
    void shouldReturnNewContentListOnEveryChange() {
        Message original = Message.assistant("a", List.of(new ContentBlock.TextBlock("x")), 1L);

        Message appended = original.appendBlock(new ContentBlock.TextBlock("y"));
        Message replaced = appended.replaceBlock(0, new ContentBlock.TextBlock("z"));

        assertThat(original.content()).containsExactly(new ContentBlock.TextBlock("x"));
        assertThat(appended.content()).hasSize(2);
        assertThat(replaced.content().get(0)).isEqualTo(new ContentBlock.TextBlock("z"));
        assertThat(appended.content()).isNotSameAs(replaced.content());
        assertThatThrownBy(() -> original.content().add(new ContentBlock.TextBlock("w")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldRejectBlankIds() {
        assertThatThrownBy(() -> Message.assistant(" ", List.of(), 1L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContentBlock.ToolUseBlock("", "Read", null, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepSignatureWhenAppendingThinking() {
        ContentBlock.ThinkingBlock block = new ContentBlock.ThinkingBlock("plan", "sig");

        assertThat(block.append(" more")).isEqualTo(new ContentBlock.ThinkingBlock("plan more", "sig"));
    }
}
