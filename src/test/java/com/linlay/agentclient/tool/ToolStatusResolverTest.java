package com.linlay.agentclient.tool;

import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.Message;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ToolStatusResolverTest {

    private static final Message CALL = Message.assistant("msg_1", List.of(
            new ContentBlock.ToolUseBlock("t1", "Read", "CLAUDE_READ", Map.of("path", "a.ts")),
            new ContentBlock.ToolUseBlock("t2", "Bash", "CLAUDE_BASH", Map.of("command", "ls"))
    ), 1L);

    @Test
    void shouldReportRunningWithoutResult() {
        ToolStatusResolution resolution = ToolStatusResolver.resolve("t1", List.of(CALL));

        assertThat(resolution.status()).isEqualTo(ToolStatus.RUNNING);
        assertThat(resolution.result()).isNull();
    }

    @Test
    void shouldReportSuccessAndError() {
        Message ok = userWith(new ContentBlock.ToolResultBlock("t1", "ok", false));
        Message failed = userWith(new ContentBlock.ToolResultBlock("t1", "boom", true));

        assertThat(ToolStatusResolver.resolve("t1", List.of(CALL, ok)).status()).isEqualTo(ToolStatus.SUCCESS);
        assertThat(ToolStatusResolver.resolve("t1", List.of(CALL, failed)).status()).isEqualTo(ToolStatus.ERROR);
        assertThat(ToolStatusResolver.resolve("t1", List.of(CALL, ok)).result().content()).isEqualTo("ok");
    }

    @Test
    void shouldTreatMissingErrorFlagAsSuccess() {
        Message result = userWith(new ContentBlock.ToolResultBlock("t1", "ok", null));

        assertThat(ToolStatusResolver.resolve("t1", List.of(CALL, result)).status()).isEqualTo(ToolStatus.SUCCESS);
    }

    @Test
    void shouldPreferResultNearestTheTail() {
        Message first = userWith(new ContentBlock.ToolResultBlock("t1", "old", true));
        Message second = userWith(new ContentBlock.ToolResultBlock("t1", "new", false));

        ToolStatusResolution resolution = ToolStatusResolver.resolve("t1", List.of(CALL, first, second));

        assertThat(resolution.status()).isEqualTo(ToolStatus.SUCCESS);
        assertThat(resolution.result().content()).isEqualTo("new");
    }

    @Test
    void shouldResolveBatchInRequestOrder() {
        Message results = userWith(
                new ContentBlock.ToolResultBlock("t2", "listing", false),
                new ContentBlock.ToolResultBlock("t1", "denied", true)
        );

        Map<String, ToolStatusResolution> resolved = ToolStatusResolver.resolveAll(
                List.of("t3", "t1", "t2"),
                List.of(CALL, results)
        );

        assertThat(resolved.keySet()).containsExactly("t3", "t1", "t2");
        assertThat(resolved.get("t1").status()).isEqualTo(ToolStatus.ERROR);
        assertThat(resolved.get("t2").status()).isEqualTo(ToolStatus.SUCCESS);
        assertThat(resolved.get("t3").status()).isEqualTo(ToolStatus.RUNNING);
    }

    @Test
    void shouldHandleEmptyInputs() {
        assertThat(ToolStatusResolver.resolve(null, List.of(CALL)).status()).isEqualTo(ToolStatus.RUNNING);
        assertThat(ToolStatusResolver.resolve("t1", null).status()).isEqualTo(ToolStatus.RUNNING);
        assertThat(ToolStatusResolver.resolveAll(List.of(), List.of(CALL))).isEmpty();
    }

    private static Message userWith(ContentBlock... blocks) {
        return Message.user("user-" + System.nanoTime(), List.of(blocks), 2L, null, false);
    }
}
