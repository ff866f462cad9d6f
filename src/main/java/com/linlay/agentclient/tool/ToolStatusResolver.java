package com.linlay.agentclient.tool;

import com.linlay.agentclient.transcript.model.ContentBlock;
import com.linlay.agentclient.transcript.model.Message;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives a tool call's outcome from the transcript instead of keeping an index of
 * pending calls. Results usually sit one or two messages after the call, so the scan
 * runs from the tail backwards. Side-effect free; safe to call mid-stream.
 */
public final class ToolStatusResolver {

    private ToolStatusResolver() {
    }

    public static ToolStatusResolution resolve(String toolUseId, List<Message> messages) {
        if (toolUseId == null || messages == null) {
            return ToolStatusResolution.running();
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            for (ContentBlock block : messages.get(i).content()) {
                if (block instanceof ContentBlock.ToolResultBlock result && toolUseId.equals(result.toolUseId())) {
                    return ToolStatusResolution.of(result);
                }
            }
        }
        return ToolStatusResolution.running();
    }

    /**
     * Resolves several ids in one backward pass, stopping as soon as all are found.
     * The returned map keeps the order of {@code toolUseIds}.
     */
    public static Map<String, ToolStatusResolution> resolveAll(Collection<String> toolUseIds, List<Message> messages) {
        Map<String, ToolStatusResolution> resolved = new LinkedHashMap<>();
        if (toolUseIds == null || toolUseIds.isEmpty()) {
            return resolved;
        }
        Set<String> pending = new LinkedHashSet<>(toolUseIds);
        pending.remove(null);
        Map<String, ToolStatusResolution> found = new HashMap<>();
        if (messages != null) {
            for (int i = messages.size() - 1; i >= 0 && !pending.isEmpty(); i--) {
                for (ContentBlock block : messages.get(i).content()) {
                    if (block instanceof ContentBlock.ToolResultBlock result && pending.remove(result.toolUseId())) {
                        found.put(result.toolUseId(), ToolStatusResolution.of(result));
                    }
                }
            }
        }
        for (String id : toolUseIds) {
            if (id != null) {
                resolved.put(id, found.getOrDefault(id, ToolStatusResolution.running()));
            }
        }
        return resolved;
    }
}
