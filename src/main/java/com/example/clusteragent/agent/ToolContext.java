package com.example.clusteragent.agent;

import com.example.clusteragent.session.PhaseTransition;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Execution context handed to the gateway and to tools. Carries an immutable
 * snapshot of the calling session's phase history so the gateway can check for a
 * recorded approval itself.
 */
@Getter
@Builder
public class ToolContext {

    private final String sessionId;
    private final String phase;

    @Singular("transition")
    private final List<PhaseTransition> history;

    /** Opaque per-session state forwarded to remote plugins */
    @Builder.Default
    private final Map<String, Object> pluginState = Map.of();

    /**
     * True when an approval transition appears in the session history.
     */
    public boolean hasRecordedApproval() {
        return history != null && history.stream().anyMatch(PhaseTransition::isApproval);
    }

    /**
     * Context for maintenance operations that run outside any session (capability scans).
     */
    public static ToolContext system(String label) {
        return ToolContext.builder().sessionId(label).phase("SYSTEM").build();
    }
}
