package com.example.clusteragent.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of one {@code advance} round-trip. Which fields matter depends on the phase.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdvanceRequest {

    @Builder.Default
    private AdvanceAction action = AdvanceAction.CONTINUE;

    /** Extra detail for the intent while clarifying */
    private String clarification;

    /** Solution to continue with; the best ranked one when absent */
    private String solutionId;

    /** Answers keyed by question id */
    @Builder.Default
    private Map<String, Object> answers = new LinkedHashMap<>();

    /** Readiness bound of a deploy */
    private Integer timeoutSeconds;

    @Builder.Default
    private String actor = "user";

    private String comment;

    public AdvanceAction effectiveAction() {
        return action != null ? action : AdvanceAction.CONTINUE;
    }

    public String effectiveActor() {
        return actor != null && !actor.isBlank() ? actor : "user";
    }
}
