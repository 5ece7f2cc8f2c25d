package com.example.clusteragent.session;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of the two workflow state graphs. {@link #FAILED} is shared by both and is
 * reachable from every non-terminal phase.
 */
public enum Phase {

    // recommendation
    CLARIFYING(WorkflowKind.RECOMMENDATION),
    SOLUTION_ASSEMBLED(WorkflowKind.RECOMMENDATION),
    AWAITING_ANSWERS(WorkflowKind.RECOMMENDATION),
    MANIFEST_GENERATED(WorkflowKind.RECOMMENDATION),
    DEPLOYED(WorkflowKind.RECOMMENDATION),

    // remediation
    INVESTIGATING(WorkflowKind.REMEDIATION),
    ANALYZED(WorkflowKind.REMEDIATION),
    AWAITING_APPROVAL(WorkflowKind.REMEDIATION),
    REMEDIATING(WorkflowKind.REMEDIATION),
    EXECUTED(WorkflowKind.REMEDIATION),
    VALIDATED(WorkflowKind.REMEDIATION),

    FAILED(null);

    private final WorkflowKind kind;

    Phase(WorkflowKind kind) {
        this.kind = kind;
    }

    /**
     * Workflow this phase belongs to; null for {@link #FAILED}.
     */
    public WorkflowKind getKind() {
        return kind;
    }

    public boolean isTerminal() {
        return this == DEPLOYED || this == VALIDATED || this == FAILED;
    }

    public Set<Phase> successors() {
        return switch (this) {
            case CLARIFYING -> EnumSet.of(SOLUTION_ASSEMBLED, FAILED);
            case SOLUTION_ASSEMBLED -> EnumSet.of(AWAITING_ANSWERS, FAILED);
            case AWAITING_ANSWERS -> EnumSet.of(MANIFEST_GENERATED, FAILED);
            case MANIFEST_GENERATED -> EnumSet.of(DEPLOYED, FAILED);
            case INVESTIGATING -> EnumSet.of(ANALYZED, FAILED);
            case ANALYZED -> EnumSet.of(AWAITING_APPROVAL, FAILED);
            case AWAITING_APPROVAL -> EnumSet.of(REMEDIATING, FAILED);
            case REMEDIATING -> EnumSet.of(EXECUTED, FAILED);
            case EXECUTED -> EnumSet.of(VALIDATED, FAILED);
            case DEPLOYED, VALIDATED, FAILED -> EnumSet.noneOf(Phase.class);
        };
    }

    public boolean canTransitionTo(Phase next) {
        return successors().contains(next);
    }
}
