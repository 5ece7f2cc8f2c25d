package com.example.clusteragent.session;

import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.error.AgentException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root aggregate of a workflow. The phase changes only through {@link #transitionTo},
 * which enforces the workflow graph and appends to the history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Session {

    private String id;
    private WorkflowKind kind;
    private Phase phase;
    @Builder.Default
    private List<PhaseTransition> history = new ArrayList<>();
    @Builder.Default
    private SessionContext context = new SessionContext();
    private Instant createdAt;
    private Instant updatedAt;
    private Instant expiresAt;
    /** Error that moved the session to FAILED */
    private String error;

    public void transitionTo(Phase next, String actor, String note) {
        transition(next, actor, note, false, null);
    }

    /**
     * Phase change that also grants approval for mutating tools.
     */
    public void approveAndTransitionTo(Phase next, String actor, String note) {
        transition(next, actor, note, true, null);
    }

    /**
     * Records an approval without leaving the current phase.
     */
    public void recordApproval(String actor, String note) {
        ensureNotTerminal();
        history.add(PhaseTransition.builder()
                .from(phase).to(phase)
                .timestamp(Instant.now())
                .approval(true)
                .actor(actor)
                .note(note)
                .build());
        updatedAt = Instant.now();
    }

    /**
     * Appends a history entry that neither changes the phase nor grants approval.
     */
    public void addNote(String actor, String note) {
        ensureNotTerminal();
        history.add(PhaseTransition.builder()
                .from(phase).to(phase)
                .timestamp(Instant.now())
                .actor(actor)
                .note(note)
                .build());
        updatedAt = Instant.now();
    }

    /**
     * Moves the session to FAILED with the error attached. Earlier history is kept.
     */
    public void fail(String errorMessage, String actor) {
        if (phase.isTerminal()) {
            return;
        }
        transition(Phase.FAILED, actor, null, false, errorMessage);
        this.error = errorMessage;
    }

    private void transition(Phase next, String actor, String note, boolean approval, String errorMessage) {
        if (phase != null && !phase.canTransitionTo(next)) {
            throw AgentException.conflict("Session " + id + " cannot move from " + phase + " to " + next);
        }
        Instant now = Instant.now();
        history.add(PhaseTransition.builder()
                .from(phase).to(next)
                .timestamp(now)
                .approval(approval)
                .actor(actor)
                .note(note)
                .error(errorMessage)
                .build());
        phase = next;
        updatedAt = now;
    }

    private void ensureNotTerminal() {
        if (phase.isTerminal()) {
            throw AgentException.conflict("Session " + id + " is already " + phase);
        }
    }

    public boolean hasRecordedApproval() {
        return history.stream().anyMatch(PhaseTransition::isApproval);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Snapshot handed to the tool gateway.
     */
    public ToolContext toolContext() {
        return ToolContext.builder()
                .sessionId(id)
                .phase(phase.name())
                .history(List.copyOf(history))
                .build();
    }

    @JsonIgnore
    public Optional<Solution> getSelectedSolution() {
        String selected = context.getSelectedSolutionId();
        return context.getSolutions().stream().filter(s -> s.getId().equals(selected)).findFirst();
    }
}
