package com.example.clusteragent.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One entry of a session's history. A phase change has {@code from != to}. Entries recorded
 * without leaving the phase have {@code from == to}: approval checkpoints set
 * {@code approval}, plain notes do not. Entries are never removed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseTransition {

    private Phase from;
    private Phase to;
    private Instant timestamp;

    /** True when this entry grants approval for mutating actions */
    private boolean approval;

    /** "user", "automatic" or "system" */
    private String actor;

    private String note;

    /** Set when the transition is caused by a failure */
    private String error;
}
