package com.example.clusteragent.session;

public enum AdvanceAction {
    /** Move to the next phase with the supplied input */
    CONTINUE,
    /** Grant approval for the pending change (remediation actions, deploy) */
    APPROVE,
    /** Fail the session on the user's behalf */
    REJECT,
    /** Re-request a step that timed out or failed without failing the session */
    RETRY
}
