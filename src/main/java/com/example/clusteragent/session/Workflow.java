package com.example.clusteragent.session;

/**
 * Phase logic of one workflow kind. Implementations mutate the session they are given;
 * the engine owns locking, persistence and failure handling.
 */
public interface Workflow {

    WorkflowKind kind();

    /**
     * Runs the work of the initial phase right after creation.
     */
    void start(Session session);

    /**
     * Applies one client round-trip. Rejected input must be reported with
     * {@link com.example.clusteragent.error.InvalidRequestException} before the session is touched.
     */
    void advance(Session session, AdvanceRequest request);
}
