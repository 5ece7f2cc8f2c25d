package com.example.clusteragent.session;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.InvalidRequestException;
import com.example.clusteragent.error.SessionExpiredException;
import com.example.clusteragent.error.SessionNotFoundException;
import com.example.clusteragent.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Plain request/response surface of the workflows: create, advance, inspect, delete.
 * <p>
 * Transitions of one session are serialized through {@link SessionLocks}; reads go
 * straight to the store. A workflow failure moves the session to FAILED with the error
 * in its history and the failed session is returned. Rejected input leaves the stored
 * session untouched and is thrown to the caller.
 */
@Slf4j
@Service
public class SessionEngine {

    private final SessionStore store;
    private final SessionLocks locks;
    private final SessionFiles files;
    private final AuditService auditService;
    private final AgentProperties properties;
    private final Map<WorkflowKind, Workflow> workflows = new EnumMap<>(WorkflowKind.class);

    public SessionEngine(SessionStore store, SessionLocks locks, SessionFiles files, AuditService auditService,
                         AgentProperties properties, List<Workflow> workflows) {
        this.store = store;
        this.locks = locks;
        this.files = files;
        this.auditService = auditService;
        this.properties = properties;
        workflows.forEach(w -> this.workflows.put(w.kind(), w));
    }

    public Session createSession(CreateSessionRequest request) {
        WorkflowKind kind = request.getKind();
        if (kind == null) {
            throw new InvalidRequestException("Workflow kind is required");
        }
        if (kind == WorkflowKind.RECOMMENDATION && isBlank(request.getIntent())) {
            throw new InvalidRequestException("A recommendation session needs an intent");
        }
        if (kind == WorkflowKind.REMEDIATION && isBlank(request.getIssue())) {
            throw new InvalidRequestException("A remediation session needs an issue description");
        }
        ExecutionOptions options = request.getOptions() != null ? request.getOptions() : ExecutionOptions.manual();
        if (options.getConfidenceThreshold() != null
                && (options.getConfidenceThreshold() < 0 || options.getConfidenceThreshold() > 1)) {
            throw new InvalidRequestException("confidenceThreshold must be between 0 and 1");
        }

        Instant now = Instant.now();
        Session session = Session.builder()
                .id(Ids.next(kind.getIdPrefix()))
                .kind(kind)
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(now.plus(Duration.ofMinutes(properties.getSessions().getTtlMinutes())))
                .build();
        session.getContext().setOptions(options);
        session.getContext().setIntent(request.getIntent());
        session.getContext().setIssue(request.getIssue());
        session.transitionTo(kind.initialPhase(), "system", "created");
        store.save(session);
        log.info("Created {} session {}", kind, session.getId());
        auditService.log("system", "SESSION_CREATED", session.getId(), Map.of("kind", kind.name()),
                session.getId(), true);

        return locks.withLock(session.getId(), lockWait(),
                () -> runStep(session, () -> workflow(kind).start(session)));
    }

    public Session advance(String sessionId, AdvanceRequest request) {
        AdvanceRequest input = request != null ? request : new AdvanceRequest();
        return locks.withLock(sessionId, lockWait(), () -> {
            Session session = load(sessionId);
            if (session.isExpiredAt(Instant.now())) {
                expire(session);
            }
            if (session.getPhase().isTerminal()) {
                throw AgentException.conflict("Session " + sessionId + " is already " + session.getPhase());
            }
            if (input.effectiveAction() == AdvanceAction.REJECT) {
                int before = session.getHistory().size();
                String reason = "Rejected by " + input.effectiveActor()
                        + (input.getComment() != null ? ": " + input.getComment() : "");
                session.fail(reason, input.effectiveActor());
                return persist(session, before);
            }
            return runStep(session, () -> workflow(session.getKind()).advance(session, input));
        });
    }

    public Session getSession(String sessionId) {
        Session session = load(sessionId);
        if (session.isExpiredAt(Instant.now())) {
            throw new SessionExpiredException(sessionId, session.getExpiresAt());
        }
        return session;
    }

    public List<Session> listSessions() {
        return store.findAll();
    }

    /**
     * Removes the session and its working directory, whatever its phase.
     */
    public void deleteSession(String sessionId) {
        locks.withLock(sessionId, lockWait(), () -> {
            if (!store.delete(sessionId)) {
                throw new SessionNotFoundException(sessionId);
            }
            files.deleteDirectory(sessionId);
            return null;
        });
        locks.release(sessionId);
        log.info("Deleted session {}", sessionId);
        auditService.log("user", "SESSION_DELETED", sessionId, Map.of(), sessionId, true);
    }

    /**
     * Deletes every session past its expiry time.
     */
    public int pruneExpired() {
        List<String> expired = store.findExpiredIds(Instant.now());
        int pruned = 0;
        for (String id : expired) {
            try {
                deleteSession(id);
                pruned++;
            } catch (AgentException e) {
                log.warn("Could not prune session {}: {}", id, e.getMessage());
            }
        }
        if (pruned > 0) {
            log.info("Pruned {} expired sessions", pruned);
        }
        return pruned;
    }

    private Session runStep(Session session, Runnable step) {
        int before = session.getHistory().size();
        try {
            step.run();
        } catch (InvalidRequestException e) {
            throw e;
        } catch (AgentException e) {
            log.error("Session {} failed in {} ({}): {}", session.getId(), session.getPhase(), e.getKind(),
                    e.getMessage());
            session.fail(e.getMessage(), "system");
        } catch (RuntimeException e) {
            log.error("Session {} failed in {}: {}", session.getId(), session.getPhase(), e.getMessage(), e);
            session.fail("Internal error: " + e.getMessage(), "system");
        }
        return persist(session, before);
    }

    private Session persist(Session session, int historyBefore) {
        store.save(session);
        List<PhaseTransition> added = session.getHistory().subList(historyBefore, session.getHistory().size());
        for (PhaseTransition transition : added) {
            log.info("Session {}: {} -> {}{}", session.getId(), transition.getFrom(), transition.getTo(),
                    transition.isApproval() ? " (approved by " + transition.getActor() + ")" : "");
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", String.valueOf(transition.getFrom()));
            details.put("to", String.valueOf(transition.getTo()));
            details.put("approval", transition.isApproval());
            if (transition.getError() != null) {
                details.put("error", transition.getError());
            }
            auditService.log(transition.getActor() != null ? transition.getActor() : "system", "PHASE_TRANSITION",
                    session.getId(), details, session.getId(), transition.getError() == null);
        }
        return session;
    }

    private void expire(Session session) {
        int before = session.getHistory().size();
        session.fail("Session expired at " + session.getExpiresAt(), "system");
        persist(session, before);
        throw new SessionExpiredException(session.getId(), session.getExpiresAt());
    }

    private Session load(String sessionId) {
        return store.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private Workflow workflow(WorkflowKind kind) {
        Workflow workflow = workflows.get(kind);
        if (workflow == null) {
            throw AgentException.precondition("No workflow registered for " + kind);
        }
        return workflow;
    }

    private Duration lockWait() {
        return Duration.ofSeconds(properties.getSessions().getLockWaitSeconds());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
