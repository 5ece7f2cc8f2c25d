package com.example.clusteragent.session;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.error.InvalidRequestException;
import com.example.clusteragent.error.SessionExpiredException;
import com.example.clusteragent.error.SessionNotFoundException;
import com.example.clusteragent.service.AuditService;
import com.example.clusteragent.support.InMemorySessionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SessionEngineTest {

    @TempDir
    Path sessionsDir;

    private InMemorySessionStore store;
    private AuditService auditService;
    private StepWorkflow workflow;
    private SessionFiles files;
    private SessionEngine engine;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.getSessions().setDirectory(sessionsDir.toString());
        properties.getSessions().setLockWaitSeconds(0);
        store = new InMemorySessionStore();
        auditService = mock(AuditService.class);
        workflow = new StepWorkflow();
        files = new SessionFiles(properties);
        engine = new SessionEngine(store, new SessionLocks(), files, auditService, properties, List.of(workflow));
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Session create() {
        return engine.createSession(CreateSessionRequest.builder()
                .kind(WorkflowKind.REMEDIATION)
                .issue("api latency is high")
                .build());
    }

    @Test
    void createRunsTheInitialStepAndPersists() {
        Session session = create();

        assertEquals(Phase.AWAITING_APPROVAL, session.getPhase());
        Session stored = store.find(session.getId()).orElseThrow();
        assertEquals(Phase.AWAITING_APPROVAL, stored.getPhase());
        assertEquals(List.of(Phase.INVESTIGATING, Phase.ANALYZED, Phase.AWAITING_APPROVAL),
                stored.getHistory().stream().map(PhaseTransition::getTo).toList());
        assertNotNull(stored.getExpiresAt());
        verify(auditService).log(eq("system"), eq("SESSION_CREATED"), eq(session.getId()), any(),
                eq(session.getId()), eq(true));
        verify(auditService, atLeastOnce()).log(anyString(), eq("PHASE_TRANSITION"), eq(session.getId()), any(),
                anyString(), anyBoolean());
    }

    @Test
    void createRejectsIncompleteRequests() {
        assertThrows(InvalidRequestException.class, () -> engine.createSession(new CreateSessionRequest()));
        assertThrows(InvalidRequestException.class, () -> engine.createSession(CreateSessionRequest.builder()
                .kind(WorkflowKind.REMEDIATION).build()));
        assertThrows(InvalidRequestException.class, () -> engine.createSession(CreateSessionRequest.builder()
                .kind(WorkflowKind.RECOMMENDATION).intent(" ").build()));
        assertThrows(InvalidRequestException.class, () -> engine.createSession(CreateSessionRequest.builder()
                .kind(WorkflowKind.REMEDIATION).issue("x")
                .options(ExecutionOptions.builder().confidenceThreshold(1.5).build())
                .build()));
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void workflowWithoutRegistrationFailsTheSession() {
        Session session = engine.createSession(CreateSessionRequest.builder()
                .kind(WorkflowKind.RECOMMENDATION).intent("redis cache").build());

        assertEquals(Phase.FAILED, session.getPhase());
        assertTrue(session.getError().contains("No workflow registered for RECOMMENDATION"));
    }

    @Test
    void unknownSessionIsNotFound() {
        SessionNotFoundException e = assertThrows(SessionNotFoundException.class,
                () -> engine.advance("rem-missing", new AdvanceRequest()));
        assertEquals(ErrorKind.NOT_FOUND, e.getKind());
        assertThrows(SessionNotFoundException.class, () -> engine.getSession("rem-missing"));
    }

    @Test
    void expiredSessionIsFailedAndReportedAsExpired() {
        Session session = create();
        Session stored = store.find(session.getId()).orElseThrow();
        stored.setExpiresAt(Instant.now().minusSeconds(60));
        store.save(stored);

        assertThrows(SessionExpiredException.class, () -> engine.advance(session.getId(), new AdvanceRequest()));

        Session after = store.find(session.getId()).orElseThrow();
        assertEquals(Phase.FAILED, after.getPhase());
        assertTrue(after.getError().startsWith("Session expired at"));
        assertThrows(SessionExpiredException.class, () -> engine.getSession(session.getId()));
    }

    @Test
    void terminalSessionCannotBeAdvanced() {
        Session session = create();
        engine.advance(session.getId(), AdvanceRequest.builder().action(AdvanceAction.REJECT).build());

        AgentException e = assertThrows(AgentException.class,
                () -> engine.advance(session.getId(), new AdvanceRequest()));

        assertEquals(ErrorKind.CONFLICT, e.getKind());
        assertEquals("Rejected by user", store.find(session.getId()).orElseThrow().getError());
    }

    @Test
    void rejectedInputLeavesTheStoredSessionUntouched() {
        Session session = create();
        int saves = store.getSaves();
        workflow.onAdvance = (s, request) -> {
            throw new InvalidRequestException("answers are incomplete");
        };

        assertThrows(InvalidRequestException.class, () -> engine.advance(session.getId(), new AdvanceRequest()));

        assertEquals(saves, store.getSaves());
        assertEquals(Phase.AWAITING_APPROVAL, store.find(session.getId()).orElseThrow().getPhase());
    }

    @Test
    void workflowFailureMovesTheSessionToFailed() {
        Session session = create();
        workflow.onAdvance = (s, request) -> {
            throw new IllegalStateException("boom");
        };

        Session failed = engine.advance(session.getId(), new AdvanceRequest());

        assertEquals(Phase.FAILED, failed.getPhase());
        assertEquals("Internal error: boom", failed.getError());
        assertEquals(Phase.AWAITING_APPROVAL, failed.getHistory().get(failed.getHistory().size() - 1).getFrom());
        assertEquals(Phase.FAILED, store.find(session.getId()).orElseThrow().getPhase());
    }

    @Test
    void concurrentAdvanceOnTheSameSessionConflicts() throws Exception {
        Session session = create();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        workflow.onAdvance = (s, request) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            s.approveAndTransitionTo(Phase.REMEDIATING, request.effectiveActor(), null);
        };
        Future<Session> first = executor.submit(() -> engine.advance(session.getId(), new AdvanceRequest()));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        AgentException e = assertThrows(AgentException.class,
                () -> engine.advance(session.getId(), new AdvanceRequest()));

        assertEquals(ErrorKind.CONFLICT, e.getKind());
        release.countDown();
        assertEquals(Phase.REMEDIATING, first.get(5, TimeUnit.SECONDS).getPhase());
    }

    @Test
    void deleteRemovesTheSessionAndItsDirectory() throws Exception {
        Session session = create();
        files.writeManifest(session.getId(), 1, "kind: ConfigMap\n");

        engine.deleteSession(session.getId());

        assertTrue(store.find(session.getId()).isEmpty());
        assertFalse(Files.exists(sessionsDir.resolve(session.getId())));
        assertThrows(SessionNotFoundException.class, () -> engine.deleteSession(session.getId()));
    }

    @Test
    void pruneDeletesOnlyExpiredSessions() {
        Session expired = create();
        Session live = create();
        Session stored = store.find(expired.getId()).orElseThrow();
        stored.setExpiresAt(Instant.now().minusSeconds(1));
        store.save(stored);

        assertEquals(1, engine.pruneExpired());

        assertTrue(store.find(expired.getId()).isEmpty());
        assertTrue(store.find(live.getId()).isPresent());
        assertEquals(1, engine.listSessions().size());
    }

    /**
     * Remediation-shaped workflow whose advance step is supplied by the test.
     */
    private static class StepWorkflow implements Workflow {

        volatile BiConsumer<Session, AdvanceRequest> onAdvance =
                (s, request) -> s.approveAndTransitionTo(Phase.REMEDIATING, request.effectiveActor(), null);

        @Override
        public WorkflowKind kind() {
            return WorkflowKind.REMEDIATION;
        }

        @Override
        public void start(Session session) {
            session.transitionTo(Phase.ANALYZED, "system", null);
            session.transitionTo(Phase.AWAITING_APPROVAL, "system", null);
        }

        @Override
        public void advance(Session session, AdvanceRequest request) {
            onAdvance.accept(session, request);
        }
    }
}
