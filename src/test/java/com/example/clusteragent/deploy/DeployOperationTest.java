package com.example.clusteragent.deploy;

import com.example.clusteragent.agent.InvocationOutcome;
import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolArgumentValidator;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolGateway;
import com.example.clusteragent.agent.ToolResult;
import com.example.clusteragent.agent.ToolRegistry;
import com.example.clusteragent.cluster.CommandResult;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.error.ToolPermissionException;
import com.example.clusteragent.service.AuditService;
import com.example.clusteragent.session.Phase;
import com.example.clusteragent.session.PhaseTransition;
import com.example.clusteragent.support.FakeClusterClient;
import com.example.clusteragent.support.StubTool;
import com.example.clusteragent.tools.KubectlApplyTool;
import com.example.clusteragent.tools.KubectlGetTool;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class DeployOperationTest {

    private static final Set<RiskClass> ALL = EnumSet.allOf(RiskClass.class);

    private static final String CONFIG_MAP = """
            apiVersion: v1
            kind: ConfigMap
            metadata:
              name: settings
              namespace: shop
            data:
              mode: fast
            """;

    private static final String DEPLOYMENT = """
            apiVersion: apps/v1
            kind: Deployment
            metadata:
              name: web
              namespace: shop
            spec:
              replicas: 2
            """;

    private FakeClusterClient cluster;
    private DeployOperation deployOperation;
    private final List<Long> sleeps = new ArrayList<>();

    @TempDir
    Path sessions;

    @BeforeEach
    void setUp() {
        cluster = new FakeClusterClient();
        AgentProperties properties = new AgentProperties();
        properties.getDeploy().setPollIntervalMs(10);
        ObjectMapper mapper = new ObjectMapper();
        ToolRegistry registry = new ToolRegistry();
        registry.register("kubernetes", new KubectlApplyTool(cluster, properties, mapper));
        registry.register("kubernetes", new KubectlGetTool(cluster, properties, mapper));
        ToolGateway gateway = new ToolGateway(registry, new ToolArgumentValidator(), mock(AuditService.class),
                new SimpleAsyncTaskExecutor());
        deployOperation = new DeployOperation(gateway, properties, millis -> {
            sleeps.add(millis);
            Thread.sleep(millis);
        });
    }

    @Test
    void resourcesWithoutReadinessRulesSucceedImmediately() throws IOException {
        writeManifest("sol-1", CONFIG_MAP);

        DeploymentResult result = deployOperation.deploy(sessions, "sol-1", Duration.ofSeconds(5), approved(), ALL);

        assertTrue(result.isSuccess());
        assertFalse(result.isReadinessTimeout());
        assertTrue(result.getNotReady().isEmpty());
        assertEquals(1, cluster.getObjects().size());
        assertTrue(cluster.commandsStartingWith("get").isEmpty());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void readyWorkloadCompletesTheDeploy() throws IOException {
        cluster.markAllReady();
        writeManifest("sol-1", CONFIG_MAP + "---\n" + DEPLOYMENT);

        DeploymentResult result = deployOperation.deploy(sessions, "sol-1", Duration.ofSeconds(5), approved(), ALL);

        assertTrue(result.isSuccess());
        assertFalse(result.isReadinessTimeout());
        assertEquals("deployment.apps", cluster.commandsStartingWith("get").get(0).get(1));
        assertEquals(2, result.getInvocations().size());
    }

    @Test
    void unreadyWorkloadEndsInReadinessTimeout() throws IOException {
        writeManifest("sol-1", DEPLOYMENT);

        DeploymentResult result = deployOperation.deploy(sessions, "sol-1", Duration.ofMillis(200), approved(), ALL);

        assertTrue(result.isSuccess());
        assertTrue(result.isReadinessTimeout());
        assertEquals(List.of("Deployment/shop/web"), result.getNotReady());
        assertTrue(cluster.commandsStartingWith("get").size() > 1, "readiness is polled");
        assertTrue(sleeps.stream().allMatch(ms -> ms <= 10));
        assertEquals(2, result.getInvocations().size(), "only the latest poll per resource is kept");
    }

    @Test
    void workloadBecomingReadyWhilePolling() throws IOException {
        int[] polls = {0};
        cluster.setStatus(doc -> {
            ObjectNode status = new ObjectMapper().createObjectNode();
            status.put("readyReplicas", ++polls[0] >= 3 ? 2 : 0);
            return status;
        });
        writeManifest("sol-1", DEPLOYMENT);

        DeploymentResult result = deployOperation.deploy(sessions, "sol-1", Duration.ofSeconds(5), approved(), ALL);

        assertFalse(result.isReadinessTimeout());
        assertEquals(3, polls[0]);
        assertEquals(2, sleeps.size());
    }

    @Test
    void redeployingIsIdempotent() throws IOException {
        cluster.markAllReady();
        writeManifest("sol-1", CONFIG_MAP + "---\n" + DEPLOYMENT);

        deployOperation.deploy(sessions, "sol-1", Duration.ofSeconds(5), approved(), ALL);
        deployOperation.deploy(sessions, "sol-1", Duration.ofSeconds(5), approved(), ALL);

        assertEquals(2, cluster.getObjects().size());
        assertEquals(2, cluster.commandsStartingWith("apply").size());
    }

    @Test
    void failedApplyIsReportedWithoutPolling() throws IOException {
        cluster.setApplyFailure(new CommandResult(1, "", "error: namespaces \"shop\" not found"));
        writeManifest("sol-1", DEPLOYMENT);

        DeploymentResult result = deployOperation.deploy(sessions, "sol-1", Duration.ofSeconds(5), approved(), ALL);

        assertFalse(result.isSuccess());
        assertFalse(result.isApplyTimeout());
        assertTrue(result.getError().contains("not found"));
        assertEquals(InvocationOutcome.FAILED, result.getInvocations().get(0).getOutcome());
        assertTrue(cluster.commandsStartingWith("get").isEmpty());
    }

    @Test
    void applyThatTimesOutIsNotReportedAsAFailure() throws IOException {
        AgentProperties properties = new AgentProperties();
        properties.getWorkflow().setToolTimeoutSeconds(1);
        ToolRegistry registry = new ToolRegistry();
        StubTool slowApply = new StubTool("kubectl_apply", RiskClass.MUTATING).answering(args -> {
            try {
                Thread.sleep(3_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ToolResult.text("applied late");
        });
        registry.register("kubernetes", slowApply);
        registry.register("kubernetes", new KubectlGetTool(cluster, properties, new ObjectMapper()));
        ToolGateway gateway = new ToolGateway(registry, new ToolArgumentValidator(), mock(AuditService.class),
                new SimpleAsyncTaskExecutor());
        DeployOperation slowDeploy = new DeployOperation(gateway, properties, Thread::sleep);
        writeManifest("sol-1", DEPLOYMENT);

        DeploymentResult result = slowDeploy.deploy(sessions, "sol-1", Duration.ofSeconds(5), approved(), ALL);

        assertFalse(result.isSuccess());
        assertTrue(result.isApplyTimeout());
        assertFalse(result.isReadinessTimeout());
        assertEquals(InvocationOutcome.TIMED_OUT, result.getInvocations().get(0).getOutcome());
        assertTrue(cluster.commandsStartingWith("get").isEmpty());
    }

    @Test
    void applyWithoutApprovalIsDenied() throws IOException {
        writeManifest("sol-1", CONFIG_MAP);
        ToolContext unapproved = ToolContext.builder().sessionId("rec-1").phase(Phase.MANIFEST_GENERATED.name()).build();

        assertThrows(ToolPermissionException.class,
                () -> deployOperation.deploy(sessions, "sol-1", Duration.ofSeconds(5), unapproved, ALL));
        assertTrue(cluster.getObjects().isEmpty());
    }

    @Test
    void missingDirectoryOrManifestIsAPreconditionError() throws IOException {
        AgentException noDir = assertThrows(AgentException.class, () -> deployOperation.deploy(
                sessions.resolve("absent"), "sol-1", Duration.ofSeconds(1), approved(), ALL));
        Files.createDirectories(sessions.resolve("sol-2"));
        AgentException noManifest = assertThrows(AgentException.class, () -> deployOperation.deploy(
                sessions, "sol-2", Duration.ofSeconds(1), approved(), ALL));

        assertEquals(ErrorKind.PRECONDITION, noDir.getKind());
        assertEquals(ErrorKind.PRECONDITION, noManifest.getKind());
    }

    private void writeManifest(String solutionId, String content) throws IOException {
        Path dir = Files.createDirectories(sessions.resolve(solutionId));
        Files.writeString(dir.resolve(DeployOperation.MANIFEST_FILE), content);
    }

    private static ToolContext approved() {
        return ToolContext.builder()
                .sessionId("rec-1")
                .phase(Phase.MANIFEST_GENERATED.name())
                .transition(PhaseTransition.builder()
                        .from(Phase.MANIFEST_GENERATED).to(Phase.MANIFEST_GENERATED)
                        .approval(true).actor("user").build())
                .build();
    }
}
