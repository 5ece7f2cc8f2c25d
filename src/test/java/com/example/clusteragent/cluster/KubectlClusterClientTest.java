package com.example.clusteragent.cluster;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class KubectlClusterClientTest {

    private static final ClusterContext DEFAULT_CONTEXT = new ClusterContext(null, null, null);

    private final AtomicInteger drained = new AtomicInteger();
    private final Executor countingExecutor = task -> {
        drained.incrementAndGet();
        new Thread(task, "kubectl-io-test").start();
    };

    @Test
    void outputIsDrainedOnTheSuppliedExecutor() {
        KubectlClusterClient client = new KubectlClusterClient(properties("sh", 10), countingExecutor);

        CommandResult result = client.run(List.of("-c", "echo deployed; echo warning 1>&2; exit 3"), DEFAULT_CONTEXT);

        assertEquals(3, result.exitCode());
        assertEquals("deployed", result.stdout());
        assertEquals("warning", result.errorText());
        assertEquals(2, drained.get(), "one reader each for stdout and stderr");
    }

    @Test
    void commandTimeoutIsReportedAsTimeout() {
        KubectlClusterClient client = new KubectlClusterClient(properties("sleep", 1), countingExecutor);

        AgentException error = assertThrows(AgentException.class, () -> client.run(List.of("5"), DEFAULT_CONTEXT));

        assertEquals(ErrorKind.TIMEOUT, error.getKind());
        assertTrue(error.getMessage().contains("did not finish within 1s"));
    }

    @Test
    void missingBinaryIsAPreconditionError() {
        KubectlClusterClient client = new KubectlClusterClient(properties("/nonexistent/kubectl", 1), countingExecutor);

        AgentException error = assertThrows(AgentException.class, () -> client.run(List.of("version"), DEFAULT_CONTEXT));

        assertEquals(ErrorKind.PRECONDITION, error.getKind());
        assertEquals(0, drained.get());
    }

    private static AgentProperties properties(String binary, int timeoutSeconds) {
        AgentProperties properties = new AgentProperties();
        properties.getKubectl().setBinary(binary);
        properties.getKubectl().setCommandTimeoutSeconds(timeoutSeconds);
        return properties;
    }
}
