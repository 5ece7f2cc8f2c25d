package com.example.clusteragent.cluster;

import com.example.clusteragent.config.AgentProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClusterContextTest {

    @Test
    void defaultsToServerSideDryRun() {
        ClusterContext context = new ClusterContext(null, null, " ");

        assertEquals("", context.kubeconfig());
        assertEquals("", context.context());
        assertEquals("server", context.dryRunMode());
    }

    @Test
    void buildsFromKubectlConfiguration() {
        AgentProperties.KubectlConfig config = new AgentProperties.KubectlConfig();
        config.setKubeconfig("/etc/kube/config");
        config.setContext("staging");
        config.setDryRunMode("client");

        ClusterContext context = ClusterContext.from(config);

        assertEquals(new ClusterContext("/etc/kube/config", "staging", "client"), context);
        assertEquals("server", context.withDryRunMode("server").dryRunMode());
        assertEquals("staging", context.withDryRunMode("server").context());
    }

    @Test
    void rejectsUnknownDryRunModes() {
        assertThrows(IllegalArgumentException.class, () -> new ClusterContext("", "", "none"));
    }
}
