package com.example.clusteragent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cluster Operations Agent
 *
 * Turns natural-language intent into validated, deployable Kubernetes manifests and
 * observed cluster problems into diagnosed, approved, executed fixes.
 *
 * Architecture:
 * - Session Engine → recommendation and remediation state machines, persisted per session
 * - Capability Index → semantic index of the cluster's resource types
 * - Tool Gateway → phase-gated execution of plugin tools (kubectl, remote plugins)
 * - Manifest Validator / Deploy Operation → dry-run validation, apply and readiness polling
 */
@SpringBootApplication
@EnableScheduling
@EnableAsync
public class ClusterAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClusterAgentApplication.class, args);
    }
}
