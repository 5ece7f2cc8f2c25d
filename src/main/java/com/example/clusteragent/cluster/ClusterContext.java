package com.example.clusteragent.cluster;

import com.example.clusteragent.config.AgentProperties;

/**
 * Which cluster a kubectl call talks to, and how dry-runs are performed there.
 * Blank kubeconfig/context mean the kubectl defaults.
 */
public record ClusterContext(String kubeconfig, String context, String dryRunMode) {

    public ClusterContext {
        kubeconfig = kubeconfig != null ? kubeconfig : "";
        context = context != null ? context : "";
        dryRunMode = dryRunMode == null || dryRunMode.isBlank() ? "server" : dryRunMode;
        if (!dryRunMode.equals("server") && !dryRunMode.equals("client")) {
            throw new IllegalArgumentException("Dry-run mode must be 'server' or 'client': " + dryRunMode);
        }
    }

    public static ClusterContext from(AgentProperties.KubectlConfig config) {
        return new ClusterContext(config.getKubeconfig(), config.getContext(), config.getDryRunMode());
    }

    public ClusterContext withDryRunMode(String mode) {
        return new ClusterContext(kubeconfig, context, mode);
    }
}
