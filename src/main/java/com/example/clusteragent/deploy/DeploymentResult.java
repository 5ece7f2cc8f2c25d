package com.example.clusteragent.deploy;

import com.example.clusteragent.agent.ToolInvocation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one deploy attempt. {@code success} reflects the apply;
 * {@code applyTimeout} is set when the apply itself did not answer in time, so the
 * objects may or may not exist; {@code readinessTimeout} is set when the apply went
 * through but some workload was still not ready when the bound elapsed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentResult {

    private boolean success;
    private boolean applyTimeout;
    private boolean readinessTimeout;
    private String manifestPath;
    private String output;
    private String error;
    @Builder.Default
    private List<String> notReady = new ArrayList<>();
    private long durationMs;
    @Builder.Default
    private List<ToolInvocation> invocations = new ArrayList<>();
}
