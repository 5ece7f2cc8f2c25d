package com.example.clusteragent.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How far a session may proceed without a human. In automatic mode the checkpoint is
 * skipped only when the proposal's confidence reaches the threshold and its risk does
 * not exceed {@code maxRiskLevel}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionOptions {

    @Builder.Default
    private ExecutionMode mode = ExecutionMode.MANUAL;

    /** Null means the configured default */
    private Double confidenceThreshold;

    @Builder.Default
    private RiskLevel maxRiskLevel = RiskLevel.LOW;

    public static ExecutionOptions manual() {
        return new ExecutionOptions();
    }
}
