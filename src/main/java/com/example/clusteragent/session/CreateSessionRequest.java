package com.example.clusteragent.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    private WorkflowKind kind;
    /** What to deploy (recommendation) */
    private String intent;
    /** What is wrong (remediation) */
    private String issue;
    private ExecutionOptions options;
}
