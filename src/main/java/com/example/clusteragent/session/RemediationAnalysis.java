package com.example.clusteragent.session;

import com.example.clusteragent.error.AgentException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Final diagnosis produced by the investigation loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemediationAnalysis {

    private String rootCause;
    private double confidence;
    @Builder.Default
    private List<String> factors = new ArrayList<>();
    private String summary;
    @Builder.Default
    private List<RemediationAction> actions = new ArrayList<>();
    /** Overall risk of applying every action */
    private RiskLevel risk;
    /** What to check after execution to confirm the fix */
    private String validationIntent;

    /**
     * Rejects analyses the workflow cannot act on.
     */
    public void validate() {
        if (rootCause == null || rootCause.isBlank()) {
            throw AgentException.validation("Analysis has no root cause");
        }
        if (confidence < 0 || confidence > 1) {
            throw AgentException.validation("Analysis confidence must be between 0 and 1: " + confidence);
        }
        if (risk == null) {
            throw AgentException.validation("Analysis has no overall risk level");
        }
        for (RemediationAction action : actions) {
            if (action.getTool() == null || action.getTool().isBlank()) {
                throw AgentException.validation("Remediation action has no tool: " + action.getDescription());
            }
            if (action.getRisk() == null) {
                throw AgentException.validation("Remediation action has no risk level: " + action.getDescription());
            }
        }
    }
}
