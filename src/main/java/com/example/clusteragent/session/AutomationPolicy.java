package com.example.clusteragent.session;

import com.example.clusteragent.config.AgentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides whether a human checkpoint may be skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutomationPolicy {

    private final AgentProperties properties;

    public AutomationDecision decide(ExecutionOptions options, double confidence, RiskLevel risk) {
        ExecutionOptions effective = options != null ? options : ExecutionOptions.manual();
        if (effective.getMode() != ExecutionMode.AUTOMATIC) {
            return new AutomationDecision(false, "Manual mode selected; waiting for the user");
        }
        double threshold = effective.getConfidenceThreshold() != null
                ? effective.getConfidenceThreshold()
                : properties.getWorkflow().getDefaultConfidenceThreshold();
        RiskLevel maxRisk = effective.getMaxRiskLevel() != null ? effective.getMaxRiskLevel() : RiskLevel.LOW;

        if (confidence < threshold) {
            return new AutomationDecision(false, String.format(Locale.ROOT,
                    "Confidence %.2f is below the threshold %.2f; manual review required", confidence, threshold));
        }
        if (risk == null || !risk.isAtMost(maxRisk)) {
            return new AutomationDecision(false, "Risk level " + (risk != null ? risk.toValue() : "unknown")
                    + " exceeds the maximum " + maxRisk.toValue() + "; manual approval required");
        }
        AutomationDecision decision = new AutomationDecision(true, String.format(Locale.ROOT,
                "Automatic execution: confidence %.2f >= %.2f, risk %s <= %s",
                confidence, threshold, risk.toValue(), maxRisk.toValue()));
        log.debug(decision.reason());
        return decision;
    }
}
