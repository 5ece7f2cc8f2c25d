package com.example.clusteragent.agent;

import com.example.clusteragent.session.Phase;
import com.example.clusteragent.session.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phase-scoped tool policy. Decides which risk classes are exposed to the model
 * in a given workflow phase:
 *
 * - Investigating / Analyzed / Clarifying / SolutionAssembled / AwaitingAnswers: read-only
 * - AwaitingApproval: nothing (human checkpoint)
 * - Remediating / Executed / ManifestGenerated: read-only, plus mutating once an
 *   approval is recorded in the session history
 * - terminal phases: nothing
 *
 * The gateway re-checks the approval itself on every mutating invocation.
 */
@Slf4j
@Component
public class ToolPolicyEngine {

    public Set<RiskClass> allowedRiskClasses(Session session) {
        return allowedRiskClasses(session.getPhase(), session.hasRecordedApproval());
    }

    public Set<RiskClass> allowedRiskClasses(Phase phase, boolean approvalRecorded) {
        Set<RiskClass> allowed = switch (phase) {
            case INVESTIGATING, ANALYZED, CLARIFYING, SOLUTION_ASSEMBLED, AWAITING_ANSWERS ->
                    EnumSet.of(RiskClass.READ_ONLY);
            case REMEDIATING, EXECUTED, MANIFEST_GENERATED -> approvalRecorded
                    ? EnumSet.of(RiskClass.READ_ONLY, RiskClass.MUTATING)
                    : EnumSet.of(RiskClass.READ_ONLY);
            case AWAITING_APPROVAL, VALIDATED, DEPLOYED, FAILED -> EnumSet.noneOf(RiskClass.class);
        };
        log.debug("Phase {} (approval={}) allows {}", phase, approvalRecorded, allowed);
        return allowed;
    }
}
