package com.example.clusteragent.session;

import com.example.clusteragent.capability.CapabilityRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders candidate solutions. Among solutions that satisfy the intent (score at or
 * above {@link #SATISFIES_INTENT}), operator-backed ones come first; everything else
 * is ordered by score.
 */
@Component
public class SolutionRanker {

    static final double SATISFIES_INTENT = 50.0;

    private static final Set<String> BUILT_IN_GROUPS = Set.of(
            "", "apps", "batch", "autoscaling", "policy", "networking.k8s.io", "rbac.authorization.k8s.io",
            "storage.k8s.io", "scheduling.k8s.io", "coordination.k8s.io", "discovery.k8s.io",
            "node.k8s.io", "certificates.k8s.io", "admissionregistration.k8s.io", "apiextensions.k8s.io",
            "apiregistration.k8s.io", "events.k8s.io", "flowcontrol.apiserver.k8s.io");

    /**
     * Marks operator-backed solutions and derives their risk from the most complex
     * resource they use, then sorts best first.
     */
    public List<Solution> rank(List<Solution> solutions, Map<String, CapabilityRecord> recordsByName) {
        for (Solution solution : solutions) {
            RiskLevel risk = RiskLevel.LOW;
            boolean operatorBacked = false;
            for (String resource : solution.getResources()) {
                CapabilityRecord record = recordsByName.get(resource);
                if (record == null) {
                    continue;
                }
                operatorBacked |= !BUILT_IN_GROUPS.contains(record.getGroup());
                RiskLevel resourceRisk = RiskLevel.of(record.getComplexity());
                if (!resourceRisk.isAtMost(risk)) {
                    risk = resourceRisk;
                }
            }
            solution.setOperatorBacked(operatorBacked);
            solution.setRisk(risk);
        }
        return solutions.stream().sorted(SolutionRanker::compare).toList();
    }

    private static int compare(Solution a, Solution b) {
        boolean aSatisfies = a.getScore() >= SATISFIES_INTENT;
        boolean bSatisfies = b.getScore() >= SATISFIES_INTENT;
        if (aSatisfies != bSatisfies) {
            return aSatisfies ? -1 : 1;
        }
        if (aSatisfies && a.isOperatorBacked() != b.isOperatorBacked()) {
            return a.isOperatorBacked() ? -1 : 1;
        }
        return Double.compare(b.getScore(), a.getScore());
    }
}
