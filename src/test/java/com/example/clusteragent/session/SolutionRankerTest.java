package com.example.clusteragent.session;

import com.example.clusteragent.capability.CapabilityRecord;
import com.example.clusteragent.capability.Complexity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SolutionRankerTest {

    private final SolutionRanker ranker = new SolutionRanker();

    private static CapabilityRecord record(String name, String group, Complexity complexity) {
        return CapabilityRecord.builder()
                .resourceName(name)
                .apiVersion(group.isEmpty() ? "v1" : group + "/v1")
                .complexity(complexity)
                .build();
    }

    private static final Map<String, CapabilityRecord> RECORDS = Map.of(
            "postgresqls.acid.zalan.do", record("postgresqls.acid.zalan.do", "acid.zalan.do", Complexity.HIGH),
            "statefulsets.apps", record("statefulsets.apps", "apps", Complexity.MEDIUM),
            "services", record("services", "", Complexity.LOW));

    private static Solution solution(String id, double score, String... resources) {
        return Solution.builder().id(id).score(score).resources(List.of(resources)).build();
    }

    @Test
    void operatorBackedSolutionsLeadAmongThoseThatSatisfyTheIntent() {
        List<Solution> ranked = ranker.rank(List.of(
                solution("plain", 92, "statefulsets.apps", "services"),
                solution("operator", 75, "postgresqls.acid.zalan.do"),
                solution("weak", 40, "postgresqls.acid.zalan.do")), RECORDS);

        assertEquals(List.of("operator", "plain", "weak"), ranked.stream().map(Solution::getId).toList());
        assertTrue(ranked.get(0).isOperatorBacked());
        assertFalse(ranked.get(1).isOperatorBacked());
    }

    @Test
    void belowTheIntentThresholdOnlyTheScoreCounts() {
        List<Solution> ranked = ranker.rank(List.of(
                solution("operator", 30, "postgresqls.acid.zalan.do"),
                solution("plain", 45, "services")), RECORDS);

        assertEquals("plain", ranked.get(0).getId());
    }

    @Test
    void riskFollowsTheMostComplexResource() {
        List<Solution> ranked = ranker.rank(List.of(
                solution("mixed", 80, "services", "statefulsets.apps"),
                solution("simple", 60, "services")), RECORDS);

        assertEquals(RiskLevel.MEDIUM, ranked.get(0).getRisk());
        assertEquals(RiskLevel.LOW, ranked.get(1).getRisk());
    }
}
