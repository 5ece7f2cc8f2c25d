package com.example.clusteragent.capability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Optional restrictions of a capability search. Null fields do not restrict.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapabilitySearchFilters {

    /** API group, "" for the core group */
    private String group;
    /** Verb the resource must support, e.g. "create" */
    private String verb;
    private Complexity complexity;
    /** Any of these providers */
    private List<String> providers;
    private Integer limit;
    private Double scoreThreshold;

    public static CapabilitySearchFilters none() {
        return new CapabilitySearchFilters();
    }

    public boolean matches(CapabilityRecord record) {
        if (group != null && !group.equals(record.getGroup())) {
            return false;
        }
        if (verb != null && (record.getVerbs() == null || !record.getVerbs().contains(verb))) {
            return false;
        }
        if (complexity != null && complexity != record.getComplexity()) {
            return false;
        }
        if (providers != null && !providers.isEmpty()
                && record.getProviders().stream().noneMatch(providers::contains)) {
            return false;
        }
        return true;
    }
}
