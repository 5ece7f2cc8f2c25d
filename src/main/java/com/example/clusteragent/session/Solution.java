package com.example.clusteragent.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A candidate combination of resource types that satisfies the user's intent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Solution {

    private String id;
    /** single | combination */
    private String type;
    /** Qualified resource names */
    @Builder.Default
    private List<String> resources = new ArrayList<>();
    /** 0-100 */
    private double score;
    private String description;
    @Builder.Default
    private List<String> reasons = new ArrayList<>();
    /** True when at least one resource is served by an operator (a custom resource) */
    private boolean operatorBacked;
    private RiskLevel risk;
    @Builder.Default
    private List<Question> questions = new ArrayList<>();
}
