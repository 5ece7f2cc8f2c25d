package com.example.clusteragent.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemediationAction {

    private String description;
    /** Gateway tool that carries out the action */
    private String tool;
    @Builder.Default
    private Map<String, Object> arguments = new LinkedHashMap<>();
    private RiskLevel risk;
    private String rationale;
}
