package com.example.clusteragent.capability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Indexed semantic description of one cluster resource type. The vector lives in the
 * vector store next to the record and is not part of its JSON form.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CapabilityRecord {

    private String id;
    /** Qualified resource name, e.g. "postgresqls.acid.zalan.do" */
    private String resourceName;
    private String kind;
    private String apiVersion;
    private boolean namespaced;

    @Builder.Default
    private List<String> capabilities = new ArrayList<>();
    @Builder.Default
    private List<String> providers = new ArrayList<>();
    @Builder.Default
    private List<String> abstractions = new ArrayList<>();
    @Builder.Default
    private List<String> verbs = new ArrayList<>();

    @Builder.Default
    private Complexity complexity = Complexity.MEDIUM;
    private String description;
    private String useCase;
    private double confidence;
    private Instant analyzedAt;

    @JsonIgnore
    private float[] embedding;

    /**
     * API group derived from the apiVersion; empty for the core group.
     */
    @JsonIgnore
    public String getGroup() {
        if (apiVersion == null) {
            return "";
        }
        int slash = apiVersion.indexOf('/');
        return slash > 0 ? apiVersion.substring(0, slash) : "";
    }

    /**
     * Text the embedding and the keyword matching are computed from.
     */
    public String searchText() {
        List<String> parts = new ArrayList<>();
        parts.add(resourceName);
        parts.add(kind);
        parts.addAll(capabilities);
        parts.addAll(providers);
        parts.addAll(abstractions);
        parts.add(description);
        parts.add(useCase);
        parts.add(complexity.toValue());
        return String.join(" ", parts.stream().filter(p -> p != null && !p.isBlank()).toList());
    }
}
