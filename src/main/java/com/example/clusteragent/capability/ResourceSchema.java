package com.example.clusteragent.capability;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A resource type served by the cluster, as input to capability indexing.
 * The semantic fields are optional; missing ones are inferred through the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceSchema {

    private String kind;
    /** API group; empty for the core group */
    private String group;
    private String version;
    private String plural;
    private boolean namespaced;
    private List<String> verbs;

    private String description;
    /** Field documentation or OpenAPI schema text, fed to the inference prompt */
    private String schemaText;

    private List<String> capabilities;
    private List<String> providers;
    private List<String> abstractions;
    private Complexity complexity;

    /**
     * {@code plural.group} for grouped resources, {@code plural} for the core group.
     */
    public String qualifiedName() {
        return group == null || group.isBlank() ? plural : plural + "." + group;
    }

    public String apiVersion() {
        return group == null || group.isBlank() ? version : group + "/" + version;
    }

    public boolean hasInferredFields() {
        return capabilities != null && !capabilities.isEmpty() && description != null && !description.isBlank();
    }
}
