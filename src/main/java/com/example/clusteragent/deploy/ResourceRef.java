package com.example.clusteragent.deploy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * A resource declared in a manifest, as addressed by kubectl get.
 */
public record ResourceRef(String kind, String apiVersion, String name, String namespace) {

    public static ResourceRef of(JsonNode document) {
        JsonNode metadata = document.path("metadata");
        return new ResourceRef(
                document.path("kind").asText(),
                document.path("apiVersion").asText(),
                metadata.path("name").asText(),
                metadata.hasNonNull("namespace") ? metadata.get("namespace").asText() : null);
    }

    /**
     * kind.group for grouped resources (deployment.apps), plain kind for the core group.
     */
    public String kubectlResource() {
        String kindName = kind.toLowerCase(Locale.ROOT);
        int slash = apiVersion.indexOf('/');
        return slash > 0 ? kindName + "." + apiVersion.substring(0, slash) : kindName;
    }

    @Override
    public String toString() {
        return namespace != null ? kind + "/" + namespace + "/" + name : kind + "/" + name;
    }
}
