package com.example.clusteragent.validation;

/**
 * One finding of a manifest validation. {@code resource} is "Kind/name" when the
 * finding can be tied to a document, otherwise null.
 */
public record ValidationIssue(IssueCode code, String message, String resource) {

    @Override
    public String toString() {
        return resource != null ? code + " [" + resource + "]: " + message : code + ": " + message;
    }
}
