package com.example.clusteragent.validation;

import com.example.clusteragent.cluster.ClusterClient;
import com.example.clusteragent.cluster.ClusterContext;
import com.example.clusteragent.cluster.CommandResult;
import com.example.clusteragent.error.AgentException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validates a manifest file without touching cluster state: structural checks first,
 * then a kubectl dry-run apply against the live API schema. Hard errors make the
 * manifest invalid; best-practice findings are only warnings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ManifestValidator {

    private static final Set<String> CLUSTER_SCOPED_KINDS = Set.of(
            "Namespace", "Node", "PersistentVolume", "ClusterRole", "ClusterRoleBinding", "StorageClass",
            "CustomResourceDefinition", "PriorityClass", "IngressClass", "APIService", "RuntimeClass",
            "MutatingWebhookConfiguration", "ValidatingWebhookConfiguration", "ClusterIssuer");

    private final ClusterClient clusterClient;

    public ManifestValidationResult validate(Path manifestPath, ClusterContext context) {
        if (!Files.isRegularFile(manifestPath)) {
            throw AgentException.precondition("Manifest file not found: " + manifestPath);
        }
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();

        List<JsonNode> documents;
        try {
            documents = Manifests.readDocuments(manifestPath);
        } catch (IOException e) {
            errors.add(new ValidationIssue(IssueCode.PARSE_ERROR, "Manifest is not valid YAML: " + e.getMessage(), null));
            return result(errors, warnings);
        }
        if (documents.isEmpty()) {
            errors.add(new ValidationIssue(IssueCode.EMPTY_MANIFEST, "Manifest contains no resources", null));
            return result(errors, warnings);
        }

        for (JsonNode doc : documents) {
            checkStructure(doc, errors);
            addBestPracticeWarnings(doc, warnings);
        }
        if (!errors.isEmpty()) {
            return result(errors, warnings);
        }

        CommandResult dryRun = clusterClient.run(
                List.of("apply", "--dry-run=" + context.dryRunMode(), "-f", manifestPath.toString()), context);
        if (!dryRun.isSuccess()) {
            errors.add(classify(dryRun.errorText()));
        }
        ManifestValidationResult result = result(errors, warnings);
        log.info("Validated {} ({} documents, {} dry-run): {} errors, {} warnings", manifestPath.getFileName(),
                documents.size(), context.dryRunMode(), errors.size(), warnings.size());
        return result;
    }

    private static void checkStructure(JsonNode doc, List<ValidationIssue> errors) {
        String resource = Manifests.describe(doc);
        if (!doc.hasNonNull("apiVersion")) {
            errors.add(new ValidationIssue(IssueCode.MISSING_FIELD, "Missing required field: apiVersion", resource));
        }
        if (!doc.hasNonNull("kind")) {
            errors.add(new ValidationIssue(IssueCode.MISSING_FIELD, "Missing required field: kind", resource));
        }
        if (!doc.path("metadata").hasNonNull("name") && !doc.path("metadata").hasNonNull("generateName")) {
            errors.add(new ValidationIssue(IssueCode.MISSING_FIELD, "Missing required field: metadata.name", resource));
        }
    }

    private static void addBestPracticeWarnings(JsonNode doc, List<ValidationIssue> warnings) {
        String resource = Manifests.describe(doc);
        JsonNode metadata = doc.path("metadata");
        if (!metadata.has("labels") || metadata.path("labels").isEmpty()) {
            warnings.add(new ValidationIssue(IssueCode.MISSING_LABELS,
                    "Consider adding labels to metadata for better resource organization", resource));
        }
        if (!metadata.hasNonNull("namespace") && !CLUSTER_SCOPED_KINDS.contains(doc.path("kind").asText())) {
            warnings.add(new ValidationIssue(IssueCode.MISSING_NAMESPACE,
                    "Consider specifying a namespace for better resource isolation", resource));
        }
    }

    static ValidationIssue classify(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("unknown field")) {
            return new ValidationIssue(IssueCode.UNKNOWN_FIELD, "Unknown field in manifest: " + message, null);
        }
        if (lower.contains("required field") || lower.contains("required value")) {
            return new ValidationIssue(IssueCode.MISSING_FIELD, "Missing required field: " + message, null);
        }
        if (lower.contains("cannot unmarshal") || lower.contains("invalid type") || lower.contains("expected type")) {
            return new ValidationIssue(IssueCode.TYPE_MISMATCH, "Type mismatch: " + message, null);
        }
        if (lower.contains("validation failed") || lower.contains("is invalid")) {
            return new ValidationIssue(IssueCode.VALIDATION_FAILED, "Kubernetes validation failed: " + message, null);
        }
        return new ValidationIssue(IssueCode.DRY_RUN_ERROR, "Validation error: " + message, null);
    }

    private static ManifestValidationResult result(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return ManifestValidationResult.builder()
                .valid(errors.isEmpty())
                .errors(errors)
                .warnings(warnings)
                .build();
    }
}
