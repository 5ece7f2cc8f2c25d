package com.example.clusteragent.validation;

import com.example.clusteragent.cluster.ClusterContext;
import com.example.clusteragent.cluster.CommandResult;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.support.FakeClusterClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestValidatorTest {

    private static final ClusterContext SERVER = new ClusterContext("", "", "server");

    private FakeClusterClient cluster;
    private ManifestValidator validator;

    @TempDir
    Path tmp;

    @BeforeEach
    void setUp() {
        cluster = new FakeClusterClient();
        validator = new ManifestValidator(cluster);
    }

    @Test
    void validManifestPassesWithDryRun() throws IOException {
        Path manifest = write("""
                apiVersion: apps/v1
                kind: Deployment
                metadata:
                  name: web
                  namespace: shop
                  labels:
                    app: web
                spec:
                  replicas: 2
                """);

        ManifestValidationResult result = validator.validate(manifest, SERVER);

        assertTrue(result.isValid());
        assertTrue(result.getWarnings().isEmpty());
        assertEquals(List.of("apply", "--dry-run=server", "-f", manifest.toString()),
                cluster.commandsStartingWith("apply").get(0));
    }

    @Test
    void bestPracticeFindingsAreOnlyWarnings() throws IOException {
        Path manifest = write("""
                apiVersion: v1
                kind: ConfigMap
                metadata:
                  name: settings
                ---
                apiVersion: v1
                kind: Namespace
                metadata:
                  name: shop
                  labels:
                    team: core
                """);

        ManifestValidationResult result = validator.validate(manifest, SERVER);

        assertTrue(result.isValid());
        assertEquals(List.of(IssueCode.MISSING_LABELS, IssueCode.MISSING_NAMESPACE),
                result.getWarnings().stream().map(ValidationIssue::code).toList());
        assertEquals("ConfigMap/settings", result.getWarnings().get(0).resource());
    }

    @Test
    void structuralErrorsSkipTheDryRun() throws IOException {
        Path manifest = write("""
                kind: Service
                metadata:
                  namespace: shop
                """);

        ManifestValidationResult result = validator.validate(manifest, SERVER);

        assertFalse(result.isValid());
        assertEquals(2, result.getErrors().size());
        assertTrue(result.getErrors().stream().allMatch(e -> e.code() == IssueCode.MISSING_FIELD));
        assertTrue(cluster.getCommands().isEmpty());
        assertTrue(result.errorSummary().contains("apiVersion"));
    }

    @Test
    void unparseableAndEmptyManifests() throws IOException {
        ManifestValidationResult broken = validator.validate(write("kind: [unclosed"), SERVER);
        ManifestValidationResult empty = validator.validate(write("---\n# nothing here\n"), SERVER);

        assertEquals(IssueCode.PARSE_ERROR, broken.getErrors().get(0).code());
        assertEquals(IssueCode.EMPTY_MANIFEST, empty.getErrors().get(0).code());
    }

    @Test
    void dryRunRejectionIsClassified() throws IOException {
        cluster.setDryRunResult(new CommandResult(1, "",
                "error: error validating data: ValidationError(Deployment.spec): unknown field \"replica\""));

        ManifestValidationResult result = validator.validate(write("""
                apiVersion: apps/v1
                kind: Deployment
                metadata:
                  name: web
                  namespace: shop
                  labels: {app: web}
                spec:
                  replica: 2
                """), SERVER);

        assertFalse(result.isValid());
        assertEquals(IssueCode.UNKNOWN_FIELD, result.getErrors().get(0).code());
    }

    @Test
    void classifiesServerMessages() {
        assertEquals(IssueCode.MISSING_FIELD,
                ManifestValidator.classify("spec.containers: Required value").code());
        assertEquals(IssueCode.TYPE_MISMATCH,
                ManifestValidator.classify("json: cannot unmarshal string into Go struct field").code());
        assertEquals(IssueCode.VALIDATION_FAILED,
                ManifestValidator.classify("The Service \"web\" is invalid: spec.ports").code());
        assertEquals(IssueCode.DRY_RUN_ERROR,
                ManifestValidator.classify("connection refused").code());
    }

    @Test
    void clientDryRunModeIsPassedThrough() throws IOException {
        Path manifest = write("""
                apiVersion: v1
                kind: Namespace
                metadata:
                  name: shop
                  labels: {team: core}
                """);

        validator.validate(manifest, SERVER.withDryRunMode("client"));

        assertEquals("--dry-run=client", cluster.commandsStartingWith("apply").get(0).get(1));
    }

    @Test
    void missingFileIsAPreconditionError() {
        AgentException error = assertThrows(AgentException.class,
                () -> validator.validate(tmp.resolve("absent.yaml"), SERVER));
        assertEquals(ErrorKind.PRECONDITION, error.getKind());
    }

    private Path write(String content) throws IOException {
        Path file = Files.createTempFile(tmp, "manifest", ".yaml");
        Files.writeString(file, content);
        return file;
    }
}
