package com.example.clusteragent.session;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.deploy.DeployOperation;
import com.example.clusteragent.error.AgentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Per-session working directory: {@code <sessions.directory>/<sessionId>/}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionFiles {

    private final AgentProperties properties;

    public Path root() {
        return Paths.get(properties.getSessions().getDirectory()).toAbsolutePath();
    }

    public Path directory(String sessionId) {
        return root().resolve(sessionId);
    }

    /**
     * Writes the current manifest plus a numbered copy of this attempt.
     */
    public Path writeManifest(String sessionId, int attempt, String manifest) {
        Path dir = directory(sessionId);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(String.format("manifest_attempt_%02d.yaml", attempt)), manifest,
                    StandardCharsets.UTF_8);
            Path current = dir.resolve(DeployOperation.MANIFEST_FILE);
            Files.writeString(current, manifest, StandardCharsets.UTF_8);
            return current;
        } catch (IOException e) {
            throw AgentException.internal("Failed to write manifest for session " + sessionId, e);
        }
    }

    public void deleteDirectory(String sessionId) {
        Path dir = directory(sessionId);
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            log.debug("Deleted session directory {}", dir);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to delete session directory {}: {}", dir, e.getMessage());
        }
    }
}
