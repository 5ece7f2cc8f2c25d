package com.example.clusteragent.cluster;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs the kubectl binary as a child process. Arguments are passed as a list, never
 * through a shell. An interrupted caller kills the process.
 */
@Slf4j
@Component
public class KubectlClusterClient implements ClusterClient {

    private final AgentProperties properties;
    private final Executor ioExecutor;

    public KubectlClusterClient(AgentProperties properties, @Qualifier("processIoExecutor") Executor ioExecutor) {
        this.properties = properties;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public CommandResult run(List<String> args, ClusterContext context) {
        List<String> command = new ArrayList<>();
        command.add(properties.getKubectl().getBinary());
        if (!context.kubeconfig().isBlank()) {
            command.add("--kubeconfig");
            command.add(context.kubeconfig());
        }
        if (!context.context().isBlank()) {
            command.add("--context");
            command.add(context.context());
        }
        command.addAll(args);
        log.info("Executing: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new AgentException(ErrorKind.PRECONDITION,
                    "Cannot start " + properties.getKubectl().getBinary() + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()), ioExecutor);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()), ioExecutor);
        int timeoutSeconds = properties.getKubectl().getCommandTimeoutSeconds();
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw AgentException.timeout("kubectl " + String.join(" ", args)
                        + " did not finish within " + timeoutSeconds + "s");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new AgentException(ErrorKind.INTERNAL, "Interrupted while running kubectl", e);
        }
        CommandResult result = new CommandResult(process.exitValue(), stdout.join(), stderr.join());
        if (!result.isSuccess()) {
            log.debug("kubectl exited with {}: {}", result.exitCode(), result.errorText());
        }
        return result;
    }

    private static String read(InputStream stream) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
