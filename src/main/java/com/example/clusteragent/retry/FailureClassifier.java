package com.example.clusteragent.retry;

import com.example.clusteragent.error.AgentException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure from a collaborator (model service, vector store,
 * plugin endpoint) is transient and therefore worth retrying.
 */
public final class FailureClassifier {

    private FailureClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof AgentException agentException) {
                return agentException.isRetryable();
            }
            if (current instanceof WebClientResponseException response) {
                int status = response.getStatusCode().value();
                return status == 429 || status >= 500;
            }
            if (current instanceof WebClientRequestException
                    || current instanceof IOException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    /**
     * HTTP status codes returned by collaborators that are worth another attempt.
     */
    public static boolean isTransientStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }
}
