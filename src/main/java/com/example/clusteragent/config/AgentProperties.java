package com.example.clusteragent.config;

import com.example.clusteragent.retry.BackoffConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the cluster agent.
 * Maps to the 'cluster-agent' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cluster-agent")
public class AgentProperties {

    private LlmConfig llm = new LlmConfig();
    private SessionConfig sessions = new SessionConfig();
    private WorkflowConfig workflow = new WorkflowConfig();
    private RetryConfig retry = new RetryConfig();
    private PluginConfig plugins = new PluginConfig();
    private CapabilityConfig capabilities = new CapabilityConfig();
    private VectorStoreConfig vectorStore = new VectorStoreConfig();
    private KubectlConfig kubectl = new KubectlConfig();
    private DeployConfig deploy = new DeployConfig();
    private AuditConfig audit = new AuditConfig();

    @Data
    public static class LlmConfig {
        /** Base URL of an OpenAI-compatible API */
        private String baseUrl = "https://api.openai.com/v1";
        private String model = "gpt-4o";
        private String apiKey = "";
        private double temperature = 0.1;
        private int maxTokens = 4096;
        private int timeoutSeconds = 120;
        private EmbeddingConfig embedding = new EmbeddingConfig();

        @Data
        public static class EmbeddingConfig {
            private String model = "text-embedding-3-small";
            private int dimensions = 1536;
            private int cacheSize = 2000;
            private int cacheTtlMinutes = 60;
        }
    }

    @Data
    public static class SessionConfig {
        private String directory = "./tmp/sessions";
        private int ttlMinutes = 24 * 60;
        private long pruneIntervalMs = 300_000;
        /** How long an advance call waits for a concurrent transition on the same session */
        private int lockWaitSeconds = 5;
    }

    @Data
    public static class WorkflowConfig {
        private int maxToolIterations = 20;
        private int maxRepairIterations = 10;
        private int maxSolutionAttempts = 3;
        private int capabilityMatches = 10;
        private int toolTimeoutSeconds = 60;
        private double defaultConfidenceThreshold = 0.8;
    }

    @Data
    public static class RetryConfig {
        private int retryCount = 3;
        private long initialDelayMs = 1000;
        private double multiplier = 2.0;
        private long maxDelayMs = 5000;
        private double jitter = 0.1;

        public BackoffConfig toBackoff() {
            return new BackoffConfig(initialDelayMs, multiplier, maxDelayMs, jitter);
        }
    }

    @Data
    public static class PluginConfig {
        private List<RemotePlugin> remote = new ArrayList<>();
        private long discoveryIntervalMs = 60_000;
        private int discoveryRetries = 5;
        private long discoveryInitialDelayMs = 1000;
        private long discoveryMaxDelayMs = 30_000;

        @Data
        public static class RemotePlugin {
            private String name;
            private String url;
            private int timeoutMs = 30_000;
            private boolean required = false;
        }
    }

    @Data
    public static class CapabilityConfig {
        private int searchLimit = 10;
        private double scoreThreshold = 0.01;
        private boolean scheduledScanEnabled = false;
        private long scanIntervalMs = 3_600_000;
        /** Resource qualified names to scan; empty means every discovered resource */
        private List<String> scanResources = new ArrayList<>();
    }

    @Data
    public static class VectorStoreConfig {
        /** memory | qdrant */
        private String type = "memory";
        private String url = "http://localhost:6333";
        private String apiKey = "";
        private String collection = "capabilities";
    }

    @Data
    public static class KubectlConfig {
        private String binary = "kubectl";
        private String kubeconfig = "";
        private String context = "";
        /** server | client */
        private String dryRunMode = "server";
        /** Upper bound for a single kubectl process */
        private int commandTimeoutSeconds = 120;
    }

    @Data
    public static class DeployConfig {
        private long pollIntervalMs = 2000;
        private int defaultTimeoutSeconds = 30;
    }

    @Data
    public static class AuditConfig {
        private boolean enabled = true;
    }
}
