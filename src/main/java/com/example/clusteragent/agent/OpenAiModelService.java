package com.example.clusteragent.agent;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.retry.FailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Model service for OpenAI-compatible APIs: chat completions with function calling,
 * and embeddings. Transport failures and 429/5xx answers are reported as TRANSIENT so
 * callers can retry them; anything else is final.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenAiModelService implements ModelService {

    private static final MediaType JSON = MediaType.get("application/json");
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ModelResponse sendMessage(List<AgentMessage> context, List<AgentTool> availableTools) {
        log.debug("Model request with {} messages and {} tools", context.size(), availableTools.size());
        JsonNode root = post("/chat/completions", buildChatRequest(context, availableTools),
                properties.getLlm().getTimeoutSeconds());
        return parseChatResponse(root);
    }

    @Override
    public float[] embed(String text) {
        AgentProperties.LlmConfig.EmbeddingConfig cfg = properties.getLlm().getEmbedding();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", cfg.getModel());
        body.put("input", text);
        if (cfg.getDimensions() > 0) {
            body.put("dimensions", cfg.getDimensions());
        }

        JsonNode root = post("/embeddings", body, 30);
        JsonNode embedding = root.path("data").path(0).path("embedding");
        if (!embedding.isArray() || embedding.isEmpty()) {
            throw new AgentException(ErrorKind.INTERNAL, "Embedding response contained no vector");
        }
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < embedding.size(); i++) {
            vector[i] = (float) embedding.get(i).asDouble();
        }
        return vector;
    }

    private JsonNode post(String path, ObjectNode body, int timeoutSeconds) {
        if (!isAvailable()) {
            throw AgentException.precondition("Model service API key is not configured");
        }
        Request request;
        try {
            request = new Request.Builder()
                    .url(trimSlash(properties.getLlm().getBaseUrl()) + path)
                    .addHeader("Authorization", "Bearer " + properties.getLlm().getApiKey())
                    .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw AgentException.internal("Cannot serialize model request", e);
        }

        OkHttpClient client = httpClient.newBuilder()
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.error("Model API error {} on {}: {}", response.code(), path, text);
                ErrorKind kind = FailureClassifier.isTransientStatus(response.code())
                        ? ErrorKind.TRANSIENT : ErrorKind.INTERNAL;
                throw new AgentException(kind, "Model API returned " + response.code() + " for " + path);
            }
            return objectMapper.readTree(text);
        } catch (IOException e) {
            throw AgentException.transientFailure("Model API call to " + path + " failed: " + e.getMessage(), e);
        }
    }

    private ObjectNode buildChatRequest(List<AgentMessage> messages, List<AgentTool> tools) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getLlm().getModel());
        root.put("temperature", properties.getLlm().getTemperature());
        root.put("max_tokens", properties.getLlm().getMaxTokens());

        ArrayNode messagesArray = root.putArray("messages");
        for (AgentMessage msg : messages) {
            ObjectNode msgNode = messagesArray.addObject();
            msgNode.put("role", msg.getRole().name().toLowerCase());
            if (msg.getContent() != null) {
                msgNode.put("content", msg.getContent());
            }
            if (msg.getToolCallId() != null) {
                msgNode.put("tool_call_id", msg.getToolCallId());
            }
            if (msg.getToolCalls() != null && !msg.getToolCalls().isEmpty()) {
                ArrayNode callsNode = msgNode.putArray("tool_calls");
                for (AgentMessage.ToolCall call : msg.getToolCalls()) {
                    ObjectNode callNode = callsNode.addObject();
                    callNode.put("id", call.getId());
                    callNode.put("type", "function");
                    ObjectNode function = callNode.putObject("function");
                    function.put("name", call.getName());
                    function.put("arguments", objectMapper.valueToTree(
                            call.getArguments() != null ? call.getArguments() : Map.of()).toString());
                }
            }
        }

        if (!tools.isEmpty()) {
            ArrayNode toolsArray = root.putArray("tools");
            for (AgentTool tool : tools) {
                ObjectNode toolNode = toolsArray.addObject();
                toolNode.put("type", "function");
                ObjectNode function = toolNode.putObject("function");
                function.put("name", tool.getName());
                function.put("description", tool.getDescription());
                function.set("parameters", objectMapper.valueToTree(tool.getParameterSchema()));
            }
        }
        return root;
    }

    private ModelResponse parseChatResponse(JsonNode root) {
        JsonNode message = root.path("choices").path(0).path("message");
        if (message.isMissingNode()) {
            throw new AgentException(ErrorKind.INTERNAL, "Model response contained no choices");
        }
        String content = message.hasNonNull("content") ? message.get("content").asText() : null;

        List<AgentMessage.ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.path("function");
            toolCalls.add(AgentMessage.ToolCall.builder()
                    .id(call.path("id").asText())
                    .name(function.path("name").asText())
                    .arguments(parseArguments(function.path("arguments").asText("{}")))
                    .build());
        }

        JsonNode usage = root.path("usage");
        TokenUsage tokens = new TokenUsage(usage.path("prompt_tokens").asLong(0),
                usage.path("completion_tokens").asLong(0));
        return new ModelResponse(content, toolCalls, tokens);
    }

    private Map<String, Object> parseArguments(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, ARGS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Model returned malformed tool arguments: {}", json);
            return Map.of("_malformed", json);
        }
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
