package com.example.clusteragent.plugin;

import com.example.clusteragent.config.AgentProperties.PluginConfig.RemotePlugin;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.retry.FailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for remote plugins. Both hooks go to {@code POST <url>/execute}:
 * {@code {"hook":"describe"}} returns the plugin's tool definitions,
 * {@code {"hook":"invoke","sessionId":..,"payload":{"tool","args","state"}}} runs one tool.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemotePluginClient {

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RemotePluginDescription describe(RemotePlugin plugin) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("hook", "describe");
        log.debug("Calling describe hook of plugin {} at {}", plugin.getName(), plugin.getUrl());
        JsonNode response = execute(plugin, request);
        try {
            return objectMapper.treeToValue(response, RemotePluginDescription.class);
        } catch (JsonProcessingException e) {
            throw AgentException.validation("Plugin " + plugin.getName() + " returned an invalid description: "
                    + e.getOriginalMessage());
        }
    }

    /**
     * Invokes a tool and returns the plugin's response ({@code success}, {@code result} or
     * {@code error}, {@code state}).
     */
    public JsonNode invoke(RemotePlugin plugin, String tool, Map<String, Object> args,
                           Map<String, Object> state, String sessionId) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("hook", "invoke");
        if (sessionId != null) {
            request.put("sessionId", sessionId);
        }
        ObjectNode payload = request.putObject("payload");
        payload.put("tool", tool);
        payload.set("args", objectMapper.valueToTree(args != null ? args : Map.of()));
        payload.set("state", objectMapper.valueToTree(state != null ? state : Map.of()));
        log.debug("Calling invoke hook of plugin {} for tool {}", plugin.getName(), tool);
        return execute(plugin, request);
    }

    private JsonNode execute(RemotePlugin plugin, ObjectNode body) {
        String url = plugin.getUrl().endsWith("/") ? plugin.getUrl() + "execute" : plugin.getUrl() + "/execute";
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(plugin.getTimeoutMs()))
                .build();
        Request request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                ErrorKind kind = FailureClassifier.isTransientStatus(response.code())
                        ? ErrorKind.TRANSIENT : ErrorKind.INTERNAL;
                throw new AgentException(kind, "Plugin " + plugin.getName() + " returned HTTP "
                        + response.code() + ": " + text);
            }
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw AgentException.validation("Plugin " + plugin.getName() + " returned malformed JSON: "
                    + e.getOriginalMessage());
        } catch (IOException e) {
            throw AgentException.transientFailure("Plugin " + plugin.getName() + " at " + url
                    + " is unreachable: " + e.getMessage(), e);
        }
    }
}
