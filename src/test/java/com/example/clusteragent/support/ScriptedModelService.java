package com.example.clusteragent.support;

import com.example.clusteragent.agent.AgentMessage;
import com.example.clusteragent.agent.AgentTool;
import com.example.clusteragent.agent.ModelResponse;
import com.example.clusteragent.agent.ModelService;
import com.example.clusteragent.agent.TokenUsage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Model double that replays queued responses in order and embeds text as a hashed
 * bag of words, so related texts land close to each other.
 */
public class ScriptedModelService implements ModelService {

    private static final int DIMENSIONS = 64;

    private final Deque<ModelResponse> responses = new ArrayDeque<>();
    private final List<List<AgentMessage>> requests = new ArrayList<>();
    private final List<List<String>> offeredTools = new ArrayList<>();
    private final AtomicInteger callIds = new AtomicInteger();

    public ScriptedModelService reply(String content) {
        responses.add(new ModelResponse(content, List.of(), new TokenUsage(10, 5)));
        return this;
    }

    public ScriptedModelService callTool(String toolName, Map<String, Object> arguments) {
        AgentMessage.ToolCall call = AgentMessage.ToolCall.builder()
                .id("call-" + callIds.incrementAndGet())
                .name(toolName)
                .arguments(arguments)
                .build();
        responses.add(new ModelResponse(null, List.of(call), new TokenUsage(10, 5)));
        return this;
    }

    @Override
    public synchronized ModelResponse sendMessage(List<AgentMessage> context, List<AgentTool> availableTools) {
        requests.add(new ArrayList<>(context));
        offeredTools.add(availableTools.stream().map(AgentTool::getName).toList());
        ModelResponse next = responses.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted model response left");
        }
        return next;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String word : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (!word.isEmpty()) {
                vector[Math.floorMod(word.hashCode(), DIMENSIONS)] += 1f;
            }
        }
        return vector;
    }

    public List<List<AgentMessage>> getRequests() {
        return requests;
    }

    /**
     * Names of the tools offered to the model, per call.
     */
    public List<List<String>> getOfferedTools() {
        return offeredTools;
    }

    public int remaining() {
        return responses.size();
    }
}
