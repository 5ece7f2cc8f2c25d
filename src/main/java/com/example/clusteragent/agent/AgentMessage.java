package com.example.clusteragent.agent;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One message of a model conversation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentMessage {

    private Role role;
    private String content;
    private List<ToolCall> toolCalls;
    private String toolCallId;

    public enum Role {
        SYSTEM, USER, ASSISTANT, TOOL
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }

    public static AgentMessage system(String content) {
        return AgentMessage.builder().role(Role.SYSTEM).content(content).build();
    }

    public static AgentMessage user(String content) {
        return AgentMessage.builder().role(Role.USER).content(content).build();
    }

    public static AgentMessage assistant(String content, List<ToolCall> toolCalls) {
        return AgentMessage.builder().role(Role.ASSISTANT).content(content).toolCalls(toolCalls).build();
    }

    public static AgentMessage toolResult(String toolCallId, String content) {
        return AgentMessage.builder().role(Role.TOOL).toolCallId(toolCallId).content(content).build();
    }
}
