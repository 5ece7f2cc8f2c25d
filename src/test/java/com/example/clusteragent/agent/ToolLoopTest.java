package com.example.clusteragent.agent;

import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.retry.RetryExecutor;
import com.example.clusteragent.service.AuditService;
import com.example.clusteragent.support.ScriptedModelService;
import com.example.clusteragent.support.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class ToolLoopTest {

    private ScriptedModelService model;
    private ToolRegistry registry;
    private AgentProperties properties;
    private ToolLoop loop;
    private StubTool getTool;

    @BeforeEach
    void setUp() {
        model = new ScriptedModelService();
        registry = new ToolRegistry();
        properties = new AgentProperties();
        ToolGateway gateway = new ToolGateway(registry, new ToolArgumentValidator(), mock(AuditService.class),
                new SimpleAsyncTaskExecutor());
        loop = new ToolLoop(model, gateway, registry, new RetryExecutor(millis -> { }), properties);

        getTool = new StubTool("kubectl_get", RiskClass.READ_ONLY)
                .answering(args -> ToolResult.text("pod/web-1 CrashLoopBackOff"));
        registry.register("kubernetes", getTool);
        registry.register("kubernetes", new StubTool("kubectl_delete", RiskClass.MUTATING));
    }

    @Test
    void runsToolsUntilModelAnswers() {
        model.callTool("kubectl_get", Map.of("resource", "pods"))
                .reply("The pod is crash looping");
        List<AgentMessage> conversation = new ArrayList<>(List.of(AgentMessage.user("why is web down?")));

        ToolLoopResult result = loop.run(conversation, EnumSet.of(RiskClass.READ_ONLY), context(), 5);

        assertTrue(result.converged());
        assertEquals(2, result.iterations());
        assertEquals("The pod is crash looping", result.finalContent());
        assertEquals(1, result.invocations().size());
        assertTrue(result.invocations().get(0).isSuccess());
        assertEquals(20, result.usage().inputTokens());
        assertTrue(conversation.stream().anyMatch(m -> m.getRole() == AgentMessage.Role.TOOL
                && m.getContent().contains("CrashLoopBackOff")));
    }

    @Test
    void offersOnlyAllowedTools() {
        model.reply("nothing to do");

        loop.run(new ArrayList<>(), EnumSet.of(RiskClass.READ_ONLY), context(), 3);

        assertEquals(List.of("kubectl_get"), model.getOfferedTools().get(0));
    }

    @Test
    void deniedToolCallIsReportedBackToTheModel() {
        model.callTool("kubectl_delete", Map.of("resource", "pod"))
                .reply("I may not delete anything yet");
        List<AgentMessage> conversation = new ArrayList<>();

        ToolLoopResult result = loop.run(conversation, EnumSet.of(RiskClass.READ_ONLY), context(), 5);

        assertTrue(result.converged());
        assertEquals(InvocationOutcome.REJECTED, result.invocations().get(0).getOutcome());
        assertTrue(conversation.stream().anyMatch(m -> m.getRole() == AgentMessage.Role.TOOL
                && m.getContent().startsWith("Error:")));
    }

    @Test
    void stopsAtIterationBound() {
        model.callTool("kubectl_get", Map.of("resource", "pods"))
                .callTool("kubectl_get", Map.of("resource", "events"))
                .callTool("kubectl_get", Map.of("resource", "nodes"));

        ToolLoopResult result = loop.run(new ArrayList<>(), EnumSet.of(RiskClass.READ_ONLY), context(), 2);

        assertFalse(result.converged());
        assertEquals(2, result.iterations());
        assertEquals(2, getTool.getCalls().size());
        assertEquals(1, model.remaining());
    }

    @Test
    void transientModelFailuresAreRetried() {
        AtomicInteger calls = new AtomicInteger();
        ModelService flaky = new ModelService() {
            @Override
            public ModelResponse sendMessage(List<AgentMessage> context, List<AgentTool> availableTools) {
                if (calls.incrementAndGet() == 1) {
                    throw AgentException.transientFailure("rate limited", null);
                }
                return ModelResponse.text("done");
            }

            @Override
            public float[] embed(String text) {
                return new float[0];
            }
        };
        ToolGateway gateway = new ToolGateway(registry, new ToolArgumentValidator(), mock(AuditService.class),
                new SimpleAsyncTaskExecutor());
        ToolLoop retrying = new ToolLoop(flaky, gateway, registry, new RetryExecutor(millis -> { }), properties);

        ToolLoopResult result = retrying.run(new ArrayList<>(), EnumSet.of(RiskClass.READ_ONLY), context(), 3);

        assertEquals("done", result.finalContent());
        assertEquals(2, calls.get());
    }

    private static ToolContext context() {
        return ToolContext.builder().sessionId("rem-1").phase("INVESTIGATING").build();
    }
}
