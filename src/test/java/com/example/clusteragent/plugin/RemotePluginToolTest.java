package com.example.clusteragent.plugin;

import com.example.clusteragent.agent.RiskClass;
import com.example.clusteragent.agent.ToolContext;
import com.example.clusteragent.agent.ToolResult;
import com.example.clusteragent.config.AgentProperties.PluginConfig.RemotePlugin;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RemotePluginToolTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private RemotePluginClient client;
    private RemotePlugin plugin;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new RemotePluginClient(new OkHttpClient(), mapper);
        plugin = new RemotePlugin();
        plugin.setName("db");
        plugin.setUrl(server.url("/plugins/db").toString());
        plugin.setTimeoutMs(5_000);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void riskClassIsInferredFromTheToolName() {
        assertEquals(RiskClass.READ_ONLY, RemotePluginTool.classify(definition("kubectl_get", null)));
        assertEquals(RiskClass.READ_ONLY, RemotePluginTool.classify(definition("releases-list", null)));
        assertEquals(RiskClass.READ_ONLY, RemotePluginTool.classify(definition("helm.status", null)));
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("helm_upgrade", null)));
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("list-releases", null)),
                "the verb has to be the last segment");
    }

    @Test
    void readVerbsInsideMutatingNamesDoNotMakeToolsReadOnly() {
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("db_get_and_lock", null)));
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("get_or_create_namespace", null)));
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("status_reset", null)));
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("restart_then_status", null)));
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("db_vacuum", null)));
    }

    @Test
    void explicitMarkerWins() {
        assertEquals(RiskClass.MUTATING, RemotePluginTool.classify(definition("db_get_and_lock", true)));
        assertEquals(RiskClass.READ_ONLY, RemotePluginTool.classify(definition("db_vacuum_analyze", false)));
    }

    @Test
    void describeParsesToolDefinitions() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"name":"db-tools","version":"1.2.0","tools":[
                  {"name":"db_query","description":"Run a read query","inputSchema":{"type":"object"}},
                  {"name":"db_failover","mutating":true}]}
                """));

        RemotePluginDescription description = client.describe(plugin);

        assertEquals("1.2.0", description.getVersion());
        assertEquals(2, description.getTools().size());
        assertTrue(description.getTools().get(1).getMutating());
        RecordedRequest request = server.takeRequest();
        assertEquals("/plugins/db/execute", request.getPath());
        assertEquals("describe", mapper.readTree(request.getBody().readUtf8()).path("hook").asText());
    }

    @Test
    void invokeSendsSessionAndStateAndReturnsResult() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"success\":true,\"result\":{\"rows\":3}}"));
        RemotePluginTool tool = new RemotePluginTool(plugin, definition("db_query", null), client);
        ToolContext context = ToolContext.builder().sessionId("rem-1").phase("INVESTIGATING")
                .pluginState(Map.of("cursor", "abc")).build();

        ToolResult result = tool.execute(Map.of("sql", "select 1"), context);

        assertTrue(result.isSuccess());
        assertEquals(3, result.getData().path("rows").asInt());
        JsonNode sent = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertEquals("invoke", sent.path("hook").asText());
        assertEquals("rem-1", sent.path("sessionId").asText());
        assertEquals("db_query", sent.path("payload").path("tool").asText());
        assertEquals("select 1", sent.path("payload").path("args").path("sql").asText());
        assertEquals("abc", sent.path("payload").path("state").path("cursor").asText());
    }

    @Test
    void pluginErrorBecomesFailedResult() {
        server.enqueue(new MockResponse().setBody(
                "{\"success\":false,\"error\":{\"code\":\"NOT_FOUND\",\"message\":\"no such table\"}}"));
        RemotePluginTool tool = new RemotePluginTool(plugin, definition("db_query", null), client);

        ToolResult result = tool.execute(Map.of(), ToolContext.system("test"));

        assertFalse(result.isSuccess());
        assertEquals("NOT_FOUND: no such table", result.getError());
    }

    @Test
    void serverErrorsAreTransientAndClientErrorsAreNot() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));
        server.enqueue(new MockResponse().setResponseCode(400).setBody("bad hook"));

        AgentException unavailable = assertThrows(AgentException.class, () -> client.describe(plugin));
        AgentException rejected = assertThrows(AgentException.class, () -> client.describe(plugin));

        assertEquals(ErrorKind.TRANSIENT, unavailable.getKind());
        assertNotEquals(ErrorKind.TRANSIENT, rejected.getKind());
    }

    private static RemoteToolDefinition definition(String name, Boolean mutating) {
        return RemoteToolDefinition.builder().name(name).mutating(mutating).build();
    }
}
