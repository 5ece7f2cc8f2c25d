package com.example.clusteragent.capability;

import com.example.clusteragent.agent.InvocationOutcome;
import com.example.clusteragent.agent.ToolGateway;
import com.example.clusteragent.agent.ToolInvocation;
import com.example.clusteragent.config.AgentProperties;
import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CapabilityScanServiceTest {

    private ToolGateway gateway;
    private CapabilityIndex index;
    private CapabilityScanService scanService;

    @BeforeEach
    void setUp() throws Exception {
        gateway = mock(ToolGateway.class);
        index = mock(CapabilityIndex.class);
        scanService = new CapabilityScanService(gateway, index, new AgentProperties(), mock(TaskScheduler.class));

        ToolInvocation listing = ToolInvocation.builder()
                .toolName("kubectl_api_resources")
                .outcome(InvocationOutcome.SUCCEEDED)
                .data(new ObjectMapper().readTree("""
                        [{"name":"deployments","group":"apps","version":"v1","kind":"Deployment","namespaced":true,
                          "verbs":["get","list","create"]},
                         {"name":"postgresqls","group":"acid.zalan.do","version":"v1","kind":"postgresql","namespaced":true,
                          "verbs":["get","create"]},
                         {"name":"namespaces","group":"","version":"v1","kind":"Namespace","namespaced":false,
                          "verbs":["get"]}]
                        """))
                .build();
        when(gateway.invoke(eq("kubectl_api_resources"), anyMap(), anySet(), any(), any())).thenReturn(listing);
        when(gateway.invoke(eq("kubectl_explain"), anyMap(), anySet(), any(), any())).thenReturn(
                ToolInvocation.builder().outcome(InvocationOutcome.SUCCEEDED).output("FIELDS: spec").build());
    }

    @Test
    void indexesEveryDiscoveredResourceByDefault() {
        ScanReport report = scanService.scan(null);

        assertEquals(3, report.discovered());
        assertEquals(List.of("deployments.apps", "postgresqls.acid.zalan.do", "namespaces"), report.indexed());
        verify(index, times(3)).index(any(ResourceSchema.class));
    }

    @Test
    void restrictsToRequestedResourcesAndReportsFailures() {
        when(index.index(argThat(schema -> schema != null && "postgresqls".equals(schema.getPlural()))))
                .thenThrow(AgentException.transientFailure("vector store down", null));

        ScanReport report = scanService.scan(List.of("postgresqls.acid.zalan.do", "deployments.apps"));

        assertEquals(2, report.discovered());
        assertEquals(List.of("deployments.apps"), report.indexed());
        assertTrue(report.failed().containsKey("postgresqls.acid.zalan.do"));
    }

    @Test
    void failedListingIsAPreconditionError() {
        when(gateway.invoke(eq("kubectl_api_resources"), anyMap(), anySet(), any(), any())).thenReturn(
                ToolInvocation.builder().outcome(InvocationOutcome.FAILED).error("connection refused").build());

        AgentException error = assertThrows(AgentException.class, () -> scanService.scan(List.of()));

        assertEquals(ErrorKind.PRECONDITION, error.getKind());
        verifyNoInteractions(index);
    }

    @Test
    void explainOutputFeedsTheSchemaText() {
        scanService.scan(List.of("namespaces"));

        verify(index).index(argThat(schema -> "FIELDS: spec".equals(schema.getSchemaText())));
        verify(gateway).invoke(eq("kubectl_explain"), eq(Map.of("resource", "namespaces")), anySet(), any(), any());
    }
}
