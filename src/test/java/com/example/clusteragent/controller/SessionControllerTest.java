package com.example.clusteragent.controller;

import com.example.clusteragent.config.AppConfig;
import com.example.clusteragent.error.ErrorKind;
import com.example.clusteragent.error.InvalidRequestException;
import com.example.clusteragent.error.SessionExpiredException;
import com.example.clusteragent.error.SessionNotFoundException;
import com.example.clusteragent.session.AdvanceAction;
import com.example.clusteragent.session.AdvanceRequest;
import com.example.clusteragent.session.CreateSessionRequest;
import com.example.clusteragent.session.Phase;
import com.example.clusteragent.session.Session;
import com.example.clusteragent.session.SessionEngine;
import com.example.clusteragent.session.WorkflowKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SessionControllerTest {

    private SessionEngine engine;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        engine = mock(SessionEngine.class);
        mvc = MockMvcBuilders.standaloneSetup(new SessionController(engine))
                .setControllerAdvice(new ApiExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(new AppConfig().objectMapper()))
                .build();
    }

    private static Session session(String id, Phase phase) {
        return Session.builder()
                .id(id)
                .kind(WorkflowKind.REMEDIATION)
                .phase(phase)
                .createdAt(Instant.parse("2026-01-01T00:00:00Z"))
                .expiresAt(Instant.parse("2026-01-02T00:00:00Z"))
                .build();
    }

    @Test
    void createReturnsTheSessionAfterItsFirstPhase() throws Exception {
        when(engine.createSession(any())).thenReturn(session("rem-1", Phase.AWAITING_APPROVAL));

        mvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\":\"REMEDIATION\",\"issue\":\"pods crash\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("rem-1"))
                .andExpect(jsonPath("$.phase").value("AWAITING_APPROVAL"));

        ArgumentCaptor<CreateSessionRequest> request = ArgumentCaptor.forClass(CreateSessionRequest.class);
        verify(engine).createSession(request.capture());
        assertEquals("pods crash", request.getValue().getIssue());
    }

    @Test
    void advanceForwardsTheRequest() throws Exception {
        when(engine.advance(eq("rem-1"), any())).thenReturn(session("rem-1", Phase.VALIDATED));

        mvc.perform(post("/api/sessions/rem-1/advance")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"action\":\"APPROVE\",\"actor\":\"dana\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("VALIDATED"));

        ArgumentCaptor<AdvanceRequest> request = ArgumentCaptor.forClass(AdvanceRequest.class);
        verify(engine).advance(eq("rem-1"), request.capture());
        assertEquals(AdvanceAction.APPROVE, request.getValue().getAction());
        assertEquals("dana", request.getValue().effectiveActor());
    }

    @Test
    void errorsMapToStatuses() throws Exception {
        when(engine.getSession("missing")).thenThrow(new SessionNotFoundException("missing"));
        when(engine.getSession("old")).thenThrow(new SessionExpiredException("old", Instant.EPOCH));
        when(engine.advance(eq("rem-1"), any())).thenThrow(new InvalidRequestException("bad answers"));

        mvc.perform(get("/api/sessions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
        mvc.perform(get("/api/sessions/old"))
                .andExpect(status().isGone());
        mvc.perform(post("/api/sessions/rem-1/advance"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("bad answers"));
    }

    @Test
    void listAndDelete() throws Exception {
        when(engine.listSessions()).thenReturn(List.of(session("rem-2", Phase.FAILED), session("rem-1", Phase.VALIDATED)));

        mvc.perform(get("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("rem-2"))
                .andExpect(jsonPath("$[1].phase").value("VALIDATED"));

        mvc.perform(delete("/api/sessions/rem-1")).andExpect(status().isNoContent());
        verify(engine).deleteSession("rem-1");

        doThrow(new SessionNotFoundException("rem-9")).when(engine).deleteSession("rem-9");
        mvc.perform(delete("/api/sessions/rem-9")).andExpect(status().isNotFound());
    }

    @Test
    void everyErrorKindHasAStatus() {
        assertEquals(HttpStatus.CONFLICT, ApiExceptionHandler.statusFor(ErrorKind.CONFLICT));
        for (ErrorKind kind : ErrorKind.values()) {
            assertNotNull(ApiExceptionHandler.statusFor(kind));
        }
    }
}
