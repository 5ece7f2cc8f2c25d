package com.example.clusteragent.controller;

import com.example.clusteragent.session.AdvanceRequest;
import com.example.clusteragent.session.CreateSessionRequest;
import com.example.clusteragent.session.Session;
import com.example.clusteragent.session.SessionEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Workflow sessions REST API.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionEngine sessionEngine;

    /**
     * Create a recommendation or remediation session and run its first phase.
     */
    @PostMapping
    public ResponseEntity<Session> create(@RequestBody CreateSessionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionEngine.createSession(request));
    }

    @PostMapping("/{id}/advance")
    public ResponseEntity<Session> advance(@PathVariable String id,
                                           @RequestBody(required = false) AdvanceRequest request) {
        return ResponseEntity.ok(sessionEngine.advance(id, request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Session> get(@PathVariable String id) {
        return ResponseEntity.ok(sessionEngine.getSession(id));
    }

    /**
     * Summary of every stored session, newest first.
     */
    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> list() {
        return ResponseEntity.ok(sessionEngine.listSessions().stream()
                .map(s -> Map.<String, Object>of(
                        "id", s.getId(),
                        "kind", s.getKind(),
                        "phase", s.getPhase(),
                        "createdAt", s.getCreatedAt(),
                        "expiresAt", s.getExpiresAt()))
                .toList());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        sessionEngine.deleteSession(id);
        return ResponseEntity.noContent().build();
    }
}
