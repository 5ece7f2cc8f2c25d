package com.example.clusteragent.controller;

import com.example.clusteragent.domain.AuditLog;
import com.example.clusteragent.service.AuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Audit Trail REST API Controller.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping
    public ResponseEntity<List<AuditLog>> recent(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditService.getRecent(limit));
    }

    @GetMapping("/session/{sessionId}")
    public ResponseEntity<List<AuditLog>> getBySession(@PathVariable String sessionId) {
        return ResponseEntity.ok(auditService.getBySession(sessionId));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(Map.of(
                "toolExecutions", auditService.countByAction("TOOL_EXECUTED"),
                "toolDenials", auditService.countByAction("TOOL_DENIED"),
                "sessionsCreated", auditService.countByAction("SESSION_CREATED"),
                "phaseTransitions", auditService.countByAction("PHASE_TRANSITION")));
    }
}
