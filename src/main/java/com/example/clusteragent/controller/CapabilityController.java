package com.example.clusteragent.controller;

import com.example.clusteragent.capability.CapabilityIndex;
import com.example.clusteragent.capability.CapabilityRecord;
import com.example.clusteragent.capability.CapabilityScanService;
import com.example.clusteragent.capability.CapabilitySearchFilters;
import com.example.clusteragent.capability.Complexity;
import com.example.clusteragent.capability.ResourceSchema;
import com.example.clusteragent.capability.ScanReport;
import com.example.clusteragent.capability.ScoredCapability;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for the capability index: scan, search, inspection and removal.
 */
@RestController
@RequestMapping("/api/capabilities")
@RequiredArgsConstructor
public class CapabilityController {

    private final CapabilityIndex capabilityIndex;
    private final CapabilityScanService scanService;

    /**
     * Scan the cluster's API resources; without a resource list every discovered resource is indexed.
     */
    @PostMapping("/scan")
    public ResponseEntity<ScanReport> scan(@RequestBody(required = false) Map<String, List<String>> body) {
        List<String> resources = body != null ? body.get("resources") : null;
        return ResponseEntity.ok(scanService.scan(resources));
    }

    @PostMapping
    public ResponseEntity<CapabilityRecord> index(@RequestBody ResourceSchema schema) {
        return ResponseEntity.ok(capabilityIndex.index(schema));
    }

    @GetMapping("/search")
    public ResponseEntity<List<ScoredCapability>> search(
            @RequestParam String query,
            @RequestParam(required = false) String group,
            @RequestParam(required = false) String verb,
            @RequestParam(required = false) String complexity,
            @RequestParam(required = false) Integer limit) {
        CapabilitySearchFilters filters = CapabilitySearchFilters.builder()
                .group(group)
                .verb(verb)
                .complexity(complexity != null ? Complexity.fromValue(complexity) : null)
                .limit(limit)
                .build();
        return ResponseEntity.ok(capabilityIndex.search(query, filters));
    }

    @GetMapping
    public ResponseEntity<List<CapabilityRecord>> list(@RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(capabilityIndex.list(limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CapabilityRecord> get(@PathVariable String id) {
        return capabilityIndex.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/by-name/{name}")
    public ResponseEntity<CapabilityRecord> getByName(@PathVariable String name) {
        return capabilityIndex.getByName(name)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return capabilityIndex.delete(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteAll() {
        long before = capabilityIndex.count();
        capabilityIndex.deleteAll();
        return ResponseEntity.ok(Map.of("deleted", before));
    }
}
