package com.example.clusteragent.capability;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one capability scan: which resources were indexed and why others failed.
 */
public record ScanReport(int discovered, List<String> indexed, Map<String, String> failed) {
}
