package com.example.clusteragent.session;

public record AutomationDecision(boolean automatic, String reason) {
}
