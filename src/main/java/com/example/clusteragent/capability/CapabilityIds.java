package com.example.clusteragent.capability;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic capability identifiers: the first 32 hex characters of
 * SHA-256("capability-" + qualified resource name), laid out as a UUID.
 */
public final class CapabilityIds {

    private CapabilityIds() {
    }

    public static String forResource(String qualifiedName) {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
        String hex;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            hex = HexFormat.of().formatHex(
                    digest.digest(("capability-" + qualifiedName).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        return hex.substring(0, 8) + "-" + hex.substring(8, 12) + "-" + hex.substring(12, 16)
                + "-" + hex.substring(16, 20) + "-" + hex.substring(20, 32);
    }
}
