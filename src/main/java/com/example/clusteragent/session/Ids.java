package com.example.clusteragent.session;

import java.util.UUID;

/**
 * Ids of the form {@code <prefix>-<epochMillis>-<8 hex>}.
 */
final class Ids {

    private Ids() {
    }

    static String next(String prefix) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return prefix + "-" + System.currentTimeMillis() + "-" + random;
    }
}
