package com.sgw.common;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic session id to worker index mapping.
 *
 * Uses a SHA-256 digest of the id so the result is stable across JVMs and restarts
 * (String.hashCode is stable too, but too weak for evenly spreading short numeric ids).
 */
public final class SessionPartitioner {
    private SessionPartitioner() {}

    public static int partition(String sessionId, int workerCount) {
        if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        byte[] digest = sha256(sessionId.getBytes(StandardCharsets.UTF_8));
        int h = ((digest[0] & 0xFF) << 24)
              | ((digest[1] & 0xFF) << 16)
              | ((digest[2] & 0xFF) << 8)
              |  (digest[3] & 0xFF);
        return Math.floorMod(h, workerCount);
    }

    public static int commandStream(int workerIndex, GatewayConfig cfg) {
        return cfg.commandStreamBase + workerIndex;
    }

    public static int signalStream(int workerIndex, GatewayConfig cfg) {
        return cfg.signalStreamBase + workerIndex;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
