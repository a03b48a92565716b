package com.sgw.common;

import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from gateway.yml (or classpath default).
 * All fields have sensible defaults for localhost development.
 */
public final class GatewayConfig {

    // Pool
    public int     workers            = 4;
    public String  workerMode         = "embedded";   // embedded | process
    public long    respawnDelayMs     = 1_000;
    public boolean restoreOnStartup   = false;

    // HTTP control surface
    public int httpPort             = 3001;
    public int httpMaxContentLength = 16 * 1024 * 1024;

    // Coordinator
    public long ipcTimeoutMs        = 75_000;
    public int  metricsIntervalSecs = 30;

    // Connection state machine
    public long qrValidityMs          = 60_000;
    public long stableDwellMs         = 5_000;
    public long reconnectBaseDelayMs  = 3_000;
    public long reconnectIncrementMs  = 2_000;
    public int  reconnectMaxAttempts  = 5;
    public long conflictBaseDelayMs   = 2_000;
    public long conflictMaxDelayMs    = 30_000;
    public int  conflictMaxAttempts   = 3;
    public long dedupWindowMs         = 60_000;
    public int  dedupMaxEntries       = 10_000;
    public int  eventQueueCapacity    = 1_024;

    // Send path
    public long   connectWaitMs        = 30_000;
    public long   sendAttemptTimeoutMs = 10_000;
    public int    sendMaxAttempts      = 3;
    public long   sendRetryDelayMs     = 1_000;
    public long   logoutTimeoutMs      = 5_000;
    public String recipientDomain      = "s.whatsapp.net";

    // Persistence
    public long   persistDebounceMs   = 2_000;
    public long   persistRetryDelayMs = 500;
    public String credentialStore     = "file";        // file | memory
    public String credentialStoreDir  = "./data/sessions";

    // Protocol client
    public String protocolClient = "loopback";
    public String pairingCodeFormat = "qr-data-url";   // raw | qr-data-url
    public int    qrImageSize       = 264;

    // Webhook sink
    public String webhookBaseUrl      = "http://localhost:8000";
    public String webhookPath         = "/whatsapp/webhook";
    public int    webhookRetries      = 2;
    public long   webhookRetryDelayMs = 1_000;
    public long   webhookTimeoutMs    = 5_000;

    // Aeron (process mode)
    public String aeronDir          = "/dev/shm/aeron-sgw";
    public String aeronChannel      = "aeron:ipc";
    public int    commandStreamBase = 1000;   // stream = base + worker index
    public int    signalStreamBase  = 2000;

    public boolean processMode() { return "process".equalsIgnoreCase(workerMode); }

    public static GatewayConfig load(String path) {
        GatewayConfig cfg = new GatewayConfig();
        try {
            InputStream is = path != null && Files.exists(Paths.get(path))
                    ? Files.newInputStream(Paths.get(path))
                    : GatewayConfig.class.getResourceAsStream("/gateway.yml");
            if (is != null) {
                try (is) {
                    Map<String, Object> map = new Yaml().load(is);
                    if (map != null) applyMap(cfg, map);
                }
            }
        } catch (Exception e) {
            // log and proceed with defaults
            System.err.println("[config] failed to load config, using defaults: " + e.getMessage());
        }
        applyEnv(cfg, System.getenv());
        return cfg;
    }

    static void applyMap(GatewayConfig cfg, Map<String, Object> map) {
        if (map.containsKey("workers")) cfg.workers = intValue(map, "workers");
        if (map.containsKey("workerMode")) cfg.workerMode = (String) map.get("workerMode");
        if (map.containsKey("respawnDelayMs")) cfg.respawnDelayMs = longValue(map, "respawnDelayMs");
        if (map.containsKey("restoreOnStartup")) cfg.restoreOnStartup = (boolean) map.get("restoreOnStartup");
        if (map.containsKey("httpPort")) cfg.httpPort = intValue(map, "httpPort");
        if (map.containsKey("httpMaxContentLength")) cfg.httpMaxContentLength = intValue(map, "httpMaxContentLength");
        if (map.containsKey("ipcTimeoutMs")) cfg.ipcTimeoutMs = longValue(map, "ipcTimeoutMs");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = intValue(map, "metricsIntervalSecs");
        if (map.containsKey("qrValidityMs")) cfg.qrValidityMs = longValue(map, "qrValidityMs");
        if (map.containsKey("stableDwellMs")) cfg.stableDwellMs = longValue(map, "stableDwellMs");
        if (map.containsKey("reconnectBaseDelayMs")) cfg.reconnectBaseDelayMs = longValue(map, "reconnectBaseDelayMs");
        if (map.containsKey("reconnectIncrementMs")) cfg.reconnectIncrementMs = longValue(map, "reconnectIncrementMs");
        if (map.containsKey("reconnectMaxAttempts")) cfg.reconnectMaxAttempts = intValue(map, "reconnectMaxAttempts");
        if (map.containsKey("conflictBaseDelayMs")) cfg.conflictBaseDelayMs = longValue(map, "conflictBaseDelayMs");
        if (map.containsKey("conflictMaxDelayMs")) cfg.conflictMaxDelayMs = longValue(map, "conflictMaxDelayMs");
        if (map.containsKey("conflictMaxAttempts")) cfg.conflictMaxAttempts = intValue(map, "conflictMaxAttempts");
        if (map.containsKey("dedupWindowMs")) cfg.dedupWindowMs = longValue(map, "dedupWindowMs");
        if (map.containsKey("dedupMaxEntries")) cfg.dedupMaxEntries = intValue(map, "dedupMaxEntries");
        if (map.containsKey("eventQueueCapacity")) cfg.eventQueueCapacity = intValue(map, "eventQueueCapacity");
        if (map.containsKey("connectWaitMs")) cfg.connectWaitMs = longValue(map, "connectWaitMs");
        if (map.containsKey("sendAttemptTimeoutMs")) cfg.sendAttemptTimeoutMs = longValue(map, "sendAttemptTimeoutMs");
        if (map.containsKey("sendMaxAttempts")) cfg.sendMaxAttempts = intValue(map, "sendMaxAttempts");
        if (map.containsKey("sendRetryDelayMs")) cfg.sendRetryDelayMs = longValue(map, "sendRetryDelayMs");
        if (map.containsKey("logoutTimeoutMs")) cfg.logoutTimeoutMs = longValue(map, "logoutTimeoutMs");
        if (map.containsKey("recipientDomain")) cfg.recipientDomain = (String) map.get("recipientDomain");
        if (map.containsKey("persistDebounceMs")) cfg.persistDebounceMs = longValue(map, "persistDebounceMs");
        if (map.containsKey("persistRetryDelayMs")) cfg.persistRetryDelayMs = longValue(map, "persistRetryDelayMs");
        if (map.containsKey("credentialStore")) cfg.credentialStore = (String) map.get("credentialStore");
        if (map.containsKey("credentialStoreDir")) cfg.credentialStoreDir = (String) map.get("credentialStoreDir");
        if (map.containsKey("protocolClient")) cfg.protocolClient = (String) map.get("protocolClient");
        if (map.containsKey("pairingCodeFormat")) cfg.pairingCodeFormat = (String) map.get("pairingCodeFormat");
        if (map.containsKey("qrImageSize")) cfg.qrImageSize = intValue(map, "qrImageSize");
        if (map.containsKey("webhookBaseUrl")) cfg.webhookBaseUrl = (String) map.get("webhookBaseUrl");
        if (map.containsKey("webhookPath")) cfg.webhookPath = (String) map.get("webhookPath");
        if (map.containsKey("webhookRetries")) cfg.webhookRetries = intValue(map, "webhookRetries");
        if (map.containsKey("webhookRetryDelayMs")) cfg.webhookRetryDelayMs = longValue(map, "webhookRetryDelayMs");
        if (map.containsKey("webhookTimeoutMs")) cfg.webhookTimeoutMs = longValue(map, "webhookTimeoutMs");
        if (map.containsKey("aeronDir")) cfg.aeronDir = (String) map.get("aeronDir");
        if (map.containsKey("aeronChannel")) cfg.aeronChannel = (String) map.get("aeronChannel");
        if (map.containsKey("commandStreamBase")) cfg.commandStreamBase = intValue(map, "commandStreamBase");
        if (map.containsKey("signalStreamBase")) cfg.signalStreamBase = intValue(map, "signalStreamBase");
    }

    static void applyEnv(GatewayConfig cfg, Map<String, String> env) {
        if (env.containsKey("PORT")) cfg.httpPort = Integer.parseInt(env.get("PORT"));
        if (env.containsKey("BACKEND_URL")) cfg.webhookBaseUrl = env.get("BACKEND_URL");
        if (env.containsKey("WORKERS")) cfg.workers = Integer.parseInt(env.get("WORKERS"));
    }

    // YAML yields Integer or Long depending on magnitude
    private static int intValue(Map<String, Object> map, String key) {
        return ((Number) map.get(key)).intValue();
    }

    private static long longValue(Map<String, Object> map, String key) {
        return ((Number) map.get(key)).longValue();
    }
}
