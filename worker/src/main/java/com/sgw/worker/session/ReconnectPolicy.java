package com.sgw.worker.session;

import com.sgw.common.GatewayConfig;

/**
 * Reconnect delays per closure category.
 *
 *   ORDINARY:        base + increment * (attempt - 1), up to maxAttempts
 *   DEVICE_CONFLICT: min(conflictBase * 2^(attempt - 1), conflictMax), up to conflictMaxAttempts
 *   LOGGED_OUT:      never
 */
public final class ReconnectPolicy {

    public static final long GIVE_UP = -1L;

    private final long baseDelayMs;
    private final long incrementMs;
    private final int  maxAttempts;
    private final long conflictBaseDelayMs;
    private final long conflictMaxDelayMs;
    private final int  conflictMaxAttempts;

    public ReconnectPolicy(long baseDelayMs, long incrementMs, int maxAttempts,
                           long conflictBaseDelayMs, long conflictMaxDelayMs, int conflictMaxAttempts) {
        if (incrementMs <= 0) throw new IllegalArgumentException("incrementMs must be positive");
        this.baseDelayMs         = baseDelayMs;
        this.incrementMs         = incrementMs;
        this.maxAttempts         = maxAttempts;
        this.conflictBaseDelayMs = conflictBaseDelayMs;
        this.conflictMaxDelayMs  = conflictMaxDelayMs;
        this.conflictMaxAttempts = conflictMaxAttempts;
    }

    public static ReconnectPolicy fromConfig(GatewayConfig cfg) {
        return new ReconnectPolicy(cfg.reconnectBaseDelayMs, cfg.reconnectIncrementMs, cfg.reconnectMaxAttempts,
                cfg.conflictBaseDelayMs, cfg.conflictMaxDelayMs, cfg.conflictMaxAttempts);
    }

    /**
     * @param attempt 1-based number of the reconnect about to be made
     * @return delay in millis, or {@link #GIVE_UP}
     */
    public long delayFor(CloseCategory category, int attempt) {
        return switch (category) {
            case ORDINARY -> attempt > maxAttempts
                    ? GIVE_UP
                    : baseDelayMs + incrementMs * (attempt - 1);
            case DEVICE_CONFLICT -> attempt > conflictMaxAttempts
                    ? GIVE_UP
                    : Math.min(conflictBaseDelayMs << Math.min(attempt - 1, 30), conflictMaxDelayMs);
            case LOGGED_OUT -> GIVE_UP;
        };
    }

    public int maxAttempts(CloseCategory category) {
        return switch (category) {
            case ORDINARY -> maxAttempts;
            case DEVICE_CONFLICT -> conflictMaxAttempts;
            case LOGGED_OUT -> 0;
        };
    }
}
