package com.sgw.worker.client;

/**
 * Close reason codes reported by the remote service.
 */
public final class CloseCodes {
    private CloseCodes() {}

    public static final int HANDSHAKE_FAILED     = -1;   // local: connect() failed before any event
    public static final int CONNECTION_LOST      = 408;
    public static final int MULTIDEVICE_MISMATCH = 411;
    public static final int CONNECTION_CLOSED    = 428;
    public static final int LOGGED_OUT           = 401;
    public static final int FORBIDDEN            = 403;
    public static final int CONNECTION_REPLACED  = 440;
    public static final int BAD_SESSION          = 500;
    public static final int UNAVAILABLE_SERVICE  = 503;
    public static final int RESTART_REQUIRED     = 515;

    /** Pairing revoked; reconnecting cannot succeed. */
    public static boolean isUnauthorized(int code) {
        return code == LOGGED_OUT || code == FORBIDDEN;
    }

    /** Another device or process took over the same account. */
    public static boolean isDeviceConflict(int code) {
        return code == CONNECTION_REPLACED;
    }
}
