package com.sgw.worker.session;

import com.sgw.worker.client.CloseCodes;

/**
 * How a connection closure is handled.
 */
public enum CloseCategory {
    /** Absorbing: no reconnect, the session is removed. */
    LOGGED_OUT,
    /** Exponential backoff with its own, smaller attempt budget. */
    DEVICE_CONFLICT,
    /** Linear backoff up to the ordinary attempt budget. */
    ORDINARY;

    public static CloseCategory classify(int code) {
        if (CloseCodes.isUnauthorized(code)) return LOGGED_OUT;
        if (CloseCodes.isDeviceConflict(code)) return DEVICE_CONFLICT;
        return ORDINARY;
    }
}
