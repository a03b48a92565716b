package com.sgw.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    INITIALIZING ("initializing"),
    QR_READY     ("qr_ready"),
    CONNECTED    ("connected"),
    RECONNECTING ("reconnecting"),
    EXPIRED      ("expired"),
    LOGGED_OUT   ("logged_out"),
    TERMINATED   ("terminated");

    public final String wireName;

    SessionStatus(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static SessionStatus fromWire(String name) {
        for (SessionStatus s : values()) {
            if (s.wireName.equals(name)) return s;
        }
        throw new IllegalArgumentException("Unknown session status: " + name);
    }
}
