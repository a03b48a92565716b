package com.sgw.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Actions the coordinator dispatches to the worker owning a session.
 */
public enum Action {
    START_SESSION ("start_session"),
    SEND_TEXT     ("send_text"),
    SEND_MEDIA    ("send_media"),
    DISCONNECT    ("disconnect"),
    GET_STATUS    ("get_status");

    public final String wireName;

    Action(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static Action fromWire(String name) {
        for (Action a : values()) {
            if (a.wireName.equals(name)) return a;
        }
        throw new IllegalArgumentException("Unknown action: " + name);
    }
}
