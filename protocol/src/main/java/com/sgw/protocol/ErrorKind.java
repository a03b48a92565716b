package com.sgw.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Externally visible failure kinds, each with the HTTP status the control surface answers with.
 */
public enum ErrorKind {
    BAD_REQUEST           ("bad-request",           400),
    NOT_FOUND             ("not-found",             404),
    NOT_AVAILABLE         ("not-available",         503),
    NOT_CONNECTED         ("not-connected",         409),
    RECIPIENT_UNREACHABLE ("recipient-unreachable", 422),
    TRANSPORT_TIMEOUT     ("transport-timeout",     504),
    REQUEST_TIMEOUT       ("request-timeout",       504),
    INTERNAL              ("internal",              500);

    public final String wireName;
    public final int    httpStatus;

    ErrorKind(String wireName, int httpStatus) {
        this.wireName   = wireName;
        this.httpStatus = httpStatus;
    }

    @JsonValue
    public String wireName() { return wireName; }

    @JsonCreator
    public static ErrorKind fromWire(String name) {
        for (ErrorKind k : values()) {
            if (k.wireName.equals(name)) return k;
        }
        return INTERNAL;
    }
}
