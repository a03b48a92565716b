package com.sgw.worker;

import com.sgw.protocol.ErrorKind;

/**
 * A worker action failed in a way the caller should see, with the kind that decides
 * the external error code.
 */
public class ActionException extends RuntimeException {

    public final ErrorKind kind;

    public ActionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ActionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
