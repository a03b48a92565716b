package com.sgw.worker.notify;

/**
 * Events published to the downstream backend, with the endpoint suffix each is posted to.
 */
public enum WebhookEvent {
    PAIRING_READY    ("pairing_ready",    "/qr"),
    CONNECTED        ("connected",        "/connected"),
    MESSAGE_RECEIVED ("message_received", "/message"),
    DISCONNECTED     ("disconnected",     "/disconnect"),
    LOGGED_OUT       ("logged_out",       "/disconnect");

    public final String wireName;
    public final String pathSuffix;

    WebhookEvent(String wireName, String pathSuffix) {
        this.wireName   = wireName;
        this.pathSuffix = pathSuffix;
    }
}
