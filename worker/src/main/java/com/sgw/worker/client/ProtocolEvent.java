package com.sgw.worker.client;

/**
 * Typed events emitted by a {@link ProtocolClient}.
 */
public interface ProtocolEvent {

    /** A one-time code the user scans to pair the session. */
    record PairingCode(String code) implements ProtocolEvent {}

    /** The connection is open. {@code userId} is the remote account id, e.g. {@code 15551234:7@s.whatsapp.net}. */
    record Opened(String userId, String displayName) implements ProtocolEvent {

        /** Phone identity without device suffix or domain. */
        public String identity() {
            if (userId == null || userId.isEmpty()) return "unknown";
            String bare = userId.split(":")[0];
            int at = bare.indexOf('@');
            return at >= 0 ? bare.substring(0, at) : bare;
        }
    }

    /** The connection closed; see {@link CloseCodes}. */
    record Closed(int code, String reason) implements ProtocolEvent {}

    record MessageReceived(InboundMessage message) implements ProtocolEvent {}

    /** Routine key material churn. Losing an intermediate update is tolerable. */
    record KeysUpdated(byte[] blob) implements ProtocolEvent {}

    /** Credentials that decide whether the session can re-authenticate. Must never be lost. */
    record CredentialsRotated(byte[] blob) implements ProtocolEvent {}
}
