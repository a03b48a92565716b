package com.sgw.worker.session;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sgw.protocol.Envelopes;
import com.sgw.protocol.SessionStatus;

/**
 * Read-only view of a session for status queries.
 */
public record SessionSnapshot(String sessionId,
                              SessionStatus status,
                              String identity,
                              String pairingCode,
                              long pairingExpiresAt,
                              int reconnectAttempts,
                              boolean stable,
                              long connectedAt) {

    public ObjectNode toJson() {
        ObjectNode node = Envelopes.object()
                .put("sessionId", sessionId)
                .put("status", status.wireName)
                .put("reconnectAttempts", reconnectAttempts)
                .put("stable", stable);
        if (identity != null) node.put("identity", identity);
        if (status == SessionStatus.QR_READY && pairingCode != null) {
            node.put("pairingCode", pairingCode);
            node.put("pairingExpiresAt", pairingExpiresAt);
        }
        if (connectedAt > 0) node.put("connectedAt", connectedAt);
        return node;
    }
}
