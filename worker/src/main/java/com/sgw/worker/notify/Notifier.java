package com.sgw.worker.notify;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fire-and-forget sink for session events. Implementations must never block the caller
 * and never throw: delivery failures are theirs to log.
 */
public interface Notifier {

    void publish(String sessionId, WebhookEvent event, ObjectNode data);
}
