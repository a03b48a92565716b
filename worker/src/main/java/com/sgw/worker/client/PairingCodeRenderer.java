package com.sgw.worker.client;

import com.sgw.common.GatewayConfig;

/**
 * Turns the raw pairing code into what is stored in status and published to the webhook.
 */
@FunctionalInterface
public interface PairingCodeRenderer {

    PairingCodeRenderer RAW = code -> code;

    String render(String code);

    /** {@code pairingCodeFormat}: {@code raw} or {@code qr-data-url}. */
    static PairingCodeRenderer fromConfig(GatewayConfig cfg) {
        switch (cfg.pairingCodeFormat) {
            case "raw":
                return RAW;
            case "qr-data-url":
                return new QrDataUrlRenderer(cfg.qrImageSize);
            default:
                throw new IllegalArgumentException("unknown pairingCodeFormat: " + cfg.pairingCodeFormat);
        }
    }
}
