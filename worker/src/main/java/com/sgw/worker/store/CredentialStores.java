package com.sgw.worker.store;

import com.sgw.common.GatewayConfig;

import java.nio.file.Paths;

public final class CredentialStores {
    private CredentialStores() {}

    public static CredentialStore fromConfig(GatewayConfig cfg) throws CredentialStoreException {
        return switch (cfg.credentialStore) {
            case "file"   -> new FileCredentialStore(Paths.get(cfg.credentialStoreDir));
            case "memory" -> new InMemoryCredentialStore();
            default -> throw new IllegalArgumentException("Unknown credentialStore: " + cfg.credentialStore);
        };
    }
}
