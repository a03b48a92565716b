package com.sgw.worker.client;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

public final class ProtocolClients {
    private ProtocolClients() {}

    public static ProtocolClientFactory load(String name) {
        List<String> available = new ArrayList<>();
        for (ProtocolClientFactory factory : ServiceLoader.load(ProtocolClientFactory.class)) {
            if (factory.name().equalsIgnoreCase(name)) return factory;
            available.add(factory.name());
        }
        throw new IllegalArgumentException("No protocol client named '" + name + "', available: " + available);
    }
}
