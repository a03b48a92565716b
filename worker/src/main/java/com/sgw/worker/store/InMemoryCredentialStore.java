package com.sgw.worker.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for development and tests. Shared by all embedded workers.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private final ConcurrentHashMap<String, CredentialRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<CredentialRecord> load(String sessionId) throws CredentialStoreException {
        return Optional.ofNullable(records.get(sessionId));
    }

    @Override
    public void upsert(CredentialRecord record) throws CredentialStoreException {
        records.put(record.id(), record);
    }

    @Override
    public Collection<String> sessionIds() {
        return new ArrayList<>(records.keySet());
    }
}
