package com.sgw.worker.store;

import java.util.Collection;
import java.util.Optional;

/**
 * Durable credential storage, keyed by session id. Calls may block.
 */
public interface CredentialStore {

    Optional<CredentialRecord> load(String sessionId) throws CredentialStoreException;

    void upsert(CredentialRecord record) throws CredentialStoreException;

    /** Ids of every session with stored credentials; used for startup restore. */
    Collection<String> sessionIds() throws CredentialStoreException;
}
