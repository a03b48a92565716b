package com.sgw.worker.store;

public class CredentialStoreException extends Exception {

    public CredentialStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
