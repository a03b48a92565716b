package com.sgw.worker.client;

/**
 * The recipient does not exist, blocked the account, or cannot receive messages.
 * Not retried: a second attempt would fail the same way.
 */
public class RecipientUnreachableException extends Exception {

    public RecipientUnreachableException(String message) {
        super(message);
    }
}
