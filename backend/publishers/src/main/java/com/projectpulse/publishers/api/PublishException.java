package com.projectpulse.publishers.api;

/**
 * A destination rejected or could not take a post. Subclasses decide whether trying again can help.
 */
public abstract class PublishException extends Exception {
    protected PublishException(String message) {
        super(message);
    }

    protected PublishException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean retryable();
}
