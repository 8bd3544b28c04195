package com.projectpulse.publishers.api;

public class PermanentPublishException extends PublishException {
    public PermanentPublishException(String message) {
        super(message);
    }

    public PermanentPublishException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
