package com.projectpulse.publishers.api;

public class RetryablePublishException extends PublishException {
    public RetryablePublishException(String message) {
        super(message);
    }

    public RetryablePublishException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
