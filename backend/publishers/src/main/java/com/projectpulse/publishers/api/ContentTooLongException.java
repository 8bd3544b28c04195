package com.projectpulse.publishers.api;

/**
 * The destination refused the text because of its length. Callers may retry once with a shorter rendering.
 */
public class ContentTooLongException extends PermanentPublishException {
    public ContentTooLongException(String message) {
        super(message);
    }
}
