package com.projectpulse.collectors.intake;

public class ClassificationException extends RuntimeException {
    private final long activityId;

    public ClassificationException(long activityId, String message, Throwable cause) {
        super(message, cause);
        this.activityId = activityId;
    }

    public long activityId() {
        return activityId;
    }
}
