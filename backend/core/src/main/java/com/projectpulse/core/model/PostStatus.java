package com.projectpulse.core.model;

public enum PostStatus {
    PENDING,
    SUCCEEDED,
    FAILED_RETRYABLE,
    FAILED_PERMANENT;

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED_PERMANENT;
    }
}
