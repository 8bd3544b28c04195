package com.projectpulse.core.model;

public enum Source {
    CHAT,
    REPOSITORY,
    STATISTICS
}
