package com.projectpulse.publishers.api;

import com.projectpulse.core.model.Destination;

/**
 * Adapter for one destination. Each call makes exactly one request; retrying is the caller's job.
 */
public interface Publisher {
    String name();

    Destination destination();

    PublishOutcome publish(String content) throws PublishException;

    /**
     * Verifies credentials and reachability without publishing anything.
     */
    void checkConnection() throws PublishException;
}
