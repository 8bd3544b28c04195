package com.projectpulse.service.support;

import com.projectpulse.core.model.Destination;
import com.projectpulse.publishers.api.PublishException;
import com.projectpulse.publishers.api.PublishOutcome;
import com.projectpulse.publishers.api.Publisher;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publisher that plays back scripted steps, then succeeds with {@code ref-N} references.
 */
public class ScriptedPublisher implements Publisher {
    private final Destination destination;
    private final Deque<Step> script = new ArrayDeque<>();
    private final List<String> published = new CopyOnWriteArrayList<>();
    private PublishException connectionFailure;

    public ScriptedPublisher(Destination destination) {
        this.destination = destination;
    }

    public synchronized ScriptedPublisher then(Step step) {
        script.addLast(step);
        return this;
    }

    public synchronized ScriptedPublisher thenFail(PublishException error) {
        return then(content -> {
            throw error;
        });
    }

    public synchronized ScriptedPublisher thenFailAlways(PublishException error) {
        for (int i = 0; i < 20; i++) {
            thenFail(error);
        }
        return this;
    }

    public ScriptedPublisher failingConnection(PublishException error) {
        this.connectionFailure = error;
        return this;
    }

    public List<String> published() {
        return List.copyOf(published);
    }

    @Override
    public String name() {
        return "scripted-" + destination.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public Destination destination() {
        return destination;
    }

    @Override
    public PublishOutcome publish(String content) throws PublishException {
        published.add(content);
        Step next;
        synchronized (this) {
            next = script.pollFirst();
        }
        if (next != null) {
            return next.apply(content);
        }
        return PublishOutcome.published("ref-" + published.size());
    }

    @Override
    public void checkConnection() throws PublishException {
        if (connectionFailure != null) {
            throw connectionFailure;
        }
    }

    @FunctionalInterface
    public interface Step {
        PublishOutcome apply(String content) throws PublishException;
    }
}
