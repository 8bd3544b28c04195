package com.projectpulse.service;

import com.projectpulse.collectors.api.Collector;
import com.projectpulse.collectors.api.CollectorContext;
import com.projectpulse.collectors.chat.ChatRoomCollector;
import com.projectpulse.collectors.intake.CollectionPass;
import com.projectpulse.collectors.intake.ContentFilter;
import com.projectpulse.collectors.intake.Deduplicator;
import com.projectpulse.collectors.repository.RepositoryEventCollector;
import com.projectpulse.collectors.statistics.StatisticsCollector;
import com.projectpulse.core.bus.EventBus;
import com.projectpulse.core.model.Destination;
import com.projectpulse.publishers.api.Publisher;
import com.projectpulse.publishers.api.Summarizer;
import com.projectpulse.publishers.blog.BlogPublisher;
import com.projectpulse.publishers.format.ContentFormatter;
import com.projectpulse.publishers.mastodon.MastodonPublisher;
import com.projectpulse.publishers.summary.HttpSummarizer;
import com.projectpulse.publishers.x.XPublisher;
import com.projectpulse.service.config.DestinationsConfig;
import com.projectpulse.service.config.PulseConfig;
import com.projectpulse.service.config.ScheduleConfig;
import com.projectpulse.service.config.SourcesConfig;
import com.projectpulse.service.http.HttpClientFactory;
import com.projectpulse.service.runtime.CycleScheduler;
import com.projectpulse.service.runtime.PublishCoordinator;
import com.projectpulse.service.runtime.Sleeper;
import com.projectpulse.service.store.EventCodec;
import com.projectpulse.service.store.JsonFileActivityStore;
import com.projectpulse.service.store.JsonlEventStore;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Wires stores, adapters and runtime components for one CLI invocation.
 */
final class PulseRuntime {
    private final PulseConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final EventBus eventBus = new EventBus();
    private final JsonFileActivityStore store;
    private final JsonlEventStore eventStore;
    private final HttpClient httpClient;
    private final ContentFormatter formatter;

    PulseRuntime(PulseConfig config, Map<String, String> env, Clock clock, Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
        this.store = new JsonFileActivityStore(config.stateFile());
        this.eventStore = new JsonlEventStore(config.eventLog());
        EventCodec.subscribeAll(eventBus, eventStore::append);
        this.httpClient = HttpClientFactory.create(Duration.ofSeconds(5), env);
        DestinationsConfig.Format format = config.destinations().format();
        this.formatter = new ContentFormatter(format.projectHashtag(), format.extraHashtags(), zone());
    }

    JsonFileActivityStore store() {
        return store;
    }

    JsonlEventStore eventStore() {
        return eventStore;
    }

    EventBus eventBus() {
        return eventBus;
    }

    Path stateDirectory() {
        Path parent = config.stateFile().toAbsolutePath().getParent();
        return parent == null ? Path.of(".") : parent;
    }

    CollectionPass collectionPass() {
        SourcesConfig sources = config.sources();
        List<Collector> collectors = new ArrayList<>();
        Map<String, Object> collectorConfig = new HashMap<>();
        if (config.collectorEnabled(ChatRoomCollector.CONFIG_KEY)) {
            collectorConfig.put(ChatRoomCollector.CONFIG_KEY, required(sources.chat(), "chat"));
            collectors.add(new ChatRoomCollector());
        }
        if (config.collectorEnabled(RepositoryEventCollector.CONFIG_KEY)) {
            collectorConfig.put(RepositoryEventCollector.CONFIG_KEY, required(sources.repository(), "repository"));
            collectors.add(new RepositoryEventCollector());
        }
        if (config.collectorEnabled(StatisticsCollector.CONFIG_KEY)) {
            collectorConfig.put(StatisticsCollector.CONFIG_KEY, required(sources.statistics(), "statistics"));
            collectors.add(new StatisticsCollector());
        }
        CollectorContext context = new CollectorContext(
                httpClient,
                eventBus,
                clock,
                Duration.ofSeconds(sources.requestTimeoutSeconds()),
                collectorConfig
        );
        return new CollectionPass(
                collectors,
                context,
                new Deduplicator(store),
                new ContentFilter(store, config.filter())
        );
    }

    Map<Destination, Publisher> publishers() {
        DestinationsConfig destinations = config.destinations();
        Duration timeout = Duration.ofSeconds(destinations.requestTimeoutSeconds());
        Map<Destination, Publisher> publishers = new EnumMap<>(Destination.class);
        addMicroblog(publishers, Destination.MICROBLOG_A, destinations.microblogA(), config.secrets().microblogAToken(), timeout);
        addMicroblog(publishers, Destination.MICROBLOG_B, destinations.microblogB(), config.secrets().microblogBToken(), timeout);
        DestinationsConfig.Blog blog = destinations.blog();
        if (blog != null && blog.enabled()) {
            if (blog.postsDirectory() == null || blog.postsDirectory().isBlank()) {
                throw new IllegalStateException("blog.postsDirectory is required in "
                        + config.configDir().resolve("destinations.json"));
            }
            publishers.put(Destination.BLOG, new BlogPublisher(
                    Path.of(blog.postsDirectory()),
                    blog.siteUrl(),
                    blog.author(),
                    clock,
                    zone()
            ));
        }
        return publishers;
    }

    CycleScheduler scheduler() {
        ScheduleConfig schedule = config.schedule();
        Map<Destination, Publisher> publishers = publishers();
        PublishCoordinator coordinator = new PublishCoordinator(
                store,
                publishers,
                formatter,
                eventBus,
                schedule.retry(),
                schedule.publishParallelism(),
                sleeper,
                clock
        );
        return new CycleScheduler(
                store,
                coordinator,
                formatter,
                summarizer(),
                schedule,
                publishers.keySet(),
                eventBus
        );
    }

    private Summarizer summarizer() {
        DestinationsConfig destinations = config.destinations();
        DestinationsConfig.SummarizerSettings settings = destinations.summarizer();
        if (!settings.enabled()) {
            return null;
        }
        return new HttpSummarizer(
                httpClient,
                Duration.ofSeconds(Math.max(60, destinations.requestTimeoutSeconds())),
                settings.apiUrl(),
                config.secrets().summarizerApiKey(),
                settings.model(),
                settings.maxTokens(),
                settings.projectName(),
                zone()
        );
    }

    private void addMicroblog(
            Map<Destination, Publisher> publishers,
            Destination destination,
            DestinationsConfig.Microblog microblog,
            String token,
            Duration timeout
    ) {
        if (microblog == null || !microblog.enabled()) {
            return;
        }
        String service = microblog.service() == null ? "" : microblog.service().toLowerCase(Locale.ROOT);
        switch (service) {
            case "mastodon" -> publishers.put(destination,
                    new MastodonPublisher(httpClient, timeout, destination, microblog.url(), token));
            case "x" -> publishers.put(destination,
                    new XPublisher(httpClient, timeout, destination, microblog.url(), token));
            default -> throw new IllegalStateException("Unknown microblog service '" + microblog.service() + "' for "
                    + destination + " in " + config.configDir().resolve("destinations.json"));
        }
    }

    private <T> T required(T section, String name) {
        if (section == null) {
            throw new IllegalStateException("Collector enabled but '" + name + "' is missing from "
                    + config.configDir().resolve("sources.json"));
        }
        return section;
    }

    private ZoneId zone() {
        return config.schedule().zoneId();
    }
}
