package com.projectpulse.service;

import com.projectpulse.collectors.api.CollectorResult;
import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.store.StoreUnavailableException;
import com.projectpulse.publishers.api.PublishException;
import com.projectpulse.publishers.api.Publisher;
import com.projectpulse.service.config.ConfigLoader;
import com.projectpulse.service.config.PulseConfig;
import com.projectpulse.service.runtime.CycleLock;
import com.projectpulse.service.runtime.CycleOutcome;
import com.projectpulse.service.runtime.PostResult;
import com.projectpulse.service.runtime.PostingStats;
import com.projectpulse.service.runtime.Sleeper;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_PARTIAL = 1;
    static final int EXIT_FAILURE = 2;
    static final int EXIT_USAGE = 64;

    static final String USAGE = String.join("\n",
            "Usage: pulse <command>",
            "  collect [hours]   collect activities from the last hours (default 24)",
            "  daily             run the daily microblog cycle",
            "  weekly            run the weekly blog cycle",
            "  stats [days]      report posting statistics for the last days (default 7)",
            "  check             test the connection of every configured publisher"
    );

    private Main() {
    }

    public static void main(String[] args) {
        installLogging();
        System.exit(run(args, System.getenv(), Clock.systemUTC(), System.out, Sleeper.system()));
    }

    static int run(String[] args, Map<String, String> env, Clock clock, PrintStream out, Sleeper sleeper) {
        Command command;
        try {
            command = Command.parse(args);
        } catch (IllegalArgumentException e) {
            out.println(e.getMessage());
            out.println(USAGE);
            return EXIT_USAGE;
        }

        PulseConfig config;
        try {
            config = ConfigLoader.load(env);
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Configuration failed", e);
            out.println("Configuration error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            PulseRuntime runtime = new PulseRuntime(config, env, clock, sleeper);
            return switch (command.name()) {
                case "collect" -> collect(runtime, clock.instant().minus(Duration.ofHours(command.amount())), out);
                case "daily" -> cycle(runtime, CycleType.DAILY, clock, out);
                case "weekly" -> cycle(runtime, CycleType.WEEKLY, clock, out);
                case "stats" -> stats(runtime, clock.instant(), command.amount(), out);
                case "check" -> check(runtime, out);
                default -> throw new IllegalArgumentException("Unknown command: " + command.name());
            };
        } catch (StoreUnavailableException e) {
            LOGGER.log(Level.SEVERE, "Store unavailable", e);
            out.println("Store unavailable: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, "Configuration failed", e);
            out.println("Configuration error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int collect(PulseRuntime runtime, Instant since, PrintStream out) {
        List<CollectorResult> results = runtime.collectionPass().run(since);
        int failed = 0;
        for (CollectorResult result : results) {
            if (result.success()) {
                out.printf(Locale.ROOT, "%s: collected=%d admitted=%d duplicates=%d newsworthy=%d%n",
                        result.collector(),
                        result.stat("collected"),
                        result.stat("admitted"),
                        result.stat("duplicates"),
                        result.stat("newsworthy"));
            } else {
                failed++;
                out.println(result.collector() + ": failed: " + result.message());
            }
        }
        if (failed == 0) {
            return EXIT_OK;
        }
        return failed == results.size() ? EXIT_FAILURE : EXIT_PARTIAL;
    }

    private static int cycle(PulseRuntime runtime, CycleType cycleType, Clock clock, PrintStream out) {
        String label = cycleType.name().toLowerCase(Locale.ROOT);
        Optional<CycleLock> acquired = CycleLock.tryAcquire(runtime.stateDirectory(), cycleType);
        if (acquired.isEmpty()) {
            LOGGER.info("Another " + label + " cycle holds the lock; nothing to do");
            out.println(label + ": already running elsewhere, skipped");
            return EXIT_OK;
        }
        try (CycleLock ignored = acquired.get()) {
            CycleOutcome outcome = runtime.scheduler().runCycle(cycleType, clock.instant());
            if (outcome.skipped()) {
                out.println(label + ": skipped, minimum interval not reached");
                return EXIT_OK;
            }
            out.println(label + ": " + outcome.candidates().size() + " candidate(s)");
            for (CycleOutcome.CandidateResult candidate : outcome.candidates()) {
                for (Destination destination : Destination.values()) {
                    PostResult result = candidate.result(destination);
                    if (result == null) {
                        continue;
                    }
                    out.println("  [" + candidate.signature() + "] " + destination + " " + result.status()
                            + (result.externalReference() == null ? "" : " " + result.externalReference())
                            + (result.error() == null || result.succeeded() ? "" : " (" + result.error() + ")"));
                }
            }
            return outcome.exitCode();
        }
    }

    private static int stats(PulseRuntime runtime, Instant now, int days, PrintStream out) {
        Instant since = now.minus(Duration.ofDays(days));
        out.print(PostingStats.collect(runtime.store(), runtime.eventStore(), since, now).render());
        return EXIT_OK;
    }

    private static int check(PulseRuntime runtime, PrintStream out) {
        out.println("store: ok (" + runtime.store().file() + ")");
        Map<Destination, Publisher> publishers = runtime.publishers();
        int failed = 0;
        for (Map.Entry<Destination, Publisher> entry : publishers.entrySet()) {
            String label = entry.getKey() + " (" + entry.getValue().name() + ")";
            try {
                entry.getValue().checkConnection();
                out.println(label + ": ok");
            } catch (PublishException e) {
                failed++;
                LOGGER.warning("Connection check failed for " + label + ": " + e.getMessage());
                out.println(label + ": failed: " + e.getMessage());
            }
        }
        if (failed == 0) {
            return EXIT_OK;
        }
        return failed == publishers.size() ? EXIT_FAILURE : EXIT_PARTIAL;
    }

    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed loading logging.properties from the classpath", e);
        }
    }

    record Command(String name, int amount) {
        static Command parse(String[] args) {
            if (args.length == 0) {
                throw new IllegalArgumentException("Missing command");
            }
            String name = args[0].toLowerCase(Locale.ROOT);
            switch (name) {
                case "collect":
                    return new Command(name, optionalAmount(args, 24));
                case "stats":
                    return new Command(name, optionalAmount(args, 7));
                case "daily":
                case "weekly":
                case "check":
                    if (args.length > 1) {
                        throw new IllegalArgumentException("'" + name + "' takes no arguments");
                    }
                    return new Command(name, 0);
                default:
                    throw new IllegalArgumentException("Unknown command: " + args[0]);
            }
        }

        private static int optionalAmount(String[] args, int fallback) {
            if (args.length > 2) {
                throw new IllegalArgumentException("Too many arguments for '" + args[0] + "'");
            }
            if (args.length == 1) {
                return fallback;
            }
            try {
                int value = Integer.parseInt(args[1]);
                if (value <= 0) {
                    throw new IllegalArgumentException("Expected a positive number but got " + args[1]);
                }
                return value;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected a positive number but got " + args[1], e);
            }
        }
    }
}
