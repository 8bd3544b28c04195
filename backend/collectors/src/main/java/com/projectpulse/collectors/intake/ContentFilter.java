package com.projectpulse.collectors.intake;

import com.projectpulse.collectors.config.FilterConfig;
import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.ActivityPayload;
import com.projectpulse.core.model.Source;
import com.projectpulse.core.store.ActivityStore;
import com.projectpulse.core.store.StoreUnavailableException;
import com.projectpulse.core.util.TextUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether an admitted activity is worth publishing. Rules are per source and driven by {@link FilterConfig}.
 */
public class ContentFilter {
    private static final Logger LOGGER = Logger.getLogger(ContentFilter.class.getName());

    private final ActivityStore store;
    private final FilterConfig config;
    private final List<Pattern> noisePatterns;

    public ContentFilter(ActivityStore store, FilterConfig config) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.noisePatterns = config.chat().noisePatterns().stream()
                .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    /**
     * Classifies {@code activity} and stores the verdict. An activity already published successfully keeps its
     * verdict.
     *
     * @throws ClassificationException when a rule fails; the activity stays unclassified
     */
    public Activity classify(Activity activity) {
        if (activity.markedNewsworthy() && store.consumedBySucceededPost(activity.id())) {
            return activity;
        }
        boolean newsworthy;
        try {
            newsworthy = evaluate(activity);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ClassificationException(
                    activity.id(),
                    "Classification failed for activity " + activity.id() + " (" + activity.source() + "): " + e.getMessage(),
                    e
            );
        }
        return store.markNewsworthy(activity.id(), newsworthy);
    }

    /**
     * Classifies every activity still waiting for a verdict, in insertion order.
     */
    public Reclassification reclassifyPending() {
        List<Activity> classified = new ArrayList<>();
        List<ClassificationException> failures = new ArrayList<>();
        for (Activity pending : store.unclassifiedActivities()) {
            try {
                classified.add(classify(pending));
            } catch (ClassificationException e) {
                LOGGER.log(Level.WARNING, e.getMessage(), e);
                failures.add(e);
            }
        }
        return new Reclassification(List.copyOf(classified), List.copyOf(failures));
    }

    boolean evaluate(Activity activity) {
        return switch (activity.source()) {
            case CHAT -> chatIsNewsworthy(activity.payload());
            case REPOSITORY -> repositoryIsNewsworthy(activity.payload());
            case STATISTICS -> statisticsIsNewsworthy(activity);
        };
    }

    private boolean chatIsNewsworthy(ActivityPayload payload) {
        FilterConfig.Chat rules = config.chat();
        String text = TextUtils.collapseWhitespace(payload.summary());
        if (text.length() < rules.minLength()) {
            return false;
        }
        for (Pattern noise : noisePatterns) {
            if (noise.matcher(text).find()) {
                return false;
            }
        }
        if (rules.keywords().isEmpty()) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return rules.keywords().stream().anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    private boolean repositoryIsNewsworthy(ActivityPayload payload) {
        FilterConfig.Repository rules = config.repository();
        String kind = payload.kind() == null ? "" : payload.kind();
        if (rules.ignoredKinds().contains(kind)) {
            return false;
        }
        if ("comment".equals(kind)
                && payload.branch() != null
                && payload.defaultBranch() != null
                && !payload.branch().equals(payload.defaultBranch())) {
            return false;
        }
        if ("push".equals(kind)) {
            Double commits = payload.metric("commits");
            return commits != null && commits >= rules.minPushCommits();
        }
        return true;
    }

    private boolean statisticsIsNewsworthy(Activity activity) {
        Optional<Activity> baseline = store.latestNewsworthy(Source.STATISTICS, activity.id());
        if (baseline.isEmpty()) {
            return true;
        }
        FilterConfig.Statistics rules = config.statistics();
        ActivityPayload current = activity.payload();
        ActivityPayload previous = baseline.get().payload();
        List<String> tracked = rules.trackedMetrics().isEmpty()
                ? List.copyOf(current.metrics().keySet())
                : rules.trackedMetrics();
        for (String metric : tracked) {
            Double now = current.metric(metric);
            if (now == null) {
                continue;
            }
            Double before = previous.metric(metric);
            if (before == null) {
                return true;
            }
            if (before == 0.0) {
                if (now != 0.0) {
                    return true;
                }
                continue;
            }
            if (Math.abs(now - before) / Math.abs(before) > rules.relativeThreshold()) {
                return true;
            }
        }
        return false;
    }

    public record Reclassification(List<Activity> classified, List<ClassificationException> failures) {
    }
}
