package com.projectpulse.publishers.format;

import com.projectpulse.core.model.Activity;
import com.projectpulse.core.model.ActivityPayload;
import com.projectpulse.core.model.Candidate;
import com.projectpulse.core.model.CycleType;
import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Source;
import com.projectpulse.core.util.TextUtils;
import com.projectpulse.publishers.api.ContentRenderer;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Renders candidates as plain text for the microblogs and Markdown for the blog, within each destination's
 * character limit.
 */
public class ContentFormatter implements ContentRenderer {
    static final int DIGEST_SECTION_LIMIT = 10;
    private static final Pattern MARKUP = Pattern.compile("[*_`]");
    private static final DateTimeFormatter DAY_MONTH = DateTimeFormatter.ofPattern("MMMM dd", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.ENGLISH);

    private final String projectHashtag;
    private final List<String> extraHashtags;
    private final ZoneId zone;

    public ContentFormatter(String projectHashtag, List<String> extraHashtags, ZoneId zone) {
        this.projectHashtag = projectHashtag;
        this.extraHashtags = extraHashtags == null ? List.of() : List.copyOf(extraHashtags);
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    @Override
    public String render(Candidate candidate, Destination destination, boolean shortened) {
        if (candidate.isAnnouncement()) {
            return announcement(candidate, destination, shortened);
        }
        if (candidate.cycleType() == CycleType.WEEKLY) {
            return renderWeekly(candidate, destination);
        }
        Activity activity = candidate.primary();
        if (destination == Destination.BLOG) {
            return blogEntry(activity);
        }
        int limit = destination.characterLimit();
        if (shortened) {
            return microblog(activity, limit * 3 / 4, 0);
        }
        return microblog(activity, limit, destination == Destination.MICROBLOG_B ? 2 : 5);
    }

    /**
     * Deterministic Markdown summary of a week, grouped by section with at most ten entries each.
     */
    public String digest(List<Activity> activities, Instant windowStart, Instant windowEnd) {
        Instant start = windowStart != null ? windowStart : activities.stream()
                .map(Activity::observedAt).min(Comparator.naturalOrder()).orElse(windowEnd);
        Instant end = windowEnd != null ? windowEnd : activities.stream()
                .map(Activity::observedAt).max(Comparator.naturalOrder()).orElse(start);

        List<String> parts = new ArrayList<>();
        parts.add("# " + weeklyTitle(start, end));
        if (activities.isEmpty()) {
            parts.add("No significant activities this week.");
            return String.join("\n\n", parts);
        }
        parts.add("This week we had " + activities.size()
                + (activities.size() == 1 ? " activity" : " activities") + " across the project.");

        Map<Section, List<Activity>> grouped = new LinkedHashMap<>();
        for (Section section : Section.values()) {
            grouped.put(section, new ArrayList<>());
        }
        for (Activity activity : activities) {
            grouped.get(Section.of(activity)).add(activity);
        }
        for (Map.Entry<Section, List<Activity>> entry : grouped.entrySet()) {
            List<Activity> inSection = entry.getValue();
            if (inSection.isEmpty()) {
                continue;
            }
            parts.add("## " + entry.getKey().heading);
            inSection.stream().limit(DIGEST_SECTION_LIMIT).forEach(activity -> parts.add(blogEntry(activity)));
            if (inSection.size() > DIGEST_SECTION_LIMIT) {
                parts.add("*...and " + (inSection.size() - DIGEST_SECTION_LIMIT) + " more*");
            }
        }
        return String.join("\n\n", parts);
    }

    public String weeklyTitle(Instant start, Instant end) {
        return "Weekly Update: " + DAY_MONTH.format(start.atZone(zone)) + " - " + DAY_MONTH_YEAR.format(end.atZone(zone));
    }

    String blogEntry(Activity activity) {
        ActivityPayload payload = activity.payload();
        List<String> parts = new ArrayList<>();
        parts.add("### " + title(activity));
        if (payload.actor() != null) {
            parts.add("*By: " + payload.actor() + "*");
        }
        if (payload.link() != null) {
            parts.add("[View details](" + payload.link() + ")");
        }
        return String.join("\n\n", parts);
    }

    List<String> hashtags(Activity activity, int max) {
        List<String> tags = new ArrayList<>();
        if (projectHashtag != null && !projectHashtag.isBlank()) {
            tags.add(projectHashtag);
        }
        tags.addAll(Section.of(activity).hashtags(activity));
        tags.addAll(extraHashtags);
        return tags.stream().distinct().limit(Math.max(0, max)).toList();
    }

    private String microblog(Activity activity, int limit, int maxHashtags) {
        String prefix = Section.of(activity).emoji(activity) + " ";
        String link = activity.payload().link();
        String linkPart = link == null ? "" : "\n\n" + link;
        List<String> tags = hashtags(activity, maxHashtags);
        String tagPart = tags.isEmpty() ? "" : "\n\n" + String.join(" ", tags);

        int budget = limit - prefix.length() - linkPart.length() - tagPart.length();
        if (budget < 20 && !tagPart.isEmpty()) {
            tagPart = "";
            budget = limit - prefix.length() - linkPart.length();
        }
        String text = prefix + TextUtils.truncate(title(activity), Math.max(budget, 1)) + linkPart + tagPart;
        return TextUtils.truncate(text, limit);
    }

    private String renderWeekly(Candidate candidate, Destination destination) {
        String body = candidate.body() != null && !candidate.body().isBlank()
                ? candidate.body()
                : digest(candidate.activities(), candidate.windowStart(), candidate.windowEnd());
        if (destination == Destination.BLOG) {
            return body;
        }
        Instant end = candidate.windowEnd() != null ? candidate.windowEnd() : candidate.primary().observedAt();
        Instant start = candidate.windowStart() != null ? candidate.windowStart() : end;
        String text = "📊 " + weeklyTitle(start, end) + "\n\n"
                + candidate.activities().size() + " updates this week."
                + (projectHashtag == null || projectHashtag.isBlank() ? "" : "\n\n" + projectHashtag);
        return TextUtils.truncate(text, destination.characterLimit());
    }

    /**
     * Short microblog pointer to a published weekly post. The link and hashtags are kept whole; the text before them
     * is cut to fit.
     */
    private String announcement(Candidate candidate, Destination destination, boolean shortened) {
        Instant end = candidate.windowEnd() != null ? candidate.windowEnd() : candidate.primary().observedAt();
        Instant start = candidate.windowStart() != null ? candidate.windowStart() : end;
        String title = headingOf(candidate.body());
        if (title == null) {
            title = weeklyTitle(start, end);
        }
        int count = candidate.activities().size();
        String text = "📊 " + title;
        if (!shortened) {
            text += "\n\n" + count + (count == 1 ? " update" : " updates") + " this week. Read the full update on our blog:";
        }
        String link = candidate.announces().isBlank() ? "" : "\n" + candidate.announces();
        List<String> tags = new ArrayList<>();
        if (projectHashtag != null && !projectHashtag.isBlank()) {
            tags.add(projectHashtag);
        }
        if (!shortened) {
            tags.addAll(extraHashtags);
        }
        String tagPart = tags.isEmpty() ? "" : "\n\n" + String.join(" ", tags.stream().distinct().toList());

        int limit = destination.characterLimit();
        if (limit <= 0) {
            return text + link + tagPart;
        }
        int budget = limit - link.length() - tagPart.length();
        if (budget < 20) {
            tagPart = "";
            budget = limit - link.length();
        }
        return TextUtils.truncate(text, Math.max(budget, 1)) + link + tagPart;
    }

    private static String headingOf(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        String first = body.strip().split("\n", 2)[0];
        if (!first.startsWith("#")) {
            return null;
        }
        String heading = first.replaceAll("^#+", "").strip();
        return heading.isEmpty() ? null : heading;
    }

    private static String title(Activity activity) {
        ActivityPayload payload = activity.payload();
        String summary = MARKUP.matcher(TextUtils.collapseWhitespace(payload.summary())).replaceAll("");
        if (payload.actor() == null || payload.actor().isBlank()) {
            return summary;
        }
        return activity.source() == Source.CHAT ? payload.actor() + ": " + summary : payload.actor() + " " + summary;
    }

    enum Section {
        RELEASES("🚀 Releases"),
        STATISTICS("📊 Statistics"),
        COMMUNITY("💬 Community Updates"),
        PULL_REQUESTS("🔀 Pull Requests"),
        ISSUES("🐛 Issues"),
        DEVELOPMENT("📝 Development Activity");

        private final String heading;

        Section(String heading) {
            this.heading = heading;
        }

        static Section of(Activity activity) {
            if (activity.source() == Source.CHAT) {
                return COMMUNITY;
            }
            if (activity.source() == Source.STATISTICS) {
                return STATISTICS;
            }
            String kind = activity.payload().kind() == null ? "" : activity.payload().kind();
            return switch (kind) {
                case "release" -> RELEASES;
                case "pull_request" -> PULL_REQUESTS;
                case "issue" -> ISSUES;
                default -> DEVELOPMENT;
            };
        }

        String emoji(Activity activity) {
            return switch (this) {
                case RELEASES -> "🚀";
                case STATISTICS -> "📊";
                case COMMUNITY -> "💬";
                case PULL_REQUESTS -> "🔀";
                case ISSUES -> "🐛";
                case DEVELOPMENT -> "push".equals(activity.payload().kind()) ? "📝" : "📢";
            };
        }

        List<String> hashtags(Activity activity) {
            return switch (this) {
                case RELEASES -> List.of("#release", "#update");
                case STATISTICS -> List.of("#stats", "#data");
                case COMMUNITY -> List.of("#community");
                case PULL_REQUESTS -> List.of("#development", "#pullrequest");
                case ISSUES -> List.of("#development", "#issue");
                case DEVELOPMENT -> "push".equals(activity.payload().kind())
                        ? List.of("#development", "#commit")
                        : List.of("#development");
            };
        }
    }
}
